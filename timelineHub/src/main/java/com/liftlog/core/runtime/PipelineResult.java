package com.liftlog.core.runtime;

import com.liftlog.core.model.JsonSupport;
import com.liftlog.core.model.Row;
import com.liftlog.core.model.SheetHeaders;
import com.liftlog.core.render.DebugReport;

import java.util.List;

public record PipelineResult(
        String sheetName,
        SheetHeaders headers,
        List<Row> rows,        // filas anotadas (incluye las no críticas)
        String text,           // texto para el resumidor externo
        DebugReport debug
) {
    public PipelineResult {
        rows = List.copyOf(rows);
    }

    /** JSON de las filas procesadas, con celdas, estilos, etiquetas y atributos. */
    public String rowsJson() {
        return JsonSupport.toJson(rows);
    }

    public String debugJson() {
        return JsonSupport.toJson(debug);
    }
}
