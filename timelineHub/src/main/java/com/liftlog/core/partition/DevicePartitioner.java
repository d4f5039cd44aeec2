package com.liftlog.core.partition;

import com.liftlog.core.model.Row;
import com.liftlog.core.model.SheetHeaders;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Agrupa las filas por equipo (contrato) para que ninguna etapa mezcle filas de máquinas
 * distintas aunque estén intercaladas en la hoja.
 */
public class DevicePartitioner {
    public static final String UNKNOWN = "UNKNOWN";

    /**
     * @return clave de equipo → índices (posiciones en {@code rows}) en orden de entrada.
     *         Sin columna de equipo todo cae en un único grupo {@value #UNKNOWN}.
     */
    public Map<String, List<Integer>> partition(List<Row> rows, SheetHeaders headers) {
        Optional<String> deviceCol = headers.deviceColumn();
        Map<String, List<Integer>> groups = new LinkedHashMap<>();
        for (int i = 0; i < rows.size(); i++) {
            String key = deviceCol.map(rows.get(i)::value).map(String::valueOf).orElse(UNKNOWN);
            groups.computeIfAbsent(key, k -> new ArrayList<>()).add(i);
        }
        return groups;
    }
}
