package com.liftlog.core.model;

import java.util.List;

public record TimelineSheet(
        String sheetName,
        SheetHeaders headers,
        List<Row> rows          // solo filas con al menos una celda con valor
) {
    public TimelineSheet {
        rows = List.copyOf(rows);
    }
}
