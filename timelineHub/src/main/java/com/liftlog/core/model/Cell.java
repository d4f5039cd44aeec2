package com.liftlog.core.model;

/**
 * Una celda de la hoja: valor escalar opcional, estilo y comentario libre.
 * {@code value == null} significa "sin valor" y es distinto de una celda ausente.
 */
public record Cell(
        Object value,        // String, Number, LocalDateTime, Boolean o null
        CellStyle style,
        String comment       // puede traer un payload tipo JSON embebido
) {
    public Cell {
        if (style == null) style = CellStyle.EMPTY;
    }

    public static Cell of(Object value) {
        return new Cell(value, CellStyle.EMPTY, null);
    }

    public static Cell empty() {
        return new Cell(null, CellStyle.EMPTY, null);
    }

    public Cell withValue(Object newValue) {
        return new Cell(newValue, style, comment);
    }

    public boolean hasValue() {
        return value != null;
    }

    /** Valor como texto; "" si no hay valor. */
    public String text() {
        return value == null ? "" : String.valueOf(value);
    }
}
