package com.liftlog.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Pistas visuales reconocidas de una celda. Hoy solo {@code backgroundColor} y {@code color},
 * ambas como {@code #RRGGBB}. Nunca es null: una celda sin pistas lleva {@link #EMPTY}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CellStyle(
        String backgroundColor,   // ej. "#9966CC"
        String color              // color de fuente
) {
    public static final CellStyle EMPTY = new CellStyle(null, null);

    public static CellStyle of(String backgroundColor, String color) {
        if (backgroundColor == null && color == null) return EMPTY;
        return new CellStyle(backgroundColor, color);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return backgroundColor == null && color == null;
    }
}
