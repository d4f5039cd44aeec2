package com.liftlog.core.model;

import java.util.*;

/**
 * Una línea del log. Inmutable: las etapas que cambian algo construyen una fila nueva
 * con {@link #toBuilder()} o {@link #withCellValue(String, Object)}.
 */
public final class Row {
    // --- obligatorios ---
    private final int id;                          // posición original, 1-based, sin cabecera
    private final Map<String, Cell> cells;         // orden = orden de cabeceras

    // --- derivados (los asigna el motor de reglas) ---
    private final List<String> tags;
    private final Map<String, Object> globalAttributes;

    private Row(int id, Map<String, Cell> cells, List<String> tags, Map<String, Object> globalAttributes) {
        this.id = id;
        this.cells = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(cells, "cells")));
        this.tags = (tags == null) ? List.of() : List.copyOf(tags);
        this.globalAttributes = (globalAttributes == null)
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(globalAttributes));
    }

    // --- getters ---
    public int id() { return id; }
    public Map<String, Cell> cells() { return cells; }
    public List<String> tags() { return tags; }
    public Map<String, Object> globalAttributes() { return globalAttributes; }

    public Optional<Cell> cell(String column) {
        if (column == null) return Optional.empty();
        return Optional.ofNullable(cells.get(column));
    }

    /** Valor crudo de la columna, o null si la columna falta o no tiene valor. */
    public Object value(String column) {
        return cell(column).map(Cell::value).orElse(null);
    }

    /** Valor de la columna como texto; "" si falta. */
    public String text(String column) {
        return cell(column).map(Cell::text).orElse("");
    }

    public boolean hasAnyValue() {
        for (Cell c : cells.values()) if (c.hasValue()) return true;
        return false;
    }

    /** Comentarios de todas las celdas, en orden de columnas, separados por salto de línea. */
    public String joinedComments() {
        StringJoiner sj = new StringJoiner("\n");
        for (Cell c : cells.values()) {
            if (c.comment() != null && !c.comment().isEmpty()) sj.add(c.comment());
        }
        return sj.toString();
    }

    /**
     * Copia de la fila con el valor de una celda reemplazado. Solo se clona la celda tocada;
     * el resto de las celdas se comparten.
     */
    public Row withCellValue(String column, Object value) {
        Map<String, Cell> next = new LinkedHashMap<>(cells);
        Cell current = cells.get(column);
        next.put(column, current == null ? Cell.of(value) : current.withValue(value));
        return new Row(id, next, tags, globalAttributes);
    }

    public Builder toBuilder() {
        return new Builder().id(id).cells(cells).tags(tags).globalAttributes(globalAttributes);
    }

    @Override public String toString() {
        return "Row{id=" + id + ", cells=" + cells + ", tags=" + tags + "}";
    }

    // --- builder ---
    public static Builder builder() { return new Builder(); }
    public static final class Builder {
        private int id;
        private Map<String, Cell> cells = new LinkedHashMap<>();
        private List<String> tags = new ArrayList<>();
        private Map<String, Object> globalAttributes = new LinkedHashMap<>();

        public Builder id(int id){ this.id = id; return this; }
        public Builder cell(String column, Cell cell){ this.cells.put(column, cell); return this; }
        public Builder value(String column, Object value){ this.cells.put(column, Cell.of(value)); return this; }
        public Builder cells(Map<String, Cell> c){ if (c != null) this.cells.putAll(c); return this; }
        public Builder tag(String t){ this.tags.add(t); return this; }
        public Builder tags(List<String> t){ this.tags = new ArrayList<>(t == null ? List.of() : t); return this; }
        public Builder attr(String k, Object v){ this.globalAttributes.put(k, v); return this; }
        public Builder globalAttributes(Map<String, Object> a){
            this.globalAttributes = new LinkedHashMap<>(a == null ? Map.of() : a);
            return this;
        }

        public Row build() {
            return new Row(id, cells, tags, globalAttributes);
        }
    }
}
