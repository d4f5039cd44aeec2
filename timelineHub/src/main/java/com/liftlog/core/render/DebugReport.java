package com.liftlog.core.render;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Vista de auditoría del motor de reglas: qué filas se descartaron del texto, cuáles
 * llegaron tarde y qué atributos se extrajeron.
 */
public record DebugReport(
        @JsonProperty("ignored_rows") List<IgnoredRow> ignoredRows,
        @JsonProperty("delayed_rows") List<DelayedRow> delayedRows,
        @JsonProperty("attribute_rows") List<AttributeRow> attributeRows
) {
    public static final DebugReport EMPTY = new DebugReport(List.of(), List.of(), List.of());

    public DebugReport {
        ignoredRows = List.copyOf(ignoredRows);
        delayedRows = List.copyOf(delayedRows);
        attributeRows = List.copyOf(attributeRows);
    }

    public record IgnoredRow(int id, String time, String content, String reason) {}

    public record DelayedRow(int id, String time, String content,
                             @JsonProperty("delay_minutes") long delayMinutes) {}

    public record AttributeRow(int id, String time, String content, List<String> attributes) {
        public AttributeRow {
            attributes = List.copyOf(attributes);
        }
    }
}
