package com.liftlog.core.model;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Cabeceras de la hoja, en orden de columnas. Se permiten nombres repetidos; las búsquedas
 * "contiene" devuelven siempre la primera columna que coincide.
 */
public record SheetHeaders(List<String> names) {

    public SheetHeaders {
        names = List.copyOf(names);
    }

    public static SheetHeaders of(String... names) {
        return new SheetHeaders(List.of(names));
    }

    /** Primera cabecera que contiene alguno de los fragmentos (ASCII sin distinguir mayúsculas). */
    public Optional<String> firstContaining(String... needles) {
        for (String name : names) {
            String lower = name.toLowerCase(Locale.ROOT);
            for (String needle : needles) {
                if (lower.contains(needle.toLowerCase(Locale.ROOT))) return Optional.of(name);
            }
        }
        return Optional.empty();
    }

    public Optional<String> contentColumn() { return firstContaining("内容", "content"); }

    public Optional<String> timeColumn() { return firstContaining("时间", "time"); }

    public Optional<String> typeColumn() { return firstContaining("类型", "type"); }

    /** Por convención la segunda columna identifica al equipo / contrato. */
    public Optional<String> deviceColumn() {
        return names.size() < 2 ? Optional.empty() : Optional.of(names.get(1));
    }

    public int size() { return names.size(); }
}
