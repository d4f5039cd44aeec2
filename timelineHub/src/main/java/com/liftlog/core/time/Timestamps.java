package com.liftlog.core.time;

import java.time.*;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Date;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parseo tolerante de marcas de tiempo de la hoja. Nada aquí lanza excepciones por datos
 * mal formados: todo devuelve {@link Optional#empty()}.
 */
public final class Timestamps {
    private Timestamps() {}

    private static final List<DateTimeFormatter> DATE_TIME_FORMATS = List.of(
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss"),
            DateTimeFormatter.ofPattern("yyyy/MM/dd HH:mm:ss"));
    private static final DateTimeFormatter TIME_ONLY = DateTimeFormatter.ofPattern("HH:mm:ss");
    private static final DateTimeFormatter DISPLAY = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private static final Pattern EMBEDDED = Pattern.compile("(\\d{4}-\\d{2}-\\d{2} \\d{2}:\\d{2}:\\d{2})");

    /**
     * Fecha y hora completas. Acepta {@link LocalDateTime}, {@link Date} y texto en
     * {@code yyyy-MM-dd HH:mm:ss} o {@code yyyy/MM/dd HH:mm:ss}.
     */
    public static Optional<LocalDateTime> parseDateTime(Object value) {
        if (value instanceof LocalDateTime ldt) return Optional.of(ldt);
        if (value instanceof Date d) return Optional.of(LocalDateTime.ofInstant(d.toInstant(), ZoneId.systemDefault()));
        if (!(value instanceof CharSequence cs)) return Optional.empty();
        String text = cs.toString().trim();
        for (DateTimeFormatter f : DATE_TIME_FORMATS) {
            Optional<LocalDateTime> parsed = tryParse(text, f);
            if (parsed.isPresent()) return parsed;
        }
        return Optional.empty();
    }

    private static Optional<LocalDateTime> tryParse(String text, DateTimeFormatter format) {
        try {
            return Optional.of(LocalDateTime.parse(text, format));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    /**
     * Como {@link #parseDateTime(Object)} pero además acepta {@code HH:mm:ss} suelto, anclado
     * al 1970-01-01. Sirve para comparar distancias relativas dentro de una misma hoja.
     */
    public static Optional<LocalDateTime> parseLenient(Object value) {
        Optional<LocalDateTime> full = parseDateTime(value);
        if (full.isPresent()) return full;
        if (value instanceof LocalTime lt) return Optional.of(LocalDate.EPOCH.atTime(lt));
        if (!(value instanceof CharSequence cs)) return Optional.empty();
        try {
            return Optional.of(LocalDate.EPOCH.atTime(LocalTime.parse(cs.toString().trim(), TIME_ONLY)));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    /** Primera marca {@code yyyy-MM-dd HH:mm:ss} embebida en un texto libre. */
    public static Optional<LocalDateTime> findEmbedded(String text) {
        if (text == null) return Optional.empty();
        Matcher m = EMBEDDED.matcher(text);
        while (m.find()) {
            Optional<LocalDateTime> parsed = parseDateTime(m.group(1));
            if (parsed.isPresent()) return parsed;
        }
        return Optional.empty();
    }

    /** Texto para mostrar un valor de la columna de tiempo. */
    public static String display(Object value) {
        if (value == null) return "";
        if (value instanceof LocalDateTime ldt) return DISPLAY.format(ldt);
        return String.valueOf(value);
    }
}
