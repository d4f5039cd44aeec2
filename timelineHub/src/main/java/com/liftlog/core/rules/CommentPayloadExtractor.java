package com.liftlog.core.rules;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.liftlog.core.model.JsonSupport;
import com.liftlog.core.model.Row;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extrae el payload tipo JSON que los técnicos pegan en los comentarios de las celdas.
 * Best-effort: nunca lanza, en el peor caso devuelve un mapa vacío.
 */
public class CommentPayloadExtractor {
    private static final Logger log = LoggerFactory.getLogger(CommentPayloadExtractor.class);

    // greedy: desde la primera '{' hasta la última '}', cruzando líneas
    private static final Pattern OBJECT = Pattern.compile("\\{.*\\}", Pattern.DOTALL);
    private static final Pattern PY_TRUE = Pattern.compile("\\bTrue\\b");
    private static final Pattern PY_FALSE = Pattern.compile("\\bFalse\\b");
    private static final Pattern PY_NONE = Pattern.compile("\\bNone\\b");

    public Map<String, Object> extract(Row row) {
        return parse(row.joinedComments());
    }

    public Map<String, Object> parse(String comments) {
        if (comments == null || comments.isEmpty()) return Map.of();
        Matcher m = OBJECT.matcher(comments);
        if (!m.find()) return Map.of();

        String raw = m.group();
        Optional<Map<String, Object>> strict = tryRead(raw);
        if (strict.isPresent()) return strict.get();
        return tryRead(relax(raw)).orElse(Map.of());
    }

    /** Comillas simples → dobles y literales estilo Python → JSON. */
    static String relax(String raw) {
        String s = raw.replace('\'', '"');
        s = PY_TRUE.matcher(s).replaceAll("true");
        s = PY_FALSE.matcher(s).replaceAll("false");
        return PY_NONE.matcher(s).replaceAll("null");
    }

    private static Optional<Map<String, Object>> tryRead(String json) {
        try {
            return Optional.ofNullable(JsonSupport.readObject(json));
        } catch (JsonProcessingException e) {
            log.debug("comment payload is not valid JSON: {}", e.getOriginalMessage());
            return Optional.empty();
        }
    }
}
