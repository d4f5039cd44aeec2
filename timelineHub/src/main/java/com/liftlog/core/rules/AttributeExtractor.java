package com.liftlog.core.rules;

import com.liftlog.core.model.Row;
import com.liftlog.core.model.SheetHeaders;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Atributos globales normalizados de una fila. Para cada atributo se prueban sus reglas en
 * orden y gana la primera que produce un valor no nulo.
 */
public class AttributeExtractor {
    private static final Logger log = LoggerFactory.getLogger(AttributeExtractor.class);

    private final RuleConfig cfg;

    public AttributeExtractor(RuleConfig cfg) {
        this.cfg = Objects.requireNonNull(cfg, "cfg");
    }

    public Map<String, Object> extract(Row row, Map<String, Object> payload, SheetHeaders headers) {
        Map<String, Object> out = new LinkedHashMap<>();
        for (var en : cfg.attributes.entrySet()) {
            for (AttributeRule rule : en.getValue()) {
                Object v = resolve(rule, row, payload);
                if (v != null) {
                    out.put(en.getKey(), v);
                    break;
                }
            }
        }
        UploadDelay.of(row, headers)
                .map(Duration::toMinutes)
                .filter(minutes -> minutes > 0)
                .ifPresent(minutes -> out.put(cfg.delay.attribute, minutes));
        return out;
    }

    Object resolve(AttributeRule rule, Row row, Map<String, Object> payload) {
        Object raw = lookup(rule.keys(), row, payload);
        if (raw == null) return null;
        Object mapped = remap(rule.valueMap(), raw);
        try {
            return rule.transform().apply(mapped);
        } catch (RuntimeException e) {
            log.debug("transform {} failed for value {}: {}", rule.transform(), mapped, e.getMessage());
            return mapped;
        }
    }

    /** Primero el JSON del comentario, después columnas con el mismo nombre. */
    private static Object lookup(List<String> keys, Row row, Map<String, Object> payload) {
        for (String k : keys) {
            Object v = payload.get(k);
            if (v != null) return v;
        }
        for (String k : keys) {
            Object v = row.value(k);
            if (v != null) return v;
        }
        return null;
    }

    private static Object remap(Map<String, Object> valueMap, Object raw) {
        if (valueMap.isEmpty()) return raw;
        if (valueMap.containsKey(raw)) return valueMap.get(raw);
        String asText = String.valueOf(raw);
        if (valueMap.containsKey(asText)) return valueMap.get(asText);
        return raw;
    }
}
