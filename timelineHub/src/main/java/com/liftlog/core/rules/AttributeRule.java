package com.liftlog.core.rules;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Una regla de extracción para un atributo global: claves candidatas (en el JSON del
 * comentario primero, luego como nombre de columna), tabla de remapeo opcional y
 * transformación opcional.
 */
public record AttributeRule(
        List<String> keys,
        Map<String, Object> valueMap,
        ValueTransform transform
) {
    public AttributeRule {
        keys = keys == null ? List.of() : List.copyOf(keys);
        valueMap = valueMap == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(valueMap));
        if (transform == null) transform = ValueTransform.Identity.INSTANCE;
    }

    public static AttributeRule of(String... keys) {
        return new AttributeRule(List.of(keys), null, null);
    }
}
