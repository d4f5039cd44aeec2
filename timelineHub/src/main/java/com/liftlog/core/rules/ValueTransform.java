package com.liftlog.core.rules;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.Map;

/**
 * Transformación declarativa que una {@link AttributeRule} aplica al valor encontrado.
 * Es una variante cerrada para que las reglas sigan siendo serializables y configurables
 * desde YAML ({@code kind: identity | offset_int | parse_enum}).
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = ValueTransform.Identity.class, name = "identity"),
        @JsonSubTypes.Type(value = ValueTransform.OffsetInt.class, name = "offset_int"),
        @JsonSubTypes.Type(value = ValueTransform.ParseEnum.class, name = "parse_enum")
})
public sealed interface ValueTransform
        permits ValueTransform.Identity, ValueTransform.OffsetInt, ValueTransform.ParseEnum {

    /** @throws IllegalArgumentException si el valor no admite la transformación */
    Object apply(Object value);

    final class Identity implements ValueTransform {
        public static final Identity INSTANCE = new Identity();

        @Override public Object apply(Object value) { return value; }

        @Override public boolean equals(Object o) { return o instanceof Identity; }
        @Override public int hashCode() { return Identity.class.hashCode(); }
        @Override public String toString() { return "Identity"; }
    }

    /** Entero más un desplazamiento fijo (ej. piso 0-based del controlador a piso visible). */
    record OffsetInt(int offset) implements ValueTransform {
        @Override public Object apply(Object value) {
            if (value instanceof Number n) {
                if (n.doubleValue() != Math.rint(n.doubleValue())) {
                    throw new IllegalArgumentException("not an integer: " + value);
                }
                return n.intValue() + offset;
            }
            if (value instanceof CharSequence cs) {
                return Integer.parseInt(cs.toString().trim()) + offset;
            }
            throw new IllegalArgumentException("not an integer: " + value);
        }
    }

    /** Código textual → etiqueta; códigos desconocidos fallan. */
    record ParseEnum(Map<String, String> values) implements ValueTransform {
        public ParseEnum {
            values = values == null ? Map.of() : Map.copyOf(values);
        }

        @Override public Object apply(Object value) {
            String key = String.valueOf(value).trim();
            String mapped = values.get(key);
            if (mapped == null) throw new IllegalArgumentException("unknown enum value: " + key);
            return mapped;
        }
    }
}
