package com.liftlog.core.model;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.PropertyAccessor;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.*;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.util.LinkedHashMap;

public final class JsonSupport {
    private JsonSupport(){}
    public static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .registerModule(new Jdk8Module())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .setVisibility(PropertyAccessor.FIELD, JsonAutoDetect.Visibility.ANY);

    private static final TypeReference<LinkedHashMap<String,Object>> OBJECT_MAP = new TypeReference<>() {};

    public static String toJson(Object o){
        try { return MAPPER.writeValueAsString(o); }
        catch (JsonProcessingException e){ throw new IllegalStateException(e); }
    }

    /** Parseo estricto de un objeto JSON; falla si el texto no es un objeto o si sobra algo después. */
    public static LinkedHashMap<String,Object> readObject(String json) throws JsonProcessingException {
        return MAPPER.readerFor(OBJECT_MAP)
                .with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
                .readValue(json);
    }
}
