package com.qualitysentinel.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.io.InputStream;

/**
 * JSON encoding of request bodies and responses.
 *
 * <p>
 * Instants are written as ISO-8601 strings and {@code Optional} values as
 * their content or {@code null}. Unknown request properties are ignored.
 * </p>
 */
public final class JsonCodec {

    private final ObjectMapper mapper;

    public JsonCodec() {
        mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.registerModule(new Jdk8Module());
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * @throws IllegalStateException if the value cannot be serialized
     */
    public byte[] write(Object value) {
        try {
            return mapper.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException(
                    "Failed to serialize " + value.getClass().getSimpleName() + ": " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Parse a request body.
     *
     * @throws IllegalArgumentException if the body is empty or malformed
     */
    public <T> T read(InputStream body, Class<T> type) {
        T value;
        try {
            value = mapper.readValue(body, type);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed JSON body: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new IllegalArgumentException("Unreadable request body: " + e.getMessage(), e);
        }
        if (value == null) {
            throw new IllegalArgumentException("Request body must not be empty");
        }
        return value;
    }

    ObjectMapper mapper() {
        return mapper;
    }
}
