package com.drawpool.queue;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Objects;

/**
 * Jackson encoding of queue entries. Unknown properties are ignored so producers may add fields.
 */
public final class JsonCodec<T> {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final Class<T> type;

    public JsonCodec(Class<T> type) {
        this.type = Objects.requireNonNull(type, "type");
    }

    public String encode(T item) {
        try {
            return MAPPER.writeValueAsString(item);
        } catch (JsonProcessingException e) {
            throw new QueueException("Cannot encode " + type.getSimpleName() + ": " + e.getOriginalMessage(), e);
        }
    }

    public T decode(String json) {
        try {
            T value = MAPPER.readValue(json, type);
            if (value == null) {
                throw new QueueException("Empty " + type.getSimpleName() + " entry");
            }
            return value;
        } catch (JsonProcessingException e) {
            throw new QueueException("Cannot decode " + type.getSimpleName() + " from " + json + ": " + e.getOriginalMessage(), e);
        }
    }
}
