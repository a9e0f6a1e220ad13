// Copyright The Wrapkit Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package dev.wrapkit.serde;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import dev.wrapkit.exception.SerDesException;

/**
 * Jackson-based implementation of {@link SerDes}, used for JSON request and response bodies.
 *
 * <p>Features:
 *
 * <ul>
 *   <li>Java 8 time types support (Duration, Instant, LocalDateTime, etc.)
 *   <li>Dates serialized as ISO-8601 strings (not timestamps)
 *   <li>Unknown properties ignored during deserialization
 * </ul>
 */
public class JacksonSerDes implements SerDes {
    private final ObjectMapper mapper;

    public JacksonSerDes() {
        this(new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES));
    }

    public JacksonSerDes(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public String serialize(Object value) {
        if (value == null) return null;
        try {
            return mapper.writeValueAsString(value);
        } catch (Exception e) {
            throw new SerDesException("Serialization failed for type: " + value.getClass().getName(), e);
        }
    }

    @Override
    public <T> T deserialize(String data, Class<T> type) {
        if (data == null || data.isEmpty()) return null;
        try {
            return mapper.readValue(data, type);
        } catch (Exception e) {
            throw new SerDesException("Deserialization failed for type: " + type.getName(), e);
        }
    }
}
