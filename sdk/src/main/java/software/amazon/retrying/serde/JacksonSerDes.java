// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.retrying.serde;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import software.amazon.retrying.exception.SerDesException;

/**
 * Jackson-based implementation of {@link SerDes}.
 *
 * <p>Features:
 *
 * <ul>
 *   <li>Java time types support; durations are written as ISO-8601 strings such as {@code "PT0.5S"} and read from
 *       either ISO-8601 strings or numbers of seconds
 *   <li>Null properties omitted when writing
 *   <li>Unknown properties rejected when reading, so a misspelled setting is reported instead of ignored
 * </ul>
 */
public class JacksonSerDes implements SerDes {
    private final ObjectMapper mapper;

    public JacksonSerDes() {
        this.mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS)
                .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    @Override
    public String serialize(Object value) {
        if (value == null) return null;
        try {
            return mapper.writeValueAsString(value);
        } catch (Exception e) {
            throw new SerDesException(
                    "Serialization failed for type: " + value.getClass().getName(), e);
        }
    }

    @Override
    public <T> T deserialize(String data, Class<T> type) {
        if (data == null) return null;
        try {
            return mapper.readValue(data, type);
        } catch (Exception e) {
            throw new SerDesException("Deserialization failed for type: " + type.getName(), e);
        }
    }
}
