package com.instruments.core.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * Renders metric snapshots as JSON using the snake_case field names declared
 * on the API records ({@code ops_count}, {@code rate_1m}, ...).
 */
public final class MetricsJson {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);

    private MetricsJson() {
        throw new AssertionError("No instances");
    }

    /**
     * @param snapshot a snapshot record or list of records
     * @return compact JSON
     * @throws IllegalArgumentException if the value cannot be serialized
     */
    public static String toJson(Object snapshot) {
        try {
            return MAPPER.writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Could not serialize " + snapshot.getClass().getSimpleName(), e);
        }
    }

    public static String toPrettyJson(Object snapshot) {
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Could not serialize " + snapshot.getClass().getSimpleName(), e);
        }
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }
}
