package com.a2dd.core.document;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Collection;
import java.util.Map;

/**
 * Single-line rendering of loaded values for directive payloads and audit lines.
 * Scalars print as-is, maps and lists as compact JSON.
 */
public final class InlineValues {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private InlineValues() {}

    public static String format(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof Map<?, ?> || value instanceof Collection<?>) {
            try {
                return MAPPER.writeValueAsString(value);
            } catch (JsonProcessingException e) {
                throw new IllegalStateException("Can not render value " + value, e);
            }
        }
        return String.valueOf(value);
    }
}
