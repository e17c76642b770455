package io.recur4j.internal.executor;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.util.Objects;

/**
 * Renders runner results for log lines. Never throws: anything Jackson cannot serialize falls back to
 * {@code toString()}.
 */
public class ResultFormatter {

    private final ObjectMapper objectMapper;

    public ResultFormatter(ObjectMapper objectMapper) {
        Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.objectMapper = objectMapper.copy()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
                .disable(SerializationFeature.INDENT_OUTPUT);
    }

    public ResultFormatter() {
        this(new ObjectMapper());
    }

    public String format(Object result) {
        if (result == null) {
            return "null";
        }
        if (result instanceof CharSequence || result instanceof Number || result instanceof Boolean) {
            return result.toString();
        }
        try {
            return objectMapper.writeValueAsString(result);
        } catch (Exception e) {
            return fallback(result);
        }
    }

    private static String fallback(Object result) {
        try {
            return String.valueOf(result);
        } catch (RuntimeException e) {
            return result.getClass().getName();
        }
    }
}
