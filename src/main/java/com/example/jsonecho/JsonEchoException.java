package com.example.jsonecho;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

public class JsonEchoException extends RuntimeException {
    private final JsonEchoErrorCode code;
    private final Map<String, Object> context;

    public JsonEchoException(JsonEchoErrorCode code, String message, Map<String, ?> context) {
        super(message);
        this.code = Objects.requireNonNull(code, "code");
        this.context = copy(context);
    }

    public JsonEchoException(JsonEchoErrorCode code, String message, Map<String, ?> context, Throwable cause) {
        super(message, cause);
        this.code = Objects.requireNonNull(code, "code");
        this.context = copy(context);
    }

    public JsonEchoErrorCode getCode() {
        return code;
    }

    public Map<String, Object> getContext() {
        return context;
    }

    private static Map<String, Object> copy(Map<String, ?> input) {
        if (input == null || input.isEmpty()) {
            return Collections.emptyMap();
        }
        Map<String, Object> values = new LinkedHashMap<>();
        input.forEach((key, value) -> {
            if (value != null) {
                values.put(key, value);
            }
        });
        return Collections.unmodifiableMap(values);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName()
                + "{code=" + code
                + ", message=" + getMessage()
                + (context.isEmpty() ? "" : ", context=" + context)
                + (getCause() == null ? "" : ", cause=" + getCause().getClass().getSimpleName())
                + '}';
    }
}
