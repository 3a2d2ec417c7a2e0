package com.example.jsonecho;

import java.util.Map;
import java.util.Objects;

public record RouteDefinition(
        HttpMethod method,
        String description,
        Map<String, String> headers,
        String idField,
        String resultsField,
        RouteResponse response
) {
    public static final String DEFAULT_ID_FIELD = "id";

    public RouteDefinition {
        method = method == null ? HttpMethod.GET : method;
        headers = headers == null ? Map.of() : Map.copyOf(headers);
        idField = idField == null ? DEFAULT_ID_FIELD : idField;
        Objects.requireNonNull(response, "response");
    }
}
