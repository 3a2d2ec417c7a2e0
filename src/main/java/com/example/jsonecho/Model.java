package com.example.jsonecho;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

/** A route as the store serves it. {@code data} is read-only. */
public record Model(
        String identifier,
        HttpMethod method,
        PathPattern pathPattern,
        String description,
        Map<String, String> headers,
        String idField,
        String resultsField,
        int status,
        JsonNode data
) {
    static Model of(String key, RouteKey routeKey, RouteDefinition route) {
        if (!(route.response() instanceof RouteResponse.Inline inline)) {
            throw ConfigException.invalidRoute(key, "response file '"
                    + ((RouteResponse.FileReference) route.response()).path() + "' was never resolved");
        }
        return new Model(
                routeKey.identifier(),
                routeKey.method(),
                routeKey.pattern(),
                route.description(),
                route.headers(),
                route.idField(),
                route.resultsField(),
                inline.status(),
                inline.body().deepCopy());
    }

    /**
     * The value records are searched in: {@code data} itself, or the array stored under
     * {@code resultsField}.
     *
     * @throws MissingResultsFieldException if {@code resultsField} is set but does not name an array
     */
    public JsonNode collection() {
        if (resultsField == null) {
            return data;
        }
        JsonNode nested = data.isObject() ? data.get(resultsField) : null;
        if (nested == null || !nested.isArray()) {
            throw new MissingResultsFieldException(identifier, resultsField);
        }
        return nested;
    }
}
