package com.example.jsonecho;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

public class ConfigException extends JsonEchoException {
    private final String routeKey;

    private ConfigException(JsonEchoErrorCode code, String routeKey, String message,
                            Map<String, ?> context, Throwable cause) {
        super(code, message, context, cause);
        this.routeKey = routeKey;
    }

    public String getRouteKey() {
        return routeKey;
    }

    public static ConfigException malformed(Path path, String reason, Throwable cause) {
        return new ConfigException(JsonEchoErrorCode.MALFORMED, null,
                "Malformed configuration '" + path + "': " + reason,
                Map.of("path", path), cause);
    }

    public static ConfigException invalidRoute(String key, String reason) {
        return new ConfigException(JsonEchoErrorCode.INVALID_ROUTE, key,
                "Invalid route '" + key + "': " + reason,
                Map.of("key", key, "reason", reason), null);
    }

    public static ConfigException duplicateRoute(String key) {
        return new ConfigException(JsonEchoErrorCode.DUPLICATE_ROUTE, key,
                "Duplicate route '" + key + "'",
                Map.of("key", key), null);
    }

    public static ConfigException externalResponse(String key, String path, JsonEchoException cause) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("key", key);
        context.put("path", path);
        context.put("cause", cause.getCode());
        return new ConfigException(JsonEchoErrorCode.EXTERNAL_RESPONSE_ERROR, key,
                "Route '" + key + "' references response file '" + path + "' which could not be loaded: "
                        + cause.getMessage(),
                context, cause);
    }
}
