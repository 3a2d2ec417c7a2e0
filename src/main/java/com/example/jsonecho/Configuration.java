package com.example.jsonecho;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record Configuration(
        int port,
        String hostname,
        String staticFolder,
        String staticRoute,
        Map<String, RouteDefinition> routes
) {
    public static final int DEFAULT_PORT = 3001;
    public static final String DEFAULT_HOSTNAME = "localhost";
    public static final String DEFAULT_STATIC_ROUTE = "/static";

    public Configuration {
        hostname = hostname == null ? DEFAULT_HOSTNAME : hostname;
        staticRoute = staticRoute == null ? DEFAULT_STATIC_ROUTE : staticRoute;
        routes = routes == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(routes));
    }

    /** The document written by {@code init}: default port and host, no routes. */
    public static Configuration defaults() {
        return new Configuration(DEFAULT_PORT, DEFAULT_HOSTNAME, null, DEFAULT_STATIC_ROUTE, Map.of());
    }
}
