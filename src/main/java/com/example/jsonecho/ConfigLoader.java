package com.example.jsonecho;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/** Reads, validates and writes configuration documents. Loading is all or nothing. */
public final class ConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private final PathResolver resolver;
    private final ObjectMapper jsonMapper;
    private final ObjectMapper yamlMapper;

    public ConfigLoader(PathResolver resolver) {
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.jsonMapper = new ObjectMapper().enable(JsonParser.Feature.STRICT_DUPLICATE_DETECTION);
        this.yamlMapper = new ObjectMapper(new YAMLFactory()).enable(JsonParser.Feature.STRICT_DUPLICATE_DETECTION);
    }

    public PathResolver resolver() {
        return resolver;
    }

    public Configuration load(String path) {
        Path location = resolver.resolve(path);
        log.info("Loading configuration from {}", location);
        JsonNode root = parse(path, resolver.loadFile(path), location);
        if (!root.isObject()) {
            throw ConfigException.malformed(location, "top-level value must be an object", null);
        }

        int port = readPort(root.get("port"), location);
        String hostname = readHostname(root.get("hostname"), location);
        String staticFolder = readOptionalText(root.get("static_folder"), "static_folder", location);
        String staticRoute = readOptionalText(root.get("static_route"), "static_route", location);
        Map<String, RouteDefinition> routes = readRoutes(root.get("routes"), location);

        Configuration configuration = new Configuration(port, hostname, staticFolder, staticRoute, routes);
        log.info("Loaded {} routes from {}", routes.size(), location);
        return configuration;
    }

    public void save(String path, Configuration configuration) {
        Objects.requireNonNull(configuration, "configuration");
        ObjectMapper mapper = mapperFor(path);
        byte[] content;
        try {
            content = mapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(toTree(mapper, configuration));
        } catch (JsonProcessingException ex) {
            throw ConfigException.malformed(resolver.resolve(path), "cannot serialize configuration", ex);
        }
        resolver.saveFile(path, content);
        log.info("Saved configuration with {} routes to {}", configuration.routes().size(), resolver.resolve(path));
    }

    private JsonNode parse(String path, byte[] content, Path location) {
        try {
            JsonNode node = mapperFor(path).readTree(content);
            if (node == null || node.isMissingNode()) {
                throw ConfigException.malformed(location, "document is empty", null);
            }
            return node;
        } catch (JsonProcessingException ex) {
            throw ConfigException.malformed(location, ex.getOriginalMessage(), ex);
        } catch (IOException ex) {
            throw ConfigException.malformed(location, ex.getMessage(), ex);
        }
    }

    private ObjectMapper mapperFor(String path) {
        String lower = path.toLowerCase(Locale.ROOT);
        return lower.endsWith(".yaml") || lower.endsWith(".yml") ? yamlMapper : jsonMapper;
    }

    private static int readPort(JsonNode node, Path location) {
        if (isAbsent(node)) {
            return Configuration.DEFAULT_PORT;
        }
        if (!node.isIntegralNumber() || !node.canConvertToInt() || node.intValue() < 1 || node.intValue() > 65535) {
            throw ConfigException.malformed(location, "port must be an integer between 1 and 65535, got " + node, null);
        }
        return node.intValue();
    }

    private static String readHostname(JsonNode node, Path location) {
        if (isAbsent(node)) {
            return Configuration.DEFAULT_HOSTNAME;
        }
        if (!node.isTextual() || node.textValue().isBlank()) {
            throw ConfigException.malformed(location, "hostname must be a non-empty string", null);
        }
        return node.textValue();
    }

    private static String readOptionalText(JsonNode node, String field, Path location) {
        if (isAbsent(node)) {
            return null;
        }
        if (!node.isTextual()) {
            throw ConfigException.malformed(location, field + " must be a string", null);
        }
        return node.textValue();
    }

    private Map<String, RouteDefinition> readRoutes(JsonNode node, Path location) {
        Map<String, RouteDefinition> routes = new LinkedHashMap<>();
        if (isAbsent(node)) {
            return routes;
        }
        if (!node.isObject()) {
            throw ConfigException.malformed(location, "routes must be an object", null);
        }
        Set<String> identifiers = new HashSet<>();
        Iterator<Map.Entry<String, JsonNode>> iterator = node.fields();
        while (iterator.hasNext()) {
            Map.Entry<String, JsonNode> entry = iterator.next();
            String key = entry.getKey();
            RouteDefinition route = readRoute(key, entry.getValue());
            String identifier = keyOf(key, route).identifier();
            if (!identifiers.add(identifier)) {
                throw ConfigException.duplicateRoute(identifier);
            }
            routes.put(key, route);
        }
        return routes;
    }

    private RouteDefinition readRoute(String key, JsonNode node) {
        if (!node.isObject()) {
            throw ConfigException.invalidRoute(key, "route definition must be an object");
        }
        String declaredMethod = readRouteText(key, node, "method");
        RouteKey routeKey = normalizeKey(key, declaredMethod);

        String idField = readRouteText(key, node, "id_field");
        if (idField != null && idField.isBlank()) {
            throw ConfigException.invalidRoute(key, "id_field must not be empty");
        }
        RouteResponse response = readResponse(key, node.get("response"));
        if (response instanceof RouteResponse.FileReference reference) {
            response = resolveReference(key, reference);
        }
        return new RouteDefinition(
                routeKey.method(),
                readRouteText(key, node, "description"),
                readHeaders(key, node.get("headers")),
                idField,
                readRouteText(key, node, "results_field"),
                response);
    }

    private static RouteKey normalizeKey(String key, String declaredMethod) {
        try {
            return RouteKey.parse(key, declaredMethod);
        } catch (IllegalArgumentException ex) {
            throw ConfigException.invalidRoute(key, ex.getMessage());
        }
    }

    private static RouteKey keyOf(String key, RouteDefinition route) {
        return normalizeKey(key, route.method().name());
    }

    private static String readRouteText(String key, JsonNode route, String field) {
        JsonNode value = route.get(field);
        if (isAbsent(value)) {
            return null;
        }
        if (!value.isTextual()) {
            throw ConfigException.invalidRoute(key, field + " must be a string");
        }
        return value.textValue();
    }

    private static Map<String, String> readHeaders(String key, JsonNode node) {
        Map<String, String> headers = new LinkedHashMap<>();
        if (isAbsent(node)) {
            return headers;
        }
        if (!node.isObject()) {
            throw ConfigException.invalidRoute(key, "headers must be an object");
        }
        Iterator<Map.Entry<String, JsonNode>> iterator = node.fields();
        while (iterator.hasNext()) {
            Map.Entry<String, JsonNode> header = iterator.next();
            if (!header.getValue().isValueNode() || header.getValue().isNull()) {
                throw ConfigException.invalidRoute(key, "header '" + header.getKey() + "' must be a scalar value");
            }
            headers.put(header.getKey(), header.getValue().asText());
        }
        return headers;
    }

    private static RouteResponse readResponse(String key, JsonNode node) {
        if (isAbsent(node)) {
            throw ConfigException.invalidRoute(key, "response is required");
        }
        if (node.isTextual()) {
            if (node.textValue().isBlank()) {
                throw ConfigException.invalidRoute(key, "response file path must not be empty");
            }
            return new RouteResponse.FileReference(node.textValue());
        }
        if (node.isObject()) {
            if (!node.has("body")) {
                throw ConfigException.invalidRoute(key, "response must contain a body");
            }
            return new RouteResponse.Inline(readStatus(key, node.get("status")), node.get("body"));
        }
        throw ConfigException.invalidRoute(key, "response must be an object or a file path, got " + node.getNodeType());
    }

    private static int readStatus(String key, JsonNode node) {
        if (isAbsent(node)) {
            return RouteResponse.DEFAULT_STATUS;
        }
        if (!node.isIntegralNumber() || !node.canConvertToInt() || node.intValue() < 100 || node.intValue() > 599) {
            throw ConfigException.invalidRoute(key, "status must be an HTTP status code between 100 and 599, got " + node);
        }
        return node.intValue();
    }

    private RouteResponse.Inline resolveReference(String key, RouteResponse.FileReference reference) {
        String path = reference.path();
        try {
            byte[] content = resolver.loadFile(path);
            JsonNode body = parse(path, content, resolver.resolve(path));
            log.debug("Resolved response file {} for route {}", path, key);
            return RouteResponse.Inline.ok(body);
        } catch (JsonEchoException ex) {
            throw ConfigException.externalResponse(key, path, ex);
        }
    }

    private static ObjectNode toTree(ObjectMapper mapper, Configuration configuration) {
        ObjectNode root = mapper.createObjectNode();
        root.put("port", configuration.port());
        root.put("hostname", configuration.hostname());
        if (configuration.staticFolder() != null) {
            root.put("static_folder", configuration.staticFolder());
        }
        root.put("static_route", configuration.staticRoute());
        ObjectNode routes = root.putObject("routes");
        configuration.routes().forEach((key, route) -> routes.set(key, toTree(mapper, key, route)));
        return root;
    }

    private static ObjectNode toTree(ObjectMapper mapper, String key, RouteDefinition route) {
        ObjectNode node = mapper.createObjectNode();
        node.put("method", route.method().name());
        if (route.description() != null) {
            node.put("description", route.description());
        }
        if (!route.headers().isEmpty()) {
            ObjectNode headers = node.putObject("headers");
            route.headers().forEach(headers::put);
        }
        node.put("id_field", route.idField());
        if (route.resultsField() != null) {
            node.put("results_field", route.resultsField());
        }
        if (route.response() instanceof RouteResponse.Inline inline) {
            ObjectNode response = node.putObject("response");
            response.put("status", inline.status());
            response.set("body", inline.body());
        } else if (route.response() instanceof RouteResponse.FileReference reference) {
            node.put("response", reference.path());
        } else {
            throw ConfigException.invalidRoute(key, "unsupported response type " + route.response().getClass().getSimpleName());
        }
        return node;
    }

    private static boolean isAbsent(JsonNode node) {
        return node == null || node.isNull() || node.isMissingNode();
    }
}
