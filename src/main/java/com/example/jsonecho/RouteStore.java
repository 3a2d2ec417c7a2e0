package com.example.jsonecho;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * In-memory index of the configured routes. Immutable once populated.
 */
public final class RouteStore {
    private static final Logger log = LoggerFactory.getLogger(RouteStore.class);

    private static final RouteStore EMPTY = new RouteStore(List.of(), Map.of());

    private final List<Model> models;
    private final Map<String, Model> modelsByIdentifier;
    private final Map<String, RouteDefinition> routesByIdentifier;
    private final Map<HttpMethod, List<Model>> modelsByMethod;

    private RouteStore(List<Model> models, Map<String, RouteDefinition> routesByIdentifier) {
        this.models = List.copyOf(models);
        this.routesByIdentifier = Collections.unmodifiableMap(new LinkedHashMap<>(routesByIdentifier));
        Map<String, Model> byIdentifier = new LinkedHashMap<>();
        Map<HttpMethod, List<Model>> byMethod = new EnumMap<>(HttpMethod.class);
        for (Model model : this.models) {
            byIdentifier.put(model.identifier(), model);
            byMethod.computeIfAbsent(model.method(), method -> new ArrayList<>()).add(model);
        }
        byMethod.replaceAll((method, list) -> List.copyOf(list));
        this.modelsByIdentifier = Collections.unmodifiableMap(byIdentifier);
        this.modelsByMethod = Collections.unmodifiableMap(byMethod);
    }

    public static RouteStore empty() {
        return EMPTY;
    }

    /**
     * Builds a store with one model per route, in the iteration order of {@code routes}.
     *
     * @throws ConfigException with {@link JsonEchoErrorCode#DUPLICATE_ROUTE} when two keys normalize to
     *                         the same identifier, or {@link JsonEchoErrorCode#INVALID_ROUTE} when a key
     *                         cannot be parsed or a response is still an unresolved file reference
     */
    public static RouteStore populate(Map<String, RouteDefinition> routes) {
        Objects.requireNonNull(routes, "routes");
        List<Model> models = new ArrayList<>(routes.size());
        Map<String, RouteDefinition> byIdentifier = new LinkedHashMap<>();
        for (Map.Entry<String, RouteDefinition> entry : routes.entrySet()) {
            String key = entry.getKey();
            RouteDefinition route = entry.getValue();
            RouteKey routeKey = parseKey(key, route);
            if (byIdentifier.containsKey(routeKey.identifier())) {
                throw ConfigException.duplicateRoute(routeKey.identifier());
            }
            Model model = Model.of(key, routeKey, route);
            byIdentifier.put(model.identifier(), route);
            models.add(model);
            log.debug("Registered model {}", model.identifier());
        }
        log.info("Populated route store with {} models", models.size());
        return new RouteStore(models, byIdentifier);
    }

    private static RouteKey parseKey(String key, RouteDefinition route) {
        try {
            return RouteKey.parse(key, route.method().name());
        } catch (IllegalArgumentException ex) {
            throw ConfigException.invalidRoute(key, ex.getMessage());
        }
    }

    /** Looks a model up by identifier; {@code "/users"} and {@code "[get] /users"} both find {@code "[GET] /users"}. */
    public Optional<Model> getModel(String identifier) {
        return canonical(identifier).map(modelsByIdentifier::get);
    }

    public List<Model> getModels() {
        return models;
    }

    public Optional<RouteDefinition> getRoute(String identifier) {
        return canonical(identifier).map(routesByIdentifier::get);
    }

    public List<String> getRouteIdentifiers() {
        return List.copyOf(routesByIdentifier.keySet());
    }

    public int size() {
        return models.size();
    }

    private static Optional<String> canonical(String identifier) {
        if (identifier == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(RouteKey.parse(identifier).identifier());
        } catch (IllegalArgumentException ex) {
            return Optional.empty();
        }
    }

    /**
     * Finds the model serving {@code concretePath}. When several patterns match, the one with the
     * longest run of literal segments before its first parameter wins; ties go to the route declared
     * first.
     */
    public Optional<RouteMatch> findMatching(HttpMethod method, String concretePath) {
        RouteMatch best = null;
        for (Model model : modelsByMethod.getOrDefault(method, List.of())) {
            Optional<Map<String, String>> params = model.pathPattern().match(concretePath);
            if (params.isEmpty()) {
                continue;
            }
            if (best == null
                    || model.pathPattern().literalPrefixLength() > best.model().pathPattern().literalPrefixLength()) {
                best = new RouteMatch(model, params.get());
            }
        }
        return Optional.ofNullable(best);
    }

    /**
     * Finds the record a path parameter points at. The parameter named like the model's id field is
     * compared against that field; any other parameter against the field of the same name. Values are
     * compared by their string form, so {@code "2"} finds {@code {"id": 2}} but {@code "02"} does not.
     *
     * @throws MissingResultsFieldException if the model's results field is missing or not an array
     */
    public Optional<JsonNode> resolveRecord(Model model, String paramName, String paramValue) {
        Objects.requireNonNull(model, "model");
        JsonNode collection = model.collection();
        if (collection.isArray()) {
            for (JsonNode element : collection) {
                if (fieldMatches(element, paramName, paramValue)) {
                    return Optional.of(element);
                }
            }
            return Optional.empty();
        }
        return fieldMatches(collection, paramName, paramValue) ? Optional.of(collection) : Optional.empty();
    }

    /**
     * Resolves a request end to end: no matching route gives empty; a route without path parameters
     * answers with its whole data; otherwise the record selected by the id parameter (or the first
     * parameter) is returned, or empty when there is none.
     */
    public Optional<MockResponse> respond(HttpMethod method, String concretePath) {
        Optional<RouteMatch> match = findMatching(method, concretePath);
        if (match.isEmpty()) {
            log.debug("No route for [{}] {}", method, concretePath);
            return Optional.empty();
        }
        Model model = match.get().model();
        Map<String, String> params = match.get().parameters();
        if (params.isEmpty()) {
            return Optional.of(new MockResponse(model.status(), model.headers(), model.data().deepCopy()));
        }
        String paramName = params.containsKey(model.idField())
                ? model.idField()
                : params.keySet().iterator().next();
        return resolveRecord(model, paramName, params.get(paramName))
                .map(found -> new MockResponse(model.status(), model.headers(), found.deepCopy()));
    }

    private static boolean fieldMatches(JsonNode element, String field, String expected) {
        if (element == null || !element.isObject()) {
            return false;
        }
        JsonNode value = element.get(field);
        if (value == null || !value.isValueNode() || value.isNull()) {
            return false;
        }
        return value.asText().equals(expected);
    }
}
