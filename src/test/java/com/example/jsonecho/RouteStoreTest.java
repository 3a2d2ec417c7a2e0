package com.example.jsonecho;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for RouteStore.
 */
class RouteStoreTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static JsonNode json(String text) {
        try {
            return MAPPER.readTree(text);
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException(ex);
        }
    }

    private static RouteDefinition route(String body) {
        return route(null, null, body);
    }

    private static RouteDefinition route(String idField, String resultsField, String body) {
        return new RouteDefinition(null, null, Map.of(), idField, resultsField,
                RouteResponse.Inline.ok(json(body)));
    }

    private static RouteStore store(Object... keysAndRoutes) {
        Map<String, RouteDefinition> routes = new LinkedHashMap<>();
        for (int i = 0; i < keysAndRoutes.length; i += 2) {
            routes.put((String) keysAndRoutes[i], (RouteDefinition) keysAndRoutes[i + 1]);
        }
        return RouteStore.populate(routes);
    }

    @Test
    void testUserLookupScenario() {
        RouteStore store = store("/api/users/:id",
                route("id", null, "[{\"id\":1,\"name\":\"A\"},{\"id\":2,\"name\":\"B\"}]"));

        RouteMatch match = store.findMatching(HttpMethod.GET, "/api/users/2").orElseThrow();
        assertThat(match.parameters()).containsExactly(entry("id", "2"));
        assertThat(store.resolveRecord(match.model(), "id", "2")).contains(json("{\"id\":2,\"name\":\"B\"}"));
        assertThat(match.model().status()).isEqualTo(200);

        RouteMatch missing = store.findMatching(HttpMethod.GET, "/api/users/9").orElseThrow();
        assertThat(store.resolveRecord(missing.model(), "id", "9")).isEmpty();
    }

    @Test
    void testRespondCombinesMatchAndRecord() {
        RouteStore store = store("/api/users/:id",
                route("[{\"id\":1,\"name\":\"A\"},{\"id\":2,\"name\":\"B\"}]"));

        assertThat(store.respond(HttpMethod.GET, "/api/users/1"))
                .hasValueSatisfying(response -> {
                    assertThat(response.status()).isEqualTo(200);
                    assertThat(response.body()).isEqualTo(json("{\"id\":1,\"name\":\"A\"}"));
                });
        assertThat(store.respond(HttpMethod.GET, "/api/users/9")).isEmpty();
        assertThat(store.respond(HttpMethod.POST, "/api/users/1")).isEmpty();
        assertThat(store.respond(HttpMethod.GET, "/api/other")).isEmpty();
    }

    @Test
    void testRespondWithoutParametersReturnsWholeData() {
        RouteDefinition created = new RouteDefinition(HttpMethod.POST, null, Map.of("X-Mock", "yes"), null, null,
                new RouteResponse.Inline(201, json("{\"created\":true}")));
        RouteStore store = store("[POST] /api/users", created);

        MockResponse response = store.respond(HttpMethod.POST, "/api/users").orElseThrow();

        assertThat(response.status()).isEqualTo(201);
        assertThat(response.headers()).containsEntry("X-Mock", "yes");
        assertThat(response.body()).isEqualTo(json("{\"created\":true}"));
    }

    @Test
    void testLiteralSegmentWinsOverParameter() {
        RouteStore store = store(
                "/api/users/:id", route("[]"),
                "/api/users/active", route("{\"active\":true}"));

        assertThat(store.findMatching(HttpMethod.GET, "/api/users/active"))
                .hasValueSatisfying(match -> assertThat(match.model().identifier()).isEqualTo("[GET] /api/users/active"));
        assertThat(store.findMatching(HttpMethod.GET, "/api/users/7"))
                .hasValueSatisfying(match -> assertThat(match.model().identifier()).isEqualTo("[GET] /api/users/:id"));
    }

    @Test
    void testEquallySpecificPatternsPreferFirstDeclared() {
        RouteStore store = store(
                "/api/:group/items", route("[]"),
                "/api/{section}/items", route("[]"));

        RouteMatch match = store.findMatching(HttpMethod.GET, "/api/books/items").orElseThrow();

        assertThat(match.model().identifier()).isEqualTo("[GET] /api/:group/items");
        assertThat(match.parameters()).containsEntry("group", "books");
    }

    @Test
    void testColonAndBraceSyntaxCollide() {
        assertThatThrownBy(() -> store(
                "/api/users/:id", route("[]"),
                "/api/users/{id}", route("[]")))
                .isInstanceOf(ConfigException.class)
                .extracting("code").isEqualTo(JsonEchoErrorCode.DUPLICATE_ROUTE);
    }

    @Test
    void testDuplicateImplicitGetRoutesFailPopulate() {
        Map<String, RouteDefinition> routes = new LinkedHashMap<>();
        routes.put("/api/users", route("[]"));
        routes.put("[GET] /api/users", route("[1]"));

        assertThatThrownBy(() -> RouteStore.populate(routes))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("[GET] /api/users")
                .extracting("code").isEqualTo(JsonEchoErrorCode.DUPLICATE_ROUTE);
    }

    @Test
    void testNumericIdMatchesStringParameter() {
        RouteStore store = store("/items/:id", route("[{\"id\":10},{\"id\":\"abc\"},{\"id\":2}]"));
        Model model = store.getModels().get(0);

        assertThat(store.resolveRecord(model, "id", "10")).contains(json("{\"id\":10}"));
        assertThat(store.resolveRecord(model, "id", "abc")).contains(json("{\"id\":\"abc\"}"));
        assertThat(store.resolveRecord(model, "id", "11")).isEmpty();
    }

    @Test
    void testNumericIdComparesTextOnly() {
        RouteStore store = store("/api/users/:id", route("[{\"id\":1},{\"id\":2,\"name\":\"B\"}]"));
        Model model = store.getModels().get(0);

        assertThat(store.resolveRecord(model, "id", "2")).contains(json("{\"id\":2,\"name\":\"B\"}"));
        for (String lookalike : new String[]{"02", "2.0", "2e0", "+2", " 2"}) {
            assertThat(store.resolveRecord(model, "id", lookalike)).as(lookalike).isEmpty();
        }
        assertThat(store.respond(HttpMethod.GET, "/api/users/02")).isEmpty();
    }

    @Test
    void testRespondBodiesAreIndependentCopies() {
        RouteStore store = store(
                "/api/users", route("[{\"id\":1}]"),
                "/api/users/:id", route("[{\"id\":1,\"name\":\"A\"}]"));

        ((ArrayNode) store.respond(HttpMethod.GET, "/api/users").orElseThrow().body()).removeAll();
        ((ObjectNode) store.respond(HttpMethod.GET, "/api/users/1").orElseThrow().body()).put("name", "changed");

        assertThat(store.respond(HttpMethod.GET, "/api/users").orElseThrow().body()).hasSize(1);
        assertThat(store.respond(HttpMethod.GET, "/api/users/1").orElseThrow().body().get("name").asText())
                .isEqualTo("A");
        assertThat(store.getModel("/api/users").orElseThrow().data()).hasSize(1);
    }

    @Test
    void testCustomIdField() {
        RouteStore store = store("/users/:uuid", route("uuid", null, "[{\"uuid\":\"u-1\"},{\"uuid\":\"u-2\"}]"));
        Model model = store.getModels().get(0);

        assertThat(store.resolveRecord(model, "uuid", "u-2")).contains(json("{\"uuid\":\"u-2\"}"));
    }

    @Test
    void testNonIdParameterMatchesFieldOfSameName() {
        RouteStore store = store("/users/by-name/:name", route("[{\"id\":1,\"name\":\"ann\"},{\"id\":2,\"name\":\"bob\"}]"));

        assertThat(store.respond(HttpMethod.GET, "/users/by-name/bob"))
                .hasValueSatisfying(response -> assertThat(response.body().get("id").asInt()).isEqualTo(2));
    }

    @Test
    void testResultsFieldScopesTheSearch() {
        RouteStore store = store("/api/users/:id",
                route("id", "data", "{\"data\":[{\"id\":1},{\"id\":2}],\"meta\":{\"id\":2}}"));
        Model model = store.getModels().get(0);

        assertThat(store.resolveRecord(model, "id", "2")).contains(json("{\"id\":2}"));
        assertThat(model.collection()).isEqualTo(json("[{\"id\":1},{\"id\":2}]"));
    }

    @Test
    void testMissingResultsFieldFailsAtQueryTime() {
        RouteStore store = store(
                "/absent/:id", route("id", "data", "{\"items\":[]}"),
                "/scalar/:id", route("id", "data", "{\"data\":{\"id\":1}}"));

        for (Model model : store.getModels()) {
            assertThatThrownBy(() -> store.resolveRecord(model, "id", "1"))
                    .isInstanceOf(MissingResultsFieldException.class)
                    .hasMessageContaining("data")
                    .extracting("code").isEqualTo(JsonEchoErrorCode.MISSING_RESULTS_FIELD);
        }
    }

    @Test
    void testSingleObjectDataMatchesItself() {
        RouteStore store = store("/me/:id", route("{\"id\":5,\"name\":\"me\"}"));
        Model model = store.getModels().get(0);

        assertThat(store.resolveRecord(model, "id", "5")).contains(json("{\"id\":5,\"name\":\"me\"}"));
        assertThat(store.resolveRecord(model, "id", "6")).isEmpty();
    }

    @Test
    void testGetModelNormalizesIdentifier() {
        RouteStore store = store("/api/users/{id}", route("[]"), "[post] /api/users", route("{}"));

        assertThat(store.getModel("[GET] /api/users/:id")).isPresent();
        assertThat(store.getModel("/api/users/{id}")).isPresent();
        assertThat(store.getModel("[POST] /api/users")).isPresent();
        assertThat(store.getModel("/api/users")).isEmpty();
        assertThat(store.getModel("not a key")).isEmpty();
        assertThat(store.getRoute("[POST] /api/users")).hasValueSatisfying(
                route -> assertThat(route.method()).isEqualTo(HttpMethod.POST));
    }

    @Test
    void testModelsKeepDeclarationOrder() {
        RouteStore store = store(
                "/c", route("[]"),
                "/a", route("[]"),
                "[DELETE] /b", route("{}"));

        assertThat(store.getModels()).extracting(Model::identifier)
                .containsExactly("[GET] /c", "[GET] /a", "[DELETE] /b");
        assertThat(store.getRouteIdentifiers()).containsExactly("[GET] /c", "[GET] /a", "[DELETE] /b");
    }

    @Test
    void testModelDataIsDetachedFromConfiguration() {
        RouteDefinition definition = route("[{\"id\":1}]");
        RouteStore store = store("/items/:id", definition);

        ((ArrayNode) ((RouteResponse.Inline) definition.response()).body()).removeAll();

        assertThat(store.getModels().get(0).data()).hasSize(1);
    }

    @Test
    void testUnresolvedFileReferenceIsRejected() {
        RouteDefinition unresolved = new RouteDefinition(null, null, null, null, null,
                new RouteResponse.FileReference("responses/users.json"));

        assertThatThrownBy(() -> store("/api/users", unresolved))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("responses/users.json")
                .extracting("code").isEqualTo(JsonEchoErrorCode.INVALID_ROUTE);
    }

    @Test
    void testEmptyStore() {
        assertThat(RouteStore.empty().getModels()).isEmpty();
        assertThat(RouteStore.empty().findMatching(HttpMethod.GET, "/")).isEmpty();
    }
}
