package com.example.jsonecho;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;

/** Inline response, or a JSON file the loader reads in its place. */
public sealed interface RouteResponse permits RouteResponse.Inline, RouteResponse.FileReference {

    int DEFAULT_STATUS = 200;

    record Inline(int status, JsonNode body) implements RouteResponse {
        public Inline {
            if (status < 100 || status > 599) {
                throw new IllegalArgumentException("HTTP status out of range: " + status);
            }
            Objects.requireNonNull(body, "body");
        }

        public static Inline ok(JsonNode body) {
            return new Inline(DEFAULT_STATUS, body);
        }
    }

    record FileReference(String path) implements RouteResponse {
        public FileReference {
            Objects.requireNonNull(path, "path");
        }
    }
}
