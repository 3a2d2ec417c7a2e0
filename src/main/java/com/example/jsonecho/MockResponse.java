package com.example.jsonecho;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

/** What the HTTP layer writes back for a matched request. Each response owns its body. */
public record MockResponse(int status, Map<String, String> headers, JsonNode body) {
}
