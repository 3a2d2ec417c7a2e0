package com.example.jsonecho;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record RouteMatch(Model model, Map<String, String> parameters) {
    public RouteMatch {
        parameters = Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }
}
