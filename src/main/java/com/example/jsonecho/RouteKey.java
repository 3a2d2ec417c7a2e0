package com.example.jsonecho;

import java.util.Objects;

public record RouteKey(HttpMethod method, PathPattern pattern) {

    public RouteKey {
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(pattern, "pattern");
    }

    public static RouteKey parse(String key) {
        return parse(key, null);
    }

    /**
     * Parses {@code key}, taking the method from the bracketed prefix, else from
     * {@code declaredMethod}, else GET.
     *
     * @throws IllegalArgumentException when the key is malformed, a method is unknown, or the prefix
     *                                  and {@code declaredMethod} disagree
     */
    public static RouteKey parse(String key, String declaredMethod) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("route key is empty");
        }
        String trimmed = key.trim();
        HttpMethod method = null;
        String path = trimmed;
        if (trimmed.startsWith("[")) {
            int end = trimmed.indexOf(']');
            if (end < 0) {
                throw new IllegalArgumentException("missing ']' after method in route key");
            }
            method = HttpMethod.parse(trimmed.substring(1, end));
            path = trimmed.substring(end + 1).trim();
        }
        if (declaredMethod != null) {
            HttpMethod declared = HttpMethod.parse(declaredMethod);
            if (method != null && method != declared) {
                throw new IllegalArgumentException("method field " + declared
                        + " contradicts method " + method + " in route key");
            }
            method = declared;
        }
        return new RouteKey(method == null ? HttpMethod.GET : method, PathPattern.compile(path));
    }

    /** Canonical string form, e.g. {@code [GET] /api/users/:id}. */
    public String identifier() {
        return "[" + method + "] " + pattern;
    }

    @Override
    public String toString() {
        return identifier();
    }
}
