package com.example.jsonecho;

import java.util.Locale;

public enum HttpMethod {
    GET, POST, PUT, PATCH, DELETE, OPTIONS, HEAD;

    /**
     * Case-insensitive lookup.
     *
     * @throws IllegalArgumentException if {@code value} is blank or not a supported method
     */
    public static HttpMethod parse(String value) {
        String normalized = value == null ? "" : value.trim().toUpperCase(Locale.ROOT);
        return switch (normalized) {
            case "GET" -> GET;
            case "POST" -> POST;
            case "PUT" -> PUT;
            case "PATCH" -> PATCH;
            case "DELETE" -> DELETE;
            case "OPTIONS" -> OPTIONS;
            case "HEAD" -> HEAD;
            case "" -> throw new IllegalArgumentException("HTTP method is empty");
            default -> throw new IllegalArgumentException("Unsupported HTTP method: " + value.trim());
        };
    }
}
