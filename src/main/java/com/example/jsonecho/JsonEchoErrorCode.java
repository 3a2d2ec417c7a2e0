package com.example.jsonecho;

public enum JsonEchoErrorCode {
    // File system
    NOT_FOUND,
    IS_A_DIRECTORY,
    PERMISSION_DENIED,
    IO_ERROR,

    // Configuration
    MALFORMED,
    INVALID_ROUTE,
    DUPLICATE_ROUTE,
    EXTERNAL_RESPONSE_ERROR,

    // Query
    MISSING_RESULTS_FIELD
}
