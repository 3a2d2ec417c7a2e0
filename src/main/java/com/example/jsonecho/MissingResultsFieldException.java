package com.example.jsonecho;

import java.util.Map;

public class MissingResultsFieldException extends JsonEchoException {
    public MissingResultsFieldException(String modelKey, String field) {
        super(JsonEchoErrorCode.MISSING_RESULTS_FIELD,
                "Model '" + modelKey + "' has no array under results field '" + field + "'",
                Map.of("model", modelKey, "field", field));
    }
}
