package com.company.silencing.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public class SilenceValidationException extends SilenceException {

    private final Map<String, String> fieldErrors;

    public SilenceValidationException(Map<String, String> fieldErrors) {
        super("Invalid silence: " + fieldErrors);
        this.fieldErrors = Collections.unmodifiableMap(new LinkedHashMap<>(fieldErrors));
    }

    public SilenceValidationException(String field, String message) {
        this(Map.of(field, message));
    }

    public Map<String, String> getFieldErrors() {
        return fieldErrors;
    }
}
