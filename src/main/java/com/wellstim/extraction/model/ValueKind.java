package com.wellstim.extraction.model;

/**
 * How a raw captured string is coerced, and what a missing value is replaced
 * with when the field is not an identity field.
 */
public enum ValueKind {

    STRING("N/A"),
    API_NUMBER(null),
    DOUBLE(0.0),
    INTEGER(0),
    DATE(null);

    private final Object missingDefault;

    ValueKind(Object missingDefault) {
        this.missingDefault = missingDefault;
    }

    public Object getMissingDefault() {
        return missingDefault;
    }
}
