package com.sourcecheck.verification.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Combined not-found verdict. Serializes as {@code true}, {@code false} or {@code "undetermined"}.
 */
public enum NotFoundClassification {
    NOT_FOUND(Boolean.TRUE),
    FOUND(Boolean.FALSE),
    UNDETERMINED("undetermined");

    private final Object wireValue;

    NotFoundClassification(Object wireValue) {
        this.wireValue = wireValue;
    }

    public static NotFoundClassification of(boolean notFound) {
        return notFound ? NOT_FOUND : FOUND;
    }

    @JsonValue
    public Object getWireValue() {
        return wireValue;
    }
}
