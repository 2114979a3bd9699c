package com.sourcecheck.verification.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum FactStatus {
    CONFIRMED("Confirmed"),
    NOT_CONFIRMED("Not Confirmed");

    private final String label;

    FactStatus(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }
}
