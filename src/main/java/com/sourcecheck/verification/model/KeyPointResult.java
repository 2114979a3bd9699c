package com.sourcecheck.verification.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public final class KeyPointResult {

    private final String keyPoint;
    private final int entry;
    private final double verifiedMatch;

    public KeyPointResult(String keyPoint, int entry, double verifiedMatch) {
        this.keyPoint = keyPoint;
        this.entry = entry;
        this.verifiedMatch = verifiedMatch;
    }

    @JsonProperty("key_point")
    public String getKeyPoint() {
        return keyPoint;
    }

    @JsonProperty("entry")
    public int getEntry() {
        return entry;
    }

    @JsonProperty("verified_match")
    public double getVerifiedMatch() {
        return verifiedMatch;
    }
}
