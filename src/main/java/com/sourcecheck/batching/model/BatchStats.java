package com.sourcecheck.batching.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

public final class BatchStats {

    private final int tokens;
    private final int chars;
    private final int samples;

    @JsonCreator
    public BatchStats(
            @JsonProperty("tokens") int tokens,
            @JsonProperty("chars") int chars,
            @JsonProperty("samples") int samples) {
        this.tokens = tokens;
        this.chars = chars;
        this.samples = samples;
    }

    @JsonProperty("tokens")
    public int getTokens() {
        return tokens;
    }

    @JsonProperty("chars")
    public int getChars() {
        return chars;
    }

    @JsonProperty("samples")
    public int getSamples() {
        return samples;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof BatchStats)) {
            return false;
        }
        BatchStats that = (BatchStats) o;
        return tokens == that.tokens && chars == that.chars && samples == that.samples;
    }

    @Override
    public int hashCode() {
        return 31 * (31 * tokens + chars) + samples;
    }

    @Override
    public String toString() {
        return "BatchStats{tokens=" + tokens + ", chars=" + chars + ", samples=" + samples + "}";
    }
}
