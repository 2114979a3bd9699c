package com.sourcecheck.verification.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Locale;

/**
 * Aggregate token-level agreement between a response and its evidence.
 */
public final class ComparisonStats {

    private final List<String> confirmedWords;
    private final List<String> unconfirmedWords;
    private final double verifiedTokenMatchRatio;
    private final List<KeyPointResult> keyPoints;

    public ComparisonStats(List<String> confirmedWords, List<String> unconfirmedWords,
                           double verifiedTokenMatchRatio, List<KeyPointResult> keyPoints) {
        this.confirmedWords = List.copyOf(confirmedWords);
        this.unconfirmedWords = List.copyOf(unconfirmedWords);
        this.verifiedTokenMatchRatio = verifiedTokenMatchRatio;
        this.keyPoints = List.copyOf(keyPoints);
    }

    public static ComparisonStats empty() {
        return new ComparisonStats(List.of(), List.of(), 0.0, List.of());
    }

    /**
     * The ratio as a percentage with one decimal, e.g. {@code 66.7%}.
     */
    @JsonProperty("percent_display")
    public String getPercentDisplay() {
        return String.format(Locale.ROOT, "%.1f%%", verifiedTokenMatchRatio * 100);
    }

    @JsonProperty("confirmed_words")
    public List<String> getConfirmedWords() {
        return confirmedWords;
    }

    @JsonProperty("unconfirmed_words")
    public List<String> getUnconfirmedWords() {
        return unconfirmedWords;
    }

    @JsonProperty("verified_token_match_ratio")
    public double getVerifiedTokenMatchRatio() {
        return verifiedTokenMatchRatio;
    }

    @JsonProperty("key_point_list")
    public List<KeyPointResult> getKeyPoints() {
        return keyPoints;
    }
}
