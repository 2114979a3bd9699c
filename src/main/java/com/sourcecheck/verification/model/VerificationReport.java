package com.sourcecheck.verification.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Verdicts of one review, carried alongside the response they describe.
 * Analyses that were not requested are null.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class VerificationReport {

    private final ResponseRecord response;
    private final List<FactCheckEntry> factCheck;
    private final List<SourceReviewEntry> sourceReview;
    private final ComparisonStats comparisonStats;
    private final String factCheckMarkup;

    public VerificationReport(ResponseRecord response, List<FactCheckEntry> factCheck,
                              List<SourceReviewEntry> sourceReview, ComparisonStats comparisonStats,
                              String factCheckMarkup) {
        this.response = response;
        this.factCheck = factCheck;
        this.sourceReview = sourceReview;
        this.comparisonStats = comparisonStats;
        this.factCheckMarkup = factCheckMarkup;
    }

    @JsonProperty("response")
    public ResponseRecord getResponse() {
        return response;
    }

    @JsonProperty("fact_check")
    public List<FactCheckEntry> getFactCheck() {
        return factCheck;
    }

    @JsonProperty("source_review")
    public List<SourceReviewEntry> getSourceReview() {
        return sourceReview;
    }

    @JsonProperty("comparison_stats")
    public ComparisonStats getComparisonStats() {
        return comparisonStats;
    }

    @JsonProperty("fact_check_markup")
    public String getFactCheckMarkup() {
        return factCheckMarkup;
    }
}
