package com.sourcecheck.verification.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Per-heuristic outcomes and the combined classification. A heuristic that did not run is null.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class NotFoundResult {

    private final Boolean parseLlmResponse;
    private final Boolean evidenceMatch;
    private final Boolean askTheModel;
    private final NotFoundClassification classification;

    public NotFoundResult(Boolean parseLlmResponse, Boolean evidenceMatch, Boolean askTheModel,
                          NotFoundClassification classification) {
        this.parseLlmResponse = parseLlmResponse;
        this.evidenceMatch = evidenceMatch;
        this.askTheModel = askTheModel;
        this.classification = classification;
    }

    @JsonProperty("parse_llm_response")
    public Boolean getParseLlmResponse() {
        return parseLlmResponse;
    }

    @JsonProperty("evidence_match")
    public Boolean getEvidenceMatch() {
        return evidenceMatch;
    }

    @JsonProperty("ask_the_model")
    public Boolean getAskTheModel() {
        return askTheModel;
    }

    @JsonProperty("not_found_classification")
    public NotFoundClassification getClassification() {
        return classification;
    }

    @Override
    public String toString() {
        return "NotFoundResult{parse=" + parseLlmResponse + ", evidence=" + evidenceMatch
                + ", model=" + askTheModel + ", classification=" + classification + "}";
    }
}
