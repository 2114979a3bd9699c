package com.sourcecheck.llm;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

public final class LanguageModelResponse {

    private final String llmResponse;
    private final Map<String, Object> usage;

    @JsonCreator
    public LanguageModelResponse(
            @JsonProperty("llm_response") String llmResponse,
            @JsonProperty("usage") Map<String, Object> usage) {
        this.llmResponse = llmResponse != null ? llmResponse : "";
        this.usage = usage != null ? Map.copyOf(usage) : Map.of();
    }

    @JsonProperty("llm_response")
    public String getLlmResponse() {
        return llmResponse;
    }

    @JsonProperty("usage")
    public Map<String, Object> getUsage() {
        return usage;
    }
}
