package com.sourcecheck.tokenizer;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Subset of a model card relevant to batching: the declared tokenizer and the model's input budget.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ModelCard {

    private final String modelName;
    private final String tokenizer;
    private final Integer maxInputLen;

    @JsonCreator
    public ModelCard(
            @JsonProperty("model_name") String modelName,
            @JsonProperty("tokenizer") String tokenizer,
            @JsonProperty("max_input_len") Integer maxInputLen) {
        this.modelName = modelName;
        this.tokenizer = tokenizer;
        this.maxInputLen = maxInputLen;
    }

    @JsonProperty("model_name")
    public String getModelName() {
        return modelName;
    }

    /**
     * Tokenizer identifier: an encoding name ({@code cl100k_base}) or a model name ({@code gpt-4}).
     */
    @JsonProperty("tokenizer")
    public String getTokenizer() {
        return tokenizer;
    }

    @JsonProperty("max_input_len")
    public Integer getMaxInputLen() {
        return maxInputLen;
    }
}
