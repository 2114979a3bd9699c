package com.sourcecheck.verification.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.sourcecheck.batching.model.Batch;
import com.sourcecheck.batching.model.BatchMetadataEntry;
import com.sourcecheck.llm.LanguageModelResponse;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A model answer together with the evidence batch it was generated from.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ResponseRecord {

    private final String llmResponse;
    private final String prompt;
    private final String evidence;
    private final List<BatchMetadataEntry> evidenceMetadata;
    private final Map<String, Set<Integer>> biblio;
    private final Integer batchId;
    private final Map<String, Object> usage;
    private final String instruction;
    private final List<String> keyPoints;

    @JsonCreator
    public ResponseRecord(
            @JsonProperty("llm_response") String llmResponse,
            @JsonProperty("prompt") String prompt,
            @JsonProperty("evidence") String evidence,
            @JsonProperty("evidence_metadata") List<BatchMetadataEntry> evidenceMetadata,
            @JsonProperty("biblio") Map<String, Set<Integer>> biblio,
            @JsonProperty("batch_id") Integer batchId,
            @JsonProperty("usage") Map<String, Object> usage,
            @JsonProperty("instruction") String instruction,
            @JsonProperty("key_points") List<String> keyPoints) {
        this.llmResponse = llmResponse != null ? llmResponse : "";
        this.prompt = prompt;
        this.evidence = evidence != null ? evidence : "";
        this.evidenceMetadata = evidenceMetadata != null ? List.copyOf(evidenceMetadata) : List.of();
        this.biblio = biblio;
        this.batchId = batchId;
        this.usage = usage;
        this.instruction = instruction;
        this.keyPoints = keyPoints != null ? List.copyOf(keyPoints) : null;
    }

    /**
     * Builds a record from the batch sent as context and the model's answer to it.
     */
    public static ResponseRecord forBatch(String prompt, LanguageModelResponse response, Batch batch) {
        return new ResponseRecord(response.getLlmResponse(), prompt, batch.getText(), batch.getMetadata(),
                batch.getBiblio(), batch.getId(), response.getUsage(), null, null);
    }

    public static ResponseRecord of(String llmResponse, String evidence, List<BatchMetadataEntry> evidenceMetadata) {
        return new ResponseRecord(llmResponse, null, evidence, evidenceMetadata, null, null, null, null, null);
    }

    public ResponseRecord withInstruction(String newInstruction) {
        return new ResponseRecord(llmResponse, prompt, evidence, evidenceMetadata, biblio, batchId, usage,
                newInstruction, keyPoints);
    }

    /**
     * Copy with the response pre-segmented into key points, each compared separately.
     */
    public ResponseRecord withKeyPoints(List<String> newKeyPoints) {
        return new ResponseRecord(llmResponse, prompt, evidence, evidenceMetadata, biblio, batchId, usage,
                instruction, newKeyPoints);
    }

    @JsonProperty("llm_response")
    public String getLlmResponse() {
        return llmResponse;
    }

    @JsonProperty("prompt")
    public String getPrompt() {
        return prompt;
    }

    @JsonProperty("evidence")
    public String getEvidence() {
        return evidence;
    }

    @JsonProperty("evidence_metadata")
    public List<BatchMetadataEntry> getEvidenceMetadata() {
        return evidenceMetadata;
    }

    @JsonProperty("biblio")
    public Map<String, Set<Integer>> getBiblio() {
        return biblio;
    }

    @JsonProperty("batch_id")
    public Integer getBatchId() {
        return batchId;
    }

    @JsonProperty("usage")
    public Map<String, Object> getUsage() {
        return usage;
    }

    @JsonProperty("instruction")
    public String getInstruction() {
        return instruction;
    }

    @JsonProperty("key_points")
    public List<String> getKeyPoints() {
        return keyPoints;
    }
}
