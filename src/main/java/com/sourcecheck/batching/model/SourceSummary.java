package com.sourcecheck.batching.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;
import java.util.Set;

/**
 * Bibliographic view of one batch in a session: id, stats and the pages drawn from each source.
 */
public final class SourceSummary {

    private final int batchId;
    private final BatchStats stats;
    private final Map<String, Set<Integer>> biblio;

    public SourceSummary(int batchId, BatchStats stats, Map<String, Set<Integer>> biblio) {
        this.batchId = batchId;
        this.stats = stats;
        this.biblio = biblio;
    }

    public static SourceSummary of(Batch batch) {
        return new SourceSummary(batch.getId(), batch.getStats(), batch.getBiblio());
    }

    @JsonProperty("batch_id")
    public int getBatchId() {
        return batchId;
    }

    @JsonProperty("batch_stats")
    public BatchStats getStats() {
        return stats;
    }

    @JsonProperty("biblio")
    public Map<String, Set<Integer>> getBiblio() {
        return biblio;
    }
}
