package com.sourcecheck.batching.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Outcome of one packaging call: the batches it produced or continued, plus diagnostics.
 */
public final class PackagingResult {

    private final List<Batch> batches;
    private final int recordsReceived;
    private final int recordsSkipped;
    private final int duplicatesRemoved;
    private final int recordsChunked;
    private final int recordsPacked;

    public PackagingResult(List<Batch> batches, int recordsReceived, int recordsSkipped,
                           int duplicatesRemoved, int recordsChunked, int recordsPacked) {
        this.batches = List.copyOf(batches);
        this.recordsReceived = recordsReceived;
        this.recordsSkipped = recordsSkipped;
        this.duplicatesRemoved = duplicatesRemoved;
        this.recordsChunked = recordsChunked;
        this.recordsPacked = recordsPacked;
    }

    public static PackagingResult empty(int recordsReceived, int recordsSkipped) {
        return new PackagingResult(List.of(), recordsReceived, recordsSkipped, 0, 0, 0);
    }

    @JsonProperty("batches")
    public List<Batch> getBatches() {
        return batches;
    }

    @JsonProperty("batches_count")
    public int getBatchesCount() {
        return batches.size();
    }

    @JsonProperty("text_batch")
    public List<String> getTextBatches() {
        return batches.stream().map(Batch::getText).toList();
    }

    @JsonProperty("tokens_per_batch")
    public List<Integer> getTokensPerBatch() {
        return batches.stream().map(b -> b.getStats().getTokens()).toList();
    }

    @JsonProperty("samples_per_batch")
    public List<Integer> getSamplesPerBatch() {
        return batches.stream().map(b -> b.getStats().getSamples()).toList();
    }

    @JsonProperty("records_received")
    public int getRecordsReceived() {
        return recordsReceived;
    }

    @JsonProperty("records_skipped")
    public int getRecordsSkipped() {
        return recordsSkipped;
    }

    @JsonProperty("duplicates_removed")
    public int getDuplicatesRemoved() {
        return duplicatesRemoved;
    }

    /**
     * Number of oversized input records that were split into token slices.
     */
    @JsonProperty("records_chunked")
    public int getRecordsChunked() {
        return recordsChunked;
    }

    /**
     * Records packed by this call after deduplication and chunking.
     */
    @JsonProperty("records_packed")
    public int getRecordsPacked() {
        return recordsPacked;
    }
}
