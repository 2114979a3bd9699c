package com.sourcecheck.batching;

import com.sourcecheck.batching.model.Batch;
import com.sourcecheck.batching.model.BatchMetadataEntry;
import com.sourcecheck.batching.model.BatchStats;
import com.sourcecheck.batching.model.TextRecord;
import com.sourcecheck.tokenizer.TokenAdapter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * In-progress batch: running text, token count, char offset, metadata and biblio.
 * A builder is either started empty or resumed from the last batch of a session, so a later
 * packaging call can keep filling the space an earlier call left free.
 * The running token count is always the adapter's count of the running text, separators included.
 */
public class BatchBuilder {

    private final int batchId;
    private final TokenAdapter tokenAdapter;
    private final String separator;
    private final StringBuilder runningText;
    private final List<BatchMetadataEntry> metadata;
    private final Map<String, Set<Integer>> biblio;
    private int runningTokens;

    private BatchBuilder(int batchId, TokenAdapter tokenAdapter, String separator, String text, int tokens,
                         List<BatchMetadataEntry> metadata, Map<String, Set<Integer>> biblio) {
        this.batchId = batchId;
        this.tokenAdapter = tokenAdapter;
        this.separator = separator != null ? separator : "";
        this.runningText = new StringBuilder(text);
        this.runningTokens = tokens;
        this.metadata = metadata;
        this.biblio = biblio;
    }

    public static BatchBuilder start(int batchId, TokenAdapter tokenAdapter, String separator) {
        return new BatchBuilder(batchId, tokenAdapter, separator, "", 0, new ArrayList<>(), new LinkedHashMap<>());
    }

    /**
     * Restores the running state of a previously built batch, keeping its id.
     * The running token count is recounted from the batch text with the session's adapter.
     */
    public static BatchBuilder resume(Batch batch, TokenAdapter tokenAdapter, String separator) {
        Map<String, Set<Integer>> biblio = new LinkedHashMap<>();
        batch.getBiblio().forEach((source, pages) -> biblio.put(source, new LinkedHashSet<>(pages)));
        return new BatchBuilder(batch.getId(), tokenAdapter, separator, batch.getText(),
                tokenAdapter.count(batch.getText()),
                new ArrayList<>(batch.getMetadata()), biblio);
    }

    /**
     * Token count of the running text once {@code record} and its separator are appended.
     */
    public int countWith(TextRecord record) {
        return tokenAdapter.count(runningText + textOf(record) + separator);
    }

    /**
     * Whether a batch of {@code tokensWithRecord} tokens, as returned by {@link #countWith}, stays under the window.
     */
    public boolean fits(int tokensWithRecord, int window) {
        return tokensWithRecord < window;
    }

    public void append(TextRecord record, int tokensWithRecord, String sourceName) {
        int start = runningText.length();
        runningText.append(textOf(record)).append(separator);
        int stop = runningText.length();

        int pageNum = record.resolvedPageNum();
        metadata.add(new BatchMetadataEntry(metadata.size(), start, stop, sourceName,
                pageNum, record.resolvedDocId(), record.resolvedBlockId()));
        biblio.computeIfAbsent(sourceName, key -> new LinkedHashSet<>()).add(pageNum);
        runningTokens = tokensWithRecord;
    }

    public boolean isEmpty() {
        return metadata.isEmpty();
    }

    public int getBatchId() {
        return batchId;
    }

    public int getCharOffset() {
        return runningText.length();
    }

    public Batch build() {
        String text = runningText.toString();
        BatchStats stats = new BatchStats(runningTokens, text.length(), metadata.size());
        return new Batch(batchId, text, metadata, biblio, stats);
    }

    private static String textOf(TextRecord record) {
        return record.getText() != null ? record.getText() : "";
    }
}
