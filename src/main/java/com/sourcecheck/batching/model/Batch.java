package com.sourcecheck.batching.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * One token-bounded aggregation of text records, ready to be sent as model context.
 * Immutable; continuation of a partially filled batch goes through {@code BatchBuilder.resume}.
 */
public final class Batch {

    private final int id;
    private final String text;
    private final List<BatchMetadataEntry> metadata;
    private final Map<String, Set<Integer>> biblio;
    private final BatchStats stats;

    @JsonCreator
    public Batch(
            @JsonProperty("batch_id") int id,
            @JsonProperty("text") String text,
            @JsonProperty("metadata") List<BatchMetadataEntry> metadata,
            @JsonProperty("biblio") Map<String, Set<Integer>> biblio,
            @JsonProperty("batch_stats") BatchStats stats) {
        this.id = id;
        this.text = text != null ? text : "";
        this.metadata = metadata != null ? List.copyOf(metadata) : List.of();
        this.biblio = copyBiblio(biblio);
        this.stats = stats != null ? stats : new BatchStats(0, this.text.length(), this.metadata.size());
    }

    private static Map<String, Set<Integer>> copyBiblio(Map<String, Set<Integer>> biblio) {
        Map<String, Set<Integer>> copy = new LinkedHashMap<>();
        if (biblio != null) {
            biblio.forEach((source, pages) ->
                    copy.put(source, Collections.unmodifiableSet(new LinkedHashSet<>(pages))));
        }
        return Collections.unmodifiableMap(copy);
    }

    @JsonProperty("batch_id")
    public int getId() {
        return id;
    }

    @JsonProperty("text")
    public String getText() {
        return text;
    }

    @JsonProperty("metadata")
    public List<BatchMetadataEntry> getMetadata() {
        return metadata;
    }

    /**
     * Source name to the pages drawn from it, in first-seen order.
     */
    @JsonProperty("biblio")
    public Map<String, Set<Integer>> getBiblio() {
        return biblio;
    }

    @JsonProperty("batch_stats")
    public BatchStats getStats() {
        return stats;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Batch)) {
            return false;
        }
        Batch batch = (Batch) o;
        return id == batch.id
                && text.equals(batch.text)
                && metadata.equals(batch.metadata)
                && biblio.equals(batch.biblio)
                && stats.equals(batch.stats);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, text, metadata, biblio, stats);
    }

    @Override
    public String toString() {
        return "Batch{id=" + id + ", " + stats + ", sources=" + biblio.keySet() + "}";
    }
}
