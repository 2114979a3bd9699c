package com.sourcecheck.batching;

import com.sourcecheck.batching.model.Batch;
import com.sourcecheck.batching.model.SourceSummary;
import com.sourcecheck.tokenizer.TokenAdapter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Caller-owned source materials of one question/answer session.
 * Holds the tokenizer every packaging call of the session must use.
 * Not thread-safe: packaging replaces the last batch in place.
 */
public class SourceSession {

    private final TokenAdapter tokenAdapter;
    private final int contextWindowSize;
    private final List<Batch> sourceMaterials = new ArrayList<>();

    public SourceSession(TokenAdapter tokenAdapter, int contextWindowSize) {
        if (tokenAdapter == null) {
            throw new IllegalArgumentException("tokenAdapter must not be null");
        }
        if (contextWindowSize <= 0) {
            throw new IllegalArgumentException("contextWindowSize must be positive, was " + contextWindowSize);
        }
        this.tokenAdapter = tokenAdapter;
        this.contextWindowSize = contextWindowSize;
    }

    public TokenAdapter getTokenAdapter() {
        return tokenAdapter;
    }

    public int getContextWindowSize() {
        return contextWindowSize;
    }

    public List<Batch> getSourceMaterials() {
        return Collections.unmodifiableList(sourceMaterials);
    }

    public Optional<Batch> getLastBatch() {
        if (sourceMaterials.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(sourceMaterials.get(sourceMaterials.size() - 1));
    }

    public void clearSourceMaterials() {
        sourceMaterials.clear();
    }

    public List<SourceSummary> reviewSourcesSummary() {
        List<SourceSummary> summary = new ArrayList<>();
        for (Batch batch : sourceMaterials) {
            summary.add(SourceSummary.of(batch));
        }
        return summary;
    }

    public boolean isSourceMaterialAttached() {
        for (Batch batch : sourceMaterials) {
            if (!batch.getText().isEmpty()) {
                return true;
            }
        }
        return false;
    }

    Batch removeLastBatch() {
        return sourceMaterials.remove(sourceMaterials.size() - 1);
    }

    void addBatch(Batch batch) {
        sourceMaterials.add(batch);
    }
}
