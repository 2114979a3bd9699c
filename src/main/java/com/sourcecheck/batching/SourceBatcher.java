package com.sourcecheck.batching;

import com.sourcecheck.batching.model.Batch;
import com.sourcecheck.batching.model.PackagingResult;
import com.sourcecheck.batching.model.TextRecord;
import com.sourcecheck.tokenizer.ModelCard;
import com.sourcecheck.tokenizer.TokenAdapter;
import com.sourcecheck.tokenizer.TokenizerResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Packs retrieved text records into token-bounded batches for use as model context.
 * Packing is greedy and order-preserving: records are never reordered to save space,
 * so metadata and citations follow retrieval order.
 */
@Service
public class SourceBatcher {

    private static final Logger logger = LoggerFactory.getLogger(SourceBatcher.class);

    private final TokenizerResolver tokenizerResolver;
    private final TextRecordMapper textRecordMapper;
    private final int defaultContextWindowSize;
    private final String separator;
    private final String backupSourceName;

    public SourceBatcher(
            TokenizerResolver tokenizerResolver,
            TextRecordMapper textRecordMapper,
            @Value("${sourcecheck.batching.context-window-size:1000}") int defaultContextWindowSize,
            @Value("${sourcecheck.batching.separator:\n}") String separator,
            @Value("${sourcecheck.batching.backup-source-name:user_provided_unknown_source}") String backupSourceName) {
        if (defaultContextWindowSize <= 0) {
            throw new IllegalStateException(
                    "sourcecheck.batching.context-window-size must be positive, was " + defaultContextWindowSize);
        }
        this.tokenizerResolver = tokenizerResolver;
        this.textRecordMapper = textRecordMapper;
        this.defaultContextWindowSize = defaultContextWindowSize;
        this.separator = separator != null ? separator : "";
        this.backupSourceName = backupSourceName;
    }

    public SourceSession openSession() {
        return openSession(null, null);
    }

    /**
     * Opens a session bound to one tokenizer.
     *
     * @param modelCard model card providing tokenizer identifier and max input length, may be null
     * @param explicitTokenizer tokenizer supplied by the caller, takes precedence when not null
     * @return a new empty session
     */
    public SourceSession openSession(ModelCard modelCard, TokenAdapter explicitTokenizer) {
        TokenAdapter adapter = tokenizerResolver.resolve(explicitTokenizer, modelCard);
        int window = defaultContextWindowSize;
        if (modelCard != null && modelCard.getMaxInputLen() != null && modelCard.getMaxInputLen() > 0) {
            window = modelCard.getMaxInputLen();
        }
        logger.debug("Opened source session: tokenizer={}, window={}", adapter.name(), window);
        return new SourceSession(adapter, window);
    }

    public PackagingResult packageSource(List<TextRecord> records, SourceSession session, boolean aggregate) {
        return packageSource(records, session, aggregate, session.getContextWindowSize());
    }

    /**
     * Deduplicates, chunks and packs records into the session's source materials.
     *
     * @param records records in retrieval order
     * @param session session whose batches are extended
     * @param aggregate when true, the session's last batch is resumed and filled first
     * @param window token budget per batch for this call
     * @return the batches produced or continued by this call, with diagnostics
     */
    public PackagingResult packageSource(List<TextRecord> records, SourceSession session,
                                         boolean aggregate, int window) {
        if (records == null) {
            throw new IllegalArgumentException("records must not be null");
        }
        if (session == null) {
            throw new IllegalArgumentException("session must not be null");
        }
        if (window <= 0) {
            throw new IllegalArgumentException("window must be positive, was " + window);
        }

        TokenAdapter adapter = session.getTokenAdapter();

        int skipped = 0;
        LinkedHashSet<TextRecord> unique = new LinkedHashSet<>();
        for (TextRecord record : records) {
            if (record == null || record.getText() == null) {
                skipped++;
                logger.warn("Skipping text record without text: {}", record);
                continue;
            }
            unique.add(record);
        }
        int duplicates = records.size() - skipped - unique.size();

        if (unique.isEmpty()) {
            logger.info("No records to package: received={}, skipped={}", records.size(), skipped);
            return PackagingResult.empty(records.size(), skipped);
        }

        // each record is followed by the separator, so its tokens come out of every slice budget
        int sliceBudget = window - adapter.count(separator);
        if (sliceBudget <= 0) {
            throw new IllegalArgumentException("window " + window + " leaves no room beside the separator");
        }

        List<TextRecord> samples = new ArrayList<>();
        int chunked = 0;
        for (TextRecord record : unique) {
            List<Integer> ids = adapter.encode(record.getText());
            if (ids.size() >= sliceBudget) {
                chunked++;
                for (List<Integer> slice : sliceTokens(ids, sliceBudget)) {
                    samples.add(record.withText(adapter.decode(slice)));
                }
            } else {
                samples.add(record);
            }
        }

        BatchBuilder current;
        if (aggregate && session.getLastBatch().isPresent()) {
            current = BatchBuilder.resume(session.removeLastBatch(), adapter, separator);
        } else {
            current = BatchBuilder.start(session.getSourceMaterials().size(), adapter, separator);
        }

        List<Batch> produced = new ArrayList<>();
        for (TextRecord sample : samples) {
            int tokens = current.countWith(sample);
            if (!current.isEmpty() && !current.fits(tokens, window)) {
                Batch closed = current.build();
                session.addBatch(closed);
                produced.add(closed);
                current = BatchBuilder.start(closed.getId() + 1, adapter, separator);
                tokens = current.countWith(sample);
            }
            current.append(sample, tokens, sourceNameOf(sample));
        }

        if (!current.isEmpty()) {
            Batch last = current.build();
            session.addBatch(last);
            produced.add(last);
        }

        PackagingResult result = new PackagingResult(produced, records.size(), skipped, duplicates,
                chunked, samples.size());
        logger.info("Packaged sources: received={}, skipped={}, duplicates={}, chunked={}, packed={}, batches={}, tokensPerBatch={}",
                records.size(), skipped, duplicates, chunked, samples.size(),
                result.getBatchesCount(), result.getTokensPerBatch());
        return result;
    }

    /**
     * Maps raw retriever results and packages them with aggregation.
     */
    public PackagingResult addSourceQueryResults(SourceSession session, List<Map<String, Object>> rawResults) {
        List<TextRecord> records = textRecordMapper.toRecords(rawResults);
        PackagingResult result = packageSource(records, session, true);
        if (result.getRecordsPacked() == 0) {
            logger.warn("No query results were added to the source materials (received={})",
                    rawResults != null ? rawResults.size() : 0);
        }
        return result;
    }

    /**
     * Splits a token sequence into evenly sized contiguous slices, each strictly below the window.
     */
    static List<List<Integer>> sliceTokens(List<Integer> ids, int window) {
        int total = ids.size();
        int sliceCount = (total + window - 1) / window;
        while (ceilDiv(total, sliceCount) >= window) {
            sliceCount++;
        }
        int sliceSize = ceilDiv(total, sliceCount);

        List<List<Integer>> slices = new ArrayList<>();
        for (int start = 0; start < total; start += sliceSize) {
            slices.add(new ArrayList<>(ids.subList(start, Math.min(total, start + sliceSize))));
        }
        return slices;
    }

    private static int ceilDiv(int value, int divisor) {
        return (value + divisor - 1) / divisor;
    }

    private String sourceNameOf(TextRecord record) {
        return Objects.requireNonNullElse(record.getFileSource(), backupSourceName);
    }
}
