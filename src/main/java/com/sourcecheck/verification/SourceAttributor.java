package com.sourcecheck.verification;

import com.sourcecheck.batching.model.BatchMetadataEntry;
import com.sourcecheck.verification.model.ResponseRecord;
import com.sourcecheck.verification.model.SourceReviewEntry;
import com.sourcecheck.verification.text.StopWords;
import com.sourcecheck.verification.text.TokenOffsetIndex;
import com.sourcecheck.verification.text.WordTokenizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Ranks the evidence spans of a batch by how many response words they contain.
 */
@Service
public class SourceAttributor {

    private static final Logger logger = LoggerFactory.getLogger(SourceAttributor.class);

    private final WordTokenizer responseTokenizer;
    private final WordTokenizer evidenceTokenizer;
    private final double minThreshold;
    private final int minMatchCount;
    private final double conclusiveThreshold;
    private final int maxResults;
    private final int snippetRadius;

    public SourceAttributor(
            StopWords stopWords,
            @Value("${sourcecheck.verification.source-min-threshold:0.25}") double minThreshold,
            @Value("${sourcecheck.verification.source-min-match-count:3}") int minMatchCount,
            @Value("${sourcecheck.verification.source-conclusive-threshold:0.75}") double conclusiveThreshold,
            @Value("${sourcecheck.verification.source-max-results:3}") int maxResults,
            @Value("${sourcecheck.verification.snippet-radius:10}") int snippetRadius) {
        Thresholds.requireRatio("sourcecheck.verification.source-min-threshold", minThreshold);
        Thresholds.requireRatio("sourcecheck.verification.source-conclusive-threshold", conclusiveThreshold);
        if (maxResults <= 0) {
            throw new IllegalStateException("sourcecheck.verification.source-max-results must be positive, was " + maxResults);
        }
        this.responseTokenizer = WordTokenizer.builder(stopWords)
                .lowerCase(false)
                .removeStopWords(true)
                .removeOneLetter(true)
                .build();
        this.evidenceTokenizer = WordTokenizer.builder(stopWords)
                .lowerCase(false)
                .removeStopWords(false)
                .build();
        this.minThreshold = minThreshold;
        this.minMatchCount = minMatchCount;
        this.conclusiveThreshold = conclusiveThreshold;
        this.maxResults = maxResults;
        this.snippetRadius = snippetRadius;
    }

    public List<SourceReviewEntry> review(ResponseRecord record) {
        try {
            return rank(record);
        } catch (RuntimeException e) {
            logger.warn("Source review failed, returning no sources: {}", e.getMessage());
            return new ArrayList<>();
        }
    }

    private List<SourceReviewEntry> rank(ResponseRecord record) {
        List<WordTokenizer.Term> responseTerms = responseTokenizer.tokenize(record.getLlmResponse());
        if (responseTerms.isEmpty()) {
            return new ArrayList<>();
        }

        String evidence = record.getEvidence();
        List<Candidate> candidates = new ArrayList<>();
        for (BatchMetadataEntry entry : record.getEvidenceMetadata()) {
            int start = Math.max(0, Math.min(entry.getEvidenceStartChar(), evidence.length()));
            int stop = Math.max(start, Math.min(entry.getEvidenceStopChar(), evidence.length()));
            TokenOffsetIndex span = TokenOffsetIndex.of(evidence.substring(start, stop));
            List<WordTokenizer.Term> spanTerms = evidenceTokenizer.tokenize(span);

            List<Integer> matchedTokens = new ArrayList<>();
            for (WordTokenizer.Term term : responseTerms) {
                for (WordTokenizer.Term candidate : spanTerms) {
                    if (term.getText().equalsIgnoreCase(candidate.getText())) {
                        matchedTokens.add(candidate.getTokenIndex());
                        break;
                    }
                }
            }

            double score = (double) matchedTokens.size() / responseTerms.size();
            if (!matchedTokens.isEmpty() && (score > minThreshold || matchedTokens.size() > minMatchCount)) {
                candidates.add(new Candidate(entry, score, matchedTokens, span));
            }
        }

        candidates.sort(Comparator.comparingDouble((Candidate c) -> c.score).reversed());

        List<SourceReviewEntry> sources = new ArrayList<>();
        Set<String> snippets = new HashSet<>();
        for (int i = 0; i < Math.min(maxResults, candidates.size()); i++) {
            Candidate candidate = candidates.get(i);
            String snippet = snippet(candidate);
            if (snippets.add(snippet)) {
                BatchMetadataEntry entry = candidate.entry;
                sources.add(new SourceReviewEntry(snippet, candidate.score, entry.getSourceName(),
                        entry.getPageNum(), entry.getDocId(), entry.getBlockId()));
            }
            if (candidate.score > conclusiveThreshold) {
                break;
            }
        }

        logger.debug("Source review: {} response terms, {} candidate spans, {} sources reported",
                responseTerms.size(), candidates.size(), sources.size());
        return sources;
    }

    private String snippet(Candidate candidate) {
        int median = median(candidate.matchedTokens);
        return candidate.span.join(median - snippetRadius, median + snippetRadius);
    }

    /**
     * Median token index; for an even count, the floor of the mean of the two middle values.
     */
    static int median(List<Integer> indexes) {
        List<Integer> sorted = new ArrayList<>(indexes);
        sorted.sort(Integer::compare);
        int mid = sorted.size() / 2;
        if (sorted.size() % 2 == 1) {
            return sorted.get(mid);
        }
        return (sorted.get(mid - 1) + sorted.get(mid)) / 2;
    }

    private static final class Candidate {
        private final BatchMetadataEntry entry;
        private final double score;
        private final List<Integer> matchedTokens;
        private final TokenOffsetIndex span;

        private Candidate(BatchMetadataEntry entry, double score, List<Integer> matchedTokens, TokenOffsetIndex span) {
            this.entry = entry;
            this.score = score;
            this.matchedTokens = matchedTokens;
            this.span = span;
        }
    }
}
