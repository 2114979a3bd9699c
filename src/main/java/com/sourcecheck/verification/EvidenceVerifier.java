package com.sourcecheck.verification;

import com.sourcecheck.verification.model.ComparisonStats;
import com.sourcecheck.verification.model.FactCheckEntry;
import com.sourcecheck.verification.model.NotFoundResult;
import com.sourcecheck.verification.model.ResponseRecord;
import com.sourcecheck.verification.model.SourceReviewEntry;
import com.sourcecheck.verification.model.VerificationReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Entry point for checking model answers against the evidence they were generated from.
 * Verification is best-effort post-processing and never fails the caller's pipeline.
 */
@Service
public class EvidenceVerifier {

    private static final Logger logger = LoggerFactory.getLogger(EvidenceVerifier.class);

    private final NumberFactChecker numberFactChecker;
    private final SourceAttributor sourceAttributor;
    private final TokenComparator tokenComparator;
    private final NotFoundClassifier notFoundClassifier;

    public EvidenceVerifier(NumberFactChecker numberFactChecker,
                            SourceAttributor sourceAttributor,
                            TokenComparator tokenComparator,
                            NotFoundClassifier notFoundClassifier) {
        this.numberFactChecker = numberFactChecker;
        this.sourceAttributor = sourceAttributor;
        this.tokenComparator = tokenComparator;
        this.notFoundClassifier = notFoundClassifier;
    }

    /**
     * Runs the selected analyses over one response.
     *
     * @param record response with its evidence and metadata
     * @param options analyses to run
     * @return report carrying the response and one result per analysis that ran
     */
    public VerificationReport review(ResponseRecord record, ReviewOptions options) {
        if (record == null) {
            throw new IllegalArgumentException("record must not be null");
        }

        ComparisonStats stats = options.isComparisonStats() ? tokenComparator.compare(record) : null;
        List<FactCheckEntry> facts = options.isReviewNumbers() ? numberFactChecker.check(record) : null;
        List<SourceReviewEntry> sources = options.isSourceReview() ? sourceAttributor.review(record) : null;

        String markup = null;
        if (options.isAddMarkup() && facts != null) {
            markup = FactCheckMarkup.apply(record.getLlmResponse(), facts);
        }

        logger.debug("Reviewed response for batch {}: facts={}, sources={}, ratio={}",
                record.getBatchId(),
                facts != null ? facts.size() : "-",
                sources != null ? sources.size() : "-",
                stats != null ? stats.getPercentDisplay() : "-");
        return new VerificationReport(record, facts, sources, stats, markup);
    }

    public VerificationReport review(ResponseRecord record) {
        return review(record, ReviewOptions.all());
    }

    public List<VerificationReport> evidenceCheckNumbers(List<ResponseRecord> records) {
        return reviewAll(records, ReviewOptions.numbersOnly());
    }

    public List<VerificationReport> evidenceCheckSources(List<ResponseRecord> records) {
        return reviewAll(records, ReviewOptions.sourcesOnly());
    }

    public List<VerificationReport> evidenceComparisonStats(List<ResponseRecord> records) {
        return reviewAll(records, ReviewOptions.comparisonOnly());
    }

    public List<NotFoundResult> classifyNotFound(List<ResponseRecord> records, NotFoundOptions options) {
        List<NotFoundResult> results = new ArrayList<>();
        for (ResponseRecord record : requireRecords(records)) {
            results.add(notFoundClassifier.classify(record, options));
        }
        return results;
    }

    private List<VerificationReport> reviewAll(List<ResponseRecord> records, ReviewOptions options) {
        List<VerificationReport> reports = new ArrayList<>();
        for (ResponseRecord record : requireRecords(records)) {
            reports.add(review(record, options));
        }
        return reports;
    }

    private static List<ResponseRecord> requireRecords(List<ResponseRecord> records) {
        if (records == null) {
            throw new IllegalArgumentException("records must not be null");
        }
        return records;
    }
}
