package com.sourcecheck.verification;

import com.sourcecheck.batching.model.BatchMetadataEntry;
import com.sourcecheck.verification.model.FactCheckEntry;
import com.sourcecheck.verification.model.FactStatus;
import com.sourcecheck.verification.model.ResponseRecord;
import com.sourcecheck.verification.text.NumberMention;
import com.sourcecheck.verification.text.NumberNormalizer;
import com.sourcecheck.verification.text.NumberScanner;
import com.sourcecheck.verification.text.TokenOffsetIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks every number in a response against the numbers in its evidence.
 * Evidence numbers include spelled-out forms, so "10%" is confirmed by "ten percent".
 */
@Service
public class NumberFactChecker {

    private static final Logger logger = LoggerFactory.getLogger(NumberFactChecker.class);
    private static final String ELLIPSIS = "...";

    private final int contextTokens;

    public NumberFactChecker(@Value("${sourcecheck.verification.fact-context-tokens:10}") int contextTokens) {
        if (contextTokens < 0) {
            throw new IllegalStateException(
                    "sourcecheck.verification.fact-context-tokens must not be negative, was " + contextTokens);
        }
        this.contextTokens = contextTokens;
    }

    public List<FactCheckEntry> check(ResponseRecord record) {
        List<NumberMention> responseNumbers;
        try {
            responseNumbers = NumberScanner.scan(TokenOffsetIndex.of(record.getLlmResponse()), false);
        } catch (RuntimeException e) {
            logger.warn("Could not extract numbers from response: {}", e.getMessage());
            return new ArrayList<>();
        }

        try {
            return confirm(responseNumbers, record);
        } catch (RuntimeException e) {
            logger.warn("Number fact check failed, reporting {} facts as not confirmed: {}",
                    responseNumbers.size(), e.getMessage());
            List<FactCheckEntry> conservative = new ArrayList<>();
            for (NumberMention number : responseNumbers) {
                conservative.add(FactCheckEntry.notConfirmed(factText(number),
                        number.getStartChar(), number.getEndChar()));
            }
            return conservative;
        }
    }

    private List<FactCheckEntry> confirm(List<NumberMention> responseNumbers, ResponseRecord record) {
        TokenOffsetIndex evidence = TokenOffsetIndex.of(record.getEvidence());
        List<NumberMention> evidenceNumbers = NumberScanner.scan(evidence, true);
        List<BatchMetadataEntry> metadata = record.getEvidenceMetadata();

        List<FactCheckEntry> facts = new ArrayList<>();
        for (NumberMention number : responseNumbers) {
            NumberMention match = null;
            for (NumberMention candidate : evidenceNumbers) {
                if (candidate.sameValue(number.getValue())) {
                    match = candidate;
                    break;
                }
            }

            String fact = factText(number);
            if (match == null) {
                facts.add(FactCheckEntry.notConfirmed(fact, number.getStartChar(), number.getEndChar()));
                continue;
            }

            BatchMetadataEntry location = locate(metadata, match.getStartChar());
            facts.add(new FactCheckEntry(fact, FactStatus.CONFIRMED, contextAround(evidence, match),
                    location != null ? location.getPageNum() : null,
                    location != null ? location.getSourceName() : "",
                    number.getStartChar(), number.getEndChar()));
        }

        logger.debug("Fact check: {} numbers in response, {} in evidence, {} confirmed",
                responseNumbers.size(), evidenceNumbers.size(),
                facts.stream().filter(FactCheckEntry::isConfirmed).count());
        return facts;
    }

    private String contextAround(TokenOffsetIndex evidence, NumberMention match) {
        int from = match.getFirstToken() - contextTokens;
        int to = match.getFirstToken() + contextTokens;
        return ELLIPSIS + " " + evidence.join(from, to) + " " + ELLIPSIS;
    }

    /**
     * Entry whose span contains the offset; the last entry when none does.
     */
    static BatchMetadataEntry locate(List<BatchMetadataEntry> metadata, int charOffset) {
        if (metadata == null || metadata.isEmpty()) {
            return null;
        }
        for (BatchMetadataEntry entry : metadata) {
            if (entry.contains(charOffset)) {
                return entry;
            }
        }
        return metadata.get(metadata.size() - 1);
    }

    private static String factText(NumberMention number) {
        String text = NumberNormalizer.stripTrailing(number.getText());
        return text.isEmpty() ? number.getText() : text;
    }
}
