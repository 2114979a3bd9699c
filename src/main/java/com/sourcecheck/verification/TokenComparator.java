package com.sourcecheck.verification;

import com.sourcecheck.verification.model.ComparisonStats;
import com.sourcecheck.verification.model.KeyPointResult;
import com.sourcecheck.verification.model.ResponseRecord;
import com.sourcecheck.verification.text.NumberMention;
import com.sourcecheck.verification.text.NumberNormalizer;
import com.sourcecheck.verification.text.NumberScanner;
import com.sourcecheck.verification.text.StopWords;
import com.sourcecheck.verification.text.TokenOffsetIndex;
import com.sourcecheck.verification.text.WordTokenizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Measures the share of response words found verbatim, or as an equal number, in the evidence.
 * Spelled-out evidence numbers count, so "20" is verified by "twenty".
 */
@Service
public class TokenComparator {

    private static final Logger logger = LoggerFactory.getLogger(TokenComparator.class);
    private static final Pattern NOISE = Pattern.compile("[(),;$\"“”•\\n\\r\\t]");
    private static final Pattern TRAILING_SENTENCE_MARK = Pattern.compile("[.:!?]+$");

    private final WordTokenizer tokenizer;

    public TokenComparator(StopWords stopWords) {
        this.tokenizer = WordTokenizer.builder(stopWords)
                .lowerCase(true)
                .removePunctuation(false)
                .removeStopWords(true)
                .removeOneLetter(true)
                .build();
    }

    public ComparisonStats compare(ResponseRecord record) {
        try {
            return compareKeyPoints(record);
        } catch (RuntimeException e) {
            logger.warn("Token comparison failed, returning zeroed stats: {}", e.getMessage());
            return ComparisonStats.empty();
        }
    }

    private ComparisonStats compareKeyPoints(ResponseRecord record) {
        List<String> keyPoints = record.getKeyPoints();
        if (keyPoints == null || keyPoints.isEmpty()) {
            keyPoints = List.of(record.getLlmResponse());
        }

        Set<String> evidenceWords = new HashSet<>();
        for (WordTokenizer.Term term : tokenizer.tokenize(record.getEvidence())) {
            String word = clean(term.getText());
            if (!word.isEmpty()) {
                evidenceWords.add(word);
            }
        }
        List<BigDecimal> evidenceNumbers = null;

        List<String> confirmed = new ArrayList<>();
        List<String> unconfirmed = new ArrayList<>();
        List<KeyPointResult> keyPointResults = new ArrayList<>();
        int totalTokens = 0;

        for (String keyPoint : keyPoints) {
            List<String> words = new ArrayList<>();
            for (WordTokenizer.Term term : tokenizer.tokenize(keyPoint)) {
                String word = clean(term.getText());
                if (!word.isEmpty()) {
                    words.add(word);
                }
            }
            if (words.isEmpty()) {
                continue;
            }

            int confirmedInPoint = 0;
            List<String> unmatched = new ArrayList<>();
            for (String word : words) {
                boolean match = evidenceWords.contains(word);
                Optional<BigDecimal> number = NumberNormalizer.parse(word);
                if (!match && number.isPresent()) {
                    if (evidenceNumbers == null) {
                        evidenceNumbers = evidenceNumbers(record.getEvidence());
                    }
                    match = containsValue(evidenceNumbers, number.get());
                }

                if (match) {
                    confirmed.add(word);
                    confirmedInPoint++;
                } else if (!unmatched.contains(word)) {
                    unmatched.add(word);
                }
            }

            keyPointResults.add(new KeyPointResult(keyPoint, keyPointResults.size(),
                    (double) confirmedInPoint / words.size()));
            unconfirmed.addAll(unmatched);
            totalTokens += words.size();
        }

        double ratio = 0.0;
        if (totalTokens > 0) {
            ratio = Math.min(1.0, (double) confirmed.size() / totalTokens);
        }

        logger.debug("Token comparison: {} response tokens, {} confirmed, ratio={}", totalTokens, confirmed.size(), ratio);
        return new ComparisonStats(confirmed, unconfirmed, ratio, keyPointResults);
    }

    private static List<BigDecimal> evidenceNumbers(String evidence) {
        List<BigDecimal> values = new ArrayList<>();
        for (NumberMention mention : NumberScanner.scan(TokenOffsetIndex.of(evidence), true)) {
            values.add(mention.getValue());
        }
        return values;
    }

    private static boolean containsValue(List<BigDecimal> values, BigDecimal value) {
        for (BigDecimal candidate : values) {
            if (candidate.compareTo(value) == 0) {
                return true;
            }
        }
        return false;
    }

    /**
     * Drops trailing sentence marks, then brackets, commas, quotes, currency signs and bullets.
     */
    static String clean(String word) {
        String stripped = TRAILING_SENTENCE_MARK.matcher(word).replaceAll("");
        return NOISE.matcher(stripped).replaceAll("");
    }
}
