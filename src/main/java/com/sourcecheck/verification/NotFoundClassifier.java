package com.sourcecheck.verification;

import com.sourcecheck.llm.LanguageModel;
import com.sourcecheck.llm.LanguageModelResponse;
import com.sourcecheck.llm.NotFoundPrompts;
import com.sourcecheck.verification.model.ComparisonStats;
import com.sourcecheck.verification.model.NotFoundClassification;
import com.sourcecheck.verification.model.NotFoundResult;
import com.sourcecheck.verification.model.ResponseRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeoutException;
import java.util.regex.Pattern;

/**
 * Decides whether a response should be treated as "no supported answer found".
 * Heuristics that run and disagree yield {@link NotFoundClassification#UNDETERMINED}.
 */
@Service
public class NotFoundClassifier {

    private static final Logger logger = LoggerFactory.getLogger(NotFoundClassifier.class);
    private static final Pattern CLEANUP = Pattern.compile("[;!?•(),.\\n\\r\\t]");
    private static final String NOT_FOUND_PREFIX = "not found";
    private static final String YES_NO_INSTRUCTION = "yes_no";

    private final TokenComparator tokenComparator;
    private final LanguageModel languageModel;
    private final double defaultThreshold;

    public NotFoundClassifier(
            TokenComparator tokenComparator,
            @Autowired(required = false) LanguageModel languageModel,
            @Value("${sourcecheck.verification.not-found-threshold:0.25}") double defaultThreshold) {
        Thresholds.requireRatio("sourcecheck.verification.not-found-threshold", defaultThreshold);
        this.tokenComparator = tokenComparator;
        this.languageModel = languageModel;
        this.defaultThreshold = defaultThreshold;
    }

    public NotFoundResult classify(ResponseRecord record) {
        return classify(record, NotFoundOptions.defaults(), null);
    }

    public NotFoundResult classify(ResponseRecord record, NotFoundOptions options) {
        return classify(record, options, null);
    }

    /**
     * @param comparisonStats stats already computed for this record, recomputed when null
     */
    public NotFoundResult classify(ResponseRecord record, NotFoundOptions options, ComparisonStats comparisonStats) {
        String cleaned = clean(record.getLlmResponse());

        Boolean parsed = null;
        if (options.isParseResponse()) {
            parsed = parseLlmResponse(cleaned);
            if (cleaned.isEmpty()) {
                // an empty answer is not-found whatever the other heuristics say
                return new NotFoundResult(parsed, null, null, NotFoundClassification.NOT_FOUND);
            }
        }

        Boolean evidence = null;
        if (options.isEvidenceMatch()) {
            double threshold = options.getThreshold() != null ? options.getThreshold() : defaultThreshold;
            evidence = evidenceMatch(record, cleaned, comparisonStats, threshold);
        }

        Boolean model = null;
        if (options.isAskTheModel()) {
            model = askTheModel(record, options.getLanguageModel() != null ? options.getLanguageModel() : languageModel);
        }

        Set<Boolean> outcomes = new LinkedHashSet<>();
        for (Boolean outcome : new Boolean[]{parsed, evidence, model}) {
            if (outcome != null) {
                outcomes.add(outcome);
            }
        }

        NotFoundClassification classification;
        if (outcomes.isEmpty()) {
            logger.warn("No not-found heuristic produced a result, classification is undetermined");
            classification = NotFoundClassification.UNDETERMINED;
        } else if (outcomes.size() == 1) {
            classification = NotFoundClassification.of(outcomes.iterator().next());
        } else {
            classification = NotFoundClassification.UNDETERMINED;
        }

        NotFoundResult result = new NotFoundResult(parsed, evidence, model, classification);
        logger.debug("Not-found classification: {}", result);
        return result;
    }

    private boolean parseLlmResponse(String cleaned) {
        return cleaned.isEmpty() || cleaned.startsWith(NOT_FOUND_PREFIX);
    }

    private boolean evidenceMatch(ResponseRecord record, String cleaned, ComparisonStats stats, double threshold) {
        // yes/no answers rarely share words with the evidence
        if ("yes".equals(cleaned) || "no".equals(cleaned)) {
            return false;
        }
        if (YES_NO_INSTRUCTION.equals(record.getInstruction())
                && (cleaned.startsWith("yes") || cleaned.startsWith("no"))) {
            return false;
        }
        ComparisonStats effective = stats != null ? stats : tokenComparator.compare(record);
        return effective.getVerifiedTokenMatchRatio() < threshold;
    }

    /**
     * @return the model's verdict, or null when no model is available or the call failed
     */
    private Boolean askTheModel(ResponseRecord record, LanguageModel model) {
        if (model == null) {
            logger.warn("Self-classification requested but no language model is configured");
            return null;
        }
        LanguageModelResponse reply;
        try {
            reply = model.infer(NotFoundPrompts.classifierInstruction(),
                    NotFoundPrompts.classifierContext(record.getLlmResponse()), Map.of());
        } catch (IOException | TimeoutException e) {
            logger.warn("Self-classification call failed: {}", e.getMessage());
            return null;
        } catch (RuntimeException e) {
            logger.warn("Self-classification call failed unexpectedly", e);
            return null;
        }

        String answer = clean(reply.getLlmResponse());
        if (answer.startsWith("yes")) {
            return true;
        }
        if (!answer.startsWith("no")) {
            logger.debug("Inconclusive self-classification reply '{}', treating as found", answer);
        }
        return false;
    }

    static String clean(String response) {
        if (response == null) {
            return "";
        }
        return CLEANUP.matcher(response).replaceAll("").trim().toLowerCase(Locale.ROOT);
    }
}
