package com.sourcecheck.verification;

import com.sourcecheck.llm.LanguageModel;

/**
 * Selects the not-found heuristics to run. Defaults: parse and evidence match on, model off.
 */
public final class NotFoundOptions {

    private final boolean parseResponse;
    private final boolean evidenceMatch;
    private final boolean askTheModel;
    private final Double threshold;
    private final LanguageModel languageModel;

    private NotFoundOptions(boolean parseResponse, boolean evidenceMatch, boolean askTheModel,
                            Double threshold, LanguageModel languageModel) {
        this.parseResponse = parseResponse;
        this.evidenceMatch = evidenceMatch;
        this.askTheModel = askTheModel;
        this.threshold = threshold;
        this.languageModel = languageModel;
    }

    public static NotFoundOptions defaults() {
        return new NotFoundOptions(true, true, false, null, null);
    }

    public NotFoundOptions withParseResponse(boolean enabled) {
        return new NotFoundOptions(enabled, evidenceMatch, askTheModel, threshold, languageModel);
    }

    public NotFoundOptions withEvidenceMatch(boolean enabled) {
        return new NotFoundOptions(parseResponse, enabled, askTheModel, threshold, languageModel);
    }

    public NotFoundOptions withAskTheModel(boolean enabled) {
        return new NotFoundOptions(parseResponse, evidenceMatch, enabled, threshold, languageModel);
    }

    /**
     * Enables self-classification with a specific model instead of the application's bean.
     */
    public NotFoundOptions withLanguageModel(LanguageModel model) {
        return new NotFoundOptions(parseResponse, evidenceMatch, true, threshold, model);
    }

    public NotFoundOptions withThreshold(double value) {
        return new NotFoundOptions(parseResponse, evidenceMatch, askTheModel, value, languageModel);
    }

    public boolean isParseResponse() {
        return parseResponse;
    }

    public boolean isEvidenceMatch() {
        return evidenceMatch;
    }

    public boolean isAskTheModel() {
        return askTheModel;
    }

    public Double getThreshold() {
        return threshold;
    }

    public LanguageModel getLanguageModel() {
        return languageModel;
    }
}
