package com.sourcecheck.llm;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Model inference collaborator. Callers send {@code Batch.text} as context and pass the
 * response back for verification; the verifier only calls it for not-found self-classification.
 */
public interface LanguageModel {

    /**
     * Runs one completion.
     *
     * @param prompt question or instruction
     * @param context evidence text, may be empty
     * @param samplingParams implementation specific sampling settings, may be empty
     * @return the model's answer and usage counters
     * @throws IOException on transport or provider errors
     * @throws TimeoutException when the call exceeds the implementation's deadline
     */
    LanguageModelResponse infer(String prompt, String context, Map<String, Object> samplingParams)
            throws IOException, TimeoutException;
}
