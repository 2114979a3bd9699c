package com.sourcecheck.llm;

/**
 * Prompt used to ask a model whether an answer is a "not found" response.
 */
public final class NotFoundPrompts {

    static final String EXAMPLES = "Here are several examples of a 'not found' response: "
            + "Not Found \n The text does not provide an answer. \n The answer is not clear. \n "
            + "Sorry, I could not find a definitive answer. \n "
            + "The answer is not provided in the information given. \n "
            + "The text does not specify the answer to this question. \n";

    static final String NEW_EXAMPLE = "Here is a new example: ";

    static final String INSTRUCTION =
            "Please respond 'Yes' or 'No' if this new example is a 'Not Found' response.";

    private NotFoundPrompts() {
    }

    /**
     * Context block carrying the examples followed by the answer under review.
     */
    public static String classifierContext(String llmResponse) {
        return EXAMPLES + NEW_EXAMPLE + (llmResponse != null ? llmResponse : "");
    }

    public static String classifierInstruction() {
        return INSTRUCTION;
    }
}
