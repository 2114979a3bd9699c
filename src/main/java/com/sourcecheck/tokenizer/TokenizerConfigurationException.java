package com.sourcecheck.tokenizer;

/**
 * Raised when no tokenizer can be resolved for a batching session.
 */
public class TokenizerConfigurationException extends RuntimeException {

    public TokenizerConfigurationException(String message) {
        super(message);
    }
}
