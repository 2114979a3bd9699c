package com.sourcecheck.verification.text;

import java.math.BigDecimal;

/**
 * A number found in a text, with the token range and character span it was read from.
 */
public final class NumberMention {

    private final BigDecimal value;
    private final int firstToken;
    private final int lastToken;
    private final int startChar;
    private final int endChar;
    private final String text;

    public NumberMention(BigDecimal value, int firstToken, int lastToken, int startChar, int endChar, String text) {
        this.value = value;
        this.firstToken = firstToken;
        this.lastToken = lastToken;
        this.startChar = startChar;
        this.endChar = endChar;
        this.text = text;
    }

    public BigDecimal getValue() {
        return value;
    }

    public int getFirstToken() {
        return firstToken;
    }

    public int getLastToken() {
        return lastToken;
    }

    public int getStartChar() {
        return startChar;
    }

    public int getEndChar() {
        return endChar;
    }

    public String getText() {
        return text;
    }

    public boolean sameValue(BigDecimal other) {
        return other != null && value.compareTo(other) == 0;
    }

    @Override
    public String toString() {
        return text + "=" + value.toPlainString();
    }
}
