package com.sourcecheck.verification.text;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Whitespace tokens of a text with their character offsets, built once per text.
 * Snippets and metadata lookups read offsets from here instead of re-splitting the text.
 */
public final class TokenOffsetIndex {

    private static final Pattern NON_WHITESPACE = Pattern.compile("\\S+");

    private final String text;
    private final List<Token> tokens;

    private TokenOffsetIndex(String text, List<Token> tokens) {
        this.text = text;
        this.tokens = Collections.unmodifiableList(tokens);
    }

    public static TokenOffsetIndex of(String text) {
        String source = text != null ? text : "";
        List<Token> tokens = new ArrayList<>();
        Matcher matcher = NON_WHITESPACE.matcher(source);
        while (matcher.find()) {
            tokens.add(new Token(matcher.group(), matcher.start(), matcher.end()));
        }
        return new TokenOffsetIndex(source, tokens);
    }

    public String getText() {
        return text;
    }

    public List<Token> getTokens() {
        return tokens;
    }

    public int size() {
        return tokens.size();
    }

    public Token get(int index) {
        return tokens.get(index);
    }

    /**
     * Joins tokens in {@code [from, to)} with single spaces; bounds are clamped to the index.
     */
    public String join(int from, int to) {
        int start = Math.max(0, from);
        int stop = Math.min(tokens.size(), to);
        StringBuilder sb = new StringBuilder();
        for (int i = start; i < stop; i++) {
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(tokens.get(i).getText());
        }
        return sb.toString();
    }

    public static final class Token {
        private final String text;
        private final int start;
        private final int end;

        public Token(String text, int start, int end) {
            this.text = text;
            this.start = start;
            this.end = end;
        }

        public String getText() {
            return text;
        }

        public int getStart() {
            return start;
        }

        public int getEnd() {
            return end;
        }

        @Override
        public String toString() {
            return text + "@" + start;
        }
    }
}
