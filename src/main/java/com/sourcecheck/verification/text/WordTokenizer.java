package com.sourcecheck.verification.text;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Whole-word tokenizer with optional filters, applied in order: punctuation, case, stopwords,
 * one-letter tokens. Each term keeps the index of the whitespace token it came from.
 */
public final class WordTokenizer {

    private static final String PUNCTUATION = "-,'/:.?%[]–";

    private final StopWords stopWords;
    private final boolean lowerCase;
    private final boolean removePunctuation;
    private final boolean removeStopWords;
    private final boolean removeOneLetter;

    private WordTokenizer(Builder builder) {
        this.stopWords = builder.stopWords;
        this.lowerCase = builder.lowerCase;
        this.removePunctuation = builder.removePunctuation;
        this.removeStopWords = builder.removeStopWords;
        this.removeOneLetter = builder.removeOneLetter;
    }

    public static Builder builder(StopWords stopWords) {
        return new Builder(stopWords);
    }

    public List<Term> tokenize(TokenOffsetIndex index) {
        List<Term> terms = new ArrayList<>();
        for (int i = 0; i < index.size(); i++) {
            String word = index.get(i).getText();
            if (removePunctuation) {
                word = stripPunctuation(word);
                if (word.isEmpty()) {
                    continue;
                }
            }
            if (lowerCase) {
                word = word.toLowerCase(Locale.ROOT);
            }
            if (removeStopWords && stopWords.contains(word)) {
                continue;
            }
            if (removeOneLetter && word.length() <= 1) {
                continue;
            }
            terms.add(new Term(word, i));
        }
        return terms;
    }

    public List<Term> tokenize(String text) {
        return tokenize(TokenOffsetIndex.of(text));
    }

    private static String stripPunctuation(String word) {
        StringBuilder sb = new StringBuilder(word.length());
        for (int i = 0; i < word.length(); i++) {
            char c = word.charAt(i);
            if (PUNCTUATION.indexOf(c) < 0) {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    public static final class Term {
        private final String text;
        private final int tokenIndex;

        public Term(String text, int tokenIndex) {
            this.text = text;
            this.tokenIndex = tokenIndex;
        }

        public String getText() {
            return text;
        }

        /**
         * Position of the source token in the {@link TokenOffsetIndex} this term was read from.
         */
        public int getTokenIndex() {
            return tokenIndex;
        }

        @Override
        public String toString() {
            return text;
        }
    }

    public static final class Builder {
        private final StopWords stopWords;
        private boolean lowerCase = true;
        private boolean removePunctuation = true;
        private boolean removeStopWords = true;
        private boolean removeOneLetter;

        private Builder(StopWords stopWords) {
            this.stopWords = stopWords;
        }

        public Builder lowerCase(boolean value) {
            this.lowerCase = value;
            return this;
        }

        public Builder removePunctuation(boolean value) {
            this.removePunctuation = value;
            return this;
        }

        public Builder removeStopWords(boolean value) {
            this.removeStopWords = value;
            return this;
        }

        public Builder removeOneLetter(boolean value) {
            this.removeOneLetter = value;
            return this;
        }

        public WordTokenizer build() {
            if (removeStopWords && stopWords == null) {
                throw new IllegalStateException("Stopword filtering requires a stopword list");
            }
            return new WordTokenizer(this);
        }
    }
}
