package com.sourcecheck.verification.text;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Finds numeric literals and, optionally, spelled-out numbers in a tokenized text.
 * A literal directly followed by "percent" or "percentage" is scaled by 0.01, matching {@code 10%}.
 */
public final class NumberScanner {

    private static final String WORD_EDGE_NOISE = "$([{\"'“‘.,;:!?)]}\"'”’•";

    private NumberScanner() {
    }

    public static List<NumberMention> scan(TokenOffsetIndex index, boolean includeWordNumbers) {
        List<NumberMention> mentions = new ArrayList<>();
        List<TokenOffsetIndex.Token> tokens = index.getTokens();

        int i = 0;
        while (i < tokens.size()) {
            TokenOffsetIndex.Token token = tokens.get(i);
            Optional<BigDecimal> literal = NumberNormalizer.parse(token.getText());
            if (literal.isPresent()) {
                BigDecimal value = literal.get();
                int last = i;
                if (!token.getText().endsWith("%") && i + 1 < tokens.size()
                        && WordNumberParser.isPercentWord(bareWord(tokens.get(i + 1).getText()))) {
                    value = value.movePointLeft(2);
                    last = i + 1;
                }
                mentions.add(mention(index, value, i, last));
                i = last + 1;
                continue;
            }

            if (includeWordNumbers && WordNumberParser.isNumberWord(bareWord(token.getText()))) {
                int next = scanWordRun(index, i, mentions);
                i = next;
                continue;
            }
            i++;
        }
        return mentions;
    }

    /**
     * Consumes a run of number words starting at {@code start} and returns the index after it.
     */
    private static int scanWordRun(TokenOffsetIndex index, int start, List<NumberMention> mentions) {
        List<TokenOffsetIndex.Token> tokens = index.getTokens();
        List<String> words = new ArrayList<>();
        int last = start;
        int i = start;

        while (i < tokens.size()) {
            String raw = tokens.get(i).getText();
            String word = bareWord(raw);
            if (WordNumberParser.isNumberWord(word)) {
                words.add(word);
                last = i;
            } else if (WordNumberParser.isPercentWord(word)) {
                words.add(word);
                last = i;
                i++;
                break;
            } else if (!(WordNumberParser.isJoiner(word) && nextIsNumberWord(tokens, i))) {
                break;
            }
            i++;
            if (endsClause(raw)) {
                break;
            }
        }

        Optional<BigDecimal> value = WordNumberParser.parse(words);
        if (value.isPresent()) {
            mentions.add(mention(index, value.get(), start, last));
        }
        return Math.max(i, start + 1);
    }

    private static boolean nextIsNumberWord(List<TokenOffsetIndex.Token> tokens, int i) {
        return i + 1 < tokens.size() && WordNumberParser.isNumberWord(bareWord(tokens.get(i + 1).getText()));
    }

    private static boolean endsClause(String raw) {
        char lastChar = raw.charAt(raw.length() - 1);
        return !Character.isLetterOrDigit(lastChar);
    }

    private static NumberMention mention(TokenOffsetIndex index, BigDecimal value, int first, int last) {
        int startChar = index.get(first).getStart();
        int endChar = index.get(last).getEnd();
        return new NumberMention(value, first, last, startChar, endChar,
                index.getText().substring(startChar, endChar));
    }

    static String bareWord(String raw) {
        int start = 0;
        int end = raw.length();
        while (start < end && WORD_EDGE_NOISE.indexOf(raw.charAt(start)) >= 0) {
            start++;
        }
        while (end > start && WORD_EDGE_NOISE.indexOf(raw.charAt(end - 1)) >= 0) {
            end--;
        }
        return raw.substring(start, end);
    }
}
