package com.sourcecheck.tokenizer;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Test tokenizer: one token per whitespace-separated word, so counts are exact.
 * Decoding joins words with single spaces.
 */
public class WhitespaceTokenAdapter implements TokenAdapter {

    private final Map<String, Integer> vocabulary = new HashMap<>();
    private final List<String> words = new ArrayList<>();

    @Override
    public int count(String text) {
        return split(text).length;
    }

    @Override
    public List<Integer> encode(String text) {
        List<Integer> ids = new ArrayList<>();
        for (String word : split(text)) {
            ids.add(vocabulary.computeIfAbsent(word, key -> {
                words.add(key);
                return words.size() - 1;
            }));
        }
        return ids;
    }

    @Override
    public String decode(List<Integer> tokenIds) {
        List<String> decoded = new ArrayList<>();
        for (Integer id : tokenIds) {
            decoded.add(words.get(id));
        }
        return String.join(" ", decoded);
    }

    @Override
    public String name() {
        return "whitespace";
    }

    private static String[] split(String text) {
        if (text == null || text.isBlank()) {
            return new String[0];
        }
        return text.trim().split("\\s+");
    }
}
