package com.sourcecheck.verification.text;

import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Converts spelled-out English numbers ("two hundred and five", "twenty-five", "ten percent") to values.
 */
public final class WordNumberParser {

    private static final Map<String, Integer> UNITS = Map.ofEntries(
            Map.entry("zero", 0), Map.entry("one", 1), Map.entry("two", 2), Map.entry("three", 3),
            Map.entry("four", 4), Map.entry("five", 5), Map.entry("six", 6), Map.entry("seven", 7),
            Map.entry("eight", 8), Map.entry("nine", 9), Map.entry("ten", 10), Map.entry("eleven", 11),
            Map.entry("twelve", 12), Map.entry("thirteen", 13), Map.entry("fourteen", 14),
            Map.entry("fifteen", 15), Map.entry("sixteen", 16), Map.entry("seventeen", 17),
            Map.entry("eighteen", 18), Map.entry("nineteen", 19), Map.entry("twenty", 20),
            Map.entry("thirty", 30), Map.entry("forty", 40), Map.entry("fifty", 50), Map.entry("sixty", 60),
            Map.entry("seventy", 70), Map.entry("eighty", 80), Map.entry("ninety", 90));

    private static final Map<String, Long> SCALES = Map.of(
            "thousand", 1_000L, "million", 1_000_000L, "billion", 1_000_000_000L);

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private static final Set<String> JOINERS = Set.of("and", "plus");
    private static final Set<String> PERCENT_WORDS = Set.of("percent", "percentage");

    private WordNumberParser() {
    }

    /**
     * True for words that carry a value: units, tens, hundred and the large scales.
     * Hyphenated compounds count when every part does.
     */
    public static boolean isNumberWord(String word) {
        String lower = word.toLowerCase(Locale.ROOT);
        if (lower.indexOf('-') > 0) {
            for (String part : lower.split("-")) {
                if (part.isEmpty() || !isSimpleNumberWord(part)) {
                    return false;
                }
            }
            return true;
        }
        return isSimpleNumberWord(lower);
    }

    public static boolean isJoiner(String word) {
        return JOINERS.contains(word.toLowerCase(Locale.ROOT));
    }

    public static boolean isPercentWord(String word) {
        return PERCENT_WORDS.contains(word.toLowerCase(Locale.ROOT));
    }

    private static boolean isSimpleNumberWord(String lower) {
        return UNITS.containsKey(lower) || "hundred".equals(lower) || SCALES.containsKey(lower);
    }

    /**
     * Parses a run of words. Joiners are ignored; a percent word scales the result by 0.01.
     *
     * @return the value, or empty when the run contains no number word or an unknown word
     */
    public static Optional<BigDecimal> parse(List<String> words) {
        BigDecimal total = BigDecimal.ZERO;
        BigDecimal current = BigDecimal.ZERO;
        boolean seenNumber = false;
        boolean percent = false;

        for (String word : words) {
            String lower = word.toLowerCase(Locale.ROOT);
            if (JOINERS.contains(lower)) {
                continue;
            }
            if (PERCENT_WORDS.contains(lower)) {
                percent = true;
                continue;
            }
            for (String part : lower.split("-")) {
                if (part.isEmpty()) {
                    continue;
                }
                if (UNITS.containsKey(part)) {
                    current = current.add(BigDecimal.valueOf(UNITS.get(part)));
                } else if ("hundred".equals(part)) {
                    current = orOne(current).multiply(HUNDRED);
                } else if (SCALES.containsKey(part)) {
                    total = total.add(orOne(current).multiply(BigDecimal.valueOf(SCALES.get(part))));
                    current = BigDecimal.ZERO;
                } else {
                    return Optional.empty();
                }
                seenNumber = true;
            }
        }

        if (!seenNumber) {
            return Optional.empty();
        }
        BigDecimal value = total.add(current);
        return Optional.of(percent ? value.movePointLeft(2) : value);
    }

    private static BigDecimal orOne(BigDecimal value) {
        return value.signum() == 0 ? BigDecimal.ONE : value;
    }
}
