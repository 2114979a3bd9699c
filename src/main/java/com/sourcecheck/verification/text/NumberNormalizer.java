package com.sourcecheck.verification.text;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Parses numeric tokens such as {@code $50,000.00}, {@code (12.5%)} or {@code 2019.}.
 * A trailing percent sign divides the value by 100. Values compare with {@link BigDecimal#compareTo}.
 */
public final class NumberNormalizer {

    private static final Pattern NUMERIC = Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)");
    private static final String LEADING_NOISE = "$€£¥([{\"'“‘";
    private static final String TRAILING_NOISE = ".,;:!?)]}\"'”’•-";

    private NumberNormalizer() {
    }

    public static Optional<BigDecimal> parse(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String token = stripTrailing(raw.trim());
        boolean percent = false;
        if (token.endsWith("%")) {
            percent = true;
            token = stripTrailing(token.substring(0, token.length() - 1));
        }
        token = stripLeading(token).replace(",", "");

        if (token.isEmpty() || !NUMERIC.matcher(token).matches()) {
            return Optional.empty();
        }
        BigDecimal value = new BigDecimal(token.endsWith(".") ? token.substring(0, token.length() - 1) : token);
        return Optional.of(percent ? value.movePointLeft(2) : value);
    }

    /**
     * Removes trailing sentence punctuation, closing brackets and bullets.
     */
    public static String stripTrailing(String token) {
        int end = token.length();
        while (end > 0 && TRAILING_NOISE.indexOf(token.charAt(end - 1)) >= 0) {
            end--;
        }
        return token.substring(0, end);
    }

    private static String stripLeading(String token) {
        int start = 0;
        while (start < token.length() && LEADING_NOISE.indexOf(token.charAt(start)) >= 0) {
            start++;
        }
        return token.substring(start);
    }
}
