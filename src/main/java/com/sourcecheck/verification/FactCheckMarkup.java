package com.sourcecheck.verification;

import com.sourcecheck.verification.model.FactCheckEntry;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * HTML highlighting of checked numbers in a response: bold when confirmed, red otherwise.
 */
public final class FactCheckMarkup {

    static final String CONFIRMED_OPEN = "<b>";
    static final String CONFIRMED_CLOSE = "</b>";
    static final String UNCONFIRMED_OPEN = "<font color=red>";
    static final String UNCONFIRMED_CLOSE = "</font>";

    private FactCheckMarkup() {
    }

    public static String apply(String response, List<FactCheckEntry> facts) {
        if (response == null || facts == null || facts.isEmpty()) {
            return response;
        }
        List<FactCheckEntry> ordered = new ArrayList<>(facts);
        // right to left so earlier offsets stay valid
        ordered.sort(Comparator.comparingInt(FactCheckEntry::getResponseStartChar).reversed());

        StringBuilder markup = new StringBuilder(response);
        int limit = response.length();
        for (FactCheckEntry fact : ordered) {
            int start = fact.getResponseStartChar();
            int end = fact.getResponseEndChar();
            if (start < 0 || end > limit || start >= end) {
                continue;
            }
            boolean confirmed = fact.isConfirmed();
            markup.insert(end, confirmed ? CONFIRMED_CLOSE : UNCONFIRMED_CLOSE);
            markup.insert(start, confirmed ? CONFIRMED_OPEN : UNCONFIRMED_OPEN);
            limit = start;
        }
        return markup.toString();
    }
}
