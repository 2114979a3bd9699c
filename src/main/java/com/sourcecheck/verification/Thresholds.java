package com.sourcecheck.verification;

final class Thresholds {

    private Thresholds() {
    }

    static void requireRatio(String key, double value) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new IllegalStateException(key + " must be between 0 and 1, was " + value);
        }
    }
}
