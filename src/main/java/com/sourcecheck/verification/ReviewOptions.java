package com.sourcecheck.verification;

/**
 * Analyses to run in {@link EvidenceVerifier#review}. All analyses run by default, without markup.
 */
public final class ReviewOptions {

    private final boolean reviewNumbers;
    private final boolean sourceReview;
    private final boolean comparisonStats;
    private final boolean addMarkup;

    public ReviewOptions(boolean reviewNumbers, boolean sourceReview, boolean comparisonStats, boolean addMarkup) {
        this.reviewNumbers = reviewNumbers;
        this.sourceReview = sourceReview;
        this.comparisonStats = comparisonStats;
        this.addMarkup = addMarkup;
    }

    public static ReviewOptions all() {
        return new ReviewOptions(true, true, true, false);
    }

    public static ReviewOptions numbersOnly() {
        return new ReviewOptions(true, false, false, false);
    }

    public static ReviewOptions sourcesOnly() {
        return new ReviewOptions(false, true, false, false);
    }

    public static ReviewOptions comparisonOnly() {
        return new ReviewOptions(false, false, true, false);
    }

    public ReviewOptions withMarkup() {
        return new ReviewOptions(reviewNumbers, sourceReview, comparisonStats, true);
    }

    public boolean isReviewNumbers() {
        return reviewNumbers;
    }

    public boolean isSourceReview() {
        return sourceReview;
    }

    public boolean isComparisonStats() {
        return comparisonStats;
    }

    public boolean isAddMarkup() {
        return addMarkup;
    }
}
