package com.sourcecheck.verification;

import com.sourcecheck.verification.model.ComparisonStats;
import com.sourcecheck.verification.model.ResponseRecord;
import com.sourcecheck.verification.text.StopWords;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TokenComparatorTest {

    private final TokenComparator comparator = new TokenComparator(new StopWords());

    private static ResponseRecord record(String response, String evidence) {
        return ResponseRecord.of(response, evidence, List.of());
    }

    @Test
    void testCompare_NumericAnswerVerifiedBySpelledOutEvidence() {
        // Given: Evidence states the amount in words
        ResponseRecord record = record("The rent is 20 dollars.", "Monthly rent is twenty dollars, payable in advance.");

        // When: Comparing tokens
        ComparisonStats stats = comparator.compare(record);

        // Then: Every content word, including the number, is verified
        assertThat(stats.getConfirmedWords()).containsExactly("rent", "20", "dollars");
        assertThat(stats.getUnconfirmedWords()).isEmpty();
        assertThat(stats.getVerifiedTokenMatchRatio()).isEqualTo(1.0);
        assertThat(stats.getPercentDisplay()).isEqualTo("100.0%");
    }

    @Test
    void testCompare_PercentAgainstSpelledOutPercent() {
        ComparisonStats stats = comparator.compare(
                record("Rent increases 5% yearly", "Rent increases five percent each year."));

        assertThat(stats.getConfirmedWords()).containsExactly("rent", "increases", "5%");
        assertThat(stats.getUnconfirmedWords()).containsExactly("yearly");
        assertThat(stats.getVerifiedTokenMatchRatio()).isEqualTo(0.75);
        assertThat(stats.getPercentDisplay()).isEqualTo("75.0%");
    }

    @Test
    void testCompare_FormattedAmountMatchesPlainNumber() {
        ComparisonStats stats = comparator.compare(record(" $1,000,000.00", "base salary of 1000000 per year"));

        assertThat(stats.getConfirmedWords()).containsExactly("1000000.00");
        assertThat(stats.getVerifiedTokenMatchRatio()).isEqualTo(1.0);
    }

    @Test
    void testCompare_UnmatchedWordsAreDistinct() {
        ComparisonStats stats = comparator.compare(record("penalty penalty clause", "No clause applies."));

        assertThat(stats.getConfirmedWords()).containsExactly("clause");
        assertThat(stats.getUnconfirmedWords()).containsExactly("penalty");
        assertThat(stats.getPercentDisplay()).isEqualTo("33.3%");
    }

    @Test
    void testCompare_KeyPointsScoredSeparately() {
        ResponseRecord record = record("ignored when key points are given",
                "Monthly rent is twenty dollars, payable in advance.")
                .withKeyPoints(List.of("Rent is 20 dollars", "Pets are allowed"));

        ComparisonStats stats = comparator.compare(record);

        assertThat(stats.getKeyPoints()).hasSize(2);
        assertThat(stats.getKeyPoints().get(0).getVerifiedMatch()).isEqualTo(1.0);
        assertThat(stats.getKeyPoints().get(1).getEntry()).isEqualTo(1);
        assertThat(stats.getKeyPoints().get(1).getVerifiedMatch()).isEqualTo(0.0);
        assertThat(stats.getVerifiedTokenMatchRatio()).isEqualTo(0.6);
    }

    @Test
    void testCompare_EmptyResponse() {
        ComparisonStats stats = comparator.compare(record("", "Some evidence text."));

        assertThat(stats.getVerifiedTokenMatchRatio()).isZero();
        assertThat(stats.getPercentDisplay()).isEqualTo("0.0%");
        assertThat(stats.getKeyPoints()).isEmpty();
    }

    @Test
    void testClean_StripsEdgesAndNoise() {
        assertThat(TokenComparator.clean("(dollars),")).isEqualTo("dollars");
        assertThat(TokenComparator.clean("end.")).isEqualTo("end");
        assertThat(TokenComparator.clean("“quoted”")).isEqualTo("quoted");
    }
}
