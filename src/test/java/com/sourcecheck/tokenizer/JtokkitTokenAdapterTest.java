package com.sourcecheck.tokenizer;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class JtokkitTokenAdapterTest {

    private final TokenAdapter adapter = new TokenizerResolver("r50k_base").resolveDefault();

    @Test
    void testCount_MatchesEncodeLength() {
        String text = "The base salary is $1,000,000.00 per year.";

        assertThat(adapter.count(text)).isEqualTo(adapter.encode(text).size());
        assertThat(adapter.count(text)).isGreaterThan(5);
    }

    @Test
    void testDecode_RestoresEncodedText() {
        String text = "Payment is due within thirty (30) days of the invoice date.";

        assertThat(adapter.decode(adapter.encode(text))).isEqualTo(text);
    }

    @Test
    void testEncode_EmptyText() {
        assertThat(adapter.count("")).isZero();
        assertThat(adapter.count(null)).isZero();
        assertThat(adapter.encode("")).isEmpty();
        assertThat(adapter.decode(List.of())).isEmpty();
    }

    @Test
    void testEncode_SpecialTokenTextIsOrdinary() {
        // Special token markers in retrieved text must not break encoding
        String text = "end <|endoftext|> marker";

        assertThat(adapter.decode(adapter.encode(text))).isEqualTo(text);
    }

    @Test
    void testName() {
        assertThat(adapter.name()).isEqualTo("r50k_base");
    }
}
