package com.sourcecheck.batching;

import com.sourcecheck.batching.model.Batch;
import com.sourcecheck.batching.model.TextRecord;
import com.sourcecheck.tokenizer.TokenAdapter;
import com.sourcecheck.tokenizer.TokenizerResolver;
import com.sourcecheck.tokenizer.WhitespaceTokenAdapter;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class BatchBuilderTest {

    private final TokenAdapter adapter = new WhitespaceTokenAdapter();

    @Test
    void testFits_StrictlyBelowWindow() {
        BatchBuilder builder = BatchBuilder.start(0, adapter, "\n");

        assertThat(builder.fits(999, 1000)).isTrue();
        assertThat(builder.fits(1000, 1000)).isFalse();
    }

    @Test
    void testCountWith_CountsRunningTextAndSeparator() {
        // Given: A BPE tokenizer where the newline separator is a token of its own
        TokenAdapter bpe = new TokenizerResolver("r50k_base").resolveDefault();
        BatchBuilder builder = BatchBuilder.start(0, bpe, "\n");
        TextRecord first = TextRecord.of("word1");
        builder.append(first, builder.countWith(first), "a.pdf");

        // When: Counting the batch with a second record
        TextRecord second = TextRecord.of("word2");
        int tokens = builder.countWith(second);

        // Then: The count covers the text that would actually be in the batch
        assertThat(tokens).isEqualTo(bpe.count("word1\nword2\n"));
        assertThat(tokens).isGreaterThan(bpe.count("word1") + bpe.count("word2"));
    }

    @Test
    void testResume_RestoresRunningState() {
        // Given: A built batch
        BatchBuilder original = BatchBuilder.start(4, adapter, "\n");
        TextRecord first = TextRecord.of("one two three", "a.pdf", 2);
        original.append(first, original.countWith(first), "a.pdf");
        Batch batch = original.build();

        // When: Resuming it and appending another record
        BatchBuilder resumed = BatchBuilder.resume(batch, adapter, "\n");
        TextRecord second = TextRecord.of("four five", "b.pdf", 9);
        resumed.append(second, resumed.countWith(second), "b.pdf");
        Batch continued = resumed.build();

        // Then: Id, offsets, counters and biblio continue from the original batch
        assertThat(resumed.getBatchId()).isEqualTo(4);
        assertThat(continued.getText()).isEqualTo("one two three\nfour five\n");
        assertThat(continued.getStats().getTokens()).isEqualTo(5);
        assertThat(continued.getMetadata().get(1).getEvidenceStartChar()).isEqualTo(14);
        assertThat(continued.getMetadata().get(1).getBatchSourceId()).isEqualTo(1);
        assertThat(continued.getBiblio()).containsOnlyKeys("a.pdf", "b.pdf");
    }

    @Test
    void testResume_DoesNotMutateSourceBatch() {
        BatchBuilder original = BatchBuilder.start(0, adapter, "\n");
        original.append(TextRecord.of("alpha", "a.pdf", 1), 1, "a.pdf");
        Batch batch = original.build();

        BatchBuilder resumed = BatchBuilder.resume(batch, adapter, "\n");
        resumed.append(TextRecord.of("beta", "a.pdf", 2), 2, "a.pdf");

        assertThat(batch.getMetadata()).hasSize(1);
        assertThat(batch.getBiblio().get("a.pdf")).containsExactly(1);
        assertThat(batch.getText()).isEqualTo("alpha\n");
    }

    @Test
    void testIsEmpty() {
        BatchBuilder builder = BatchBuilder.start(0, adapter, "\n");
        assertThat(builder.isEmpty()).isTrue();

        builder.append(TextRecord.of(""), 0, "a.pdf");

        assertThat(builder.isEmpty()).isFalse();
        assertThat(builder.getCharOffset()).isEqualTo(1);
    }
}
