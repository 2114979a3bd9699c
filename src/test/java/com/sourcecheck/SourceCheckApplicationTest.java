package com.sourcecheck;

import com.sourcecheck.batching.SourceBatcher;
import com.sourcecheck.batching.SourceSession;
import com.sourcecheck.batching.model.TextRecord;
import com.sourcecheck.llm.LanguageModelResponse;
import com.sourcecheck.verification.EvidenceVerifier;
import com.sourcecheck.verification.model.ResponseRecord;
import com.sourcecheck.verification.model.VerificationReport;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Verifies the engine is wired from application properties without a language model bean.
 */
@SpringBootTest
@ActiveProfiles("test")
class SourceCheckApplicationTest {

    @Autowired
    private SourceBatcher sourceBatcher;

    @Autowired
    private EvidenceVerifier evidenceVerifier;

    @Test
    void testContext_BatcherUsesConfiguredWindowAndFallbackTokenizer() {
        SourceSession session = sourceBatcher.openSession();

        assertThat(session.getContextWindowSize()).isEqualTo(512);
        assertThat(session.getTokenAdapter().name()).isEqualTo("r50k_base");
    }

    @Test
    void testContext_PackageAnswerAndVerify() {
        // Given: Retrieved passages packaged with the real BPE tokenizer
        SourceSession session = sourceBatcher.openSession();
        sourceBatcher.packageSource(List.of(
                TextRecord.of("The security deposit is 1500 dollars.", "lease.pdf", 2),
                TextRecord.of("Rent is due on the first day of each month.", "lease.pdf", 3)), session, true);

        // When: Verifying an answer against the batch
        ResponseRecord record = ResponseRecord.forBatch("How much is the deposit?",
                new LanguageModelResponse("The security deposit is $1,500.", Map.of()),
                session.getSourceMaterials().get(0));
        VerificationReport report = evidenceVerifier.review(record);

        // Then: The number is confirmed on its source page
        assertThat(session.getSourceMaterials()).hasSize(1);
        assertThat(report.getFactCheck()).hasSize(1);
        assertThat(report.getFactCheck().get(0).isConfirmed()).isTrue();
        assertThat(report.getFactCheck().get(0).getPageNum()).isEqualTo(2);
        assertThat(report.getComparisonStats().getPercentDisplay()).isEqualTo("100.0%");
    }
}
