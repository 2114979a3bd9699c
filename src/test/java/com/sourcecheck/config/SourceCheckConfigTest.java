package com.sourcecheck.config;

import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.TestPropertySource;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@TestPropertySource(properties = {
        "sourcecheck.batching.context-window-size=2048",
        "sourcecheck.tokenizer.fallback-encoding=cl100k_base",
        "sourcecheck.verification.not-found-threshold=0.4"
})
class SourceCheckConfigTest {

    @Test
    void testSettingsBoundFromProperties(ApplicationContext context) {
        SourceCheckConfig config = context.getBean(SourceCheckConfig.class);

        assertThat(config.getContextWindowSize()).isEqualTo(2048);
        assertThat(config.getFallbackEncoding()).isEqualTo("cl100k_base");
        assertThat(config.getNotFoundThreshold()).isEqualTo(0.4);
    }
}
