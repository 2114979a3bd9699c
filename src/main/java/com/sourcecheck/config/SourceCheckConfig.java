package com.sourcecheck.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationListener;
import org.springframework.context.annotation.Configuration;

@Configuration
public class SourceCheckConfig implements ApplicationListener<ApplicationReadyEvent> {

    private static final Logger logger = LoggerFactory.getLogger(SourceCheckConfig.class);

    @Value("${sourcecheck.tokenizer.fallback-encoding:r50k_base}")
    private String fallbackEncoding;

    @Value("${sourcecheck.batching.context-window-size:1000}")
    private int contextWindowSize;

    @Value("${sourcecheck.batching.backup-source-name:user_provided_unknown_source}")
    private String backupSourceName;

    @Value("${sourcecheck.verification.source-min-threshold:0.25}")
    private double sourceMinThreshold;

    @Value("${sourcecheck.verification.source-conclusive-threshold:0.75}")
    private double sourceConclusiveThreshold;

    @Value("${sourcecheck.verification.not-found-threshold:0.25}")
    private double notFoundThreshold;

    @Override
    public void onApplicationEvent(ApplicationReadyEvent event) {
        logger.info("Batching: window={} tokens, fallback tokenizer={}, backup source={}",
                contextWindowSize, fallbackEncoding, backupSourceName);
        logger.info("Verification: source threshold={}, conclusive={}, not-found threshold={}",
                sourceMinThreshold, sourceConclusiveThreshold, notFoundThreshold);
    }

    public int getContextWindowSize() {
        return contextWindowSize;
    }

    public String getFallbackEncoding() {
        return fallbackEncoding;
    }

    public double getNotFoundThreshold() {
        return notFoundThreshold;
    }
}
