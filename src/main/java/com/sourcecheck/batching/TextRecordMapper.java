package com.sourcecheck.batching;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sourcecheck.batching.model.TextRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Converts untyped retriever output into {@link TextRecord}s.
 */
@Component
public class TextRecordMapper {

    private static final Logger logger = LoggerFactory.getLogger(TextRecordMapper.class);

    private final ObjectMapper objectMapper;

    public TextRecordMapper() {
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * Maps each entry independently; entries without text or with fields of the wrong type are skipped.
     */
    public List<TextRecord> toRecords(List<Map<String, Object>> rawResults) {
        List<TextRecord> records = new ArrayList<>();
        if (rawResults == null) {
            return records;
        }

        for (int i = 0; i < rawResults.size(); i++) {
            Map<String, Object> raw = rawResults.get(i);
            if (raw == null || !(raw.get("text") instanceof String)) {
                logger.warn("Skipping retriever result {}: missing text field", i);
                continue;
            }
            try {
                records.add(objectMapper.convertValue(raw, TextRecord.class));
            } catch (IllegalArgumentException e) {
                logger.warn("Skipping retriever result {}: {}", i, e.getMessage());
            }
        }
        return records;
    }
}
