package com.sourcecheck.batching.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Location of one packed record inside a batch's text: the half-open range
 * [evidence_start_char, evidence_stop_char) plus the record's source coordinates.
 */
public final class BatchMetadataEntry {

    private final int batchSourceId;
    private final int evidenceStartChar;
    private final int evidenceStopChar;
    private final String sourceName;
    private final int pageNum;
    private final int docId;
    private final int blockId;

    @JsonCreator
    public BatchMetadataEntry(
            @JsonProperty("batch_source_id") int batchSourceId,
            @JsonProperty("evidence_start_char") int evidenceStartChar,
            @JsonProperty("evidence_stop_char") int evidenceStopChar,
            @JsonProperty("source_name") String sourceName,
            @JsonProperty("page_num") int pageNum,
            @JsonProperty("doc_id") int docId,
            @JsonProperty("block_id") int blockId) {
        this.batchSourceId = batchSourceId;
        this.evidenceStartChar = evidenceStartChar;
        this.evidenceStopChar = evidenceStopChar;
        this.sourceName = sourceName;
        this.pageNum = pageNum;
        this.docId = docId;
        this.blockId = blockId;
    }

    @JsonProperty("batch_source_id")
    public int getBatchSourceId() {
        return batchSourceId;
    }

    @JsonProperty("evidence_start_char")
    public int getEvidenceStartChar() {
        return evidenceStartChar;
    }

    @JsonProperty("evidence_stop_char")
    public int getEvidenceStopChar() {
        return evidenceStopChar;
    }

    @JsonProperty("source_name")
    public String getSourceName() {
        return sourceName;
    }

    @JsonProperty("page_num")
    public int getPageNum() {
        return pageNum;
    }

    @JsonProperty("doc_id")
    public int getDocId() {
        return docId;
    }

    @JsonProperty("block_id")
    public int getBlockId() {
        return blockId;
    }

    public boolean contains(int charOffset) {
        return charOffset >= evidenceStartChar && charOffset < evidenceStopChar;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof BatchMetadataEntry)) {
            return false;
        }
        BatchMetadataEntry that = (BatchMetadataEntry) o;
        return batchSourceId == that.batchSourceId
                && evidenceStartChar == that.evidenceStartChar
                && evidenceStopChar == that.evidenceStopChar
                && pageNum == that.pageNum
                && docId == that.docId
                && blockId == that.blockId
                && Objects.equals(sourceName, that.sourceName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(batchSourceId, evidenceStartChar, evidenceStopChar, sourceName, pageNum, docId, blockId);
    }
}
