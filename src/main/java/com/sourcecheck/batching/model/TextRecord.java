package com.sourcecheck.batching.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A retrieved text fragment with optional location metadata.
 * Missing page falls back to master_index, then to 1; missing doc_id and block_id default to 1.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class TextRecord {

    private static final int DEFAULT_LOCATION = 1;

    private final String text;
    private final String fileSource;
    private final Integer pageNum;
    private final Integer masterIndex;
    private final Integer docId;
    private final Integer blockId;

    @JsonCreator
    public TextRecord(
            @JsonProperty("text") String text,
            @JsonProperty("file_source") String fileSource,
            @JsonProperty("page_num") Integer pageNum,
            @JsonProperty("master_index") Integer masterIndex,
            @JsonProperty("doc_id") @JsonAlias("doc_ID") Integer docId,
            @JsonProperty("block_id") @JsonAlias("block_ID") Integer blockId) {
        this.text = text;
        this.fileSource = fileSource;
        this.pageNum = pageNum;
        this.masterIndex = masterIndex;
        this.docId = docId;
        this.blockId = blockId;
    }

    public static TextRecord of(String text) {
        return new TextRecord(text, null, null, null, null, null);
    }

    public static TextRecord of(String text, String fileSource, Integer pageNum) {
        return new TextRecord(text, fileSource, pageNum, null, null, null);
    }

    /**
     * Copy carrying the same location metadata with different text, used for chunk slices.
     */
    public TextRecord withText(String newText) {
        return new TextRecord(newText, fileSource, pageNum, masterIndex, docId, blockId);
    }

    @JsonProperty("text")
    public String getText() {
        return text;
    }

    @JsonProperty("file_source")
    public String getFileSource() {
        return fileSource;
    }

    @JsonProperty("page_num")
    public Integer getPageNum() {
        return pageNum;
    }

    @JsonProperty("master_index")
    public Integer getMasterIndex() {
        return masterIndex;
    }

    @JsonProperty("doc_id")
    public Integer getDocId() {
        return docId;
    }

    @JsonProperty("block_id")
    public Integer getBlockId() {
        return blockId;
    }

    @JsonIgnore
    public int resolvedPageNum() {
        if (pageNum != null) {
            return pageNum;
        }
        return masterIndex != null ? masterIndex : DEFAULT_LOCATION;
    }

    @JsonIgnore
    public int resolvedDocId() {
        return docId != null ? docId : DEFAULT_LOCATION;
    }

    @JsonIgnore
    public int resolvedBlockId() {
        return blockId != null ? blockId : DEFAULT_LOCATION;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TextRecord)) {
            return false;
        }
        TextRecord that = (TextRecord) o;
        return Objects.equals(text, that.text)
                && Objects.equals(fileSource, that.fileSource)
                && Objects.equals(pageNum, that.pageNum)
                && Objects.equals(masterIndex, that.masterIndex)
                && Objects.equals(docId, that.docId)
                && Objects.equals(blockId, that.blockId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(text, fileSource, pageNum, masterIndex, docId, blockId);
    }

    @Override
    public String toString() {
        return "TextRecord{source=" + fileSource + ", page=" + resolvedPageNum()
                + ", chars=" + (text != null ? text.length() : 0) + "}";
    }
}
