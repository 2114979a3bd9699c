package com.sourcecheck.verification.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A candidate evidence span for a response, scored by token overlap.
 */
public final class SourceReviewEntry {

    private final String text;
    private final double matchScore;
    private final String source;
    private final int pageNum;
    private final int docId;
    private final int blockId;

    public SourceReviewEntry(String text, double matchScore, String source, int pageNum, int docId, int blockId) {
        this.text = text;
        this.matchScore = matchScore;
        this.source = source;
        this.pageNum = pageNum;
        this.docId = docId;
        this.blockId = blockId;
    }

    @JsonProperty("text")
    public String getText() {
        return text;
    }

    @JsonProperty("match_score")
    public double getMatchScore() {
        return matchScore;
    }

    @JsonProperty("source")
    public String getSource() {
        return source;
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

    @Override
    public String toString() {
        return "SourceReviewEntry{source=" + source + ", page=" + pageNum + ", score=" + matchScore + "}";
    }
}
