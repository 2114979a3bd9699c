package com.sourcecheck.verification.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Verdict on one number found in a model response.
 * {@code text} is the evidence context around the match, empty when not confirmed.
 */
public final class FactCheckEntry {

    private final String fact;
    private final FactStatus status;
    private final String text;
    private final Integer pageNum;
    private final String source;
    private final int responseStartChar;
    private final int responseEndChar;

    public FactCheckEntry(String fact, FactStatus status, String text, Integer pageNum, String source,
                          int responseStartChar, int responseEndChar) {
        this.fact = fact;
        this.status = status;
        this.text = text;
        this.pageNum = pageNum;
        this.source = source;
        this.responseStartChar = responseStartChar;
        this.responseEndChar = responseEndChar;
    }

    public static FactCheckEntry notConfirmed(String fact, int responseStartChar, int responseEndChar) {
        return new FactCheckEntry(fact, FactStatus.NOT_CONFIRMED, "", null, "",
                responseStartChar, responseEndChar);
    }

    @JsonProperty("fact")
    public String getFact() {
        return fact;
    }

    @JsonProperty("status")
    public FactStatus getStatus() {
        return status;
    }

    @JsonProperty("text")
    public String getText() {
        return text;
    }

    @JsonProperty("page_num")
    public Integer getPageNum() {
        return pageNum;
    }

    @JsonProperty("source")
    public String getSource() {
        return source;
    }

    @JsonIgnore
    public boolean isConfirmed() {
        return status == FactStatus.CONFIRMED;
    }

    @JsonIgnore
    public int getResponseStartChar() {
        return responseStartChar;
    }

    @JsonIgnore
    public int getResponseEndChar() {
        return responseEndChar;
    }

    @Override
    public String toString() {
        return "FactCheckEntry{fact=" + fact + ", status=" + status.getLabel() + ", page=" + pageNum + "}";
    }
}
