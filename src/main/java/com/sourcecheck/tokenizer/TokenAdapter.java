package com.sourcecheck.tokenizer;

import java.util.List;

/**
 * Narrow view of a tokenizer used for batching and chunking.
 * A single instance must serve every count/encode/decode call of one batching session,
 * otherwise chunk boundaries computed while counting will not match the ones used while slicing.
 */
public interface TokenAdapter {

    int count(String text);

    List<Integer> encode(String text);

    String decode(List<Integer> tokenIds);

    /**
     * Identifier of the underlying vocabulary, e.g. {@code r50k_base}.
     */
    String name();
}
