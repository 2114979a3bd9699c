package com.sourcecheck.tokenizer;

import com.knuddels.jtokkit.api.Encoding;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Byte-pair encoding tokenizer backed by a JTokkit {@link Encoding}.
 * Special tokens such as {@code <|endoftext|>} are encoded as ordinary text.
 */
public class JtokkitTokenAdapter implements TokenAdapter {

    private final Encoding encoding;

    public JtokkitTokenAdapter(Encoding encoding) {
        this.encoding = Objects.requireNonNull(encoding, "encoding");
    }

    @Override
    public int count(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        return encoding.encodeOrdinary(text).size();
    }

    @Override
    public List<Integer> encode(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        return new ArrayList<>(encoding.encodeOrdinary(text));
    }

    @Override
    public String decode(List<Integer> tokenIds) {
        if (tokenIds == null || tokenIds.isEmpty()) {
            return "";
        }
        return encoding.decode(tokenIds);
    }

    @Override
    public String name() {
        return encoding.getName();
    }

    @Override
    public String toString() {
        return "JtokkitTokenAdapter[" + name() + "]";
    }
}
