package com.verexpr.parse;

import java.nio.charset.StandardCharsets;

/**
 * Half-open range {@code [start, end)} of byte offsets into the UTF-8 encoded input.
 */
public record Span(int start, int end) {
    public Span {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid span [" + start + ", " + end + ")");
        }
    }

    public int length() {
        return end - start;
    }

    public boolean isEmpty() {
        return start == end;
    }

    public boolean contains(Span other) {
        return start <= other.start && other.end <= end;
    }

    public String slice(byte[] utf8) {
        return new String(utf8, start, length(), StandardCharsets.UTF_8);
    }

    @Override
    public String toString() {
        return "[" + start + ".." + end + ")";
    }
}
