package com.verexpr.parse;

/**
 * Maps offsets into a {@code String} to offsets into its UTF-8 encoding. ASCII-only input
 * needs no table.
 */
final class Utf8Offsets {
    private final int[] byteOffsets;
    private final int length;

    private Utf8Offsets(int[] byteOffsets, int length) {
        this.byteOffsets = byteOffsets;
        this.length = length;
    }

    static Utf8Offsets of(String text) {
        int n = text.length();
        int i = 0;
        while (i < n && text.charAt(i) < 0x80) {
            i++;
        }
        if (i == n) {
            return new Utf8Offsets(null, n);
        }

        int[] table = new int[n + 1];
        int bytes = 0;
        for (i = 0; i < n; i++) {
            table[i] = bytes;
            char c = text.charAt(i);
            if (c < 0x80) {
                bytes += 1;
            } else if (c < 0x800) {
                bytes += 2;
            } else if (Character.isHighSurrogate(c) && i + 1 < n && Character.isLowSurrogate(text.charAt(i + 1))) {
                // The low half is not a boundary; it maps to the start of the pair
                table[++i] = bytes;
                bytes += 4;
            } else {
                bytes += 3;
            }
        }
        table[n] = bytes;
        return new Utf8Offsets(table, n);
    }

    int toByte(int charOffset) {
        if (charOffset < 0 || charOffset > length) {
            throw new IndexOutOfBoundsException("Offset " + charOffset + " outside [0, " + length + "]");
        }
        return byteOffsets == null ? charOffset : byteOffsets[charOffset];
    }
}
