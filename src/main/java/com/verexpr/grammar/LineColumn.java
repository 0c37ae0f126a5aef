package com.verexpr.grammar;

/**
 * 1-based line and column of an offset into some text. Columns count code points.
 */
public record LineColumn(int line, int column) {

    public static LineColumn of(CharSequence text, int offset) {
        if (offset < 0 || offset > text.length()) {
            throw new IllegalArgumentException("Offset " + offset + " outside [0, " + text.length() + "]");
        }
        int line = 1;
        int lineStart = 0;
        for (int i = 0; i < offset; i++) {
            char c = text.charAt(i);
            if (c == '\n' || (c == '\r' && (i + 1 >= text.length() || text.charAt(i + 1) != '\n'))) {
                line++;
                lineStart = i + 1;
            }
        }
        return new LineColumn(line, Character.codePointCount(text, lineStart, offset) + 1);
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
