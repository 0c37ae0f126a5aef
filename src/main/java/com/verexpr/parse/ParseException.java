package com.verexpr.parse;

/**
 * The input could not be turned into a parse tree. No partial tree is ever produced.
 */
public abstract class ParseException extends Exception {
    private final int position;

    protected ParseException(String message, int position) {
        super(message);
        this.position = position;
    }

    /** Byte offset into the UTF-8 encoded input where parsing gave up. */
    public int position() {
        return position;
    }
}
