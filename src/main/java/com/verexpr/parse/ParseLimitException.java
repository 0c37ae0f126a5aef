package com.verexpr.parse;

/**
 * Rule nesting went deeper than the parser's budget, or deeper than the thread stack allows,
 * usually a left recursive grammar or pathologically nested input.
 */
public class ParseLimitException extends ParseException {
    private final String rule;
    private final int maxDepth;

    public ParseLimitException(String rule, int position, int maxDepth) {
        super("Rule nesting exceeded " + maxDepth + " levels in '" + rule + "' at offset " + position, position);
        this.rule = rule;
        this.maxDepth = maxDepth;
    }

    /** The thread stack ran out at {@code reachedDepth}, before the budget was used up. */
    public ParseLimitException(String rule, int position, int maxDepth, int reachedDepth) {
        super("Rule nesting ran out of stack after " + reachedDepth + " levels in '" + rule + "' at offset "
            + position + " (limit " + maxDepth + ")", position);
        this.rule = rule;
        this.maxDepth = maxDepth;
    }

    public String rule() {
        return rule;
    }

    public int maxDepth() {
        return maxDepth;
    }
}
