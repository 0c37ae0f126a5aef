package com.verexpr.parse;

/**
 * Result of a successful parse: all nodes stored in pre-order in parallel arrays.
 * Each parent owns the contiguous index range of its descendants.
 *
 * <p>Spans are offsets into the UTF-8 encoding of the input. The {@code String} indexes are
 * kept alongside to slice node text without re-encoding.
 */
public final class ParseTree {
    private final String input;
    private final String[] rules;
    private final int[] charStarts;
    private final int[] charEnds;
    private final int[] starts;
    private final int[] ends;
    private final int[] subtreeEnds;
    private final int byteLength;

    ParseTree(String input, String[] rules, int[] charStarts, int[] charEnds,
              int[] starts, int[] ends, int[] subtreeEnds, int byteLength) {
        this.input = input;
        this.rules = rules;
        this.charStarts = charStarts;
        this.charEnds = charEnds;
        this.starts = starts;
        this.ends = ends;
        this.subtreeEnds = subtreeEnds;
        this.byteLength = byteLength;
    }

    public String input() {
        return input;
    }

    /** Length of the input in UTF-8 bytes, the end of the root span. */
    public int byteLength() {
        return byteLength;
    }

    public ParseNode root() {
        return node(0);
    }

    /** Total number of nodes, root included. */
    public int size() {
        return rules.length;
    }

    public ParseNode node(int index) {
        if (index < 0 || index >= rules.length) {
            throw new IndexOutOfBoundsException("Node " + index + " of " + rules.length);
        }
        return new ParseNode(this, index);
    }

    String ruleOf(int index) {
        return rules[index];
    }

    int startOf(int index) {
        return starts[index];
    }

    int endOf(int index) {
        return ends[index];
    }

    String textOf(int index) {
        return input.substring(charStarts[index], charEnds[index]);
    }

    int subtreeEndOf(int index) {
        return subtreeEnds[index];
    }
}
