package com.verexpr.parse;

import java.util.Arrays;

/**
 * Growable pre-order node storage used while matching. A node's descendants occupy the
 * contiguous range {@code (node, subtreeEnd)}, so discarding a failed attempt is a truncation.
 * Offsets are {@code String} indexes until the tree is frozen.
 */
final class NodeArena {
    private String[] rules = new String[64];
    private int[] starts = new int[64];
    private int[] ends = new int[64];
    private int[] subtreeEnds = new int[64];
    private int size;

    /** Closed nodes lifted out of the arena, subtree ends relative to the first one. */
    record Segment(String[] rules, int[] starts, int[] ends, int[] subtreeEnds) {}

    int size() {
        return size;
    }

    int open(String rule, int start) {
        ensureCapacity(size + 1);
        int node = size++;
        rules[node] = rule;
        starts[node] = start;
        ends[node] = start;
        subtreeEnds[node] = size;
        return node;
    }

    void close(int node, int end) {
        ends[node] = end;
        subtreeEnds[node] = size;
    }

    void truncate(int newSize) {
        if (newSize < size) {
            Arrays.fill(rules, newSize, size, null);
            size = newSize;
        }
    }

    /** Copies the nodes from {@code from} to the end, or returns {@code null} if there are none. */
    Segment copyFrom(int from) {
        if (from >= size) {
            return null;
        }
        int[] relative = new int[size - from];
        for (int i = from; i < size; i++) {
            relative[i - from] = subtreeEnds[i] - from;
        }
        return new Segment(
            Arrays.copyOfRange(rules, from, size),
            Arrays.copyOfRange(starts, from, size),
            Arrays.copyOfRange(ends, from, size),
            relative);
    }

    void append(Segment segment) {
        int count = segment.rules().length;
        ensureCapacity(size + count);
        int base = size;
        System.arraycopy(segment.rules(), 0, rules, base, count);
        System.arraycopy(segment.starts(), 0, starts, base, count);
        System.arraycopy(segment.ends(), 0, ends, base, count);
        for (int i = 0; i < count; i++) {
            subtreeEnds[base + i] = segment.subtreeEnds()[i] + base;
        }
        size += count;
    }

    ParseTree toTree(String input) {
        Utf8Offsets offsets = Utf8Offsets.of(input);
        int[] byteStarts = new int[size];
        int[] byteEnds = new int[size];
        for (int i = 0; i < size; i++) {
            byteStarts[i] = offsets.toByte(starts[i]);
            byteEnds[i] = offsets.toByte(ends[i]);
        }
        return new ParseTree(
            input,
            Arrays.copyOf(rules, size),
            Arrays.copyOf(starts, size),
            Arrays.copyOf(ends, size),
            byteStarts,
            byteEnds,
            Arrays.copyOf(subtreeEnds, size),
            offsets.toByte(input.length()));
    }

    private void ensureCapacity(int capacity) {
        if (capacity > rules.length) {
            int grown = Math.max(capacity, rules.length * 2);
            rules = Arrays.copyOf(rules, grown);
            starts = Arrays.copyOf(starts, grown);
            ends = Arrays.copyOf(ends, grown);
            subtreeEnds = Arrays.copyOf(subtreeEnds, grown);
        }
    }
}
