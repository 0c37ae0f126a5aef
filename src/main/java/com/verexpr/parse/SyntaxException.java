package com.verexpr.parse;

import com.verexpr.grammar.LineColumn;
import org.eclipse.collections.api.set.sorted.ImmutableSortedSet;

/**
 * The start rule could not match the whole input. Reports the furthest position any
 * alternative reached and what was being attempted there.
 */
public class SyntaxException extends ParseException {
    private final LineColumn location;
    private final ImmutableSortedSet<String> expected;

    public SyntaxException(int position, LineColumn location, ImmutableSortedSet<String> expected) {
        super(describe(location, expected), position);
        this.location = location;
        this.expected = expected;
    }

    public LineColumn location() {
        return location;
    }

    /** Rule names, and quoted literals, that were attempted at {@link #position()}. */
    public ImmutableSortedSet<String> expected() {
        return expected;
    }

    private static String describe(LineColumn location, ImmutableSortedSet<String> expected) {
        if (expected.isEmpty()) {
            return "Syntax error at " + location + ": unexpected input";
        }
        if (expected.size() == 1) {
            return "Syntax error at " + location + ": expected " + expected.getFirst();
        }
        return "Syntax error at " + location + ": expected one of " + expected.makeString(", ");
    }
}
