package com.verexpr.grammar;

/**
 * A grammar definition that cannot be used: malformed grammar text, duplicate or undefined rules,
 * or a bad start rule. This is a configuration error, not a property of the parsed input.
 */
public class GrammarException extends RuntimeException {
    private final LineColumn location;

    public GrammarException(String message) {
        super(message);
        this.location = null;
    }

    public GrammarException(String message, LineColumn location) {
        super(location + ": " + message);
        this.location = location;
    }

    /** Where in the grammar text the problem was found, or {@code null} for structural errors. */
    public LineColumn location() {
        return location;
    }
}
