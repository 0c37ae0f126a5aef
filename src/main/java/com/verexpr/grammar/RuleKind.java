package com.verexpr.grammar;

/**
 * How a rule shows up in the parse tree and whether implicit whitespace is skipped inside it.
 */
public enum RuleKind {
    /** {@code name = { ... }}: a node with children, whitespace skipped between tokens. */
    NORMAL,
    /** {@code name = _{ ... }}: no node of its own, children attach to the caller. */
    SILENT,
    /** {@code name = @{ ... }}: a leaf node, no skipping anywhere below it. */
    ATOMIC,
    /** {@code name = ${ ... }}: no skipping, but children are kept. */
    COMPOUND_ATOMIC;

    public boolean producesNode() {
        return this != SILENT;
    }

    public boolean disablesSkipping() {
        return this == ATOMIC || this == COMPOUND_ATOMIC;
    }
}
