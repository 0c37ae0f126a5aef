package com.verexpr.grammar;

import org.eclipse.collections.api.map.ImmutableMap;
import org.eclipse.collections.api.set.ImmutableSet;
import org.eclipse.collections.impl.factory.Maps;
import org.eclipse.collections.impl.factory.Sets;

import static com.verexpr.grammar.PegExpr.choice;
import static com.verexpr.grammar.PegExpr.literal;
import static com.verexpr.grammar.PegExpr.range;

/**
 * Rules every grammar can reference without defining them. They never produce parse tree nodes.
 */
public final class Builtins {
    public static final String SOI = "SOI";
    public static final String EOI = "EOI";

    private static final PegExpr DIGIT = range('0', '9');
    private static final PegExpr ALPHA = choice(range('a', 'z'), range('A', 'Z'));

    private static final ImmutableMap<String, PegExpr> BODIES = Maps.mutable.<String, PegExpr>empty()
        .withKeyValue("ANY", new PegExpr.Any())
        .withKeyValue("ASCII_DIGIT", DIGIT)
        .withKeyValue("ASCII_NONZERO_DIGIT", range('1', '9'))
        .withKeyValue("ASCII_ALPHA", ALPHA)
        .withKeyValue("ASCII_ALPHANUMERIC", choice(range('a', 'z'), range('A', 'Z'), DIGIT))
        .withKeyValue("ASCII_HEX_DIGIT", choice(DIGIT, range('a', 'f'), range('A', 'F')))
        .withKeyValue("NEWLINE", choice(literal("\n"), literal("\r\n"), literal("\r")))
        .toImmutable();

    private static final ImmutableSet<String> NAMES = Sets.mutable.withAll(BODIES.keysView())
        .with(SOI)
        .with(EOI)
        .toImmutable();

    private Builtins() {}

    public static boolean isBuiltin(String name) {
        return NAMES.contains(name);
    }

    /**
     * Returns the body of a built-in rule, or {@code null} for the position assertions
     * {@link #SOI} and {@link #EOI} which the parser evaluates directly.
     */
    public static PegExpr body(String name) {
        return BODIES.get(name);
    }

    public static ImmutableSet<String> names() {
        return NAMES;
    }
}
