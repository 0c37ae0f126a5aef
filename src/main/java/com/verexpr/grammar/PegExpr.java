package com.verexpr.grammar;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.impl.factory.Lists;

/**
 * Body of a grammar rule. A grammar is a map from rule name to one of these trees,
 * interpreted by a single recursive matcher.
 */
public sealed interface PegExpr {
    int UNBOUNDED = -1;

    record Literal(String text, boolean caseInsensitive) implements PegExpr {
        public Literal {
            if (text.isEmpty()) {
                throw new IllegalArgumentException("Empty literal");
            }
        }

        public String describe() {
            return (caseInsensitive ? "^" : "") + "\"" + text + "\"";
        }
    }

    // Inclusive code point range, 'a'..'z'
    record CharRange(int low, int high) implements PegExpr {
        public CharRange {
            if (low > high) {
                throw new IllegalArgumentException("Empty character range: " + low + ".." + high);
            }
        }

        public String describe() {
            return "'" + new String(Character.toChars(low)) + "'..'" + new String(Character.toChars(high)) + "'";
        }
    }

    record Any() implements PegExpr {}
    record Sequence(ImmutableList<PegExpr> items) implements PegExpr {}
    record Choice(ImmutableList<PegExpr> alternatives) implements PegExpr {}

    // max is UNBOUNDED for * and +
    record Repeat(PegExpr inner, int min, int max) implements PegExpr {
        public Repeat {
            if (min < 0 || (max != UNBOUNDED && max < min)) {
                throw new IllegalArgumentException("Invalid repetition bounds {" + min + "," + max + "}");
            }
        }
    }

    record Lookahead(PegExpr inner, boolean positive) implements PegExpr {}
    record RuleRef(String name) implements PegExpr {}

    static PegExpr literal(String text) {
        return new Literal(text, false);
    }

    static PegExpr insensitive(String text) {
        return new Literal(text, true);
    }

    static PegExpr range(char low, char high) {
        return new CharRange(low, high);
    }

    static PegExpr ref(String name) {
        return new RuleRef(name);
    }

    static PegExpr seq(PegExpr... items) {
        return items.length == 1 ? items[0] : new Sequence(Lists.immutable.of(items));
    }

    static PegExpr choice(PegExpr... alternatives) {
        return alternatives.length == 1 ? alternatives[0] : new Choice(Lists.immutable.of(alternatives));
    }

    static PegExpr optional(PegExpr inner) {
        return new Repeat(inner, 0, 1);
    }

    static PegExpr zeroOrMore(PegExpr inner) {
        return new Repeat(inner, 0, UNBOUNDED);
    }

    static PegExpr oneOrMore(PegExpr inner) {
        return new Repeat(inner, 1, UNBOUNDED);
    }

    static PegExpr and(PegExpr inner) {
        return new Lookahead(inner, true);
    }

    static PegExpr not(PegExpr inner) {
        return new Lookahead(inner, false);
    }
}
