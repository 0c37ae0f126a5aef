package com.verexpr.extract;

import com.verexpr.parse.ParseNode;
import org.eclipse.collections.api.list.ListIterable;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.set.ImmutableSet;
import org.eclipse.collections.impl.factory.Sets;

/**
 * Keeps the nodes produced by a fixed set of rules. Nested matches are kept independently.
 */
public class RuleFilter {
    public static final ImmutableSet<String> EXPRESSION_RULES = Sets.immutable.of("expr", "expr_inner");

    private final ImmutableSet<String> rules;

    public RuleFilter() {
        this(EXPRESSION_RULES);
    }

    public RuleFilter(Iterable<String> rules) {
        this.rules = Sets.immutable.withAll(rules);
        if (this.rules.isEmpty()) {
            throw new IllegalArgumentException("At least one rule is required");
        }
    }

    public ImmutableSet<String> rules() {
        return rules;
    }

    public boolean accepts(ParseNode node) {
        return rules.contains(node.rule());
    }

    /** The accepted nodes, in their original order. */
    public MutableList<ParseNode> filter(ListIterable<ParseNode> nodes) {
        return nodes.select(this::accepts).toList();
    }
}
