package com.verexpr.extract;

import org.eclipse.collections.api.list.ImmutableList;

/**
 * The unique expressions of one input in report order, and how many expression nodes
 * they were collected from.
 */
public record ExpressionInventory(ImmutableList<String> expressions, int occurrences) {

    public int count() {
        return expressions.size();
    }
}
