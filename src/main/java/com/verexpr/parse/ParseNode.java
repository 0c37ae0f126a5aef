package com.verexpr.parse;

import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

/**
 * View of one node of a {@link ParseTree}.
 */
public record ParseNode(ParseTree tree, int index) {

    public String rule() {
        return tree.ruleOf(index);
    }

    public int start() {
        return tree.startOf(index);
    }

    public int end() {
        return tree.endOf(index);
    }

    /** Byte range of the match in the UTF-8 encoded input. */
    public Span span() {
        return new Span(start(), end());
    }

    /** The exact input text this node matched. */
    public String text() {
        return tree.textOf(index);
    }

    public boolean isLeaf() {
        return tree.subtreeEndOf(index) == index + 1;
    }

    /** Number of nodes below this one, at any depth. */
    public int descendantCount() {
        return tree.subtreeEndOf(index) - index - 1;
    }

    public MutableList<ParseNode> children() {
        MutableList<ParseNode> children = Lists.mutable.empty();
        int end = tree.subtreeEndOf(index);
        for (int child = index + 1; child < end; child = tree.subtreeEndOf(child)) {
            children.add(new ParseNode(tree, child));
        }
        return children;
    }

    @Override
    public String toString() {
        return rule() + span();
    }
}
