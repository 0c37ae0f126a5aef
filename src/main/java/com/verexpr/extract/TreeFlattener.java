package com.verexpr.extract;

import com.verexpr.parse.ParseNode;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.ArrayDeque;
import java.util.Deque;

public class TreeFlattener {

    /**
     * Lists every node reachable from {@code root}, root included, in pre-order: a node
     * before its children, each child's whole subtree before the next sibling.
     */
    public MutableList<ParseNode> flatten(ParseNode root) {
        MutableList<ParseNode> nodes = Lists.mutable.withInitialCapacity(root.descendantCount() + 1);
        Deque<ParseNode> pending = new ArrayDeque<>();
        pending.push(root);
        while (!pending.isEmpty()) {
            ParseNode node = pending.pop();
            nodes.add(node);
            MutableList<ParseNode> children = node.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                pending.push(children.get(i));
            }
        }
        return nodes;
    }
}
