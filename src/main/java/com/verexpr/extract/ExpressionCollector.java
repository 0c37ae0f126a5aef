package com.verexpr.extract;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.set.sorted.MutableSortedSet;
import org.eclipse.collections.impl.set.sorted.mutable.TreeSortedSet;

import java.util.Comparator;

/**
 * Unique expression texts, iterated in ascending UTF-8 byte order whatever the insertion order.
 */
public class ExpressionCollector {
    /** Code point order, which is the same as comparing the UTF-8 encodings byte by byte. */
    public static final Comparator<String> UTF8_ORDER = ExpressionCollector::compareCodePoints;

    private final MutableSortedSet<String> expressions = TreeSortedSet.newSet(UTF8_ORDER);
    private int offered;

    /** Returns {@code false} if the text was already present. */
    public boolean add(String expression) {
        offered++;
        return expressions.add(expression);
    }

    public void addAll(Iterable<String> expressions) {
        for (String expression : expressions) {
            add(expression);
        }
    }

    public int size() {
        return expressions.size();
    }

    /** How many texts were offered, duplicates included. */
    public int offered() {
        return offered;
    }

    public boolean contains(String expression) {
        return expressions.contains(expression);
    }

    public ImmutableList<String> toSortedList() {
        return expressions.toList().toImmutable();
    }

    public ExpressionInventory toInventory() {
        return new ExpressionInventory(toSortedList(), offered);
    }

    // String.compareTo orders by UTF-16 unit, which puts surrogate pairs before U+E000..U+FFFF
    static int compareCodePoints(String a, String b) {
        int i = 0;
        int j = 0;
        while (i < a.length() && j < b.length()) {
            int ca = a.codePointAt(i);
            int cb = b.codePointAt(j);
            if (ca != cb) {
                return Integer.compare(ca, cb);
            }
            i += Character.charCount(ca);
            j += Character.charCount(cb);
        }
        return Integer.compare(a.length() - i, b.length() - j);
    }
}
