package com.verexpr.extract;

import org.eclipse.collections.impl.factory.Lists;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

public class ExpressionCollectorTest {

    private static final String EMOJI = new String(Character.toChars(0x1F600));

    @Test
    public void testDeduplicates() {
        ExpressionCollector collector = new ExpressionCollector();

        assertTrue(collector.add("a"));
        assertFalse(collector.add("a"));
        assertTrue(collector.add("b"));

        assertEquals(2, collector.size());
        assertEquals(3, collector.offered());
        assertTrue(collector.contains("a"));
        assertFalse(collector.contains("c"));
    }

    @Test
    public void testOrderIgnoresInsertionOrder() {
        ExpressionCollector collector = new ExpressionCollector();
        collector.addAll(Lists.immutable.of("b", "a", "B", "ab", "a"));

        assertEquals(Lists.immutable.of("B", "a", "ab", "b"), collector.toSortedList());
    }

    @Test
    public void testSupplementaryCharactersSortByCodePoint() {
        ExpressionCollector collector = new ExpressionCollector();
        collector.add(EMOJI);
        collector.add("\uFFFD");

        // UTF-16 order would put the surrogate pair first
        assertTrue(EMOJI.compareTo("\uFFFD") < 0);
        assertEquals(Lists.immutable.of("\uFFFD", EMOJI), collector.toSortedList());
    }

    @Test
    public void testOrderMatchesUtf8Bytes() {
        String[] samples = {"", "a", "ab", "b", "é", "éa", "中", "\uFFFD", EMOJI, EMOJI + "a", "z" + EMOJI};

        for (String a : samples) {
            for (String b : samples) {
                int expected = Integer.signum(Arrays.compareUnsigned(
                    a.getBytes(StandardCharsets.UTF_8), b.getBytes(StandardCharsets.UTF_8)));
                assertEquals(expected, Integer.signum(ExpressionCollector.compareCodePoints(a, b)), a + " vs " + b);
            }
        }
    }

    @Test
    public void testInventory() {
        ExpressionCollector collector = new ExpressionCollector();
        collector.addAll(Lists.immutable.of("x", "y", "x"));

        ExpressionInventory inventory = collector.toInventory();
        assertEquals(Lists.immutable.of("x", "y"), inventory.expressions());
        assertEquals(2, inventory.count());
        assertEquals(3, inventory.occurrences());
    }

    @Test
    public void testEmpty() {
        ExpressionInventory inventory = new ExpressionCollector().toInventory();

        assertTrue(inventory.expressions().isEmpty());
        assertEquals(0, inventory.occurrences());
    }
}
