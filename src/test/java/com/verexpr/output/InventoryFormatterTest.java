package com.verexpr.output;

import com.verexpr.extract.ExpressionInventory;
import com.verexpr.grammar.GrammarReader;
import com.verexpr.parse.ParseException;
import com.verexpr.parse.ParseTree;
import com.verexpr.parse.PegParser;
import org.eclipse.collections.impl.factory.Lists;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

public class InventoryFormatterTest {

    private static final ExpressionInventory INVENTORY =
        new ExpressionInventory(Lists.immutable.of("(a)", "a", "a + (a)"), 5);

    // ============================================================
    // Text
    // ============================================================

    @Test
    public void testText() {
        assertEquals("(a)\na\na + (a)\n3 unique expressions", new InventoryFormatter().formatText(INVENTORY));
    }

    @Test
    public void testTextSingularAndEmpty() {
        InventoryFormatter formatter = new InventoryFormatter();

        assertEquals("a\n1 unique expression",
            formatter.formatText(new ExpressionInventory(Lists.immutable.of("a"), 6)));
        assertEquals("0 unique expressions",
            formatter.formatText(new ExpressionInventory(Lists.immutable.empty(), 0)));
    }

    // ============================================================
    // JSON
    // ============================================================

    @Test
    public void testCompactJson() throws IOException {
        assertEquals("{\"file\":\"x.rs\",\"count\":3,\"occurrences\":5,\"expressions\":[\"(a)\",\"a\",\"a + (a)\"]}",
            new InventoryFormatter(false).formatJson("x.rs", INVENTORY));
    }

    @Test
    public void testPrettyJson() throws IOException {
        String json = new InventoryFormatter(true).formatJson("x.rs", INVENTORY);

        assertTrue(json.contains("\"file\" : \"x.rs\""), json);
        assertTrue(json.contains("\"count\" : 3"), json);
        assertTrue(json.lines().count() > 1);
    }

    @Test
    public void testJsonEscapesExpressions() throws IOException {
        ExpressionInventory inventory = new ExpressionInventory(Lists.immutable.of("\"s\\n\"", "x\ny"), 2);

        String json = new InventoryFormatter(false).formatJson("q\".rs", inventory);
        assertEquals("{\"file\":\"q\\\".rs\",\"count\":2,\"occurrences\":2,"
            + "\"expressions\":[\"\\\"s\\\\n\\\"\",\"x\\ny\"]}", json);
    }

    // ============================================================
    // Tree
    // ============================================================

    @Test
    public void testTree() throws ParseException {
        ParseTree tree = new PegParser(GrammarReader.parse("start = { x }\nx = { \"a\" }", "start")).parse("a");

        assertEquals("start [0..1)\n  x [0..1) \"a\"", new InventoryFormatter().formatTree(tree));
    }

    @Test
    public void testTreeNestingAndEscapes() throws ParseException {
        ParseTree tree = new PegParser(GrammarReader.parse("""
            start = { pair ~ pair }
            pair  = { ch ~ ch }
            ch    = { ANY }
            """, "start")).parse("a\"\tb");

        String expected = String.join("\n",
            "start [0..4)",
            "  pair [0..2)",
            "    ch [0..1) \"a\"",
            "    ch [1..2) \"\\\"\"",
            "  pair [2..4)",
            "    ch [2..3) \"\\t\"",
            "    ch [3..4) \"b\"");
        assertEquals(expected, new InventoryFormatter().formatTree(tree));
    }

    @Test
    public void testTreeEscapesControlCharacters() throws ParseException {
        ParseTree tree = new PegParser(GrammarReader.parse("start = { ch* }\nch = { ANY }", "start"))
            .parse("\u0001\u001F\u007F");

        String expected = String.join("\n",
            "start [0..3)",
            "  ch [0..1) \"\\u0001\"",
            "  ch [1..2) \"\\u001F\"",
            "  ch [2..3) \"\u007F\"");
        assertEquals(expected, new InventoryFormatter().formatTree(tree));
    }

    @Test
    public void testTreeSpansAreUtf8Bytes() throws ParseException {
        ParseTree tree = new PegParser(GrammarReader.parse("start = { ch* }\nch = { ANY }", "start"))
            .parse("\u00E9a\uD83D\uDE00");

        String expected = String.join("\n",
            "start [0..7)",
            "  ch [0..2) \"\u00E9\"",
            "  ch [2..3) \"a\"",
            "  ch [3..7) \"\uD83D\uDE00\"");
        assertEquals(expected, new InventoryFormatter().formatTree(tree));
    }
}
