package com.verexpr.grammar;

import com.verexpr.parse.ParseException;
import com.verexpr.parse.PegParser;
import org.junit.jupiter.api.Test;

import static com.verexpr.grammar.PegExpr.*;
import static org.junit.jupiter.api.Assertions.*;

public class GrammarTest {

    @Test
    public void testBuiltGrammarParses() throws ParseException {
        Grammar grammar = Grammar.builder("list")
            .rule(Grammar.WHITESPACE, RuleKind.SILENT, literal(" "))
            .rule("list", seq(ref("num"), zeroOrMore(seq(literal(","), ref("num"))), ref("EOI")))
            .rule("num", RuleKind.ATOMIC, oneOrMore(range('0', '9')))
            .build();

        assertEquals(4, new PegParser(grammar).parse("1, 22 ,333").size());
    }

    @Test
    public void testLookups() {
        Grammar grammar = Grammar.builder("start")
            .rule(Grammar.COMMENT, RuleKind.SILENT, literal("#"))
            .rule("start", literal("a"))
            .rule(Grammar.WHITESPACE, RuleKind.SILENT, literal(" "))
            .build();

        assertNull(grammar.rule("missing"));
        assertFalse(grammar.defines("EOI"));
        assertEquals("[WHITESPACE, COMMENT]", grammar.skipRules().collect(Rule::name).toString());
    }

    @Test
    public void testNoSkipRules() {
        Grammar grammar = Grammar.builder("start").rule("start", literal("a")).build();

        assertFalse(grammar.hasSkipRules());
    }

    @Test
    public void testBuiltinNamesAreReserved() {
        Grammar.Builder builder = Grammar.builder("start");

        for (String name : Builtins.names()) {
            assertThrows(GrammarException.class, () -> builder.rule(name, literal("a")));
        }
    }

    @Test
    public void testSilentStartRuleIsRejected() {
        Grammar.Builder builder = Grammar.builder("start").rule("start", RuleKind.SILENT, literal("a"));

        assertThrows(GrammarException.class, builder::build);
    }

    @Test
    public void testInvalidExpressions() {
        assertThrows(IllegalArgumentException.class, () -> literal(""));
        assertThrows(IllegalArgumentException.class, () -> range('z', 'a'));
        assertThrows(IllegalArgumentException.class, () -> new Repeat(literal("a"), 3, 1));
    }

    @Test
    public void testLineColumn() {
        String text = "ab\ncd\r\nef\rg";

        assertEquals(new LineColumn(1, 1), LineColumn.of(text, 0));
        assertEquals(new LineColumn(1, 3), LineColumn.of(text, 2));
        assertEquals(new LineColumn(2, 2), LineColumn.of(text, 4));
        assertEquals(new LineColumn(3, 1), LineColumn.of(text, 7));
        assertEquals(new LineColumn(4, 1), LineColumn.of(text, 10));
        assertEquals("2:2", LineColumn.of(text, 4).toString());
        assertThrows(IllegalArgumentException.class, () -> LineColumn.of(text, text.length() + 1));
    }
}
