package com.verexpr.extract;

import com.verexpr.grammar.GrammarReader;
import com.verexpr.parse.ParseException;
import com.verexpr.parse.ParseNode;
import com.verexpr.parse.ParseTree;
import com.verexpr.parse.PegParser;
import org.eclipse.collections.api.list.MutableList;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

public class TreeFlattenerTest {

    private final TreeFlattener flattener = new TreeFlattener();

    private ParseTree parse(String grammar, String input) throws ParseException {
        return new PegParser(GrammarReader.parse(grammar, "start")).parse(input);
    }

    @Test
    public void testPreOrder() throws ParseException {
        ParseTree tree = parse("""
            start = { a ~ b }
            a = { x ~ x }
            b = { x }
            x = { "x" }
            """, "xxx");

        MutableList<ParseNode> nodes = flattener.flatten(tree.root());
        assertEquals("[start, a, x, x, b, x]", nodes.collect(ParseNode::rule).toString());
        assertEquals("[0, 0, 0, 1, 2, 2]", nodes.collect(ParseNode::start).toString());
    }

    @Test
    public void testSingleNode() throws ParseException {
        ParseTree tree = parse("start = { \"abc\" }", "abc");

        MutableList<ParseNode> nodes = flattener.flatten(tree.root());
        assertEquals(1, nodes.size());
        assertEquals(tree.root(), nodes.getOnly());
    }

    @Test
    public void testSubtree() throws ParseException {
        ParseTree tree = parse("""
            start = { a ~ b }
            a = { x ~ x }
            b = { x }
            x = { "x" }
            """, "xxx");

        ParseNode b = tree.root().children().getLast();
        assertEquals("[b, x]", flattener.flatten(b).collect(ParseNode::rule).toString());
    }

    @Test
    public void testMatchesArenaOrder() throws ParseException, IOException {
        ParseTree tree = new PegParser(GrammarReader.bundled()).parse("f(a, b + c)[0] as int");

        MutableList<ParseNode> nodes = flattener.flatten(tree.root());
        assertEquals(tree.size(), nodes.size());
        for (int i = 0; i < nodes.size(); i++) {
            assertEquals(i, nodes.get(i).index());
        }
    }
}
