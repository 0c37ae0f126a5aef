package com.verexpr.output;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.io.JsonStringEncoder;
import com.verexpr.extract.ExpressionInventory;
import com.verexpr.parse.ParseNode;
import com.verexpr.parse.ParseTree;

import java.io.IOException;
import java.io.StringWriter;

public class InventoryFormatter {
    private final boolean prettyPrint;
    private final JsonFactory factory = new JsonFactory();

    private static final JsonStringEncoder ESCAPER = JsonStringEncoder.getInstance();

    private static final ThreadLocal<StringBuilder> STRING_BUILDER_POOL =
        ThreadLocal.withInitial(() -> new StringBuilder(512));

    public InventoryFormatter() {
        this(true);
    }

    public InventoryFormatter(boolean prettyPrint) {
        this.prettyPrint = prettyPrint;
    }

    /** One expression per line, then the count. */
    public String formatText(ExpressionInventory inventory) {
        StringBuilder sb = STRING_BUILDER_POOL.get();
        sb.setLength(0);

        for (String expression : inventory.expressions()) {
            sb.append(expression).append('\n');
        }
        sb.append(inventory.count())
          .append(inventory.count() == 1 ? " unique expression" : " unique expressions");
        return sb.toString();
    }

    public String formatJson(String source, ExpressionInventory inventory) throws IOException {
        StringWriter out = new StringWriter();
        try (JsonGenerator generator = factory.createGenerator(out)) {
            if (prettyPrint) {
                generator.useDefaultPrettyPrinter();
            }
            generator.writeStartObject();
            generator.writeStringField("file", source);
            generator.writeNumberField("count", inventory.count());
            generator.writeNumberField("occurrences", inventory.occurrences());
            generator.writeArrayFieldStart("expressions");
            for (String expression : inventory.expressions()) {
                generator.writeString(expression);
            }
            generator.writeEndArray();
            generator.writeEndObject();
        }
        return out.toString();
    }

    /**
     * Indented pre-order dump, one node per line as {@code rule [start..end)} with UTF-8 byte
     * offsets. Leaves also show their text, escaped as a JSON string.
     */
    public String formatTree(ParseTree tree) {
        StringBuilder sb = STRING_BUILDER_POOL.get();
        sb.setLength(0);

        formatNode(tree.root(), 0, sb);
        return sb.toString();
    }

    private void formatNode(ParseNode node, int indent, StringBuilder sb) {
        if (indent > 0) {
            sb.append('\n');
        }
        sb.append("  ".repeat(indent))
          .append(node.rule())
          .append(' ')
          .append(node.span());
        if (node.isLeaf()) {
            sb.append(" \"");
            ESCAPER.quoteAsString(node.text(), sb);
            sb.append('"');
            return;
        }
        for (ParseNode child : node.children()) {
            formatNode(child, indent + 1, sb);
        }
    }
}
