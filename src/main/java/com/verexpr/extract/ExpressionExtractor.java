package com.verexpr.extract;

import com.verexpr.parse.ParseException;
import com.verexpr.parse.ParseNode;
import com.verexpr.parse.ParseTree;
import com.verexpr.parse.PegParser;
import org.eclipse.collections.api.list.MutableList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parse, flatten, filter, normalize, dedupe. A parse failure aborts before anything is collected.
 */
public class ExpressionExtractor {
    private static final Logger LOG = LoggerFactory.getLogger(ExpressionExtractor.class);

    private final PegParser parser;
    private final RuleFilter filter;
    private final TreeFlattener flattener = new TreeFlattener();
    private final TextNormalizer normalizer = new TextNormalizer();

    public ExpressionExtractor(PegParser parser) {
        this(parser, new RuleFilter());
    }

    public ExpressionExtractor(PegParser parser, RuleFilter filter) {
        this.parser = parser;
        this.filter = filter;
        for (String rule : filter.rules()) {
            if (!parser.grammar().defines(rule)) {
                LOG.warn("Rule '{}' is not defined by the grammar and will never match", rule);
            }
        }
    }

    public ExpressionInventory extract(String input) throws ParseException {
        return extract(parser.parse(input));
    }

    public ExpressionInventory extract(ParseTree tree) {
        MutableList<ParseNode> nodes = flattener.flatten(tree.root());
        MutableList<ParseNode> selected = filter.filter(nodes);

        ExpressionCollector collector = new ExpressionCollector();
        for (ParseNode node : selected) {
            collector.add(normalizer.normalize(node));
        }
        LOG.debug("Kept {} of {} nodes, {} unique expressions", selected.size(), nodes.size(), collector.size());
        return collector.toInventory();
    }
}
