package com.verexpr;

import com.verexpr.extract.ExpressionExtractor;
import com.verexpr.extract.ExpressionInventory;
import com.verexpr.extract.RuleFilter;
import com.verexpr.grammar.Grammar;
import com.verexpr.grammar.GrammarReader;
import com.verexpr.output.InventoryFormatter;
import com.verexpr.parse.ParseTree;
import com.verexpr.parse.PegParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

@Command(name = "verexpr", mixinStandardHelpOptions = true, version = "1.0",
         description = "List the unique expressions of a Verus source file")
public class VerExpr implements Callable<Integer> {
    @Parameters(index = "0", description = "Verus source file to scan")
    private Path inputFile;

    @Option(names = {"-r", "--rule"}, paramLabel = "RULE",
            description = "Rule whose matches are collected, repeatable (default: expr, expr_inner)")
    private List<String> rules = new ArrayList<>();

    @Option(names = {"-g", "--grammar"}, paramLabel = "FILE",
            description = "Grammar file to use instead of the bundled Verus grammar")
    private Path grammarFile;

    @Option(names = "--start", paramLabel = "RULE", defaultValue = GrammarReader.DEFAULT_START_RULE,
            description = "Rule the whole input must match (default: ${DEFAULT-VALUE})")
    private String startRule;

    @Option(names = "--max-depth", paramLabel = "N", defaultValue = "" + PegParser.DEFAULT_MAX_DEPTH,
            description = "Maximum rule nesting before giving up (default: ${DEFAULT-VALUE})")
    private int maxDepth;

    @Option(names = "--json", description = "Print the expressions as a JSON document")
    private boolean json = false;

    @Option(names = {"-c", "--compact-output"}, description = "Compact JSON output without whitespace")
    private boolean compactOutput = false;

    @Option(names = "--tree", description = "Print the parse tree instead of the expressions")
    private boolean tree = false;

    @Option(names = {"-v", "--verbose"}, description = "Log parser progress to stderr")
    private boolean verbose = false;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new VerExpr()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        if (verbose) {
            // Must happen before the first logger is created
            System.setProperty("org.slf4j.simpleLogger.defaultLogLevel", "debug");
        }
        Logger log = LoggerFactory.getLogger(VerExpr.class);
        try {
            Grammar grammar = grammarFile != null
                ? GrammarReader.read(grammarFile, startRule)
                : GrammarReader.bundled(startRule);
            PegParser parser = new PegParser(grammar, maxDepth);

            String source = readSource(inputFile);
            ParseTree parseTree = parser.parse(source);

            InventoryFormatter formatter = new InventoryFormatter(!compactOutput);
            if (tree) {
                System.out.println(formatter.formatTree(parseTree));
                return 0;
            }

            RuleFilter filter = rules.isEmpty() ? new RuleFilter() : new RuleFilter(rules);
            ExpressionInventory inventory = new ExpressionExtractor(parser, filter).extract(parseTree);
            if (json) {
                System.out.println(formatter.formatJson(inputFile.toString(), inventory));
            } else {
                System.out.println(formatter.formatText(inventory));
            }
            return 0;
        } catch (Exception e) {
            log.debug("Failed to process {}", inputFile, e);
            System.err.println("Error: " + e.getMessage());
            return 1;
        }
    }

    static String readSource(Path path) throws IOException {
        try {
            return Files.readString(path, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            throw new IOException("Cannot read " + path + ": no such file", e);
        } catch (AccessDeniedException e) {
            throw new IOException("Cannot read " + path + ": permission denied", e);
        } catch (CharacterCodingException e) {
            throw new IOException("Cannot read " + path + ": not valid UTF-8", e);
        }
    }
}
