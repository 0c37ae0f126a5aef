package com.verexpr.parse;

import com.verexpr.grammar.Builtins;
import com.verexpr.grammar.Grammar;
import com.verexpr.grammar.LineColumn;
import com.verexpr.grammar.PegExpr;
import com.verexpr.grammar.Rule;
import com.verexpr.grammar.RuleKind;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.map.primitive.ImmutableObjectIntMap;
import org.eclipse.collections.api.map.primitive.MutableLongObjectMap;
import org.eclipse.collections.api.map.primitive.MutableObjectIntMap;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.SortedSets;
import org.eclipse.collections.impl.factory.primitive.ObjectIntMaps;
import org.eclipse.collections.impl.map.mutable.primitive.LongObjectHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Matches input text against a {@link Grammar} with PEG semantics: ordered choice takes the
 * first alternative that matches, repetition is greedy and never gives back a repetition,
 * lookahead consumes nothing.
 *
 * <p>A parser holds no per-input state and can be reused; each call works on its own cursor,
 * node arena and memo table. Successful rule matches are memoized by rule, position and
 * matching context, so alternatives that re-parse the same prefix cost linear time.
 *
 * <p>Positions reported in exceptions are offsets into the UTF-8 encoding of the input.
 */
public final class PegParser {
    private static final Logger LOG = LoggerFactory.getLogger(PegParser.class);

    public static final int DEFAULT_MAX_DEPTH = 1000;

    private static final int FAIL = -1;

    private final Grammar grammar;
    private final int maxDepth;
    private final ImmutableObjectIntMap<String> ruleIds;

    public PegParser(Grammar grammar) {
        this(grammar, DEFAULT_MAX_DEPTH);
    }

    public PegParser(Grammar grammar, int maxDepth) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
        }
        this.grammar = Objects.requireNonNull(grammar, "grammar");
        this.maxDepth = maxDepth;

        MutableObjectIntMap<String> ids = ObjectIntMaps.mutable.empty();
        for (Rule rule : grammar.rules()) {
            ids.put(rule.name(), ids.size());
        }
        this.ruleIds = ids.toImmutable();
    }

    public Grammar grammar() {
        return grammar;
    }

    public ParseTree parse(String input) throws ParseException {
        return parse(grammar.startRule(), input);
    }

    /**
     * Matches {@code startRule} against the whole of {@code input}.
     *
     * @throws SyntaxException if the rule does not match, or matches only a prefix
     * @throws ParseLimitException if rule nesting exceeds the depth budget
     */
    public ParseTree parse(String startRule, String input) throws ParseException {
        Objects.requireNonNull(input, "input");
        Rule rule = grammar.rule(startRule);
        if (rule == null) {
            throw new IllegalArgumentException("Unknown start rule: " + startRule);
        }
        if (!rule.kind().producesNode()) {
            throw new IllegalArgumentException("Start rule must not be silent: " + startRule);
        }

        long started = System.nanoTime();
        Run run = new Run(input);
        int end;
        try {
            end = run.matchRule(rule, 0);
        } catch (StackOverflowError e) {
            throw run.stackExhausted(e);
        }
        if (end != input.length()) {
            throw run.syntaxError(end);
        }
        ParseTree tree = run.arena.toTree(input);
        LOG.debug("Parsed {} chars into {} nodes in {} us, {} memoized matches",
            input.length(), tree.size(), (System.nanoTime() - started) / 1000, run.memos.size());
        return tree;
    }

    private record Memo(int end, NodeArena.Segment nodes) {}

    /** Matching state for a single input. */
    private final class Run {
        private final String input;
        private final NodeArena arena = new NodeArena();

        private int depth;
        // No implicit skipping while set
        private boolean atomic;
        // Nested rules produce no nodes while set
        private boolean discarding;
        // Failures are not tracked while positive: inside lookahead or an atomic rule
        private int quiet;

        private int furthest = -1;
        private final MutableList<String> expected = Lists.mutable.empty();

        // Successful matches by rule, position and context flags
        private final MutableLongObjectMap<Memo> memos = new LongObjectHashMap<>();
        // Innermost rule entered, for reporting stack exhaustion
        private String deepestRule;
        private int deepestPos;

        Run(String input) {
            this.input = input;
        }

        int match(PegExpr expr, int pos) throws ParseLimitException {
            if (expr instanceof PegExpr.RuleRef ref) {
                return matchRef(ref.name(), pos);
            }
            if (expr instanceof PegExpr.Sequence sequence) {
                return matchSequence(sequence, pos);
            }
            if (expr instanceof PegExpr.Choice choice) {
                return matchChoice(choice, pos);
            }
            if (expr instanceof PegExpr.Repeat repeat) {
                return matchRepeat(repeat, pos);
            }
            if (expr instanceof PegExpr.Literal literal) {
                return matchLiteral(literal, pos);
            }
            if (expr instanceof PegExpr.CharRange range) {
                return matchRange(range, pos);
            }
            if (expr instanceof PegExpr.Lookahead lookahead) {
                return matchLookahead(lookahead, pos);
            }
            if (expr instanceof PegExpr.Any) {
                if (pos < input.length()) {
                    return pos + Character.charCount(input.codePointAt(pos));
                }
                return failToken("ANY", pos);
            }
            throw new IllegalStateException("Unknown expression " + expr);
        }

        int matchRule(Rule rule, int pos) throws ParseLimitException {
            long key = memoKey(rule, pos);
            Memo memo = memos.get(key);
            if (memo != null) {
                if (memo.nodes() != null) {
                    arena.append(memo.nodes());
                }
                return memo.end();
            }
            if (++depth > maxDepth) {
                throw new ParseLimitException(rule.name(), Utf8Offsets.of(input).toByte(pos), maxDepth);
            }
            deepestRule = rule.name();
            deepestPos = pos;
            int mark = arena.size();
            RuleKind kind = rule.kind();
            boolean tracked = kind.producesNode() && quiet == 0;
            int furthestAtEntry = furthest;
            int expectedAtEntry = expected.size();

            int node = kind.producesNode() && !discarding ? arena.open(rule.name(), pos) : -1;

            boolean wasAtomic = atomic;
            boolean wasDiscarding = discarding;
            if (kind.disablesSkipping()) {
                atomic = true;
            }
            if (kind == RuleKind.ATOMIC) {
                discarding = true;
                quiet++;
            }

            int end = match(rule.body(), pos);

            if (kind == RuleKind.ATOMIC) {
                quiet--;
            }
            atomic = wasAtomic;
            discarding = wasDiscarding;
            depth--;

            if (end == FAIL) {
                if (node >= 0) {
                    arena.truncate(node);
                }
                if (tracked) {
                    trackRule(rule.name(), pos, furthestAtEntry, expectedAtEntry);
                }
                return FAIL;
            }
            if (node >= 0) {
                arena.close(node, end);
            }
            memos.put(key, new Memo(end, arena.copyFrom(mark)));
            return end;
        }

        // The same rule at the same position matches the same way unless skipping, node
        // production or failure tracking differ.
        private long memoKey(Rule rule, int pos) {
            int flags = (atomic ? 1 : 0) | (discarding ? 2 : 0) | (quiet > 0 ? 4 : 0);
            return ((long) ruleIds.get(rule.name()) << 35) | ((long) pos << 3) | flags;
        }

        private int matchRef(String name, int pos) throws ParseLimitException {
            Rule rule = grammar.rule(name);
            if (rule != null) {
                return matchRule(rule, pos);
            }
            int furthestAtEntry = furthest;
            int expectedAtEntry = expected.size();
            int end;
            if (Builtins.SOI.equals(name)) {
                end = pos == 0 ? pos : FAIL;
            } else if (Builtins.EOI.equals(name)) {
                end = pos == input.length() ? pos : FAIL;
            } else {
                quiet++;
                end = match(Builtins.body(name), pos);
                quiet--;
            }
            if (end == FAIL && quiet == 0) {
                trackRule(name, pos, furthestAtEntry, expectedAtEntry);
            }
            return end;
        }

        private int matchSequence(PegExpr.Sequence sequence, int pos) throws ParseLimitException {
            int mark = arena.size();
            int cursor = pos;
            boolean first = true;
            for (PegExpr item : sequence.items()) {
                if (!first) {
                    cursor = skip(cursor);
                }
                first = false;
                cursor = match(item, cursor);
                if (cursor == FAIL) {
                    arena.truncate(mark);
                    return FAIL;
                }
            }
            return cursor;
        }

        private int matchChoice(PegExpr.Choice choice, int pos) throws ParseLimitException {
            for (PegExpr alternative : choice.alternatives()) {
                int end = match(alternative, pos);
                if (end != FAIL) {
                    return end;
                }
            }
            return FAIL;
        }

        private int matchRepeat(PegExpr.Repeat repeat, int pos) throws ParseLimitException {
            int mark = arena.size();
            int cursor = pos;
            int count = 0;
            while (repeat.max() == PegExpr.UNBOUNDED || count < repeat.max()) {
                int iterationMark = arena.size();
                int start = count == 0 ? cursor : skip(cursor);
                int end = match(repeat.inner(), start);
                if (end == FAIL) {
                    arena.truncate(iterationMark);
                    break;
                }
                count++;
                if (end == cursor) {
                    // An empty match would repeat forever
                    break;
                }
                cursor = end;
            }
            if (count < repeat.min()) {
                arena.truncate(mark);
                return FAIL;
            }
            return cursor;
        }

        private int matchLookahead(PegExpr.Lookahead lookahead, int pos) throws ParseLimitException {
            int mark = arena.size();
            quiet++;
            int end = match(lookahead.inner(), pos);
            quiet--;
            arena.truncate(mark);
            boolean matched = end != FAIL;
            return matched == lookahead.positive() ? pos : FAIL;
        }

        private int matchLiteral(PegExpr.Literal literal, int pos) {
            String text = literal.text();
            if (input.regionMatches(literal.caseInsensitive(), pos, text, 0, text.length())) {
                return pos + text.length();
            }
            return failToken(literal.describe(), pos);
        }

        private int matchRange(PegExpr.CharRange range, int pos) {
            if (pos < input.length()) {
                int cp = input.codePointAt(pos);
                if (cp >= range.low() && cp <= range.high()) {
                    return pos + Character.charCount(cp);
                }
            }
            return failToken(range.describe(), pos);
        }

        // Runs of WHITESPACE and COMMENT between the elements of non-atomic sequences and repetitions
        private int skip(int pos) throws ParseLimitException {
            if (atomic || !grammar.hasSkipRules()) {
                return pos;
            }
            atomic = true;
            quiet++;
            int cursor = pos;
            boolean progressed = true;
            while (progressed) {
                progressed = false;
                for (Rule rule : grammar.skipRules()) {
                    int end = matchRule(rule, cursor);
                    if (end != FAIL && end > cursor) {
                        cursor = end;
                        progressed = true;
                    }
                }
            }
            quiet--;
            atomic = false;
            return cursor;
        }

        private int failToken(String token, int pos) {
            if (quiet == 0) {
                if (pos > furthest) {
                    furthest = pos;
                    expected.clear();
                }
                if (pos == furthest) {
                    expected.add(token);
                }
            }
            return FAIL;
        }

        // A rule that fails at the furthest position replaces whatever it attempted there.
        private void trackRule(String name, int pos, int furthestAtEntry, int expectedAtEntry) {
            if (pos < furthest) {
                return;
            }
            if (pos > furthest) {
                furthest = pos;
                expected.clear();
            } else if (furthestAtEntry == pos) {
                while (expected.size() > expectedAtEntry) {
                    expected.remove(expected.size() - 1);
                }
            } else {
                expected.clear();
            }
            expected.add(name);
        }

        SyntaxException syntaxError(int matchedEnd) {
            int position = furthest;
            if (matchedEnd > furthest) {
                // The start rule matched a prefix and nothing got further.
                position = matchedEnd;
                expected.clear();
            }
            position = Math.max(position, 0);
            return new SyntaxException(
                Utf8Offsets.of(input).toByte(position),
                LineColumn.of(input, position),
                SortedSets.immutable.withAll(expected));
        }

        ParseLimitException stackExhausted(StackOverflowError cause) {
            String rule = deepestRule != null ? deepestRule : grammar.startRule();
            ParseLimitException e = new ParseLimitException(
                rule, Utf8Offsets.of(input).toByte(deepestPos), maxDepth, depth);
            e.initCause(cause);
            return e;
        }
    }
}
