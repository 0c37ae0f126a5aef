package com.verexpr.grammar;

import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads the textual grammar description into a {@link Grammar}.
 *
 * <pre>
 * rule      = IDENT "=" ("_" | "@" | "$")? "{" choice "}"
 * choice    = "|"? sequence ("|" sequence)*
 * sequence  = prefixed ("~" prefixed)*
 * prefixed  = ("&amp;" | "!")* postfixed
 * postfixed = primary ("?" | "*" | "+" | "{" n? ("," m?)? "}")*
 * primary   = "(" choice ")" | "^"? STRING | CHAR (".." CHAR)? | IDENT
 * </pre>
 *
 * {@code //} starts a comment that runs to the end of the line.
 */
public final class GrammarReader {
    private static final Logger LOG = LoggerFactory.getLogger(GrammarReader.class);

    public static final String BUNDLED_GRAMMAR = "/grammar/verus.peg";
    public static final String DEFAULT_START_RULE = "file";

    private final String text;
    private int pos;

    private GrammarReader(String text) {
        this.text = text;
    }

    public static Grammar parse(String text) {
        return parse(text, DEFAULT_START_RULE);
    }

    public static Grammar parse(String text, String startRule) {
        Grammar.Builder builder = Grammar.builder(startRule);
        new GrammarReader(text).readRules(builder);
        return builder.build();
    }

    public static Grammar read(Path path, String startRule) throws IOException {
        Grammar grammar = parse(Files.readString(path, StandardCharsets.UTF_8), startRule);
        LOG.debug("Loaded {} rules from {}", grammar.rules().size(), path);
        return grammar;
    }

    public static Grammar bundled() throws IOException {
        return bundled(DEFAULT_START_RULE);
    }

    public static Grammar bundled(String startRule) throws IOException {
        try (InputStream in = GrammarReader.class.getResourceAsStream(BUNDLED_GRAMMAR)) {
            if (in == null) {
                throw new IOException("Missing grammar resource " + BUNDLED_GRAMMAR);
            }
            Grammar grammar = parse(new String(in.readAllBytes(), StandardCharsets.UTF_8), startRule);
            LOG.debug("Loaded {} rules from bundled grammar", grammar.rules().size());
            return grammar;
        }
    }

    private void readRules(Grammar.Builder builder) {
        skipTrivia();
        while (pos < text.length()) {
            int ruleStart = pos;
            String name = readIdent();
            expect('=');
            RuleKind kind = readKind();
            expect('{');
            PegExpr body = readChoice();
            expect('}');
            try {
                builder.rule(name, kind, body);
            } catch (GrammarException e) {
                throw new GrammarException(e.getMessage(), LineColumn.of(text, ruleStart));
            }
            skipTrivia();
        }
    }

    private RuleKind readKind() {
        skipTrivia();
        if (pos >= text.length()) {
            throw error("expected '{'");
        }
        return switch (text.charAt(pos)) {
            case '_' -> advance(RuleKind.SILENT);
            case '@' -> advance(RuleKind.ATOMIC);
            case '$' -> advance(RuleKind.COMPOUND_ATOMIC);
            default -> RuleKind.NORMAL;
        };
    }

    private RuleKind advance(RuleKind kind) {
        pos++;
        return kind;
    }

    private PegExpr readChoice() {
        consume('|');
        MutableList<PegExpr> alternatives = Lists.mutable.of(readSequence());
        while (consume('|')) {
            alternatives.add(readSequence());
        }
        return alternatives.size() == 1
            ? alternatives.getFirst()
            : new PegExpr.Choice(alternatives.toImmutable());
    }

    private PegExpr readSequence() {
        MutableList<PegExpr> items = Lists.mutable.of(readPrefixed());
        while (consume('~')) {
            items.add(readPrefixed());
        }
        return items.size() == 1
            ? items.getFirst()
            : new PegExpr.Sequence(items.toImmutable());
    }

    private PegExpr readPrefixed() {
        if (consume('&')) {
            return PegExpr.and(readPrefixed());
        }
        if (consume('!')) {
            return PegExpr.not(readPrefixed());
        }
        return readPostfixed();
    }

    private PegExpr readPostfixed() {
        PegExpr expr = readPrimary();
        while (true) {
            if (consume('?')) {
                expr = PegExpr.optional(expr);
            } else if (consume('*')) {
                expr = PegExpr.zeroOrMore(expr);
            } else if (consume('+')) {
                expr = PegExpr.oneOrMore(expr);
            } else if (consume('{')) {
                expr = readBounds(expr);
            } else {
                return expr;
            }
        }
    }

    // After '{': {n}, {n,}, {,m} or {n,m}
    private PegExpr readBounds(PegExpr inner) {
        int start = pos;
        Integer min = readNumber();
        Integer max;
        if (consume(',')) {
            max = readNumber();
            if (min == null && max == null) {
                throw error("repetition needs at least one bound", start);
            }
        } else {
            if (min == null) {
                throw error("expected repetition count", start);
            }
            max = min;
        }
        expect('}');
        int low = min != null ? min : 0;
        int high = max != null ? max : PegExpr.UNBOUNDED;
        if (high != PegExpr.UNBOUNDED && high < low) {
            throw error("repetition maximum " + high + " is below minimum " + low, start);
        }
        return new PegExpr.Repeat(inner, low, high);
    }

    private Integer readNumber() {
        skipTrivia();
        int start = pos;
        while (pos < text.length() && Character.isDigit(text.charAt(pos))) {
            pos++;
        }
        if (start == pos) {
            return null;
        }
        try {
            return Integer.parseInt(text.substring(start, pos));
        } catch (NumberFormatException e) {
            throw error("repetition count out of range", start);
        }
    }

    private PegExpr readPrimary() {
        skipTrivia();
        if (pos >= text.length()) {
            throw error("expected expression");
        }
        char c = text.charAt(pos);
        if (c == '(') {
            pos++;
            PegExpr inner = readChoice();
            expect(')');
            return inner;
        }
        if (c == '"') {
            return PegExpr.literal(readString());
        }
        if (c == '^') {
            pos++;
            skipTrivia();
            if (pos >= text.length() || text.charAt(pos) != '"') {
                throw error("expected string after '^'");
            }
            return PegExpr.insensitive(readString());
        }
        if (c == '\'') {
            int start = pos;
            int low = readChar();
            skipTrivia();
            if (text.startsWith("..", pos)) {
                pos += 2;
                skipTrivia();
                if (pos >= text.length() || text.charAt(pos) != '\'') {
                    throw error("expected character after '..'");
                }
                int high = readChar();
                if (high < low) {
                    throw error("empty character range", start);
                }
                return new PegExpr.CharRange(low, high);
            }
            return PegExpr.literal(new String(Character.toChars(low)));
        }
        if (isIdentStart(c)) {
            return PegExpr.ref(readIdent());
        }
        throw error("unexpected '" + c + "'");
    }

    private String readString() {
        int start = pos;
        pos++;
        StringBuilder sb = new StringBuilder();
        while (pos < text.length() && text.charAt(pos) != '"') {
            sb.appendCodePoint(readCodePoint());
        }
        if (pos >= text.length()) {
            throw error("unterminated string", start);
        }
        pos++;
        if (sb.length() == 0) {
            throw error("empty string literal", start);
        }
        return sb.toString();
    }

    private int readChar() {
        int start = pos;
        pos++;
        if (pos >= text.length()) {
            throw error("unterminated character", start);
        }
        int cp = readCodePoint();
        if (pos >= text.length() || text.charAt(pos) != '\'') {
            throw error("unterminated character", start);
        }
        pos++;
        return cp;
    }

    private int readCodePoint() {
        int cp = text.codePointAt(pos);
        pos += Character.charCount(cp);
        if (cp != '\\') {
            return cp;
        }
        if (pos >= text.length()) {
            throw error("unterminated escape");
        }
        char escaped = text.charAt(pos++);
        return switch (escaped) {
            case 'n' -> '\n';
            case 'r' -> '\r';
            case 't' -> '\t';
            case '0' -> 0;
            case '\\', '"', '\'' -> escaped;
            case 'u' -> readUnicodeEscape();
            default -> throw error("unknown escape '\\" + escaped + "'", pos - 2);
        };
    }

    // \\u{1F600}
    private int readUnicodeEscape() {
        int start = pos - 2;
        if (pos >= text.length() || text.charAt(pos) != '{') {
            throw error("expected '{' in unicode escape", start);
        }
        int close = text.indexOf('}', pos);
        if (close < 0) {
            throw error("unterminated unicode escape", start);
        }
        try {
            int cp = Integer.parseInt(text.substring(pos + 1, close), 16);
            if (!Character.isValidCodePoint(cp)) {
                throw error("invalid code point in unicode escape", start);
            }
            pos = close + 1;
            return cp;
        } catch (NumberFormatException e) {
            throw error("invalid unicode escape", start);
        }
    }

    private String readIdent() {
        skipTrivia();
        int start = pos;
        if (pos >= text.length() || !isIdentStart(text.charAt(pos))) {
            throw error("expected rule name");
        }
        while (pos < text.length() && (isIdentStart(text.charAt(pos)) || Character.isDigit(text.charAt(pos)))) {
            pos++;
        }
        return text.substring(start, pos);
    }

    private static boolean isIdentStart(char c) {
        return c == '_' || (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private boolean consume(char c) {
        skipTrivia();
        if (pos < text.length() && text.charAt(pos) == c) {
            pos++;
            return true;
        }
        return false;
    }

    private void expect(char c) {
        if (!consume(c)) {
            throw error("expected '" + c + "'");
        }
    }

    private void skipTrivia() {
        while (pos < text.length()) {
            char c = text.charAt(pos);
            if (Character.isWhitespace(c)) {
                pos++;
            } else if (text.startsWith("//", pos)) {
                while (pos < text.length() && text.charAt(pos) != '\n') {
                    pos++;
                }
            } else {
                return;
            }
        }
    }

    private GrammarException error(String message) {
        return error(message, Math.min(pos, text.length()));
    }

    private GrammarException error(String message, int at) {
        return new GrammarException(message, LineColumn.of(text, at));
    }
}
