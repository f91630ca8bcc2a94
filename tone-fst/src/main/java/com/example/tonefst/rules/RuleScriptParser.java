package com.example.tonefst.rules;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.text.Normalizer;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Parser for rule scripts. One statement per line:
 *
 * <pre>
 * % comment
 * ::tone:: = [1234]
 * {::tone::>::tone::} -> #[^#]+# / _ #
 * </pre>
 *
 * Inside a pattern {@code #} is the word boundary, {@code 0} is epsilon, {@code [..]} and
 * {@code [^..]} are symbol classes, {@code (a|b)} is a disjunction, {@code *}, {@code +} and
 * {@code ?} are postfix operators, {@code ::name::} refers to a macro and {@code \x} is the literal
 * {@code x}. Whitespace is insignificant. A base character followed by combining marks forms one
 * symbol; the text is NFD normalized first.
 */
public final class RuleScriptParser {

    private static final String COMMENT_PREFIX = "%";
    private static final String MACRO_DELIMITER = "::";

    private RuleScriptParser() {
    }

    public static List<Statement> parseFile(Path path) throws IOException {
        return parse(Files.readString(path, StandardCharsets.UTF_8));
    }

    public static List<Statement> parse(String script) {
        List<Statement> statements = new ArrayList<>();
        String[] lines = normalize(script).split("\\R", -1);
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i].strip();
            if (line.isEmpty()) {
                continue;
            }
            if (line.startsWith(COMMENT_PREFIX)) {
                statements.add(new Statement.Comment());
                continue;
            }
            statements.add(parseStatement(lines[i], i + 1));
        }
        return statements;
    }

    /**
     * Parses a single pattern. A pattern of one element is returned as that element, longer
     * patterns as a {@link RegexAst.Group}.
     */
    public static RegexAst parsePattern(String pattern) {
        String normalized = normalize(pattern);
        Cursor cursor = new Cursor(normalized, 1, 0, normalized.length());
        List<RegexAst> nodes = cursor.sequence();
        cursor.expectEnd();
        return nodes.size() == 1 ? nodes.get(0) : new RegexAst.Group(nodes);
    }

    private static Statement parseStatement(String line, int lineNumber) {
        String stripped = line.strip();
        if (stripped.startsWith(MACRO_DELIMITER)) {
            int nameEnd = stripped.indexOf(MACRO_DELIMITER, MACRO_DELIMITER.length());
            if (nameEnd > 0) {
                int equals = indexOfUnescaped(stripped, "=", nameEnd + MACRO_DELIMITER.length());
                boolean onlySpaceBefore = equals > 0
                        && stripped.substring(nameEnd + MACRO_DELIMITER.length(), equals).isBlank();
                if (onlySpaceBefore) {
                    String name = stripped.substring(MACRO_DELIMITER.length(), nameEnd).strip();
                    if (name.isEmpty()) {
                        throw new RuleSyntaxException("Empty macro name", lineNumber, 1);
                    }
                    Cursor cursor = new Cursor(stripped, lineNumber, equals + 1, stripped.length());
                    List<RegexAst> nodes = cursor.sequence();
                    cursor.expectEnd();
                    RegexAst definition = nodes.size() == 1 ? nodes.get(0) : new RegexAst.Group(nodes);
                    return new Statement.MacroDef(name, definition);
                }
            }
        }

        int arrow = indexOfUnescaped(stripped, "->", 0);
        if (arrow < 0) {
            throw new RuleSyntaxException("Expected a macro definition or a rule 'source -> target'", lineNumber, 1);
        }
        int slash = indexOfUnescaped(stripped, "/", arrow + 2);
        int targetEnd = slash < 0 ? stripped.length() : slash;

        RegexAst source = side(stripped, lineNumber, 0, arrow);
        RegexAst target = side(stripped, lineNumber, arrow + 2, targetEnd);
        RegexAst left = RegexAst.epsilon();
        RegexAst right = RegexAst.epsilon();
        if (slash >= 0) {
            int focus = indexOfUnescaped(stripped, "_", slash + 1);
            if (focus < 0) {
                throw new RuleSyntaxException("Context after '/' needs a '_' placeholder", lineNumber, slash + 1);
            }
            left = context(stripped, lineNumber, slash + 1, focus);
            right = context(stripped, lineNumber, focus + 1, stripped.length());
        }
        if (((RegexAst.Group) source).nodes().isEmpty()) {
            throw new RuleSyntaxException("Rule source is empty", lineNumber, 1);
        }
        return new Statement.Rule(new RewriteRule(left, source, right, target));
    }

    private static RegexAst side(String line, int lineNumber, int from, int to) {
        Cursor cursor = new Cursor(line, lineNumber, from, to);
        List<RegexAst> nodes = cursor.sequence();
        cursor.expectEnd();
        return new RegexAst.Group(nodes);
    }

    private static RegexAst context(String line, int lineNumber, int from, int to) {
        if (line.substring(from, to).isBlank()) {
            return RegexAst.epsilon();
        }
        return side(line, lineNumber, from, to);
    }

    /**
     * Position of {@code token} at or after {@code from}, skipping escaped characters and the
     * contents of symbol classes.
     */
    private static int indexOfUnescaped(String text, String token, int from) {
        boolean inClass = false;
        for (int i = from; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\\') {
                i++;
                continue;
            }
            if (inClass) {
                if (c == ']') {
                    inClass = false;
                }
                continue;
            }
            if (c == '[') {
                inClass = true;
                continue;
            }
            if (text.startsWith(token, i)) {
                return i;
            }
        }
        return -1;
    }

    private static String normalize(String text) {
        return Normalizer.normalize(text, Normalizer.Form.NFD);
    }

    private static final class Cursor {
        private final String text;
        private final int line;
        private final int end;
        private int position;

        private Cursor(String text, int line, int start, int end) {
            this.text = text;
            this.line = line;
            this.position = start;
            this.end = end;
        }

        List<RegexAst> sequence() {
            List<RegexAst> nodes = new ArrayList<>();
            while (true) {
                skipSpace();
                if (atEnd() || peek() == ')' || peek() == '|') {
                    return nodes;
                }
                nodes.add(postfix(atom()));
            }
        }

        void expectEnd() {
            skipSpace();
            if (!atEnd()) {
                throw error("Unexpected '" + peek() + "'");
            }
        }

        private RegexAst postfix(RegexAst node) {
            RegexAst result = node;
            while (true) {
                skipSpace();
                if (atEnd()) {
                    return result;
                }
                char c = peek();
                if (c == '*') {
                    result = new RegexAst.Star(result);
                } else if (c == '+') {
                    result = new RegexAst.Plus(result);
                } else if (c == '?') {
                    result = new RegexAst.Option(result);
                } else {
                    return result;
                }
                position++;
            }
        }

        private RegexAst atom() {
            char c = peek();
            switch (c) {
                case '(':
                    return parenthesized();
                case '[':
                    return symbolClass();
                case '#':
                    position++;
                    return new RegexAst.Boundary();
                case '0':
                    position++;
                    return new RegexAst.Epsilon();
                case '*':
                case '+':
                case '?':
                    throw error("Operator '" + c + "' has nothing to repeat");
                case ']':
                    throw error("Unbalanced ']'");
                default:
                    break;
            }
            if (text.startsWith(MACRO_DELIMITER, position) && position + MACRO_DELIMITER.length() < end) {
                return macro();
            }
            return new RegexAst.Char(symbol());
        }

        private RegexAst parenthesized() {
            int open = position;
            position++;
            List<RegexAst> alternatives = new ArrayList<>();
            alternatives.add(new RegexAst.Group(sequence()));
            while (!atEnd() && peek() == '|') {
                position++;
                alternatives.add(new RegexAst.Group(sequence()));
            }
            if (atEnd() || peek() != ')') {
                position = open;
                throw error("Unclosed '('");
            }
            position++;
            return alternatives.size() == 1 ? alternatives.get(0) : new RegexAst.Disjunction(alternatives);
        }

        private RegexAst symbolClass() {
            int open = position;
            position++;
            boolean complement = !atEnd() && peek() == '^';
            if (complement) {
                position++;
            }
            Set<String> symbols = new LinkedHashSet<>();
            while (true) {
                if (atEnd()) {
                    position = open;
                    throw error("Unclosed '['");
                }
                char c = peek();
                if (c == ']') {
                    position++;
                    break;
                }
                if (Character.isWhitespace(c)) {
                    position++;
                    continue;
                }
                symbols.add(symbol());
            }
            return complement ? new RegexAst.SymbolClassComplement(symbols) : new RegexAst.SymbolClass(symbols);
        }

        private RegexAst macro() {
            int open = position;
            position += MACRO_DELIMITER.length();
            int close = text.indexOf(MACRO_DELIMITER, position);
            if (close < 0 || close + MACRO_DELIMITER.length() > end) {
                position = open;
                throw error("Unclosed macro reference");
            }
            String name = text.substring(position, close).strip();
            if (name.isEmpty()) {
                position = open;
                throw error("Empty macro name");
            }
            position = close + MACRO_DELIMITER.length();
            return new RegexAst.Macro(name);
        }

        /**
         * One symbol: an optionally escaped base character plus any combining marks after it.
         */
        private String symbol() {
            if (peek() == '\\') {
                position++;
                if (atEnd()) {
                    throw error("Dangling escape");
                }
            }
            int startOfSymbol = position;
            position += Character.charCount(text.codePointAt(position));
            while (!atEnd() && isCombining(text.codePointAt(position))) {
                position += Character.charCount(text.codePointAt(position));
            }
            return text.substring(startOfSymbol, position);
        }

        private void skipSpace() {
            while (!atEnd() && Character.isWhitespace(peek())) {
                position++;
            }
        }

        private boolean atEnd() {
            return position >= end;
        }

        private char peek() {
            return text.charAt(position);
        }

        private RuleSyntaxException error(String message) {
            return new RuleSyntaxException(message, line, position + 1);
        }

        private static boolean isCombining(int codePoint) {
            int type = Character.getType(codePoint);
            return type == Character.NON_SPACING_MARK
                    || type == Character.ENCLOSING_MARK
                    || type == Character.COMBINING_SPACING_MARK;
        }
    }
}
