package org.lituus.mtgl.grammar;

import org.lituus.mtgl.tree.SourceLocation;
import org.lituus.mtgl.tree.SourceSpan;

import java.util.ArrayList;
import java.util.List;

/**
 * Lexer for clause grammar syntax.
 *
 * <p>Never throws on malformed text: problems become {@link GrammarToken.Error} tokens and the parser reports
 * the first one with its location.
 */
public final class GrammarLexer {
    private static final int MAX_INPUT_SIZE = 1_000_000;
    private static final String OPERATORS = "/&!?*+.^:()<>[]$|";

    private final String input;
    private final List<GrammarToken> tokens = new ArrayList<>();
    private int pos;
    private int line = 1;
    private int column = 1;

    private GrammarLexer(String input) {
        this.input = input;
    }

    public static List<GrammarToken> tokenize(String input) {
        if (input.length() > MAX_INPUT_SIZE) {
            throw new IllegalArgumentException("Grammar input exceeds maximum size of " + MAX_INPUT_SIZE
                                               + " characters");
        }
        return new GrammarLexer(input).run();
    }

    private List<GrammarToken> run() {
        for (skipBlank(); pos < input.length(); skipBlank()) {
            var start = location();
            char c = input.charAt(pos);
            if (Character.isLetter(c) || c == '_') {
                var name = word();
                tokens.add(new GrammarToken.Identifier(spanFrom(start), name));
            } else if (c == '%') {
                step();
                var name = word();
                tokens.add(new GrammarToken.Directive(spanFrom(start), name));
            } else if (c == '\'' || c == '"') {
                tokens.add(quoted(start));
            } else if (c == '{') {
                tokens.add(kind(start));
            } else {
                tokens.add(operator(start));
            }
        }
        tokens.add(new GrammarToken.Eof(SourceSpan.at(location())));
        return tokens;
    }

    private String word() {
        int from = pos;
        while (pos < input.length() && isWordChar(input.charAt(pos))) {
            step();
        }
        return input.substring(from, pos);
    }

    private GrammarToken quoted(SourceLocation start) {
        char quote = step();
        var value = new StringBuilder();
        while (pos < input.length() && input.charAt(pos) != quote && input.charAt(pos) != '\n') {
            char c = step();
            if (c == '\\' && pos < input.length()) {
                c = step();
            }
            value.append(c);
        }
        if (pos >= input.length() || input.charAt(pos) != quote) {
            return new GrammarToken.Error(spanFrom(start), "Unterminated string literal");
        }
        step();
        return new GrammarToken.StringLiteral(spanFrom(start), value.toString());
    }

    private GrammarToken kind(SourceLocation start) {
        step();
        int from = pos;
        while (pos < input.length() && input.charAt(pos) != '}') {
            char c = input.charAt(pos);
            if (c == '{' || c == '\n') {
                return new GrammarToken.Error(spanFrom(start), "Malformed clause kind");
            }
            step();
        }
        if (pos >= input.length()) {
            return new GrammarToken.Error(spanFrom(start), "Unterminated clause kind");
        }
        var kind = input.substring(from, pos).strip();
        step();
        if (kind.isEmpty()) {
            return new GrammarToken.Error(spanFrom(start), "Empty clause kind");
        }
        return new GrammarToken.KindBlock(spanFrom(start), kind);
    }

    private GrammarToken operator(SourceLocation start) {
        char c = step();
        if (c == '<' && pos < input.length() && input.charAt(pos) == '-') {
            step();
            return new GrammarToken.Operator(spanFrom(start), GrammarToken.Operator.ARROW);
        }
        if (c == GrammarToken.Operator.ARROW || OPERATORS.indexOf(c) >= 0) {
            return new GrammarToken.Operator(spanFrom(start), c);
        }
        return new GrammarToken.Error(spanFrom(start), "Unexpected character: " + c);
    }

    /**
     * Whitespace and {@code #} line comments.
     */
    private void skipBlank() {
        while (pos < input.length()) {
            char c = input.charAt(pos);
            if (c == '#') {
                while (pos < input.length() && input.charAt(pos) != '\n') {
                    step();
                }
            } else if (Character.isWhitespace(c)) {
                step();
            } else {
                return;
            }
        }
    }

    private char step() {
        char c = input.charAt(pos++);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    private SourceLocation location() {
        return SourceLocation.at(line, column, pos);
    }

    private SourceSpan spanFrom(SourceLocation start) {
        return SourceSpan.of(start, location());
    }

    private static boolean isWordChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }
}
