package org.lituus.mtgl.grammar;

import org.lituus.mtgl.tree.SourceSpan;

/**
 * Tokens of clause grammar text.
 */
public sealed interface GrammarToken {
    SourceSpan span();

    /**
     * Rule name or token type name.
     */
    record Identifier(SourceSpan span, String name) implements GrammarToken {}

    /**
     * Quoted token value, escapes already resolved.
     */
    record StringLiteral(SourceSpan span, String value) implements GrammarToken {}

    /**
     * Clause kind of a rule: {@code { trigger }}.
     */
    record KindBlock(SourceSpan span, String kind) implements GrammarToken {}

    record Directive(SourceSpan span, String name) implements GrammarToken {}

    /**
     * Single-character operator or delimiter. The rule arrow ({@code <-} or {@code ←}) is
     * reported as {@link #ARROW}.
     */
    record Operator(SourceSpan span, char symbol) implements GrammarToken {
        public static final char ARROW = '←';

        public boolean is(char expected) {
            return symbol == expected;
        }

        public String display() {
            return symbol == ARROW ? "'<-'" : "'" + symbol + "'";
        }
    }

    record Eof(SourceSpan span) implements GrammarToken {}

    record Error(SourceSpan span, String message) implements GrammarToken {}

    /**
     * Whether the token is the operator {@code symbol}.
     */
    static boolean isOperator(GrammarToken token, char symbol) {
        return token instanceof Operator operator && operator.is(symbol);
    }
}
