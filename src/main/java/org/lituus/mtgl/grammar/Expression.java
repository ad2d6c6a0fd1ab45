package org.lituus.mtgl.grammar;

import org.lituus.mtgl.lexer.TokenType;
import org.lituus.mtgl.tree.SourceSpan;

import java.util.List;

/**
 * Clause grammar expression types - the building blocks of clause rules. Terminals match tokens, not characters.
 */
public sealed interface Expression {

    /**
     * Source location of this expression in the grammar.
     */
    SourceSpan span();

    // === Terminals ===

    /**
     * Token of a type: action, mana_symbol
     */
    record TypeMatch(SourceSpan span, TokenType type) implements Expression {}

    /**
     * Token with a normalized value: 'draw'
     */
    record Literal(SourceSpan span, String value) implements Expression {}

    /**
     * Token of a type with a normalized value: action:'exile'
     */
    record TypedLiteral(SourceSpan span, TokenType type, String value) implements Expression {}

    /**
     * Token with one of several values: 'until' | 'unless'
     */
    record Dictionary(SourceSpan span, List<String> values) implements Expression {}

    /**
     * Any token: .
     */
    record Any(SourceSpan span) implements Expression {}

    /**
     * Start of the span being parsed: ^
     */
    record Anchor(SourceSpan span) implements Expression {}

    /**
     * Rule reference: RuleName
     */
    record Reference(SourceSpan span, String ruleName) implements Expression {}

    // === Combinators ===

    /**
     * Sequence: e1 e2 e3
     */
    record Sequence(SourceSpan span, List<Expression> elements) implements Expression {}

    /**
     * Ordered choice: e1 / e2 / e3
     */
    record Choice(SourceSpan span, List<Expression> alternatives) implements Expression {}

    // === Repetition ===

    /**
     * Zero or more: e*
     */
    record ZeroOrMore(SourceSpan span, Expression expression) implements Expression {}

    /**
     * One or more: e+
     */
    record OneOrMore(SourceSpan span, Expression expression) implements Expression {}

    /**
     * Optional: e?
     */
    record Optional(SourceSpan span, Expression expression) implements Expression {}

    // === Predicates ===

    /**
     * Positive lookahead: &e
     */
    record And(SourceSpan span, Expression expression) implements Expression {}

    /**
     * Negative lookahead: !e
     */
    record Not(SourceSpan span, Expression expression) implements Expression {}

    // === Special ===

    /**
     * Named capture: $name< e > - matched token values become clause attribute {@code name}
     */
    record Capture(SourceSpan span, String name, Expression expression) implements Expression {}

    /**
     * Nested span: [ e ] - tokens matched by e are parsed again with the top-level clause rules
     */
    record Nested(SourceSpan span, Expression expression) implements Expression {}

    /**
     * Grouping: ( e )
     */
    record Group(SourceSpan span, Expression expression) implements Expression {}
}
