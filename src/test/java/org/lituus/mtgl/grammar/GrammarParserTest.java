package org.lituus.mtgl.grammar;

import org.junit.jupiter.api.Test;
import org.lituus.mtgl.error.MtglError;
import org.lituus.mtgl.error.MtglException;
import org.lituus.mtgl.lexer.TokenType;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GrammarParserTest {

    // === Rules ===

    @Test
    void parse_clauseRule_capturesKind() {
        var grammar = GrammarParser.parse("Draw <- action:'draw' {action}");

        assertEquals(1, grammar.rules().size());
        var rule = grammar.rules().get(0);
        assertEquals("Draw", rule.name());
        assertTrue(rule.isClause());
        assertEquals("action", rule.kind().orElseThrow());

        var literal = assertInstanceOf(Expression.TypedLiteral.class, rule.expression());
        assertEquals(TokenType.ACTION, literal.type());
        assertEquals("draw", literal.value());
    }

    @Test
    void parse_ruleWithoutKind_isFragment() {
        var rule = GrammarParser.parse("Boundary <- ',' / '.'").rules().get(0);

        assertFalse(rule.isClause());
        var choice = assertInstanceOf(Expression.Choice.class, rule.expression());
        assertEquals(2, choice.alternatives().size());
    }

    @Test
    void parse_consecutiveRules_splitAtArrow() {
        var grammar = GrammarParser.parse("""
            A <- 'a' 'b'
            B <- A {action}
            """);

        assertEquals(2, grammar.rules().size());
        var seq = assertInstanceOf(Expression.Sequence.class, grammar.rules().get(0).expression());
        assertEquals(2, seq.elements().size());
        var ref = assertInstanceOf(Expression.Reference.class, grammar.rules().get(1).expression());
        assertEquals("A", ref.ruleName());
    }

    // === Terminals ===

    @Test
    void parse_tokenType_createsTypeMatch() {
        var expr = GrammarParser.parse("M <- mana_symbol {mana}").rules().get(0).expression();

        var match = assertInstanceOf(Expression.TypeMatch.class, expr);
        assertEquals(TokenType.MANA_SYMBOL, match.type());
    }

    @Test
    void parse_literal_isNormalized() {
        var expr = GrammarParser.parse("T <- ' Then ' {action}").rules().get(0).expression();

        var literal = assertInstanceOf(Expression.Literal.class, expr);
        assertEquals("then", literal.value());
    }

    @Test
    void parse_pipedLiterals_createDictionary() {
        var expr = GrammarParser.parse("W <- 'Until' | 'unless' | 'as long as'").rules().get(0).expression();

        var dictionary = assertInstanceOf(Expression.Dictionary.class, expr);
        assertEquals(List.of("until", "unless", "as long as"), dictionary.values());
    }

    @Test
    void parse_anchorAndAny_createTerminals() {
        var expr = GrammarParser.parse("L <- ^ keyword . {keyword-line}").rules().get(0).expression();

        var seq = assertInstanceOf(Expression.Sequence.class, expr);
        assertInstanceOf(Expression.Anchor.class, seq.elements().get(0));
        assertInstanceOf(Expression.TypeMatch.class, seq.elements().get(1));
        assertInstanceOf(Expression.Any.class, seq.elements().get(2));
    }

    // === Operators ===

    @Test
    void parse_lookahead_createsAndNot() {
        var expr = GrammarParser.parse("A <- &',' !'.' . {action}").rules().get(0).expression();

        var seq = assertInstanceOf(Expression.Sequence.class, expr);
        assertInstanceOf(Expression.And.class, seq.elements().get(0));
        assertInstanceOf(Expression.Not.class, seq.elements().get(1));
    }

    @Test
    void parse_repetition_createsSuffixOperators() {
        var expr = GrammarParser.parse("A <- number* word+ zone? {action}").rules().get(0).expression();

        var seq = assertInstanceOf(Expression.Sequence.class, expr);
        assertInstanceOf(Expression.ZeroOrMore.class, seq.elements().get(0));
        assertInstanceOf(Expression.OneOrMore.class, seq.elements().get(1));
        assertInstanceOf(Expression.Optional.class, seq.elements().get(2));
    }

    @Test
    void parse_group_wrapsChoice() {
        var expr = GrammarParser.parse("A <- ('a' / 'b') 'c' {action}").rules().get(0).expression();

        var seq = assertInstanceOf(Expression.Sequence.class, expr);
        var group = assertInstanceOf(Expression.Group.class, seq.elements().get(0));
        assertInstanceOf(Expression.Choice.class, group.expression());
    }

    @Test
    void parse_capture_namesInnerExpression() {
        var expr = GrammarParser.parse("N <- $amount<number> {action}").rules().get(0).expression();

        var capture = assertInstanceOf(Expression.Capture.class, expr);
        assertEquals("amount", capture.name());
        assertInstanceOf(Expression.TypeMatch.class, capture.expression());
    }

    @Test
    void parse_nestedSpan_wrapsExpression() {
        var expr = GrammarParser.parse("E <- [ .+ ] {effect}").rules().get(0).expression();

        var nested = assertInstanceOf(Expression.Nested.class, expr);
        var repeated = assertInstanceOf(Expression.OneOrMore.class, nested.expression());
        assertInstanceOf(Expression.Any.class, repeated.expression());
    }

    // === Directives ===

    @Test
    void parse_directives_setVersionAndClauseOrder() {
        var grammar = GrammarParser.parse("""
            %version <- '2'
            %clauses <- B / A
            A <- 'a' {action}
            B <- 'b' {mana}
            """);

        assertEquals("2", grammar.version());
        assertEquals(List.of("B", "A"), grammar.clauseOrder().stream().map(Expression.Reference::ruleName).toList());
        assertEquals(List.of("B", "A"), grammar.clauseRules().stream().map(Rule::name).toList());
    }

    @Test
    void parse_withoutVersion_isUnversioned() {
        assertEquals(Grammar.UNVERSIONED, GrammarParser.parse("A <- 'a' {action}").version());
    }

    @Test
    void parse_comments_areIgnored() {
        var grammar = GrammarParser.parse("""
            # leading comment
            A <- 'a' {action}  # trailing comment
            """);

        assertEquals(1, grammar.rules().size());
    }

    // === Errors ===

    @Test
    void parse_lowerCaseRuleName_fails() {
        assertUnexpected("draw <- 'x' {action}");
    }

    @Test
    void parse_unknownTokenType_fails() {
        assertUnexpected("A <- frob {action}");
    }

    @Test
    void parse_unterminatedString_fails() {
        assertUnexpected("A <- 'abc");
    }

    @Test
    void parse_emptyKind_fails() {
        assertUnexpected("A <- 'a' { }");
    }

    @Test
    void parse_unclosedGroup_fails() {
        assertUnexpected("A <- ( 'a' {action}");
    }

    @Test
    void parse_emptyExpression_fails() {
        assertUnexpected("A <- {action}");
    }

    @Test
    void parse_unknownDirective_fails() {
        assertUnexpected("%whitespace <- 'x'");
    }

    @Test
    void parse_clauseOrderWithLiteral_fails() {
        assertUnexpected("%clauses <- 'a'\nA <- 'a' {action}");
    }

    @Test
    void parse_versionWithoutString_fails() {
        assertUnexpected("%version <- A\nA <- 'a' {action}");
    }

    @Test
    void parse_error_reportsLocation() {
        var error = assertUnexpected("A <- 'a' {action}\nb <- 'x'");

        assertEquals(2, error.location().line());
        assertEquals(1, error.location().column());
    }

    private static MtglError.UnexpectedGrammarInput assertUnexpected(String grammarText) {
        var exception = assertThrows(MtglException.class, () -> GrammarParser.parse(grammarText));
        return assertInstanceOf(MtglError.UnexpectedGrammarInput.class, exception.error());
    }
}
