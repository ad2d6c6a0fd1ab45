package org.lituus.mtgl.grammar;

import org.junit.jupiter.api.Test;
import org.lituus.mtgl.error.MtglError;
import org.lituus.mtgl.error.MtglException;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GrammarTest {

    // === Validation ===

    @Test
    void validate_duplicateRule_fails() {
        assertGrammarError("A <- 'a' {action}\nA <- 'b' {action}", "Duplicate rule");
    }

    @Test
    void validate_undefinedReference_fails() {
        assertGrammarError("A <- 'a' Missing {action}", "Undefined rule reference: 'Missing'");
    }

    @Test
    void validate_unknownClauseRule_fails() {
        assertGrammarError("%clauses <- C\nA <- 'a' {action}", "Unknown rule in %clauses");
    }

    @Test
    void validate_fragmentInClauseList_fails() {
        assertGrammarError("%clauses <- A / B\nA <- 'a'\nB <- 'b' {action}", "has no clause kind");
    }

    @Test
    void validate_noClauseRules_fails() {
        assertGrammarError("A <- 'a'", "defines no clause rules");
    }

    @Test
    void validate_validGrammar_returnsItself() {
        var grammar = GrammarParser.parse("A <- 'a'\nB <- A {action}");

        assertSame(grammar, grammar.validate());
    }

    // === Clause Rules ===

    @Test
    void clauseRules_withoutClauseList_useDeclarationOrder() {
        var grammar = GrammarParser.parse("""
            A <- 'a'
            B <- A {action}
            C <- 'c' {mana}
            """);

        assertEquals(List.of("B", "C"), grammar.clauseRules().stream().map(Rule::name).toList());
    }

    @Test
    void rule_lookupByName() {
        var grammar = GrammarParser.parse("A <- 'a'\nB <- A {action}");

        assertTrue(grammar.rule("A").isPresent());
        assertTrue(grammar.rule("Z").isEmpty());
        assertEquals(2, grammar.ruleMap().size());
    }

    // === Bundled Grammar ===

    @Test
    void standard_loadsAndValidates() {
        var grammar = Grammar.standard();

        assertEquals("2", grammar.version());
        var clauseRules = grammar.clauseRules();
        assertEquals(15, clauseRules.size());
        assertEquals("AbilityWord", clauseRules.get(0).name());
        assertEquals("Mana", clauseRules.get(clauseRules.size() - 1).name());
        assertFalse(grammar.rule("Boundary").orElseThrow().isClause());
    }

    @Test
    void standard_isShared() {
        assertSame(Grammar.standard(), Grammar.standard());
    }

    @Test
    void fromResource_missing_fails() {
        assertThrows(IllegalStateException.class, () -> Grammar.fromResource("mtgl/missing.peg"));
    }

    private static void assertGrammarError(String grammarText, String reason) {
        var grammar = GrammarParser.parse(grammarText);
        var exception = assertThrows(MtglException.class, grammar::validate);
        var error = assertInstanceOf(MtglError.GrammarError.class, exception.error());
        assertTrue(error.reason().contains(reason), error.reason());
    }
}
