package org.lituus.mtgl.lexer;

import org.junit.jupiter.api.Test;
import org.lituus.mtgl.catalog.Category;
import org.lituus.mtgl.catalog.SymbolCatalog;
import org.lituus.mtgl.tagger.Tagger;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LexerTest {

    private static final Tagger TAGGER = Tagger.create(SymbolCatalog.standard());
    private static final Lexer LEXER = Lexer.create();

    private static List<Token> tokenize(String line) {
        return LEXER.tokenize(TAGGER.tag(line));
    }

    private static List<TokenType> types(List<Token> tokens) {
        return tokens.stream().map(Token::type).toList();
    }

    // === Ordering and Trivia ===

    @Test
    void tokenize_manaString_splitsPerSymbol() {
        var tokens = tokenize("Add {B}{B}{B}.");

        assertEquals(List.of(TokenType.ACTION, TokenType.MANA_SYMBOL, TokenType.MANA_SYMBOL,
                             TokenType.MANA_SYMBOL, TokenType.PUNCTUATION), types(tokens));
        assertEquals(List.of("add", "B", "B", "B", "."), tokens.stream().map(Token::value).toList());
    }

    @Test
    void tokenize_manaSymbols_shareGroupAndKeepOffsets() {
        var tokens = tokenize("Add {B}{B}{B}.");

        assertEquals(tokens.get(1).group(), tokens.get(3).group());
        assertNotEquals(tokens.get(0).group(), tokens.get(1).group());
        assertEquals(4, tokens.get(1).span().start().offset());
        assertEquals(7, tokens.get(1).span().end().offset());
        assertEquals(10, tokens.get(3).span().start().offset());
        assertEquals(5, tokens.get(1).span().start().column());
        assertEquals("{B}", tokens.get(2).text());
        assertEquals("{B}", tokens.get(2).surface());
    }

    @Test
    void tokenize_tapSymbol_isSymbolToken() {
        var tokens = tokenize("{T}: Add {G}.");

        assertEquals(TokenType.SYMBOL, tokens.get(0).type());
        assertEquals("T", tokens.get(0).value());
        assertTrue(tokens.get(0).isSymbol());
    }

    @Test
    void tokenize_sourceOrder_isPreserved() {
        var tokens = tokenize("When this creature enters the battlefield, draw a card.");

        for (int i = 1; i < tokens.size(); i++) {
            assertTrue(tokens.get(i - 1).span().end().offset() <= tokens.get(i).span().start().offset());
        }
        assertEquals(10, tokens.size());
    }

    @Test
    void tokenize_whitespaceAndReminder_areDropped() {
        var tokens = tokenize("Flying  (This creature can't be blocked.)");

        assertEquals(List.of(TokenType.KEYWORD), types(tokens));
    }

    @Test
    void tokenize_lineNumber_isRecordedInSpans() {
        var tokens = LEXER.tokenize(TAGGER.tag("Draw a card."), 3);

        assertTrue(tokens.stream().allMatch(t -> t.span().start().line() == 3));
    }

    // === Ambiguity Resolution ===

    @Test
    void tokenize_exileAfterPreposition_isZone() {
        var tokens = tokenize("Cast it from exile.");

        assertEquals(TokenType.PREPOSITION, tokens.get(2).type());
        assertEquals(TokenType.ZONE, tokens.get(3).type());
        assertEquals("exile", tokens.get(3).value());
    }

    @Test
    void tokenize_exileAtLineStart_isAction() {
        var first = tokenize("Exile target creature.").get(0);

        assertEquals(TokenType.ACTION, first.type());
        assertEquals("exile", first.value());
        assertEquals("Exile", first.text());
    }

    @Test
    void tokenize_counterBeforeTarget_isAction() {
        assertEquals(TokenType.ACTION, tokenize("Counter target spell.").get(0).type());
    }

    @Test
    void tokenize_counterAfterQuality_isReference() {
        var tokens = tokenize("Put a +1/+1 counter on it.");

        assertEquals(TokenType.QUALITY, tokens.get(2).type());
        assertEquals(TokenType.REFERENCE, tokens.get(3).type());
        assertEquals("counter", tokens.get(3).value());
    }

    @Test
    void tokenize_undecidedAmbiguity_isUnparsedWithCandidates() {
        var first = tokenize("Counter.").get(0);

        assertEquals(TokenType.UNPARSED, first.type());
        assertEquals("counter", first.value());
        assertEquals("action:counter reference:counter", first.attributes().get("candidates"));
    }

    @Test
    void tokenize_customRules_replaceStandardRules() {
        var lexer = Lexer.create(List.of(ContextRule.before("exile", Category.ZONE, Category.PUNCTUATION),
                                         ContextRule.after("counter", Category.REFERENCE, TokenType.QUANTIFIER)));

        assertEquals(TokenType.ZONE, lexer.tokenize(TAGGER.tag("Exile.")).get(0).type());
        assertEquals(TokenType.UNPARSED, lexer.tokenize(TAGGER.tag("Exile target creature.")).get(0).type());
        assertEquals(TokenType.REFERENCE, lexer.tokenize(TAGGER.tag("Remove a counter.")).get(2).type());
    }

    @Test
    void tokenize_noRules_leavesEveryAmbiguityUnparsed() {
        var lexer = Lexer.create(List.of());

        assertEquals(TokenType.UNPARSED, lexer.tokenize(TAGGER.tag("Cast it from exile.")).get(3).type());
    }

    // === Token Types ===

    @Test
    void fromGrammarName_knownAndUnknownNames() {
        assertEquals(TokenType.MANA_SYMBOL, TokenType.fromGrammarName("mana_symbol").orElseThrow());
        assertTrue(TokenType.fromGrammarName("Mana_Symbol").isEmpty());
        assertEquals("ability_word", TokenType.ABILITY_WORD.grammarName());
    }
}
