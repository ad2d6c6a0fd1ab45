package org.lituus.mtgl.parser;

import org.junit.jupiter.api.Test;
import org.lituus.mtgl.catalog.SymbolCatalog;
import org.lituus.mtgl.error.MtglError;
import org.lituus.mtgl.error.MtglException;
import org.lituus.mtgl.grammar.Grammar;
import org.lituus.mtgl.grammar.GrammarParser;
import org.lituus.mtgl.lexer.Lexer;
import org.lituus.mtgl.lexer.Token;
import org.lituus.mtgl.tagger.Tagger;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ClauseEngineTest {

    private static final Tagger TAGGER = Tagger.create(SymbolCatalog.standard());
    private static final Lexer LEXER = Lexer.create();
    private static final ClauseParser STANDARD = ClauseEngine.create(Grammar.standard());

    private static List<Token> tokens(String line) {
        return LEXER.tokenize(TAGGER.tag(line));
    }

    private static ClauseEngine engine(String grammarText) {
        return ClauseEngine.create(GrammarParser.parse(grammarText));
    }

    private static List<ClauseKind> kinds(List<Clause> clauses) {
        return clauses.stream().map(Clause::kind).toList();
    }

    // === Standard Grammar ===

    @Test
    void parse_manaAbility_capturesSymbols() {
        var clauses = STANDARD.parse(tokens("Add {B}{B}{B}."));

        assertEquals(1, clauses.size());
        var action = clauses.get(0);
        assertEquals(ClauseKind.ACTION, action.kind());
        assertEquals("add", action.attributes().get("action"));
        assertEquals(0, action.start());
        assertEquals(5, action.end());

        assertEquals(1, action.children().size());
        var mana = action.children().get(0);
        assertEquals(ClauseKind.MANA, mana.kind());
        assertEquals(Map.of("mana", "{B}{B}{B}"), mana.attributes());
    }

    @Test
    void parse_unknownWords_becomeOneUnparsedClause() {
        var clauses = STANDARD.parse(tokens("Frobnicate the wizzle, then draw a card."));

        assertEquals(List.of(ClauseKind.UNPARSED, ClauseKind.ACTION), kinds(clauses));
        var unparsed = clauses.get(0);
        assertEquals(0, unparsed.start());
        assertEquals(3, unparsed.end());
        assertEquals("Frobnicate the wizzle", unparsed.attributes().get("text"));
        assertEquals("1:1-1:22", unparsed.attributes().get("span"));
        assertNull(unparsed.rule());

        var action = clauses.get(1);
        assertEquals(3, action.start());
        assertEquals(9, action.end());
        assertEquals("draw", action.attributes().get("action"));
        assertEquals("a card", action.attributes().get("args"));
    }

    @Test
    void parse_triggeredAbility_nestsConditionAndEffect() {
        var clauses = STANDARD.parse(tokens("When this creature enters the battlefield, draw a card."));

        assertEquals(1, clauses.size());
        var trigger = clauses.get(0);
        assertEquals(ClauseKind.TRIGGER, trigger.kind());
        assertEquals("when", trigger.attributes().get("word"));
        assertEquals(List.of(ClauseKind.CONDITION, ClauseKind.EFFECT), kinds(trigger.children()));

        var condition = trigger.children().get(0).children().get(0);
        assertEquals(ClauseKind.ACTION, condition.kind());
        assertEquals("self", condition.attributes().get("subject"));
        assertEquals("enter", condition.attributes().get("action"));
        assertEquals("battlefield", condition.attributes().get("zone"));

        var effect = trigger.children().get(1).children().get(0);
        assertEquals("draw", effect.attributes().get("action"));
    }

    @Test
    void parse_activatedAbility_splitsCostAndEffect() {
        var activated = STANDARD.parse(tokens("{T}: Add {G}.")).get(0);

        assertEquals(ClauseKind.ACTIVATED, activated.kind());
        assertEquals(List.of(ClauseKind.COST, ClauseKind.EFFECT), kinds(activated.children()));
        var cost = activated.children().get(0);
        assertEquals("{T}", cost.children().get(0).attributes().get("mana"));
    }

    @Test
    void parse_loyaltyAbility_capturesLoyalty() {
        var activated = STANDARD.parse(tokens("+1: Draw a card.")).get(0);

        assertEquals(ClauseKind.ACTIVATED, activated.kind());
        assertEquals("+1", activated.children().get(0).attributes().get("loyalty"));
    }

    @Test
    void parse_conditional_nestsConditionAndEffect() {
        var conditional = STANDARD.parse(tokens("If you control a creature, draw a card.")).get(0);

        assertEquals(ClauseKind.CONDITIONAL, conditional.kind());
        assertEquals(List.of(ClauseKind.CONDITION, ClauseKind.EFFECT), kinds(conditional.children()));
        assertEquals("control", conditional.children().get(0).children().get(0).attributes().get("action"));
    }

    @Test
    void parse_keywordLine_listsKeywords() {
        var line = STANDARD.parse(tokens("Flying, first strike")).get(0);

        assertEquals(ClauseKind.KEYWORD_LINE, line.kind());
        assertEquals(List.of("flying", "first strike"),
                     line.children().stream().map(c -> c.attributes().get("keyword")).toList());
    }

    @Test
    void parse_modalHeaderAndMode() {
        var modal = STANDARD.parse(tokens("Choose one —")).get(0);
        var mode = STANDARD.parse(tokens("• Draw a card.")).get(0);

        assertEquals(ClauseKind.MODAL, modal.kind());
        assertEquals("1", modal.attributes().get("choose"));
        assertEquals(ClauseKind.MODE, mode.kind());
        assertEquals(ClauseKind.ACTION, mode.children().get(0).kind());
    }

    @Test
    void parse_chapter_capturesNumbers() {
        var chapter = STANDARD.parse(tokens("I, II — Draw a card.")).get(0);

        assertEquals(ClauseKind.CHAPTER, chapter.kind());
        assertEquals("1 , 2", chapter.attributes().get("chapter"));
        assertEquals(ClauseKind.ACTION, chapter.children().get(0).kind());
    }

    @Test
    void parse_levelStriation_capturesRangeAndPowerToughness() {
        var level = STANDARD.parse(tokens("LEVEL 2-6 3/3 First strike")).get(0);

        assertEquals(ClauseKind.LEVEL, level.kind());
        assertEquals("2-6", level.attributes().get("level"));
        assertEquals("3/3", level.attributes().get("pt"));
        assertEquals(List.of(ClauseKind.KEYWORD_LINE), kinds(level.children()));
    }

    @Test
    void parse_openLevelStriation_hasNoAbilities() {
        var clauses = STANDARD.parse(tokens("LEVEL 7+ 4/4"));

        assertEquals(1, clauses.size());
        assertEquals("7+", clauses.get(0).attributes().get("level"));
        assertTrue(clauses.get(0).children().isEmpty());
    }

    @Test
    void parse_ifWouldInstead_isReplacement() {
        var clauses = STANDARD.parse(tokens("If you would draw a card, draw two cards instead."));

        assertEquals(1, clauses.size());
        var replacement = clauses.get(0);
        assertEquals(ClauseKind.REPLACEMENT, replacement.kind());
        assertEquals("if", replacement.attributes().get("word"));
        assertEquals(List.of(ClauseKind.CONDITION, ClauseKind.EFFECT), kinds(replacement.children()));
    }

    @Test
    void parse_insteadIf_isReplacement() {
        var replacement = STANDARD.parse(tokens("Draw two cards instead if you control a Wizard.")).get(0);

        assertEquals(ClauseKind.REPLACEMENT, replacement.kind());
        assertEquals("instead", replacement.attributes().get("word"));
        assertEquals(List.of(ClauseKind.EFFECT, ClauseKind.CONDITION), kinds(replacement.children()));
        assertEquals("draw", replacement.children().get(0).children().get(0).attributes().get("action"));
    }

    @Test
    void parse_skip_isReplacement() {
        var clauses = STANDARD.parse(tokens("Target player skips their next turn."));

        assertEquals(1, clauses.size());
        var replacement = clauses.get(0);
        assertEquals(ClauseKind.REPLACEMENT, replacement.kind());
        assertEquals("skip", replacement.attributes().get("word"));
        assertEquals("target player", replacement.attributes().get("subject"));
        assertNotNull(replacement.attributes().get("skipped"));
    }

    @Test
    void parse_conditionalWithoutInstead_staysConditional() {
        var clauses = STANDARD.parse(tokens("If you control a creature, draw a card."));

        assertEquals(List.of(ClauseKind.CONDITIONAL), kinds(clauses));
    }

    @Test
    void parse_unresolvedAmbiguity_reportsCandidates() {
        var clauses = STANDARD.parse(tokens("Counter."));

        assertEquals(1, clauses.size());
        assertTrue(clauses.get(0).isUnparsed());
        assertEquals("action:counter reference:counter", clauses.get(0).attributes().get("candidates"));
    }

    @Test
    void parse_emptyLine_hasNoClauses() {
        assertTrue(STANDARD.parse(List.of()).isEmpty());
    }

    @Test
    void parse_topLevelClauses_coverEveryToken() {
        var lines = List.of(
            "Flying",
            "Flying, first strike",
            "{T}: Add {G}.",
            "Choose one —",
            "• Counter target spell.",
            "I, II — Create a 1/1 white Soldier creature token.",
            "Whenever a creature dies, you gain 1 life.",
            "If you would draw a card, draw two cards instead.",
            "Equipped creature gets +2/+2.",
            "Enchanted creature has \"{T}: Add {R}.\"",
            "Landfall — Whenever a land enters the battlefield under your control, you may draw a card.",
            "qwe ,,, :: — • \" zz { ( } ) ;; target",
            "Exile target creature. Its controller gains life equal to its power.");

        for (var line : lines) {
            var tokens = tokens(line);
            var clauses = STANDARD.parse(tokens);

            int expected = 0;
            for (var clause : clauses) {
                assertEquals(expected, clause.start(), line);
                assertTrue(clause.end() > clause.start(), line);
                expected = clause.end();
            }
            assertEquals(tokens.size(), expected, line);
        }
    }

    // === Engine Mechanics ===

    @Test
    void parse_leftRecursiveRule_isCutByGuard() {
        var engine = engine("A <- A 'x' / 'x' {action}");

        var clauses = engine.parse(tokens("x x"));

        assertEquals(List.of(ClauseKind.ACTION, ClauseKind.ACTION), kinds(clauses));
    }

    @Test
    void parse_clauseOrder_decidesBetweenRules() {
        var engine = engine("""
            %clauses <- First / Any
            First <- ^ . {keyword}
            Any <- . {action}
            """);

        var clauses = engine.parse(tokens("x x"));

        assertEquals(List.of(ClauseKind.KEYWORD, ClauseKind.ACTION), kinds(clauses));
        assertEquals("First", clauses.get(0).rule());
    }

    @Test
    void parse_failedAlternative_leavesNoCaptures() {
        var engine = engine("A <- $a<number> 'zzz' / $b<number> {action}");

        var clause = engine.parse(tokens("3")).get(0);

        assertEquals(Map.of("b", "3"), clause.attributes());
    }

    @Test
    void parse_repeatedCapture_joinsValues() {
        var engine = engine("A <- $n<number> $n<number> {action}");

        var clause = engine.parse(tokens("3 4")).get(0);

        assertEquals("3 4", clause.attributes().get("n"));
    }

    @Test
    void parse_predicates_consumeNothing() {
        var engine = engine("A <- &number $n<number> !. {action}");

        var clause = engine.parse(tokens("3")).get(0);

        assertEquals(1, clause.tokenCount());
        assertEquals("3", clause.attributes().get("n"));
    }

    @Test
    void parse_nestedSpans_parseAgain() {
        var engine = engine("""
            %clauses <- Outer / Item
            Outer <- 'then' [ .+ ] {effect}
            Item <- . {action}
            """);

        var outer = engine.parse(tokens("then then draw")).get(0);

        assertEquals(ClauseKind.EFFECT, outer.kind());
        var inner = outer.children().get(0);
        assertEquals(ClauseKind.EFFECT, inner.kind());
        assertEquals(ClauseKind.ACTION, inner.children().get(0).kind());
    }

    @Test
    void parse_nestingDepthReached_yieldsUnparsedChild() {
        var grammar = GrammarParser.parse("""
            %clauses <- Outer / Item
            Outer <- 'then' [ .+ ] {effect}
            Item <- . {action}
            """);
        var engine = ClauseEngine.create(grammar, new ParserConfig(1, true, true));

        var inner = engine.parse(tokens("then then draw")).get(0).children().get(0);

        assertEquals(ClauseKind.EFFECT, inner.kind());
        var leaf = inner.children().get(0);
        assertTrue(leaf.isUnparsed());
        assertEquals("draw", leaf.attributes().get("text"));
    }

    @Test
    void parse_withoutMerging_reportsEachUnmatchedToken() {
        var engine = ClauseEngine.create(Grammar.standard(), new ParserConfig(16, false, true));

        var clauses = engine.parse(tokens("Frobnicate the wizzle, then draw a card."));

        assertEquals(List.of(ClauseKind.UNPARSED, ClauseKind.UNPARSED, ClauseKind.UNPARSED, ClauseKind.ACTION),
                     kinds(clauses));
        assertTrue(clauses.subList(0, 3).stream().allMatch(c -> c.tokenCount() == 1));
    }

    // === Memoization ===

    private static final List<String> REAL_LINES = List.of(
        "Landfall — Whenever a land enters the battlefield under your control, you may draw a card.",
        "{T}, Sacrifice a creature: Draw a card.",
        "When this creature enters, if you control an artifact, draw a card.",
        "If you would draw a card, draw two cards instead.",
        "Choose one — • Counter target spell. • Return target permanent to its owner's hand.");

    private static void assertCoversEveryToken(List<Token> tokens, List<Clause> clauses) {
        int expected = 0;
        for (var clause : clauses) {
            assertEquals(expected, clause.start());
            expected = clause.end();
        }
        assertEquals(tokens.size(), expected);
    }

    @Test
    void parse_repeatedConditionals_finishesQuickly() {
        var tokens = tokens("if ".repeat(60) + ",");

        var clauses = assertTimeoutPreemptively(Duration.ofSeconds(10), () -> STANDARD.parse(tokens));

        assertCoversEveryToken(tokens, clauses);
    }

    @Test
    void parse_repeatedTriggers_finishesQuickly() {
        var tokens = tokens("when ".repeat(12) + "x , ".repeat(12));

        var clauses = assertTimeoutPreemptively(Duration.ofSeconds(10), () -> STANDARD.parse(tokens));

        assertCoversEveryToken(tokens, clauses);
    }

    @Test
    void parse_withoutPackrat_givesSameClauses() {
        var uncached = ClauseEngine.create(Grammar.standard(), new ParserConfig(16, true, false));

        for (var line : REAL_LINES) {
            var tokens = tokens(line);
            assertEquals(uncached.parse(tokens), STANDARD.parse(tokens), line);
        }
    }

    @Test
    void parse_memoizedSubtrees_areFreshInstances() {
        var clauses = STANDARD.parse(tokens("if if if draw a card , draw a card."));
        var seen = Collections.newSetFromMap(new IdentityHashMap<Clause, Boolean>());

        var pending = new ArrayDeque<>(clauses);
        while (!pending.isEmpty()) {
            var clause = pending.pop();
            assertTrue(seen.add(clause));
            pending.addAll(clause.children());
        }
    }

    // === Configuration ===

    @Test
    void create_unknownClauseKind_fails() {
        var grammar = GrammarParser.parse("A <- 'x' {sorcery}");

        var exception = assertThrows(MtglException.class, () -> ClauseEngine.create(grammar));
        assertInstanceOf(MtglError.GrammarError.class, exception.error());
    }

    @Test
    void create_unparsedKind_isReserved() {
        var grammar = GrammarParser.parse("A <- 'x' {unparsed}");

        assertThrows(MtglException.class, () -> ClauseEngine.create(grammar));
    }

    @Test
    void create_lineClassKinds_areReserved() {
        assertThrows(MtglException.class, () -> ClauseEngine.create(GrammarParser.parse("A <- 'x' {static}")));
        assertThrows(MtglException.class, () -> ClauseEngine.create(GrammarParser.parse("A <- 'x' {spell}")));
    }

    @Test
    void create_invalidGrammar_fails() {
        var grammar = GrammarParser.parse("A <- B {action}");

        assertThrows(MtglException.class, () -> ClauseEngine.create(grammar));
    }

    @Test
    void parserConfig_nonPositiveDepth_isRejected() {
        assertThrows(IllegalArgumentException.class, () -> new ParserConfig(0, true, true));
    }

    @Test
    void clauseKind_labelsRoundTrip() {
        assertEquals("keyword-line", ClauseKind.KEYWORD_LINE.label());
        assertEquals(ClauseKind.ABILITY_WORD, ClauseKind.fromLabel("ability-word").orElseThrow());
        assertTrue(ClauseKind.fromLabel("sorcery").isEmpty());
    }
}
