package org.lituus.mtgl.catalog;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ManaSymbolsTest {

    @Test
    void classify_repeatedSymbols_countsInOrder() {
        var mana = ManaSymbols.classify("{2}{W}{W}").orElseThrow();

        assertEquals(List.of("2", "W", "W"), mana.symbols());
        assertEquals("2=1 W=2", mana.describeCounts());
        assertTrue(mana.mana());
    }

    @Test
    void classify_tapOnly_isNotMana() {
        var tap = ManaSymbols.classify("{T}").orElseThrow();
        var mixed = ManaSymbols.classify("{T}{B}").orElseThrow();

        assertFalse(tap.mana());
        assertTrue(mixed.mana());
    }

    @Test
    void classify_separatedSymbols_isEmpty() {
        assertTrue(ManaSymbols.classify("{W} {U}").isEmpty());
        assertFalse(ManaSymbols.isBraceString("{}"));
    }

    @Test
    void canonical_hybridHalves_usePrintedOrder() {
        assertEquals("W/U", ManaSymbols.canonical("u/w").orElseThrow());
        assertEquals("W/U", ManaSymbols.canonical("W/U").orElseThrow());
        assertEquals("2/W", ManaSymbols.canonical("2/w").orElseThrow());
    }

    @Test
    void canonical_phyrexian_keepsMarker() {
        assertEquals("W/P", ManaSymbols.canonical("w/p").orElseThrow());
        assertEquals("G/U/P", ManaSymbols.canonical("u/g/p").orElseThrow());
    }

    @Test
    void canonical_unknownBody_isEmpty() {
        assertTrue(ManaSymbols.canonical("Z/Q").isEmpty());
        assertTrue(ManaSymbols.canonical("W/W").isEmpty());
    }

    @Test
    void canonicalText_rendersBraces() {
        assertEquals("{B}{B}{B}", ManaSymbols.classify("{b}{b}{b}").orElseThrow().canonicalText());
    }
}
