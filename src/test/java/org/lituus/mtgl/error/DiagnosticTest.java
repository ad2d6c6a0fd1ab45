package org.lituus.mtgl.error;

import org.junit.jupiter.api.Test;
import org.lituus.mtgl.tree.SourceLocation;
import org.lituus.mtgl.tree.SourceSpan;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DiagnosticTest {

    private static final List<String> LINES = List.of("Frobnicate the wizzle, then draw a card.");

    @Test
    void format_warningWithLabelAndNote() {
        var diagnostic = Diagnostic.warning("W001", "unparsed span", SourceSpan.onLine(1, 0, 10))
                                   .withLabel("no clause rule matched")
                                   .withNote("tokens: word");

        var expected = """
            warning[W001]: unparsed span
              --> Test:1:1
              |
            1 | Frobnicate the wizzle, then draw a card.
              | ^^^^^^^^^^ no clause rule matched
              |
              = note: tokens: word
            """;
        assertEquals(expected, diagnostic.format(LINES, "Test"));
    }

    @Test
    void format_secondaryLabel_isDashed() {
        var diagnostic = Diagnostic.error("boom", SourceSpan.onLine(1, 0, 10))
                                   .withLabel("here")
                                   .withSecondaryLabel(SourceSpan.onLine(1, 15, 21), "there")
                                   .withHelp("try again");

        var output = diagnostic.format(LINES, "Test");

        assertTrue(output.startsWith("error: boom\n"));
        assertTrue(output.contains("^^^^^^^^^^ here"));
        assertTrue(output.contains("------ there"));
        assertTrue(output.contains("= help: try again"));
    }

    @Test
    void format_withoutLabels_underlinesSpan() {
        var diagnostic = Diagnostic.error("boom", SourceSpan.onLine(1, 11, 14));

        assertTrue(diagnostic.format(LINES, null).contains("  |            ^^^\n"));
    }

    @Test
    void formatSimple_isOneLine() {
        var diagnostic = Diagnostic.warning("unparsed span", SourceSpan.onLine(2, 4, 8));

        assertEquals("Test:2:5: warning: unparsed span", diagnostic.formatSimple("Test"));
    }

    // === Errors ===

    @Test
    void exception_carriesErrorMessage() {
        var error = new MtglError.GrammarError(SourceLocation.at(3, 7, 40), "Duplicate rule: 'A'");
        var exception = new MtglException(error);

        assertSame(error, exception.error());
        assertEquals("Duplicate rule: 'A' at 3:7", exception.getMessage());
    }

    @Test
    void inputError_namesPositionAndCard() {
        assertEquals("Card #2 'Bolt' rejected: missing oracle text",
                     new MtglError.InputError(2, "Bolt", "missing oracle text").message());
        assertEquals("Card #0 rejected: missing card record",
                     new MtglError.InputError(0, null, "missing card record").message());
    }

    @Test
    void severity_headersUseDisplayName() {
        assertArrayEquals(new Diagnostic.Severity[] {Diagnostic.Severity.ERROR, Diagnostic.Severity.WARNING},
                          Diagnostic.Severity.values());
        assertTrue(Diagnostic.error("boom", SourceSpan.onLine(1, 0, 4)).format(LINES, "Test").startsWith("error: boom"));
    }
}
