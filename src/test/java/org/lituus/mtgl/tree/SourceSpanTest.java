package org.lituus.mtgl.tree;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SourceSpanTest {

    @Test
    void onLine_convertsOffsetsToColumns() {
        var span = SourceSpan.onLine(2, 4, 13);

        assertEquals(2, span.start().line());
        assertEquals(5, span.start().column());
        assertEquals(9, span.length());
        assertEquals("2:5-2:14", span.toString());
    }

    @Test
    void extract_returnsCoveredText() {
        assertEquals("{B}{B}{B}", SourceSpan.onLine(1, 4, 13).extract("Add {B}{B}{B}."));
    }

    @Test
    void merge_coversBothSpans() {
        var merged = SourceSpan.onLine(1, 6, 9).merge(SourceSpan.onLine(1, 0, 3));

        assertEquals(0, merged.start().offset());
        assertEquals(9, merged.end().offset());
        assertEquals("Add {B}{B}", merged.extract("Add {B}{B}{B}."));
    }

    @Test
    void at_isEmpty() {
        assertEquals(0, SourceSpan.at(SourceLocation.START).length());
    }
}
