package com.astdump.syntax;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class SourceTextTest {

    @Test
    void testSliceReturnsSpanText() {
        SourceText text = SourceText.of("int x = 42;");
        assertEquals("42", text.slice(SourceSpan.of(8, 10)).toString());
        assertEquals("", text.slice(SourceSpan.of(3, 3)).toString());
    }

    @Test
    void testSliceRejectsSpansOutsideText() {
        SourceText text = SourceText.of("abc");
        assertThrows(InvalidSpanException.class, () -> text.slice(SourceSpan.of(-1, 2)));
        assertThrows(InvalidSpanException.class, () -> text.slice(SourceSpan.of(1, 4)));
        assertThrows(InvalidSpanException.class, () -> text.slice(SourceSpan.of(2, 1)));
        assertThrows(InvalidSpanException.class, () -> text.slice(null));
    }

    @Test
    void testInvalidSpanExceptionCarriesSpan() {
        SourceText text = SourceText.of("abc");
        SourceSpan span = SourceSpan.of(5, 9);
        InvalidSpanException e = assertThrows(InvalidSpanException.class, () -> text.slice(span));
        assertEquals(span, e.getSpan());
        assertTrue(e.getMessage().contains("[5, 9)"), e.getMessage());
    }

    @Test
    void testOffsetOfHandlesAllLineTerminators() {
        SourceText text = new SourceText("Mixed.java", "a\nbc\r\nd\re");
        assertEquals(4, text.lineCount());
        assertEquals(0, text.offsetOf(1, 1));
        assertEquals(2, text.offsetOf(2, 1));
        assertEquals(3, text.offsetOf(2, 2));
        assertEquals(6, text.offsetOf(3, 1));
        assertEquals(8, text.offsetOf(4, 1));
    }

    @Test
    void testOffsetOfRejectsMissingLines() {
        SourceText text = SourceText.of("one\ntwo");
        assertThrows(InvalidSpanException.class, () -> text.offsetOf(0, 1));
        assertThrows(InvalidSpanException.class, () -> text.offsetOf(3, 1));
        assertThrows(InvalidSpanException.class, () -> text.offsetOf(2, 10));
    }
}
