package com.astdump.token;

import com.astdump.syntax.InvalidSpanException;
import com.astdump.syntax.SourceSpan;
import com.astdump.syntax.SourceText;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class SpanTokenizerTest {

    private static List<String> spellings(String source) {
        SourceText text = SourceText.of(source);
        try (SpanTokenizer tokenizer = SpanTokenizer.open(text, text.fullSpan())) {
            return tokenizer.remaining().stream().map(Token::spelling).toList();
        }
    }

    @Test
    void testNumbersKeepTheirSpelling() {
        assertEquals(List.of("0x1F"), spellings("0x1F"));
        assertEquals(List.of("10UL", ";"), spellings("10UL;"));
        assertEquals(List.of("1_000L"), spellings("1_000L"));
        assertEquals(List.of("1.5e-3f"), spellings("1.5e-3f"));
        assertEquals(List.of("0x1.8p+3"), spellings("0x1.8p+3"));
        assertEquals(List.of(".5"), spellings(".5"));
    }

    @Test
    void testSignEndsNumberUnlessAfterExponent() {
        assertEquals(List.of("1", "+", "2"), spellings("1+2"));
        assertEquals(List.of("0x1E", "+", "3"), spellings("0x1E+3"));
        assertEquals(List.of("2e+10"), spellings("2e+10"));
    }

    @Test
    void testSkipsWhitespaceAndComments() {
        assertEquals(List.of("x", "=", "7"), spellings("  /* lead */ x // tail\n = \t7 // end"));
        assertEquals(List.of(), spellings("   \n\t "));
        assertEquals(List.of(), spellings("/* only a comment */"));
        assertEquals(List.of(), spellings("/* unterminated"));
    }

    @Test
    void testStringsAndCharacters() {
        SourceText text = SourceText.of("\"a\\\"b\" 'c' '\\n'");
        try (SpanTokenizer tokenizer = SpanTokenizer.open(text, text.fullSpan())) {
            List<Token> tokens = tokenizer.remaining();
            assertEquals(3, tokens.size());
            assertEquals(TokenKind.STRING, tokens.get(0).kind());
            assertEquals("\"a\\\"b\"", tokens.get(0).spelling());
            assertEquals(TokenKind.CHARACTER, tokens.get(1).kind());
            assertEquals("'\\n'", tokens.get(2).spelling());
        }
    }

    @Test
    void testPunctuatorsUseLongestMatch() {
        assertEquals(List.of("a", ">>>=", "b"), spellings("a>>>=b"));
        assertEquals(List.of("x", "->", "y"), spellings("x->y"));
        assertEquals(List.of("i", "++", ";"), spellings("i++;"));
        assertEquals(List.of("a", "<<=", "b"), spellings("a<<=b"));
        assertEquals(List.of("(", ")"), spellings("()"));
    }

    @Test
    void testOnlyJavaPunctuatorsAreCombined() {
        assertEquals(List.of("p", "->", "*", "q"), spellings("p->*q"));
        assertEquals(List.of("#", "#"), spellings("##"));
        assertEquals(List.of("a", "::", "b"), spellings("a::b"));
    }

    @Test
    void testTokenSpansAreAbsolute() {
        SourceText text = SourceText.of("int value = 42;");
        try (SpanTokenizer tokenizer = SpanTokenizer.open(text, SourceSpan.of(4, 15))) {
            Token first = tokenizer.next().orElseThrow();
            assertEquals(TokenKind.IDENTIFIER, first.kind());
            assertEquals("value", first.spelling());
            assertEquals(SourceSpan.of(4, 9), first.span());

            tokenizer.next();
            Token number = tokenizer.next().orElseThrow();
            assertEquals(SourceSpan.of(12, 14), number.span());
        }
    }

    @Test
    void testNeverReadsPastTheSpan() {
        SourceText text = SourceText.of("12345");
        try (SpanTokenizer tokenizer = SpanTokenizer.open(text, SourceSpan.of(1, 3))) {
            assertEquals("23", tokenizer.next().orElseThrow().spelling());
            assertTrue(tokenizer.next().isEmpty());
        }
    }

    @Test
    void testClosedTokenizerRefusesToRead() {
        SourceText text = SourceText.of("abc");
        SpanTokenizer tokenizer = SpanTokenizer.open(text, text.fullSpan());
        tokenizer.close();
        assertTrue(tokenizer.isClosed());
        assertThrows(IllegalStateException.class, tokenizer::next);
    }

    @Test
    void testOpenRejectsInvalidSpansAndMissingSource() {
        SourceText text = SourceText.of("abc");
        assertThrows(InvalidSpanException.class, () -> SpanTokenizer.open(text, SourceSpan.of(0, 10)));
        assertThrows(InvalidSpanException.class, () -> SpanTokenizer.open(null, SourceSpan.of(0, 1)));
    }
}
