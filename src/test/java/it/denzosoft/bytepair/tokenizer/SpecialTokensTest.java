package it.denzosoft.bytepair.tokenizer;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SpecialTokensTest {

    private SpecialTokens specials;

    @BeforeEach
    void setUp() {
        specials = new SpecialTokens();
    }

    @Test
    void testNoSpecialsYieldsSingleSpan() {
        List<SpecialTokens.Span> spans = specials.split("plain text");
        assertEquals(1, spans.size());
        assertFalse(spans.get(0).isSpecial());
        assertEquals("plain text", spans.get(0).text());
        assertTrue(specials.split("").isEmpty());
    }

    @Test
    void testSplitsAroundLiterals() {
        specials.add("<END>", 300);
        List<SpecialTokens.Span> spans = specials.split("a<END>b<END>");

        assertEquals(4, spans.size());
        assertEquals("a", spans.get(0).text());
        assertEquals(300, spans.get(1).specialId());
        assertEquals("b", spans.get(2).text());
        assertEquals(-1, spans.get(2).specialId());
        assertEquals(300, spans.get(3).specialId());
    }

    @Test
    void testAdjacentLiteralsLeaveNoEmptySpans() {
        specials.add("<a>", 1000);
        List<SpecialTokens.Span> spans = specials.split("<a><a>");
        assertEquals(2, spans.size());
        assertTrue(spans.get(0).isSpecial());
        assertTrue(spans.get(1).isSpecial());
    }

    @Test
    void testEarliestPositionWins() {
        specials.add("bc", 1);
        specials.add("abcd", 2);
        List<SpecialTokens.Span> spans = specials.split("xabcdbc");

        assertEquals(3, spans.size());
        assertEquals("x", spans.get(0).text());
        assertEquals(2, spans.get(1).specialId());
        assertEquals(1, spans.get(2).specialId());
    }

    @Test
    void testLongestLiteralAtSamePosition() {
        specials.add("<|end", 1);
        specials.add("<|end|>", 2);
        List<SpecialTokens.Span> spans = specials.split("<|end|><|end");

        assertEquals(2, spans.size());
        assertEquals(2, spans.get(0).specialId());
        assertEquals(1, spans.get(1).specialId());
    }

    @Test
    void testLiteralsAreNotPatterns() {
        specials.add(".*", 7);
        List<SpecialTokens.Span> spans = specials.split("abc.*d");
        assertEquals(3, spans.size());
        assertEquals("abc", spans.get(0).text());
        assertEquals(7, spans.get(1).specialId());
        assertEquals("d", spans.get(2).text());
    }

    @Test
    void testPartialPrefixFallsBackToText() {
        specials.add("<END>", 300);
        List<SpecialTokens.Span> spans = specials.split("<EN<END>");
        assertEquals(2, spans.size());
        assertEquals("<EN", spans.get(0).text());
        assertEquals(300, spans.get(1).specialId());
    }

    @Test
    void testDuplicateLiteralConflicts() {
        specials.add("<END>", 300);
        TokenizerException e = assertThrows(TokenizerException.class, () -> specials.add("<END>", 301));
        assertEquals(ErrorKind.SPECIAL_TOKEN_CONFLICT, e.kind());
        assertEquals(300, specials.getTokenId("<END>"));
        assertNull(specials.getLiteral(301));
    }

    @Test
    void testLoneSurrogateLiteralRejected() {
        TokenizerException e = assertThrows(TokenizerException.class, () -> specials.add("\uDE00x", 300));
        assertEquals(ErrorKind.SPECIAL_TOKEN_CONFLICT, e.kind());
        assertTrue(specials.isEmpty());

        assertTrue(SpecialTokens.isWellFormed("a\uD83D\uDE00b"));
        assertFalse(SpecialTokens.isWellFormed("\uD83D"));
        assertFalse(SpecialTokens.isWellFormed("\uDE00\uD83D"));
    }

    @Test
    void testMatchDoesNotStartInsideSurrogatePair() {
        specials.add("\uD83D\uDE00", 300);
        List<SpecialTokens.Span> spans = specials.split("\uD83D\uDE00\uD83D\uDE01");
        assertEquals(2, spans.size());
        assertEquals(300, spans.get(0).specialId());
        assertEquals("\uD83D\uDE01", spans.get(1).text());
    }
}
