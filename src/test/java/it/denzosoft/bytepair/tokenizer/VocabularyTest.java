package it.denzosoft.bytepair.tokenizer;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class VocabularyTest {

    private Vocabulary vocabulary;

    @BeforeEach
    void setUp() {
        vocabulary = new Vocabulary();
    }

    @Test
    void testStartsWithByteIdentities() {
        assertEquals(256, vocabulary.size());
        for (int i = 0; i < 256; i++) {
            assertArrayEquals(new byte[] { (byte) i }, vocabulary.tokenOf(i));
        }
        assertEquals(0, vocabulary.mergeCount());
    }

    @Test
    void testUnknownIdFails() {
        TokenizerException e = assertThrows(TokenizerException.class, () -> vocabulary.tokenOf(256));
        assertEquals(ErrorKind.UNKNOWN_TOKEN, e.kind());
        assertThrows(TokenizerException.class, () -> vocabulary.tokenOf(-1));
    }

    @Test
    void testMergeConcatenatesParents() {
        MergeRule first = vocabulary.addMerge('a', 'b');
        MergeRule second = vocabulary.addMerge(first.id(), 'c');

        assertEquals(256, first.id());
        assertEquals(257, second.id());
        assertArrayEquals("ab".getBytes(), vocabulary.tokenOf(256));
        assertArrayEquals("abc".getBytes(), vocabulary.tokenOf(257));
        assertEquals(256, vocabulary.idOfPair('a', 'b'));
        assertEquals(-1, vocabulary.idOfPair('b', 'a'));
        assertEquals(258, vocabulary.size());
    }

    @Test
    void testSamePairCannotBeMergedTwice() {
        vocabulary.addMerge(97, 97);
        assertThrows(IllegalStateException.class, () -> vocabulary.addMerge(97, 97));
        assertEquals(257, vocabulary.size());
    }

    @Test
    void testMergesAndSpecialsShareCounter() {
        vocabulary.addMerge(97, 97);
        assertEquals(257, vocabulary.registerSpecial("<END>"));
        assertEquals(258, vocabulary.addMerge(256, 256).id());
        assertTrue(vocabulary.isSpecial(257));
        assertFalse(vocabulary.isSpecial(258));
    }

    @Test
    void testRegistrationIsIdempotent() {
        int id = vocabulary.registerSpecial("<|endoftext|>");
        int size = vocabulary.size();
        assertEquals(id, vocabulary.registerSpecial("<|endoftext|>"));
        assertEquals(size, vocabulary.size());
    }

    @Test
    void testSpecialTokenResolvesToLiteralBytes() {
        int id = vocabulary.registerSpecial("<END>");
        assertArrayEquals("<END>".getBytes(), vocabulary.tokenOf(id));
        assertTrue(vocabulary.contains(id));
    }

    @Test
    void testEmptySpecialTokenRejected() {
        TokenizerException e = assertThrows(TokenizerException.class, () -> vocabulary.registerSpecial(""));
        assertEquals(ErrorKind.SPECIAL_TOKEN_CONFLICT, e.kind());
        assertThrows(TokenizerException.class, () -> vocabulary.registerSpecial(null));
        assertEquals(256, vocabulary.size());
    }

    @Test
    void testTokenOfReturnsCopy() {
        vocabulary.addMerge(1, 2);
        vocabulary.tokenOf(256)[0] = 42;
        assertArrayEquals(new byte[] { 1, 2 }, vocabulary.tokenOf(256));
    }

    @Test
    void testResetRestoresInitialState() {
        vocabulary.addMerge(97, 98);
        vocabulary.registerSpecial("<END>");
        vocabulary.reset();

        assertEquals(256, vocabulary.size());
        assertEquals(0, vocabulary.mergeCount());
        assertEquals(-1, vocabulary.idOfPair(97, 98));
        assertTrue(vocabulary.specialTokens().isEmpty());
        assertFalse(vocabulary.contains(256));
    }

    @Test
    void testPairKeyOrdersLexicographically() {
        assertTrue(Vocabulary.pairKey(1, 500) < Vocabulary.pairKey(2, 0));
        assertTrue(Vocabulary.pairKey(3, 4) < Vocabulary.pairKey(3, 5));
        long key = Vocabulary.pairKey(300, 7);
        assertEquals(300, Vocabulary.leftOf(key));
        assertEquals(7, Vocabulary.rightOf(key));
    }
}
