package it.denzosoft.bytepair.tokenizer;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.*;

/**
 * Byte-level BPE tokenizer trained from a raw corpus.
 *
 * Encoding splits the text around special tokens, then reduces every plain span from its
 * UTF-8 bytes by repeated left-to-right passes that apply any known merge, until a pass
 * changes nothing. Decoding concatenates token bytes and converts the result to text once.
 *
 * Not thread-safe: one caller owns the instance for the duration of each operation.
 */
public class BPETokenizer implements Tokenizer {

    private final int maxVocabSize;
    private final Vocabulary vocabulary;
    private final BPETrainer trainer;

    public BPETokenizer(int maxVocabSize) {
        if (maxVocabSize <= Vocabulary.BYTE_TOKENS) {
            throw TokenizerException.config(maxVocabSize);
        }
        this.maxVocabSize = maxVocabSize;
        this.vocabulary = new Vocabulary();
        this.trainer = new BPETrainer(vocabulary);
    }

    @Override
    public int maxVocabSize() { return maxVocabSize; }

    Vocabulary vocabulary() { return vocabulary; }

    public void reset() {
        vocabulary.reset();
    }

    public TrainingResult train(String corpus) {
        return train(utf8(corpus), false, null);
    }

    public TrainingResult train(byte[] corpus, boolean stopEarly) {
        return train(corpus, stopEarly, null);
    }

    /**
     * Learns merges from the corpus until the vocabulary reaches its maximum size.
     * On an already trained tokenizer the corpus is first reduced with the existing
     * merges, so training resumes from the current state.
     */
    @Override
    public TrainingResult train(byte[] corpus, boolean stopEarly, TrainingListener listener) {
        int[] sequence = applyMerges(toByteIds(corpus));
        return trainer.train(sequence, maxVocabSize, stopEarly, listener);
    }

    @Override
    public int registerSpecial(String literal) {
        return vocabulary.registerSpecial(literal);
    }

    @Override
    public int specialTokenId(String literal) {
        return vocabulary.specialTokens().getTokenId(literal);
    }

    @Override
    public int[] encode(String text) {
        if (text == null || text.isEmpty()) return new int[0];

        SpecialTokens specials = vocabulary.specialTokens();
        if (specials.isEmpty()) {
            return encodeOrdinary(text);
        }

        int[] out = new int[16];
        int n = 0;
        for (SpecialTokens.Span span : specials.split(text)) {
            int[] ids = span.isSpecial() ? new int[] { span.specialId() } : encodeOrdinary(span.text());
            if (n + ids.length > out.length) {
                out = Arrays.copyOf(out, Math.max(out.length * 2, n + ids.length));
            }
            System.arraycopy(ids, 0, out, n, ids.length);
            n += ids.length;
        }
        return Arrays.copyOf(out, n);
    }

    /** Encodes text without looking for special tokens. */
    public int[] encodeOrdinary(String text) {
        return encodeBytes(utf8(text));
    }

    /**
     * Strict UTF-8 conversion: an unpaired surrogate has no byte form that decodes back
     * to the same string, so it is rejected instead of replaced.
     *
     * @throws TokenizerException of kind MALFORMED_TEXT
     */
    static byte[] utf8(String text) {
        try {
            ByteBuffer encoded = StandardCharsets.UTF_8.newEncoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT)
                .encode(CharBuffer.wrap(text));
            byte[] bytes = new byte[encoded.remaining()];
            encoded.get(bytes);
            return bytes;
        } catch (CharacterCodingException e) {
            throw TokenizerException.malformedText(e);
        }
    }

    public int[] encodeBytes(byte[] bytes) {
        return applyMerges(toByteIds(bytes));
    }

    private static int[] toByteIds(byte[] bytes) {
        int[] ids = new int[bytes.length];
        for (int i = 0; i < bytes.length; i++) {
            ids[i] = Byte.toUnsignedInt(bytes[i]);
        }
        return ids;
    }

    /**
     * Repeats full passes until one changes nothing. Each pass scans left to right and
     * replaces the first known pair it meets, then resumes after it.
     */
    private int[] applyMerges(int[] ids) {
        boolean changed = true;
        while (changed && ids.length > 1) {
            changed = false;
            int[] out = new int[ids.length];
            int n = 0;
            int i = 0;
            while (i < ids.length) {
                int merged = i + 1 < ids.length ? vocabulary.idOfPair(ids[i], ids[i + 1]) : -1;
                if (merged >= 0) {
                    out[n++] = merged;
                    i += 2;
                    changed = true;
                } else {
                    out[n++] = ids[i++];
                }
            }
            ids = n == out.length ? out : Arrays.copyOf(out, n);
        }
        return ids;
    }

    /**
     * @throws TokenizerException of kind UNKNOWN_TOKEN on an ID absent from the vocabulary
     */
    public byte[] decodeBytes(int[] tokens) {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream(tokens.length * 2);
        for (int token : tokens) {
            byte[] piece = vocabulary.tokenOf(token);
            bytes.write(piece, 0, piece.length);
        }
        return bytes.toByteArray();
    }

    @Override
    public String decode(int[] tokens) {
        return new String(decodeBytes(tokens), StandardCharsets.UTF_8);
    }

    @Override
    public TokenizerResult<String> tryDecode(int[] tokens) {
        try {
            return TokenizerResult.ok(decode(tokens));
        } catch (TokenizerException e) {
            return TokenizerResult.failure(e);
        }
    }

    @Override
    public int vocabSize() { return vocabulary.size(); }

    @Override
    public int mergeCount() { return vocabulary.mergeCount(); }

    @Override
    public List<MergeRule> merges() { return vocabulary.merges(); }

    @Override
    public byte[] tokenOf(int tokenId) {
        return vocabulary.tokenOf(tokenId);
    }

    @Override
    public boolean isSpecialToken(int tokenId) {
        return vocabulary.isSpecial(tokenId);
    }
}
