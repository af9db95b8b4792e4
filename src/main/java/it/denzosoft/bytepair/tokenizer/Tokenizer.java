package it.denzosoft.bytepair.tokenizer;

import java.util.List;

/**
 * A trainable byte-level tokenizer. IDs 0-255 are the raw bytes; higher IDs are
 * learned merges and special tokens, drawn from one counter.
 */
public interface Tokenizer {

    /** Learns merges from the corpus, resuming from any merges already known. */
    TrainingResult train(byte[] corpus, boolean stopEarly, TrainingListener listener);

    /** @return the ID of the literal, existing or newly assigned */
    int registerSpecial(String literal);

    /** @return the ID registered for the literal, or -1 */
    int specialTokenId(String literal);

    int[] encode(String text);
    String decode(int[] tokens);

    /** Decode variant that reports unknown IDs as a failed result instead of throwing. */
    TokenizerResult<String> tryDecode(int[] tokens);

    byte[] tokenOf(int tokenId);
    int vocabSize();
    int maxVocabSize();
    int mergeCount();
    List<MergeRule> merges();
    boolean isSpecialToken(int tokenId);
}
