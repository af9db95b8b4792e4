package it.denzosoft.bytepair.tokenizer;

import java.nio.charset.StandardCharsets;
import java.util.*;

/**
 * Append-only symbol table: byte identities 0-255, learned merges and special tokens.
 * Merge results and special tokens share one ID counter starting at 256.
 */
public class Vocabulary {

    public static final int BYTE_TOKENS = 256;

    private final Map<Integer, byte[]> idToToken = new HashMap<>();
    private final Map<Long, Integer> pairToId = new HashMap<>(); // pair key -> merged ID
    private final List<MergeRule> merges = new ArrayList<>();
    private final SpecialTokens specialTokens = new SpecialTokens();
    private int nextId;

    public Vocabulary() {
        reset();
    }

    /** Drops every merge and special token, keeping only the 256 byte identities. */
    public void reset() {
        idToToken.clear();
        pairToId.clear();
        merges.clear();
        specialTokens.clear();
        for (int i = 0; i < BYTE_TOKENS; i++) {
            idToToken.put(i, new byte[] { (byte) i });
        }
        nextId = BYTE_TOKENS;
    }

    static long pairKey(int left, int right) {
        return ((long) left << 32) | (right & 0xFFFFFFFFL);
    }

    static int leftOf(long pairKey) {
        return (int) (pairKey >>> 32);
    }

    static int rightOf(long pairKey) {
        return (int) pairKey;
    }

    /**
     * Returns the bytes an ID stands for. Special tokens yield the UTF-8 bytes of their literal.
     *
     * @throws TokenizerException of kind UNKNOWN_TOKEN if the ID was never assigned
     */
    public byte[] tokenOf(int tokenId) {
        String literal = specialTokens.getLiteral(tokenId);
        if (literal != null) {
            return literal.getBytes(StandardCharsets.UTF_8);
        }
        byte[] token = idToToken.get(tokenId);
        if (token == null) {
            throw TokenizerException.unknownToken(tokenId);
        }
        return token.clone();
    }

    public boolean contains(int tokenId) {
        return idToToken.containsKey(tokenId) || specialTokens.contains(tokenId);
    }

    /** @return the ID the pair merges into, or -1 if no rule exists */
    public int idOfPair(int left, int right) {
        Integer id = pairToId.get(pairKey(left, right));
        return id == null ? -1 : id;
    }

    /**
     * Records a new merge rule under the next free ID.
     * The token of the new ID is the concatenation of the two parent tokens.
     */
    MergeRule addMerge(int left, int right) {
        long key = pairKey(left, right);
        if (pairToId.containsKey(key)) {
            throw new IllegalStateException("Pair (" + left + ", " + right + ") already merged into " + pairToId.get(key));
        }
        byte[] leftToken = idToToken.get(left);
        byte[] rightToken = idToToken.get(right);
        if (leftToken == null || rightToken == null) {
            throw TokenizerException.unknownToken(leftToken == null ? left : right);
        }

        byte[] merged = Arrays.copyOf(leftToken, leftToken.length + rightToken.length);
        System.arraycopy(rightToken, 0, merged, leftToken.length, rightToken.length);

        int id = nextId++;
        MergeRule rule = new MergeRule(left, right, id);
        pairToId.put(key, id);
        idToToken.put(id, merged);
        merges.add(rule);
        return rule;
    }

    /**
     * Registers a special token literal. Registering a known literal again returns its
     * existing ID and consumes nothing.
     */
    public int registerSpecial(String literal) {
        int existing = specialTokens.getTokenId(literal);
        if (existing >= 0) {
            return existing;
        }
        int id = nextId;
        specialTokens.add(literal, id);
        nextId++;
        return id;
    }

    public boolean isSpecial(int tokenId) {
        return specialTokens.contains(tokenId);
    }

    public SpecialTokens specialTokens() { return specialTokens; }

    /** Next unused ID, i.e. the number of symbols defined so far. */
    public int size() { return nextId; }

    public int mergeCount() { return merges.size(); }

    /** Merge rules in creation order. */
    public List<MergeRule> merges() {
        return Collections.unmodifiableList(merges);
    }
}
