package it.denzosoft.bytepair.tokenizer;

import java.nio.charset.StandardCharsets;

/**
 * Emitted once per accepted merge during training.
 */
public final class TrainingEvent {
    private final int left;
    private final int right;
    private final int newId;
    private final byte[] tokenBytes;

    public TrainingEvent(int left, int right, int newId, byte[] tokenBytes) {
        this.left = left;
        this.right = right;
        this.newId = newId;
        this.tokenBytes = tokenBytes.clone();
    }

    public int left() { return left; }
    public int right() { return right; }
    public int newId() { return newId; }
    public byte[] tokenBytes() { return tokenBytes.clone(); }

    /** Token bytes as text, for display. Invalid UTF-8 shows as replacement characters. */
    public String token() {
        return new String(tokenBytes, StandardCharsets.UTF_8);
    }

    @Override
    public String toString() {
        return "Merged IDs (" + left + ", " + right + ") as a new token \"" + token() + "\" with ID " + newId;
    }
}
