package it.denzosoft.bytepair.tokenizer;

public final class TrainerConfig {

    public static final TrainerConfig DEFAULT = new TrainerConfig(1000, false);

    private final int maxVocabSize;
    private final boolean stopEarly;

    public TrainerConfig(int maxVocabSize, boolean stopEarly) {
        this.maxVocabSize = maxVocabSize;
        this.stopEarly = stopEarly;
    }

    public int maxVocabSize() { return maxVocabSize; }
    /** Stop as soon as the most frequent pair occurs only once. */
    public boolean stopEarly() { return stopEarly; }

    public static Builder builder() { return new Builder(); }

    public static class Builder {
        private int maxVocabSize = 1000;
        private boolean stopEarly = false;

        public Builder maxVocabSize(int m) { this.maxVocabSize = m; return this; }
        public Builder stopEarly(boolean se) { this.stopEarly = se; return this; }
        public TrainerConfig build() { return new TrainerConfig(maxVocabSize, stopEarly); }
    }
}
