package it.denzosoft.bytepair.tokenizer;

import java.util.Collections;
import java.util.List;

public final class TrainingResult {
    private final int mergeCount;
    private final int finalVocabSize;
    private final List<TrainingEvent> events;

    public TrainingResult(int mergeCount, int finalVocabSize, List<TrainingEvent> events) {
        this.mergeCount = mergeCount;
        this.finalVocabSize = finalVocabSize;
        this.events = Collections.unmodifiableList(events);
    }

    /** Merges performed by this call only. */
    public int mergeCount() { return mergeCount; }
    public int finalVocabSize() { return finalVocabSize; }
    public List<TrainingEvent> events() { return events; }

    @Override
    public String toString() {
        return String.format("Training complete: %d merges performed. Final vocabulary size: %d",
            mergeCount, finalVocabSize);
    }
}
