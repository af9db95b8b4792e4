package it.denzosoft.bytepair.tokenizer;

import java.util.*;

/**
 * Learns merge rules by repeatedly merging the most frequent adjacent pair of a sequence.
 * Ties on the count go to the smallest (left, right) pair.
 */
public class BPETrainer {

    private final Vocabulary vocabulary;

    public BPETrainer(Vocabulary vocabulary) {
        this.vocabulary = vocabulary;
    }

    /**
     * Merges pairs of {@code sequence} into the vocabulary until it holds {@code targetVocabSize}
     * symbols, no pair is left, or (with {@code stopEarly}) the best pair occurs only once.
     *
     * @param sequence symbol IDs to learn from; not modified
     * @param listener receives one event per accepted merge, may be null
     */
    public TrainingResult train(int[] sequence, int targetVocabSize, boolean stopEarly, TrainingListener listener) {
        TrainingListener sink = listener != null ? listener : TrainingListener.NONE;
        List<TrainingEvent> events = new ArrayList<>();
        int[] current = sequence;

        while (vocabulary.size() < targetVocabSize) {
            long best = -1;
            int bestCount = 0;
            Map<Long, int[]> counts = countPairs(current);
            for (Map.Entry<Long, int[]> e : counts.entrySet()) {
                int count = e.getValue()[0];
                long key = e.getKey();
                if (count > bestCount || (count == bestCount && key < best)) {
                    best = key;
                    bestCount = count;
                }
            }

            if (best < 0) break; // fewer than two symbols left
            if (stopEarly && bestCount == 1) break;

            int left = Vocabulary.leftOf(best);
            int right = Vocabulary.rightOf(best);
            MergeRule rule = vocabulary.addMerge(left, right);
            current = mergePair(current, left, right, rule.id());

            TrainingEvent event = new TrainingEvent(left, right, rule.id(), vocabulary.tokenOf(rule.id()));
            events.add(event);
            sink.onMerge(event);
        }

        return new TrainingResult(events.size(), vocabulary.size(), events);
    }

    /** Counts every overlapping window of two symbols. */
    static Map<Long, int[]> countPairs(int[] sequence) {
        Map<Long, int[]> counts = new HashMap<>();
        for (int i = 0; i + 1 < sequence.length; i++) {
            counts.computeIfAbsent(Vocabulary.pairKey(sequence[i], sequence[i + 1]), k -> new int[1])[0]++;
        }
        return counts;
    }

    /**
     * Replaces non-overlapping occurrences of (left, right), scanning left to right:
     * a run "x x x" merged on (x, x) leaves "xx x".
     */
    static int[] mergePair(int[] sequence, int left, int right, int newId) {
        int[] merged = new int[sequence.length];
        int n = 0;
        int i = 0;
        while (i < sequence.length) {
            if (i + 1 < sequence.length && sequence[i] == left && sequence[i + 1] == right) {
                merged[n++] = newId;
                i += 2;
            } else {
                merged[n++] = sequence[i++];
            }
        }
        return n == merged.length ? merged : Arrays.copyOf(merged, n);
    }
}
