package it.denzosoft.bytepair.tokenizer;

@FunctionalInterface
public interface TrainingListener {

    TrainingListener NONE = event -> { };

    void onMerge(TrainingEvent event);
}
