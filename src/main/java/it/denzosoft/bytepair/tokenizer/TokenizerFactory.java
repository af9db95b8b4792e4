package it.denzosoft.bytepair.tokenizer;

public final class TokenizerFactory {

    private TokenizerFactory() {}

    public static Tokenizer create(TrainerConfig config) {
        return new BPETokenizer(config.maxVocabSize());
    }

    /** Creates a tokenizer, reporting an invalid size as a CONFIG failure instead of throwing. */
    public static TokenizerResult<Tokenizer> tryCreate(TrainerConfig config) {
        if (config.maxVocabSize() <= Vocabulary.BYTE_TOKENS) {
            return TokenizerResult.failure(TokenizerException.config(config.maxVocabSize()));
        }
        return TokenizerResult.ok(create(config));
    }
}
