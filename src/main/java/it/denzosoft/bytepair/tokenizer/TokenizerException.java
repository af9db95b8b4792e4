package it.denzosoft.bytepair.tokenizer;

public class TokenizerException extends RuntimeException {

    private final ErrorKind kind;

    public TokenizerException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ErrorKind kind() { return kind; }

    public static TokenizerException config(int maxVocabSize) {
        return new TokenizerException(ErrorKind.CONFIG,
            "Maximum vocabulary size must be greater than " + Vocabulary.BYTE_TOKENS + ", got " + maxVocabSize);
    }

    public static TokenizerException unknownToken(int tokenId) {
        return new TokenizerException(ErrorKind.UNKNOWN_TOKEN, "Unknown token ID: " + tokenId);
    }

    public static TokenizerException malformedText(Throwable cause) {
        TokenizerException e = new TokenizerException(ErrorKind.MALFORMED_TEXT,
            "Text is not well-formed UTF-16: " + cause.getMessage());
        e.initCause(cause);
        return e;
    }

    public static TokenizerException specialTokenConflict(String literal, String reason) {
        return new TokenizerException(ErrorKind.SPECIAL_TOKEN_CONFLICT,
            "Special token " + (literal == null ? "null" : "\"" + literal + "\"") + " rejected: " + reason);
    }
}
