package it.denzosoft.bytepair.tokenizer;

/**
 * Outcome of a tokenizer operation that can fail: either a value or the error that prevented it.
 */
public final class TokenizerResult<T> {

    private final T value;
    private final TokenizerException error;

    private TokenizerResult(T value, TokenizerException error) {
        this.value = value;
        this.error = error;
    }

    public static <T> TokenizerResult<T> ok(T value) {
        return new TokenizerResult<>(value, null);
    }

    public static <T> TokenizerResult<T> failure(TokenizerException error) {
        if (error == null) throw new IllegalArgumentException("error must not be null");
        return new TokenizerResult<>(null, error);
    }

    public boolean isOk() { return error == null; }
    public TokenizerException error() { return error; }

    /** @return the error kind, or null on success */
    public ErrorKind errorKind() { return error == null ? null : error.kind(); }

    /** Returns the value, rethrowing the error if the operation failed. */
    public T value() {
        if (error != null) throw error;
        return value;
    }

    @Override
    public String toString() {
        return isOk() ? "Ok[" + value + "]" : "Failure[" + error.kind() + ": " + error.getMessage() + "]";
    }
}
