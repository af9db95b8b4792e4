package it.denzosoft.bytepair.tokenizer;

public enum ErrorKind {
    /** Maximum vocabulary size does not leave room for a single merge. */
    CONFIG,
    /** An ID that is neither a byte, a merge result, nor a special token. */
    UNKNOWN_TOKEN,
    /** A special token literal that cannot be matched unambiguously. */
    SPECIAL_TOKEN_CONFLICT,
    /** Text with an unpaired surrogate, which has no UTF-8 form. */
    MALFORMED_TEXT
}
