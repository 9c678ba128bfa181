package work.lcod.ftml.extraction;

public enum FtmlErrorKind {
    MISSING_KEY,
    INVALID_LANGUAGE,
    INVALID_URI,
    NOT_IN,
    INVALID_VALUE,
    UNEXPECTED_END_OF,
    DUPLICATE_VALUE,
    INVALID_IN,
    MISSING_ARGUMENT,
    MISMATCHED_ARGUMENT,
    MISMATCHED_BOUND_ARGUMENT,
    ENCODING_ERROR
}
