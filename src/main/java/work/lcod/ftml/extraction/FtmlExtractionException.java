package work.lcod.ftml.extraction;

import work.lcod.ftml.keys.FtmlKey;
import work.lcod.ftml.model.term.ArgumentPosition;

/**
 * Failure of one add or close step; aborts extraction of the document.
 */
public final class FtmlExtractionException extends RuntimeException {
    private final FtmlErrorKind kind;
    private final FtmlKey key;

    private FtmlExtractionException(FtmlErrorKind kind, FtmlKey key, String message) {
        super(message);
        this.kind = kind;
        this.key = key;
    }

    public FtmlErrorKind kind() {
        return kind;
    }

    /** The key the error is about; null for argument errors. */
    public FtmlKey key() {
        return key;
    }

    public static FtmlExtractionException missingKey(FtmlKey key) {
        return new FtmlExtractionException(FtmlErrorKind.MISSING_KEY, key, "`" + key + "` key missing in attributes");
    }

    public static FtmlExtractionException invalidLanguage(FtmlKey key, String value) {
        return new FtmlExtractionException(FtmlErrorKind.INVALID_LANGUAGE, key, "invalid language in " + key + ": " + value);
    }

    public static FtmlExtractionException invalidUri(FtmlKey key, String error) {
        return new FtmlExtractionException(FtmlErrorKind.INVALID_URI, key, "invalid uri in " + key + ": " + error);
    }

    public static FtmlExtractionException notIn(FtmlKey key, String where) {
        return new FtmlExtractionException(FtmlErrorKind.NOT_IN, key, "key " + key + " not allowed outside of " + where);
    }

    public static FtmlExtractionException invalidValue(FtmlKey key) {
        return new FtmlExtractionException(FtmlErrorKind.INVALID_VALUE, key, "value for key " + key + " invalid");
    }

    public static FtmlExtractionException unexpectedEndOf(FtmlKey key) {
        return new FtmlExtractionException(FtmlErrorKind.UNEXPECTED_END_OF, key, key + " ended unexpectedly");
    }

    public static FtmlExtractionException duplicateValue(FtmlKey key) {
        return new FtmlExtractionException(FtmlErrorKind.DUPLICATE_VALUE, key, "duplicate property: " + key);
    }

    public static FtmlExtractionException invalidIn(FtmlKey key, String where) {
        return new FtmlExtractionException(FtmlErrorKind.INVALID_IN, key, "key " + key + " not allowed in " + where);
    }

    /** {@code index} is 1-based. */
    public static FtmlExtractionException missingArgument(int index) {
        return new FtmlExtractionException(
            FtmlErrorKind.MISSING_ARGUMENT, null, "missing argument " + index + " for application term");
    }

    public static FtmlExtractionException mismatchedArgument(ArgumentPosition position) {
        return new FtmlExtractionException(
            FtmlErrorKind.MISMATCHED_ARGUMENT, null, "mismatched argument at position " + position);
    }

    public static FtmlExtractionException mismatchedBoundArgument(ArgumentPosition position) {
        return new FtmlExtractionException(
            FtmlErrorKind.MISMATCHED_BOUND_ARGUMENT, null, "mismatched bound argument at position " + position);
    }

    public static FtmlExtractionException encodingError(FtmlKey key, String message) {
        return new FtmlExtractionException(FtmlErrorKind.ENCODING_ERROR, key, "error encoding " + key + ": " + message);
    }
}
