package work.lcod.ftml.uri;

/**
 * Raised when a string is not a well-formed uri of the requested kind.
 */
public final class UriParseException extends Exception {
    public UriParseException(String message) {
        super(message);
    }
}
