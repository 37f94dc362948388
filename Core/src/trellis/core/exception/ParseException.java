package trellis.core.exception;

/**
 * Thrown when parsing a run request and finding that it is not structured as expected.
 */
public final class ParseException extends Exception {

    public ParseException(String message) {
        super(message);
    }

    public ParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
