package trellis.core.exception;

/**
 * Thrown when a test or a scope is registered after registration has closed, which happens once a suite starts to run
 * or, in the path style, when a registration call is nested inside a running test.
 */
public final class TestRegistrationClosedException extends RuntimeException {

    public TestRegistrationClosedException(String message) {
        super(message);
    }
}
