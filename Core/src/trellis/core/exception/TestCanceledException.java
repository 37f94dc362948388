package trellis.core.exception;

/**
 * Thrown by a test body when something the test depends on is unavailable, so the test could not be carried out. The
 * test is reported as canceled rather than failed.
 */
public final class TestCanceledException extends RuntimeException {

    public TestCanceledException(String message) {
        super(message);
    }

    public TestCanceledException(String message, Throwable cause) {
        super(message, cause);
    }
}
