package trellis.core.exception;

/**
 * Thrown by a test body to say that the test is not implemented yet. The test is reported as pending, which is neither
 * a success nor a failure.
 */
public final class TestPendingException extends RuntimeException {

    public TestPendingException() {
        super("test is pending");
    }
}
