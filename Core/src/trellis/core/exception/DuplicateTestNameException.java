package trellis.core.exception;

/**
 * Thrown when a test is registered under a full name that an earlier registration in the same suite already took.
 */
public final class DuplicateTestNameException extends RuntimeException {
    public final String testName;

    public DuplicateTestNameException(String testName) {
        super("Duplicate test name: " + testName);
        this.testName = testName;
    }
}
