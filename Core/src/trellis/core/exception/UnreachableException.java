package trellis.core.exception;

/**
 * Thrown when the engine meets a value that the structures it builds rule out, such as a node of the registration tree
 * that is neither a test, a message nor a scope.
 */
public final class UnreachableException extends RuntimeException {
    public final Object unexpectedValue;

    public UnreachableException(String what, Object unexpectedValue) {
        super("Unexpected " + what + ": " + unexpectedValue);
        this.unexpectedValue = unexpectedValue;
    }
}
