package trellis.core.engine;

import trellis.core.exception.TestCanceledException;
import trellis.core.exception.TestPendingException;

/**
 * How the body of a test ended.
 *
 * Test bodies signal pending and canceled tests by throwing; {@link #of(TestBody)} turns whatever the body did into
 * one of these values so the engine reports from a value rather than from a catch block.
 */
public final class Outcome {
    public enum Kind { SUCCEEDED, FAILED, PENDING, CANCELED }

    private static final Outcome SUCCEEDED = new Outcome(Kind.SUCCEEDED, null);
    private static final Outcome PENDING = new Outcome(Kind.PENDING, null);
    public final Kind kind;
    public final Throwable cause;

    private Outcome(Kind kind, Throwable cause) {
        this.kind = kind;
        this.cause = cause;
    }

    public static Outcome succeeded() {
        return SUCCEEDED;
    }

    public static Outcome pending() {
        return PENDING;
    }

    public static Outcome canceled(TestCanceledException cause) {
        return new Outcome(Kind.CANCELED, cause);
    }

    public static Outcome failed(Throwable cause) {
        return new Outcome(Kind.FAILED, cause);
    }

    /**
     * Runs the body and returns how it ended.
     *
     * @param body The body to run.
     * @return the outcome.
     * @throws Error If the body threw one of the {@link AbortErrors}, which is rethrown untouched.
     */
    public static Outcome of(TestBody body) {
        try {
            body.run();
            return succeeded();
        } catch (TestPendingException e) {
            return pending();
        } catch (TestCanceledException e) {
            return canceled(e);
        } catch (Throwable t) {
            if (AbortErrors.shouldCauseAbort(t)) {
                throw (Error) t;
            }
            return failed(t);
        }
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " { " + this.kind + (this.cause == null ? "" : ", cause: " + this.cause) + " }";
    }
}
