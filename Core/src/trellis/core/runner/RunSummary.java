package trellis.core.runner;

/**
 * The counts of the outcomes of a run.
 */
public final class RunSummary {
    public final int testsSucceeded;
    public final int testsFailed;
    public final int testsPending;
    public final int testsCanceled;
    public final int testsIgnored;
    public final int suitesCompleted;
    public final int suitesAborted;

    RunSummary(int testsSucceeded, int testsFailed, int testsPending, int testsCanceled, int testsIgnored, int suitesCompleted, int suitesAborted) {
        this.testsSucceeded = testsSucceeded;
        this.testsFailed = testsFailed;
        this.testsPending = testsPending;
        this.testsCanceled = testsCanceled;
        this.testsIgnored = testsIgnored;
        this.suitesCompleted = suitesCompleted;
        this.suitesAborted = suitesAborted;
    }

    /**
     * Returns true iff no test failed and no suite aborted.
     */
    public boolean isSuccessful() {
        return (this.testsFailed == 0) && (this.suitesAborted == 0);
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName()
                + " { succeeded: " + this.testsSucceeded
                + ", failed: " + this.testsFailed
                + ", pending: " + this.testsPending
                + ", canceled: " + this.testsCanceled
                + ", ignored: " + this.testsIgnored
                + ", suites completed: " + this.suitesCompleted
                + ", suites aborted: " + this.suitesAborted
                + " }";
    }
}
