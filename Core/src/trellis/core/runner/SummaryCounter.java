package trellis.core.runner;

import trellis.core.Reporter;
import trellis.core.event.Event;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * A reporter that counts the outcome events it sees and forwards every event to another reporter.
 */
final class SummaryCounter implements Reporter {
    private final Reporter delegate;
    private final AtomicInteger testsSucceeded = new AtomicInteger(0);
    private final AtomicInteger testsFailed = new AtomicInteger(0);
    private final AtomicInteger testsPending = new AtomicInteger(0);
    private final AtomicInteger testsCanceled = new AtomicInteger(0);
    private final AtomicInteger testsIgnored = new AtomicInteger(0);
    private final AtomicInteger suitesCompleted = new AtomicInteger(0);
    private final AtomicInteger suitesAborted = new AtomicInteger(0);

    SummaryCounter(Reporter delegate) {
        this.delegate = delegate;
    }

    @Override
    public void apply(Event event) {
        switch (event.type) {
            case TEST_SUCCEEDED:
                this.testsSucceeded.incrementAndGet();
                break;
            case TEST_FAILED:
                this.testsFailed.incrementAndGet();
                break;
            case TEST_PENDING:
                this.testsPending.incrementAndGet();
                break;
            case TEST_CANCELED:
                this.testsCanceled.incrementAndGet();
                break;
            case TEST_IGNORED:
                this.testsIgnored.incrementAndGet();
                break;
            case SUITE_COMPLETED:
                this.suitesCompleted.incrementAndGet();
                break;
            case SUITE_ABORTED:
                this.suitesAborted.incrementAndGet();
                break;
            default:
                break;
        }
        this.delegate.apply(event);
    }

    RunSummary summary() {
        return new RunSummary(this.testsSucceeded.get(), this.testsFailed.get(), this.testsPending.get(), this.testsCanceled.get(), this.testsIgnored.get(), this.suitesCompleted.get(), this.suitesAborted.get());
    }
}
