package trellis.core.report;

import trellis.core.Reporter;
import trellis.core.event.Event;
import trellis.core.util.Logger;
import trellis.core.util.ObjectChecker;

/**
 * A reporter that forwards every event to another reporter and logs, rather than propagates, anything that reporter
 * throws. A broken reporter therefore never turns into a test failure or an aborted suite.
 */
public final class CatchReporter implements Reporter {
    private static final Logger LOGGER = Logger.forClass(CatchReporter.class);
    private final Reporter delegate;

    private CatchReporter(Reporter delegate) {
        ObjectChecker.assertNonNull(delegate, "reporter");
        this.delegate = delegate;
    }

    /**
     * Returns the given reporter if it already is a catch reporter, otherwise a catch reporter wrapping it.
     *
     * @param reporter The reporter to wrap.
     * @return a catch reporter.
     */
    public static Reporter wrapIfNecessary(Reporter reporter) {
        return (reporter instanceof CatchReporter) ? reporter : new CatchReporter(reporter);
    }

    @Override
    public void apply(Event event) {
        try {
            this.delegate.apply(event);
        } catch (RuntimeException e) {
            LOGGER.log("Reporter " + this.delegate.getClass().getName() + " failed to handle " + event.type, e);
        }
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " { delegate: " + this.delegate + " }";
    }
}
