package trellis.core.runner;

import trellis.core.Filter;
import trellis.core.Reporter;
import trellis.core.RunArgs;
import trellis.core.Stopper;
import trellis.core.Suite;
import trellis.core.engine.AbortErrors;
import trellis.core.event.Event;
import trellis.core.event.EventType;
import trellis.core.event.Tracker;
import trellis.core.report.CatchReporter;
import trellis.core.util.Logger;
import trellis.core.util.ObjectChecker;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Runs a list of suites and sums up their outcomes.
 *
 * Each suite is reported as starting before it runs and as completed after it returns. A suite whose run throws is
 * reported as aborted instead and the remaining suites still run, unless what it threw is one of the
 * {@link AbortErrors}, which ends the whole run.
 *
 * With more than one thread the suites are handed to a {@link ParallelDistributor}. The nested suites of a suite run
 * on the same worker thread as the suite itself.
 */
public final class SuiteRunner {
    private static final Logger LOGGER = Logger.forClass(SuiteRunner.class);
    private final Reporter reporter;
    private final Stopper stopper;
    private final Filter filter;
    private final Map<String, Object> configMap;
    private final int numThreads;
    private final int runStamp;

    private SuiteRunner(Reporter reporter, Stopper stopper, Filter filter, Map<String, Object> configMap, int numThreads, int runStamp) {
        ObjectChecker.assertNonNull(reporter, "reporter");
        ObjectChecker.assertNonNull(stopper, "stopper");
        ObjectChecker.assertNonNull(filter, "filter");
        ObjectChecker.assertNonNull(configMap, "configMap");
        if (numThreads < 1) {
            throw new IllegalArgumentException("numThreads must be at least 1 but was: " + numThreads);
        }
        this.reporter = reporter;
        this.stopper = stopper;
        this.filter = filter;
        this.configMap = configMap;
        this.numThreads = numThreads;
        this.runStamp = runStamp;
    }

    /**
     * Runs the given suites, each with all of its tests selected.
     *
     * @param suites The suites to run.
     * @return the summary of the run.
     * @throws InterruptedException If interrupted while waiting for distributed suites.
     */
    public RunSummary run(List<Suite> suites) throws InterruptedException {
        ObjectChecker.assertNoNullElements(suites.toArray(), "suites");

        SummaryCounter counter = new SummaryCounter(this.reporter);
        RunArgs args = RunArgs.Builder.newBuilder()
                .reporter(CatchReporter.wrapIfNecessary(counter))
                .stopper(this.stopper)
                .filter(this.filter)
                .configMap(this.configMap)
                .tracker(Tracker.forRun(this.runStamp))
                .build();

        LOGGER.log("Running " + suites.size() + " suites with " + this.numThreads + " threads.");
        if (this.numThreads == 1) {
            for (Suite suite : suites) {
                if (this.stopper.stopRequested()) {
                    LOGGER.log("Stop requested, not running the remaining suites.");
                    break;
                }
                runSuite(suite, args);
            }
        } else {
            ParallelDistributor distributor = ParallelDistributor.withThreads(this.numThreads, args);
            try {
                RunArgs distributingArgs = args.withDistributor(distributor);
                for (Suite suite : suites) {
                    if (this.stopper.stopRequested()) {
                        LOGGER.log("Stop requested, not distributing the remaining suites.");
                        break;
                    }
                    distributor.apply(suite, distributingArgs.tracker.nextTracker());
                }
                distributor.waitUntilDone();
            } finally {
                distributor.shutdown();
            }
        }

        RunSummary summary = counter.summary();
        LOGGER.log("Run finished: " + summary);
        return summary;
    }

    /**
     * Runs every test of the given suite, reporting the suite as starting and then as completed or aborted.
     *
     * @param suite The suite to run.
     * @param args The collaborators of the run.
     */
    public static void runSuite(Suite suite, RunArgs args) {
        ObjectChecker.assertNonNull(suite, "suite");
        ObjectChecker.assertNonNull(args, "args");
        Reporter report = CatchReporter.wrapIfNecessary(args.reporter);
        RunArgs reportingArgs = args.withReporter(report);

        report.apply(suiteEvent(EventType.SUITE_STARTING, suite, args.tracker).build());
        long startTime = System.currentTimeMillis();
        try {
            suite.run(null, reportingArgs);
            report.apply(suiteEvent(EventType.SUITE_COMPLETED, suite, args.tracker)
                    .durationMillis(System.currentTimeMillis() - startTime)
                    .build());
        } catch (RuntimeException | Error e) {
            LOGGER.log("Suite " + suite.suiteName() + " aborted", e);
            report.apply(suiteEvent(EventType.SUITE_ABORTED, suite, args.tracker)
                    .throwable(e)
                    .durationMillis(System.currentTimeMillis() - startTime)
                    .build());
            if (AbortErrors.shouldCauseAbort(e)) {
                throw e;
            }
        }
    }

    private static Event.Builder suiteEvent(EventType type, Suite suite, Tracker tracker) {
        return Event.Builder.newBuilder(type)
                .ordinal(tracker.nextOrdinal())
                .suite(suite.suiteName(), suite.suiteId())
                .text(suite.suiteName());
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " { threads: " + this.numThreads + ", " + this.filter + " }";
    }

    public static final class Builder {
        private Reporter reporter;
        private Stopper stopper = Stopper.NEVER;
        private Filter filter = Filter.defaultFilter();
        private Map<String, Object> configMap = Collections.emptyMap();
        private int numThreads = 1;
        private int runStamp = 0;

        public static Builder newBuilder() {
            return new Builder();
        }

        public Builder reporter(Reporter reporter) {
            this.reporter = reporter;
            return this;
        }

        public Builder stopper(Stopper stopper) {
            this.stopper = stopper;
            return this;
        }

        public Builder filter(Filter filter) {
            this.filter = filter;
            return this;
        }

        public Builder configMap(Map<String, Object> configMap) {
            this.configMap = configMap;
            return this;
        }

        public Builder numThreads(int numThreads) {
            this.numThreads = numThreads;
            return this;
        }

        public Builder runStamp(int runStamp) {
            this.runStamp = runStamp;
            return this;
        }

        public SuiteRunner build() {
            return new SuiteRunner(this.reporter, this.stopper, this.filter, this.configMap, this.numThreads, this.runStamp);
        }
    }
}
