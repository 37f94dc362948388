package trellis.core;

import trellis.core.event.Tracker;
import trellis.core.util.ObjectChecker;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The collaborators a suite runs with.
 *
 * {@link RunArgs#reporter}: receives every event of the run.
 * {@link RunArgs#stopper}: polled between tests to stop the run early.
 * {@link RunArgs#filter}: decides which tests run, which are ignored and which are left out.
 * {@link RunArgs#configMap}: arbitrary configuration handed through to the suites and their tests.
 * {@link RunArgs#distributor}: runs nested suites elsewhere, or null to run everything on the calling thread.
 * {@link RunArgs#tracker}: hands out the ordering tokens of the events.
 */
public final class RunArgs {
    public final Reporter reporter;
    public final Stopper stopper;
    public final Filter filter;
    public final Map<String, Object> configMap;
    public final Distributor distributor;
    public final Tracker tracker;

    private RunArgs(Reporter reporter, Stopper stopper, Filter filter, Map<String, Object> configMap, Distributor distributor, Tracker tracker) {
        ObjectChecker.assertNonNull(reporter, "reporter");
        ObjectChecker.assertNonNull(stopper, "stopper");
        ObjectChecker.assertNonNull(filter, "filter");
        ObjectChecker.assertNonNull(configMap, "configMap");
        ObjectChecker.assertNonNull(tracker, "tracker");
        this.reporter = reporter;
        this.stopper = stopper;
        this.filter = filter;
        this.configMap = configMap;
        this.distributor = distributor;
        this.tracker = tracker;
    }

    /**
     * Returns a copy of these arguments that reports to the given reporter instead.
     */
    public RunArgs withReporter(Reporter reporter) {
        return new RunArgs(reporter, this.stopper, this.filter, this.configMap, this.distributor, this.tracker);
    }

    /**
     * Returns a copy of these arguments that orders its events with the given tracker instead.
     */
    public RunArgs withTracker(Tracker tracker) {
        return new RunArgs(this.reporter, this.stopper, this.filter, this.configMap, this.distributor, tracker);
    }

    /**
     * Returns a copy of these arguments that hands nested suites to the given distributor.
     */
    public RunArgs withDistributor(Distributor distributor) {
        ObjectChecker.assertNonNull(distributor, "distributor");
        return new RunArgs(this.reporter, this.stopper, this.filter, this.configMap, distributor, this.tracker);
    }

    /**
     * Returns a copy of these arguments that does not distribute.
     */
    public RunArgs withoutDistributor() {
        return new RunArgs(this.reporter, this.stopper, this.filter, this.configMap, null, this.tracker);
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " { filter: " + this.filter + ", config keys: " + this.configMap.keySet() + (this.distributor == null ? "" : ", [distributed]") + " }";
    }

    public static final class Builder {
        private Reporter reporter;
        private Stopper stopper = Stopper.NEVER;
        private Filter filter = Filter.defaultFilter();
        private Map<String, Object> configMap = Collections.emptyMap();
        private Distributor distributor;
        private Tracker tracker;

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
            this.configMap = (configMap == null) ? null : Collections.unmodifiableMap(new LinkedHashMap<>(configMap));
            return this;
        }

        public Builder distributor(Distributor distributor) {
            this.distributor = distributor;
            return this;
        }

        public Builder tracker(Tracker tracker) {
            this.tracker = tracker;
            return this;
        }

        public RunArgs build() {
            Tracker trackerToUse = (this.tracker == null) ? Tracker.forRun(0) : this.tracker;
            return new RunArgs(this.reporter, this.stopper, this.filter, this.configMap, this.distributor, trackerToUse);
        }
    }
}
