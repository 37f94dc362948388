package trellis.core;

import trellis.core.event.Tracker;

/**
 * Accepts suites to run somewhere other than the calling thread.
 */
public interface Distributor {

    /**
     * Schedules the given suite to be run with the given tracker. The suite must be run with all tests selected, using
     * the reporter, stopper, filter and config map of the run that distributed it.
     *
     * @param suite The suite to run.
     * @param tracker The tracker the suite's events are ordered with.
     */
    public void apply(Suite suite, Tracker tracker);
}
