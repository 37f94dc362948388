package trellis.core;

import trellis.core.event.Event;

/**
 * Receives the events fired while suites run, in the order the engine fires them.
 *
 * Info and markup events fired from threads started by a test may arrive concurrently with the events of the thread
 * running the suite, so implementations that keep state must be thread-safe.
 */
@FunctionalInterface
public interface Reporter {

    /**
     * Handles the given event.
     *
     * @param event The event.
     */
    public void apply(Event event);
}
