package trellis.core.engine;

import trellis.core.event.Location;

/**
 * Fires a message that was given to an informer or documenter while a test was running, once the test's outcome is
 * known.
 */
@FunctionalInterface
interface RecordedMessageFiring {

    /**
     * @param message The message.
     * @param isConstructingThread Whether the message came from the thread that ran the test.
     * @param testWasPending Whether the test the message is about turned out to be pending.
     * @param testWasCanceled Whether the test the message is about was canceled.
     * @param location Where the message was given, or null.
     */
    public void fire(String message, boolean isConstructingThread, boolean testWasPending, boolean testWasCanceled, Location location);
}
