package trellis.core.engine;

import trellis.core.event.Location;

/**
 * Fires a message as soon as it is given, noting whether it came from the thread that runs the suite.
 */
@FunctionalInterface
interface ConcurrentMessageFiring {

    public void fire(String message, boolean isConstructingThread, Location location);
}
