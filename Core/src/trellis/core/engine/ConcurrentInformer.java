package trellis.core.engine;

import trellis.core.Documenter;
import trellis.core.Informer;
import trellis.core.event.Location;
import trellis.core.util.ObjectChecker;

/**
 * The suite level informer and documenter installed for the duration of a run. Messages are fired as they arrive,
 * marked with whether they came from the thread running the suite.
 */
final class ConcurrentInformer extends ThreadAwareness implements Informer, Documenter {
    private final ConcurrentMessageFiring fire;

    ConcurrentInformer(ConcurrentMessageFiring fire) {
        ObjectChecker.assertNonNull(fire, "fire");
        this.fire = fire;
    }

    @Override
    public void apply(String message) {
        ObjectChecker.assertNonNull(message, "message");
        this.fire.fire(message, isConstructingThread(), Location.ofCaller());
    }
}
