package trellis.core.event;

import trellis.core.util.ObjectChecker;

/**
 * Hands out the {@link Ordinal}s of one run.
 *
 * This class is thread-safe. Informers fired from threads started by a test share the tracker of the thread that ran
 * the test, so their events sort close to that test's events.
 */
public final class Tracker {
    private Ordinal currentOrdinal;

    private Tracker(Ordinal firstOrdinal) {
        ObjectChecker.assertNonNull(firstOrdinal, "firstOrdinal");
        this.currentOrdinal = firstOrdinal;
    }

    public static Tracker startingAt(Ordinal firstOrdinal) {
        return new Tracker(firstOrdinal);
    }

    public static Tracker forRun(int runStamp) {
        return new Tracker(Ordinal.forRun(runStamp));
    }

    /**
     * Returns the next ordinal of this tracker.
     */
    public synchronized Ordinal nextOrdinal() {
        Ordinal ordinal = this.currentOrdinal;
        this.currentOrdinal = ordinal.next();
        return ordinal;
    }

    /**
     * Returns a new tracker whose ordinals sort after every ordinal this tracker has handed out so far and before every
     * ordinal it hands out from now on.
     */
    public synchronized Tracker nextTracker() {
        Ordinal[] newAndOld = this.currentOrdinal.nextNewOldPair();
        this.currentOrdinal = newAndOld[1];
        return new Tracker(newAndOld[0]);
    }

    @Override
    public synchronized String toString() {
        return this.getClass().getSimpleName() + " { current: " + this.currentOrdinal + " }";
    }
}
