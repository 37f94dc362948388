package trellis.core.engine;

import trellis.core.Documenter;
import trellis.core.Informer;
import trellis.core.event.Location;
import trellis.core.util.ObjectChecker;

import java.util.ArrayList;
import java.util.List;

/**
 * Records the info and markup given while a path-style test runs during registration. At that point there is no
 * reporter to fire them to, so every message is held, whichever thread gives it, and replayed when the test's recorded
 * outcome is reported during the run.
 *
 * Unlike {@link MessageRecorder} this class records from any thread, so the recording list is synchronized.
 */
public final class PathMessageRecorder extends ThreadAwareness {
    private final List<RecordedMessage> messages = new ArrayList<>();
    private final Informer informer = message -> record(message, false);
    private final Documenter documenter = markup -> record(markup, true);

    Informer informer() {
        return this.informer;
    }

    Documenter documenter() {
        return this.documenter;
    }

    /**
     * Fires every recorded message in the order recorded.
     *
     * @param testWasPending Whether the recorded test was pending.
     * @param testWasCanceled Whether the recorded test was canceled.
     * @param infoFire How to fire info messages.
     * @param markupFire How to fire markup.
     */
    void fireRecordedMessages(boolean testWasPending, boolean testWasCanceled, RecordedMessageFiring infoFire, RecordedMessageFiring markupFire) {
        List<RecordedMessage> toFire;
        synchronized (this.messages) {
            toFire = new ArrayList<>(this.messages);
        }
        for (RecordedMessage recorded : toFire) {
            RecordedMessageFiring fire = recorded.isMarkup ? markupFire : infoFire;
            fire.fire(recorded.message, recorded.wasConstructingThread, testWasPending, testWasCanceled, recorded.location);
        }
    }

    int recordedMessageCount() {
        synchronized (this.messages) {
            return this.messages.size();
        }
    }

    private void record(String message, boolean isMarkup) {
        ObjectChecker.assertNonNull(message, "message");
        RecordedMessage recorded = new RecordedMessage(message, isMarkup, isConstructingThread(), Location.ofCaller());
        synchronized (this.messages) {
            this.messages.add(recorded);
        }
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " { recorded: " + recordedMessageCount() + " }";
    }

    private static final class RecordedMessage {
        private final String message;
        private final boolean isMarkup;
        private final boolean wasConstructingThread;
        private final Location location;

        private RecordedMessage(String message, boolean isMarkup, boolean wasConstructingThread, Location location) {
            this.message = message;
            this.isMarkup = isMarkup;
            this.wasConstructingThread = wasConstructingThread;
            this.location = location;
        }
    }
}
