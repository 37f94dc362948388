package trellis.core.engine;

import trellis.core.event.Location;
import trellis.core.util.ObjectChecker;

import java.util.ArrayList;
import java.util.List;

/**
 * Holds back the messages given during a test until the test's outcome is known, so that they are reported after the
 * test's own outcome event and can be marked as belonging to a pending or canceled test.
 *
 * Only messages from the thread that constructed the recorder (the thread running the test) are held back. Messages
 * from any other thread are fired at once, since a thread started by a test may outlive it and there is no single
 * point where they could safely be fired later. The recording list is therefore only ever touched by the constructing
 * thread and needs no synchronization.
 *
 * Once {@link #fireRecordedMessages(boolean, boolean)} has been called, further messages from the constructing thread
 * are fired immediately with the outcome that was fired.
 */
final class MessageRecorder extends ThreadAwareness {
    private final List<RecordedMessage> messages = new ArrayList<>();
    private boolean flushed = false;
    private boolean testWasPending = false;
    private boolean testWasCanceled = false;

    /**
     * Records the message if called by the constructing thread, otherwise fires it immediately as a message from
     * another thread about a test that was neither pending nor canceled.
     *
     * @param message The message.
     * @param fire How to fire the message.
     * @param location Where the message was given, or null.
     */
    void apply(String message, RecordedMessageFiring fire, Location location) {
        ObjectChecker.assertNonNull(message, "message");
        ObjectChecker.assertNonNull(fire, "fire");

        if (!isConstructingThread()) {
            fire.fire(message, false, false, false, location);
        } else if (this.flushed) {
            fire.fire(message, true, this.testWasPending, this.testWasCanceled, location);
        } else {
            record(message, fire, location);
        }
    }

    /**
     * Fires every recorded message in the order recorded, marked with the outcome of the test.
     *
     * @param testWasPending Whether the test was pending.
     * @param testWasCanceled Whether the test was canceled.
     */
    void fireRecordedMessages(boolean testWasPending, boolean testWasCanceled) {
        if (this.flushed) {
            throw new IllegalStateException("recorded messages were already fired.");
        }
        this.flushed = true;
        this.testWasPending = testWasPending;
        this.testWasCanceled = testWasCanceled;

        for (RecordedMessage recorded : this.messages) {
            recorded.fire.fire(recorded.message, true, testWasPending, testWasCanceled, recorded.location);
        }
        this.messages.clear();
    }

    int recordedMessageCount() {
        return this.messages.size();
    }

    private void record(String message, RecordedMessageFiring fire, Location location) {
        if (!isConstructingThread()) {
            throw new IllegalStateException("only the thread running the test may record messages.");
        }
        this.messages.add(new RecordedMessage(message, fire, location));
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " { recorded: " + this.messages.size() + (this.flushed ? ", [fired]" : ", [recording]") + " }";
    }

    private static final class RecordedMessage {
        private final String message;
        private final RecordedMessageFiring fire;
        private final Location location;

        private RecordedMessage(String message, RecordedMessageFiring fire, Location location) {
            this.message = message;
            this.fire = fire;
            this.location = location;
        }
    }
}
