package trellis.core.engine;

import trellis.core.Documenter;
import trellis.core.event.Location;

/**
 * The documenter handed to a test while it runs. It shares the test's {@link MessageRecorder} with the informer, so
 * info and markup keep their relative order.
 */
final class MessageRecordingDocumenter implements Documenter {
    private final MessageRecorder recorder;
    private final RecordedMessageFiring fire;

    MessageRecordingDocumenter(MessageRecorder recorder, RecordedMessageFiring fire) {
        this.recorder = recorder;
        this.fire = fire;
    }

    @Override
    public void apply(String markup) {
        this.recorder.apply(markup, this.fire, Location.ofCaller());
    }
}
