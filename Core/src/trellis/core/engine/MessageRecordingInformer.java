package trellis.core.engine;

import trellis.core.Informer;
import trellis.core.event.Location;

/**
 * The informer handed to a test while it runs. Its messages go through the test's {@link MessageRecorder}.
 */
final class MessageRecordingInformer implements Informer {
    private final MessageRecorder recorder;
    private final RecordedMessageFiring fire;

    MessageRecordingInformer(MessageRecorder recorder, RecordedMessageFiring fire) {
        this.recorder = recorder;
        this.fire = fire;
    }

    @Override
    public void apply(String message) {
        this.recorder.apply(message, this.fire, Location.ofCaller());
    }
}
