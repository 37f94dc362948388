package trellis.core.report;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import trellis.core.Reporter;
import trellis.core.event.Event;
import trellis.core.util.ObjectChecker;

import java.io.PrintStream;

/**
 * A reporter that writes every event it receives as a single line holding one JSON object.
 *
 * Events may arrive from several threads; each line is written whole.
 */
public final class JsonEventWriter implements Reporter {
    private final PrintStream stream;

    private JsonEventWriter(PrintStream stream) {
        ObjectChecker.assertNonNull(stream, "stream");
        this.stream = stream;
    }

    public static JsonEventWriter writingTo(PrintStream stream) {
        return new JsonEventWriter(stream);
    }

    @Override
    public void apply(Event event) {
        String line = toJson(event).toString();
        synchronized (this.stream) {
            this.stream.println(line);
            this.stream.flush();
        }
    }

    /**
     * Returns the JSON representation of the given event. Properties the event does not carry are left out.
     *
     * @param event The event.
     * @return the JSON object.
     */
    public static JsonObject toJson(Event event) {
        ObjectChecker.assertNonNull(event, "event");
        JsonObject json = new JsonObject();
        json.addProperty("type", event.type.name());

        JsonArray ordinal = new JsonArray();
        for (int stamp : event.ordinal.toArray()) {
            ordinal.add(stamp);
        }
        json.add("ordinal", ordinal);

        json.addProperty("suite_name", event.suiteName);
        json.addProperty("suite_id", event.suiteId);
        if (event.testName != null) {
            json.addProperty("test_name", event.testName);
        }
        if (event.text != null) {
            json.addProperty("text", event.text);
        }
        if (event.throwable != null) {
            json.addProperty("throwable", event.throwable.getClass().getName());
            json.addProperty("throwable_message", event.throwable.getMessage());
        }
        if (event.durationMillis != null) {
            json.addProperty("duration_millis", event.durationMillis);
        }
        json.addProperty("indentation_level", event.indentationLevel);
        if (event.location != null) {
            json.addProperty("location", event.location.toString());
        }
        if (event.aboutAPendingTest != null) {
            json.addProperty("about_a_pending_test", event.aboutAPendingTest);
            json.addProperty("about_a_canceled_test", event.aboutACanceledTest);
        }
        json.addProperty("from_constructing_thread", event.fromConstructingThread);
        json.addProperty("thread_name", event.threadName);
        json.addProperty("time_stamp", event.timeStamp);
        return json;
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName();
    }
}
