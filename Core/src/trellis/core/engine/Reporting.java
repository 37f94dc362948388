package trellis.core.engine;

import trellis.core.Reporter;
import trellis.core.Suite;
import trellis.core.event.Event;
import trellis.core.event.EventType;
import trellis.core.event.Location;
import trellis.core.event.Tracker;

/**
 * Builds and fires the events the engine reports. Every event takes the next ordinal of the given tracker at the
 * moment it is fired.
 */
final class Reporting {

    private Reporting() {}

    static void testStarting(Suite suite, Reporter report, Tracker tracker, TestLeaf<?> test, String testText) {
        report.apply(forTest(EventType.TEST_STARTING, suite, tracker, test, testText).build());
    }

    static void testSucceeded(Suite suite, Reporter report, Tracker tracker, TestLeaf<?> test, String testText, long duration) {
        report.apply(forTest(EventType.TEST_SUCCEEDED, suite, tracker, test, testText).durationMillis(duration).build());
    }

    static void testFailed(Suite suite, Reporter report, Tracker tracker, TestLeaf<?> test, String testText, Throwable cause, long duration) {
        report.apply(forTest(EventType.TEST_FAILED, suite, tracker, test, testText).throwable(cause).durationMillis(duration).build());
    }

    static void testPending(Suite suite, Reporter report, Tracker tracker, TestLeaf<?> test, String testText, long duration) {
        report.apply(forTest(EventType.TEST_PENDING, suite, tracker, test, testText).durationMillis(duration).build());
    }

    static void testCanceled(Suite suite, Reporter report, Tracker tracker, TestLeaf<?> test, String testText, Throwable cause, long duration) {
        report.apply(forTest(EventType.TEST_CANCELED, suite, tracker, test, testText).throwable(cause).durationMillis(duration).build());
    }

    static void testIgnored(Suite suite, Reporter report, Tracker tracker, TestLeaf<?> test, String testText) {
        report.apply(forTest(EventType.TEST_IGNORED, suite, tracker, test, testText).build());
    }

    static void scopeOpened(Suite suite, Reporter report, Tracker tracker, String text, int indentationLevel, Location location) {
        report.apply(forScope(EventType.SCOPE_OPENED, suite, tracker, text, indentationLevel, location).build());
    }

    static void scopeClosed(Suite suite, Reporter report, Tracker tracker, String text, int indentationLevel, Location location) {
        report.apply(forScope(EventType.SCOPE_CLOSED, suite, tracker, text, indentationLevel, location).build());
    }

    /**
     * Fires an info event that is not about any test's outcome.
     */
    static void infoProvided(Suite suite, Reporter report, Tracker tracker, String message, int indentationLevel, Location location, boolean isConstructingThread) {
        report.apply(forMessage(EventType.INFO_PROVIDED, suite, tracker, null, message, indentationLevel, location, isConstructingThread).build());
    }

    /**
     * Fires an info event given while the named test ran, marked with how the test ended.
     */
    static void infoProvided(Suite suite, Reporter report, Tracker tracker, String testName, String message, int indentationLevel, Location location, boolean isConstructingThread, boolean testWasPending, boolean testWasCanceled) {
        report.apply(forMessage(EventType.INFO_PROVIDED, suite, tracker, testName, message, indentationLevel, location, isConstructingThread)
                .aboutATest(testWasPending, testWasCanceled)
                .build());
    }

    static void markupProvided(Suite suite, Reporter report, Tracker tracker, String markup, int indentationLevel, Location location, boolean isConstructingThread) {
        report.apply(forMessage(EventType.MARKUP_PROVIDED, suite, tracker, null, markup, indentationLevel, location, isConstructingThread).build());
    }

    static void markupProvided(Suite suite, Reporter report, Tracker tracker, String testName, String markup, int indentationLevel, Location location, boolean isConstructingThread, boolean testWasPending, boolean testWasCanceled) {
        report.apply(forMessage(EventType.MARKUP_PROVIDED, suite, tracker, testName, markup, indentationLevel, location, isConstructingThread)
                .aboutATest(testWasPending, testWasCanceled)
                .build());
    }

    private static Event.Builder forTest(EventType type, Suite suite, Tracker tracker, TestLeaf<?> test, String testText) {
        return Event.Builder.newBuilder(type)
                .ordinal(tracker.nextOrdinal())
                .suite(suite.suiteName(), suite.suiteId())
                .testName(test.testName)
                .text(testText)
                .indentationLevel(test.indentationLevel())
                .location(test.location);
    }

    private static Event.Builder forScope(EventType type, Suite suite, Tracker tracker, String text, int indentationLevel, Location location) {
        return Event.Builder.newBuilder(type)
                .ordinal(tracker.nextOrdinal())
                .suite(suite.suiteName(), suite.suiteId())
                .text(text)
                .indentationLevel(indentationLevel)
                .location(location);
    }

    private static Event.Builder forMessage(EventType type, Suite suite, Tracker tracker, String testName, String message, int indentationLevel, Location location, boolean isConstructingThread) {
        return Event.Builder.newBuilder(type)
                .ordinal(tracker.nextOrdinal())
                .suite(suite.suiteName(), suite.suiteId())
                .testName(testName)
                .text(message)
                .indentationLevel(indentationLevel)
                .location(location)
                .fromConstructingThread(isConstructingThread);
    }
}
