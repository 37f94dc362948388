package trellis.core.event;

import trellis.core.util.ObjectChecker;

/**
 * An event fired to a {@link trellis.core.Reporter} while suites are running.
 *
 * {@link Event#type}: what happened.
 * {@link Event#ordinal}: the ordering token of this event within the run.
 * {@link Event#suiteName}, {@link Event#suiteId}: the suite the event belongs to.
 * {@link Event#testName}: the full name of the test the event is about, or null for suite and scope level events.
 * {@link Event#text}: the text to display. For tests this is the innermost test text (with any child prefix), for
 * scopes it is the scope description and for info and markup events it is the message itself.
 * {@link Event#throwable}: the cause of a failed or canceled test or an aborted suite, otherwise null.
 * {@link Event#durationMillis}: how long the test or suite took, or null if the event carries no duration.
 * {@link Event#indentationLevel}: the nesting depth of the element, used by reporters that indent their output.
 * {@link Event#location}: where in user code the element was declared, or null if unknown.
 * {@link Event#aboutAPendingTest}, {@link Event#aboutACanceledTest}: only set on info and markup events that were
 * recorded during a test, and only once that test's outcome is known.
 * {@link Event#fromConstructingThread}: false iff an info or markup event came from a thread other than the one that
 * ran the suite.
 */
public final class Event {
    public final EventType type;
    public final Ordinal ordinal;
    public final String suiteName;
    public final String suiteId;
    public final String testName;
    public final String text;
    public final Throwable throwable;
    public final Long durationMillis;
    public final int indentationLevel;
    public final Location location;
    public final Boolean aboutAPendingTest;
    public final Boolean aboutACanceledTest;
    public final boolean fromConstructingThread;
    public final String threadName;
    public final long timeStamp;

    private Event(Builder builder) {
        this.type = builder.type;
        this.ordinal = builder.ordinal;
        this.suiteName = builder.suiteName;
        this.suiteId = builder.suiteId;
        this.testName = builder.testName;
        this.text = builder.text;
        this.throwable = builder.throwable;
        this.durationMillis = builder.durationMillis;
        this.indentationLevel = builder.indentationLevel;
        this.location = builder.location;
        this.aboutAPendingTest = builder.aboutAPendingTest;
        this.aboutACanceledTest = builder.aboutACanceledTest;
        this.fromConstructingThread = builder.fromConstructingThread;
        this.threadName = builder.threadName;
        this.timeStamp = builder.timeStamp;
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " { type: " + this.type
                + ", suite: " + this.suiteName
                + (this.testName == null ? "" : ", test: " + this.testName)
                + (this.text == null ? "" : ", text: " + this.text)
                + (this.throwable == null ? "" : ", throwable: " + this.throwable)
                + " }";
    }

    public static final class Builder {
        private EventType type;
        private Ordinal ordinal;
        private String suiteName;
        private String suiteId;
        private String testName;
        private String text;
        private Throwable throwable;
        private Long durationMillis;
        private int indentationLevel = 0;
        private Location location;
        private Boolean aboutAPendingTest;
        private Boolean aboutACanceledTest;
        private boolean fromConstructingThread = true;
        private String threadName = Thread.currentThread().getName();
        private long timeStamp = System.currentTimeMillis();

        public static Builder newBuilder(EventType type) {
            Builder builder = new Builder();
            builder.type = type;
            return builder;
        }

        public Builder ordinal(Ordinal ordinal) {
            this.ordinal = ordinal;
            return this;
        }

        public Builder suite(String suiteName, String suiteId) {
            this.suiteName = suiteName;
            this.suiteId = suiteId;
            return this;
        }

        public Builder testName(String testName) {
            this.testName = testName;
            return this;
        }

        public Builder text(String text) {
            this.text = text;
            return this;
        }

        public Builder throwable(Throwable throwable) {
            this.throwable = throwable;
            return this;
        }

        public Builder durationMillis(long durationMillis) {
            this.durationMillis = durationMillis;
            return this;
        }

        public Builder indentationLevel(int indentationLevel) {
            this.indentationLevel = indentationLevel;
            return this;
        }

        public Builder location(Location location) {
            this.location = location;
            return this;
        }

        public Builder aboutATest(boolean pending, boolean canceled) {
            this.aboutAPendingTest = pending;
            this.aboutACanceledTest = canceled;
            return this;
        }

        public Builder fromConstructingThread(boolean fromConstructingThread) {
            this.fromConstructingThread = fromConstructingThread;
            return this;
        }

        public Event build() {
            ObjectChecker.assertNonNull(this.type, "type");
            ObjectChecker.assertNonNull(this.ordinal, "ordinal");
            ObjectChecker.assertNonNull(this.suiteName, "suiteName");
            ObjectChecker.assertNonNull(this.suiteId, "suiteId");
            ObjectChecker.assertNonNegative(this.indentationLevel, "indentationLevel");
            if ((this.type == EventType.TEST_FAILED) && (this.throwable == null)) {
                throw new IllegalStateException("a " + this.type + " event needs a throwable.");
            }
            return new Event(this);
        }
    }
}
