package trellis.core.engine;

import trellis.core.event.Location;

/**
 * One registered test.
 *
 * {@link TestLeaf#testName}: the full name, made of the texts of the enclosing scopes and the test's own text.
 * {@link TestLeaf#testText}: the test's own text.
 * {@link TestLeaf#testFun}: what to run.
 * {@link TestLeaf#recordedDuration}: the duration measured when the test already ran during registration (path style),
 * otherwise null.
 * {@link TestLeaf#recordedMessages}: the messages given when the test already ran during registration, otherwise null.
 */
public final class TestLeaf<T> extends Node {
    public final String testName;
    public final String testText;
    public final T testFun;
    public final Location location;
    public final Long recordedDuration;
    public final PathMessageRecorder recordedMessages;

    TestLeaf(Branch parent, String testName, String testText, T testFun, Location location, Long recordedDuration, PathMessageRecorder recordedMessages) {
        super(parent);
        this.testName = testName;
        this.testText = testText;
        this.testFun = testFun;
        this.location = location;
        this.recordedDuration = recordedDuration;
        this.recordedMessages = recordedMessages;
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " { " + this.testName + " }";
    }
}
