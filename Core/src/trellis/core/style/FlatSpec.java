package trellis.core.style;

import trellis.core.RunArgs;
import trellis.core.Tag;
import trellis.core.engine.Engine;
import trellis.core.engine.SuperEngine;
import trellis.core.engine.TestBody;

/**
 * A suite without nesting. {@link #behaviorOf(String)} starts a new subject and every test registered after it
 * belongs to that subject, until the next subject starts.
 */
public abstract class FlatSpec extends StyleSuite<TestBody> {
    private final Engine engine = new Engine(this.getClass().getName());

    protected void behaviorOf(String subject) {
        this.engine.registerFlatBranch(subject, "A behavior of clause may not appear inside an it clause.");
    }

    protected void it(String specText, TestBody body, Tag... tags) {
        this.engine.registerTest(specText, body, "An it clause may not appear inside another it clause.", tags);
    }

    protected void ignore(String specText, TestBody body, Tag... tags) {
        this.engine.registerIgnoredTest(specText, body, "An ignore clause may not appear inside an it clause.", tags);
    }

    @Override
    SuperEngine<TestBody> engine() {
        return this.engine;
    }

    @Override
    void runTest(String testName, RunArgs args) {
        this.engine.runTestImpl(this, testName, args);
    }
}
