package trellis.core.style;

import trellis.core.RunArgs;
import trellis.core.Tag;
import trellis.core.engine.Engine;
import trellis.core.engine.SuperEngine;
import trellis.core.engine.TestBody;

/**
 * A suite of tests nested in {@code describe} scopes, registered from the constructor. The full name of a test is the
 * text of its enclosing scopes followed by its own text.
 */
public abstract class FunSpec extends StyleSuite<TestBody> {
    private final Engine engine = new Engine(this.getClass().getName());

    protected void describe(String description, Runnable body) {
        this.engine.registerNestedBranch(description, null, body, "A describe clause may not appear inside an it clause.");
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
