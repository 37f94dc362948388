package trellis.core.style;

import trellis.core.RunArgs;
import trellis.core.Tag;
import trellis.core.engine.Engine;
import trellis.core.engine.SuperEngine;
import trellis.core.engine.TestBody;

/**
 * A suite whose scopes read as a sentence: the verb of a scope joins its subject to the texts of its children.
 *
 * <pre>
 * when("A stack", () -&gt; {
 *     should("an empty stack", () -&gt; {
 *         in("be empty", () -&gt; assertTrue(new ArrayDeque&lt;&gt;().isEmpty()));
 *     });
 * });
 * </pre>
 *
 * registers the test {@code "A stack when an empty stack should be empty"}.
 */
public abstract class WordSpec extends StyleSuite<TestBody> {
    private static final String SCOPE_INSIDE_TEST = "A when, should or must clause may not appear inside an in clause.";
    private final Engine engine = new Engine(this.getClass().getName());

    protected void when(String subject, Runnable body) {
        this.engine.registerNestedBranch(subject, "when", body, SCOPE_INSIDE_TEST);
    }

    protected void should(String subject, Runnable body) {
        this.engine.registerNestedBranch(subject, "should", body, SCOPE_INSIDE_TEST);
    }

    protected void must(String subject, Runnable body) {
        this.engine.registerNestedBranch(subject, "must", body, SCOPE_INSIDE_TEST);
    }

    protected void in(String specText, TestBody body, Tag... tags) {
        this.engine.registerTest(specText, body, "An in clause may not appear inside another in clause.", tags);
    }

    protected void ignore(String specText, TestBody body, Tag... tags) {
        this.engine.registerIgnoredTest(specText, body, "An ignore clause may not appear inside an in clause.", tags);
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
