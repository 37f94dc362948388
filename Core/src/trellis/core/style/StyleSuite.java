package trellis.core.style;

import trellis.core.AbstractSuite;
import trellis.core.RunArgs;
import trellis.core.engine.SuperEngine;
import trellis.core.exception.TestCanceledException;
import trellis.core.exception.TestPendingException;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * What every style shares: the engine that holds the registered tests, the way a run goes through that engine, and
 * the helpers test bodies call.
 *
 * @param <T> The type of the test bodies of the style.
 */
public abstract class StyleSuite<T> extends AbstractSuite {

    StyleSuite() {}

    abstract SuperEngine<T> engine();

    abstract void runTest(String testName, RunArgs args);

    /**
     * Called before the registered tests are looked at. Styles that register lazily do so here.
     */
    void ensureRegistered() {}

    @Override
    public List<String> testNames() {
        ensureRegistered();
        return engine().testNames();
    }

    @Override
    public Map<String, Set<String>> tags() {
        ensureRegistered();
        return engine().tags();
    }

    @Override
    public void run(String testName, RunArgs args) {
        ensureRegistered();
        engine().runImpl(this, testName, args, super::run);
    }

    @Override
    protected void runTests(String testName, RunArgs args) {
        engine().runTestsImpl(this, testName, args, this::runTest);
    }

    /**
     * Gives information about the suite or, while a test runs, about that test.
     *
     * @param message The information.
     */
    protected void info(String message) {
        engine().informer().apply(message);
    }

    /**
     * Gives markup about the suite or, while a test runs, about that test.
     *
     * @param markup The markup.
     */
    protected void markup(String markup) {
        engine().documenter().apply(markup);
    }

    /**
     * Ends the calling test as pending.
     */
    protected void pending() {
        throw new TestPendingException();
    }

    /**
     * Ends the calling test as canceled.
     *
     * @param message Why the test could not be carried out.
     */
    protected void cancel(String message) {
        throw new TestCanceledException(message);
    }

    /**
     * Ends the calling test as canceled unless the given condition holds.
     *
     * @param condition The condition the test depends on.
     * @param message What the test depends on.
     */
    protected void assume(boolean condition, String message) {
        if (!condition) {
            throw new TestCanceledException("Assumption failed: " + message);
        }
    }
}
