package trellis.core;

import trellis.core.runner.SuiteRunner;
import trellis.core.util.Logger;
import trellis.core.util.ObjectChecker;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * The base of every suite. Its {@link #run(String, RunArgs)} is the template that the style engines wrap: it calls
 * {@link #beforeAll(Map)}, runs the suite's own tests and then its nested suites, each reported as a suite of its own,
 * and always calls {@link #afterAll(Map)} once {@link #beforeAll(Map)} succeeded.
 *
 * If the tests and {@link #afterAll(Map)} both throw, the error of the tests propagates and the error of
 * {@link #afterAll(Map)} is attached to it as suppressed.
 */
public abstract class AbstractSuite implements Suite {
    private static final Logger LOGGER = Logger.forClass(AbstractSuite.class);

    @Override
    public String suiteName() {
        return this.getClass().getSimpleName();
    }

    @Override
    public String suiteId() {
        return this.getClass().getName();
    }

    @Override
    public int expectedTestCount(Filter filter) {
        ObjectChecker.assertNonNull(filter, "filter");
        int count = filter.runnableTestCount(testNames(), tags());
        for (Suite nested : nestedSuites()) {
            count += nested.expectedTestCount(filter);
        }
        return count;
    }

    /**
     * Returns the suites run after this suite's own tests when the whole suite is run. None by default.
     */
    public List<Suite> nestedSuites() {
        return Collections.emptyList();
    }

    /**
     * Called once before any test of the suite runs.
     *
     * @param configMap The config map of the run.
     */
    protected void beforeAll(Map<String, Object> configMap) throws Exception {}

    /**
     * Called once after the tests of the suite ran, whether or not they succeeded.
     *
     * @param configMap The config map of the run.
     */
    protected void afterAll(Map<String, Object> configMap) throws Exception {}

    /**
     * Runs the named test, or all the tests of this suite if no name is given.
     *
     * @param testName The single test to run, or null to run every test.
     * @param args The collaborators of the run.
     */
    protected abstract void runTests(String testName, RunArgs args);

    @Override
    public void run(String testName, RunArgs args) {
        ObjectChecker.assertNonNull(args, "args");

        callHook("beforeAll", () -> beforeAll(args.configMap));

        Throwable testsError = null;
        try {
            runTests(testName, args);
            if (testName == null) {
                runNestedSuites(args);
            }
        } catch (RuntimeException | Error e) {
            testsError = e;
            throw e;
        } finally {
            if (testsError == null) {
                callHook("afterAll", () -> afterAll(args.configMap));
            } else {
                try {
                    callHook("afterAll", () -> afterAll(args.configMap));
                } catch (RuntimeException | Error e) {
                    testsError.addSuppressed(e);
                    LOGGER.log("afterAll of " + suiteName() + " failed after its tests failed", e);
                }
            }
        }
    }

    private void runNestedSuites(RunArgs args) {
        for (Suite nested : nestedSuites()) {
            if (args.stopper.stopRequested()) {
                return;
            }
            if (args.distributor == null) {
                SuiteRunner.runSuite(nested, args);
            } else {
                args.distributor.apply(nested, args.tracker.nextTracker());
            }
        }
    }

    private void callHook(String name, Hook hook) {
        try {
            hook.call();
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new IllegalStateException(name + " of " + suiteName() + " failed", e);
        }
    }

    @FunctionalInterface
    private interface Hook {
        void call() throws Exception;
    }
}
