package trellis.core;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A named collection of tests that can be run.
 */
public interface Suite {

    /**
     * Returns the name displayed for this suite, by default its simple class name.
     */
    public String suiteName();

    /**
     * Returns an identifier that is unique among the suites of a run, by default the fully qualified class name.
     */
    public String suiteId();

    /**
     * Returns the full names of this suite's tests in the order they were registered.
     */
    public List<String> testNames();

    /**
     * Returns the tags of every tagged test, keyed by test name. Untagged tests are absent.
     */
    public Map<String, Set<String>> tags();

    /**
     * Returns how many tests a run with the given filter will actually execute.
     *
     * @param filter The filter of the run.
     * @return the number of tests expected to run.
     */
    public int expectedTestCount(Filter filter);

    /**
     * Runs this suite.
     *
     * @param testName The single test to run, or null to run every test.
     * @param args The collaborators of the run.
     */
    public void run(String testName, RunArgs args);
}
