package trellis.core.config;

import trellis.core.Filter;
import trellis.core.util.ObjectChecker;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * A request to run some suites.
 *
 * {@link RunRequest#suiteClassNames}: the fully qualified names of the suite classes to run, in order.
 * {@link RunRequest#testName}: the single test to run in each suite, or null to run every test.
 * {@link RunRequest#filter}: the filter of the run.
 * {@link RunRequest#configMap}: the config map handed to the suites.
 */
public final class RunRequest {
    public final List<String> suiteClassNames;
    public final String testName;
    public final Filter filter;
    public final Map<String, Object> configMap;

    private RunRequest(List<String> suiteClassNames, String testName, Filter filter, Map<String, Object> configMap) {
        ObjectChecker.assertNonNull(suiteClassNames, "suiteClassNames");
        ObjectChecker.assertNonNull(filter, "filter");
        ObjectChecker.assertNonNull(configMap, "configMap");
        this.suiteClassNames = Collections.unmodifiableList(suiteClassNames);
        this.testName = testName;
        this.filter = filter;
        this.configMap = Collections.unmodifiableMap(configMap);
    }

    public static RunRequest of(List<String> suiteClassNames, String testName, Filter filter, Map<String, Object> configMap) {
        return new RunRequest(suiteClassNames, testName, filter, configMap);
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " { suites: " + this.suiteClassNames + (this.testName == null ? "" : ", test: " + this.testName) + ", " + this.filter + " }";
    }
}
