package trellis.example;

import trellis.core.AbstractSuite;
import trellis.core.RunArgs;
import trellis.core.Suite;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A suite without tests of its own that runs every example suite as a nested suite.
 */
public final class AllStackSuites extends AbstractSuite {
    private final List<Suite> nestedSuites = Arrays.asList(
            new StackFunSuite(),
            new StackFunSpec(),
            new StackWordSpec(),
            new StackFlatSpec(),
            new StackFixtureSuite(),
            new StackPathSpec());

    @Override
    public List<String> testNames() {
        return Collections.emptyList();
    }

    @Override
    public Map<String, Set<String>> tags() {
        return Collections.emptyMap();
    }

    @Override
    public List<Suite> nestedSuites() {
        return this.nestedSuites;
    }

    @Override
    protected void runTests(String testName, RunArgs args) {}
}
