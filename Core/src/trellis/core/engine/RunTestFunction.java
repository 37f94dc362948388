package trellis.core.engine;

import trellis.core.RunArgs;

/**
 * Runs one test of a suite by name.
 */
@FunctionalInterface
public interface RunTestFunction {

    public void runTest(String testName, RunArgs args);
}
