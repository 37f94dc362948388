package trellis.core.engine;

import trellis.core.RunArgs;

/**
 * The run method of the suite class that the engine's run wraps, such as the one that runs before and after hooks
 * around the tests.
 */
@FunctionalInterface
public interface RunFunction {

    public void run(String testName, RunArgs args);
}
