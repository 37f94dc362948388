package trellis.core.engine;

import trellis.core.RunArgs;
import trellis.core.Suite;

/**
 * The engine of the styles whose test bodies take no argument.
 */
public class Engine extends SuperEngine<TestBody> {

    public Engine(String suiteClassName) {
        super(suiteClassName);
    }

    /**
     * Runs the named test by calling its body directly.
     *
     * @param suite The suite the test belongs to.
     * @param testName The full name of the test.
     * @param args The collaborators of the run.
     */
    public void runTestImpl(Suite suite, String testName, RunArgs args) {
        runTestImpl(suite, testName, args, test -> test.testFun.run());
    }
}
