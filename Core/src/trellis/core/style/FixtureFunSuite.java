package trellis.core.style;

import trellis.core.RunArgs;
import trellis.core.Tag;
import trellis.core.engine.FixtureEngine;
import trellis.core.engine.FixtureTestBody;
import trellis.core.engine.SuperEngine;

/**
 * A {@link FunSuite} whose test bodies are handed a fixture. Subclasses create the fixture, and clean it up, in
 * {@link #withFixture(OneArgTest)}, which runs once for every test.
 *
 * @param <F> The type of the fixture.
 */
public abstract class FixtureFunSuite<F> extends StyleSuite<FixtureTestBody<F>> {
    private final FixtureEngine<F> engine = new FixtureEngine<>(this.getClass().getName());

    /**
     * Creates a fixture, hands it to the test and cleans it up.
     *
     * @param test The test to run.
     */
    protected abstract void withFixture(OneArgTest<F> test) throws Throwable;

    protected void test(String testName, FixtureTestBody<F> body, Tag... tags) {
        this.engine.registerTest(testName, body, "A test clause may not appear inside another test clause.", tags);
    }

    protected void ignore(String testName, FixtureTestBody<F> body, Tag... tags) {
        this.engine.registerIgnoredTest(testName, body, "An ignore clause may not appear inside a test clause.", tags);
    }

    @Override
    SuperEngine<FixtureTestBody<F>> engine() {
        return this.engine;
    }

    @Override
    void runTest(String testName, RunArgs args) {
        this.engine.runTestImpl(this, testName, args, test -> withFixture(new OneArgTest<>(test.testName, test.testFun, args.configMap)));
    }
}
