package trellis.core.style;

import trellis.core.RunArgs;
import trellis.core.Tag;
import trellis.core.engine.Engine;
import trellis.core.engine.SuperEngine;
import trellis.core.engine.TestBody;

/**
 * A suite of flat, named tests registered from the constructor:
 *
 * <pre>
 * public final class SetSuite extends FunSuite {
 *     public SetSuite() {
 *         test("an empty set has size 0", () -> assertEquals(0, new HashSet&lt;&gt;().size()));
 *     }
 * }
 * </pre>
 */
public abstract class FunSuite extends StyleSuite<TestBody> {
    private final Engine engine = new Engine(this.getClass().getName());

    protected void test(String testName, TestBody body, Tag... tags) {
        this.engine.registerTest(testName, body, "A test clause may not appear inside another test clause.", tags);
    }

    protected void ignore(String testName, TestBody body, Tag... tags) {
        this.engine.registerIgnoredTest(testName, body, "An ignore clause may not appear inside a test clause.", tags);
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
