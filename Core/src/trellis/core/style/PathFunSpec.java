package trellis.core.style;

import trellis.core.RunArgs;
import trellis.core.Tag;
import trellis.core.engine.PathEngine;
import trellis.core.engine.SuperEngine;
import trellis.core.engine.TestBody;

import java.util.List;

/**
 * A {@link FunSpec} in which every test runs in its own instance of the suite, while that instance defines its tests.
 * Subclasses define their scopes and tests in {@link #define()} and need a public no-argument constructor.
 *
 * Since every test gets a fresh instance, the state a test sees is exactly what the fields of the suite and the code
 * of its enclosing scopes set up for it:
 *
 * <pre>
 * public final class StackSpec extends PathFunSpec {
 *     private final Deque&lt;Integer&gt; stack = new ArrayDeque&lt;&gt;();
 *
 *     protected void define() {
 *         describe("A stack", () -&gt; {
 *             stack.push(9);
 *             it("has one element", () -&gt; assertEquals(1, stack.size()));
 *             it("pops it", () -&gt; assertEquals(9, (int) stack.pop()));
 *         });
 *     }
 * }
 * </pre>
 *
 * The tests have all run by the time the suite's test names are first asked for; running the suite reports the
 * outcomes that were observed.
 */
public abstract class PathFunSpec extends StyleSuite<TestBody> {
    private PathEngine engine;

    /**
     * Defines the scopes and tests of the suite.
     */
    protected abstract void define();

    protected void describe(String description, Runnable body) {
        engine().handleNestedBranch(description, null, body);
    }

    protected void it(String specText, TestBody body, Tag... tags) {
        engine().handleTest(specText, body, tags);
    }

    protected void ignore(String specText, TestBody body, Tag... tags) {
        engine().handleIgnoredTest(specText, body, tags);
    }

    /**
     * Returns the paths of the tests each pass over {@link #define()} registered, in order.
     */
    public List<List<Integer>> targetedPaths() {
        ensureRegistered();
        return engine().targetedPaths();
    }

    @Override
    synchronized PathEngine engine() {
        if (this.engine == null) {
            this.engine = PathEngine.forSuite(this.getClass().getName(),
                    "An it clause may not appear inside another it clause.",
                    "An ignore clause may not appear inside an it clause.",
                    "A describe clause may not appear inside an it clause.");
        }
        return this.engine;
    }

    @Override
    void ensureRegistered() {
        engine().ensureTestResultsRegistered(this::define, () -> {
            PathFunSpec fresh = newInstance();
            fresh.engine = engine();
            return fresh::define;
        });
    }

    @Override
    void runTest(String testName, RunArgs args) {
        engine().runTestImpl(this, testName, args);
    }

    private PathFunSpec newInstance() {
        try {
            return this.getClass().getDeclaredConstructor().newInstance();
        } catch (ReflectiveOperationException e) {
            throw new IllegalStateException(this.getClass().getName() + " needs a public no-argument constructor to run each of its tests in a fresh instance.", e);
        }
    }
}
