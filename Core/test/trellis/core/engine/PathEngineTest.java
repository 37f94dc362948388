package trellis.core.engine;

import org.junit.Assert;
import org.junit.Test;
import trellis.core.AbstractSuite;
import trellis.core.RunArgs;
import trellis.core.event.Event;
import trellis.core.event.EventType;
import trellis.core.exception.DuplicateTestNameException;
import trellis.core.exception.TestCanceledException;
import trellis.core.exception.TestPendingException;
import trellis.core.exception.TestRegistrationClosedException;
import trellis.core.helper.AssertHelper;
import trellis.core.helper.EventRecordingReporter;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.hamcrest.Matchers.instanceOf;

public class PathEngineTest {
    private static final String IT_IN_IT = "it inside it";
    private static final String IGNORE_IN_IT = "ignore inside it";
    private static final String DESCRIBE_IN_IT = "describe inside it";
    private static final long SLOW_MILLIS = 50;

    @Test
    public void testIsInTargetPathOnTheFirstPass() {
        Assert.assertTrue(PathEngine.isInTargetPath(Collections.singletonList(0), null));
        Assert.assertTrue(PathEngine.isInTargetPath(Arrays.asList(0, 0, 0), null));
        Assert.assertFalse(PathEngine.isInTargetPath(Collections.singletonList(1), null));
        Assert.assertFalse(PathEngine.isInTargetPath(Arrays.asList(0, 1), null));
    }

    @Test
    public void testIsInTargetPathWithATarget() {
        List<Integer> target = Arrays.asList(0, 1);

        // On the way to the target.
        Assert.assertTrue(PathEngine.isInTargetPath(Collections.singletonList(0), target));
        // The target itself.
        Assert.assertTrue(PathEngine.isInTargetPath(Arrays.asList(0, 1), target));
        // Below the target through first elements only.
        Assert.assertTrue(PathEngine.isInTargetPath(Arrays.asList(0, 1, 0), target));
        Assert.assertTrue(PathEngine.isInTargetPath(Arrays.asList(0, 1, 0, 0), target));

        Assert.assertFalse(PathEngine.isInTargetPath(Collections.singletonList(1), target));
        Assert.assertFalse(PathEngine.isInTargetPath(Arrays.asList(0, 0), target));
        Assert.assertFalse(PathEngine.isInTargetPath(Arrays.asList(0, 2), target));
        Assert.assertFalse(PathEngine.isInTargetPath(Arrays.asList(0, 1, 1), target));
    }

    @Test
    public void testGetNextPathCountsWithinTheCurrentScope() {
        PathEngine engine = newEngine();
        assertThat(engine.getNextPath(), contains(0));
        assertThat(engine.getNextPath(), contains(1));
        assertThat(engine.getNextPath(), contains(2));
    }

    @Test
    public void testEveryTestRunsOnceInItsOwnPass() {
        PathEngine engine = newEngine();
        List<String> ran = new ArrayList<>();
        List<String> scopesEntered = new ArrayList<>();

        PathEngine.PassDefinition definition = () -> {
            engine.handleNestedBranch("A", null, () -> {
                scopesEntered.add("A");
                engine.handleTest("L1", () -> ran.add("L1"));
                engine.handleTest("L2", () -> ran.add("L2"));
            });
            engine.handleTest("L3", () -> ran.add("L3"));
        };
        engine.ensureTestResultsRegistered(definition, () -> definition);

        Assert.assertEquals(Arrays.asList("L1", "L2", "L3"), ran);
        Assert.assertEquals(Arrays.asList("A", "A"), scopesEntered);
        Assert.assertEquals(Arrays.asList("A L1", "A L2", "L3"), engine.testNames());
        Assert.assertEquals(Arrays.asList(Arrays.asList(0, 0), Arrays.asList(0, 1), Collections.singletonList(1)), engine.targetedPaths());
    }

    @Test
    public void testRegistrationHappensOnlyOnce() {
        PathEngine engine = newEngine();
        List<String> ran = new ArrayList<>();
        PathEngine.PassDefinition definition = () -> engine.handleTest("only", () -> ran.add("only"));

        engine.ensureTestResultsRegistered(definition, () -> definition);
        engine.ensureTestResultsRegistered(definition, () -> definition);

        Assert.assertEquals(Collections.singletonList("only"), ran);
    }

    @Test
    public void testEachPassUsesAFreshDefinition() {
        PathEngine engine = newEngine();
        List<Integer> instances = new ArrayList<>();
        int[] created = { 0 };

        engine.ensureTestResultsRegistered(passFor(engine, 0, instances), () -> passFor(engine, ++created[0], instances));

        Assert.assertEquals(2, created[0]);
        Assert.assertEquals(Arrays.asList(0, 1, 2), instances);
    }

    @Test
    public void testEmptyScopeIsStillRegistered() {
        PathEngine engine = newEngine();
        PathEngine.PassDefinition definition = () -> {
            engine.handleNestedBranch("empty", null, () -> {});
            engine.handleTest("after", () -> {});
        };
        engine.ensureTestResultsRegistered(definition, () -> definition);

        Assert.assertEquals(Collections.singletonList("after"), engine.testNames());
        assertThat(engine.testPath("after"), contains(1));
    }

    @Test
    public void testIgnoredTestIsRegisteredButNotRun() {
        PathEngine engine = newEngine();
        List<String> ran = new ArrayList<>();
        PathEngine.PassDefinition definition = () -> {
            engine.handleIgnoredTest("skipped", () -> ran.add("skipped"));
            engine.handleTest("runs", () -> ran.add("runs"));
        };
        engine.ensureTestResultsRegistered(definition, () -> definition);

        Assert.assertEquals(Collections.singletonList("runs"), ran);
        Assert.assertEquals(Arrays.asList("skipped", "runs"), engine.testNames());
    }

    @Test
    public void testRecordedOutcomesAndMessagesAreReplayed() {
        PathEngineSuite suite = new PathEngineSuite();
        PathEngine engine = suite.engine;
        AssertionError failure = new AssertionError("wrong");
        PathEngine.PassDefinition definition = () -> engine.handleNestedBranch("A stack", null, () -> {
            engine.handleTest("passes", () -> engine.informer().apply("while passing"));
            engine.handleTest("fails", () -> {
                throw failure;
            });
        });
        engine.ensureTestResultsRegistered(definition, () -> definition);

        EventRecordingReporter reporter = new EventRecordingReporter();
        suite.run(null, RunArgs.Builder.newBuilder().reporter(reporter).build());

        assertThat(reporter.describe(), contains(
                "SCOPE_OPENED:A stack",
                "TEST_STARTING:passes",
                "TEST_SUCCEEDED:passes",
                "INFO_PROVIDED:while passing",
                "TEST_STARTING:fails",
                "TEST_FAILED:fails",
                "SCOPE_CLOSED:A stack"));

        Event info = reporter.eventsOfType(EventType.INFO_PROVIDED).get(0);
        Assert.assertEquals("A stack passes", info.testName);
        Assert.assertEquals(2, info.indentationLevel);
        Assert.assertSame(failure, reporter.eventsOfType(EventType.TEST_FAILED).get(0).throwable);
    }

    @Test
    public void testEveryOutcomeReportsTheDurationOfItsPass() {
        PathEngineSuite suite = new PathEngineSuite();
        PathEngine engine = suite.engine;
        PathEngine.PassDefinition definition = () -> {
            engine.handleTest("passes", () -> Thread.sleep(SLOW_MILLIS));
            engine.handleTest("fails", () -> {
                Thread.sleep(SLOW_MILLIS);
                Assert.fail("on purpose");
            });
            engine.handleTest("pending", () -> {
                Thread.sleep(SLOW_MILLIS);
                throw new TestPendingException();
            });
            engine.handleTest("canceled", () -> {
                Thread.sleep(SLOW_MILLIS);
                throw new TestCanceledException("no network");
            });
        };
        engine.ensureTestResultsRegistered(definition, () -> definition);

        EventRecordingReporter reporter = new EventRecordingReporter();
        suite.run(null, RunArgs.Builder.newBuilder().reporter(reporter).build());

        for (EventType type : Arrays.asList(EventType.TEST_SUCCEEDED, EventType.TEST_FAILED, EventType.TEST_PENDING, EventType.TEST_CANCELED)) {
            List<Event> events = reporter.eventsOfType(type);
            Assert.assertEquals(1, events.size());
            assertThat(type.toString(), events.get(0).durationMillis, greaterThanOrEqualTo(SLOW_MILLIS));
        }
    }

    @Test
    public void testRegistrationMessagesAreAddedOnce() {
        PathEngineSuite suite = new PathEngineSuite();
        PathEngine engine = suite.engine;
        PathEngine.PassDefinition definition = () -> {
            engine.informer().apply("top");
            engine.handleNestedBranch("scope", null, () -> {
                engine.informer().apply("inside");
                engine.handleTest("a", () -> {});
                engine.handleTest("b", () -> {});
            });
        };
        engine.ensureTestResultsRegistered(definition, () -> definition);

        EventRecordingReporter reporter = new EventRecordingReporter();
        suite.run(null, RunArgs.Builder.newBuilder().reporter(reporter).build());

        assertThat(reporter.describe(), contains(
                "INFO_PROVIDED:top",
                "SCOPE_OPENED:scope",
                "INFO_PROVIDED:inside",
                "TEST_STARTING:a",
                "TEST_SUCCEEDED:a",
                "TEST_STARTING:b",
                "TEST_SUCCEEDED:b",
                "SCOPE_CLOSED:scope"));
    }

    @Test
    public void testNestingInsideATestFailsThatTest() {
        PathEngineSuite suite = new PathEngineSuite();
        PathEngine engine = suite.engine;
        PathEngine.PassDefinition definition = () -> {
            engine.handleTest("nests a test", () -> engine.handleTest("inner", () -> {}));
            engine.handleTest("nests a scope", () -> engine.handleNestedBranch("inner", null, () -> {}));
            engine.handleTest("nests an ignore", () -> engine.handleIgnoredTest("inner", () -> {}));
        };
        engine.ensureTestResultsRegistered(definition, () -> definition);

        EventRecordingReporter reporter = new EventRecordingReporter();
        suite.run(null, RunArgs.Builder.newBuilder().reporter(reporter).build());

        List<Event> failures = reporter.eventsOfType(EventType.TEST_FAILED);
        Assert.assertEquals(3, failures.size());
        List<String> messages = new ArrayList<>();
        for (Event failure : failures) {
            assertThat(failure.throwable, instanceOf(TestRegistrationClosedException.class));
            messages.add(failure.throwable.getMessage());
        }
        Assert.assertEquals(Arrays.asList(IT_IN_IT, DESCRIBE_IN_IT, IGNORE_IN_IT), messages);
        Assert.assertEquals(Arrays.asList("nests a test", "nests a scope", "nests an ignore"), engine.testNames());
    }

    @Test
    public void testRegistrationIsClosedOnceRun() {
        PathEngineSuite suite = new PathEngineSuite();
        PathEngine engine = suite.engine;
        PathEngine.PassDefinition definition = () -> engine.handleTest("a", () -> {});
        engine.ensureTestResultsRegistered(definition, () -> definition);
        suite.run(null, RunArgs.Builder.newBuilder().reporter(new EventRecordingReporter()).build());

        AssertHelper.assertThrows(TestRegistrationClosedException.class, () -> engine.registerTest("late", () -> {}, IT_IN_IT));
    }

    private static PathEngine.PassDefinition passFor(PathEngine engine, int instance, List<Integer> instances) {
        return () -> {
            instances.add(instance);
            engine.handleTest("first", () -> {});
            engine.handleTest("second", () -> {});
            engine.handleTest("third", () -> {});
        };
    }

    @Test
    public void testDuplicateIsRejectedBeforeItsBodyRuns() {
        PathEngine engine = newEngine();
        List<String> ran = new ArrayList<>();
        PathEngine.PassDefinition definition = () -> {
            engine.handleTest("same", () -> ran.add("first"));
            engine.handleTest("same", () -> ran.add("second"));
            engine.handleTest("third", () -> ran.add("third"));
        };

        DuplicateTestNameException thrown = AssertHelper.assertThrows(DuplicateTestNameException.class, () -> engine.ensureTestResultsRegistered(definition, () -> definition));
        Assert.assertEquals("same", thrown.testName);
        Assert.assertEquals(Collections.singletonList("first"), ran);

        // The passes are not resumed.
        Assert.assertSame(thrown, AssertHelper.assertThrows(DuplicateTestNameException.class, () -> engine.ensureTestResultsRegistered(definition, () -> definition)));
        Assert.assertEquals(Collections.singletonList("first"), ran);
        Assert.assertEquals(Collections.singletonList("same"), engine.testNames());
    }

    @Test
    public void testDuplicateInsideAScopeIsRejectedBeforeItsBodyRuns() {
        PathEngine engine = newEngine();
        List<String> ran = new ArrayList<>();
        PathEngine.PassDefinition definition = () -> engine.handleNestedBranch("A", null, () -> {
            engine.handleTest("x", () -> ran.add("first"));
            engine.handleTest("x", () -> ran.add("second"));
        });

        DuplicateTestNameException thrown = AssertHelper.assertThrows(DuplicateTestNameException.class, () -> engine.ensureTestResultsRegistered(definition, () -> definition));
        Assert.assertEquals("A x", thrown.testName);
        Assert.assertEquals(Collections.singletonList("first"), ran);
    }

    private static PathEngine newEngine() {
        return PathEngine.forSuite(PathEngineTest.class.getName(), IT_IN_IT, IGNORE_IN_IT, DESCRIBE_IN_IT);
    }

    private static final class PathEngineSuite extends AbstractSuite {
        private final PathEngine engine = newEngine();

        @Override
        public List<String> testNames() {
            return this.engine.testNames();
        }

        @Override
        public Map<String, Set<String>> tags() {
            return this.engine.tags();
        }

        @Override
        public void run(String testName, RunArgs args) {
            this.engine.runImpl(this, testName, args, super::run);
        }

        @Override
        protected void runTests(String testName, RunArgs args) {
            this.engine.runTestsImpl(this, testName, args, (name, runArgs) -> this.engine.runTestImpl(this, name, runArgs));
        }
    }
}
