package trellis.core.runner;

import org.junit.Assert;
import org.junit.Test;
import trellis.core.Filter;
import trellis.core.RequestableStopper;
import trellis.core.Suite;
import trellis.core.Tag;
import trellis.core.event.Event;
import trellis.core.event.EventType;
import trellis.core.helper.AssertHelper;
import trellis.core.helper.EventRecordingReporter;
import trellis.core.style.FunSuite;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.startsWith;

public class SuiteRunnerTest {

    @Test
    public void testSuitesAreBracketedBySuiteEvents() throws InterruptedException {
        EventRecordingReporter reporter = new EventRecordingReporter();
        RunSummary summary = SuiteRunner.Builder.newBuilder().reporter(reporter).build().run(Arrays.asList(new PassingSuite(), new MixedSuite()));

        assertThat(reporter.describe(), contains(
                "SUITE_STARTING:PassingSuite",
                "TEST_STARTING:one",
                "TEST_SUCCEEDED:one",
                "TEST_STARTING:two",
                "TEST_SUCCEEDED:two",
                "SUITE_COMPLETED:PassingSuite",
                "SUITE_STARTING:MixedSuite",
                "TEST_STARTING:passes",
                "TEST_SUCCEEDED:passes",
                "TEST_STARTING:fails",
                "TEST_FAILED:fails",
                "TEST_IGNORED:ignored",
                "SUITE_COMPLETED:MixedSuite"));

        Assert.assertEquals(3, summary.testsSucceeded);
        Assert.assertEquals(1, summary.testsFailed);
        Assert.assertEquals(1, summary.testsIgnored);
        Assert.assertEquals(2, summary.suitesCompleted);
        Assert.assertFalse(summary.isSuccessful());
        Assert.assertNotNull(reporter.eventsOfType(EventType.SUITE_COMPLETED).get(0).durationMillis);
    }

    @Test
    public void testAbortedSuiteDoesNotStopTheRun() throws InterruptedException {
        EventRecordingReporter reporter = new EventRecordingReporter();
        RunSummary summary = SuiteRunner.Builder.newBuilder().reporter(reporter).build().run(Arrays.asList(new BrokenSuite(), new PassingSuite()));

        Assert.assertEquals(1, summary.suitesAborted);
        Assert.assertEquals(1, summary.suitesCompleted);
        Assert.assertEquals(2, summary.testsSucceeded);
        Event aborted = reporter.eventsOfType(EventType.SUITE_ABORTED).get(0);
        Assert.assertEquals("BrokenSuite", aborted.suiteName);
        Assert.assertEquals("cannot start", aborted.throwable.getMessage());
    }

    @Test
    public void testAbortErrorEndsTheRun() {
        EventRecordingReporter reporter = new EventRecordingReporter();
        SuiteRunner runner = SuiteRunner.Builder.newBuilder().reporter(reporter).build();

        AssertHelper.assertThrows(OutOfMemoryError.class, () -> runner.run(Arrays.asList(new ExhaustedSuite(), new PassingSuite())));
        assertThat(reporter.describe(), contains("SUITE_STARTING:ExhaustedSuite", "SUITE_ABORTED:ExhaustedSuite"));
    }

    @Test
    public void testFilterAndConfigAreHandedToTheSuites() throws InterruptedException {
        EventRecordingReporter reporter = new EventRecordingReporter();
        ConfigSuite configSuite = new ConfigSuite();
        RunSummary summary = SuiteRunner.Builder.newBuilder()
                .reporter(reporter)
                .filter(Filter.of(null, Collections.singleton("slow"), null))
                .configMap(Collections.singletonMap("answer", 42L))
                .build()
                .run(Collections.singletonList(configSuite));

        Assert.assertEquals(1, summary.testsSucceeded);
        Assert.assertEquals(0, summary.testsIgnored);
        Assert.assertEquals(42L, configSuite.seen);
    }

    @Test
    public void testStopRequestedBeforehandRunsNothing() throws InterruptedException {
        RequestableStopper stopper = new RequestableStopper();
        stopper.requestStop();
        EventRecordingReporter reporter = new EventRecordingReporter();

        RunSummary summary = SuiteRunner.Builder.newBuilder().reporter(reporter).stopper(stopper).build().run(Collections.singletonList(new PassingSuite()));

        Assert.assertTrue(reporter.events().isEmpty());
        Assert.assertEquals(0, summary.suitesCompleted);
    }

    @Test
    public void testParallelRunKeepsEachSuiteInOrder() throws InterruptedException {
        EventRecordingReporter reporter = new EventRecordingReporter();
        List<Suite> suites = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            suites.add(new PassingSuite());
        }
        suites.add(new MixedSuite());

        RunSummary summary = SuiteRunner.Builder.newBuilder().reporter(reporter).numThreads(3).build().run(suites);

        Assert.assertEquals(5, summary.suitesCompleted);
        Assert.assertEquals(9, summary.testsSucceeded);
        Assert.assertEquals(1, summary.testsFailed);

        List<Event> sorted = reporter.events();
        sorted.sort(Comparator.comparing((Event event) -> event.ordinal));
        Event current = null;
        for (Event event : sorted) {
            assertThat(event.threadName, startsWith("SuiteWorker-"));
            if (event.type == EventType.SUITE_STARTING) {
                Assert.assertNull(current);
                current = event;
            } else if (event.type == EventType.SUITE_COMPLETED) {
                Assert.assertNotNull(current);
                current = null;
            } else {
                Assert.assertNotNull(current);
            }
        }
        Assert.assertNull(current);
    }

    @Test
    public void testNestedSuitesRunOnTheWorkerOfTheirParent() throws InterruptedException {
        EventRecordingReporter reporter = new EventRecordingReporter();
        RunSummary summary = SuiteRunner.Builder.newBuilder().reporter(reporter).numThreads(2).build().run(Collections.singletonList(new ParentSuite()));

        Assert.assertEquals(3, summary.suitesCompleted);
        Assert.assertEquals(4, summary.testsSucceeded);

        String workerName = reporter.events().get(0).threadName;
        assertThat(workerName, startsWith("SuiteWorker-"));
        for (Event event : reporter.events()) {
            Assert.assertEquals(workerName, event.threadName);
        }
        assertThat(reporter.describe(), contains(
                "SUITE_STARTING:ParentSuite",
                "TEST_STARTING:own",
                "TEST_SUCCEEDED:own",
                "SUITE_STARTING:PassingSuite",
                "TEST_STARTING:one",
                "TEST_SUCCEEDED:one",
                "TEST_STARTING:two",
                "TEST_SUCCEEDED:two",
                "SUITE_COMPLETED:PassingSuite",
                "SUITE_STARTING:PassingSuite",
                "TEST_STARTING:one",
                "TEST_SUCCEEDED:one",
                "TEST_STARTING:two",
                "TEST_SUCCEEDED:two",
                "SUITE_COMPLETED:PassingSuite",
                "SUITE_COMPLETED:ParentSuite"));
    }

    @Test
    public void testInvalidThreadCountIsRejected() {
        AssertHelper.assertThrows(IllegalArgumentException.class, () -> SuiteRunner.Builder.newBuilder().reporter(new EventRecordingReporter()).numThreads(0).build());
    }

    public static final class PassingSuite extends FunSuite {
        public PassingSuite() {
            test("one", () -> {});
            test("two", () -> {});
        }
    }

    public static final class ParentSuite extends FunSuite {
        private final List<Suite> nested = Arrays.asList(new PassingSuite(), new PassingSuite());

        public ParentSuite() {
            test("own", () -> {});
        }

        @Override
        public List<Suite> nestedSuites() {
            return this.nested;
        }
    }

    public static final class MixedSuite extends FunSuite {
        public MixedSuite() {
            test("passes", () -> {});
            test("fails", () -> Assert.fail("on purpose"));
            ignore("ignored", () -> {});
        }
    }

    public static final class BrokenSuite extends FunSuite {
        public BrokenSuite() {
            test("never runs", () -> {});
        }

        @Override
        protected void beforeAll(Map<String, Object> configMap) {
            throw new IllegalStateException("cannot start");
        }
    }

    public static final class ExhaustedSuite extends FunSuite {
        public ExhaustedSuite() {
            test("never runs", () -> {});
        }

        @Override
        protected void beforeAll(Map<String, Object> configMap) {
            throw new OutOfMemoryError("simulated");
        }
    }

    public static final class ConfigSuite extends FunSuite {
        private volatile Object seen;

        public ConfigSuite() {
            test("reads config", () -> {});
            test("slow", () -> Assert.fail("excluded"), Tag.of("slow"));
        }

        @Override
        protected void beforeAll(Map<String, Object> configMap) {
            this.seen = configMap.get("answer");
        }
    }
}
