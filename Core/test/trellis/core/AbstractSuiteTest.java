package trellis.core;

import org.junit.Assert;
import org.junit.Test;
import trellis.core.event.EventType;
import trellis.core.helper.AssertHelper;
import trellis.core.helper.EventRecordingReporter;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;

public class AbstractSuiteTest {

    @Test
    public void testHooksRunAroundTheTests() {
        List<String> calls = new ArrayList<>();
        new HookedSuite(calls, null, null, null).run(null, args(new EventRecordingReporter()));
        Assert.assertEquals(Arrays.asList("beforeAll", "runTests", "afterAll"), calls);
    }

    @Test
    public void testAfterAllRunsWhenTheTestsThrow() {
        List<String> calls = new ArrayList<>();
        IllegalStateException testsError = new IllegalStateException("tests");
        HookedSuite suite = new HookedSuite(calls, null, testsError, null);

        IllegalStateException thrown = AssertHelper.assertThrows(IllegalStateException.class, () -> suite.run(null, args(new EventRecordingReporter())));
        Assert.assertSame(testsError, thrown);
        Assert.assertEquals(Arrays.asList("beforeAll", "runTests", "afterAll"), calls);
        Assert.assertEquals(0, thrown.getSuppressed().length);
    }

    @Test
    public void testTestsErrorWinsOverAfterAllError() {
        IllegalStateException testsError = new IllegalStateException("tests");
        IllegalArgumentException afterAllError = new IllegalArgumentException("afterAll");
        HookedSuite suite = new HookedSuite(new ArrayList<>(), null, testsError, afterAllError);

        IllegalStateException thrown = AssertHelper.assertThrows(IllegalStateException.class, () -> suite.run(null, args(new EventRecordingReporter())));
        Assert.assertSame(testsError, thrown);
        Assert.assertArrayEquals(new Throwable[]{ afterAllError }, thrown.getSuppressed());
    }

    @Test
    public void testAfterAllErrorPropagatesWhenTheTestsPass() {
        IllegalArgumentException afterAllError = new IllegalArgumentException("afterAll");
        HookedSuite suite = new HookedSuite(new ArrayList<>(), null, null, afterAllError);
        Assert.assertSame(afterAllError, AssertHelper.assertThrows(IllegalArgumentException.class, () -> suite.run(null, args(new EventRecordingReporter()))));
    }

    @Test
    public void testCheckedBeforeAllErrorIsWrappedAndSkipsEverything() {
        List<String> calls = new ArrayList<>();
        IOException beforeAllError = new IOException("no disk");
        HookedSuite suite = new HookedSuite(calls, beforeAllError, null, null);

        IllegalStateException thrown = AssertHelper.assertThrows(IllegalStateException.class, () -> suite.run(null, args(new EventRecordingReporter())));
        Assert.assertSame(beforeAllError, thrown.getCause());
        Assert.assertEquals("beforeAll of HookedSuite failed", thrown.getMessage());
        Assert.assertEquals(Collections.singletonList("beforeAll"), calls);
    }

    @Test
    public void testNestedSuitesRunAfterTheOwnTestsAsSuites() {
        List<String> calls = new ArrayList<>();
        ParentSuite parent = new ParentSuite(calls);
        EventRecordingReporter reporter = new EventRecordingReporter();
        parent.run(null, args(reporter));

        Assert.assertEquals(Arrays.asList("parent", "child"), calls);
        assertThat(reporter.types(), contains(EventType.SUITE_STARTING, EventType.SUITE_COMPLETED));
        Assert.assertEquals("ChildSuite", reporter.events().get(0).suiteName);
        Assert.assertEquals(2, parent.expectedTestCount(Filter.defaultFilter()));
    }

    @Test
    public void testSingleTestRunSkipsNestedSuites() {
        List<String> calls = new ArrayList<>();
        new ParentSuite(calls).run("own", args(new EventRecordingReporter()));
        Assert.assertEquals(Collections.singletonList("parent"), calls);
    }

    @Test
    public void testStopRequestSkipsNestedSuites() {
        List<String> calls = new ArrayList<>();
        RequestableStopper stopper = new RequestableStopper();
        stopper.requestStop();
        new ParentSuite(calls).run(null, RunArgs.Builder.newBuilder().reporter(new EventRecordingReporter()).stopper(stopper).build());
        Assert.assertEquals(Collections.singletonList("parent"), calls);
    }

    @Test
    public void testNamesDefaultToTheClass() {
        HookedSuite suite = new HookedSuite(new ArrayList<>(), null, null, null);
        Assert.assertEquals("HookedSuite", suite.suiteName());
        Assert.assertEquals(HookedSuite.class.getName(), suite.suiteId());
    }

    private static RunArgs args(Reporter reporter) {
        return RunArgs.Builder.newBuilder().reporter(reporter).build();
    }

    private static final class HookedSuite extends AbstractSuite {
        private final List<String> calls;
        private final Exception beforeAllError;
        private final RuntimeException testsError;
        private final RuntimeException afterAllError;

        private HookedSuite(List<String> calls, Exception beforeAllError, RuntimeException testsError, RuntimeException afterAllError) {
            this.calls = calls;
            this.beforeAllError = beforeAllError;
            this.testsError = testsError;
            this.afterAllError = afterAllError;
        }

        @Override
        public List<String> testNames() {
            return Collections.emptyList();
        }

        @Override
        public Map<String, Set<String>> tags() {
            return Collections.emptyMap();
        }

        @Override
        protected void beforeAll(Map<String, Object> configMap) throws Exception {
            this.calls.add("beforeAll");
            if (this.beforeAllError != null) {
                throw this.beforeAllError;
            }
        }

        @Override
        protected void runTests(String testName, RunArgs args) {
            this.calls.add("runTests");
            if (this.testsError != null) {
                throw this.testsError;
            }
        }

        @Override
        protected void afterAll(Map<String, Object> configMap) {
            this.calls.add("afterAll");
            if (this.afterAllError != null) {
                throw this.afterAllError;
            }
        }
    }

    private static final class ParentSuite extends AbstractSuite {
        private final List<String> calls;

        private ParentSuite(List<String> calls) {
            this.calls = calls;
        }

        @Override
        public List<String> testNames() {
            return Collections.singletonList("own");
        }

        @Override
        public Map<String, Set<String>> tags() {
            return Collections.emptyMap();
        }

        @Override
        public List<Suite> nestedSuites() {
            return Collections.singletonList(new ChildSuite(this.calls));
        }

        @Override
        protected void runTests(String testName, RunArgs args) {
            this.calls.add("parent");
        }
    }

    private static final class ChildSuite extends AbstractSuite {
        private final List<String> calls;

        private ChildSuite(List<String> calls) {
            this.calls = calls;
        }

        @Override
        public List<String> testNames() {
            return Collections.singletonList("nested");
        }

        @Override
        public Map<String, Set<String>> tags() {
            return Collections.emptyMap();
        }

        @Override
        protected void runTests(String testName, RunArgs args) {
            this.calls.add("child");
        }
    }
}
