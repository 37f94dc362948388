package trellis.core.engine;

import org.junit.Assert;
import org.junit.Test;
import trellis.core.Filter;
import trellis.core.RunArgs;
import trellis.core.Tag;
import trellis.core.exception.DuplicateTestNameException;
import trellis.core.exception.TestRegistrationClosedException;
import trellis.core.helper.AssertHelper;
import trellis.core.helper.EventRecordingReporter;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsInAnyOrder;

public class EngineRegistrationTest {
    private static final String CLOSED = "registration closed";
    private static final TestBody NOTHING = () -> {};
    private final Engine engine = new Engine(EngineRegistrationTest.class.getName());

    @Test
    public void testDuplicateNameIsRejected() {
        this.engine.registerTest("A", NOTHING, CLOSED);
        DuplicateTestNameException e = AssertHelper.assertThrows(DuplicateTestNameException.class, () -> this.engine.registerTest("A", NOTHING, CLOSED));
        Assert.assertEquals("A", e.testName);
        Assert.assertEquals(Collections.singletonList("A"), this.engine.testNames());
    }

    @Test
    public void testDistinctNamesAreAccepted() {
        this.engine.registerTest("A", NOTHING, CLOSED);
        this.engine.registerTest("B", NOTHING, CLOSED);
        Assert.assertEquals(Arrays.asList("A", "B"), this.engine.testNames());
    }

    @Test
    public void testSameTextInDifferentScopesIsNotADuplicate() {
        this.engine.registerNestedBranch("one", null, () -> this.engine.registerTest("works", NOTHING, CLOSED), CLOSED);
        this.engine.registerNestedBranch("two", null, () -> this.engine.registerTest("works", NOTHING, CLOSED), CLOSED);
        Assert.assertEquals(Arrays.asList("one works", "two works"), this.engine.testNames());
    }

    @Test
    public void testNamesKeepRegistrationOrderAcrossNesting() {
        this.engine.registerTest("first", NOTHING, CLOSED);
        this.engine.registerNestedBranch("outer", null, () -> {
            this.engine.registerTest("second", NOTHING, CLOSED);
            this.engine.registerNestedBranch("inner", null, () -> this.engine.registerIgnoredTest("third", NOTHING, CLOSED), CLOSED);
            this.engine.registerTest("fourth", NOTHING, CLOSED);
        }, CLOSED);
        this.engine.registerTest("fifth", NOTHING, CLOSED);

        Assert.assertEquals(Arrays.asList("first", "outer second", "outer inner third", "outer fourth", "fifth"), this.engine.testNames());
    }

    @Test
    public void testNestedNameJoinsScopeAndTestText() {
        String description = this.engine.registerNestedBranch("outer", null, () -> this.engine.registerTest("inner", NOTHING, CLOSED), CLOSED).descriptionText;
        Assert.assertEquals("outer", description);
        Assert.assertEquals(Collections.singletonList("outer inner"), this.engine.testNames());
        Assert.assertTrue(this.engine.currentBranchIsTrunk());
    }

    @Test
    public void testChildPrefixIsPartOfTheName() {
        this.engine.registerNestedBranch("A stack", "when", () ->
                this.engine.registerNestedBranch("empty", "should", () ->
                        this.engine.registerTest("be empty", NOTHING, CLOSED), CLOSED), CLOSED);
        Assert.assertEquals(Collections.singletonList("A stack when empty should be empty"), this.engine.testNames());
    }

    @Test
    public void testFlatBranchCollectsFollowingTests() {
        this.engine.registerFlatBranch("A stack", CLOSED);
        Assert.assertFalse(this.engine.currentBranchIsTrunk());
        this.engine.registerTest("should pop", NOTHING, CLOSED);
        this.engine.registerFlatBranch("A queue", CLOSED);
        this.engine.registerTest("should poll", NOTHING, CLOSED);
        Assert.assertEquals(Arrays.asList("A stack should pop", "A queue should poll"), this.engine.testNames());
    }

    @Test
    public void testTagsAreRecordedPerTest() {
        this.engine.registerTest("tagged", NOTHING, CLOSED, Tag.of("slow"), Tag.of("db"));
        this.engine.registerTest("untagged", NOTHING, CLOSED);

        Assert.assertEquals(new LinkedHashSet<>(Arrays.asList("slow", "db")), this.engine.tags().get("tagged"));
        Assert.assertFalse(this.engine.tags().containsKey("untagged"));
    }

    @Test
    public void testIgnoredTestGetsTheIgnoreTagAndKeepsItsOwn() {
        this.engine.registerIgnoredTest("later", NOTHING, CLOSED, Tag.of("slow"));
        assertThat(this.engine.tags().get("later"), containsInAnyOrder("slow", Filter.IGNORE_TAG));
        Assert.assertEquals(Collections.singletonList("later"), this.engine.testNames());
    }

    @Test
    public void testTestPath() {
        this.engine.registerTest("a", NOTHING, CLOSED);
        this.engine.registerNestedBranch("b", null, () -> {
            this.engine.registerTest("c", NOTHING, CLOSED);
            this.engine.registerTest("d", NOTHING, CLOSED);
        }, CLOSED);

        assertThat(this.engine.testPath("a"), contains(0));
        assertThat(this.engine.testPath("b c"), contains(1, 0));
        assertThat(this.engine.testPath("b d"), contains(1, 1));
        AssertHelper.assertThrows(IllegalArgumentException.class, () -> this.engine.testPath("nope"));
    }

    @Test
    public void testRegistrationIsClosedAfterRun() {
        EngineBackedSuite suite = new EngineBackedSuite();
        suite.engine.registerTest("only", NOTHING, CLOSED);
        suite.run(null, RunArgs.Builder.newBuilder().reporter(new EventRecordingReporter()).build());

        List<String> before = suite.engine.testNames();
        TestRegistrationClosedException e = AssertHelper.assertThrows(TestRegistrationClosedException.class, () -> suite.engine.registerTest("late", NOTHING, CLOSED));
        Assert.assertEquals(CLOSED, e.getMessage());
        AssertHelper.assertThrows(TestRegistrationClosedException.class, () -> suite.engine.registerIgnoredTest("late", NOTHING, CLOSED));
        AssertHelper.assertThrows(TestRegistrationClosedException.class, () -> suite.engine.registerNestedBranch("late", null, () -> {}, CLOSED));
        AssertHelper.assertThrows(TestRegistrationClosedException.class, () -> suite.engine.registerFlatBranch("late", CLOSED));

        Assert.assertSame(before, suite.engine.testNames());
        Assert.assertTrue(suite.engine.tags().isEmpty());
    }

    @Test
    public void testFailingScopeBodyRestoresTheCurrentBranch() {
        AssertHelper.assertThrows(IllegalStateException.class, () -> this.engine.registerNestedBranch("broken", null, () -> {
            throw new IllegalStateException("boom");
        }, CLOSED));
        Assert.assertTrue(this.engine.currentBranchIsTrunk());

        this.engine.registerTest("after", NOTHING, CLOSED);
        Assert.assertEquals(Collections.singletonList("after"), this.engine.testNames());
    }

    @Test
    public void testNullArgumentsAreRejected() {
        AssertHelper.assertThrows(NullPointerException.class, () -> this.engine.registerTest(null, NOTHING, CLOSED));
        AssertHelper.assertThrows(NullPointerException.class, () -> this.engine.registerTest("a", null, CLOSED));
        AssertHelper.assertThrows(NullPointerException.class, () -> this.engine.registerTest("a", NOTHING, CLOSED, (Tag) null));
        Assert.assertTrue(this.engine.testNames().isEmpty());
    }
}
