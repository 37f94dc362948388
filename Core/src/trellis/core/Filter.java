package trellis.core;

import trellis.core.util.ObjectChecker;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Decides which tests of a suite run, which are reported as ignored and which are left out of the run.
 *
 * A test is a candidate if it carries at least one of {@link #tagsToInclude} (when that set is given) and its name is
 * one of {@link #testNamesToInclude} (when that set is given). A candidate is left out if it carries any of
 * {@link #tagsToExclude}, with one exception: a test carrying the reserved {@link #IGNORE_TAG} whose only excluded tag
 * is the ignore tag itself stays in and is reported as ignored.
 */
public final class Filter {
    public static final String IGNORE_TAG = "trellis.Ignore";
    public final Set<String> tagsToInclude;
    public final Set<String> tagsToExclude;
    public final Set<String> testNamesToInclude;

    private Filter(Set<String> tagsToInclude, Set<String> tagsToExclude, Set<String> testNamesToInclude) {
        ObjectChecker.assertNonNull(tagsToExclude, "tagsToExclude");
        if ((tagsToInclude != null) && tagsToInclude.isEmpty()) {
            throw new IllegalArgumentException("tagsToInclude was defined, but contained an empty set");
        }
        if ((testNamesToInclude != null) && testNamesToInclude.isEmpty()) {
            throw new IllegalArgumentException("testNamesToInclude was defined, but contained an empty set");
        }
        this.tagsToInclude = (tagsToInclude == null) ? null : Collections.unmodifiableSet(new LinkedHashSet<>(tagsToInclude));
        this.tagsToExclude = Collections.unmodifiableSet(new LinkedHashSet<>(tagsToExclude));
        this.testNamesToInclude = (testNamesToInclude == null) ? null : Collections.unmodifiableSet(new LinkedHashSet<>(testNamesToInclude));
    }

    /**
     * Returns the filter that runs every test and reports the tests carrying the ignore tag as ignored.
     */
    public static Filter defaultFilter() {
        return new Filter(null, Collections.singleton(IGNORE_TAG), null);
    }

    /**
     * Returns a new filter.
     *
     * @param tagsToInclude The tags a test needs at least one of, or null to not filter on included tags.
     * @param tagsToExclude The tags that leave a test out of the run.
     * @param testNamesToInclude The only test names to consider, or null to consider every test.
     * @return the filter.
     */
    public static Filter of(Set<String> tagsToInclude, Set<String> tagsToExclude, Set<String> testNamesToInclude) {
        return new Filter(tagsToInclude, tagsToExclude, testNamesToInclude);
    }

    /**
     * Returns the decisions for every test of the given names that is not left out, in the order given.
     *
     * @param testNames The test names, in registration order.
     * @param tags The tags of each test. Tests without tags may be absent.
     * @return the decisions for the tests that stay in the run.
     */
    public List<FilterDecision> apply(List<String> testNames, Map<String, Set<String>> tags) {
        ObjectChecker.assertNonNull(testNames, "testNames");
        verifyTags(tags);

        List<FilterDecision> decisions = new ArrayList<>();
        for (String testName : includedTestNames(testNames, tags)) {
            Set<String> testTags = tags.get(testName);
            boolean isIgnored = (testTags != null) && testTags.contains(IGNORE_TAG);

            if ((testTags == null) || onlyExcludedByIgnoreTag(testTags) || intersect(testTags, this.tagsToExclude).isEmpty()) {
                decisions.add(new FilterDecision(testName, false, isIgnored));
            }
        }
        return decisions;
    }

    /**
     * Returns the decision for a single test.
     *
     * @param testName The name of the test.
     * @param tags The tags of each test of the suite.
     * @return the decision.
     */
    public FilterDecision apply(String testName, Map<String, Set<String>> tags) {
        ObjectChecker.assertNonNull(testName, "testName");
        List<FilterDecision> decisions = apply(Collections.singletonList(testName), tags);
        return decisions.isEmpty() ? new FilterDecision(testName, true, false) : decisions.get(0);
    }

    /**
     * Returns how many of the given tests would actually run, that is neither left out nor ignored.
     *
     * @param testNames The test names.
     * @param tags The tags of each test.
     * @return the number of tests to run.
     */
    public int runnableTestCount(List<String> testNames, Map<String, Set<String>> tags) {
        int count = 0;
        for (FilterDecision decision : apply(testNames, tags)) {
            if (!decision.ignored) {
                count++;
            }
        }
        return count;
    }

    private List<String> includedTestNames(List<String> testNames, Map<String, Set<String>> tags) {
        List<String> included = new ArrayList<>();
        for (String testName : testNames) {
            boolean hasIncludedTag = (this.tagsToInclude == null)
                    || (tags.containsKey(testName) && !intersect(tags.get(testName), this.tagsToInclude).isEmpty());
            boolean hasIncludedName = (this.testNamesToInclude == null) || this.testNamesToInclude.contains(testName);
            if (hasIncludedTag && hasIncludedName) {
                included.add(testName);
            }
        }
        return included;
    }

    private boolean onlyExcludedByIgnoreTag(Set<String> testTags) {
        if (!testTags.contains(IGNORE_TAG)) {
            return false;
        }
        Set<String> excluding = new HashSet<>(this.tagsToExclude);
        excluding.add(IGNORE_TAG);
        return intersect(testTags, excluding).size() == 1;
    }

    private static void verifyTags(Map<String, Set<String>> tags) {
        ObjectChecker.assertNonNull(tags, "tags");
        for (Map.Entry<String, Set<String>> entry : tags.entrySet()) {
            if (entry.getValue().isEmpty()) {
                throw new IllegalArgumentException(entry.getKey() + " was associated with an empty set in the map passed as tags");
            }
        }
    }

    private static Set<String> intersect(Set<String> left, Set<String> right) {
        Set<String> intersection = new HashSet<>(left);
        intersection.retainAll(right);
        return intersection;
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " { include: " + this.tagsToInclude + ", exclude: " + this.tagsToExclude + ", names: " + this.testNamesToInclude + " }";
    }
}
