package trellis.core.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * An immutable snapshot of everything an engine has registered.
 *
 * Tests are normally registered by the single thread that constructs a suite, but the suite may then be run by
 * another thread. Rather than locking, the engine keeps the current bundle in an atomic reference and replaces it as a
 * whole on every change, checking that nobody replaced it in between.
 *
 * {@link Bundle#currentBranch}: the branch new nodes are registered into.
 * {@link Bundle#testNamesList}: the test names in registration order.
 * {@link Bundle#testsMap}: the test of each name.
 * {@link Bundle#tagsMap}: the tags of each tagged test.
 * {@link Bundle#registrationClosed}: true once the suite started to run.
 */
final class Bundle<T> {
    final Branch currentBranch;
    final List<String> testNamesList;
    final Map<String, TestLeaf<T>> testsMap;
    final Map<String, Set<String>> tagsMap;
    final boolean registrationClosed;

    private Bundle(Branch currentBranch, List<String> testNamesList, Map<String, TestLeaf<T>> testsMap, Map<String, Set<String>> tagsMap, boolean registrationClosed) {
        this.currentBranch = currentBranch;
        this.testNamesList = testNamesList;
        this.testsMap = testsMap;
        this.tagsMap = tagsMap;
        this.registrationClosed = registrationClosed;
    }

    static <T> Bundle<T> initial(Trunk trunk) {
        return new Bundle<>(trunk, Collections.emptyList(), Collections.emptyMap(), Collections.emptyMap(), false);
    }

    Bundle<T> withCurrentBranch(Branch branch) {
        return new Bundle<>(branch, this.testNamesList, this.testsMap, this.tagsMap, this.registrationClosed);
    }

    Bundle<T> withTest(TestLeaf<T> testLeaf, Set<String> tagNames) {
        List<String> names = new ArrayList<>(this.testNamesList);
        names.add(testLeaf.testName);

        Map<String, TestLeaf<T>> tests = new LinkedHashMap<>(this.testsMap);
        tests.put(testLeaf.testName, testLeaf);

        Bundle<T> withTest = new Bundle<>(this.currentBranch, Collections.unmodifiableList(names), Collections.unmodifiableMap(tests), this.tagsMap, this.registrationClosed);
        return tagNames.isEmpty() ? withTest : withTest.withTags(testLeaf.testName, tagNames);
    }

    /**
     * Returns a bundle where the given tags are added to those the test already has.
     */
    Bundle<T> withTags(String testName, Set<String> tagNames) {
        Set<String> union = new LinkedHashSet<>(this.tagsMap.getOrDefault(testName, Collections.emptySet()));
        union.addAll(tagNames);

        Map<String, Set<String>> tags = new LinkedHashMap<>(this.tagsMap);
        tags.put(testName, Collections.unmodifiableSet(union));
        return new Bundle<>(this.currentBranch, this.testNamesList, this.testsMap, Collections.unmodifiableMap(tags), this.registrationClosed);
    }

    Bundle<T> closed() {
        return new Bundle<>(this.currentBranch, this.testNamesList, this.testsMap, this.tagsMap, true);
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " { tests: " + this.testNamesList.size() + ", current: " + this.currentBranch + (this.registrationClosed ? ", [closed]" : ", [open]") + " }";
    }
}
