package trellis.core.engine;

import trellis.core.Documenter;
import trellis.core.Filter;
import trellis.core.FilterDecision;
import trellis.core.Informer;
import trellis.core.Reporter;
import trellis.core.RunArgs;
import trellis.core.Suite;
import trellis.core.Tag;
import trellis.core.event.Location;
import trellis.core.event.Tracker;
import trellis.core.exception.DuplicateTestNameException;
import trellis.core.exception.TestRegistrationClosedException;
import trellis.core.exception.UnreachableException;
import trellis.core.report.CatchReporter;
import trellis.core.util.Logger;
import trellis.core.util.ObjectChecker;

import java.util.ConcurrentModificationException;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

/**
 * The registration and execution engine behind every style of suite.
 *
 * A suite registers its tests and scopes into the engine while it is being constructed. The first time the suite is
 * run, registration closes for good and the registered tree is walked in registration order, running each test and
 * reporting its outcome.
 *
 * The registered state lives in an immutable {@link Bundle} held by an atomic reference. Every change replaces the
 * bundle and verifies that the bundle it replaced is the one the change started from; if another thread got in between,
 * a {@link ConcurrentModificationException} is thrown. Registration is expected to happen on a single thread, so this
 * is only ever a sign of misuse and is never retried.
 *
 * The informer and documenter the suite hands out forward to a slot that moves through four stages: during
 * registration messages are added to the tree, during a run they are reported at once, while a test runs they are held
 * back until the test's outcome is known, and once the run is over any use is an error.
 *
 * @param <T> The type of the test bodies.
 */
public abstract class SuperEngine<T> {
    private static final Logger LOGGER = Logger.forClass(SuperEngine.class);
    private final String suiteClassName;
    private final Trunk trunk = new Trunk();
    private final AtomicReference<Bundle<T>> atomic;
    private final AtomicReference<Informer> atomicInformer = new AtomicReference<>(new RegistrationInformer());
    private final AtomicReference<Documenter> atomicDocumenter = new AtomicReference<>(new RegistrationDocumenter());
    private final Informer zombieInformer;
    private final Documenter zombieDocumenter;
    private final Informer informer = message -> this.atomicInformer.get().apply(message);
    private final Documenter documenter = markup -> this.atomicDocumenter.get().apply(markup);

    SuperEngine(String suiteClassName) {
        ObjectChecker.assertNonNull(suiteClassName, "suiteClassName");
        this.suiteClassName = suiteClassName;
        this.atomic = new AtomicReference<>(Bundle.initial(this.trunk));
        this.zombieInformer = zombie("An info can not be given by " + suiteClassName + " once its run has completed.");
        this.zombieDocumenter = zombie("Markup can not be given by " + suiteClassName + " once its run has completed.");
    }

    /**
     * Registers a test in the current branch and returns its full name.
     *
     * @param testText The text of the test.
     * @param testFun The body of the test.
     * @param registrationClosedMessage The message of the error thrown when registration has closed.
     * @param tags The tags of the test.
     * @return the full name of the test.
     */
    public String registerTest(String testText, T testFun, String registrationClosedMessage, Tag... tags) {
        return registerTest(testText, testFun, registrationClosedMessage, Location.ofCaller(), null, null, tags);
    }

    String registerTest(String testText, T testFun, String registrationClosedMessage, Location location, Long recordedDuration, PathMessageRecorder recordedMessages, Tag... tags) {
        checkRegisterTestParamsForNull(testText, testFun, tags);

        Bundle<T> oldBundle = this.atomic.get();
        if (oldBundle.registrationClosed) {
            throw new TestRegistrationClosedException(registrationClosedMessage);
        }

        Branch currentBranch = oldBundle.currentBranch;
        String testName = getTestName(testText, currentBranch);
        if (oldBundle.testsMap.containsKey(testName)) {
            throw new DuplicateTestNameException(testName);
        }

        TestLeaf<T> testLeaf = new TestLeaf<>(currentBranch, testName, testText, testFun, location, recordedDuration, recordedMessages);
        updateAtomic(oldBundle, oldBundle.withTest(testLeaf, tagNames(tags)));
        currentBranch.addSubNode(testLeaf);
        return testName;
    }

    /**
     * Throws the error {@link #registerTest(String, Object, String, Tag...)} would throw for a test with the given text
     * in the current branch, without registering anything.
     */
    void rejectUnregistrableTest(String testText, String registrationClosedMessage) {
        Bundle<T> bundle = this.atomic.get();
        if (bundle.registrationClosed) {
            throw new TestRegistrationClosedException(registrationClosedMessage);
        }
        String testName = getTestName(testText, bundle.currentBranch);
        if (bundle.testsMap.containsKey(testName)) {
            throw new DuplicateTestNameException(testName);
        }
    }

    /**
     * Registers a test that is reported as ignored instead of being run. It still has a name and is listed among the
     * test names.
     *
     * @param testText The text of the test.
     * @param testFun The body of the test, which is never run.
     * @param registrationClosedMessage The message of the error thrown when registration has closed.
     * @param tags The tags of the test, to which the ignore tag is added.
     * @return the full name of the test.
     */
    public String registerIgnoredTest(String testText, T testFun, String registrationClosedMessage, Tag... tags) {
        checkRegisterTestParamsForNull(testText, testFun, tags);
        String testName = registerTest(testText, testFun, registrationClosedMessage, Location.ofCaller(), null, null);

        Set<String> tagNames = new LinkedHashSet<>(tagNames(tags));
        tagNames.add(Filter.IGNORE_TAG);

        Bundle<T> oldBundle = this.atomic.get();
        updateAtomic(oldBundle, oldBundle.withTags(testName, tagNames));
        return testName;
    }

    /**
     * Registers a scope in the current branch, makes it the current branch while the given body registers its
     * contents, and then restores the previous current branch.
     *
     * @param description The text of the scope.
     * @param childPrefix The text put between the scope's text and its children's texts, or null for none.
     * @param body Registers the contents of the scope.
     * @param registrationClosedMessage The message of the error thrown when registration has closed.
     * @return the registered scope.
     */
    public DescriptionBranch registerNestedBranch(String description, String childPrefix, Runnable body, String registrationClosedMessage) {
        ObjectChecker.assertNonNull(description, "description");
        ObjectChecker.assertNonNull(body, "body");

        Bundle<T> oldBundle = this.atomic.get();
        if (oldBundle.registrationClosed) {
            throw new TestRegistrationClosedException(registrationClosedMessage);
        }

        Branch oldBranch = oldBundle.currentBranch;
        DescriptionBranch newBranch = new DescriptionBranch(oldBranch, description, childPrefix, Location.ofCaller());
        updateAtomic(oldBundle, oldBundle.withCurrentBranch(newBranch));
        oldBranch.addSubNode(newBranch);

        runInBranch(oldBranch, body);
        return newBranch;
    }

    /**
     * Registers a scope directly under the trunk and leaves it as the current branch. Styles that do not nest use this
     * to start a new subject, which then collects every test registered until the next subject.
     *
     * @param description The text of the scope.
     * @param registrationClosedMessage The message of the error thrown when registration has closed.
     */
    public void registerFlatBranch(String description, String registrationClosedMessage) {
        ObjectChecker.assertNonNull(description, "description");

        Bundle<T> oldBundle = this.atomic.get();
        if (oldBundle.registrationClosed) {
            throw new TestRegistrationClosedException(registrationClosedMessage);
        }

        DescriptionBranch newBranch = new DescriptionBranch(this.trunk, description, null, Location.ofCaller());
        updateAtomic(oldBundle, oldBundle.withCurrentBranch(newBranch));
        this.trunk.addSubNode(newBranch);
    }

    public boolean currentBranchIsTrunk() {
        return this.atomic.get().currentBranch == this.trunk;
    }

    /**
     * Makes the given branch current while the body runs. The branch that was current before is always restored.
     */
    void navigateToBranch(Branch branch, Runnable body, String registrationClosedMessage) {
        Bundle<T> oldBundle = this.atomic.get();
        if (oldBundle.registrationClosed) {
            throw new TestRegistrationClosedException(registrationClosedMessage);
        }

        Branch oldBranch = oldBundle.currentBranch;
        updateAtomic(oldBundle, oldBundle.withCurrentBranch(branch));
        runInBranch(oldBranch, body);
    }

    private void runInBranch(Branch branchToRestore, Runnable body) {
        Throwable bodyError = null;
        try {
            body.run();
        } catch (RuntimeException | Error e) {
            bodyError = e;
            throw e;
        } finally {
            runCleanup(bodyError, () -> {
                Bundle<T> oldBundle = this.atomic.get();
                updateAtomic(oldBundle, oldBundle.withCurrentBranch(branchToRestore));
            });
        }
    }

    /**
     * Returns the full names of the registered tests in the order they were registered.
     */
    public List<String> testNames() {
        return this.atomic.get().testNamesList;
    }

    /**
     * Returns the tags of every tagged test, keyed by full test name.
     */
    public Map<String, Set<String>> tags() {
        return this.atomic.get().tagsMap;
    }

    /**
     * Returns the position of the named test in the registration tree: its index among its parent's children,
     * preceded by the index of each enclosing scope among its own parent's children.
     *
     * @param testName The full name of the test.
     * @return the path of the test.
     * @throws IllegalArgumentException If no test has the given name.
     */
    public List<Integer> testPath(String testName) {
        ObjectChecker.assertNonNull(testName, "testName");
        TestLeaf<T> test = this.atomic.get().testsMap.get(testName);
        if (test == null) {
            throw new IllegalArgumentException("Test name '" + testName + "' not found.");
        }

        LinkedList<Integer> path = new LinkedList<>();
        Node node = test;
        for (Branch parent = test.parent(); parent != null; parent = parent.parent()) {
            path.addFirst(parent.indexOf(node));
            node = parent;
        }
        return Collections.unmodifiableList(path);
    }

    /**
     * Returns the informer of the suite. Whatever the current stage of the suite, messages given to it go to the sink
     * of that stage.
     */
    public Informer informer() {
        return this.informer;
    }

    /**
     * Returns the documenter of the suite, which follows the same stages as {@link #informer()}.
     */
    public Documenter documenter() {
        return this.documenter;
    }

    /**
     * Runs the named test and reports its outcome, followed by the messages given while it ran.
     *
     * @param suite The suite the test belongs to.
     * @param testName The full name of the test.
     * @param args The collaborators of the run.
     * @param invoker Runs the body of the test.
     * @throws IllegalArgumentException If no test has the given name.
     */
    public void runTestImpl(Suite suite, String testName, RunArgs args, FixtureInvoker<T> invoker) {
        ObjectChecker.assertNonNull(suite, "suite");
        ObjectChecker.assertNonNull(testName, "testName");
        ObjectChecker.assertNonNull(args, "args");
        ObjectChecker.assertNonNull(invoker, "invoker");

        TestLeaf<T> theTest = this.atomic.get().testsMap.get(testName);
        if (theTest == null) {
            throw new IllegalArgumentException("No test in this suite has name: \"" + testName + "\"");
        }

        Reporter report = CatchReporter.wrapIfNecessary(args.reporter);
        Tracker tracker = args.tracker;
        String testText = prependChildPrefix(theTest.parent(), theTest.testText);
        int messageIndentation = theTest.indentationLevel() + 1;
        long startTime = System.currentTimeMillis();

        Reporting.testStarting(suite, report, tracker, theTest, testText);

        MessageRecorder recorderForThisTest = new MessageRecorder();
        Informer informerForThisTest = new MessageRecordingInformer(recorderForThisTest,
                (message, isConstructingThread, testWasPending, testWasCanceled, location) ->
                        Reporting.infoProvided(suite, report, tracker, testName, message, messageIndentation, location, isConstructingThread, testWasPending, testWasCanceled));
        Documenter documenterForThisTest = new MessageRecordingDocumenter(recorderForThisTest,
                (markup, isConstructingThread, testWasPending, testWasCanceled, location) ->
                        Reporting.markupProvided(suite, report, tracker, testName, markup, messageIndentation, location, isConstructingThread, testWasPending, testWasCanceled));

        Informer oldInformer = this.atomicInformer.getAndSet(informerForThisTest);
        Documenter oldDocumenter = this.atomicDocumenter.getAndSet(documenterForThisTest);

        Outcome outcome = null;
        Throwable bodyError = null;
        try {
            outcome = Outcome.of(() -> invoker.invoke(theTest));
            long duration = System.currentTimeMillis() - startTime;
            long recordedOrMeasured = (theTest.recordedDuration == null) ? duration : theTest.recordedDuration;

            switch (outcome.kind) {
                case SUCCEEDED:
                    Reporting.testSucceeded(suite, report, tracker, theTest, testText, recordedOrMeasured);
                    break;
                case PENDING:
                    Reporting.testPending(suite, report, tracker, theTest, testText, recordedOrMeasured);
                    break;
                case CANCELED:
                    Reporting.testCanceled(suite, report, tracker, theTest, testText, outcome.cause, recordedOrMeasured);
                    break;
                case FAILED:
                    Reporting.testFailed(suite, report, tracker, theTest, testText, outcome.cause, recordedOrMeasured);
                    break;
                default:
                    throw new UnreachableException("outcome", outcome.kind);
            }
        } catch (RuntimeException | Error e) {
            bodyError = e;
            throw e;
        } finally {
            boolean testWasPending = (outcome != null) && (outcome.kind == Outcome.Kind.PENDING);
            boolean testWasCanceled = (outcome != null) && (outcome.kind == Outcome.Kind.CANCELED);

            runCleanup(bodyError, () -> {
                recorderForThisTest.fireRecordedMessages(testWasPending, testWasCanceled);
                if (theTest.recordedMessages != null) {
                    theTest.recordedMessages.fireRecordedMessages(testWasPending, testWasCanceled,
                            (message, isConstructingThread, pending, canceled, location) ->
                                    Reporting.infoProvided(suite, report, tracker, testName, message, messageIndentation, location, isConstructingThread, pending, canceled),
                            (markup, isConstructingThread, pending, canceled, location) ->
                                    Reporting.markupProvided(suite, report, tracker, testName, markup, messageIndentation, location, isConstructingThread, pending, canceled));
                }
            });
            runCleanup(bodyError, () -> restoreSlots(oldInformer, informerForThisTest, oldDocumenter, documenterForThisTest, suite));
        }
    }

    /**
     * Runs the named test, or every test in registration order if no name is given, consulting the filter of the run
     * for each. Each scope is reported as opened before its contents and closed after them, even if something in it
     * fails. The stopper is polled before each element; once it requests a stop, no further element is entered.
     *
     * @param suite The suite being run.
     * @param testName The single test to run, or null to run every test.
     * @param args The collaborators of the run.
     * @param runTest Runs a single test.
     */
    public void runTestsImpl(Suite suite, String testName, RunArgs args, RunTestFunction runTest) {
        ObjectChecker.assertNonNull(suite, "suite");
        ObjectChecker.assertNonNull(args, "args");
        ObjectChecker.assertNonNull(runTest, "runTest");

        Reporter report = CatchReporter.wrapIfNecessary(args.reporter);
        RunArgs reportingArgs = args.withReporter(report);

        if (testName != null) {
            FilterDecision decision = args.filter.apply(testName, suite.tags());
            if (!decision.excluded) {
                if (decision.ignored) {
                    TestLeaf<T> theTest = this.atomic.get().testsMap.get(testName);
                    if (theTest == null) {
                        throw new IllegalArgumentException("No test in this suite has name: \"" + testName + "\"");
                    }
                    Reporting.testIgnored(suite, report, args.tracker, theTest, testName);
                } else {
                    runTest.runTest(testName, reportingArgs);
                }
            }
        } else {
            runTestsInBranch(suite, this.trunk, reportingArgs, runTest);
        }
    }

    private void runTestsInBranch(Suite suite, Branch branch, RunArgs args, RunTestFunction runTest) {
        if (branch instanceof DescriptionBranch) {
            DescriptionBranch description = (DescriptionBranch) branch;
            String text = prependChildPrefix(description.parent(), description.descriptionText);
            int indentationLevel = description.indentationLevel();

            Reporting.scopeOpened(suite, args.reporter, args.tracker, text, indentationLevel, description.location);
            try {
                traverseSubNodes(suite, branch, args, runTest);
            } finally {
                Reporting.scopeClosed(suite, args.reporter, args.tracker, text, indentationLevel, description.location);
            }
        } else {
            traverseSubNodes(suite, branch, args, runTest);
        }
    }

    private void traverseSubNodes(Suite suite, Branch branch, RunArgs args, RunTestFunction runTest) {
        for (Node node : branch.subNodes()) {
            if (args.stopper.stopRequested()) {
                return;
            }

            if (node instanceof TestLeaf) {
                TestLeaf<?> testLeaf = (TestLeaf<?>) node;
                FilterDecision decision = args.filter.apply(testLeaf.testName, suite.tags());
                if (!decision.excluded) {
                    if (decision.ignored) {
                        Reporting.testIgnored(suite, args.reporter, args.tracker, testLeaf, prependChildPrefix(branch, testLeaf.testText));
                    } else {
                        runTest.runTest(testLeaf.testName, args);
                    }
                }
            } else if (node instanceof InfoLeaf) {
                InfoLeaf infoLeaf = (InfoLeaf) node;
                Reporting.infoProvided(suite, args.reporter, args.tracker, infoLeaf.message, infoLeaf.indentationLevel(), infoLeaf.location, true);
            } else if (node instanceof MarkupLeaf) {
                MarkupLeaf markupLeaf = (MarkupLeaf) node;
                Reporting.markupProvided(suite, args.reporter, args.tracker, markupLeaf.markup, markupLeaf.indentationLevel(), markupLeaf.location, true);
            } else if (node instanceof Branch) {
                runTestsInBranch(suite, (Branch) node, args, runTest);
            } else {
                throw new UnreachableException("node in the registration tree", node);
            }
        }
    }

    /**
     * Closes registration if it is still open, then runs the suite through the given run function with the suite's
     * informer and documenter reporting straight to the run's reporter. When the run function returns or throws, the
     * informer and documenter are retired for good.
     *
     * @param suite The suite being run.
     * @param testName The single test to run, or null to run every test.
     * @param args The collaborators of the run.
     * @param superRun The run of the suite that this engine's run wraps.
     */
    public void runImpl(Suite suite, String testName, RunArgs args, RunFunction superRun) {
        ObjectChecker.assertNonNull(suite, "suite");
        ObjectChecker.assertNonNull(args, "args");
        ObjectChecker.assertNonNull(superRun, "superRun");

        closeRegistration();

        Reporter report = CatchReporter.wrapIfNecessary(args.reporter);
        Tracker tracker = args.tracker;

        Informer informerForThisSuite = new ConcurrentInformer((message, isConstructingThread, location) ->
                Reporting.infoProvided(suite, report, tracker, message, 1, location, isConstructingThread));
        Documenter documenterForThisSuite = new ConcurrentInformer((markup, isConstructingThread, location) ->
                Reporting.markupProvided(suite, report, tracker, markup, 1, location, isConstructingThread));

        this.atomicInformer.set(informerForThisSuite);
        this.atomicDocumenter.set(documenterForThisSuite);

        LOGGER.log("Running " + suite.suiteName() + ((testName == null) ? "" : " (test: " + testName + ")"));
        Throwable runError = null;
        try {
            superRun.run(testName, args.withReporter(report));
        } catch (RuntimeException | Error e) {
            runError = e;
            throw e;
        } finally {
            runCleanup(runError, () -> restoreSlots(this.zombieInformer, informerForThisSuite, this.zombieDocumenter, documenterForThisSuite, suite));
            LOGGER.log("Finished running " + suite.suiteName());
        }
    }

    /**
     * Closes registration. Does nothing if registration was already closed.
     */
    void closeRegistration() {
        Bundle<T> oldBundle = this.atomic.get();
        if (!oldBundle.registrationClosed) {
            updateAtomic(oldBundle, oldBundle.closed());
            LOGGER.log("Registration closed for " + this.suiteClassName + " with " + oldBundle.testNamesList.size() + " tests.");
        }
    }

    boolean registrationClosed() {
        return this.atomic.get().registrationClosed;
    }

    Informer swapInformer(Informer informer) {
        return this.atomicInformer.getAndSet(informer);
    }

    Documenter swapDocumenter(Documenter documenter) {
        return this.atomicDocumenter.getAndSet(documenter);
    }

    /**
     * Puts the given informer and documenter back, verifying that the slots still held the expected ones.
     *
     * @throws ConcurrentModificationException If another informer or documenter was found in place of the expected one.
     */
    void restoreSlots(Informer informer, Informer expectedInformer, Documenter documenter, Documenter expectedDocumenter, Object owner) {
        Informer shouldBeExpectedInformer = this.atomicInformer.getAndSet(informer);
        Documenter shouldBeExpectedDocumenter = this.atomicDocumenter.getAndSet(documenter);
        if ((shouldBeExpectedInformer != expectedInformer) || (shouldBeExpectedDocumenter != expectedDocumenter)) {
            throw new ConcurrentModificationException("The informer or documenter of " + owner.getClass().getName() + " was modified concurrently.");
        }
    }

    /**
     * Returns whether a message given outside of any test should be added to the registration tree. Always true here;
     * an engine that registers the same scopes more than once uses this to avoid adding a message twice.
     */
    boolean shouldRecordRegistrationMessage() {
        return true;
    }

    /**
     * Returns the text of the given test or scope with the child prefix of its parent, if it has one, put in front.
     */
    public String prependChildPrefix(Branch parent, String text) {
        if (parent instanceof DescriptionBranch) {
            String childPrefix = ((DescriptionBranch) parent).childPrefix;
            if (childPrefix != null) {
                return childPrefix + " " + text;
            }
        }
        return text;
    }

    /**
     * Returns the texts of the given branch and its enclosing scopes, outermost first, each followed by its child
     * prefix if it has one, separated by single spaces.
     */
    public String getTestNamePrefix(Branch branch) {
        if (!(branch instanceof DescriptionBranch)) {
            return "";
        }
        DescriptionBranch description = (DescriptionBranch) branch;
        String text = (description.childPrefix == null)
                ? description.descriptionText
                : description.descriptionText + " " + description.childPrefix;
        return (getTestNamePrefix(description.parent()) + " " + text).trim();
    }

    public String getTestName(String testText, Branch parent) {
        return (getTestNamePrefix(parent) + " " + testText).trim();
    }

    /**
     * Replaces the current bundle with the given one, verifying that the current bundle was the given old one.
     *
     * @throws ConcurrentModificationException If the current bundle was not the old one.
     */
    private void updateAtomic(Bundle<T> oldBundle, Bundle<T> newBundle) {
        Bundle<T> shouldBeOldBundle = this.atomic.getAndSet(newBundle);
        if (shouldBeOldBundle != oldBundle) {
            throw new ConcurrentModificationException("Two threads attempted to modify the tests of " + this.suiteClassName + " concurrently. Tests must be registered from a single thread.");
        }
    }

    /**
     * Runs a cleanup step. If an earlier error is given, a failure of the cleanup is attached to that error and logged
     * so that the earlier error is the one that propagates.
     */
    static void runCleanup(Throwable earlierError, Runnable cleanup) {
        if (earlierError == null) {
            cleanup.run();
            return;
        }
        try {
            cleanup.run();
        } catch (RuntimeException | Error e) {
            earlierError.addSuppressed(e);
            LOGGER.log("Cleanup failed while another error was propagating", e);
        }
    }

    private static Set<String> tagNames(Tag[] tags) {
        Set<String> names = new LinkedHashSet<>();
        for (Tag tag : tags) {
            names.add(tag.name);
        }
        return names;
    }

    private static void checkRegisterTestParamsForNull(String testText, Object testFun, Tag[] tags) {
        ObjectChecker.assertNonNull(testText, "testText");
        ObjectChecker.assertNonNull(testFun, "testFun");
        ObjectChecker.assertNoNullElements(tags, "tags");
    }

    private static ZombieSink zombie(String complaint) {
        return new ZombieSink(complaint);
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " { suite: " + this.suiteClassName + ", " + this.atomic.get() + " }";
    }

    /**
     * Adds each message given during registration to the current branch.
     */
    private final class RegistrationInformer implements Informer {
        @Override
        public void apply(String message) {
            ObjectChecker.assertNonNull(message, "message");
            if (shouldRecordRegistrationMessage()) {
                Bundle<T> oldBundle = SuperEngine.this.atomic.get();
                Branch currentBranch = oldBundle.currentBranch;
                updateAtomic(oldBundle, oldBundle.withCurrentBranch(currentBranch));
                currentBranch.addSubNode(new InfoLeaf(currentBranch, message, Location.ofCaller()));
            }
        }
    }

    private final class RegistrationDocumenter implements Documenter {
        @Override
        public void apply(String markup) {
            ObjectChecker.assertNonNull(markup, "markup");
            if (shouldRecordRegistrationMessage()) {
                Bundle<T> oldBundle = SuperEngine.this.atomic.get();
                Branch currentBranch = oldBundle.currentBranch;
                updateAtomic(oldBundle, oldBundle.withCurrentBranch(currentBranch));
                currentBranch.addSubNode(new MarkupLeaf(currentBranch, markup, Location.ofCaller()));
            }
        }
    }

    /**
     * The informer and documenter of a suite whose run has completed.
     */
    private static final class ZombieSink implements Informer, Documenter {
        private final String complaint;

        private ZombieSink(String complaint) {
            this.complaint = complaint;
        }

        @Override
        public void apply(String message) {
            ObjectChecker.assertNonNull(message, "message");
            throw new IllegalStateException(this.complaint);
        }
    }
}
