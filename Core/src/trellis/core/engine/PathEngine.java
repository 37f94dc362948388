package trellis.core.engine;

import trellis.core.Documenter;
import trellis.core.Informer;
import trellis.core.Tag;
import trellis.core.event.Location;
import trellis.core.exception.TestRegistrationClosedException;
import trellis.core.util.Logger;
import trellis.core.util.ObjectChecker;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

/**
 * The engine of the path style, where each test runs while the suite defines its tests, in a fresh instance of the
 * suite, so that every test sees the state its enclosing scopes set up and nothing that another test did.
 *
 * The suite's definition is run once per test. Each pass aims at one target: every scope and test the definition
 * reaches is given a path, the indices of its enclosing scopes and its own index in its scope, in the order reached.
 * Only the scopes on the way to the target are entered and only the first test at or below the target is run. The
 * first scope or test reached after that becomes the target of the next pass. The passes end when a pass reaches
 * nothing after its target.
 *
 * A test that ran during a pass is registered with a body that replays its outcome, along with how long it took and the
 * messages it gave, so that running the suite afterwards reports what was observed.
 *
 * The passes are driven by {@link #ensureTestResultsRegistered(PassDefinition, Supplier)}, which hands each pass its
 * own instance of the suite explicitly.
 */
public final class PathEngine extends Engine {
    private static final Logger LOGGER = Logger.forClass(PathEngine.class);
    private final Map<List<Integer>, Branch> registeredBranches = new HashMap<>();
    private final List<List<Integer>> targetedPaths = new ArrayList<>();
    private final String itInsideItMessage;
    private final String ignoreInsideItMessage;
    private final String describeInsideItMessage;
    private boolean testResultsRegistered = false;
    private Throwable registrationFailure = null;
    private boolean passesRunning = false;

    // The state of the current pass.
    private List<Integer> targetPath = null;
    private List<Integer> currentPath = Collections.emptyList();
    private Set<List<Integer>> usedPathSet = new HashSet<>();
    private boolean targetLeafHasBeenReached = false;
    private List<Integer> nextTargetPath = null;
    private boolean insideAPathTest = false;
    private boolean describeRegisteredNoTests = false;
    private boolean currentBranchIsNew = true;

    private PathEngine(String suiteClassName, String itInsideItMessage, String ignoreInsideItMessage, String describeInsideItMessage) {
        super(suiteClassName);
        this.itInsideItMessage = itInsideItMessage;
        this.ignoreInsideItMessage = ignoreInsideItMessage;
        this.describeInsideItMessage = describeInsideItMessage;
    }

    /**
     * Returns a new path engine.
     *
     * @param suiteClassName The name of the suite class, used in error messages.
     * @param itInsideItMessage The message of the error thrown when a test is defined inside a test.
     * @param ignoreInsideItMessage The message of the error thrown when an ignored test is defined inside a test.
     * @param describeInsideItMessage The message of the error thrown when a scope is defined inside a test.
     * @return the engine.
     */
    public static PathEngine forSuite(String suiteClassName, String itInsideItMessage, String ignoreInsideItMessage, String describeInsideItMessage) {
        ObjectChecker.assertNonNull(itInsideItMessage, "itInsideItMessage");
        ObjectChecker.assertNonNull(ignoreInsideItMessage, "ignoreInsideItMessage");
        ObjectChecker.assertNonNull(describeInsideItMessage, "describeInsideItMessage");
        return new PathEngine(suiteClassName, itInsideItMessage, ignoreInsideItMessage, describeInsideItMessage);
    }

    /**
     * Runs every pass of the suite's definition, unless that already happened. The first pass runs the definition of
     * the calling instance, every later pass the definition of a fresh instance.
     *
     * If a pass throws, the passes stop and every later call throws the same error, since the tests after the failing
     * one were never registered. A call made by a definition while the passes run returns at once.
     *
     * @param initialPass The definition of the calling instance.
     * @param freshInstance Creates a fresh instance of the suite, sharing this engine, and returns its definition.
     */
    public synchronized void ensureTestResultsRegistered(PassDefinition initialPass, Supplier<PassDefinition> freshInstance) {
        ObjectChecker.assertNonNull(initialPass, "initialPass");
        ObjectChecker.assertNonNull(freshInstance, "freshInstance");
        if (this.registrationFailure != null) {
            rethrow(this.registrationFailure);
        }
        if (this.testResultsRegistered || this.passesRunning) {
            return;
        }

        this.passesRunning = true;
        int passes = 0;
        try {
            startPass(null);
            initialPass.define();
            passes++;

            while (this.nextTargetPath != null) {
                startPass(this.nextTargetPath);
                freshInstance.get().define();
                passes++;
            }
        } catch (RuntimeException | Error e) {
            this.registrationFailure = e;
            LOGGER.log("Pass " + (passes + 1) + " of " + this + " failed", e);
            throw e;
        } finally {
            this.passesRunning = false;
        }
        this.testResultsRegistered = true;
        LOGGER.log("Registered " + testNames().size() + " tests of " + this + " in " + passes + " passes.");
    }

    private static void rethrow(Throwable failure) {
        if (failure instanceof Error) {
            throw (Error) failure;
        }
        throw (RuntimeException) failure;
    }

    private void startPass(List<Integer> target) {
        this.targetPath = target;
        this.currentPath = Collections.emptyList();
        this.usedPathSet = new HashSet<>();
        this.targetLeafHasBeenReached = false;
        this.nextTargetPath = null;
        this.currentBranchIsNew = (target == null);
    }

    /**
     * Handles a test reached during a pass: runs and registers it if it is the target, remembers it as the next target
     * if the target was already reached, and otherwise skips it.
     *
     * @param testText The text of the test.
     * @param testFun The body of the test.
     * @param tags The tags of the test.
     */
    public void handleTest(String testText, TestBody testFun, Tag... tags) {
        if (this.insideAPathTest) {
            throw new TestRegistrationClosedException(this.itInsideItMessage);
        }
        ObjectChecker.assertNonNull(testText, "testText");
        ObjectChecker.assertNonNull(testFun, "testFun");
        Location location = Location.ofCaller();

        this.insideAPathTest = true;
        try {
            this.describeRegisteredNoTests = false;
            List<Integer> nextPath = getNextPath();
            if (isInTargetPath(nextPath, this.targetPath)) {
                rejectUnregistrableTest(testText, this.itInsideItMessage);
                PathMessageRecorder recordedMessages = new PathMessageRecorder();
                Throwable[] resultOfRunningTest = new Throwable[1];
                long duration = runDuringRegistration(testFun, recordedMessages, resultOfRunningTest);

                Throwable captured = resultOfRunningTest[0];
                TestBody replay = () -> {
                    if (captured != null) {
                        throw captured;
                    }
                };
                registerTest(testText, replay, this.itInsideItMessage, location, duration, recordedMessages, tags);
                this.targetedPaths.add(nextPath);
                this.targetLeafHasBeenReached = true;
            } else if (this.targetLeafHasBeenReached && (this.nextTargetPath == null)) {
                this.nextTargetPath = nextPath;
            }
        } finally {
            this.insideAPathTest = false;
        }
    }

    /**
     * Runs the test body with the recorder's informer and documenter in place and returns how long it took. Anything
     * the body throws, other than an error that aborts the run, is put in the result slot.
     */
    private long runDuringRegistration(TestBody testFun, PathMessageRecorder recordedMessages, Throwable[] result) {
        Informer oldInformer = swapInformer(recordedMessages.informer());
        Documenter oldDocumenter = swapDocumenter(recordedMessages.documenter());

        long startTime = System.currentTimeMillis();
        Throwable abortError = null;
        try {
            testFun.run();
        } catch (Throwable t) {
            if (AbortErrors.shouldCauseAbort(t)) {
                abortError = t;
                throw (Error) t;
            }
            result[0] = t;
        } finally {
            runCleanup(abortError, () -> restoreSlots(oldInformer, recordedMessages.informer(), oldDocumenter, recordedMessages.documenter(), this));
        }
        return System.currentTimeMillis() - startTime;
    }

    /**
     * Handles an ignored test reached during a pass. It is registered when it is the target, but never run.
     *
     * @param testText The text of the test.
     * @param testFun The body of the test.
     * @param tags The tags of the test.
     */
    public void handleIgnoredTest(String testText, TestBody testFun, Tag... tags) {
        if (this.insideAPathTest) {
            throw new TestRegistrationClosedException(this.ignoreInsideItMessage);
        }

        this.describeRegisteredNoTests = false;
        List<Integer> nextPath = getNextPath();
        if (isInTargetPath(nextPath, this.targetPath)) {
            registerIgnoredTest(testText, testFun, this.ignoreInsideItMessage, tags);
            this.targetedPaths.add(nextPath);
            this.targetLeafHasBeenReached = true;
        } else if (this.targetLeafHasBeenReached && (this.nextTargetPath == null)) {
            this.nextTargetPath = nextPath;
        }
    }

    /**
     * Handles a scope reached during a pass. A scope on the way to the target is entered, registering it the first
     * time it is entered.
     *
     * @param description The text of the scope.
     * @param childPrefix The text put between the scope's text and its children's texts, or null for none.
     * @param body Defines the contents of the scope.
     */
    public void handleNestedBranch(String description, String childPrefix, Runnable body) {
        if (this.insideAPathTest) {
            throw new TestRegistrationClosedException(this.describeInsideItMessage);
        }

        List<Integer> nextPath = getNextPath();
        if (this.targetLeafHasBeenReached && (this.nextTargetPath == null)) {
            this.nextTargetPath = nextPath;
        } else if (isInTargetPath(nextPath, this.targetPath)) {
            List<Integer> oldCurrentPath = this.currentPath;
            boolean oldBranchIsNew = this.currentBranchIsNew;
            this.currentPath = nextPath;
            try {
                Branch registered = this.registeredBranches.get(nextPath);
                if (registered == null) {
                    this.describeRegisteredNoTests = true;
                    this.currentBranchIsNew = true;
                    DescriptionBranch branch = registerNestedBranch(description, childPrefix, body, this.describeInsideItMessage);
                    this.registeredBranches.put(nextPath, branch);
                    if (this.describeRegisteredNoTests) {
                        this.targetLeafHasBeenReached = true;
                    }
                } else {
                    this.currentBranchIsNew = false;
                    navigateToBranch(registered, body, this.describeInsideItMessage);
                }
            } finally {
                this.currentPath = oldCurrentPath;
                this.currentBranchIsNew = oldBranchIsNew;
            }
        }
    }

    /**
     * Returns the next unused path below the current scope.
     */
    List<Integer> getNextPath() {
        int count = 0;
        while (true) {
            List<Integer> candidate = new ArrayList<>(this.currentPath);
            candidate.add(count);
            if (this.usedPathSet.add(candidate)) {
                return Collections.unmodifiableList(candidate);
            }
            count++;
        }
    }

    /**
     * Returns true iff the candidate path is on the way to the target path on this pass.
     *
     * With no target, which is the first pass, only the all zero paths are: the first element of every scope. With a
     * target, the candidate is on the way if it leads to the target, is the target, or continues below the target
     * through first elements only.
     *
     * @param candidate The path of the scope or test reached.
     * @param target The target path of the pass, or null on the first pass.
     * @return whether the candidate is on the way to the target.
     */
    public static boolean isInTargetPath(List<Integer> candidate, List<Integer> target) {
        ObjectChecker.assertNonNull(candidate, "candidate");
        if (target == null) {
            return allZeros(candidate);
        }
        if (candidate.size() < target.size()) {
            return target.subList(0, candidate.size()).equals(candidate);
        } else if (candidate.size() > target.size()) {
            return candidate.subList(0, target.size()).equals(target) && allZeros(candidate.subList(target.size(), candidate.size()));
        } else {
            return target.equals(candidate);
        }
    }

    private static boolean allZeros(List<Integer> path) {
        for (int index : path) {
            if (index != 0) {
                return false;
            }
        }
        return true;
    }

    /**
     * Returns the paths of the tests registered by each pass, in the order of the passes.
     */
    public synchronized List<List<Integer>> targetedPaths() {
        return Collections.unmodifiableList(new ArrayList<>(this.targetedPaths));
    }

    /**
     * Messages given outside of any test are added to the tree only while the scope they are given in is being
     * registered, since later passes run through the same scope again.
     */
    @Override
    boolean shouldRecordRegistrationMessage() {
        return this.currentBranchIsNew;
    }

    /**
     * Defines the scopes and tests of one instance of a path style suite.
     */
    @FunctionalInterface
    public interface PassDefinition {

        public void define();
    }
}
