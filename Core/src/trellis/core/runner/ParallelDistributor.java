package trellis.core.runner;

import trellis.core.Distributor;
import trellis.core.RunArgs;
import trellis.core.Suite;
import trellis.core.event.Tracker;
import trellis.core.util.Logger;
import trellis.core.util.ObjectChecker;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A distributor that runs every suite it is given on a fixed pool of worker threads, with the reporter, stopper,
 * filter and config map of the run it was created for. The suites it runs do not distribute further; their nested
 * suites run on the worker that runs them.
 */
public final class ParallelDistributor implements Distributor {
    private static final Logger LOGGER = Logger.forClass(ParallelDistributor.class);
    private final ExecutorService executor;
    private final RunArgs args;
    private final List<Future<?>> submitted = new ArrayList<>();

    private ParallelDistributor(ExecutorService executor, RunArgs args) {
        this.executor = executor;
        this.args = args.withoutDistributor();
    }

    /**
     * Returns a distributor backed by the given number of worker threads.
     *
     * @param numThreads The number of worker threads.
     * @param args The collaborators the distributed suites run with.
     * @return the distributor.
     */
    public static ParallelDistributor withThreads(int numThreads, RunArgs args) {
        ObjectChecker.assertNonNull(args, "args");
        if (numThreads < 1) {
            throw new IllegalArgumentException("numThreads must be at least 1 but was: " + numThreads);
        }
        return new ParallelDistributor(Executors.newFixedThreadPool(numThreads, new WorkerThreadFactory()), args);
    }

    @Override
    public void apply(Suite suite, Tracker tracker) {
        ObjectChecker.assertNonNull(suite, "suite");
        ObjectChecker.assertNonNull(tracker, "tracker");
        RunArgs argsForSuite = this.args.withTracker(tracker);

        LOGGER.log("Distributing " + suite.suiteName());
        Future<?> future = this.executor.submit(() -> SuiteRunner.runSuite(suite, argsForSuite));
        synchronized (this.submitted) {
            this.submitted.add(future);
        }
    }

    /**
     * Blocks until every suite distributed so far has run. If running a suite threw, the first such error is thrown
     * once all suites are done.
     *
     * @throws InterruptedException If interrupted while waiting.
     */
    public void waitUntilDone() throws InterruptedException {
        List<Future<?>> futures;
        synchronized (this.submitted) {
            futures = new ArrayList<>(this.submitted);
        }

        Throwable firstFailure = null;
        for (Future<?> future : futures) {
            try {
                future.get();
            } catch (ExecutionException e) {
                if (firstFailure == null) {
                    firstFailure = e.getCause();
                } else {
                    firstFailure.addSuppressed(e.getCause());
                }
            }
        }

        if (firstFailure instanceof RuntimeException) {
            throw (RuntimeException) firstFailure;
        } else if (firstFailure instanceof Error) {
            throw (Error) firstFailure;
        } else if (firstFailure != null) {
            throw new IllegalStateException("A distributed suite failed.", firstFailure);
        }
    }

    /**
     * Stops the worker threads once the suites already distributed have run.
     */
    public void shutdown() {
        this.executor.shutdown();
    }

    @Override
    public String toString() {
        synchronized (this.submitted) {
            return this.getClass().getSimpleName() + " { distributed: " + this.submitted.size() + " }";
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger count = new AtomicInteger(0);

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "SuiteWorker-" + this.count.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
