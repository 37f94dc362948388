package trellis.core.engine;

/**
 * Remembers the thread that constructed the object.
 *
 * Messages given to an informer by the thread that runs a suite or a test can be attributed to that suite or test.
 * Messages from threads a test started cannot: those threads may outlive the test, so such messages are passed on as
 * they arrive and marked as coming from another thread.
 */
abstract class ThreadAwareness {
    private final Thread constructingThread = Thread.currentThread();

    /**
     * Returns true iff the calling thread is the thread that constructed this object.
     */
    public final boolean isConstructingThread() {
        return Thread.currentThread() == this.constructingThread;
    }
}
