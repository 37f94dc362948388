package trellis.core;

/**
 * Polled by the engine between tests and scopes. Once it returns true no further test or scope is entered, but a test
 * that already started always runs to completion.
 */
@FunctionalInterface
public interface Stopper {
    public static final Stopper NEVER = () -> false;

    public boolean stopRequested();
}
