package trellis.core;

/**
 * A sink for extra human-readable information about a suite or a test, reported separately from the test outcomes.
 */
@FunctionalInterface
public interface Informer {

    public void apply(String message);
}
