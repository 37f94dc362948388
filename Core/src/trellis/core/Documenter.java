package trellis.core;

/**
 * A sink for markup text documenting a suite or a test.
 */
@FunctionalInterface
public interface Documenter {

    public void apply(String markup);
}
