package trellis.core.engine;

/**
 * Runs the body of a registered test, handing it a fixture if the style uses one. This lets one engine serve both the
 * styles whose tests take no argument and the styles whose tests take a fixture.
 */
@FunctionalInterface
public interface FixtureInvoker<T> {

    public void invoke(TestLeaf<T> test) throws Throwable;
}
