package trellis.core.engine;

/**
 * The body of a test that is handed a fixture.
 */
@FunctionalInterface
public interface FixtureTestBody<F> {

    public void run(F fixture) throws Throwable;
}
