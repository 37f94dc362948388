package trellis.core.engine;

/**
 * The engine of the styles whose test bodies are handed a fixture. How the fixture is made is up to the style, through
 * the {@link FixtureInvoker} it runs its tests with.
 *
 * @param <F> The type of the fixture.
 */
public final class FixtureEngine<F> extends SuperEngine<FixtureTestBody<F>> {

    public FixtureEngine(String suiteClassName) {
        super(suiteClassName);
    }
}
