package trellis.core.engine;

/**
 * The body of a test that takes no fixture.
 */
@FunctionalInterface
public interface TestBody {

    public void run() throws Throwable;
}
