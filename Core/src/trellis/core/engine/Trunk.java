package trellis.core.engine;

/**
 * The root of a registration tree. Each engine owns exactly one.
 */
public final class Trunk extends Branch {

    Trunk() {
        super(null);
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName();
    }
}
