package trellis.core.engine;

import trellis.core.event.Location;

/**
 * Information given outside of any test while the suite was registering its tests. It is reported at its place in the
 * tree when the suite runs.
 */
public final class InfoLeaf extends Node {
    public final String message;
    public final Location location;

    InfoLeaf(Branch parent, String message, Location location) {
        super(parent);
        this.message = message;
        this.location = location;
    }
}
