package trellis.core.engine;

import trellis.core.event.Location;

/**
 * Markup given outside of any test while the suite was registering its tests.
 */
public final class MarkupLeaf extends Node {
    public final String markup;
    public final Location location;

    MarkupLeaf(Branch parent, String markup, Location location) {
        super(parent);
        this.markup = markup;
        this.location = location;
    }
}
