package trellis.core.engine;

import trellis.core.event.Location;

/**
 * A named scope, such as a {@code describe} clause.
 *
 * The optional child prefix is put between this scope's text and the text of each child, which is how a style like
 * {@code "A stack" should { ... }} produces names such as {@code "A stack should pop"}.
 */
public final class DescriptionBranch extends Branch {
    public final String descriptionText;
    public final String childPrefix;
    public final Location location;

    DescriptionBranch(Branch parent, String descriptionText, String childPrefix, Location location) {
        super(parent);
        this.descriptionText = descriptionText;
        this.childPrefix = childPrefix;
        this.location = location;
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " { " + this.descriptionText + (this.childPrefix == null ? "" : " [" + this.childPrefix + "]") + " }";
    }
}
