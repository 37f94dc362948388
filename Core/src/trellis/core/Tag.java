package trellis.core;

import trellis.core.util.ObjectChecker;

/**
 * A named label attached to a test when it is registered, which a {@link Filter} uses to include or exclude it.
 */
public final class Tag {
    public final String name;

    private Tag(String name) {
        ObjectChecker.assertNonNull(name, "name");
        this.name = name;
    }

    public static Tag of(String name) {
        return new Tag(name);
    }

    @Override
    public boolean equals(Object other) {
        return (other instanceof Tag) && this.name.equals(((Tag) other).name);
    }

    @Override
    public int hashCode() {
        return this.name.hashCode();
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " { " + this.name + " }";
    }
}
