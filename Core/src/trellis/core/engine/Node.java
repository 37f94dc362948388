package trellis.core.engine;

/**
 * An element of the registration tree. Every node but the trunk has exactly one parent, which never changes.
 */
public abstract class Node {
    private final Branch parent;

    Node(Branch parent) {
        this.parent = parent;
    }

    /**
     * Returns the branch this node was registered in, or null for the trunk.
     */
    public final Branch parent() {
        return this.parent;
    }

    /**
     * Returns how deeply this node is nested: 0 for the trunk and its direct children, 1 for their children and so on.
     */
    public final int indentationLevel() {
        int level = -1;
        for (Branch ancestor = this.parent; ancestor != null; ancestor = ancestor.parent()) {
            level++;
        }
        return Math.max(level, 0);
    }
}
