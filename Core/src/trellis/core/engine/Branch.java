package trellis.core.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A node that holds other nodes in the order they were registered. Children are only ever appended.
 */
public abstract class Branch extends Node {
    private final List<Node> subNodes = new ArrayList<>();

    Branch(Branch parent) {
        super(parent);
    }

    synchronized void addSubNode(Node node) {
        if (node.parent() != this) {
            throw new IllegalArgumentException("node belongs to another branch.");
        }
        this.subNodes.add(node);
    }

    /**
     * Returns a snapshot of the children of this branch in registration order.
     */
    public synchronized List<Node> subNodes() {
        return Collections.unmodifiableList(new ArrayList<>(this.subNodes));
    }

    synchronized int indexOf(Node node) {
        for (int i = 0; i < this.subNodes.size(); i++) {
            if (this.subNodes.get(i) == node) {
                return i;
            }
        }
        return -1;
    }
}
