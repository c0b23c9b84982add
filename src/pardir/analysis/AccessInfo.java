package pardir.analysis;

import pardir.hir.*;

import java.util.*;

/**
* One access to a variable: its kind, the node performing it and whether any
* component of the access is indexed.
*/
public class AccessInfo {

    private final AccessType type;

    private final Traversable node;

    private final boolean indexed;

    public AccessInfo(AccessType type, Traversable node, boolean indexed) {
        this.type = type;
        this.node = node;
        this.indexed = indexed;
    }

    public AccessType getAccessType() {
        return type;
    }

    /**
    * Returns the accessing node: the reference, or the loop for the control
    * variable of a loop.
    */
    public Traversable getNode() {
        return node;
    }

    /** Returns true if the access carries array indices. */
    public boolean isArray() {
        return indexed;
    }

    /**
    * Returns the loop nearest to the access, looking at the accessing node
    * itself first and stopping at {@code boundary}.
    *
    * @param boundary the node where the upward search stops.
    * @return the loop or null if there is none below the boundary.
    */
    public Loop getEnclosingLoop(Traversable boundary) {
        Traversable t = node;
        while (t != null && t != boundary) {
            if (t instanceof Loop) {
                return (Loop)t;
            }
            t = t.getParent();
        }
        return null;
    }

    @Override
    public String toString() {
        return type + (indexed ? "[indexed]" : "") + " at " +
                ((node instanceof Loop) ? "loop header" : node.toString());
    }

    /**
    * Checks if a reference carries indices in any of its components.
    */
    static boolean isIndexed(Reference ref) {
        for (List<Expression> indices : ref.getComponentIndices()) {
            if (!indices.isEmpty()) {
                return true;
            }
        }
        return false;
    }

}
