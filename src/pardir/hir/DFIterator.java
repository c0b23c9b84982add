package pardir.hir;

import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;

/**
* Depth-first iterator in program order over the IR tree, which returns only
* the nodes of a requested type. The iterator keeps no work list; it finds the
* next item by visiting the tree from the last returned node. Subtrees rooted
* at pruned types are not entered.
*/
public class DFIterator<E extends Traversable> {

    /** Initial size of the list of pruned types */
    private static final int DEFAULT_PRUNED_ON_SIZE = 4;

    /** List of types whose child nodes are skipped during iteration. */
    private List<Class<? extends Traversable>> pruned_on;

    /** The initial IR node of the iterator. */
    private Traversable root;

    /** The next IR node to be returned. */
    private Traversable next;

    /** The IR node type to be returned during iteration. */
    private Class<? extends Traversable> type;

    /**
    * Constructs a new iterator that returns any traversable nodes during
    * iteration.
    * @param root the initial node for the iteration.
    */
    public DFIterator(Traversable root) {
        this(root, Traversable.class);
    }

    /**
    * Constructs a new iterator that returns the specified IR type during
    * iteration.
    * @param root the initial node for the iteration.
    * @param c the IR class type to be iterated over.
    */
    public DFIterator(Traversable root, Class<? extends Traversable> c) {
        this.root = root;
        pruned_on = null;
        type = c;
        reset();
    }

    /**
    * Checks if there is a next element of the requested type.
    * @return true if there exist a next element of the requested type.
    */
    public boolean hasNext() {
        return next != null;
    }

    /**
    * Returns the next IR node.
    * @return the next IR node.
    * @exception NoSuchElementException no more elements found.
    */
    @SuppressWarnings("unchecked")
    public E next() {
        if (next == null) {
            throw new NoSuchElementException();
        }
        E ret = (E)next;
        next = findNext(ret);
        return ret;
    }

    /**
    * Considers the specified IR class type as one whose child nodes are not
    * visited during iteration. The pruned node itself is still returned if
    * it has the requested type. Calling this method resets the iterator.
    * @param c the IR node type to be pruned on.
    */
    public void pruneOn(Class<? extends Traversable> c) {
        if (pruned_on == null) {
            pruned_on = new ArrayList<Class<? extends Traversable>>(
                    DEFAULT_PRUNED_ON_SIZE);
        }
        pruned_on.add(c);
        reset();
    }

    /**
    * Initializes the iterator by placing the first item to be returned for a
    * call to {@link #next()}.
    */
    public void reset() {
        if (type.isInstance(root)) {
            next = root;
        } else {
            next = findNext(root);
        }
    }

    /**
    * Drives memory-less depth-first search by 1) searching the next item in the
    * subtree rooted at the current node {@code t} and 2) searching the
    * supertree disregarding the subtree mentioned in 1).
    * @param t the IR node where the search starts.
    * @return the next element of the requested type {@code E} or null if one
    * is not found.
    */
    private Traversable findNext(Traversable t) {
        Traversable ret = findNext(t, 0);
        // Continue searching after pruning the subtree rooted at "t".
        if (ret == null && t != root) {
            Traversable child = t;
            Traversable parent = child.getParent();
            while (ret == null && parent != null) {
                int t_pos = Tools.identityIndexOf(parent.getChildren(), child);
                ret = findNext(parent, t_pos + 1);
                if (parent == root) {
                    break;
                }
                child = parent;
                parent = child.getParent();
            }
        }
        return ret;
    }

    /**
    * Performs depth-first search within the tree rooted at the current node
    * {@code t}, skipping the subtree rooted at {@code 0, 1, ..., (pos-1)}-th
    * child of the current node.
    * @param t the IR node where the search starts.
    * @param pos the position that masks subtrees that are already visited.
    * @return the next element of the requested type or null if one is not
    * found.
    */
    private Traversable findNext(Traversable t, int pos) {
        Traversable ret = null;
        List<Traversable> children = t.getChildren();
        if (!isPruned(t) && children != null) {
            for (int i = pos; i < children.size() && ret == null; i++) {
                Traversable child = children.get(i);
                if (type.isInstance(child)) {
                    ret = child;
                } else {
                    ret = findNext(child, 0);
                }
            }
        }
        return ret;
    }

    /**
    * Tests if the specified traversable object belongs in a list of IR types
    * that are pruned on.
    * @param t the IR node to be tested.
    * @return true if it is.
    */
    private boolean isPruned(Traversable t) {
        if (pruned_on == null) {
            return false;
        }
        for (int i = 0; i < pruned_on.size(); i++) {
            if (pruned_on.get(i).isInstance(t)) {
                return true;
            }
        }
        return false;
    }

    /**
    * Returns a list of traversed elements of type {@code E} using the current
    * iterator.
    * @return the collected list.
    */
    public List<E> getList() {
        List<E> ret = new ArrayList<E>();
        reset();
        while (hasNext()) {
            ret.add(next());
        }
        return ret;
    }

}
