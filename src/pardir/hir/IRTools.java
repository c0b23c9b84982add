package pardir.hir;

import java.util.ArrayList;
import java.util.List;

/**
* <b>IRTools</b> provides static methods that query the IR tree.
*/
public final class IRTools {

    private IRTools() {
    }

    /**
    * Checks if the IR tree rooted at {@code t} is consistent: every node
    * below {@code t} has a parent that lists it as a child.
    *
    * @param t the root of the tree to be checked.
    * @return true if the tree is consistent.
    */
    public static boolean checkConsistency(Traversable t) {
        DFIterator<Traversable> iter = new DFIterator<Traversable>(t);
        iter.next();
        while (iter.hasNext()) {
            Traversable tr = iter.next();
            Traversable p = tr.getParent();
            if (p == null ||
                Tools.identityIndexOf(p.getChildren(), tr) < 0) {
                PrintTools.printlnStatus(0, "Affected IR =", tr);
                PrintTools.printlnStatus(0, "Affected parent =", p);
                return false;
            }
        }
        return true;
    }

    /**
    * Returns the nearest ancestor of {@code t} with the specified type; the
    * search starts at the parent of {@code t}.
    *
    * @param t the traversable object where the search starts.
    * @param type the IR type to be searched for.
    * @return the closest ancestor of the type, or null if there is none.
    */
    @SuppressWarnings("unchecked")
    public static <T> T getAncestorOfType(Traversable t, Class<T> type) {
        if (t == null) {
            return null;
        }
        Traversable ret = t.getParent();
        while (ret != null && !type.isInstance(ret)) {
            ret = ret.getParent();
        }
        return (T)ret;
    }

    /**
    * Returns the ancestors of {@code t}, nearest first.
    *
    * @param t the traversable object where the search starts.
    * @return the list of ancestors.
    */
    public static List<Traversable> getAncestors(Traversable t) {
        List<Traversable> ret = new ArrayList<Traversable>();
        Traversable p = (t == null) ? null : t.getParent();
        while (p != null) {
            ret.add(p);
            p = p.getParent();
        }
        return ret;
    }

    /**
    * Returns the ancestors of {@code t} that have the specified type,
    * nearest first.
    */
    public static <T> List<T> getAncestorsOfType(Traversable t, Class<T> type) {
        List<T> ret = new ArrayList<T>();
        for (Traversable p : getAncestors(t)) {
            if (type.isInstance(p)) {
                ret.add(type.cast(p));
            }
        }
        return ret;
    }

    /**
    * Returns a list of descendents of the traversable object {@code t} with the
    * specified type {@code type}, in program order.
    *
    * @param t the traversable object to be searched.
    * @param type the IR type to be searched for.
    * @return the list of descendents having the type {@code type}.
    */
    public static <T extends Traversable> List<T>
            getDescendentsOfType(Traversable t, Class<T> type) {
        List<T> ret = (new DFIterator<T>(t, type)).getList();
        if (type.isInstance(t)) {
            ret.remove(0);
        }
        return ret;
    }

    /**
    * Checks if the specified traversable object {@code des} is a descendant of
    * the other traversable object {@code anc} in the IR tree.
    *
    * @param des a possible descendant of {@code anc}.
    * @param anc a possible ancestor of {@code des}.
    * @return true if {@code des} is a descendant of {@code anc}, false if not.
    */
    public static boolean isDescendantOf(Traversable des, Traversable anc) {
        Traversable t = des;
        while (t != null && t != anc) {
            t = t.getParent();
        }
        return (des != anc && t == anc);
    }

}
