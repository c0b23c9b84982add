package pardir.hir;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
* Base class of every IR object. A node owns the list of its children and
* keeps a non-owning link to its parent. Every change to the child list goes
* through {@link #replaceChildren(List)}, which checks the structural rule of
* the node kind before anything is committed, so a subtree always satisfies
* the rules of its kinds.
*/
public abstract class Node implements Cloneable, Traversable {

    /** The parent traversable object */
    protected Traversable parent;

    /** The list of children of the node */
    protected List<Traversable> children;

    /** Constructor for derived classes. */
    protected Node() {
        parent = null;
        children = new ArrayList<Traversable>(2);
    }

    /**
    * Decides whether the given child is allowed at the given position.
    *
    * @param position the position of the child.
    * @param child the candidate child.
    * @return true if the child is valid at the position.
    */
    protected abstract boolean isValidChild(int position, Traversable child);

    /**
    * Decides whether a node of this kind may have the given number of
    * children. The default accepts any number.
    *
    * @param size the number of children.
    * @return true if the arity is valid.
    */
    protected boolean isValidArity(int size) {
        return true;
    }

    /**
    * Returns a textual description of the valid children layout, used in
    * error messages.
    */
    protected abstract String getChildrenFormat();

    /**
    * Returns the short name of the node kind.
    */
    public String getNodeName() {
        return getClass().getSimpleName();
    }

    /* Traversable interface */
    public List<Traversable> getChildren() {
        return Collections.unmodifiableList(children);
    }

    /* Traversable interface */
    public Traversable getParent() {
        return parent;
    }

    /* Traversable interface */
    public void setParent(Traversable t) {
        parent = t;
    }

    /**
    * Replaces the whole child list of this node. The new list is checked
    * against the arity and position rules of the node kind; on failure the
    * node is left untouched. Children of the old list that are not in the new
    * list are detached.
    *
    * @param new_children the new children.
    * @throws StructuralError if the new list violates the structural rule.
    * @throws NotAnOrphanException if a new child belongs to another parent.
    */
    protected void replaceChildren(List<? extends Traversable> new_children) {
        if (!isValidArity(new_children.size())) {
            throw new StructuralError(getNodeName() + " cannot have " +
                    new_children.size() + " children; expected " +
                    getChildrenFormat());
        }
        for (int i = 0; i < new_children.size(); i++) {
            Traversable child = new_children.get(i);
            if (child == null || !isValidChild(i, child)) {
                throw new StructuralError("Item '" +
                        (child == null ? "null" :
                        child.getClass().getSimpleName()) +
                        "' can't be child " + i + " of '" + getNodeName() +
                        "'. The valid format is: '" + getChildrenFormat() +
                        "'.");
            }
            if (child.getParent() != null && child.getParent() != this) {
                throw new NotAnOrphanException(getNodeName());
            }
            for (int j = 0; j < i; j++) {
                if (new_children.get(j) == child) {
                    throw new StructuralError("Item '" +
                            child.getClass().getSimpleName() +
                            "' appears twice among the children of '" +
                            getNodeName() + "'.");
                }
            }
        }
        for (Traversable old : children) {
            if (Tools.identityIndexOf(new_children, old) < 0) {
                old.setParent(null);
            }
        }
        children = new ArrayList<Traversable>(new_children);
        for (Traversable child : children) {
            child.setParent(this);
        }
    }

    /* Traversable interface */
    public void setChild(int index, Traversable t) {
        if (t == null || index < 0 || index >= children.size()) {
            throw new IllegalArgumentException();
        }
        if (t.getParent() != null) {
            throw new NotAnOrphanException(getNodeName());
        }
        List<Traversable> list = new ArrayList<Traversable>(children);
        list.set(index, t);
        replaceChildren(list);
    }

    /**
    * Inserts the specified traversable object at the end of the child list.
    *
    * @param t the traversable object to be inserted.
    * @throws NotAnOrphanException if <b>t</b> has a parent.
    * @throws StructuralError if the result is structurally invalid.
    */
    protected void addChild(Traversable t) {
        addChild(children.size(), t);
    }

    /**
    * Inserts the specified traversable object at the specified position.
    *
    * @param index the insert position.
    * @param t the traversable object to be inserted.
    * @throws IllegalArgumentException if <b>t</b> is null or index is
    * out-of-bound.
    * @throws NotAnOrphanException if <b>t</b> has a parent.
    */
    protected void addChild(int index, Traversable t) {
        if (t == null || index < 0 || index > children.size()) {
            throw new IllegalArgumentException("invalid child inserted.");
        }
        if (t.getParent() != null) {
            throw new NotAnOrphanException(getNodeName());
        }
        List<Traversable> list = new ArrayList<Traversable>(children);
        list.add(index, t);
        replaceChildren(list);
    }

    /* Traversable interface */
    public void removeChild(Traversable child) {
        int index = Tools.identityIndexOf(children, child);
        if (index < 0) {
            throw new NotAChildException();
        }
        List<Traversable> list = new ArrayList<Traversable>(children);
        list.remove(index);
        replaceChildren(list);
    }

    /**
    * Detaches this node from its parent, if it has one.
    *
    * @throws StructuralError if the parent cannot lose this child.
    */
    public void detach() {
        if (parent != null) {
            parent.removeChild(this);
        }
    }

    /**
    * Returns the position of this node among its parent's children.
    *
    * @return the position, or -1 if the node has no parent.
    */
    public int getPosition() {
        if (parent == null) {
            return -1;
        }
        return Tools.identityIndexOf(parent.getChildren(), this);
    }

    /**
    * Returns a deep copy of this node. The copy has no parent.
    */
    @Override
    public Node clone() {
        Node o = null;
        try {
            o = (Node)super.clone();
        } catch(CloneNotSupportedException e) {
            throw new InternalError();
        }
        o.parent = null;
        o.children = new ArrayList<Traversable>(children.size());
        for (Traversable child : children) {
            Node o_child = ((Node)child).clone();
            o_child.setParent(o);
            o.children.add(o_child);
        }
        return o;
    }

    /**
    * Verifies three properties of this object:
    * (1) All children are not null, (2) the parent object has this
    * object as a child, (3) all children have this object as the parent.
    *
    * @throws IllegalStateException if any of the properties are not true.
    */
    public void verify() throws IllegalStateException {
        if (parent != null &&
            Tools.identityIndexOf(parent.getChildren(), this) < 0) {
            throw new IllegalStateException(
                    "parent does not think this is a child");
        }
        for (Traversable child : children) {
            if (child == null) {
                throw new IllegalStateException("a child is null");
            }
            if (child.getParent() != this) {
                throw new IllegalStateException(
                        "a child does not think this is the parent");
            }
            ((Node)child).verify();
        }
    }

    /** Returns a string representation of the node */
    @Override
    public String toString() {
        StringWriter sw = new StringWriter(80);
        print(new PrintWriter(sw));
        return sw.toString();
    }

}
