package pardir.hir;

import java.io.PrintWriter;
import java.util.Collections;
import java.util.List;

/**
* Named component access inside a structure reference. The plain kind is a
* leaf naming the last component of the access.
*/
public class Member extends Expression {

    private final String name;

    public Member(String name) {
        super();
        if (name == null || name.length() == 0) {
            throw new IllegalArgumentException("member needs a name");
        }
        this.name = name;
    }

    public String getName() {
        return name;
    }

    /**
    * Returns the structure reference this member belongs to, or null if the
    * member is detached.
    */
    public Reference getParentReference() {
        Traversable t = getParent();
        while (t instanceof Member) {
            t = t.getParent();
        }
        return (t instanceof Reference) ? (Reference)t : null;
    }

    /**
    * Returns the depth of this member below its structure reference: 1 for a
    * member directly beneath the reference.
    */
    public int getDepth() {
        int depth = 1;
        Traversable t = getParent();
        while (t instanceof Member) {
            depth++;
            t = t.getParent();
        }
        return depth;
    }

    /**
    * Appends this member and the members beneath it to the given signature
    * and index lists.
    */
    protected void collectAccess(List<String> names,
                                 List<List<Expression>> indices) {
        names.add(name.toLowerCase());
        if (this instanceof ArrayIndexed) {
            indices.add(((ArrayIndexed)this).getIndices());
        } else {
            indices.add(Collections.<Expression>emptyList());
        }
    }

    @Override
    protected boolean isValidChild(int position, Traversable child) {
        return false;
    }

    @Override
    protected boolean isValidArity(int size) {
        return (size == 0);
    }

    @Override
    protected String getChildrenFormat() {
        return "<LeafNode>";
    }

    public void print(PrintWriter o) {
        o.print(name);
    }

    @Override
    public boolean equals(Object o) {
        return (super.equals(o) && name.equalsIgnoreCase(((Member)o).name));
    }

    @Override
    public Member clone() {
        return (Member)super.clone();
    }

}
