package pardir.analysis;

import pardir.hir.*;

import java.util.*;

/**
* Resolved view of an indexed access: the base symbol and one entry per
* dimension, each either a single index or a range.
*/
public class ArrayAccessDescriptor {

    private final Reference access;

    private final List<Expression> entries;

    ArrayAccessDescriptor(Reference access, List<Expression> entries) {
        this.access = access;
        this.entries = Collections.unmodifiableList(
                new ArrayList<Expression>(entries));
    }

    /** Returns the described access. */
    public Reference getAccess() {
        return access;
    }

    public Symbol getBaseSymbol() {
        return access.getSymbol();
    }

    public int getNumDimensions() {
        return entries.size();
    }

    /**
    * Returns the entry of the given dimension: an index expression or a
    * {@link Range}.
    */
    public Expression getEntry(int dim) {
        return entries.get(dim);
    }

    public List<Expression> getEntries() {
        return entries;
    }

    public boolean isRange(int dim) {
        return (entries.get(dim) instanceof Range);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(32);
        sb.append(getBaseSymbol().getName()).append("[");
        for (int i = 0; i < entries.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(isRange(i) ? "Range(" : "Index(");
            sb.append(entries.get(i)).append(")");
        }
        return sb.append("]").toString();
    }

}
