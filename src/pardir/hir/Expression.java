package pardir.hir;

/**
* Base class for all expressions. Expressions are compared structurally: two
* expressions are equal if they have the same kind, the same own attributes
* and equal children.
*/
public abstract class Expression extends Node {

    /** Constructor for derived classes. */
    protected Expression() {
        super();
    }

    /**
    * Get the parent Statement containing this Expression.
    *
    * @return the enclosing Statement or null if this Expression
    *   is not inside a Statement.
    */
    public Statement getStatement() {
        Traversable t = this;
        do {
            t = t.getParent();
        } while (t != null && !(t instanceof Statement));
        return (Statement)t;
    }

    @Override
    public Expression clone() {
        return (Expression)super.clone();
    }

    /**
    * Checks if the given object has the same type as this expression and
    * equal children. Subclasses with additional fields call this method first
    * and proceed with more checking.
    */
    @Override
    public boolean equals(Object o) {
        if (o == null || this.getClass() != o.getClass()) {
            return false;
        }
        return children.equals(((Expression)o).children);
    }

    /**
    * Returns the hash code of the string representation, which is consistent
    * with the structural equality.
    */
    @Override
    public int hashCode() {
        return toString().hashCode();
    }

    /**
    * Expression children of most kinds may be any expression but a range.
    */
    protected static boolean isDataNode(Traversable t) {
        return (t instanceof Expression && !(t instanceof Range) &&
                !(t instanceof Member));
    }

}
