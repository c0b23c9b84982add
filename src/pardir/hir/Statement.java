package pardir.hir;

/**
* Base class for all statements. Statements are compared by identity.
*/
public abstract class Statement extends Node {

    /** Constructor for derived classes. */
    protected Statement() {
        super();
    }

    /**
    * Returns the routine in which this statement is located.
    *
    * @return the enclosing routine, or null if it is not in a routine.
    */
    public Routine getRoutine() {
        return IRTools.getAncestorOfType(this, Routine.class);
    }

    /**
    * Returns the nearest scope (a node owning a symbol table) enclosing this
    * statement.
    *
    * @return the enclosing scope, or null if there is none.
    */
    public ScopingNode getScope() {
        return IRTools.getAncestorOfType(this, ScopingNode.class);
    }

    @Override
    public Statement clone() {
        return (Statement)super.clone();
    }

    /**
    * Compares the statement with the specified object for equality.
    *
    * @param o the object to be compared.
    * @return true if {@code (o == this)}, false otherwise.
    */
    @Override
    public boolean equals(Object o) {
        return (o == this);
    }

    /**
    * Returns the identity hash code of the statement.
    */
    @Override
    public int hashCode() {
        return System.identityHashCode(this);
    }

}
