package pardir.analysis;

/**
* Kind of a variable access.
*/
public enum AccessType {
    READ, WRITE, READWRITE;

    /** Returns true if the access may modify the variable. */
    public boolean isWrite() {
        return (this != READ);
    }

    /** Returns true if the access may observe the variable. */
    public boolean isRead() {
        return (this != WRITE);
    }
}
