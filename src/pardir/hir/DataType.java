package pardir.hir;

/**
* Base class of the datatypes a symbol may have.
*/
public abstract class DataType {

    /** Returns true if the type describes an array. */
    public boolean isArray() {
        return false;
    }

    /** Returns true if the type describes a structure. */
    public boolean isStructure() {
        return false;
    }

    @Override
    public abstract String toString();

}
