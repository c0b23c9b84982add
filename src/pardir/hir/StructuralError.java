package pardir.hir;

/**
* Thrown when a tree would violate the structural rule of a node kind, i.e. a
* child of the wrong type is placed at some position or the number of
* children does not match what the node kind allows.
*/
public class StructuralError extends RuntimeException {

    private static final long serialVersionUID = 3482L;

    public StructuralError(String message) {
        super(message);
    }

}
