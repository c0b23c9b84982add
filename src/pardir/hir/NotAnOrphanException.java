package pardir.hir;

/**
* Thrown when a child is being added to some IR object and
* that child already has a parent.  Because the IR is
* a tree, it is not legal for a child to have multiple
* parents.
*/
public class NotAnOrphanException extends RuntimeException {

    private static final long serialVersionUID = 3478L;

    public NotAnOrphanException() {
        super();
    }
    
    public NotAnOrphanException(String message) {
        super(message);
    }

}
