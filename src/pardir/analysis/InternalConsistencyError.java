package pardir.analysis;

/**
* Thrown when the analysis meets a broken invariant or a construct it does not
* handle, e.g. a task writing a variable that is private to the enclosing
* parallel region.
*/
public class InternalConsistencyError extends RuntimeException {

    private static final long serialVersionUID = 3502L;

    public InternalConsistencyError(String message) {
        super(message);
    }

}
