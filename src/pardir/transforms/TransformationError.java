package pardir.transforms;

/**
* Thrown when a transformation is applied to nodes it cannot handle: the
* nodes are not contiguous siblings of one schedule, or there are none.
*/
public class TransformationError extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public TransformationError(String message) {
        super(message);
    }

}
