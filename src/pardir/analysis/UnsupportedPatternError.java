package pardir.analysis;

/**
* Thrown when an index or reference shape falls outside the patterns the
* clause analysis can describe soundly. The analysis never approximates such
* a shape.
*/
public class UnsupportedPatternError extends RuntimeException {

    private static final long serialVersionUID = 3501L;

    public UnsupportedPatternError(String message) {
        super(message);
    }

}
