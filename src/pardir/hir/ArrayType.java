package pardir.hir;

/**
* Array datatype: an element type and a number of dimensions.
*/
public class ArrayType extends DataType {

    private final DataType element_type;

    private final int rank;

    /**
    * Constructs an array type.
    *
    * @param element_type the type of each element (scalar or structure).
    * @param rank the number of dimensions.
    * @throws IllegalArgumentException if the element type is missing or is
    *   itself an array, or the rank is not positive.
    */
    public ArrayType(DataType element_type, int rank) {
        if (element_type == null || element_type.isArray()) {
            throw new IllegalArgumentException(
                    "array element type must be a scalar or structure type");
        }
        if (rank < 1) {
            throw new IllegalArgumentException(
                    "array rank must be positive but found " + rank);
        }
        this.element_type = element_type;
        this.rank = rank;
    }

    public DataType getElementType() {
        return element_type;
    }

    public int getRank() {
        return rank;
    }

    @Override
    public boolean isArray() {
        return true;
    }

    @Override
    public String toString() {
        return "array<" + element_type + ", " + rank + ">";
    }

}
