package pardir.hir;

/**
* Scalar datatype identified by its intrinsic kind.
*/
public class ScalarType extends DataType {

    /** Intrinsic kinds of scalar data. */
    public enum Intrinsic {
        INTEGER, REAL, BOOLEAN, CHARACTER
    }

    public static final ScalarType INTEGER_TYPE =
            new ScalarType(Intrinsic.INTEGER);

    public static final ScalarType REAL_TYPE = new ScalarType(Intrinsic.REAL);

    public static final ScalarType BOOLEAN_TYPE =
            new ScalarType(Intrinsic.BOOLEAN);

    public static final ScalarType CHARACTER_TYPE =
            new ScalarType(Intrinsic.CHARACTER);

    private final Intrinsic intrinsic;

    public ScalarType(Intrinsic intrinsic) {
        if (intrinsic == null) {
            throw new IllegalArgumentException("intrinsic kind is required");
        }
        this.intrinsic = intrinsic;
    }

    public Intrinsic getIntrinsic() {
        return intrinsic;
    }

    @Override
    public boolean equals(Object o) {
        return (o instanceof ScalarType &&
                ((ScalarType)o).intrinsic == intrinsic);
    }

    @Override
    public int hashCode() {
        return intrinsic.hashCode();
    }

    @Override
    public String toString() {
        return intrinsic.name().toLowerCase();
    }

}
