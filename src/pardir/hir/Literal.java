package pardir.hir;

import java.io.PrintWriter;

/**
* Constant value of a scalar intrinsic type. Integer literals may carry a
* leading minus sign, which is how folded arithmetic results are stored.
*/
public class Literal extends Expression {

    private final String value;

    private final ScalarType type;

    public Literal(String value, ScalarType type) {
        super();
        if (value == null || type == null) {
            throw new IllegalArgumentException(
                    "literal needs a value and a type");
        }
        if (type.getIntrinsic() == ScalarType.Intrinsic.INTEGER &&
            !value.matches("-?[0-9]+")) {
            throw new IllegalArgumentException(
                    "'" + value + "' is not a valid integer literal");
        }
        this.value = value;
        this.type = type;
    }

    /**
    * Constructs an integer literal.
    */
    public Literal(long value) {
        this(Long.toString(value), ScalarType.INTEGER_TYPE);
    }

    public String getValue() {
        return value;
    }

    public ScalarType getType() {
        return type;
    }

    public boolean isInteger() {
        return (type.getIntrinsic() == ScalarType.Intrinsic.INTEGER);
    }

    /**
    * Returns the value of an integer literal.
    *
    * @throws IllegalStateException if the literal is not an integer.
    * @throws NumberFormatException if the value does not fit in a long.
    */
    public long getIntValue() {
        if (!isInteger()) {
            throw new IllegalStateException(
                    "literal '" + value + "' is not an integer");
        }
        return Long.parseLong(value);
    }

    @Override
    protected boolean isValidChild(int position, Traversable child) {
        return false;
    }

    @Override
    protected boolean isValidArity(int size) {
        return (size == 0);
    }

    @Override
    protected String getChildrenFormat() {
        return "<LeafNode>";
    }

    public void print(PrintWriter o) {
        o.print(value);
    }

    @Override
    public boolean equals(Object o) {
        return (super.equals(o) &&
                value.equals(((Literal)o).value) &&
                type.equals(((Literal)o).type));
    }

    @Override
    public Literal clone() {
        return (Literal)super.clone();
    }

}
