package pardir.hir;

import java.io.PrintWriter;
import java.util.Arrays;

/**
* Operation with two operands. The bound inquiries {@code LBOUND} and
* {@code UBOUND} are also binary operations: the first operand is the
* inquired array access and the second one is the dimension literal, counted
* from 1.
*/
public class BinaryOperation extends Expression {

    /** Supported binary operators. */
    public enum Operator {
        ADD("+"), SUB("-"), MUL("*"), DIV("/"), POW("**"),
        EQ("=="), NE("/="), LT("<"), LE("<="), GT(">"), GE(">="),
        AND(".and."), OR(".or."),
        LBOUND("LBOUND"), UBOUND("UBOUND");

        private final String text;

        private Operator(String text) {
            this.text = text;
        }

        /** Returns true for the operators printed as intrinsic calls. */
        public boolean isIntrinsic() {
            return (this == LBOUND || this == UBOUND);
        }

        @Override
        public String toString() {
            return text;
        }
    }

    private final Operator op;

    public BinaryOperation(Operator op, Expression lhs, Expression rhs) {
        super();
        if (op == null || lhs == null || rhs == null) {
            throw new IllegalArgumentException(
                    "binary operation needs an operator and two operands");
        }
        this.op = op;
        replaceChildren(Arrays.asList(lhs, rhs));
    }

    /**
    * Builds {@code LBOUND(access, dim)}.
    */
    public static BinaryOperation lbound(Reference access, int dim) {
        return new BinaryOperation(Operator.LBOUND, access, new Literal(dim));
    }

    /**
    * Builds {@code UBOUND(access, dim)}.
    */
    public static BinaryOperation ubound(Reference access, int dim) {
        return new BinaryOperation(Operator.UBOUND, access, new Literal(dim));
    }

    public Operator getOperator() {
        return op;
    }

    public Expression getLHS() {
        return (Expression)children.get(0);
    }

    public Expression getRHS() {
        return (Expression)children.get(1);
    }

    @Override
    protected boolean isValidChild(int position, Traversable child) {
        return (position < 2 && isDataNode(child));
    }

    @Override
    protected boolean isValidArity(int size) {
        return (size == 2);
    }

    @Override
    protected String getChildrenFormat() {
        return "DataNode, DataNode";
    }

    public void print(PrintWriter o) {
        if (op.isIntrinsic()) {
            o.print(op);
            o.print("(");
            getLHS().print(o);
            o.print(", ");
            getRHS().print(o);
            o.print(")");
            return;
        }
        printOperand(getLHS(), o);
        o.print(" ");
        o.print(op);
        o.print(" ");
        printOperand(getRHS(), o);
    }

    /**
    * Prints an operand, enclosing nested operations in parentheses.
    */
    static void printOperand(Expression e, PrintWriter o) {
        boolean nested = (e instanceof BinaryOperation &&
                !((BinaryOperation)e).op.isIntrinsic());
        if (nested) {
            o.print("(");
        }
        e.print(o);
        if (nested) {
            o.print(")");
        }
    }

    @Override
    public boolean equals(Object o) {
        return (super.equals(o) && op == ((BinaryOperation)o).op);
    }

    @Override
    public BinaryOperation clone() {
        return (BinaryOperation)super.clone();
    }

}
