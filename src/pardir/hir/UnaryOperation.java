package pardir.hir;

import java.io.PrintWriter;

/**
* Operation with a single operand.
*/
public class UnaryOperation extends Expression {

    /** Supported unary operators. */
    public enum Operator {
        MINUS("-"), PLUS("+"), NOT(".not. ");

        private final String text;

        private Operator(String text) {
            this.text = text;
        }

        @Override
        public String toString() {
            return text;
        }
    }

    private final Operator op;

    public UnaryOperation(Operator op, Expression operand) {
        super();
        if (op == null || operand == null) {
            throw new IllegalArgumentException(
                    "unary operation needs an operator and an operand");
        }
        this.op = op;
        addChild(operand);
    }

    public Operator getOperator() {
        return op;
    }

    public Expression getOperand() {
        return (Expression)children.get(0);
    }

    @Override
    protected boolean isValidChild(int position, Traversable child) {
        return (position == 0 && isDataNode(child));
    }

    @Override
    protected boolean isValidArity(int size) {
        return (size == 1);
    }

    @Override
    protected String getChildrenFormat() {
        return "DataNode";
    }

    public void print(PrintWriter o) {
        o.print(op);
        BinaryOperation.printOperand(getOperand(), o);
    }

    @Override
    public boolean equals(Object o) {
        return (super.equals(o) && op == ((UnaryOperation)o).op);
    }

    @Override
    public UnaryOperation clone() {
        return (UnaryOperation)super.clone();
    }

}
