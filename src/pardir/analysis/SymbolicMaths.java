package pardir.analysis;

import pardir.hir.*;

/**
* Folds integer-literal arithmetic and compares expressions after folding.
* An instance is created for one compilation run and handed to the analyses
* that need it; it keeps no state between calls.
*/
public class SymbolicMaths {

    public SymbolicMaths() {
    }

    /**
    * Returns a folded copy of the expression: every addition, subtraction
    * and multiplication of integer literals, and every negation of an
    * integer literal, is replaced by its value. Arithmetic that does not fit
    * in a {@code long} is left unfolded. The input is not modified.
    *
    * @param e the expression to be folded.
    * @return the folded copy.
    */
    public Expression fold(Expression e) {
        if (e instanceof BinaryOperation) {
            BinaryOperation bop = (BinaryOperation)e;
            if (bop.getOperator().isIntrinsic()) {
                return bop.clone();
            }
            Expression lhs = fold(bop.getLHS());
            Expression rhs = fold(bop.getRHS());
            Long value = evaluate(bop.getOperator(), lhs, rhs);
            if (value != null) {
                return new Literal(value.longValue());
            }
            return new BinaryOperation(bop.getOperator(), lhs, rhs);
        } else if (e instanceof UnaryOperation) {
            UnaryOperation uop = (UnaryOperation)e;
            Expression operand = fold(uop.getOperand());
            Long value = valueOf(operand);
            if (value != null) {
                if (uop.getOperator() == UnaryOperation.Operator.MINUS &&
                    value.longValue() != Long.MIN_VALUE) {
                    return new Literal(-value.longValue());
                }
                if (uop.getOperator() == UnaryOperation.Operator.PLUS) {
                    return operand;
                }
            }
            return new UnaryOperation(uop.getOperator(), operand);
        }
        return e.clone();
    }

    /**
    * Returns the integer value of the expression if it folds to a literal.
    *
    * @return the value, or null if the expression is not constant.
    */
    public Long getIntValue(Expression e) {
        return valueOf(fold(e));
    }

    /**
    * Builds {@code a - b}, folded to a literal when both operands are
    * integer literals after folding.
    */
    public Expression subtract(Expression a, Expression b) {
        return combine(BinaryOperation.Operator.SUB, a, b);
    }

    /**
    * Builds {@code a + b}, folded to a literal when both operands are
    * integer literals after folding.
    */
    public Expression add(Expression a, Expression b) {
        return combine(BinaryOperation.Operator.ADD, a, b);
    }

    /**
    * Checks if two expressions are equal after folding.
    */
    public boolean equal(Expression a, Expression b) {
        return fold(a).equals(fold(b));
    }

    private Expression combine(BinaryOperation.Operator op,
                               Expression a, Expression b) {
        Expression lhs = fold(a);
        Expression rhs = fold(b);
        Long value = evaluate(op, lhs, rhs);
        if (value != null) {
            return new Literal(value.longValue());
        }
        return new BinaryOperation(op, lhs, rhs);
    }

    private static Long evaluate(BinaryOperation.Operator op,
                                 Expression lhs, Expression rhs) {
        Long l = valueOf(lhs);
        Long r = valueOf(rhs);
        if (l == null || r == null) {
            return null;
        }
        try {
            switch (op) {
            case ADD:
                return Long.valueOf(
                        Math.addExact(l.longValue(), r.longValue()));
            case SUB:
                return Long.valueOf(
                        Math.subtractExact(l.longValue(), r.longValue()));
            case MUL:
                return Long.valueOf(
                        Math.multiplyExact(l.longValue(), r.longValue()));
            default:
                return null;
            }
        } catch (ArithmeticException e) {
            PrintTools.printlnStatus(2, "[SymbolicMaths]", "overflow in", l,
                    op, r, "- left unfolded");
            return null;
        }
    }

    /**
    * Returns the value of an integer literal, or null if the expression is
    * not one or its value does not fit in a {@code long}.
    */
    private static Long valueOf(Expression e) {
        if (!(e instanceof Literal) || !((Literal)e).isInteger()) {
            return null;
        }
        try {
            return Long.valueOf(((Literal)e).getIntValue());
        } catch (NumberFormatException ex) {
            return null;
        }
    }

}
