package pardir.analysis;

import pardir.hir.*;

import java.util.*;

/**
* Queries on the dimensions of indexed accesses. A full-range dimension is
* written {@code LBOUND(a, d):UBOUND(a, d):1}, where {@code a} is the same
* access as the indexed one and {@code d} the dimension counted from 1.
*/
public final class ArrayAccessModel {

    private ArrayAccessModel() {
    }

    /**
    * Checks if the dimension is a range starting at the lower bound of the
    * same access.
    *
    * @param node an indexed reference or member.
    * @param dim the dimension, starting at 0.
    * @throws IllegalArgumentException if the dimension is out of range.
    */
    public static boolean isLowerBound(ArrayIndexed node, int dim) {
        validateIndex(node, dim);
        Expression entry = node.getIndex(dim);
        if (!(entry instanceof Range)) {
            return false;
        }
        return isBoundInquiry(node, ((Range)entry).getStart(),
                BinaryOperation.Operator.LBOUND, dim);
    }

    /**
    * Checks if the dimension is a range stopping at the upper bound of the
    * same access.
    *
    * @param node an indexed reference or member.
    * @param dim the dimension, starting at 0.
    * @throws IllegalArgumentException if the dimension is out of range.
    */
    public static boolean isUpperBound(ArrayIndexed node, int dim) {
        validateIndex(node, dim);
        Expression entry = node.getIndex(dim);
        if (!(entry instanceof Range)) {
            return false;
        }
        return isBoundInquiry(node, ((Range)entry).getStop(),
                BinaryOperation.Operator.UBOUND, dim);
    }

    /**
    * Checks if the dimension selects every element: a range from the lower
    * to the upper bound of the same access with a unit step.
    *
    * @param node an indexed reference or member.
    * @param dim the dimension, starting at 0.
    * @throws IllegalArgumentException if the dimension is out of range.
    */
    public static boolean isFullRange(ArrayIndexed node, int dim) {
        if (!isLowerBound(node, dim) || !isUpperBound(node, dim)) {
            return false;
        }
        Expression step = ((Range)node.getIndex(dim)).getStep();
        return (step instanceof Literal && ((Literal)step).isInteger() &&
                ((Literal)step).getValue().equals("1"));
    }

    /**
    * Checks if a bound-inquiry argument denotes the same access as the
    * indexed node. For a reference the symbols must be the same. For a member
    * inside a structure access the component names must agree down to the
    * member and the indices of every component above the member must print
    * the same; indices of the member itself are ignored. So {@code a(3)%b%c}
    * matches {@code c} in {@code a(3)%b%c(:)}, but {@code a(2)%b%c} does not.
    *
    * @param node an indexed reference or member.
    * @param other the access to compare with.
    */
    public static boolean matchingAccess(ArrayIndexed node, Reference other) {
        if (node instanceof Reference) {
            return (((Reference)node).getSymbol() == other.getSymbol());
        }
        Member member = (Member)node;
        Reference parent_ref = member.getParentReference();
        if (parent_ref == null) {
            return false;
        }
        int depth = member.getDepth();
        List<String> self_sig = parent_ref.getSignature();
        List<String> other_sig = other.getSignature();
        if (other_sig.size() < depth + 1 ||
            !self_sig.subList(0, depth + 1).equals(
                    other_sig.subList(0, depth + 1))) {
            return false;
        }
        List<List<Expression>> self_indices =
                parent_ref.getComponentIndices();
        List<List<Expression>> other_indices = other.getComponentIndices();
        for (int i = 0; i < depth; i++) {
            if (!PrintTools.listToString(self_indices.get(i), ",").equals(
                    PrintTools.listToString(other_indices.get(i), ","))) {
                return false;
            }
        }
        return true;
    }

    /**
    * Resolves an indexed reference into its base symbol and one entry per
    * dimension of the base array.
    *
    * @param ref an array reference or an array of structures reference.
    * @return the descriptor.
    * @throws IllegalArgumentException if the reference is not indexed.
    * @throws StructuralError if the number of indices differs from the
    *   declared rank of the base symbol.
    */
    public static ArrayAccessDescriptor resolve(Reference ref) {
        if (!(ref instanceof ArrayIndexed)) {
            throw new IllegalArgumentException("Reference '" + ref +
                    "' has no indices to resolve");
        }
        List<Expression> indices = ((ArrayIndexed)ref).getIndices();
        Symbol base = ref.getSymbol();
        if (base.isArray() && base.getRank() != indices.size()) {
            throw new StructuralError("Access '" + ref + "' has " +
                    indices.size() + " indices but '" + base.getName() +
                    "' is declared with rank " + base.getRank());
        }
        return new ArrayAccessDescriptor(ref, indices);
    }

    private static boolean isBoundInquiry(ArrayIndexed node, Expression e,
            BinaryOperation.Operator op, int dim) {
        if (!(e instanceof BinaryOperation)) {
            return false;
        }
        BinaryOperation bound = (BinaryOperation)e;
        if (bound.getOperator() != op) {
            return false;
        }
        if (!(bound.getLHS() instanceof Reference) ||
            !matchingAccess(node, (Reference)bound.getLHS())) {
            return false;
        }
        Expression dim_expr = bound.getRHS();
        return (dim_expr instanceof Literal &&
                ((Literal)dim_expr).isInteger() &&
                ((Literal)dim_expr).getValue().equals(
                        Integer.toString(dim + 1)));
    }

    private static void validateIndex(ArrayIndexed node, int dim) {
        if (dim < 0 || dim >= node.getNumIndices()) {
            throw new IllegalArgumentException("The index argument should " +
                    "be in range 0 to " + (node.getNumIndices() - 1) +
                    " but found " + dim + ".");
        }
    }

}
