package pardir.hir;

import java.io.PrintWriter;
import java.util.Arrays;

/**
* Assignment statement {@code lhs = rhs}. The target is a reference of any
* kind.
*/
public class Assignment extends Statement {

    public Assignment(Reference lhs, Expression rhs) {
        super();
        if (lhs == null || rhs == null) {
            throw new IllegalArgumentException(
                    "assignment needs a target and a value");
        }
        replaceChildren(Arrays.asList(lhs, rhs));
    }

    public Reference getLHS() {
        return (Reference)children.get(0);
    }

    public Expression getRHS() {
        return (Expression)children.get(1);
    }

    public void setRHS(Expression rhs) {
        setChild(1, rhs);
    }

    @Override
    protected boolean isValidChild(int position, Traversable child) {
        switch (position) {
        case 0:
            return (child instanceof Reference);
        case 1:
            return Expression.isDataNode(child);
        default:
            return false;
        }
    }

    @Override
    protected boolean isValidArity(int size) {
        return (size == 2);
    }

    @Override
    protected String getChildrenFormat() {
        return "Reference, DataNode";
    }

    public void print(PrintWriter o) {
        getLHS().print(o);
        o.print(" = ");
        getRHS().print(o);
    }

    @Override
    public Assignment clone() {
        return (Assignment)super.clone();
    }

}
