package pardir.hir;

import java.io.PrintWriter;
import java.util.Arrays;

/**
* Triplet {@code start:stop:step} selecting a section of one array dimension.
* A range only appears as an index of an array access.
*/
public class Range extends Expression {

    /**
    * Constructs a range with a unit step.
    */
    public Range(Expression start, Expression stop) {
        this(start, stop, new Literal(1));
    }

    public Range(Expression start, Expression stop, Expression step) {
        super();
        if (start == null || stop == null || step == null) {
            throw new IllegalArgumentException("range bounds are required");
        }
        replaceChildren(Arrays.asList(start, stop, step));
    }

    public Expression getStart() {
        return (Expression)children.get(0);
    }

    public Expression getStop() {
        return (Expression)children.get(1);
    }

    public Expression getStep() {
        return (Expression)children.get(2);
    }

    @Override
    protected boolean isValidChild(int position, Traversable child) {
        return (position < 3 && isDataNode(child));
    }

    @Override
    protected boolean isValidArity(int size) {
        return (size == 3);
    }

    @Override
    protected String getChildrenFormat() {
        return "DataNode, DataNode, DataNode";
    }

    public void print(PrintWriter o) {
        getStart().print(o);
        o.print(":");
        getStop().print(o);
        o.print(":");
        getStep().print(o);
    }

    @Override
    public Range clone() {
        return (Range)super.clone();
    }

}
