package pardir.hir;

import java.io.PrintWriter;
import java.util.Arrays;

/**
* Counted loop {@code do var = start, stop, step}. The control variable is
* held as a symbol; the children are the start, stop and step expressions
* followed by the body.
*/
public class Loop extends Statement {

    private final Symbol variable;

    public Loop(Symbol variable, Expression start, Expression stop,
                Expression step) {
        this(variable, start, stop, step, new Schedule());
    }

    public Loop(Symbol variable, Expression start, Expression stop,
                Expression step, Schedule body) {
        super();
        if (variable == null) {
            throw new IllegalArgumentException("loop needs a control variable");
        }
        if (!variable.isScalar()) {
            throw new StructuralError("Loop control variable '" +
                    variable.getName() + "' must be a scalar");
        }
        this.variable = variable;
        replaceChildren(Arrays.asList(start, stop, step, body));
    }

    public Symbol getVariable() {
        return variable;
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

    public Schedule getBody() {
        return (Schedule)children.get(3);
    }

    @Override
    protected boolean isValidChild(int position, Traversable child) {
        if (position < 3) {
            return Expression.isDataNode(child);
        }
        return (position == 3 && child instanceof Schedule &&
                !(child instanceof Routine));
    }

    @Override
    protected boolean isValidArity(int size) {
        return (size == 4);
    }

    @Override
    protected String getChildrenFormat() {
        return "DataNode, DataNode, DataNode, Schedule";
    }

    public void print(PrintWriter o) {
        o.print("do " + variable.getName() + " = ");
        getStart().print(o);
        o.print(", ");
        getStop().print(o);
        o.print(", ");
        getStep().print(o);
        o.println();
        getBody().print(o);
        o.print("enddo");
    }

    @Override
    public Loop clone() {
        return (Loop)super.clone();
    }

}
