package pardir.hir;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;

/**
* Conditional block with an optional else body.
*/
public class IfBlock extends Statement {

    public IfBlock(Expression condition, Schedule if_body) {
        this(condition, if_body, null);
    }

    public IfBlock(Expression condition, Schedule if_body,
                   Schedule else_body) {
        super();
        if (condition == null || if_body == null) {
            throw new IllegalArgumentException(
                    "if-block needs a condition and a body");
        }
        List<Traversable> list = new ArrayList<Traversable>(3);
        list.add(condition);
        list.add(if_body);
        if (else_body != null) {
            list.add(else_body);
        }
        replaceChildren(list);
    }

    public Expression getCondition() {
        return (Expression)children.get(0);
    }

    public Schedule getIfBody() {
        return (Schedule)children.get(1);
    }

    /**
    * Returns the else body, or null if there is none.
    */
    public Schedule getElseBody() {
        return (children.size() == 3) ? (Schedule)children.get(2) : null;
    }

    @Override
    protected boolean isValidChild(int position, Traversable child) {
        if (position == 0) {
            return Expression.isDataNode(child);
        }
        return (position < 3 && child instanceof Schedule &&
                !(child instanceof Routine));
    }

    @Override
    protected boolean isValidArity(int size) {
        return (size == 2 || size == 3);
    }

    @Override
    protected String getChildrenFormat() {
        return "DataNode, Schedule [, Schedule]";
    }

    public void print(PrintWriter o) {
        o.print("if (");
        getCondition().print(o);
        o.println(") then");
        getIfBody().print(o);
        if (getElseBody() != null) {
            o.println("else");
            getElseBody().print(o);
        }
        o.print("end if");
    }

    @Override
    public IfBlock clone() {
        return (IfBlock)super.clone();
    }

}
