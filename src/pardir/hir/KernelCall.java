package pardir.hir;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
* Call to a compute kernel. Besides the argument expressions, the call
* carries the names of the variables the kernel declares locally, as
* reported by the kernel-call layer.
*/
public class KernelCall extends Statement {

    private final String name;

    private final List<String> local_variables;

    public KernelCall(String name, List<? extends Expression> arguments) {
        this(name, arguments, Collections.<String>emptyList());
    }

    public KernelCall(String name, List<? extends Expression> arguments,
                      List<String> local_variables) {
        super();
        if (name == null || arguments == null || local_variables == null) {
            throw new IllegalArgumentException(
                    "kernel call needs a name, arguments and local variables");
        }
        this.name = name;
        this.local_variables = new ArrayList<String>(local_variables);
        replaceChildren(arguments);
    }

    public String getName() {
        return name;
    }

    public List<Expression> getArguments() {
        List<Expression> ret = new ArrayList<Expression>(children.size());
        for (Traversable t : children) {
            ret.add((Expression)t);
        }
        return ret;
    }

    /**
    * Returns the names of the variables local to the called kernel.
    */
    public List<String> getLocalVariables() {
        return Collections.unmodifiableList(local_variables);
    }

    @Override
    protected boolean isValidChild(int position, Traversable child) {
        return Expression.isDataNode(child);
    }

    @Override
    protected String getChildrenFormat() {
        return "[DataNode]*";
    }

    public void print(PrintWriter o) {
        o.print("call " + name + "(");
        PrintTools.printListWithComma(children, o);
        o.print(")");
    }

    @Override
    public KernelCall clone() {
        return (KernelCall)super.clone();
    }

}
