package pardir.hir;

import java.io.PrintWriter;
import java.util.List;

/**
* Indexed array component of a structure, e.g. {@code data(i)} in
* {@code grid%data(i)}.
*/
public class ArrayMember extends Member implements ArrayIndexed {

    public ArrayMember(String name, List<? extends Expression> indices) {
        super(name);
        replaceChildren(indices);
    }

    public List<Expression> getIndices() {
        return Reference.indicesFrom(children, 0);
    }

    public Expression getIndex(int dim) {
        return Reference.indexAt(this, dim);
    }

    public int getNumIndices() {
        return children.size();
    }

    @Override
    protected boolean isValidChild(int position, Traversable child) {
        return Reference.isIndexNode(child);
    }

    @Override
    protected boolean isValidArity(int size) {
        return (size >= 1);
    }

    @Override
    protected String getChildrenFormat() {
        return "[DataNode | Range]+";
    }

    @Override
    public void print(PrintWriter o) {
        o.print(getName());
        Reference.printIndices(this, o);
    }

    @Override
    public ArrayMember clone() {
        return (ArrayMember)super.clone();
    }

}
