package pardir.hir;

import java.io.PrintWriter;
import java.util.List;

/**
* Access to one element or section of an array, e.g. {@code a(i, 1:n:1)}.
*/
public class ArrayReference extends Reference implements ArrayIndexed {

    public ArrayReference(Symbol symbol, List<? extends Expression> indices) {
        super(symbol);
        replaceChildren(indices);
    }

    public List<Expression> getIndices() {
        return indicesFrom(children, 0);
    }

    public Expression getIndex(int dim) {
        return indexAt(this, dim);
    }

    public int getNumIndices() {
        return children.size();
    }

    @Override
    protected boolean isValidChild(int position, Traversable child) {
        return isIndexNode(child);
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
        o.print(symbol.getName());
        printIndices(this, o);
    }

    @Override
    public ArrayReference clone() {
        return (ArrayReference)super.clone();
    }

}
