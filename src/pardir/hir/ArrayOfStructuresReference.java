package pardir.hir;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;

/**
* Access to a component of one element of an array of structures, e.g.
* {@code cells(i)%value}. The first child is the member; the remaining children
* are the indices of the array.
*/
public class ArrayOfStructuresReference extends StructureReference
        implements ArrayIndexed {

    public ArrayOfStructuresReference(Symbol symbol, Member member,
                                      List<? extends Expression> indices) {
        super(symbol);
        if (member == null || indices == null) {
            throw new IllegalArgumentException(
                    "array of structures reference needs a member and indices");
        }
        List<Expression> list = new ArrayList<Expression>(indices.size() + 1);
        list.add(member);
        list.addAll(indices);
        replaceChildren(list);
    }

    public List<Expression> getIndices() {
        return indicesFrom(children, 1);
    }

    public Expression getIndex(int dim) {
        return indexAt(this, dim);
    }

    public int getNumIndices() {
        return children.size() - 1;
    }

    @Override
    protected boolean isValidChild(int position, Traversable child) {
        if (position == 0) {
            return (child instanceof Member);
        }
        return isIndexNode(child);
    }

    @Override
    protected boolean isValidArity(int size) {
        return (size >= 2);
    }

    @Override
    protected String getChildrenFormat() {
        return "Member, [DataNode | Range]+";
    }

    @Override
    public void print(PrintWriter o) {
        o.print(symbol.getName());
        printIndices(this, o);
        o.print("%");
        getMember().print(o);
    }

    @Override
    public ArrayOfStructuresReference clone() {
        return (ArrayOfStructuresReference)super.clone();
    }

}
