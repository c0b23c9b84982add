package pardir.hir;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;

/**
* Indexed structure component accessed further, e.g. {@code b(2)} in
* {@code a%b(2)%c}.
*/
public class ArrayOfStructuresMember extends StructureMember
        implements ArrayIndexed {

    public ArrayOfStructuresMember(String name, Member inner,
                                   List<? extends Expression> indices) {
        super(name);
        if (inner == null || indices == null) {
            throw new IllegalArgumentException(
                    "array of structures member needs a member and indices");
        }
        List<Expression> list = new ArrayList<Expression>(indices.size() + 1);
        list.add(inner);
        list.addAll(indices);
        replaceChildren(list);
    }

    public List<Expression> getIndices() {
        return Reference.indicesFrom(children, 1);
    }

    public Expression getIndex(int dim) {
        return Reference.indexAt(this, dim);
    }

    public int getNumIndices() {
        return children.size() - 1;
    }

    @Override
    protected boolean isValidChild(int position, Traversable child) {
        if (position == 0) {
            return (child instanceof Member);
        }
        return Reference.isIndexNode(child);
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
        o.print(getName());
        Reference.printIndices(this, o);
        o.print("%");
        getMember().print(o);
    }

    @Override
    public ArrayOfStructuresMember clone() {
        return (ArrayOfStructuresMember)super.clone();
    }

}
