package pardir.hir;

import java.io.PrintWriter;
import java.util.List;

/**
* Access to a component of a structure, e.g. {@code grid%data(i)}. The first
* child is the accessed member.
*/
public class StructureReference extends Reference {

    public StructureReference(Symbol symbol, Member member) {
        super(symbol);
        if (member == null) {
            throw new IllegalArgumentException(
                    "structure reference needs a member");
        }
        addChild(member);
    }

    /** Constructor for the indexed subclass. */
    protected StructureReference(Symbol symbol) {
        super(symbol);
    }

    public Member getMember() {
        return (Member)children.get(0);
    }

    @Override
    protected void collectAccess(List<String> names,
                                 List<List<Expression>> indices) {
        super.collectAccess(names, indices);
        getMember().collectAccess(names, indices);
    }

    @Override
    protected boolean isValidChild(int position, Traversable child) {
        return (position == 0 && child instanceof Member);
    }

    @Override
    protected boolean isValidArity(int size) {
        return (size == 1);
    }

    @Override
    protected String getChildrenFormat() {
        return "Member";
    }

    @Override
    public void print(PrintWriter o) {
        o.print(symbol.getName());
        o.print("%");
        getMember().print(o);
    }

    @Override
    public StructureReference clone() {
        return (StructureReference)super.clone();
    }

}
