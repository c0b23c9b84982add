package pardir.hir;

import java.io.PrintWriter;
import java.util.List;

/**
* Structure component that is itself accessed further, e.g. {@code b} in
* {@code a%b%c}. The first child is the inner member.
*/
public class StructureMember extends Member {

    public StructureMember(String name, Member inner) {
        super(name);
        if (inner == null) {
            throw new IllegalArgumentException(
                    "structure member needs an inner member");
        }
        addChild(inner);
    }

    /** Constructor for the indexed subclass. */
    protected StructureMember(String name) {
        super(name);
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
        o.print(getName());
        o.print("%");
        getMember().print(o);
    }

    @Override
    public StructureMember clone() {
        return (StructureMember)super.clone();
    }

}
