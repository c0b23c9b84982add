package pardir.hir;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
* Use of a symbol as a value or as an assignment target. The plain kind is a
* leaf; the array and structure kinds add indices and member accesses as
* children.
*/
public class Reference extends Expression {

    /** The referenced symbol */
    protected Symbol symbol;

    public Reference(Symbol symbol) {
        super();
        if (symbol == null) {
            throw new IllegalArgumentException("reference needs a symbol");
        }
        this.symbol = symbol;
    }

    public Symbol getSymbol() {
        return symbol;
    }

    public String getName() {
        return symbol.getName();
    }

    /**
    * Returns the component names of the access, starting with the symbol
    * name, in lower case. For {@code a(3)%b%c(i)} this is {@code [a, b, c]}.
    */
    public List<String> getSignature() {
        List<String> names = new ArrayList<String>();
        collectAccess(names, new ArrayList<List<Expression>>());
        return names;
    }

    /**
    * Returns the index expressions of every component of the access, one
    * (possibly empty) list per entry of {@link #getSignature()}.
    */
    public List<List<Expression>> getComponentIndices() {
        List<List<Expression>> indices = new ArrayList<List<Expression>>();
        collectAccess(new ArrayList<String>(), indices);
        return indices;
    }

    /**
    * Appends this component and the components beneath it to the given
    * signature and index lists.
    */
    protected void collectAccess(List<String> names,
                                 List<List<Expression>> indices) {
        names.add(symbol.getName().toLowerCase());
        if (this instanceof ArrayIndexed) {
            indices.add(((ArrayIndexed)this).getIndices());
        } else {
            indices.add(Collections.<Expression>emptyList());
        }
    }

    @Override
    protected boolean isValidChild(int position, Traversable child) {
        return false;
    }

    @Override
    protected boolean isValidArity(int size) {
        return (size == 0);
    }

    @Override
    protected String getChildrenFormat() {
        return "<LeafNode>";
    }

    public void print(PrintWriter o) {
        o.print(symbol.getName());
    }

    @Override
    public boolean equals(Object o) {
        return (super.equals(o) && symbol == ((Reference)o).symbol);
    }

    @Override
    public Reference clone() {
        return (Reference)super.clone();
    }

    /**
    * Prints the index list of an indexed node as {@code (i, j)}.
    */
    static void printIndices(ArrayIndexed node, PrintWriter o) {
        o.print("(");
        PrintTools.printListWithComma(node.getIndices(), o);
        o.print(")");
    }

    /**
    * Returns the index children of an indexed node, which start at
    * {@code first}.
    */
    static List<Expression> indicesFrom(List<Traversable> children,
                                        int first) {
        List<Expression> ret = new ArrayList<Expression>();
        for (int i = first; i < children.size(); i++) {
            ret.add((Expression)children.get(i));
        }
        return ret;
    }

    /**
    * Returns the index of dimension {@code dim} of an indexed node.
    */
    static Expression indexAt(ArrayIndexed node, int dim) {
        if (dim < 0 || dim >= node.getNumIndices()) {
            throw new IllegalArgumentException("Array index " + dim +
                    " is out of range for an access with " +
                    node.getNumIndices() + " dimension(s)");
        }
        return node.getIndices().get(dim);
    }

    /**
    * Index children may be any data expression or a range.
    */
    static boolean isIndexNode(Traversable child) {
        return (isDataNode(child) || child instanceof Range);
    }

}
