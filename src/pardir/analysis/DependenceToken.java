package pardir.analysis;

import pardir.hir.*;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.*;

/**
* One item of a {@code depend} clause: the base symbol and, for an array, one
* index expression (or range) per dimension, tagged with the direction of the
* dependence. Tokens compare by symbol, direction and index structure.
*/
public final class DependenceToken {

    /** Direction of a dependence. */
    public enum Direction {
        IN, OUT
    }

    private final Symbol symbol;

    private final List<Expression> indices;

    private final Direction direction;

    /**
    * Constructs a token. The indices are copied.
    *
    * @param symbol the base symbol.
    * @param indices the index expressions; empty for a scalar or a whole
    *   variable.
    * @param direction the dependence direction.
    */
    public DependenceToken(Symbol symbol, List<? extends Expression> indices,
                           Direction direction) {
        if (symbol == null || indices == null || direction == null) {
            throw new IllegalArgumentException(
                    "dependence token needs a symbol, indices and a direction");
        }
        List<Expression> list = new ArrayList<Expression>(indices.size());
        for (Expression index : indices) {
            list.add((index.getParent() == null) ? index : index.clone());
        }
        this.symbol = symbol;
        this.indices = Collections.unmodifiableList(list);
        this.direction = direction;
    }

    public Symbol getSymbol() {
        return symbol;
    }

    /** Returns the name of the base variable in lower case. */
    public String getName() {
        return symbol.getName().toLowerCase();
    }

    public List<Expression> getIndices() {
        return indices;
    }

    public Direction getDirection() {
        return direction;
    }

    public boolean isScalar() {
        return indices.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof DependenceToken)) {
            return false;
        }
        DependenceToken other = (DependenceToken)o;
        return (symbol == other.symbol && direction == other.direction &&
                indices.equals(other.indices));
    }

    @Override
    public int hashCode() {
        return toString().hashCode() * 31 + direction.hashCode();
    }

    /**
    * Returns the clause item text, e.g. {@code a(i + 9, j)}.
    */
    @Override
    public String toString() {
        if (indices.isEmpty()) {
            return symbol.getName();
        }
        StringWriter sw = new StringWriter(40);
        PrintWriter pw = new PrintWriter(sw);
        pw.print(symbol.getName());
        pw.print("(");
        PrintTools.printListWithComma(indices, pw);
        pw.print(")");
        pw.flush();
        return sw.toString();
    }

}
