package pardir.hir;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;

/**
* Ordered sequence of statements that introduces a scope: the body of a
* routine, a loop, an if-block or a directive region.
*/
public class Schedule extends Statement implements ScopingNode {

    /** The symbol table of this scope */
    protected SymbolTable symbol_table;

    public Schedule() {
        super();
        symbol_table = new SymbolTable(this);
    }

    public Schedule(List<? extends Statement> statements) {
        this();
        replaceChildren(statements);
    }

    public SymbolTable getSymbolTable() {
        return symbol_table;
    }

    /**
    * Returns the statements of this schedule.
    */
    public List<Statement> getStatements() {
        List<Statement> ret = new ArrayList<Statement>(children.size());
        for (Traversable t : children) {
            ret.add((Statement)t);
        }
        return ret;
    }

    public Statement getStatement(int index) {
        return (Statement)children.get(index);
    }

    public int countStatements() {
        return children.size();
    }

    /**
    * Appends a statement to the schedule.
    *
    * @throws NotAnOrphanException if the statement has a parent.
    */
    public void addStatement(Statement stmt) {
        addChild(stmt);
    }

    /**
    * Inserts a statement at the given position.
    *
    * @throws NotAnOrphanException if the statement has a parent.
    */
    public void addStatement(int index, Statement stmt) {
        addChild(index, stmt);
    }

    /**
    * Replaces all statements of the schedule at once.
    */
    public void setStatements(List<? extends Statement> statements) {
        replaceChildren(statements);
    }

    @Override
    protected boolean isValidChild(int position, Traversable child) {
        return (child instanceof Statement && !(child instanceof Routine));
    }

    @Override
    protected String getChildrenFormat() {
        return "[Statement]*";
    }

    public void print(PrintWriter o) {
        for (Traversable t : children) {
            t.print(o);
            o.println();
        }
    }

    /**
    * Returns a deep copy of the schedule. The copy owns a new symbol table
    * holding the same symbols.
    */
    @Override
    public Schedule clone() {
        Schedule o = (Schedule)super.clone();
        o.symbol_table = new SymbolTable(o);
        for (Symbol symbol : symbol_table.getSymbols()) {
            o.symbol_table.add(symbol);
        }
        return o;
    }

}
