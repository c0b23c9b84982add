package pardir.hir;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;

/**
* Top-level scope of a compilation unit (a module or a file): holds the
* routines and the module-level symbols.
*/
public class Container extends Node implements ScopingNode {

    private final String name;

    private SymbolTable symbol_table;

    public Container(String name) {
        super();
        this.name = name;
        symbol_table = new SymbolTable(this);
    }

    public String getName() {
        return name;
    }

    public SymbolTable getSymbolTable() {
        return symbol_table;
    }

    public void addRoutine(Routine routine) {
        addChild(routine);
    }

    public List<Routine> getRoutines() {
        List<Routine> ret = new ArrayList<Routine>(children.size());
        for (Traversable t : children) {
            ret.add((Routine)t);
        }
        return ret;
    }

    /**
    * Returns the routine with the given name, or null if there is none.
    */
    public Routine getRoutine(String routine_name) {
        for (Routine routine : getRoutines()) {
            if (routine.getName().equalsIgnoreCase(routine_name)) {
                return routine;
            }
        }
        return null;
    }

    @Override
    protected boolean isValidChild(int position, Traversable child) {
        return (child instanceof Routine);
    }

    @Override
    protected String getChildrenFormat() {
        return "[Routine]*";
    }

    public void print(PrintWriter o) {
        o.println("module " + name);
        o.println("contains");
        for (Traversable t : children) {
            t.print(o);
            o.println();
        }
        o.print("end module " + name);
    }

    @Override
    public Container clone() {
        Container o = (Container)super.clone();
        o.symbol_table = new SymbolTable(o);
        for (Symbol symbol : symbol_table.getSymbols()) {
            o.symbol_table.add(symbol);
        }
        return o;
    }

}
