package pardir.hir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
* Name to symbol bindings of one scope. Names are case-insensitive and unique
* within a table. Scopes nest following the ancestor chain of the owning
* node, so a lookup that misses locally continues in the enclosing scopes.
*/
public class SymbolTable {

    /** The node that owns this table */
    private final ScopingNode scope;

    /** The internal look-up table */
    private final Map<String, Symbol> symbols;

    public SymbolTable(ScopingNode scope) {
        this.scope = scope;
        this.symbols = new LinkedHashMap<String, Symbol>();
    }

    /** Returns the node owning this table. */
    public ScopingNode getScope() {
        return scope;
    }

    /**
    * Adds a symbol to this table.
    *
    * @param symbol the new symbol.
    * @return the added symbol.
    * @throws DuplicateSymbolException if the name is already bound here.
    */
    public Symbol add(Symbol symbol) {
        String key = normalize(symbol.getName());
        if (symbols.containsKey(key)) {
            throw new DuplicateSymbolException("Symbol table already " +
                    "contains a symbol with name '" + symbol.getName() + "'");
        }
        symbols.put(key, symbol);
        return symbol;
    }

    /**
    * Looks up a name in this table only.
    *
    * @return the symbol, or null if it is not bound here.
    */
    public Symbol lookupLocal(String name) {
        return symbols.get(normalize(name));
    }

    /**
    * Looks up a name in this table and then in the enclosing scopes.
    *
    * @return the nearest visible symbol, or null if none is found.
    */
    public Symbol lookup(String name) {
        SymbolTable table = this;
        while (table != null) {
            Symbol ret = table.lookupLocal(name);
            if (ret != null) {
                return ret;
            }
            table = table.getParentTable();
        }
        return null;
    }

    /** Returns true if the symbol object is bound in this table. */
    public boolean contains(Symbol symbol) {
        return (symbols.get(normalize(symbol.getName())) == symbol);
    }

    /**
    * Returns the table of the nearest enclosing scope, or null at the top.
    */
    public SymbolTable getParentTable() {
        ScopingNode parent =
                IRTools.getAncestorOfType(scope, ScopingNode.class);
        return (parent == null) ? null : parent.getSymbolTable();
    }

    /**
    * Returns the chain of enclosing tables, nearest first.
    */
    public List<SymbolTable> getParentTables() {
        List<SymbolTable> ret = new ArrayList<SymbolTable>();
        SymbolTable table = getParentTable();
        while (table != null) {
            ret.add(table);
            table = table.getParentTable();
        }
        return ret;
    }

    /** Returns the symbols of this table in insertion order. */
    public List<Symbol> getSymbols() {
        return Collections.unmodifiableList(
                new ArrayList<Symbol>(symbols.values()));
    }

    /** Returns the symbols of this table that are local variables. */
    public List<Symbol> getLocalSymbols() {
        List<Symbol> ret = new ArrayList<Symbol>();
        for (Symbol symbol : symbols.values()) {
            if (symbol.getInterface() instanceof SymbolInterface.Local) {
                ret.add(symbol);
            }
        }
        return ret;
    }

    private static String normalize(String name) {
        return name.toLowerCase();
    }

    @Override
    public String toString() {
        return PrintTools.listToString(getSymbols(), PrintTools.line_sep);
    }

}
