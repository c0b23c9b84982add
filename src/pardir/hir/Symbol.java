package pardir.hir;

/**
* A named entity of a scope: its datatype and how it is brought into the
* scope. Symbols are compared by identity; names are unique within the symbol
* table that owns the symbol.
*/
public class Symbol {

    private final String name;

    private final DataType datatype;

    private final SymbolInterface sym_interface;

    /**
    * Constructs a local symbol.
    */
    public Symbol(String name, DataType datatype) {
        this(name, datatype, new SymbolInterface.Local());
    }

    public Symbol(String name, DataType datatype,
                  SymbolInterface sym_interface) {
        if (name == null || name.length() == 0) {
            throw new IllegalArgumentException("symbol name is required");
        }
        if (datatype == null || sym_interface == null) {
            throw new IllegalArgumentException(
                    "symbol '" + name + "' needs a datatype and an interface");
        }
        this.name = name;
        this.datatype = datatype;
        this.sym_interface = sym_interface;
    }

    public String getName() {
        return name;
    }

    public DataType getDatatype() {
        return datatype;
    }

    public SymbolInterface getInterface() {
        return sym_interface;
    }

    public boolean isArray() {
        return datatype.isArray();
    }

    public boolean isScalar() {
        return (datatype instanceof ScalarType);
    }

    public boolean isConstant() {
        return (sym_interface instanceof SymbolInterface.Constant);
    }

    public boolean isImported() {
        return (sym_interface instanceof SymbolInterface.Imported);
    }

    public boolean isArgument() {
        return (sym_interface instanceof SymbolInterface.Argument);
    }

    /**
    * Returns the number of dimensions of an array symbol, or 0 for anything
    * else.
    */
    public int getRank() {
        if (datatype instanceof ArrayType) {
            return ((ArrayType)datatype).getRank();
        }
        return 0;
    }

    @Override
    public String toString() {
        return name + ": " + datatype + ", " + sym_interface;
    }

}
