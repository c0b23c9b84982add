package pardir.analysis;

import pardir.hir.*;

import java.util.*;

/**
* All accesses to one signature in program order.
*/
public class VariableAccesses {

    private final Signature signature;

    private final Symbol symbol;

    private final List<AccessInfo> accesses;

    public VariableAccesses(Signature signature, Symbol symbol) {
        this.signature = signature;
        this.symbol = symbol;
        this.accesses = new ArrayList<AccessInfo>();
    }

    void add(AccessInfo access) {
        accesses.add(access);
    }

    public Signature getSignature() {
        return signature;
    }

    /** Returns the symbol of the base variable of the accesses. */
    public Symbol getSymbol() {
        return symbol;
    }

    public List<AccessInfo> getAllAccesses() {
        return Collections.unmodifiableList(accesses);
    }

    public AccessInfo getFirst() {
        return accesses.get(0);
    }

    public int size() {
        return accesses.size();
    }

    /**
    * Returns true if the variable is accessed as an array: the first access
    * is indexed or the symbol is declared as an array.
    */
    public boolean isArray() {
        return (getFirst().isArray() || symbol.isArray());
    }

    public boolean isWritten() {
        for (AccessInfo access : accesses) {
            if (access.getAccessType().isWrite()) {
                return true;
            }
        }
        return false;
    }

    public boolean isRead() {
        for (AccessInfo access : accesses) {
            if (access.getAccessType().isRead()) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return signature + ": " + PrintTools.listToString(accesses, ", ");
    }

}
