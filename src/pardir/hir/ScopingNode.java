package pardir.hir;

/**
* Any IR node that introduces a scope and owns a symbol table.
*/
public interface ScopingNode extends Traversable {

    /**
    * Returns the symbol table owned by this node.
    */
    SymbolTable getSymbolTable();

}
