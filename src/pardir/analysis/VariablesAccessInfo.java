package pardir.analysis;

import pardir.hir.*;

import java.util.*;

/**
* Collects every variable access beneath an IR node, in program order, keyed
* by signature. The walk follows execution order within a statement:
* <ul>
* <li>assignment: reads of the target's indices, reads of the value, then the
*     write of the target;</li>
* <li>loop: a write and a read of the control variable at the loop itself,
*     reads of the start, stop and step expressions, then the body;</li>
* <li>if-block: reads of the condition, then the bodies;</li>
* <li>kernel call: arguments passed by reference are read and written, their
*     indices are read.</li>
* </ul>
*/
public class VariablesAccessInfo {

    private final Map<Signature, VariableAccesses> accesses;

    /**
    * Collects the accesses beneath the given node.
    *
    * @param root a statement or expression.
    * @throws InternalConsistencyError if a statement kind is not handled.
    */
    public VariablesAccessInfo(Traversable root) {
        accesses = new LinkedHashMap<Signature, VariableAccesses>();
        if (root instanceof Statement) {
            addStatement((Statement)root);
        } else if (root instanceof Expression) {
            addReads((Expression)root);
        } else {
            for (Traversable child : root.getChildren()) {
                addStatement((Statement)child);
            }
        }
    }

    /**
    * Returns the accessed signatures in order of first access.
    */
    public List<Signature> getSignatures() {
        return new ArrayList<Signature>(accesses.keySet());
    }

    /**
    * Returns the accesses to the given signature, or null if it is not
    * accessed.
    */
    public VariableAccesses get(Signature signature) {
        return accesses.get(signature);
    }

    public boolean contains(Signature signature) {
        return accesses.containsKey(signature);
    }

    public Collection<VariableAccesses> getAll() {
        return Collections.unmodifiableCollection(accesses.values());
    }

    private void addStatement(Statement stmt) {
        if (stmt instanceof Assignment) {
            Assignment assign = (Assignment)stmt;
            Reference lhs = assign.getLHS();
            for (Reference ref :
                    IRTools.getDescendentsOfType(lhs, Reference.class)) {
                addAccess(ref, AccessType.READ);
            }
            addReads(assign.getRHS());
            addAccess(lhs, AccessType.WRITE);
        } else if (stmt instanceof Loop) {
            Loop loop = (Loop)stmt;
            Symbol var = loop.getVariable();
            addAccess(new Signature(var.getName()), var,
                    new AccessInfo(AccessType.WRITE, loop, false));
            addAccess(new Signature(var.getName()), var,
                    new AccessInfo(AccessType.READ, loop, false));
            addReads(loop.getStart());
            addReads(loop.getStop());
            addReads(loop.getStep());
            addStatement(loop.getBody());
        } else if (stmt instanceof IfBlock) {
            IfBlock if_block = (IfBlock)stmt;
            addReads(if_block.getCondition());
            addStatement(if_block.getIfBody());
            if (if_block.getElseBody() != null) {
                addStatement(if_block.getElseBody());
            }
        } else if (stmt instanceof KernelCall) {
            for (Expression arg : ((KernelCall)stmt).getArguments()) {
                if (arg instanceof Reference) {
                    for (Reference ref : IRTools.getDescendentsOfType(
                            arg, Reference.class)) {
                        addAccess(ref, AccessType.READ);
                    }
                    addAccess((Reference)arg, AccessType.READWRITE);
                } else {
                    addReads(arg);
                }
            }
        } else if (stmt instanceof Directive) {
            Schedule body = ((Directive)stmt).getBody();
            if (body != null) {
                addStatement(body);
            }
        } else if (stmt instanceof Schedule) {
            for (Statement child : ((Schedule)stmt).getStatements()) {
                addStatement(child);
            }
        } else {
            throw new InternalConsistencyError("Unsupported statement '" +
                    stmt.getNodeName() + "' in variable access analysis");
        }
    }

    /**
    * Records every reference within the expression as a read.
    */
    private void addReads(Expression e) {
        DFIterator<Reference> iter =
                new DFIterator<Reference>(e, Reference.class);
        while (iter.hasNext()) {
            addAccess(iter.next(), AccessType.READ);
        }
    }

    private void addAccess(Reference ref, AccessType type) {
        addAccess(new Signature(ref.getSignature()), ref.getSymbol(),
                new AccessInfo(type, ref, AccessInfo.isIndexed(ref)));
    }

    private void addAccess(Signature signature, Symbol symbol,
                           AccessInfo access) {
        VariableAccesses var_accesses = accesses.get(signature);
        if (var_accesses == null) {
            var_accesses = new VariableAccesses(signature, symbol);
            accesses.put(signature, var_accesses);
        }
        var_accesses.add(access);
    }

    @Override
    public String toString() {
        return PrintTools.listToString(
                new ArrayList<VariableAccesses>(accesses.values()), "; ");
    }

}
