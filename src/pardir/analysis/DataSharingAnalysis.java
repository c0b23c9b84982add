package pardir.analysis;

import pardir.hir.*;

import java.util.*;

/**
* Data-sharing classification of the variables used in a parallel region.
* <p>
* Every variable accessed in the region body is visited in program order.
* A scalar accessed once is shared. A scalar accessed more than once is
* private if its first access is a write inside a loop of the region, since
* every iteration then defines the value before it uses it; otherwise it is
* shared. Arrays are never privatized and are reported separately. Variables
* that a called kernel declares locally are always private. Compile-time
* constants appear in no list.
* <pre>
*   k = 5                 ! k: first access is a write outside any loop
*   do i = 1, n           ! i: written by the loop header -&gt; private
*     tmp = a(i)          ! tmp: first access is a write in a loop -&gt; private
*     b(i) = tmp * k      ! a, b: shared arrays; k, n: shared
*   enddo
* </pre>
*/
public final class DataSharingAnalysis {

    private static final String tag = "[DataSharingAnalysis]";

    private DataSharingAnalysis() {
    }

    /**
    * Classifies the variables of a parallel region, resolving names in the
    * table of the scope enclosing the region.
    *
    * @param region the directive whose body is classified.
    * @return the classification.
    */
    public static ClassificationResult classifyParallel(Directive region) {
        ScopingNode scope = region.getScope();
        return classifyParallel(region,
                (scope == null) ? null : scope.getSymbolTable());
    }

    /**
    * Classifies the variables of a parallel region.
    *
    * @param region the directive whose body is classified.
    * @param symtab the table used to resolve accessed names; an access whose
    *   name is not found there is resolved to the symbol of the access.
    * @return the classification; lists are sorted by name.
    * @throws IllegalArgumentException if the directive has no body.
    * @throws InternalConsistencyError if a kernel reports an empty local
    *   variable name or the body holds a statement that is not handled.
    */
    public static ClassificationResult classifyParallel(Directive region,
                                                        SymbolTable symtab) {
        if (region == null || region.getBody() == null) {
            throw new IllegalArgumentException(
                    "only a region directive can be classified");
        }
        Set<String> private_set = new TreeSet<String>();
        Set<String> firstprivate_set = new TreeSet<String>();
        Set<String> shared_set = new TreeSet<String>();
        Set<String> shared_arrays = new TreeSet<String>();

        Set<String> kernel_locals = collectKernelLocals(region);

        VariablesAccessInfo info = new VariablesAccessInfo(region.getBody());
        for (Signature signature : info.getSignatures()) {
            VariableAccesses accesses = info.get(signature);
            String name = signature.getVarName();
            Symbol symbol = resolve(symtab, name, accesses.getSymbol());
            if (symbol.isConstant() || kernel_locals.contains(name)) {
                continue;
            }
            if (accesses.isArray() || symbol.isArray()) {
                shared_arrays.add(name);
                PrintTools.printlnStatus(2, tag, signature, "-> shared array");
            } else if (signature.isStructure()) {
                // components of a structure are never privatized
                shared_set.add(name);
                PrintTools.printlnStatus(2, tag, signature, "-> shared");
            } else if (accesses.size() == 1) {
                shared_set.add(name);
                PrintTools.printlnStatus(2, tag, signature,
                        "-> shared (single access)");
            } else if (isWrittenFirstInLoop(accesses.getFirst(), region)) {
                private_set.add(name);
                PrintTools.printlnStatus(2, tag, signature,
                        "-> private (written first in a loop)");
            } else {
                shared_set.add(name);
                PrintTools.printlnStatus(2, tag, signature, "-> shared");
            }
        }
        for (String name : kernel_locals) {
            private_set.add(name);
            PrintTools.printlnStatus(2, tag, name, "-> private (kernel local)");
        }
        shared_set.removeAll(private_set);
        // a structure with an indexed component is listed once, as an array
        shared_set.removeAll(shared_arrays);

        ClassificationResult ret = new ClassificationResult(private_set,
                firstprivate_set, shared_set, shared_arrays);
        PrintTools.printlnStatus(1, tag, region.getKind().getKeyword(), ":",
                ret);
        return ret;
    }

    private static boolean isWrittenFirstInLoop(AccessInfo first,
                                                Directive region) {
        return (first.getAccessType() == AccessType.WRITE &&
                first.getEnclosingLoop(region) != null);
    }

    private static Set<String> collectKernelLocals(Directive region) {
        Set<String> ret = new LinkedHashSet<String>();
        DFIterator<KernelCall> iter =
                new DFIterator<KernelCall>(region.getBody(), KernelCall.class);
        while (iter.hasNext()) {
            KernelCall call = iter.next();
            for (String local : call.getLocalVariables()) {
                if (local == null || local.trim().length() == 0) {
                    throw new InternalConsistencyError("Kernel '" +
                            call.getName() + "' reports a local variable " +
                            "without a name");
                }
                ret.add(local.trim().toLowerCase());
            }
        }
        return ret;
    }

    private static Symbol resolve(SymbolTable symtab, String name,
                                  Symbol fallback) {
        if (symtab != null) {
            Symbol symbol = symtab.lookup(name);
            if (symbol != null) {
                return symbol;
            }
        }
        return fallback;
    }

}
