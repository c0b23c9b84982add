package pardir.analysis;

import pardir.hir.*;

import java.util.*;

/**
* Builds the dependence tokens of the accesses in a task. Array indices must
* belong to a small affine class, relative to the loop the task is created
* from:
* <ul>
* <li>a plain reference to a variable that is private or firstprivate in
*     the task, or private in the enclosing parallel region (it then becomes
*     firstprivate in the task);</li>
* <li>{@code v + k}, {@code k + v} or {@code v - k} with {@code v} as above
*     and {@code k} an integer literal; the token covers every iteration of
*     the task loop, so the index becomes {@code v + (stop - start)} or
*     {@code v - (stop - start)};</li>
* <li>an integer literal, a named constant or a full-range dimension.</li>
* </ul>
* Any other index raises {@link UnsupportedPatternError}.
*/
public class DependenceClauseBuilder {

    private static final String tag = "[DependenceClauseBuilder]";

    private final TaskClauses clauses;

    private final Set<String> parallel_private;

    private final Loop task_loop;

    private final SymbolicMaths maths;

    /**
    * Constructs a builder for one task.
    *
    * @param clauses the clause lists of the task, extended with the index
    *   variables that become firstprivate.
    * @param parallel_private the private names of the enclosing parallel
    *   region, in lower case.
    * @param task_loop the loop the task is created from.
    * @param maths the expression service used to fold the loop span.
    */
    public DependenceClauseBuilder(TaskClauses clauses,
                                   Collection<String> parallel_private,
                                   Loop task_loop, SymbolicMaths maths) {
        this.clauses = clauses;
        this.parallel_private = new HashSet<String>(parallel_private);
        this.task_loop = task_loop;
        this.maths = maths;
    }

    /**
    * Builds the token for an access. A scalar or a structure accessed without
    * indices yields a token with the variable name only.
    *
    * @param ref the accessed reference.
    * @param direction the direction of the dependence.
    * @return the token.
    * @throws UnsupportedPatternError if an index is outside the supported
    *   class.
    */
    public DependenceToken buildToken(Reference ref,
                                      DependenceToken.Direction direction) {
        if (!AccessInfo.isIndexed(ref)) {
            return new DependenceToken(ref.getSymbol(),
                    Collections.<Expression>emptyList(), direction);
        }
        if (!(ref instanceof ArrayIndexed)) {
            throw new UnsupportedPatternError("Indexed structure component " +
                    "in '" + ref + "' is not supported inside a task");
        }
        List<List<Expression>> component_indices = ref.getComponentIndices();
        for (int i = 1; i < component_indices.size(); i++) {
            if (!component_indices.get(i).isEmpty()) {
                throw new UnsupportedPatternError("Indexed structure " +
                        "component in '" + ref + "' is not supported inside " +
                        "a task");
            }
        }
        ArrayAccessDescriptor descriptor = ArrayAccessModel.resolve(ref);
        List<Expression> indices = new ArrayList<Expression>();
        for (int dim = 0; dim < descriptor.getNumDimensions(); dim++) {
            indices.add(resolveIndex((ArrayIndexed)ref, dim));
        }
        DependenceToken ret = new DependenceToken(ref.getSymbol(), indices,
                direction);
        PrintTools.printlnStatus(2, tag, direction, ret);
        return ret;
    }

    /**
    * Returns the token expression of one index.
    */
    Expression resolveIndex(ArrayIndexed node, int dim) {
        Expression index = node.getIndex(dim);
        if (index instanceof Range) {
            if (!ArrayAccessModel.isFullRange(node, dim)) {
                throw new UnsupportedPatternError("Range '" + index +
                        "' that does not cover the whole dimension is not " +
                        "supported as an index inside a task");
            }
            return index.clone();
        }
        if (index instanceof Literal && ((Literal)index).isInteger()) {
            return index.clone();
        }
        if (isPlainReference(index)) {
            captureIndex((Reference)index);
            return index.clone();
        }
        if (index instanceof BinaryOperation) {
            return widen((BinaryOperation)index);
        }
        throw new UnsupportedPatternError(index.getNodeName() + " '" + index +
                "' is not allowed to appear in an array index inside a task");
    }

    /**
    * Widens {@code v +/- k} to cover every iteration of the task loop.
    */
    Expression widen(BinaryOperation bop) {
        BinaryOperation.Operator op = bop.getOperator();
        if (op != BinaryOperation.Operator.ADD &&
            op != BinaryOperation.Operator.SUB) {
            throw new UnsupportedPatternError("Operator '" + op + "' in " +
                    "index '" + bop + "' is not supported inside a task");
        }
        Reference var = null;
        if (isPlainReference(bop.getLHS()) && isIntegerLiteral(bop.getRHS())) {
            var = (Reference)bop.getLHS();
        } else if (op == BinaryOperation.Operator.ADD &&
                   isIntegerLiteral(bop.getLHS()) &&
                   isPlainReference(bop.getRHS())) {
            var = (Reference)bop.getRHS();
        } else {
            throw new UnsupportedPatternError("Index '" + bop + "' is not " +
                    "of the form variable +/- literal inside a task");
        }
        captureIndex(var);
        Expression span = maths.subtract(task_loop.getStop(),
                task_loop.getStart());
        return new BinaryOperation(op, var.clone(), span);
    }

    /**
    * Makes sure an index variable holds the same value for the whole task.
    */
    private void captureIndex(Reference var) {
        if (var.getSymbol().isConstant()) {
            return;
        }
        String name = var.getName().toLowerCase();
        if (clauses.isCaptured(name)) {
            return;
        }
        if (parallel_private.contains(name)) {
            clauses.addFirstprivate(name);
            PrintTools.printlnStatus(2, tag, name,
                    "-> firstprivate (index variable)");
            return;
        }
        throw new UnsupportedPatternError("Shared variable '" + name +
                "' used as an index inside a task is not supported");
    }

    private static boolean isPlainReference(Expression e) {
        return (e != null && e.getClass() == Reference.class);
    }

    private static boolean isIntegerLiteral(Expression e) {
        return (e instanceof Literal && ((Literal)e).isInteger());
    }

}
