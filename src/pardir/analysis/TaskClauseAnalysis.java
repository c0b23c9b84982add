package pardir.analysis;

import pardir.hir.*;

import java.util.*;

/**
* Computes the data-sharing lists and the dependence clauses of a task. The
* task body must be the single loop the task is created from. Its control
* variable is private and the variables of its bounds are firstprivate. The
* statements of the loop body are then visited in program order:
* <ul>
* <li>the target of an assignment becomes shared with an {@code out}
*     dependence;</li>
* <li>a variable read by an assignment, an if condition or a loop header is
*     captured as firstprivate when it is private in the enclosing parallel
*     region; otherwise it is shared with an {@code in} dependence;</li>
* <li>the control variable of a nested loop is private.</li>
* </ul>
* Variables that are private or firstprivate in the task never produce a
* dependence.
*/
public class TaskClauseAnalysis {

    private static final String tag = "[TaskClauseAnalysis]";

    private final Directive task;

    private final Set<String> parallel_private;

    private final TaskClauses clauses;

    private final SymbolicMaths maths;

    private DependenceClauseBuilder builder;

    private TaskClauseAnalysis(Directive task,
                               Collection<String> parallel_private,
                               SymbolicMaths maths) {
        this.task = task;
        this.parallel_private = new HashSet<String>();
        for (String name : parallel_private) {
            this.parallel_private.add(name.toLowerCase());
        }
        this.clauses = new TaskClauses();
        this.maths = maths;
    }

    /**
    * Computes the clauses of a task placed in the tree. The directive nesting
    * is checked first and the private list of the enclosing parallel region
    * is obtained from its classification.
    *
    * @param task the task directive.
    * @return the clauses of the task.
    * @throws NestingError if the task is not legally nested.
    */
    public static TaskClauses computeTaskClauses(Directive task) {
        NestingValidator.validate(task);
        Directive parallel = null;
        for (Directive d : IRTools.getAncestorsOfType(task, Directive.class)) {
            if (d.hasCapability(DirectiveCapability.PARALLEL_REGION)) {
                parallel = d;
                break;
            }
        }
        if (parallel == null) {
            throw new InternalConsistencyError("Task '" +
                    task.getBeginString() + "' has no enclosing parallel " +
                    "region");
        }
        return computeTaskClauses(task,
                DataSharingAnalysis.classifyParallel(parallel).getPrivate());
    }

    /**
    * Computes the clauses of a task.
    *
    * @param task the task directive.
    * @param parallel_private the private names of the enclosing parallel
    *   region.
    * @return the clauses of the task.
    */
    public static TaskClauses computeTaskClauses(Directive task,
            Collection<String> parallel_private) {
        return computeTaskClauses(task, parallel_private, new SymbolicMaths());
    }

    /**
    * Computes the clauses of a task with the given expression service.
    *
    * @param task the task directive.
    * @param parallel_private the private names of the enclosing parallel
    *   region.
    * @param maths the expression service used for index widening.
    * @return the clauses of the task.
    * @throws UnsupportedPatternError if the task body or an access is
    *   outside the supported shapes.
    * @throws InternalConsistencyError if a variable would need two
    *   data-sharing attributes or a construct is not handled.
    */
    public static TaskClauses computeTaskClauses(Directive task,
            Collection<String> parallel_private, SymbolicMaths maths) {
        if (task == null || !task.hasCapability(DirectiveCapability.TASK_UNIT)) {
            throw new IllegalArgumentException("not a task directive: " +
                    ((task == null) ? "null" : task.getBeginString()));
        }
        if (parallel_private == null || maths == null) {
            throw new IllegalArgumentException(
                    "task analysis needs the parallel private list and maths");
        }
        TaskClauseAnalysis analysis =
                new TaskClauseAnalysis(task, parallel_private, maths);
        analysis.analyze();
        PrintTools.printlnStatus(1, tag, task.getKind().getKeyword(), ":",
                analysis.clauses);
        return analysis.clauses;
    }

    private void analyze() {
        List<Statement> stmts = task.getBody().getStatements();
        if (stmts.size() != 1 || !(stmts.get(0) instanceof Loop)) {
            throw new UnsupportedPatternError("The body of task '" +
                    task.getKind().getKeyword() + "' must be the single " +
                    "loop the task is created from");
        }
        Loop loop = (Loop)stmts.get(0);
        clauses.addPrivate(loop.getVariable().getName().toLowerCase());
        addBoundVariables(loop.getStart());
        addBoundVariables(loop.getStop());
        addBoundVariables(loop.getStep());
        builder = new DependenceClauseBuilder(clauses, parallel_private, loop,
                maths);
        visit(loop.getBody());
    }

    /**
    * Makes the variables of a bound of the task loop firstprivate.
    */
    private void addBoundVariables(Expression bound) {
        DFIterator<Reference> iter =
                new DFIterator<Reference>(bound, Reference.class);
        iter.pruneOn(Reference.class);
        while (iter.hasNext()) {
            Reference ref = iter.next();
            if (AccessInfo.isIndexed(ref)) {
                throw new UnsupportedPatternError("Array access '" + ref +
                        "' in the bounds of the task loop is not supported");
            }
            if (ref.getSymbol().isConstant()) {
                continue;
            }
            String name = ref.getName().toLowerCase();
            if (!clauses.isCaptured(name)) {
                clauses.addFirstprivate(name);
            }
        }
    }

    private void visit(Statement stmt) {
        if (stmt instanceof Schedule) {
            for (Statement child : ((Schedule)stmt).getStatements()) {
                visit(child);
            }
        } else if (stmt instanceof Assignment) {
            Assignment assign = (Assignment)stmt;
            addWrite(assign.getLHS());
            addReads(assign.getRHS());
        } else if (stmt instanceof IfBlock) {
            IfBlock if_block = (IfBlock)stmt;
            addReads(if_block.getCondition());
            visit(if_block.getIfBody());
            if (if_block.getElseBody() != null) {
                visit(if_block.getElseBody());
            }
        } else if (stmt instanceof Loop) {
            Loop loop = (Loop)stmt;
            clauses.addPrivate(loop.getVariable().getName().toLowerCase());
            addReads(loop.getStart());
            addReads(loop.getStop());
            addReads(loop.getStep());
            visit(loop.getBody());
        } else {
            throw new InternalConsistencyError("Unhandled construct '" +
                    stmt.getNodeName() + "' inside task '" +
                    task.getKind().getKeyword() + "'");
        }
    }

    private void addWrite(Reference lhs) {
        String name = lhs.getName().toLowerCase();
        if (clauses.isCaptured(name)) {
            throw new InternalConsistencyError("Variable '" + name + "' is " +
                    "written in a task where it is private or firstprivate");
        }
        if (parallel_private.contains(name)) {
            throw new InternalConsistencyError("Variable '" + name + "' is " +
                    "written in a task but is private in the enclosing " +
                    "parallel region");
        }
        DependenceToken token =
                builder.buildToken(lhs, DependenceToken.Direction.OUT);
        clauses.addShared(name);
        clauses.addToken(token);
    }

    /**
    * Handles the variables read by an expression. References nested in
    * indices are checked by the index rules of the enclosing access.
    */
    private void addReads(Expression e) {
        DFIterator<Reference> iter =
                new DFIterator<Reference>(e, Reference.class);
        iter.pruneOn(Reference.class);
        while (iter.hasNext()) {
            addRead(iter.next());
        }
    }

    private void addRead(Reference ref) {
        if (ref.getSymbol().isConstant()) {
            return;
        }
        String name = ref.getName().toLowerCase();
        if (clauses.isCaptured(name)) {
            return;
        }
        if (parallel_private.contains(name)) {
            clauses.addFirstprivate(name);
            PrintTools.printlnStatus(2, tag, name,
                    "-> firstprivate (private in the parallel region)");
            return;
        }
        DependenceToken token =
                builder.buildToken(ref, DependenceToken.Direction.IN);
        clauses.addShared(name);
        clauses.addToken(token);
    }

}
