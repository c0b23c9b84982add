package pardir.analysis;

import pardir.exec.Driver;
import pardir.hir.*;

import java.util.*;

/**
* Validates every directive in the container and attaches the data-sharing
* and dependence clauses to the parallel and task directives. Routines listed
* in the skip-routines option are left out.
*/
public class DirectiveClausePass extends AnalysisPass {

    private static final String pass_name = "[DirectiveClause]";

    public DirectiveClausePass(Container container) {
        super(container);
    }

    public String getPassName() {
        return pass_name;
    }

    public void start() {
        Set<String> skip_set = Driver.getSkipRoutineSet();
        for (Routine routine : container.getRoutines()) {
            if (skip_set.contains(routine.getName().toLowerCase())) {
                PrintTools.printlnStatus(1, pass_name, "skipping routine",
                        routine.getName());
                continue;
            }
            List<Directive> directives = new ArrayList<Directive>();
            DFIterator<Directive> iter =
                    new DFIterator<Directive>(routine, Directive.class);
            while (iter.hasNext()) {
                directives.add(iter.next());
            }
            for (Directive directive : directives) {
                NestingValidator.validate(directive);
                OmpAnnotation clauses = computeClauses(directive);
                if (clauses != null) {
                    directive.setClauses(clauses);
                    PrintTools.printlnStatus(1, pass_name,
                            directive.getBeginString());
                }
            }
        }
    }

    /**
    * Computes the clause annotation of a directive that is already in the
    * tree.
    *
    * @param directive the directive.
    * @return the clauses of a parallel region or a task, or null for the
    *   other kinds.
    */
    public static OmpAnnotation computeClauses(Directive directive) {
        if (directive.hasCapability(DirectiveCapability.PARALLEL_REGION)) {
            return DataSharingAnalysis.classifyParallel(directive)
                    .toAnnotation();
        }
        if (directive.getKind() == DirectiveKind.TASK) {
            return TaskClauseAnalysis.computeTaskClauses(directive)
                    .toAnnotation();
        }
        return null;
    }

}
