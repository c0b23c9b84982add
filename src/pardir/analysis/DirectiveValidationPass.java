package pardir.analysis;

import pardir.exec.Driver;
import pardir.hir.*;

import java.util.*;

/**
* Checks the nesting rules of every directive in the container. Routines
* listed in the skip-routines option are left out.
*/
public class DirectiveValidationPass extends AnalysisPass {

    private static final String pass_name = "[DirectiveValidation]";

    public DirectiveValidationPass(Container container) {
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
            int count = 0;
            DFIterator<Directive> iter =
                    new DFIterator<Directive>(routine, Directive.class);
            while (iter.hasNext()) {
                NestingValidator.validate(iter.next());
                count++;
            }
            PrintTools.printlnStatus(1, pass_name, routine.getName() + ":",
                    count, "directive(s) validated");
        }
    }

}
