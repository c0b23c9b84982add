package pardir.hir;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

import static pardir.hir.DirectiveCapability.*;
import static pardir.hir.DirectiveParameter.*;

/**
* The kinds of directive. Each kind carries its capability set and the
* parameters it accepts; the nesting rules only look at the capabilities.
*/
public enum DirectiveKind {

    PARALLEL("parallel",
            EnumSet.of(PARALLEL_REGION),
            EnumSet.noneOf(DirectiveParameter.class)),
    PARALLEL_DO("parallel do",
            EnumSet.of(PARALLEL_REGION, LOOP_CONCURRENT, COMBINED),
            EnumSet.of(COLLAPSE, SCHEDULE)),
    DO("do",
            EnumSet.of(LOOP_CONCURRENT),
            EnumSet.of(COLLAPSE, SCHEDULE, NOWAIT)),
    LOOP("loop",
            EnumSet.of(LOOP_CONCURRENT),
            EnumSet.of(COLLAPSE)),
    TARGET("target",
            EnumSet.of(OFFLOAD_REGION),
            EnumSet.noneOf(DirectiveParameter.class)),
    SINGLE("single",
            EnumSet.of(SERIAL_REGION),
            EnumSet.of(NOWAIT)),
    MASTER("master",
            EnumSet.of(SERIAL_REGION),
            EnumSet.noneOf(DirectiveParameter.class)),
    TASK("task",
            EnumSet.of(TASK_UNIT),
            EnumSet.noneOf(DirectiveParameter.class)),
    TASKLOOP("taskloop",
            EnumSet.of(TASK_UNIT, LOOP_CONCURRENT),
            EnumSet.of(GRAINSIZE, NUM_TASKS, NOGROUP)),
    TASKWAIT("taskwait",
            EnumSet.of(STANDALONE),
            EnumSet.noneOf(DirectiveParameter.class)),
    BARRIER("barrier",
            EnumSet.of(STANDALONE),
            EnumSet.noneOf(DirectiveParameter.class)),
    DECLARE_TARGET("declare target",
            EnumSet.of(STANDALONE, ROUTINE_PROLOGUE),
            EnumSet.noneOf(DirectiveParameter.class));

    private final String keyword;

    private final Set<DirectiveCapability> capabilities;

    private final Set<DirectiveParameter> parameters;

    private DirectiveKind(String keyword,
                          EnumSet<DirectiveCapability> capabilities,
                          EnumSet<DirectiveParameter> parameters) {
        this.keyword = keyword;
        this.capabilities = Collections.unmodifiableSet(capabilities);
        this.parameters = Collections.unmodifiableSet(parameters);
    }

    /** Returns the directive name as it appears in directive text. */
    public String getKeyword() {
        return keyword;
    }

    public Set<DirectiveCapability> getCapabilities() {
        return capabilities;
    }

    public boolean hasCapability(DirectiveCapability capability) {
        return capabilities.contains(capability);
    }

    /** Returns true if the kind accepts the given parameter. */
    public boolean accepts(DirectiveParameter parameter) {
        return parameters.contains(parameter);
    }

    /** Returns true if a directive of this kind has a body. */
    public boolean hasBody() {
        return !capabilities.contains(STANDALONE);
    }

}
