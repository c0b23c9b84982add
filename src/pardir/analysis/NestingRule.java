package pardir.analysis;

/**
* The legality rules on the placement and shape of directives.
*/
public enum NestingRule {
    SERIAL_NEEDS_PARALLEL(
            "a serial region must be inside a non-combined parallel region"),
    SERIAL_IN_SERIAL(
            "a serial region must not be inside another serial region"),
    STANDALONE_NEEDS_PARALLEL(
            "a standalone directive must be inside a non-combined parallel region"),
    TASK_NEEDS_SERIAL(
            "a task directive must be inside a serial region"),
    PARALLEL_IN_PARALLEL(
            "parallel regions cannot be nested"),
    LOOP_STRUCTURE(
            "a loop directive must contain exactly one loop and, with collapse, "
            + "a perfect nest of that depth"),
    COMBINED_STRUCTURE(
            "a combined directive must contain exactly one loop"),
    DO_NEEDS_PARALLEL(
            "a do directive must be inside a non-combined parallel region"),
    LOOP_NEEDS_PARALLEL_OR_TARGET(
            "a loop directive must be inside a parallel or target region"),
    FIRST_IN_ROUTINE(
            "a declare target directive must be the first statement of a routine");

    private final String description;

    private NestingRule(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
