package pardir.hir;

/**
* Properties of a directive kind that the nesting rules are stated over.
*/
public enum DirectiveCapability {
    /** Creates a team of threads. */
    PARALLEL_REGION,
    /** Executed by a single thread of the team. */
    SERIAL_REGION,
    /** Has no body. */
    STANDALONE,
    /** Creates deferred units of work. */
    TASK_UNIT,
    /** Distributes the iterations of the loop beneath it. */
    LOOP_CONCURRENT,
    /** Parallel region and loop distribution in one directive. */
    COMBINED,
    /** Offloads its body to a device. */
    OFFLOAD_REGION,
    /** Placed as the first statement of a routine. */
    ROUTINE_PROLOGUE
}
