package pardir.hir;

/**
* Parameters a directive may declare besides its clause data.
*/
public enum DirectiveParameter {
    COLLAPSE("collapse"),
    GRAINSIZE("grainsize"),
    NUM_TASKS("num_tasks"),
    NOGROUP("nogroup"),
    NOWAIT("nowait"),
    SCHEDULE("schedule");

    private final String keyword;

    private DirectiveParameter(String keyword) {
        this.keyword = keyword;
    }

    /** Returns the keyword of the parameter in directive text. */
    public String getKeyword() {
        return keyword;
    }

    /** Returns true if the parameter is a flag without a value. */
    public boolean isFlag() {
        return (this == NOGROUP || this == NOWAIT);
    }

}
