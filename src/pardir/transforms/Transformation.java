package pardir.transforms;

import pardir.hir.*;

/**
* Base class of the transformations that insert directives into the tree.
* A transformation checks everything it can before it touches the tree and
* leaves the tree as it was when it fails.
*/
public abstract class Transformation {

    /** Constructor for derived classes. */
    protected Transformation() {
    }

    /** Returns the name of the transformation */
    public abstract String getName();

    /**
    * Returns the schedule holding the statement.
    *
    * @throws TransformationError if the statement is not in a schedule.
    */
    protected Schedule getParentSchedule(Statement stmt) {
        if (stmt == null) {
            throw new TransformationError(getName() +
                    " cannot be applied to a null statement");
        }
        if (!(stmt.getParent() instanceof Schedule)) {
            throw new TransformationError(getName() + " can only be applied " +
                    "to statements of a schedule but '" + stmt.getNodeName() +
                    "' is not in one");
        }
        return (Schedule)stmt.getParent();
    }

}
