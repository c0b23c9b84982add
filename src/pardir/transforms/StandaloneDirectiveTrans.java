package pardir.transforms;

import pardir.analysis.NestingValidator;
import pardir.hir.*;

import java.util.*;

/**
* Inserts a standalone directive, such as a barrier or a taskwait, before a
* statement.
*/
public class StandaloneDirectiveTrans extends Transformation {

    private static final String tag = "[StandaloneDirectiveTrans]";

    private final DirectiveKind kind;

    /**
    * @throws IllegalArgumentException if the kind has a body.
    */
    public StandaloneDirectiveTrans(DirectiveKind kind) {
        if (kind == null || kind.hasBody()) {
            throw new IllegalArgumentException(
                    "a standalone directive needs a standalone kind: " + kind);
        }
        this.kind = kind;
    }

    public String getName() {
        return "StandaloneDirectiveTrans(" + kind.getKeyword() + ")";
    }

    public DirectiveKind getKind() {
        return kind;
    }

    /**
    * Checks that the directive may be placed before the statement.
    *
    * @throws TransformationError if the statement is not in a schedule.
    * @throws pardir.analysis.NestingError if the directive would break a
    *   nesting rule there.
    */
    public void validate(Statement stmt) {
        Schedule parent = getParentSchedule(stmt);
        NestingValidator.validate(kind, 1,
                NestingValidator.getAncestorKinds(stmt),
                Collections.<Statement>emptyList());
        NestingValidator.validatePlacement(kind, parent, stmt.getPosition());
    }

    /**
    * Inserts a new directive right before the statement.
    *
    * @return the new directive.
    */
    public Directive apply(Statement stmt) {
        validate(stmt);
        Schedule parent = (Schedule)stmt.getParent();
        Directive directive = new Directive(kind);
        parent.addStatement(stmt.getPosition(), directive);
        PrintTools.printlnStatus(1, tag, "inserted", directive.getBeginString());
        return directive;
    }

}
