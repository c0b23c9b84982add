package pardir.analysis;

import pardir.hir.DirectiveCapability;
import pardir.hir.DirectiveKind;

/**
* Thrown when a directive violates a nesting rule. The error names the rule
* and either the offending ancestor or the capability of the ancestor that
* could not be found.
*/
public class NestingError extends RuntimeException {

    private static final long serialVersionUID = 3503L;

    private final NestingRule rule;

    private final DirectiveKind kind;

    private final DirectiveKind offending_ancestor;

    private final DirectiveCapability missing_capability;

    public NestingError(NestingRule rule, DirectiveKind kind,
                        DirectiveKind offending_ancestor,
                        DirectiveCapability missing_capability,
                        String message) {
        super(message + " (rule " + rule + ": " + rule.getDescription() + ")");
        this.rule = rule;
        this.kind = kind;
        this.offending_ancestor = offending_ancestor;
        this.missing_capability = missing_capability;
    }

    public NestingRule getRule() {
        return rule;
    }

    /** Returns the kind of the directive that was checked. */
    public DirectiveKind getKind() {
        return kind;
    }

    /** Returns the ancestor that violates the rule, or null. */
    public DirectiveKind getOffendingAncestor() {
        return offending_ancestor;
    }

    /** Returns the capability of the required but missing ancestor, or null. */
    public DirectiveCapability getMissingCapability() {
        return missing_capability;
    }

}
