package pardir.analysis;

import pardir.hir.*;

import java.util.*;

import static pardir.hir.DirectiveCapability.*;

/**
* Checks the legality rules of directives against their ancestor chain and
* the shape of their body. The rules only depend on the directive kind, the
* collapse depth, the kinds of the enclosing directives and the body
* statements, so a directive can be checked before it is inserted into the
* tree. Validation never modifies the tree.
*/
public final class NestingValidator {

    private static final String tag = "[NestingValidator]";

    private NestingValidator() {
    }

    /**
    * Validates a directive in place.
    *
    * @param directive the directive to be checked.
    * @throws NestingError if a rule is violated.
    */
    public static void validate(Directive directive) {
        Schedule body = directive.getBody();
        validate(directive.getKind(), directive.getCollapse(),
                getAncestorKinds(directive),
                (body == null) ? Collections.<Statement>emptyList() :
                        body.getStatements());
        Traversable parent = directive.getParent();
        validatePlacement(directive.getKind(), parent,
                (parent == null) ? 0 : directive.getPosition());
        PrintTools.printlnStatus(2, tag, "valid:", directive.getBeginString());
    }

    /**
    * Validates a directive that is described but not necessarily present in
    * the tree.
    *
    * @param kind the directive kind.
    * @param collapse the collapse depth (1 if not declared).
    * @param ancestors the kinds of the enclosing directives, nearest first.
    * @param body the statements of the body (empty for a standalone kind).
    * @throws NestingError if a rule is violated.
    */
    public static void validate(DirectiveKind kind, int collapse,
                                List<DirectiveKind> ancestors,
                                List<? extends Statement> body) {
        if (kind.hasCapability(PARALLEL_REGION)) {
            for (DirectiveKind ancestor : ancestors) {
                if (ancestor.hasCapability(PARALLEL_REGION)) {
                    throw new NestingError(NestingRule.PARALLEL_IN_PARALLEL,
                            kind, ancestor, null, "Directive '" +
                            kind.getKeyword() + "' cannot be nested inside '" +
                            ancestor.getKeyword() + "'");
                }
            }
        }
        if (kind.hasCapability(SERIAL_REGION)) {
            requireParallel(kind, ancestors, NestingRule.SERIAL_NEEDS_PARALLEL);
            for (DirectiveKind ancestor : ancestors) {
                if (ancestor.hasCapability(SERIAL_REGION)) {
                    throw new NestingError(NestingRule.SERIAL_IN_SERIAL, kind,
                            ancestor, null, "Directive '" + kind.getKeyword() +
                            "' cannot be nested inside serial region '" +
                            ancestor.getKeyword() + "'");
                }
            }
        }
        if (kind.hasCapability(ROUTINE_PROLOGUE) && !ancestors.isEmpty()) {
            throw new NestingError(NestingRule.FIRST_IN_ROUTINE, kind,
                    ancestors.get(0), null, "Directive '" + kind.getKeyword() +
                    "' cannot be placed inside '" +
                    ancestors.get(0).getKeyword() + "'");
        }
        if (kind.hasCapability(STANDALONE) &&
            !kind.hasCapability(ROUTINE_PROLOGUE)) {
            requireParallel(kind, ancestors,
                    NestingRule.STANDALONE_NEEDS_PARALLEL);
        }
        if (kind.hasCapability(TASK_UNIT) &&
            findAncestor(ancestors, SERIAL_REGION, false) == null) {
            throw missing(NestingRule.TASK_NEEDS_SERIAL, kind, SERIAL_REGION);
        }
        if (kind == DirectiveKind.DO) {
            requireParallel(kind, ancestors, NestingRule.DO_NEEDS_PARALLEL);
        }
        if (kind == DirectiveKind.LOOP &&
            findAncestor(ancestors, PARALLEL_REGION, true) == null &&
            findAncestor(ancestors, OFFLOAD_REGION, true) == null) {
            throw missing(NestingRule.LOOP_NEEDS_PARALLEL_OR_TARGET, kind,
                    PARALLEL_REGION);
        }
        if (kind.hasCapability(COMBINED)) {
            if (body.size() != 1 || !(body.get(0) instanceof Loop)) {
                throw new NestingError(NestingRule.COMBINED_STRUCTURE, kind,
                        null, null, "Directive '" + kind.getKeyword() +
                        "' must contain exactly one loop but found " +
                        describe(body));
            }
        }
        if (kind.hasCapability(LOOP_CONCURRENT)) {
            validateLoopNest(kind, collapse, body);
        }
    }

    /**
    * Checks where a directive sits among its siblings. A directive that
    * opens a routine must be child 0 of the routine; a directive without a
    * parent is accepted.
    *
    * @param kind the directive kind.
    * @param parent the node holding the directive, or null.
    * @param position the index of the directive among the children of
    *   {@code parent}.
    * @throws NestingError if the directive is misplaced.
    */
    public static void validatePlacement(DirectiveKind kind,
                                         Traversable parent, int position) {
        if (!kind.hasCapability(ROUTINE_PROLOGUE) || parent == null) {
            return;
        }
        if (!(parent instanceof Routine) || position != 0) {
            throw new NestingError(NestingRule.FIRST_IN_ROUTINE, kind, null,
                    null, "Directive '" + kind.getKeyword() + "' must be " +
                    "child 0 of a Routine but found one as child " + position +
                    " of a " + parent.getClass().getSimpleName());
        }
    }

    /**
    * Returns the kinds of the directives enclosing the node, nearest first.
    */
    public static List<DirectiveKind> getAncestorKinds(Traversable t) {
        List<DirectiveKind> ret = new ArrayList<DirectiveKind>();
        for (Directive d : IRTools.getAncestorsOfType(t, Directive.class)) {
            ret.add(d.getKind());
        }
        return ret;
    }

    private static void validateLoopNest(DirectiveKind kind, int collapse,
                                         List<? extends Statement> body) {
        if (body.size() != 1 || !(body.get(0) instanceof Loop)) {
            throw new NestingError(NestingRule.LOOP_STRUCTURE, kind, null,
                    null, "Directive '" + kind.getKeyword() +
                    "' must have exactly one loop as child but found " +
                    describe(body));
        }
        Loop loop = (Loop)body.get(0);
        for (int depth = 2; depth <= collapse; depth++) {
            List<Statement> stmts = loop.getBody().getStatements();
            if (stmts.size() != 1 || !(stmts.get(0) instanceof Loop)) {
                throw new NestingError(NestingRule.LOOP_STRUCTURE, kind,
                        null, null, "Directive '" + kind.getKeyword() +
                        "' has collapse(" + collapse + ") but the loop at " +
                        "depth " + (depth - 1) + " does not contain exactly " +
                        "one nested loop; found " + describe(stmts));
            }
            loop = (Loop)stmts.get(0);
        }
    }

    private static void requireParallel(DirectiveKind kind,
                                        List<DirectiveKind> ancestors,
                                        NestingRule rule) {
        if (findAncestor(ancestors, PARALLEL_REGION, false) == null) {
            throw missing(rule, kind, PARALLEL_REGION);
        }
    }

    /**
    * Returns the nearest ancestor with the capability; combined kinds only
    * count if {@code allow_combined} is set.
    */
    private static DirectiveKind findAncestor(List<DirectiveKind> ancestors,
                                              DirectiveCapability capability,
                                              boolean allow_combined) {
        for (DirectiveKind ancestor : ancestors) {
            if (ancestor.hasCapability(capability) &&
                (allow_combined || !ancestor.hasCapability(COMBINED))) {
                return ancestor;
            }
        }
        return null;
    }

    private static NestingError missing(NestingRule rule, DirectiveKind kind,
                                        DirectiveCapability capability) {
        return new NestingError(rule, kind, null, capability, "Directive '" +
                kind.getKeyword() + "' must be inside a " + capability +
                " directive but no such ancestor was found");
    }

    private static String describe(List<? extends Statement> stmts) {
        if (stmts.isEmpty()) {
            return "no statements";
        }
        List<String> names = new ArrayList<String>(stmts.size());
        for (Statement stmt : stmts) {
            names.add(stmt.getNodeName());
        }
        return "[" + PrintTools.listToString(names, ", ") + "]";
    }

}
