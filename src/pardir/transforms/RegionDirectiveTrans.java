package pardir.transforms;

import pardir.analysis.DirectiveClausePass;
import pardir.analysis.NestingValidator;
import pardir.hir.*;

import java.util.*;

/**
* Encloses a contiguous run of statements of one schedule in a new region
* directive. The nesting rules are checked for the new directive and for
* every directive inside the enclosed statements before the tree changes.
* Clauses of parallel and task directives are computed after the change; if
* that fails the tree is restored and the error is passed on.
* <pre>
*   RegionDirectiveTrans trans =
*       new RegionDirectiveTrans(DirectiveKind.PARALLEL_DO).setCollapse(2);
*   Directive directive = trans.apply(loop_nest);
* </pre>
*/
public class RegionDirectiveTrans extends Transformation {

    private static final String tag = "[RegionDirectiveTrans]";

    /** Carries the kind and parameters of the directives to be created. */
    private final Directive prototype;

    /**
    * Constructs the transformation for a region kind.
    *
    * @throws IllegalArgumentException if the kind is standalone.
    */
    public RegionDirectiveTrans(DirectiveKind kind) {
        if (kind == null || !kind.hasBody()) {
            throw new IllegalArgumentException(
                    "a region directive needs a region kind: " + kind);
        }
        prototype = new Directive(kind);
    }

    public String getName() {
        return "RegionDirectiveTrans(" + prototype.getKind().getKeyword() + ")";
    }

    public DirectiveKind getKind() {
        return prototype.getKind();
    }

    public RegionDirectiveTrans setCollapse(int collapse) {
        prototype.setCollapse(collapse);
        return this;
    }

    public RegionDirectiveTrans setGrainsize(int grainsize) {
        prototype.setGrainsize(grainsize);
        return this;
    }

    public RegionDirectiveTrans setNumTasks(int num_tasks) {
        prototype.setNumTasks(num_tasks);
        return this;
    }

    public RegionDirectiveTrans setNogroup(boolean nogroup) {
        prototype.setNogroup(nogroup);
        return this;
    }

    public RegionDirectiveTrans setNowait(boolean nowait) {
        prototype.setNowait(nowait);
        return this;
    }

    public RegionDirectiveTrans setSchedule(String schedule) {
        prototype.setSchedule(schedule);
        return this;
    }

    /**
    * Checks that the statements can be enclosed in the directive. The tree is
    * not modified.
    *
    * @param nodes the statements to be enclosed, in order.
    * @throws TransformationError if the statements are not contiguous
    *   siblings of one schedule.
    * @throws pardir.analysis.NestingError if the new directive or a
    *   directive inside the statements would break a nesting rule.
    */
    public void validate(List<? extends Statement> nodes) {
        if (nodes == null || nodes.isEmpty()) {
            throw new TransformationError(getName() +
                    " needs at least one statement");
        }
        Schedule parent = getParentSchedule(nodes.get(0));
        int position = nodes.get(0).getPosition();
        for (int i = 1; i < nodes.size(); i++) {
            Statement stmt = nodes.get(i);
            if (stmt == null || stmt.getParent() != parent ||
                stmt.getPosition() != position + i) {
                throw new TransformationError(getName() + " can only " +
                        "enclose contiguous statements of one schedule");
            }
        }
        List<DirectiveKind> outer =
                NestingValidator.getAncestorKinds(nodes.get(0));
        NestingValidator.validate(prototype.getKind(),
                prototype.getCollapse(), outer, nodes);

        // directives inside the statements get the new directive as ancestor
        for (Statement stmt : nodes) {
            DFIterator<Directive> iter =
                    new DFIterator<Directive>(stmt, Directive.class);
            while (iter.hasNext()) {
                Directive inner = iter.next();
                List<DirectiveKind> ancestors = new ArrayList<DirectiveKind>();
                for (Directive d :
                        IRTools.getAncestorsOfType(inner, Directive.class)) {
                    if (!IRTools.isDescendantOf(d, parent)) {
                        break;
                    }
                    ancestors.add(d.getKind());
                }
                ancestors.add(prototype.getKind());
                ancestors.addAll(outer);
                Schedule body = inner.getBody();
                NestingValidator.validate(inner.getKind(),
                        inner.getCollapse(), ancestors,
                        (body == null) ? Collections.<Statement>emptyList() :
                                body.getStatements());
            }
        }
    }

    /**
    * Encloses the statements in a new directive.
    *
    * @param nodes the statements to be enclosed, in order.
    * @return the new directive, now holding the statements.
    */
    public Directive apply(List<? extends Statement> nodes) {
        validate(nodes);
        Schedule parent = (Schedule)nodes.get(0).getParent();
        List<Statement> original = parent.getStatements();
        int position = nodes.get(0).getPosition();

        Directive directive = prototype.clone();
        List<Statement> replaced = new ArrayList<Statement>(
                original.subList(0, position));
        replaced.add(directive);
        replaced.addAll(original.subList(position + nodes.size(),
                original.size()));
        parent.setStatements(replaced);
        directive.getBody().setStatements(nodes);

        try {
            OmpAnnotation clauses = DirectiveClausePass.computeClauses(directive);
            if (clauses != null) {
                directive.setClauses(clauses);
            }
        } catch (RuntimeException e) {
            PrintTools.printlnStatus(1, tag, "restoring the tree:",
                    e.getMessage());
            directive.getBody().setStatements(
                    Collections.<Statement>emptyList());
            parent.setStatements(original);
            throw e;
        }
        PrintTools.printlnStatus(1, tag, "inserted", directive.getBeginString());
        return directive;
    }

}
