package pardir.hir;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
* Parallelisation directive. A directive of a region kind owns exactly one
* child, the body schedule; a standalone directive has no children. The kind
* tag decides the capabilities, the accepted parameters and the directive
* text; computed clause data is kept in an {@link OmpAnnotation}.
*/
public class Directive extends Statement {

    private final DirectiveKind kind;

    private Map<DirectiveParameter, Object> parameters;

    private OmpAnnotation clauses;

    /**
    * Constructs a directive of the given kind; a region kind receives an
    * empty body.
    */
    public Directive(DirectiveKind kind) {
        this(kind, (kind != null && kind.hasBody()) ? new Schedule() : null);
    }

    /**
    * Constructs a directive with the given body.
    *
    * @param kind the directive kind.
    * @param body the body, which must be null for a standalone kind.
    * @throws StructuralError if a standalone kind is given a body or a region
    *   kind is given none.
    */
    public Directive(DirectiveKind kind, Schedule body) {
        super();
        if (kind == null) {
            throw new IllegalArgumentException("directive needs a kind");
        }
        this.kind = kind;
        this.parameters =
                new EnumMap<DirectiveParameter, Object>(DirectiveParameter.class);
        this.clauses = null;
        if (!kind.hasBody() && body != null) {
            throw new StructuralError("Directive '" + kind.getKeyword() +
                    "' is standalone and cannot have a body");
        }
        List<Traversable> list = new ArrayList<Traversable>(1);
        if (body != null) {
            list.add(body);
        }
        replaceChildren(list);
    }

    public DirectiveKind getKind() {
        return kind;
    }

    public boolean hasCapability(DirectiveCapability capability) {
        return kind.hasCapability(capability);
    }

    /**
    * Returns the body of a region directive, or null for a standalone one.
    */
    public Schedule getBody() {
        return (children.isEmpty()) ? null : (Schedule)children.get(0);
    }

    /* Parameters */

    /**
    * Sets the number of nested loops distributed by the directive.
    *
    * @throws StructuralError if the kind does not accept the parameter or the
    *   value is not positive.
    */
    public Directive setCollapse(int collapse) {
        return setPositive(DirectiveParameter.COLLAPSE, collapse);
    }

    /**
    * Sets the grainsize of a task loop.
    *
    * @throws StructuralError if num_tasks is already set.
    */
    public Directive setGrainsize(int grainsize) {
        checkExclusive(DirectiveParameter.GRAINSIZE,
                DirectiveParameter.NUM_TASKS);
        return setPositive(DirectiveParameter.GRAINSIZE, grainsize);
    }

    /**
    * Sets the number of tasks of a task loop.
    *
    * @throws StructuralError if grainsize is already set.
    */
    public Directive setNumTasks(int num_tasks) {
        checkExclusive(DirectiveParameter.NUM_TASKS,
                DirectiveParameter.GRAINSIZE);
        return setPositive(DirectiveParameter.NUM_TASKS, num_tasks);
    }

    public Directive setNogroup(boolean nogroup) {
        return setFlag(DirectiveParameter.NOGROUP, nogroup);
    }

    public Directive setNowait(boolean nowait) {
        return setFlag(DirectiveParameter.NOWAIT, nowait);
    }

    /**
    * Sets the loop schedule, e.g. {@code static} or {@code dynamic, 4}.
    */
    public Directive setSchedule(String schedule) {
        checkAccepted(DirectiveParameter.SCHEDULE);
        if (schedule == null || schedule.trim().length() == 0) {
            throw new StructuralError("Directive '" + kind.getKeyword() +
                    "' needs a non-empty schedule");
        }
        parameters.put(DirectiveParameter.SCHEDULE, schedule.trim());
        return this;
    }

    /**
    * Returns the collapse depth; 1 if it was not declared.
    */
    public int getCollapse() {
        Integer ret = (Integer)parameters.get(DirectiveParameter.COLLAPSE);
        return (ret == null) ? 1 : ret.intValue();
    }

    /**
    * Returns the value of a parameter, or null if it was not declared.
    */
    public Object getParameter(DirectiveParameter parameter) {
        return parameters.get(parameter);
    }

    public Map<DirectiveParameter, Object> getParameters() {
        return Collections.unmodifiableMap(parameters);
    }

    private void checkAccepted(DirectiveParameter parameter) {
        if (!kind.accepts(parameter)) {
            throw new StructuralError("Directive '" + kind.getKeyword() +
                    "' does not accept the '" + parameter.getKeyword() +
                    "' parameter");
        }
    }

    private void checkExclusive(DirectiveParameter parameter,
                                DirectiveParameter other) {
        if (parameters.containsKey(other)) {
            throw new StructuralError("Directive '" + kind.getKeyword() +
                    "' cannot declare both '" + parameter.getKeyword() +
                    "' and '" + other.getKeyword() + "'");
        }
    }

    private Directive setPositive(DirectiveParameter parameter, int value) {
        checkAccepted(parameter);
        if (value < 1) {
            throw new StructuralError("Parameter '" + parameter.getKeyword() +
                    "' of directive '" + kind.getKeyword() +
                    "' must be positive but found " + value);
        }
        parameters.put(parameter, Integer.valueOf(value));
        return this;
    }

    private Directive setFlag(DirectiveParameter parameter, boolean value) {
        checkAccepted(parameter);
        if (value) {
            parameters.put(parameter, Boolean.TRUE);
        } else {
            parameters.remove(parameter);
        }
        return this;
    }

    /* Clause data */

    /**
    * Returns the clause annotation, or null if no clauses were computed.
    */
    public OmpAnnotation getClauses() {
        return clauses;
    }

    /**
    * Attaches clause data to the directive, replacing any earlier one.
    */
    public void setClauses(OmpAnnotation clauses) {
        if (clauses != null) {
            clauses.attach(this);
        }
        this.clauses = clauses;
    }

    /* Text contract */

    /**
    * Returns the text opening the directive, e.g.
    * {@code omp taskloop grainsize(32) nogroup} or
    * {@code omp parallel default(shared), private(i)}.
    */
    public String getBeginString() {
        StringBuilder sb = new StringBuilder(80);
        sb.append("omp ").append(kind.getKeyword());
        for (Map.Entry<DirectiveParameter, Object> entry :
                parameters.entrySet()) {
            sb.append(" ").append(entry.getKey().getKeyword());
            if (!entry.getKey().isFlag()) {
                sb.append("(").append(entry.getValue()).append(")");
            }
        }
        if (clauses != null) {
            String clause_text = clauses.toString();
            if (clause_text.length() > 0) {
                sb.append(" ").append(clause_text);
            }
        }
        return sb.toString();
    }

    /**
    * Returns the text closing a region directive, e.g.
    * {@code omp end parallel do}, or null for a standalone directive.
    */
    public String getEndString() {
        if (!kind.hasBody()) {
            return null;
        }
        return "omp end " + kind.getKeyword();
    }

    @Override
    protected boolean isValidChild(int position, Traversable child) {
        return (position == 0 && child instanceof Schedule &&
                !(child instanceof Routine));
    }

    @Override
    protected boolean isValidArity(int size) {
        return (size == ((kind.hasBody()) ? 1 : 0));
    }

    @Override
    protected String getChildrenFormat() {
        return (kind.hasBody()) ? "Schedule" : "<LeafNode>";
    }

    @Override
    public String getNodeName() {
        return "Directive[" + kind.getKeyword() + "]";
    }

    public void print(PrintWriter o) {
        o.print("!$" + getBeginString());
        if (kind.hasBody()) {
            o.println();
            getBody().print(o);
            o.print("!$" + getEndString());
        }
    }

    @Override
    public Directive clone() {
        Directive o = (Directive)super.clone();
        o.parameters =
                new EnumMap<DirectiveParameter, Object>(parameters);
        o.clauses = null;
        if (clauses != null) {
            o.setClauses(clauses.clone());
        }
        return o;
    }

}
