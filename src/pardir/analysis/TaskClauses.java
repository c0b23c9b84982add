package pardir.analysis;

import pardir.hir.*;

import java.util.*;

/**
* Data-sharing lists and dependence tokens of a task, in the order in which
* the analysis first met each name. Names are in lower case.
*/
public class TaskClauses {

    private final List<String> private_list;

    private final List<String> firstprivate_list;

    private final List<String> shared_list;

    private final List<DependenceToken> in_tokens;

    private final List<DependenceToken> out_tokens;

    TaskClauses() {
        private_list = new ArrayList<String>();
        firstprivate_list = new ArrayList<String>();
        shared_list = new ArrayList<String>();
        in_tokens = new ArrayList<DependenceToken>();
        out_tokens = new ArrayList<DependenceToken>();
    }

    public List<String> getPrivate() {
        return Collections.unmodifiableList(private_list);
    }

    public List<String> getFirstprivate() {
        return Collections.unmodifiableList(firstprivate_list);
    }

    public List<String> getShared() {
        return Collections.unmodifiableList(shared_list);
    }

    public List<DependenceToken> getInTokens() {
        return Collections.unmodifiableList(in_tokens);
    }

    public List<DependenceToken> getOutTokens() {
        return Collections.unmodifiableList(out_tokens);
    }

    /** Returns true if the name is private or firstprivate in the task. */
    public boolean isCaptured(String name) {
        return (private_list.contains(name) || firstprivate_list.contains(name));
    }

    boolean isPrivate(String name) {
        return private_list.contains(name);
    }

    boolean isFirstprivate(String name) {
        return firstprivate_list.contains(name);
    }

    void addPrivate(String name) {
        if (firstprivate_list.contains(name) || shared_list.contains(name)) {
            throw new InternalConsistencyError("Variable '" + name +
                    "' cannot become private in the task: it is already " +
                    (firstprivate_list.contains(name) ? "firstprivate" :
                    "shared"));
        }
        if (!private_list.contains(name)) {
            private_list.add(name);
        }
    }

    void addFirstprivate(String name) {
        if (private_list.contains(name) || shared_list.contains(name)) {
            throw new InternalConsistencyError("Variable '" + name +
                    "' cannot become firstprivate in the task: it is already " +
                    (private_list.contains(name) ? "private" : "shared"));
        }
        if (!firstprivate_list.contains(name)) {
            firstprivate_list.add(name);
        }
    }

    void addShared(String name) {
        if (isCaptured(name)) {
            throw new InternalConsistencyError("Variable '" + name +
                    "' cannot become shared in the task: it is already " +
                    (private_list.contains(name) ? "private" : "firstprivate"));
        }
        if (!shared_list.contains(name)) {
            shared_list.add(name);
        }
    }

    void addToken(DependenceToken token) {
        if (!shared_list.contains(token.getName())) {
            throw new InternalConsistencyError("Dependence on '" + token +
                    "' is only allowed for a shared variable");
        }
        List<DependenceToken> list =
                (token.getDirection() == DependenceToken.Direction.IN) ?
                in_tokens : out_tokens;
        if (!list.contains(token)) {
            list.add(token);
        }
    }

    /**
    * Builds the clause annotation of the task.
    */
    public OmpAnnotation toAnnotation() {
        OmpAnnotation ret = new OmpAnnotation();
        ret.put(OmpAnnotation.PRIVATE, new ArrayList<String>(private_list));
        ret.put(OmpAnnotation.FIRSTPRIVATE,
                new ArrayList<String>(firstprivate_list));
        ret.put(OmpAnnotation.SHARED, new ArrayList<String>(shared_list));
        ret.put(OmpAnnotation.DEPEND_IN,
                new ArrayList<DependenceToken>(in_tokens));
        ret.put(OmpAnnotation.DEPEND_OUT,
                new ArrayList<DependenceToken>(out_tokens));
        return ret;
    }

    @Override
    public String toString() {
        return "private=" + private_list + " firstprivate=" +
                firstprivate_list + " shared=" + shared_list + " in=" +
                in_tokens + " out=" + out_tokens;
    }

}
