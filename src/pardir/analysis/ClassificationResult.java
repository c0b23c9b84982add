package pardir.analysis;

import pardir.hir.*;

import java.util.*;

/**
* Data-sharing classification of a parallel region: disjoint private,
* firstprivate and shared scalar lists, and the arrays shared by the team.
* All lists are sorted by name and hold lower-case names.
*/
public class ClassificationResult {

    private final List<String> private_list;

    private final List<String> firstprivate_list;

    private final List<String> shared_list;

    private final List<String> shared_arrays;

    ClassificationResult(Collection<String> private_set,
                         Collection<String> firstprivate_set,
                         Collection<String> shared_set,
                         Collection<String> shared_array_set) {
        private_list = sorted(private_set);
        firstprivate_list = sorted(firstprivate_set);
        shared_list = sorted(shared_set);
        shared_arrays = sorted(shared_array_set);
    }

    public List<String> getPrivate() {
        return private_list;
    }

    public List<String> getFirstprivate() {
        return firstprivate_list;
    }

    public List<String> getShared() {
        return shared_list;
    }

    public List<String> getSharedArrays() {
        return shared_arrays;
    }

    /**
    * Builds the clause annotation of the parallel region. Every variable that
    * is not listed as private is shared by default.
    */
    public OmpAnnotation toAnnotation() {
        OmpAnnotation ret = new OmpAnnotation(OmpAnnotation.DEFAULT, "shared");
        ret.put(OmpAnnotation.PRIVATE, new ArrayList<String>(private_list));
        ret.put(OmpAnnotation.FIRSTPRIVATE,
                new ArrayList<String>(firstprivate_list));
        Set<String> shared = new TreeSet<String>(shared_list);
        shared.addAll(shared_arrays);
        ret.put(OmpAnnotation.SHARED, new ArrayList<String>(shared));
        return ret;
    }

    private static List<String> sorted(Collection<String> names) {
        List<String> ret = new ArrayList<String>(new TreeSet<String>(names));
        return Collections.unmodifiableList(ret);
    }

    @Override
    public String toString() {
        return "private=" + private_list + " firstprivate=" +
                firstprivate_list + " shared=" + shared_list +
                " shared arrays=" + shared_arrays;
    }

}
