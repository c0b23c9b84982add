package pardir.hir;

import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
* OmpAnnotation holds the data-sharing and dependence clauses computed for a
* directive. Values of the list clauses are collections whose elements print
* as clause items; {@code default} holds a plain string.
*/
public class OmpAnnotation extends Annotation {

    private static final long serialVersionUID = 3481L;

    public static final String DEFAULT = "default";
    public static final String PRIVATE = "private";
    public static final String FIRSTPRIVATE = "firstprivate";
    public static final String SHARED = "shared";
    public static final String DEPEND_IN = "depend(in)";
    public static final String DEPEND_OUT = "depend(out)";

    // Clauses in printing order.
    private static final List<String> keywords = Arrays.asList(
            DEFAULT, PRIVATE, FIRSTPRIVATE, SHARED, DEPEND_IN, DEPEND_OUT);

    /**
    * Constructs an empty omp annotation.
    */
    public OmpAnnotation() {
        super();
    }

    /**
    * Constructs an omp annotation with the given key-value pair.
    */
    public OmpAnnotation(String key, Object value) {
        super();
        put(key, value);
    }

    // Prints one clause to sb.
    private void printClause(String key, StringBuilder sb) {
        Object value = get(key);
        if (key.equals(DEPEND_IN)) {
            sb.append("depend(in: ");
        } else if (key.equals(DEPEND_OUT)) {
            sb.append("depend(out: ");
        } else {
            sb.append(key).append("(");
        }
        if (value instanceof Collection) {
            sb.append(PrintTools.listToString(
                    Arrays.asList(((Collection<?>)value).toArray()), ", "));
        } else {
            sb.append(value);
        }
        sb.append(")");
    }

    /**
    * Returns true if the clause has a value worth printing.
    */
    private boolean isPrinted(String key) {
        Object value = get(key);
        if (value == null) {
            return false;
        }
        return !(value instanceof Collection && ((Collection<?>)value).isEmpty());
    }

    /**
    * Returns the clause text, clauses separated by commas, e.g.
    * {@code default(shared), private(a, b)}.
    * @return the string representation.
    */
    @Override
    public String toString() {
        StringBuilder str = new StringBuilder(80);
        Set<String> my_keys = new LinkedHashSet<String>(keySet());
        for (String key : keywords) {
            if (my_keys.remove(key) && isPrinted(key)) {
                if (str.length() > 0) {
                    str.append(", ");
                }
                printClause(key, str);
            }
        }
        // Remaining clauses.
        for (String key : my_keys) {
            if (isPrinted(key)) {
                if (str.length() > 0) {
                    str.append(", ");
                }
                printClause(key, str);
            }
        }
        return str.toString();
    }

    @Override
    public OmpAnnotation clone() {
        return (OmpAnnotation)super.clone();
    }

}
