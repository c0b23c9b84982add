package pardir.hir;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
* Annotation is the base class of the key/value data attached to statements.
* An annotation is kept apart from the IR tree; it only records the statement
* it belongs to.
*/
public abstract class Annotation extends LinkedHashMap<String, Object> {

    private static final long serialVersionUID = 3479L;

    /** The statement having this annotation */
    protected Statement ir;

    /**
    * Constructs a new annotation.
    */
    protected Annotation() {
        super();
        ir = null;
    }

    /**
    * Returns the annotated value with the specified key.
    * @param key the given string key.
    * @return the annotated value or null (if not present).
    */
    @SuppressWarnings("unchecked")
    public <T> T get(String key) {
        return (T)super.get(key);
    }

    /**
    * Returns a string representation of the annotation. All child classes
    * of Annotation should implement their own toString() method.
    * @return the string representation.
    */
    @Override
    public abstract String toString();

    /**
    * Returns a clone of this annotation object. Collections and maps are
    * copied; other values are shared.
    * @return a cloned annotation.
    */
    @Override
    public Annotation clone() {
        Annotation o = (Annotation)super.clone();
        o.clear();
        for (Map.Entry<String, Object> entry : entrySet()) {
            o.put(entry.getKey(), cloneObject(entry.getValue()));
        }
        o.ir = null;
        return o;
    }

    private Object cloneObject(Object obj) {
        if (obj instanceof Collection) {
            List<Object> list = new ArrayList<Object>();
            for (Object val : (Collection<?>)obj) {
                list.add(cloneObject(val));
            }
            return list;
        } else if (obj instanceof Map) {
            Map<Object, Object> map = new LinkedHashMap<Object, Object>();
            for (Map.Entry<?, ?> entry : ((Map<?, ?>)obj).entrySet()) {
                map.put(entry.getKey(), cloneObject(entry.getValue()));
            }
            return map;
        }
        return obj;
    }

    /**
    * Attaches a link from this annotation to the specified statement.
    * @param ir the associated statement.
    */
    public void attach(Statement ir) {
        this.ir = ir;
    }

    /**
    * Returns the statement that contains this annotation.
    */
    public Statement getAnnotatable() {
        return ir;
    }

}
