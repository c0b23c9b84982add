package pardir.analysis;

import java.util.*;

/**
* Name path of an accessed variable, e.g. {@code grid%data} for any access to
* the {@code data} component of {@code grid} regardless of indices. Component
* names are kept in lower case.
*/
public final class Signature implements Comparable<Signature> {

    private final List<String> components;

    public Signature(List<String> components) {
        if (components == null || components.isEmpty()) {
            throw new IllegalArgumentException("signature needs a name");
        }
        List<String> list = new ArrayList<String>(components.size());
        for (String component : components) {
            list.add(component.toLowerCase());
        }
        this.components = Collections.unmodifiableList(list);
    }

    public Signature(String name) {
        this(Collections.singletonList(name));
    }

    /** Returns the name of the base variable. */
    public String getVarName() {
        return components.get(0);
    }

    public List<String> getComponents() {
        return components;
    }

    /** Returns true if the signature reaches into a structure. */
    public boolean isStructure() {
        return (components.size() > 1);
    }

    @Override
    public boolean equals(Object o) {
        return (o instanceof Signature &&
                components.equals(((Signature)o).components));
    }

    @Override
    public int hashCode() {
        return components.hashCode();
    }

    public int compareTo(Signature other) {
        return toString().compareTo(other.toString());
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(32);
        for (String component : components) {
            if (sb.length() > 0) {
                sb.append("%");
            }
            sb.append(component);
        }
        return sb.toString();
    }

}
