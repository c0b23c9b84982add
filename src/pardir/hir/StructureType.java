package pardir.hir;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
* Derived (structure) datatype with named components.
*/
public class StructureType extends DataType {

    private final String name;

    private final Map<String, DataType> components;

    public StructureType(String name) {
        this.name = name;
        this.components = new LinkedHashMap<String, DataType>();
    }

    /**
    * Adds a component to the structure.
    *
    * @throws DuplicateSymbolException if a component of the name exists.
    */
    public StructureType addComponent(String component, DataType type) {
        String key = component.toLowerCase();
        if (components.containsKey(key)) {
            throw new DuplicateSymbolException("Structure type '" + name +
                    "' already has a component named '" + component + "'");
        }
        components.put(key, type);
        return this;
    }

    /** Returns the type of the named component, or null if there is none. */
    public DataType getComponentType(String component) {
        return components.get(component.toLowerCase());
    }

    public Map<String, DataType> getComponents() {
        return Collections.unmodifiableMap(components);
    }

    public String getName() {
        return name;
    }

    @Override
    public boolean isStructure() {
        return true;
    }

    @Override
    public String toString() {
        return "type(" + name + ")";
    }

}
