package pardir.hir;

import java.util.List;

/** 
* Any class implementing this interface can act
* as a tree node by providing access to its children
* and parent.
*/
public interface Traversable extends Printable {

    /**
    * Provides read-only access to the children of this object. The ordering
    * of children is defined by each node kind; use the accessors of the
    * particular class to reach a specific child.
    *
    * @return the children as an unmodifiable list.
    */
    List<Traversable> getChildren();

    /**
    * Provides access to the parent of this object. Every IR object has at most
    * one parent. The parent link is used for upward queries only; it does not
    * own this object.
    *
    * @return the parent of this object.
    */
    Traversable getParent();

    /**
    * Removes the specified child.
    *
    * @param child a reference to a child object that must match with ==.
    * @throws NotAChildException if the child does not exist.
    * @throws StructuralError if the remaining children would violate the
    *   structural rule of this node kind.
    */
    void removeChild(Traversable child);

    /**
    * Sets the <var>index</var><i>th</i> child of this object to <var>t</var>.
    * The old child located at the position <var>index</var> will have a null
    * parent.
    *
    * @throws NotAnOrphanException if <var>t</var> already has a parent.
    * @throws StructuralError if the type of the new child would violate the
    *   structural rule of this node kind at position <var>index</var>.
    */
    void setChild(int index, Traversable t);

    /**
    * Sets the parent of this object. Only the parent's child setters call
    * this method, after the parent already considers this object a child.
    */
    void setParent(Traversable t);

}
