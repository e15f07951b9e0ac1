package svlower.hir;

import java.util.List;

/**
* Any class implementing this interface can act as a tree node by providing
* access to its children and parent.
*/
public interface Traversable extends Printable {

    /**
    * Provides access to the children of this object as a list. The ordering
    * of the list is the structural (execution) order of the children.
    *
    * @return the children as a list.
    */
    List<Traversable> getChildren();

    /**
    * Provides access to the parent of this object. Every IR object has at
    * most one parent.
    *
    * @return the parent of this object.
    */
    Traversable getParent();

    /**
    * Removes the specified child.
    *
    * @param child a reference to a child object that must match with ==.
    * @throws NotAChildException if the child does not exist.
    * @throws UnsupportedOperationException if the child exists but the
    *   parent refuses to let it go. A loop, for instance, refuses to remove
    *   its condition because that would lead to invalid IR.
    */
    void removeChild(Traversable child);

    /**
    * Sets the <var>index</var><i>th</i> child of this object to <var>t</var>.
    * The old child located at that position ends up with a null parent.
    *
    * @throws NotAnOrphanException if <var>t</var> already has a parent.
    * @throws IllegalArgumentException if the type of the new child would
    *   violate a class invariant by becoming the <var>index</var><i>th</i>
    *   child.
    */
    void setChild(int index, Traversable t);

    /**
    * Sets the parent of this object. The intent is that this object first
    * becomes a child of another object, and then is told who its parent is.
    */
    void setParent(Traversable t);

}
