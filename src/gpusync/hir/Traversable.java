package gpusync.hir;

import java.util.List;

/**
* Any class implementing this interface can be a node of the kernel IR tree.
* A traversable object knows its parent and its ordered children, and accepts
* a {@link TraversableVisitor}.
*/
public interface Traversable {

    /**
    * Returns the list of children of the object; the returned list is live
    * and must not be modified directly.
    */
    List<Traversable> getChildren();

    /** Returns the parent of the object, or null for a root. */
    Traversable getParent();

    /**
    * Sets the parent of the object. This is used internally while attaching
    * and detaching children.
    */
    void setParent(Traversable t);

    /**
    * Replaces the child at the specified position with the given object.
    *
    * @param index the position of the child.
    * @param t the new child.
    * @throws NotAnOrphanException if <b>t</b> already has a parent.
    */
    void setChild(int index, Traversable t);

    /** Dispatches to the matching {@code visit} method of the visitor. */
    void accept(TraversableVisitor v);
}
