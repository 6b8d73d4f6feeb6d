package polyc.hir;

import java.util.List;

/**
* A node of the IR tree. Statement bodies of a scop and the generated loop
* tree are both made of traversable objects; each node has at most one
* parent and lists its children in printing order, which is also the order
* in which accesses are numbered.
*/
public interface Traversable extends Printable {

    /** Returns the children in printing order. */
    List<Traversable> getChildren();

    /** Returns the parent, or null for a root. */
    Traversable getParent();

    /**
    * Sets the <var>index</var><i>th</i> child of this object to <var>t</var>.
    * The old child loses its parent.
    *
    * @throws NotAnOrphanException if <var>t</var> already has a parent.
    * @throws IllegalArgumentException if the new child is of a kind this
    *   node cannot hold.
    */
    void setChild(int index, Traversable t);

    /**
    * Sets the parent of this object; called by the parent when it takes or
    * gives up the object.
    */
    void setParent(Traversable t);

}
