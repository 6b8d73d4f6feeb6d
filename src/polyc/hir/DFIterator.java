package polyc.hir;

import java.util.ArrayList;
import java.util.LinkedList;
import java.util.List;
import java.util.NoSuchElementException;

/**
* Iterates over the IR tree in depth-first pre-order, returning the objects of
* a requested type. Subtrees rooted at objects of a pruned type are not
* entered, although the pruned object itself is still returned. Enumerating
* the accesses of a statement body with
* <pre>
*   DFIterator&lt;AccessExpression&gt; iter =
*       new DFIterator&lt;AccessExpression&gt;(body, AccessExpression.class);
*   iter.pruneOn(AccessExpression.class);
* </pre>
* yields them in the order used for re-indexing.
*/
public class DFIterator<E extends Traversable> {

    private final Traversable root;

    private final Class<? extends Traversable> type;

    private final List<Class<? extends Traversable>> pruned_on =
            new ArrayList<Class<? extends Traversable>>(2);

    // Nodes still to visit; the head is visited first.
    private final LinkedList<Traversable> pending = new LinkedList<Traversable>();

    private Traversable next;

    public DFIterator(Traversable root) {
        this(root, Traversable.class);
    }

    /**
    * Creates an iterator returning the objects of type <var>c</var> under
    * <var>root</var>, including <var>root</var> itself.
    */
    public DFIterator(Traversable root, Class<? extends Traversable> c) {
        this.root = root;
        this.type = c;
        reset();
    }

    public boolean hasNext() {
        while (next == null && !pending.isEmpty()) {
            Traversable t = pending.removeFirst();
            if (!isPruned(t)) {
                List<Traversable> children = t.getChildren();
                for (int i = children.size() - 1; i >= 0; i--) {
                    pending.addFirst(children.get(i));
                }
            }
            if (type.isInstance(t)) {
                next = t;
            }
        }
        return next != null;
    }

    @SuppressWarnings("unchecked")
    public E next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        E ret = (E)next;
        next = null;
        return ret;
    }

    /** Disables traversal into objects of type <var>c</var>. */
    public void pruneOn(Class<? extends Traversable> c) {
        pruned_on.add(c);
    }

    /** Restarts the iteration from the root. */
    public void reset() {
        pending.clear();
        pending.add(root);
        next = null;
    }

    private boolean isPruned(Traversable t) {
        for (Class<? extends Traversable> c : pruned_on) {
            if (c.isInstance(t)) {
                return true;
            }
        }
        return false;
    }

    /** Returns all objects from the root on, as a list. */
    public List<E> getList() {
        List<E> ret = new ArrayList<E>();
        reset();
        while (hasNext()) {
            ret.add(next());
        }
        return ret;
    }

}
