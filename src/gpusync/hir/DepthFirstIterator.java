package gpusync.hir;

import java.util.ArrayList;
import java.util.LinkedList;
import java.util.List;
import java.util.NoSuchElementException;

/**
* Iterates over Traversable objects in depth-first pre-order, starting from
* the root object given to the constructor.
*/
public class DepthFirstIterator<E extends Traversable>
        implements java.util.Iterator<E> {

    private final Traversable root;

    private final LinkedList<Traversable> stack;

    // Kept as a list; a set iterator would be allocated for every node.
    private final List<Class<? extends Traversable>> prune_list;

    public DepthFirstIterator(Traversable init) {
        root = init;
        stack = new LinkedList<Traversable>();
        stack.add(init);
        prune_list = new ArrayList<Class<? extends Traversable>>(4);
    }

    public boolean hasNext() {
        return !stack.isEmpty();
    }

    @SuppressWarnings("unchecked")
    public E next() {
        if (stack.isEmpty()) {
            throw new NoSuchElementException();
        }
        Traversable t = stack.removeFirst();
        List<Traversable> children = t.getChildren();
        if (children != null && !needsPruning(t.getClass())) {
            for (int i = children.size() - 1; i >= 0; i--) {
                Traversable child = children.get(i);
                if (child != null) {
                    stack.addFirst(child);
                }
            }
        }
        return (E)t;
    }

    public void remove() {
        throw new UnsupportedOperationException();
    }

    private boolean needsPruning(Class<? extends Traversable> c) {
        for (int i = 0; i < prune_list.size(); i++) {
            if (prune_list.get(i).isAssignableFrom(c)) {
                return true;
            }
        }
        return false;
    }

    /**
    * Disables traversal into the children of objects of the given type; the
    * objects themselves are still returned.
    *
    * @param c the object type to be pruned on.
    */
    public void pruneOn(Class<? extends Traversable> c) {
        prune_list.add(c);
    }

    /**
    * Returns the remaining objects of class <b>c</b> in iteration order.
    *
    * @param c the object type to be collected.
    * @return the collected list.
    */
    public <T extends Traversable> List<T> getList(Class<T> c) {
        List<T> ret = new ArrayList<T>();
        while (hasNext()) {
            Object o = next();
            if (c.isInstance(o)) {
                ret.add(c.cast(o));
            }
        }
        return ret;
    }

    /** Restarts the iteration from the root; pruned types are kept. */
    public void reset() {
        stack.clear();
        stack.add(root);
    }
}
