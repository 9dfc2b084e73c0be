package gpusync.hir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
* Base class of all expressions. Expressions are compared structurally:
* {@link #equals} holds for two expressions of the same class whose own
* fields and children are equal, with symbols compared by identity.
*/
public abstract class Expression implements Traversable, Cloneable {

    /** The parent object, or null if the expression is an orphan. */
    protected Traversable parent;

    /** The ordered child expressions. */
    protected List<Traversable> children;

    protected Expression() {
        parent = null;
        children = new ArrayList<Traversable>(2);
    }

    /**
    * Adds the given expression as the last child, setting its parent.
    *
    * @throws NotAnOrphanException if <b>e</b> already has a parent.
    */
    protected void addChild(Expression e) {
        if (e.getParent() != null) {
            throw new NotAnOrphanException(e.toString());
        }
        children.add(e);
        e.setParent(this);
    }

    /** Returns a deep copy of the expression without a parent. */
    @Override
    public Expression clone() {
        Expression o;
        try {
            o = (Expression)super.clone();
        } catch(CloneNotSupportedException e) {
            throw new InternalError();
        }
        o.parent = null;
        o.children = new ArrayList<Traversable>(children.size());
        for (int i = 0; i < children.size(); i++) {
            Expression child = ((Expression)children.get(i)).clone();
            o.children.add(child);
            child.setParent(o);
        }
        return o;
    }

    public List<Traversable> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public Traversable getParent() {
        return parent;
    }

    public void setParent(Traversable t) {
        parent = t;
    }

    public void setChild(int index, Traversable t) {
        if (!(t instanceof Expression)) {
            throw new IllegalArgumentException(
                    "child of an expression must be an expression");
        }
        if (t.getParent() != null) {
            throw new NotAnOrphanException(t.toString());
        }
        Traversable old = children.get(index);
        if (old != null) {
            old.setParent(null);
        }
        children.set(index, t);
        t.setParent(this);
    }

    /** Returns the child expression at the given position. */
    protected Expression getChild(int index) {
        return (Expression)children.get(index);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || o.getClass() != getClass()) {
            return false;
        }
        return children.equals(((Expression)o).children);
    }

    @Override
    public int hashCode() {
        return toString().hashCode();
    }
}
