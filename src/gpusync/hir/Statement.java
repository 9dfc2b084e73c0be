package gpusync.hir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
* Base class for all statements.
*
* <p>
* Every statement reachable from a {@link Program} carries a stable integer
* identity, its index in the program's statement arena. The identity is
* assigned once by {@link Program#number} and is never changed by later
* rewriting, so analyses can key their results by it.
* </p>
*/
public abstract class Statement implements Traversable {

    /** Identity of a statement that was never numbered. */
    public static final int NO_ID = -1;

    /** The parent object, or null if the statement is an orphan. */
    protected Traversable parent;

    /** The ordered children; expressions and statements. */
    protected List<Traversable> children;

    private int id;

    protected Statement() {
        parent = null;
        children = new ArrayList<Traversable>(4);
        id = NO_ID;
    }

    /**
    * Returns the arena identity of the statement, or {@link #NO_ID} if it was
    * never numbered.
    */
    public int getId() {
        return id;
    }

    /** Assigns the arena identity; called by {@link Program#number} only. */
    void setId(int id) {
        if (this.id != NO_ID && this.id != id) {
            throw new IllegalStateException(
                    "statement identity is already " + this.id);
        }
        this.id = id;
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

    /**
    * Adds the given object as the last child.
    *
    * @throws NotAnOrphanException if <b>t</b> already has a parent.
    */
    protected void addChild(Traversable t) {
        if (t.getParent() != null) {
            throw new NotAnOrphanException(t.getClass().getName());
        }
        children.add(t);
        t.setParent(this);
    }

    public void setChild(int index, Traversable t) {
        if (t != null && t.getParent() != null) {
            throw new NotAnOrphanException(t.getClass().getName());
        }
        Traversable old = children.get(index);
        if (old != null) {
            old.setParent(null);
        }
        children.set(index, t);
        if (t != null) {
            t.setParent(this);
        }
    }

    /** Returns the expression child at the given position. */
    protected Expression getExpressionChild(int index) {
        return (Expression)children.get(index);
    }

    /** Returns the statement child at the given position, possibly null. */
    protected Statement getStatementChild(int index) {
        return (Statement)children.get(index);
    }

    /**
    * Returns the text of the statement indented by the given number of
    * levels; each line ends with a line separator.
    */
    public abstract String toString(int indent);

    @Override
    public String toString() {
        return toString(0);
    }

    /** Indentation prefix for the given nesting level. */
    protected static String indent(int level) {
        StringBuilder sb = new StringBuilder(level * 2);
        for (int i = 0; i < level; i++) {
            sb.append("  ");
        }
        return sb.toString();
    }

    /** Prints a nested statement, adding braces unless it is a block. */
    protected static String nested(Statement body, int indent) {
        if (body instanceof CompoundStatement) {
            return body.toString(indent);
        }
        return indent(indent) + "{" + PrintTools.line_sep
            + body.toString(indent + 1)
            + indent(indent) + "}" + PrintTools.line_sep;
    }
}
