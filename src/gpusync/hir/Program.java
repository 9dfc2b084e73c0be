package gpusync.hir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
* The root of a kernel IR tree. A program owns the arena of its statements:
* {@link #number} gives each statement a stable integer identity that indexes
* the arena, and identities survive any later insertion of statements.
*/
public final class Program implements Traversable {

    private final String name;
    private final List<Traversable> children;
    private final List<Statement> arena;

    /**
    * Creates a program with the given body.
    *
    * @param name the kernel name, used in messages.
    * @param body the kernel body.
    * @throws NotAnOrphanException if <b>body</b> already has a parent.
    */
    public Program(String name, Statement body) {
        this.name = name;
        this.children = new ArrayList<Traversable>(1);
        this.arena = new ArrayList<Statement>();
        if (body.getParent() != null) {
            throw new NotAnOrphanException();
        }
        children.add(body);
        body.setParent(this);
    }

    public String getName() {
        return name;
    }

    public Statement getBody() {
        return (Statement)children.get(0);
    }

    /**
    * Assigns identities to every statement that has none, in pre-order, and
    * registers them in the arena.
    *
    * @return the number of statements in the arena.
    * @throws IllegalStateException if a statement carries an identity that
    *         belongs to another program.
    */
    public int number() {
        DepthFirstIterator<Statement> iter =
                new DepthFirstIterator<Statement>(this);
        iter.pruneOn(Expression.class);
        List<Statement> stmts = iter.getList(Statement.class);
        for (int i = 0; i < stmts.size(); i++) {
            Statement stmt = stmts.get(i);
            int id = stmt.getId();
            if (id == Statement.NO_ID) {
                stmt.setId(arena.size());
                arena.add(stmt);
            } else if (id >= arena.size() || arena.get(id) != stmt) {
                throw new IllegalStateException("statement " + id
                        + " does not belong to program " + name);
            }
        }
        return arena.size();
    }

    /**
    * Returns the statement with the given identity.
    *
    * @throws IndexOutOfBoundsException if no such statement was numbered.
    */
    public Statement getStatement(int id) {
        return arena.get(id);
    }

    public List<Traversable> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public Traversable getParent() {
        return null;
    }

    public void setParent(Traversable t) {
        throw new UnsupportedOperationException("a program has no parent");
    }

    public void setChild(int index, Traversable t) {
        if (index != 0 || !(t instanceof Statement)) {
            throw new IllegalArgumentException(
                    "the only child of a program is its body statement");
        }
        if (t.getParent() != null) {
            throw new NotAnOrphanException();
        }
        children.get(0).setParent(null);
        children.set(0, t);
        t.setParent(this);
    }

    @Override
    public String toString() {
        return "// kernel " + name + PrintTools.line_sep + getBody();
    }

    public void accept(TraversableVisitor v) { v.visit(this); }
}
