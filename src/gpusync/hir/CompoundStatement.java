package gpusync.hir;

import java.util.ArrayList;
import java.util.List;

/**
* A sequence of statements executed in order, printed as a braced block.
*/
public class CompoundStatement extends Statement {

    public CompoundStatement() {
        super();
    }

    /**
    * Creates a block holding the given statements.
    *
    * @throws NotAnOrphanException if a statement already has a parent.
    */
    public CompoundStatement(List<? extends Statement> stmts) {
        super();
        for (Statement stmt : stmts) {
            addStatement(stmt);
        }
    }

    /**
    * Appends a statement to the block.
    *
    * @throws NotAnOrphanException if <b>stmt</b> already has a parent.
    */
    public void addStatement(Statement stmt) {
        addChild(stmt);
    }

    /**
    * Inserts a statement immediately before a child statement.
    *
    * @param ref the child before which to insert.
    * @param stmt the new statement; must be an orphan.
    * @throws NotAChildException if <b>ref</b> is not a child of the block.
    */
    public void addStatementBefore(Statement ref, Statement stmt) {
        int index = Tools.identityIndexOf(children, ref);
        if (index < 0) {
            throw new NotAChildException();
        }
        if (stmt.getParent() != null) {
            throw new NotAnOrphanException();
        }
        children.add(index, stmt);
        stmt.setParent(this);
    }

    /** Returns the statements of the block as a new list. */
    public List<Statement> getStatements() {
        List<Statement> ret = new ArrayList<Statement>(children.size());
        for (int i = 0; i < children.size(); i++) {
            ret.add((Statement)children.get(i));
        }
        return ret;
    }

    /** Returns the number of statements in the block. */
    public int countStatements() {
        return children.size();
    }

    @Override
    public String toString(int indent) {
        StringBuilder sb = new StringBuilder(80);
        sb.append(indent(indent)).append("{").append(PrintTools.line_sep);
        for (int i = 0; i < children.size(); i++) {
            sb.append(((Statement)children.get(i)).toString(indent + 1));
        }
        sb.append(indent(indent)).append("}").append(PrintTools.line_sep);
        return sb.toString();
    }

    @Override
    public void accept(TraversableVisitor v) { v.visit(this); }
}
