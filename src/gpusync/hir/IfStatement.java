package gpusync.hir;

/**
* A conditional statement with an optional else branch.
*/
public class IfStatement extends Statement {

    public IfStatement(Expression condition, Statement thenStmt) {
        this(condition, thenStmt, null);
    }

    public IfStatement(Expression condition,
                       Statement thenStmt, Statement elseStmt) {
        super();
        addChild(condition);
        addChild(thenStmt);
        if (elseStmt != null) {
            addChild(elseStmt);
        }
    }

    public Expression getControlExpression() {
        return getExpressionChild(0);
    }

    public Statement getThenStatement() {
        return getStatementChild(1);
    }

    /** Returns the else branch, or null. */
    public Statement getElseStatement() {
        return (children.size() > 2) ? getStatementChild(2) : null;
    }

    @Override
    public String toString(int indent) {
        StringBuilder sb = new StringBuilder(80);
        sb.append(indent(indent)).append("if (")
          .append(getControlExpression()).append(")")
          .append(PrintTools.line_sep);
        sb.append(nested(getThenStatement(), indent));
        if (getElseStatement() != null) {
            sb.append(indent(indent)).append("else")
              .append(PrintTools.line_sep);
            sb.append(nested(getElseStatement(), indent));
        }
        return sb.toString();
    }

    @Override
    public void accept(TraversableVisitor v) { v.visit(this); }
}
