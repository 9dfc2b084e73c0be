package gpusync.hir;

/**
* Evaluates an expression for its side effects, typically an intrinsic call.
*/
public class ExpressionStatement extends Statement {

    public ExpressionStatement(Expression expr) {
        super();
        addChild(expr);
    }

    public Expression getExpression() {
        return getExpressionChild(0);
    }

    @Override
    public String toString(int indent) {
        return indent(indent) + getExpression() + ";" + PrintTools.line_sep;
    }

    @Override
    public void accept(TraversableVisitor v) { v.visit(this); }
}
