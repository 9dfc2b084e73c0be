package gpusync.hir;

/**
* A counted loop {@code for (var = min; var < min + extent; ++var) body}.
*/
public class ForLoop extends Statement {

    private final Variable loopVar;
    private final LoopKind kind;

    /**
    * Creates a loop.
    *
    * @param loopVar the index variable.
    * @param min the first value of the index.
    * @param extent the number of iterations.
    * @param kind how iterations are executed.
    * @param body the loop body.
    */
    public ForLoop(Variable loopVar, Expression min, Expression extent,
                   LoopKind kind, Statement body) {
        super();
        if (loopVar == null || kind == null) {
            throw new IllegalArgumentException("incomplete loop header");
        }
        this.loopVar = loopVar;
        this.kind = kind;
        addChild(min);
        addChild(extent);
        addChild(body);
    }

    public Variable getLoopVariable() {
        return loopVar;
    }

    public LoopKind getKind() {
        return kind;
    }

    public Expression getMin() {
        return getExpressionChild(0);
    }

    public Expression getExtent() {
        return getExpressionChild(1);
    }

    public Statement getBody() {
        return getStatementChild(2);
    }

    /**
    * Replaces the loop body.
    *
    * @throws NotAnOrphanException if <b>body</b> already has a parent.
    */
    public void setBody(Statement body) {
        setChild(2, body);
    }

    @Override
    public String toString(int indent) {
        String var = loopVar.getSymbolName();
        return indent(indent) + "for" + (kind == LoopKind.SERIAL ? "" :
                " " + kind.name().toLowerCase()) + " (" + var + ", "
            + getMin() + ", " + getExtent() + ")" + PrintTools.line_sep
            + nested(getBody(), indent);
    }

    @Override
    public void accept(TraversableVisitor v) { v.visit(this); }
}
