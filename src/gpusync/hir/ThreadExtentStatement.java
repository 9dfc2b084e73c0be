package gpusync.hir;

/**
* Binds a thread index of the launch hierarchy for the duration of its body:
* every logical thread executes the body with {@code var} set to its own
* index in {@code [0, extent)}. The outermost such statement marks entry into
* device code.
*/
public class ThreadExtentStatement extends Statement {

    private final Variable var;
    private final String threadTag;
    private final ThreadScope scope;

    /**
    * Creates a thread scope.
    *
    * @param var the thread index variable.
    * @param threadTag the thread tag, such as {@code threadIdx.x}.
    * @param extent the number of threads along this dimension.
    * @param body the statement executed by every thread.
    * @throws IllegalArgumentException if the thread tag is unknown.
    */
    public ThreadExtentStatement(Variable var, String threadTag,
                                 Expression extent, Statement body) {
        super();
        if (var == null) {
            throw new IllegalArgumentException("thread scope without index");
        }
        this.var = var;
        this.threadTag = threadTag;
        this.scope = ThreadScope.parse(threadTag);
        addChild(extent);
        addChild(body);
    }

    public Variable getVariable() {
        return var;
    }

    public String getThreadTag() {
        return threadTag;
    }

    public ThreadScope getThreadScope() {
        return scope;
    }

    public Expression getExtent() {
        return getExpressionChild(0);
    }

    public Statement getBody() {
        return getStatementChild(1);
    }

    /**
    * Replaces the body.
    *
    * @throws NotAnOrphanException if <b>body</b> already has a parent.
    */
    public void setBody(Statement body) {
        setChild(1, body);
    }

    @Override
    public String toString(int indent) {
        return indent(indent) + "// attr [" + var.getSymbolName() + " : "
            + threadTag + "] thread_extent = " + getExtent()
            + PrintTools.line_sep + nested(getBody(), indent);
    }

    @Override
    public void accept(TraversableVisitor v) { v.visit(this); }
}
