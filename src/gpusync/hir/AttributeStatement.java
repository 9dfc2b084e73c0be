package gpusync.hir;

/**
* Attaches a keyed attribute about a symbol to a statement. The kernel IR uses
* attributes for facts that hold within the body, such as which buffer is the
* write side of a double buffer.
*/
public class AttributeStatement extends Statement {

    /** The body writes the next stage of the named double buffer. */
    public static final String DOUBLE_BUFFER_WRITE = "double_buffer_write";

    /** Accesses to the named buffer within the body must not be cached. */
    public static final String VOLATILE_SCOPE = "volatile_scope";

    private final Symbol node;
    private final String key;

    /**
    * Creates an attribute statement.
    *
    * @param node the symbol the attribute is about.
    * @param key the attribute key.
    * @param value the attribute value.
    * @param body the statement the attribute applies to.
    */
    public AttributeStatement(Symbol node, String key,
                              Expression value, Statement body) {
        super();
        if (key == null) {
            throw new IllegalArgumentException("attribute key is null");
        }
        this.node = node;
        this.key = key;
        addChild(value);
        addChild(body);
    }

    public Symbol getNode() {
        return node;
    }

    public String getKey() {
        return key;
    }

    public Expression getValue() {
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
        return indent(indent) + "// attr ["
            + (node == null ? "" : node.getSymbolName()) + "] " + key
            + " = " + getValue() + PrintTools.line_sep
            + nested(getBody(), indent);
    }

    @Override
    public void accept(TraversableVisitor v) { v.visit(this); }
}
