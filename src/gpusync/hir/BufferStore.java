package gpusync.hir;

/**
* Writes one element of a buffer: {@code buffer[index] = value}.
*/
public class BufferStore extends Statement {

    private final Buffer buffer;

    public BufferStore(Buffer buffer, Expression index, Expression value) {
        super();
        if (buffer == null) {
            throw new IllegalArgumentException("store to null buffer");
        }
        this.buffer = buffer;
        addChild(index);
        addChild(value);
    }

    public Buffer getBuffer() {
        return buffer;
    }

    public Expression getIndex() {
        return getExpressionChild(0);
    }

    public Expression getValue() {
        return getExpressionChild(1);
    }

    @Override
    public String toString(int indent) {
        return indent(indent) + buffer.getSymbolName() + "[" + getIndex()
            + "] = " + getValue() + ";" + PrintTools.line_sep;
    }

    @Override
    public void accept(TraversableVisitor v) { v.visit(this); }
}
