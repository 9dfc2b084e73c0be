package gpusync.hir;

/**
* Reads one element of a buffer: {@code buffer[index]}.
*/
public class BufferLoad extends Expression {

    private final Buffer buffer;

    public BufferLoad(Buffer buffer, Expression index) {
        super();
        if (buffer == null) {
            throw new IllegalArgumentException("load from null buffer");
        }
        this.buffer = buffer;
        addChild(index);
    }

    public Buffer getBuffer() {
        return buffer;
    }

    public Expression getIndex() {
        return getChild(0);
    }

    @Override
    public BufferLoad clone() {
        return (BufferLoad)super.clone();
    }

    @Override
    public boolean equals(Object o) {
        return super.equals(o) && buffer == ((BufferLoad)o).buffer;
    }

    @Override
    public String toString() {
        return buffer.getSymbolName() + "[" + getIndex() + "]";
    }

    @Override
    public void accept(TraversableVisitor v) { v.visit(this); }
}
