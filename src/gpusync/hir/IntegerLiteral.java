package gpusync.hir;

/**
* Represents an integer constant.
*/
public class IntegerLiteral extends Expression {

    private final long value;

    public IntegerLiteral(long value) {
        super();
        this.value = value;
    }

    public long getValue() {
        return value;
    }

    @Override
    public IntegerLiteral clone() {
        return (IntegerLiteral)super.clone();
    }

    @Override
    public boolean equals(Object o) {
        return super.equals(o) && value == ((IntegerLiteral)o).value;
    }

    @Override
    public int hashCode() {
        return Long.valueOf(value).hashCode();
    }

    @Override
    public String toString() {
        return Long.toString(value);
    }

    @Override
    public void accept(TraversableVisitor v) { v.visit(this); }
}
