package gpusync.hir;

/**
* Represents a string constant, used for the arguments of intrinsic calls
* such as the storage scope of a barrier.
*/
public class StringLiteral extends Expression {

    private final String value;

    public StringLiteral(String value) {
        super();
        if (value == null) {
            throw new IllegalArgumentException("string literal is null");
        }
        this.value = value;
    }

    /** Returns the unquoted value. */
    public String getValue() {
        return value;
    }

    @Override
    public StringLiteral clone() {
        return (StringLiteral)super.clone();
    }

    @Override
    public boolean equals(Object o) {
        return super.equals(o) && value.equals(((StringLiteral)o).value);
    }

    @Override
    public String toString() {
        return "\"" + value + "\"";
    }

    @Override
    public void accept(TraversableVisitor v) { v.visit(this); }
}
