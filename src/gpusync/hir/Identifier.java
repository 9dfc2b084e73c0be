package gpusync.hir;

/**
* A reference to a {@link Variable}. Identifiers are equal when they refer to
* the same variable object.
*/
public class Identifier extends Expression {

    private final Variable var;

    public Identifier(Variable var) {
        super();
        if (var == null) {
            throw new IllegalArgumentException("identifier without variable");
        }
        this.var = var;
    }

    /** Returns the referenced variable. */
    public Variable getVariable() {
        return var;
    }

    @Override
    public Identifier clone() {
        return (Identifier)super.clone();
    }

    @Override
    public boolean equals(Object o) {
        return super.equals(o) && var == ((Identifier)o).var;
    }

    @Override
    public int hashCode() {
        return System.identityHashCode(var);
    }

    @Override
    public String toString() {
        return var.getSymbolName();
    }

    @Override
    public void accept(TraversableVisitor v) { v.visit(this); }
}
