package gpusync.hir;

/**
* Represents an expression having an operator and two operands.
*/
public class BinaryExpression extends Expression {

    private final BinaryOperator op;

    /**
    * Creates a binary expression.
    *
    * @param lhs the left operand.
    * @param op the operator.
    * @param rhs the right operand.
    * @throws NotAnOrphanException if an operand already has a parent.
    */
    public BinaryExpression(Expression lhs, BinaryOperator op, Expression rhs) {
        super();
        if (op == null) {
            throw new IllegalArgumentException("binary operator is null");
        }
        this.op = op;
        addChild(lhs);
        addChild(rhs);
    }

    public BinaryOperator getOperator() {
        return op;
    }

    public Expression getLHS() {
        return getChild(0);
    }

    public Expression getRHS() {
        return getChild(1);
    }

    @Override
    public BinaryExpression clone() {
        return (BinaryExpression)super.clone();
    }

    @Override
    public boolean equals(Object o) {
        return super.equals(o) && op == ((BinaryExpression)o).op;
    }

    @Override
    public String toString() {
        if (op.isFunctionForm()) {
            return op.getSymbol() + "(" + getLHS() + ", " + getRHS() + ")";
        }
        return "(" + getLHS() + " " + op.getSymbol() + " " + getRHS() + ")";
    }

    @Override
    public void accept(TraversableVisitor v) { v.visit(this); }
}
