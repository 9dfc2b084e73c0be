package gpusync.hir;

/**
* Symbolic manipulation of integer expressions through their
* {@link LinearForm}. All methods return new orphan expressions and leave
* their arguments untouched.
*/
public final class Symbolic {

    private Symbolic() {
    }

    /**
    * Returns the canonical form of the expression: like terms are combined,
    * constants folded and atoms ordered by name.
    */
    public static Expression simplify(Expression e) {
        return LinearForm.of(e).toExpression();
    }

    /** Returns the simplified sum of two expressions. */
    public static Expression add(Expression e1, Expression e2) {
        return LinearForm.of(e1).add(LinearForm.of(e2)).toExpression();
    }

    /** Returns the simplified difference of two expressions. */
    public static Expression subtract(Expression e1, Expression e2) {
        return LinearForm.of(e1).subtract(LinearForm.of(e2)).toExpression();
    }

    /** Returns the simplified sum of an expression and a constant. */
    public static Expression add(Expression e, long c) {
        return LinearForm.of(e).add(LinearForm.constant(c)).toExpression();
    }

    /**
    * Checks if two expressions have the same normal form, which implies they
    * evaluate equally.
    */
    public static boolean isEqual(Expression e1, Expression e2) {
        return LinearForm.of(e1).equals(LinearForm.of(e2));
    }
}
