package gpusync.hir;

/**
* Binary operators of the kernel IR. {@code MIN} and {@code MAX} print in
* function-call form.
*/
public enum BinaryOperator {

    ADD("+"),
    SUBTRACT("-"),
    MULTIPLY("*"),
    DIVIDE("/"),
    MODULUS("%"),
    MIN("min"),
    MAX("max"),
    COMPARE_LT("<"),
    COMPARE_LE("<="),
    COMPARE_GT(">"),
    COMPARE_GE(">="),
    COMPARE_EQ("=="),
    COMPARE_NE("!="),
    LOGICAL_AND("&&"),
    LOGICAL_OR("||");

    private final String symbol;

    private BinaryOperator(String symbol) {
        this.symbol = symbol;
    }

    /** Returns the printed form of the operator. */
    public String getSymbol() {
        return symbol;
    }

    /** Checks if the operator yields a truth value. */
    public boolean isCompare() {
        return this == COMPARE_LT || this == COMPARE_LE
            || this == COMPARE_GT || this == COMPARE_GE
            || this == COMPARE_EQ || this == COMPARE_NE;
    }

    /** Checks if the operator is printed as a function call. */
    public boolean isFunctionForm() {
        return this == MIN || this == MAX;
    }
}
