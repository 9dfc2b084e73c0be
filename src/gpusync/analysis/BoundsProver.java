package gpusync.analysis;

import gpusync.hir.Expression;
import gpusync.hir.Variable;

/**
 * Symbolic facts about integer expressions under known variable ranges.
 * A prover answers conservatively: {@link #canProve} returns false whenever
 * it cannot establish the condition, and the bound queries return null when
 * no bound is known.
 */
public interface BoundsProver {

	/** Forgets every variable range. */
	void clear();

	/**
	 * Records that <b>v</b> ranges over {@code [min, min + extent - 1]}.
	 */
	void bind(Variable v, Expression min, Expression extent);

	/**
	 * Checks if the condition holds for every value of the bound variables
	 * and every value of the free ones.
	 *
	 * @param cond a comparison, or a conjunction/disjunction of comparisons.
	 * @return true if the condition was proven.
	 */
	boolean canProve(Expression cond);

	/** Returns a canonical form of the expression. */
	Expression simplify(Expression e);

	/**
	 * Returns a lower bound of the expression in which no bound variable
	 * occurs, or null if there is none.
	 */
	Expression getLowerBound(Expression e);

	/**
	 * Returns an upper bound of the expression in which no bound variable
	 * occurs, or null if there is none.
	 */
	Expression getUpperBound(Expression e);
}
