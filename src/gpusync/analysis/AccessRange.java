package gpusync.analysis;

import gpusync.hir.Expression;
import gpusync.hir.IRTools;
import gpusync.hir.Variable;

/**
 * The range of buffer indices an access may touch: an inclusive interval
 * {@code [min, max]} of possibly-symbolic bounds, a single point when both
 * bounds are the same expression, or the unknown range that may touch every
 * index. Bound expressions are private orphan copies.
 */
public final class AccessRange {
	private static final AccessRange EVERYTHING = new AccessRange(null, null);

	private final Expression min;
	private final Expression max;

	private AccessRange(Expression min, Expression max) {
		this.min = min;
		this.max = max;
	}

	/** Returns the range holding just the given index. */
	public static AccessRange point(Expression index) {
		Expression p = index.clone();
		return new AccessRange(p, p);
	}

	/**
	 * Returns the inclusive range {@code [min, max]}; structurally equal
	 * bounds yield a single point.
	 */
	public static AccessRange interval(Expression min, Expression max) {
		if( min.equals(max) ) {
			return point(min);
		}
		return new AccessRange(min.clone(), max.clone());
	}

	/** Returns the range that may touch any index. */
	public static AccessRange everything() {
		return EVERYTHING;
	}

	public boolean isEverything() {
		return min == null;
	}

	public boolean isSinglePoint() {
		return min != null && min == max;
	}

	/**
	 * Returns the index of a single-point range.
	 *
	 * @throws IllegalStateException if the range is not a single point.
	 */
	public Expression getPointValue() {
		if( !isSinglePoint() ) {
			throw new IllegalStateException("not a single point: " + this);
		}
		return min;
	}

	/** Returns the lower bound, or null for the unknown range. */
	public Expression getMin() {
		return min;
	}

	/** Returns the upper bound, or null for the unknown range. */
	public Expression getMax() {
		return max;
	}

	/**
	 * Returns the range with every reference to <b>v</b> replaced by
	 * <b>with</b>; a single point stays a single point.
	 */
	public AccessRange substitute(Variable v, Expression with) {
		if( isEverything() ) {
			return this;
		}
		Expression newMin = IRTools.replaceSymbol(min, v, with);
		if( isSinglePoint() ) {
			return new AccessRange(newMin, newMin);
		}
		return new AccessRange(newMin, IRTools.replaceSymbol(max, v, with));
	}

	@Override
	public String toString() {
		if( isEverything() ) {
			return "[*]";
		} else if( isSinglePoint() ) {
			return "[" + min + "]";
		}
		return "[" + min + ", " + max + "]";
	}
}
