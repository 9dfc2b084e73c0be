package gpusync.analysis;

import java.util.LinkedHashMap;
import java.util.Map;

import gpusync.hir.BinaryExpression;
import gpusync.hir.BinaryOperator;
import gpusync.hir.Expression;
import gpusync.hir.LinearForm;
import gpusync.hir.PrintTools;
import gpusync.hir.Symbolic;
import gpusync.hir.Variable;

/**
 * A set of symbolic value ranges of integer variables, used as the default
 * {@link BoundsProver}.
 *
 * Expressions are brought into {@link LinearForm}; a bound of a form is
 * obtained by replacing each bound variable with its lower or upper bound,
 * depending on the sign of its coefficient, until no bound variable remains.
 * Bounds may themselves be symbolic. A comparison is proven when the bound of
 * the difference of its operands is a constant of the right sign.
 */
public class RangeDomain implements BoundsProver {
	private static final String tag = "[RangeDomain]";

	/** Variable to its {lower, upper} bound. */
	private final Map<Variable, LinearForm[]> ranges;

	public RangeDomain() {
		ranges = new LinkedHashMap<Variable, LinearForm[]>();
	}

	public void clear() {
		ranges.clear();
	}

	public void bind(Variable v, Expression min, Expression extent) {
		LinearForm lb = LinearForm.of(min);
		LinearForm ub = lb.add(LinearForm.of(extent)).subtract(LinearForm.constant(1));
		ranges.put(v, new LinearForm[] {lb, ub});
	}

	/** Checks if a range is known for the variable. */
	public boolean isBound(Variable v) {
		return ranges.containsKey(v);
	}

	public Expression simplify(Expression e) {
		return Symbolic.simplify(e);
	}

	public Expression getLowerBound(Expression e) {
		LinearForm f = bound(LinearForm.of(e), false);
		return (f == null) ? null : f.toExpression();
	}

	public Expression getUpperBound(Expression e) {
		LinearForm f = bound(LinearForm.of(e), true);
		return (f == null) ? null : f.toExpression();
	}

	/**
	 * Eliminates the bound variables from the form.
	 *
	 * @param f the form to be bounded.
	 * @param upper whether to compute the upper bound.
	 * @return the bound, or null if a bound variable hides in an opaque atom
	 *         or the ranges refer to each other cyclically.
	 */
	private LinearForm bound(LinearForm f, boolean upper) {
		LinearForm ret = f;
		// Symbolic bounds may mention other bound variables; cap the rounds
		// so that cyclic ranges terminate.
		int limit = 4 * (ranges.size() + 1);
		for( int step = 0; step < limit; step++ ) {
			Variable next = firstBoundVariable(ret);
			if( next == null ) {
				break;
			}
			long c = ret.getCoefficient(next);
			LinearForm[] range = ranges.get(next);
			ret = ret.substitute(next, ((c > 0) == upper) ? range[1] : range[0]);
		}
		if( firstBoundVariable(ret) != null ) {
			return null;
		}
		for( Variable v : ranges.keySet() ) {
			if( ret.dependsOn(v) ) {
				return null;
			}
		}
		return ret;
	}

	private Variable firstBoundVariable(LinearForm f) {
		for( Object atom : f.getAtoms() ) {
			if( atom instanceof Variable && ranges.containsKey(atom) ) {
				return (Variable)atom;
			}
		}
		return null;
	}

	public boolean canProve(Expression cond) {
		boolean ret = prove(cond);
		PrintTools.println(tag + " " + cond + (ret ? " proven" : " not proven"), 4);
		return ret;
	}

	private boolean prove(Expression cond) {
		if( !(cond instanceof BinaryExpression) ) {
			return false;
		}
		BinaryExpression be = (BinaryExpression)cond;
		Expression lhs = be.getLHS();
		Expression rhs = be.getRHS();
		switch( be.getOperator() ) {
		case LOGICAL_AND:
			return prove(lhs) && prove(rhs);
		case LOGICAL_OR:
			return prove(lhs) || prove(rhs);
		case COMPARE_LT:
			return upperBelow(difference(lhs, rhs), 0);
		case COMPARE_LE:
			return upperBelow(difference(lhs, rhs), 1);
		case COMPARE_GT:
			return upperBelow(difference(rhs, lhs), 0);
		case COMPARE_GE:
			return upperBelow(difference(rhs, lhs), 1);
		case COMPARE_EQ:
			return difference(lhs, rhs).equals(LinearForm.constant(0));
		case COMPARE_NE:
			return upperBelow(difference(lhs, rhs), 0)
				|| upperBelow(difference(rhs, lhs), 0);
		default:
			return false;
		}
	}

	private static LinearForm difference(Expression e1, Expression e2) {
		return LinearForm.of(e1).subtract(LinearForm.of(e2));
	}

	/** Checks if the upper bound of the form is a constant below the limit. */
	private boolean upperBelow(LinearForm f, long limit) {
		LinearForm ub = bound(f, true);
		return ub != null && ub.isConstant() && ub.getConstant() < limit;
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder(80);
		sb.append("{");
		boolean first = true;
		for( Map.Entry<Variable, LinearForm[]> range : ranges.entrySet() ) {
			if( !first ) {
				sb.append(", ");
			}
			sb.append(range.getKey()).append("=[").append(range.getValue()[0])
				.append(", ").append(range.getValue()[1]).append("]");
			first = false;
		}
		sb.append("}");
		return sb.toString();
	}
}
