package gpusync.analysis;

import java.util.Collection;

import gpusync.hir.BinaryExpression;
import gpusync.hir.BinaryOperator;
import gpusync.hir.Expression;
import gpusync.hir.IntegerLiteral;
import gpusync.hir.PrintTools;

/**
 * Decides whether an access may race with any of a set of pending,
 * not-yet-synchronized accesses.
 *
 * Two accesses are safe when they touch different buffers, when both touch
 * the same single index, or when the bounds prover shows their ranges are
 * disjoint. A pending double-buffer write and a plain read in the same
 * iteration are also safe under {@link #DOUBLE_BUFFER_EXEMPTION}. Anything the
 * prover cannot establish is a conflict.
 */
public class ConflictDetector {
	private static final String tag = "[ConflictDetector]";

	/**
	 * Whether a read does not conflict with a pending double-buffer write of
	 * the same iteration. Software pipelining writes the next stage of a
	 * double buffer while the current stage is read, so the two never touch
	 * the same half within one iteration; across iterations they do, and
	 * loop-carry checks never apply the exemption.
	 */
	public static final boolean DOUBLE_BUFFER_EXEMPTION = true;

	private final BoundsProver prover;

	public ConflictDetector(BoundsProver prover) {
		this.prover = prover;
	}

	/**
	 * Checks if the candidate may conflict with a pending access.
	 *
	 * @param pending the unsynchronized accesses of the opposite kind.
	 * @param candidate the access being added.
	 * @param loopCarry whether the candidate was projected into the next
	 *        iteration of the enclosing loop.
	 * @return true if a barrier is needed before the candidate.
	 */
	public boolean conflicts(Collection<AccessEntry> pending,
			AccessEntry candidate, boolean loopCarry) {
		prover.clear();
		bindThreads(candidate);
		for( AccessEntry x : pending ) {
			bindThreads(x);
		}
		for( AccessEntry x : pending ) {
			if( x.getBuffer() != candidate.getBuffer() ) {
				continue;
			}
			if( isSafe(x, candidate, loopCarry) ) {
				continue;
			}
			PrintTools.println(tag + " " + x + " conflicts with " + candidate
					+ (loopCarry ? " in the next iteration" : ""), 4);
			return true;
		}
		return false;
	}

	private void bindThreads(AccessEntry e) {
		for( ThreadBinding t : e.getThreads() ) {
			prover.bind(t.getVariable(), new IntegerLiteral(0), t.getExtent());
		}
	}

	private boolean isSafe(AccessEntry x, AccessEntry e, boolean loopCarry) {
		AccessRange r1 = x.getTouched();
		AccessRange r2 = e.getTouched();
		if( !r1.isEverything() && !r2.isEverything() ) {
			// Same index value means no conflict.
			if( r1.isSinglePoint() && r2.isSinglePoint() ) {
				Expression p1 = prover.simplify(r1.getPointValue());
				Expression p2 = prover.simplify(r2.getPointValue());
				if( p1.equals(p2) ) {
					return true;
				}
			}
			if( prover.canProve(lessThan(r1.getMax(), r2.getMin()))
					|| prover.canProve(lessThan(r2.getMax(), r1.getMin())) ) {
				return true;
			}
		}
		return DOUBLE_BUFFER_EXEMPTION && x.isDoubleBufferWrite()
			&& e.getType() == AccessType.READ && !loopCarry;
	}

	private static Expression lessThan(Expression a, Expression b) {
		return new BinaryExpression(a.clone(), BinaryOperator.COMPARE_LT, b.clone());
	}
}
