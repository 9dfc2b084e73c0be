package gpusync.transforms;

import java.util.List;

import gpusync.analysis.ThreadSyncException;
import gpusync.hir.BinaryExpression;
import gpusync.hir.BinaryOperator;
import gpusync.hir.Expression;
import gpusync.hir.Identifier;
import gpusync.hir.IntegerLiteral;
import gpusync.hir.PrintTools;
import gpusync.hir.ThreadExtentStatement;
import gpusync.hir.ThreadScope;

/**
 * Derives the operands of a cross-block barrier from the enclosing thread
 * scopes: the number of blocks is the product of the extents of the block
 * scopes, and the leader condition holds for the thread whose every
 * thread-rank index, virtual threads included, is zero. The operands are derived once per kernel and
 * reused by every later barrier of the same kernel.
 */
public class GlobalBarrierCache {
	private static final String pass_name = "[GlobalBarrierCache]";

	private Expression numBlocks;
	private Expression isLead;
	private int numWorkDim;
	private int derivations;

	public GlobalBarrierCache() {
		reset();
		derivations = 0;
	}

	/**
	 * Returns the block count for the given thread-scope nesting, deriving it
	 * on first use. The caller must clone the result before attaching it.
	 *
	 * @throws ThreadSyncException if the nesting depth differs from the one
	 *         the cached operands were derived for.
	 */
	public Expression getNumBlocks(List<ThreadExtentStatement> threadExtents) {
		derive(threadExtents);
		return numBlocks;
	}

	/** Returns the leader condition for the given nesting; see {@link #getNumBlocks}. */
	public Expression getIsLead(List<ThreadExtentStatement> threadExtents) {
		derive(threadExtents);
		return isLead;
	}

	private void derive(List<ThreadExtentStatement> threadExtents) {
		if( numBlocks != null ) {
			if( numWorkDim != threadExtents.size() ) {
				throw new ThreadSyncException(
						ThreadSyncException.Kind.INCONSISTENT_THREAD_NESTING,
						"global barrier under " + threadExtents.size()
						+ " thread scopes, previously under " + numWorkDim);
			}
			return;
		}
		numWorkDim = threadExtents.size();
		Expression blocks = null;
		Expression lead = null;
		for( ThreadExtentStatement te : threadExtents ) {
			int rank = te.getThreadScope().getRank();
			if( rank == ThreadScope.BLOCK ) {
				Expression extent = te.getExtent().clone();
				blocks = (blocks == null) ? extent
						: new BinaryExpression(extent, BinaryOperator.MULTIPLY, blocks);
			} else if( rank == ThreadScope.THREAD ) {
				Expression cond = new BinaryExpression(new Identifier(te.getVariable()),
						BinaryOperator.COMPARE_EQ, new IntegerLiteral(0));
				lead = (lead == null) ? cond
						: new BinaryExpression(lead, BinaryOperator.LOGICAL_AND, cond);
			}
		}
		numBlocks = (blocks == null) ? new IntegerLiteral(1) : blocks;
		isLead = (lead == null) ? new IntegerLiteral(1) : lead;
		derivations++;
		PrintTools.println(pass_name + " num_blocks = " + numBlocks
				+ ", is_lead = " + isLead, 3);
	}

	/** Returns the number of times the operands were derived. */
	public int getDerivationCount() {
		return derivations;
	}

	public boolean isEmpty() {
		return numBlocks == null;
	}

	/** Forgets the operands; the next kernel derives its own. */
	public void reset() {
		numBlocks = null;
		isLead = null;
		numWorkDim = 0;
	}
}
