package gpusync.transforms;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import gpusync.hir.ThreadExtentStatement;

/**
 * State the rewriter carries through one invocation: the stack of enclosing
 * thread scopes, the read/write statistics of global buffers and the
 * operands of the cross-block barrier.
 */
public class RewriteContext {
	private final List<ThreadExtentStatement> threadExtents;
	private final ReadWriteStatistics stats;
	private final GlobalBarrierCache barrierCache;

	public RewriteContext() {
		threadExtents = new ArrayList<ThreadExtentStatement>();
		stats = new ReadWriteStatistics();
		barrierCache = new GlobalBarrierCache();
	}

	public void pushThreadExtent(ThreadExtentStatement te) {
		threadExtents.add(te);
	}

	/**
	 * Pops the innermost thread scope.
	 *
	 * @return true if the popped scope was the outermost one, that is the
	 *         rewriter left device code.
	 */
	public boolean popThreadExtent(ThreadExtentStatement te) {
		ThreadExtentStatement top = threadExtents.remove(threadExtents.size() - 1);
		if( top != te ) {
			throw new IllegalStateException("thread scope " + te.getThreadTag()
					+ " closed out of order");
		}
		return threadExtents.isEmpty();
	}

	public boolean inThreadEnv() {
		return !threadExtents.isEmpty();
	}

	/** Returns the enclosing thread scopes, outermost first. */
	public List<ThreadExtentStatement> getThreadExtents() {
		return Collections.unmodifiableList(threadExtents);
	}

	public ReadWriteStatistics getStatistics() {
		return stats;
	}

	public GlobalBarrierCache getBarrierCache() {
		return barrierCache;
	}

	/** Clears the per-kernel state once the rewriter leaves device code. */
	public void resetKernelState() {
		stats.reset();
		barrierCache.reset();
	}
}
