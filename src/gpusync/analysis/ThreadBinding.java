package gpusync.analysis;

import gpusync.hir.Expression;
import gpusync.hir.ThreadExtentStatement;
import gpusync.hir.ThreadScope;
import gpusync.hir.Variable;

/**
 * An environment thread: a thread index variable together with its position
 * in the launch hierarchy and its extent. While the binding is active the
 * variable ranges over {@code [0, extent - 1]}.
 */
public final class ThreadBinding {
	private final Variable var;
	private final String threadTag;
	private final ThreadScope scope;
	private final Expression extent;

	public ThreadBinding(Variable var, String threadTag, Expression extent) {
		this.var = var;
		this.threadTag = threadTag;
		this.scope = ThreadScope.parse(threadTag);
		this.extent = extent.clone();
	}

	/** Returns the binding established by a thread extent statement. */
	public static ThreadBinding of(ThreadExtentStatement stmt) {
		return new ThreadBinding(stmt.getVariable(), stmt.getThreadTag(),
				stmt.getExtent());
	}

	public Variable getVariable() {
		return var;
	}

	public String getThreadTag() {
		return threadTag;
	}

	public ThreadScope getThreadScope() {
		return scope;
	}

	/** Returns the extent; callers must clone it before attaching it. */
	public Expression getExtent() {
		return extent;
	}

	@Override
	public String toString() {
		return var + ":" + threadTag + "<" + extent + ">";
	}
}
