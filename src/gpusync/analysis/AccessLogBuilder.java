package gpusync.analysis;

import java.util.ArrayList;
import java.util.LinkedList;
import java.util.List;

import gpusync.hir.AttributeStatement;
import gpusync.hir.BinaryExpression;
import gpusync.hir.Buffer;
import gpusync.hir.BufferLoad;
import gpusync.hir.BufferStore;
import gpusync.hir.CompoundStatement;
import gpusync.hir.Expression;
import gpusync.hir.ExpressionStatement;
import gpusync.hir.ForLoop;
import gpusync.hir.FunctionCall;
import gpusync.hir.Identifier;
import gpusync.hir.IfStatement;
import gpusync.hir.IntegerLiteral;
import gpusync.hir.KernelIntrinsics;
import gpusync.hir.Program;
import gpusync.hir.Statement;
import gpusync.hir.StorageScope;
import gpusync.hir.StringLiteral;
import gpusync.hir.Symbolic;
import gpusync.hir.ThreadExtentStatement;
import gpusync.hir.TraversableVisitor;

/**
 * Walks a kernel in program order and builds, for every nesting level, the
 * ordered log of statement records holding the accesses of that level.
 *
 * <p>
 * Only accesses in device code (below the outermost
 * {@link ThreadExtentStatement}) to storage the subclass enables are logged.
 * When a nested level closes (a loop body, a branch, a double-buffer region
 * or the whole device code), its log is handed to {@link #summarize}; the
 * reduced accesses it returns become the record of the enclosing statement at
 * the outer level. Loop summaries are relaxed over the whole iteration
 * range of the loop variable before they move outward.
 * </p>
 *
 * <p>
 * While the arms of a conditional are walked, {@link #getConditionCounter}
 * is nonzero.
 * </p>
 */
public abstract class AccessLogBuilder implements TraversableVisitor {
	/** Statement logs of the open nesting levels; the last one is innermost. */
	private final LinkedList<List<StatementEntry>> scopes;
	/** Accesses of the statement being logged, or null between statements. */
	private List<AccessEntry> current;
	private final List<ThreadBinding> envThreads;
	private boolean inDeviceEnv;
	private int conditionCounter;
	/** Buffer named by the enclosing double_buffer_write attribute. */
	private Buffer doubleBufferWrite;

	/** Prover used to relax loop summaries. */
	protected final BoundsProver prover;

	protected AccessLogBuilder(BoundsProver prover) {
		this.prover = prover;
		scopes = new LinkedList<List<StatementEntry>>();
		scopes.add(new ArrayList<StatementEntry>());
		current = null;
		envThreads = new ArrayList<ThreadBinding>();
		inDeviceEnv = false;
		conditionCounter = 0;
		doubleBufferWrite = null;
	}

	/**
	 * Checks if accesses to the buffer (null for a barrier) in the given
	 * storage scope take part in the analysis.
	 */
	protected abstract boolean isEnabled(Buffer buffer, StorageScope scope);

	/**
	 * Plans one nesting level and returns the accesses of the level that stay
	 * visible to the enclosing level.
	 *
	 * @param seq the statement records of the level in program order.
	 * @param loop the loop whose body the level is, or null.
	 */
	protected abstract List<AccessEntry> summarize(List<StatementEntry> seq,
			ForLoop loop);

	/** Returns the number of conditional arms enclosing the current point. */
	protected int getConditionCounter() {
		return conditionCounter;
	}

	/** Returns a copy of the environment threads active at the current point. */
	protected List<ThreadBinding> getEnvThreads() {
		return new ArrayList<ThreadBinding>(envThreads);
	}

	/** Checks if the current point is in device code. */
	protected boolean inDeviceEnv() {
		return inDeviceEnv;
	}

	private void append(AccessEntry e) {
		if( current == null ) {
			throw new IllegalStateException("access " + e + " outside of a statement");
		}
		current.add(e);
	}

	private boolean isLogged(Buffer buffer) {
		return inDeviceEnv && isEnabled(buffer, buffer.getScope());
	}

	/** Logs the accesses of the expressions as one record of the statement. */
	private void logStatement(Statement stmt, Expression... exprs) {
		List<AccessEntry> saved = current;
		current = new ArrayList<AccessEntry>();
		for( Expression e : exprs ) {
			e.accept(this);
		}
		pushRecord(stmt, current);
		current = saved;
	}

	private void pushRecord(Statement stmt, List<AccessEntry> accesses) {
		if( !accesses.isEmpty() ) {
			scopes.getLast().add(new StatementEntry(stmt.getId(), accesses));
		}
	}

	/** Walks the statement as a nested level and returns its summary. */
	private List<AccessEntry> summarizeNested(Statement body, ForLoop loop) {
		scopes.add(new ArrayList<StatementEntry>());
		body.accept(this);
		return summarize(scopes.removeLast(), loop);
	}

	public void visit(Program node) {
		node.getBody().accept(this);
	}

	public void visit(CompoundStatement node) {
		for( Statement stmt : node.getStatements() ) {
			stmt.accept(this);
		}
	}

	public void visit(ExpressionStatement node) {
		logStatement(node, node.getExpression());
	}

	public void visit(BufferStore node) {
		List<AccessEntry> saved = current;
		current = new ArrayList<AccessEntry>();
		node.getValue().accept(this);
		node.getIndex().accept(this);
		Buffer buffer = node.getBuffer();
		if( isLogged(buffer) ) {
			current.add(AccessEntry.access(buffer, AccessType.WRITE,
					AccessRange.point(node.getIndex()), envThreads));
		}
		pushRecord(node, current);
		current = saved;
	}

	public void visit(ForLoop node) {
		List<AccessEntry> saved = current;
		current = new ArrayList<AccessEntry>();
		node.getMin().accept(this);
		node.getExtent().accept(this);
		List<AccessEntry> accesses = current;
		current = saved;
		for( AccessEntry e : summarizeNested(node.getBody(), node) ) {
			accesses.add(relax(e, node));
		}
		pushRecord(node, accesses);
	}

	/**
	 * Widens the touched range of a body access to cover every iteration of
	 * the loop.
	 */
	private AccessEntry relax(AccessEntry e, ForLoop loop) {
		AccessRange touched = e.getTouched();
		if( e.getBuffer() == null || touched.isEverything() ) {
			return e;
		}
		prover.clear();
		prover.bind(loop.getLoopVariable(), loop.getMin(), loop.getExtent());
		Expression lb = prover.getLowerBound(touched.getMin());
		Expression ub = prover.getUpperBound(touched.getMax());
		if( lb == null || ub == null ) {
			return e.withTouched(AccessRange.everything());
		}
		return e.withTouched(AccessRange.interval(lb, ub));
	}

	public void visit(IfStatement node) {
		++conditionCounter;
		List<AccessEntry> saved = current;
		current = new ArrayList<AccessEntry>();
		node.getControlExpression().accept(this);
		List<AccessEntry> accesses = current;
		current = saved;
		accesses.addAll(summarizeNested(node.getThenStatement(), null));
		if( node.getElseStatement() != null ) {
			accesses.addAll(summarizeNested(node.getElseStatement(), null));
		}
		pushRecord(node, accesses);
		--conditionCounter;
	}

	public void visit(ThreadExtentStatement node) {
		envThreads.add(ThreadBinding.of(node));
		if( !inDeviceEnv ) {
			inDeviceEnv = true;
			// A kernel boundary synchronizes every thread, so the summary of
			// the device code is dropped.
			summarizeNested(node.getBody(), null);
			inDeviceEnv = false;
		} else {
			node.getBody().accept(this);
		}
		envThreads.remove(envThreads.size() - 1);
	}

	public void visit(AttributeStatement node) {
		if( !AttributeStatement.DOUBLE_BUFFER_WRITE.equals(node.getKey())
				|| !(node.getNode() instanceof Buffer) ) {
			node.getBody().accept(this);
			return;
		}
		if( doubleBufferWrite != null ) {
			throw new IllegalStateException("nested " + node.getKey()
					+ " regions for " + doubleBufferWrite + " and " + node.getNode());
		}
		doubleBufferWrite = (Buffer)node.getNode();
		List<AccessEntry> accesses = new ArrayList<AccessEntry>();
		for( AccessEntry e : summarizeNested(node.getBody(), null) ) {
			if( e.getType() == AccessType.WRITE && e.getBuffer() == doubleBufferWrite ) {
				accesses.add(e.withDoubleBufferWrite(true));
			} else {
				accesses.add(e);
			}
		}
		pushRecord(node, accesses);
		doubleBufferWrite = null;
	}

	public void visit(BinaryExpression node) {
		node.getLHS().accept(this);
		node.getRHS().accept(this);
	}

	public void visit(BufferLoad node) {
		Buffer buffer = node.getBuffer();
		if( isLogged(buffer) ) {
			append(AccessEntry.access(buffer, AccessType.READ,
					AccessRange.point(node.getIndex()), envThreads));
		}
		node.getIndex().accept(this);
	}

	public void visit(FunctionCall node) {
		if( node.getName().equals(KernelIntrinsics.ACCESS_PTR) ) {
			logAccessPtr(node);
		} else if( node.getName().equals(KernelIntrinsics.ADDRESS_OF) ) {
			if( !KernelIntrinsics.isWellFormed(node) ) {
				throw new IllegalArgumentException("malformed address: " + node);
			}
			// Taking the address touches no element; only the index is evaluated.
			((BufferLoad)node.getArgument(0)).getIndex().accept(this);
			return;
		} else if( node.getName().equals(KernelIntrinsics.STORAGE_SYNC) ) {
			StorageScope scope = KernelIntrinsics.getSyncScope(node);
			if( inDeviceEnv && isEnabled(null, scope) ) {
				append(AccessEntry.sync(envThreads, scope));
			}
		}
		for( int i = 0; i < node.getNumArguments(); i++ ) {
			node.getArgument(i).accept(this);
		}
	}

	private void logAccessPtr(FunctionCall node) {
		if( !KernelIntrinsics.isWellFormed(node)
				|| !(node.getArgument(2) instanceof IntegerLiteral) ) {
			throw new IllegalArgumentException("malformed access pointer: " + node);
		}
		Buffer buffer = node.getBufferArgument();
		if( !isLogged(buffer) ) {
			return;
		}
		Expression offset = node.getArgument(0);
		Expression last = Symbolic.add(Symbolic.add(offset, node.getArgument(1)), -1);
		AccessRange touched = AccessRange.interval(Symbolic.simplify(offset), last);
		long mask = ((IntegerLiteral)node.getArgument(2)).getValue();
		if( (mask & KernelIntrinsics.ACCESS_READ) != 0 ) {
			append(AccessEntry.access(buffer, AccessType.READ, touched, envThreads));
		}
		if( (mask & KernelIntrinsics.ACCESS_WRITE) != 0 ) {
			append(AccessEntry.access(buffer, AccessType.WRITE, touched, envThreads));
		}
	}

	public void visit(Identifier node) {
	}

	public void visit(IntegerLiteral node) {
	}

	public void visit(StringLiteral node) {
	}
}
