package gpusync.transforms;

import java.util.List;

import gpusync.analysis.SyncSet;
import gpusync.hir.AttributeStatement;
import gpusync.hir.BinaryExpression;
import gpusync.hir.Buffer;
import gpusync.hir.BufferLoad;
import gpusync.hir.BufferStore;
import gpusync.hir.CompoundStatement;
import gpusync.hir.ExpressionStatement;
import gpusync.hir.ForLoop;
import gpusync.hir.FunctionCall;
import gpusync.hir.IRTools;
import gpusync.hir.Identifier;
import gpusync.hir.IfStatement;
import gpusync.hir.IntegerLiteral;
import gpusync.hir.KernelIntrinsics;
import gpusync.hir.PrintTools;
import gpusync.hir.Program;
import gpusync.hir.Statement;
import gpusync.hir.StorageRank;
import gpusync.hir.StorageScope;
import gpusync.hir.StringLiteral;
import gpusync.hir.ThreadExtentStatement;
import gpusync.hir.TraversableVisitor;

/**
 * Rewrites a program in place so that a barrier of the target storage scope
 * executes immediately before every statement the planner flagged.
 *
 * <p>
 * Barriers of block-local scopes are plain {@code storage_sync("scope")}
 * calls. A barrier of the global scope spans every block of the launch: it
 * carries the leader condition and the block count of the enclosing thread
 * scopes, and the kernel that contains it is set up for it when the rewriter
 * leaves the kernel's outermost thread scope. The setup calls
 * {@code prepare_global_barrier()} before the kernel, initializes the barrier
 * state with {@code global_barrier_kinit()} at the top of the kernel body,
 * and marks every global buffer that the kernel both reads and writes as
 * {@code volatile_scope}.
 * </p>
 */
public class ThreadSyncInserter implements TraversableVisitor {
	private static final String pass_name = "[ThreadSyncInserter]";

	private final StorageScope syncScope;
	private final SyncSet syncs;
	private final RewriteContext context;
	private int numInserted;

	public ThreadSyncInserter(StorageScope syncScope, SyncSet syncs) {
		this.syncScope = syncScope;
		this.syncs = syncs;
		this.context = new RewriteContext();
		this.numInserted = 0;
	}

	/**
	 * Inserts the barriers into the program. A program without flagged
	 * statements is left untouched.
	 *
	 * @return the number of barriers inserted.
	 */
	public int insert(Program program) {
		if( syncs.isEmpty() ) {
			return 0;
		}
		program.accept(this);
		return numInserted;
	}

	public RewriteContext getContext() {
		return context;
	}

	private boolean isGlobalTarget() {
		return syncScope.getRank() == StorageRank.GLOBAL;
	}

	private boolean isCounted(Buffer buffer) {
		return isGlobalTarget() && buffer.getScope().getRank() == StorageRank.GLOBAL;
	}

	/** Inserts the barrier a statement was flagged for, then descends into it. */
	private void rewrite(Statement stmt) {
		if( stmt.getId() != Statement.NO_ID && syncs.contains(stmt.getId()) ) {
			Statement barrier = makeBarrier();
			IRTools.insertBefore(stmt, barrier);
			numInserted++;
			PrintTools.println(pass_name + " inserted " + barrier.toString().trim()
					+ " before statement " + stmt.getId(), 2);
		}
		stmt.accept(this);
	}

	private Statement makeBarrier() {
		if( !isGlobalTarget() ) {
			return KernelIntrinsics.storageSync(syncScope);
		}
		List<ThreadExtentStatement> threadExtents = context.getThreadExtents();
		GlobalBarrierCache cache = context.getBarrierCache();
		return KernelIntrinsics.globalSync(syncScope,
				cache.getIsLead(threadExtents).clone(),
				cache.getNumBlocks(threadExtents).clone());
	}

	/**
	 * Sets up the kernel rooted at the outermost thread scope for cross-block
	 * barriers and clears the per-kernel state.
	 */
	private void initGlobalBarrier(ThreadExtentStatement te) {
		IRTools.insertBefore(te, KernelIntrinsics.call(KernelIntrinsics.PREPARE_GLOBAL_BARRIER));
		CompoundStatement newBody = new CompoundStatement();
		Statement body = te.getBody();
		te.setBody(newBody);
		for( Buffer buffer : context.getStatistics().getReadWriteBuffers() ) {
			body = new AttributeStatement(buffer, AttributeStatement.VOLATILE_SCOPE,
					new IntegerLiteral(1), body);
			PrintTools.println(pass_name + " " + buffer + " is volatile in "
					+ te.getThreadTag() + " scope", 2);
		}
		newBody.addStatement(KernelIntrinsics.call(KernelIntrinsics.GLOBAL_BARRIER_KINIT));
		newBody.addStatement(body);
		context.resetKernelState();
	}

	public void visit(Program node) {
		rewrite(node.getBody());
	}

	public void visit(CompoundStatement node) {
		// Iterate over a copy; barriers are inserted into the block.
		for( Statement stmt : node.getStatements() ) {
			rewrite(stmt);
		}
	}

	public void visit(ExpressionStatement node) {
		node.getExpression().accept(this);
	}

	public void visit(BufferStore node) {
		if( isCounted(node.getBuffer()) ) {
			context.getStatistics().addWrite(node.getBuffer());
		}
		node.getValue().accept(this);
		node.getIndex().accept(this);
	}

	public void visit(ForLoop node) {
		node.getMin().accept(this);
		node.getExtent().accept(this);
		rewrite(node.getBody());
	}

	public void visit(IfStatement node) {
		node.getControlExpression().accept(this);
		rewrite(node.getThenStatement());
		if( node.getElseStatement() != null ) {
			rewrite(node.getElseStatement());
		}
	}

	public void visit(ThreadExtentStatement node) {
		context.pushThreadExtent(node);
		node.getExtent().accept(this);
		rewrite(node.getBody());
		boolean leftDevice = context.popThreadExtent(node);
		if( leftDevice && isGlobalTarget() ) {
			initGlobalBarrier(node);
		}
	}

	public void visit(AttributeStatement node) {
		node.getValue().accept(this);
		rewrite(node.getBody());
	}

	public void visit(BinaryExpression node) {
		node.getLHS().accept(this);
		node.getRHS().accept(this);
	}

	public void visit(BufferLoad node) {
		if( isCounted(node.getBuffer()) ) {
			context.getStatistics().addRead(node.getBuffer());
		}
		node.getIndex().accept(this);
	}

	public void visit(FunctionCall node) {
		for( int i = 0; i < node.getNumArguments(); i++ ) {
			node.getArgument(i).accept(this);
		}
		if( node.getName().equals(KernelIntrinsics.ACCESS_PTR)
				&& node.getBufferArgument() != null
				&& isCounted(node.getBufferArgument())
				&& node.getNumArguments() == 3
				&& node.getArgument(2) instanceof IntegerLiteral ) {
			long mask = ((IntegerLiteral)node.getArgument(2)).getValue();
			if( (mask & KernelIntrinsics.ACCESS_READ) != 0 ) {
				context.getStatistics().addRead(node.getBufferArgument());
			}
			if( (mask & KernelIntrinsics.ACCESS_WRITE) != 0 ) {
				context.getStatistics().addWrite(node.getBufferArgument());
			}
		}
	}

	public void visit(Identifier node) {
	}

	public void visit(IntegerLiteral node) {
	}

	public void visit(StringLiteral node) {
	}
}
