package gpusync.analysis;

import java.util.ArrayList;
import java.util.List;

import gpusync.hir.BinaryExpression;
import gpusync.hir.BinaryOperator;
import gpusync.hir.Buffer;
import gpusync.hir.Expression;
import gpusync.hir.ForLoop;
import gpusync.hir.Identifier;
import gpusync.hir.IntegerLiteral;
import gpusync.hir.LoopKind;
import gpusync.hir.PrintTools;
import gpusync.hir.Program;
import gpusync.hir.StorageScope;
import gpusync.hir.Variable;

/**
 * Finds the statements that need a barrier of one storage scope before them.
 *
 * <p>
 * Planning runs bottom-up: every nesting level is planned when it closes, by
 * simulating its statements in order with the sets of reads and writes not
 * yet separated by a barrier. A statement whose access conflicts with a
 * pending access of the opposite kind is flagged, and the pending sets start
 * over. If the level is a loop body, the leftover pending accesses are then
 * checked against the body once more, projected one iteration ahead for a
 * serial loop; one barrier is enough there since every iteration passes it.
 * Finally the level is reduced to the accesses visible from outside: those
 * before its first barrier, the barrier itself, and those after its last
 * barrier.
 * </p>
 *
 * <p>
 * A barrier needed inside a conditional branch cannot be placed, because not
 * every thread reaches it; planning aborts with a
 * {@link ThreadSyncException}.
 * </p>
 */
public class ThreadSyncPlanner extends AccessLogBuilder {
	private static final String pass_name = "[ThreadSyncPlanner]";

	private final StorageScope syncScope;
	private final ConflictDetector detector;
	private final SyncSet syncs;

	public ThreadSyncPlanner(StorageScope syncScope, BoundsProver prover) {
		super(prover);
		this.syncScope = syncScope;
		this.detector = new ConflictDetector(prover);
		this.syncs = new SyncSet();
	}

	/**
	 * Numbers the statements of the program and plans every level of it.
	 *
	 * @return the statements flagged for a barrier.
	 * @throws ThreadSyncException if a barrier is needed inside a branch.
	 */
	public SyncSet plan(Program program) {
		program.number();
		program.accept(this);
		PrintTools.println(pass_name + " " + syncScope + " barriers before "
				+ syncs, 2);
		return syncs;
	}

	@Override
	protected boolean isEnabled(Buffer buffer, StorageScope scope) {
		return inDeviceEnv() && syncScope.equals(scope);
	}

	@Override
	protected List<AccessEntry> summarize(List<StatementEntry> seq, ForLoop loop) {
		// Unsynced reads and writes
		List<AccessEntry> reads = new ArrayList<AccessEntry>();
		List<AccessEntry> writes = new ArrayList<AccessEntry>();
		for( StatementEntry s : seq ) {
			boolean syncBeforeStmt = syncs.contains(s.getStatementId());
			if( syncBeforeStmt ) {
				reads.clear();
				writes.clear();
			}
			for( AccessEntry acc : s.getAccesses() ) {
				if( acc.getType() == AccessType.READ ) {
					if( detector.conflicts(writes, acc, false) ) {
						syncBeforeStmt = true;
						break;
					}
				} else if( acc.getType() == AccessType.WRITE ) {
					if( detector.conflicts(reads, acc, false) ) {
						syncBeforeStmt = true;
						break;
					}
				} else {
					reads.clear();
					writes.clear();
				}
			}
			if( syncBeforeStmt ) {
				reads.clear();
				writes.clear();
			}
			addPending(s, reads, writes);
			if( syncBeforeStmt ) {
				flagSync(s);
			}
		}
		if( loop != null ) {
			planLoopCarry(seq, loop, reads, writes);
		}
		List<AccessEntry> ret = reduce(seq);
		if( loop != null ) {
			// The exemption only holds within one iteration.
			for( int i = 0; i < ret.size(); i++ ) {
				ret.set(i, ret.get(i).withDoubleBufferWrite(false));
			}
		}
		PrintTools.println(pass_name + " level of " + seq.size() + " statements"
				+ (loop == null ? "" : " in loop " + loop.getLoopVariable())
				+ " exposes " + ret, 3);
		return ret;
	}

	private static void addPending(StatementEntry s, List<AccessEntry> reads,
			List<AccessEntry> writes) {
		for( AccessEntry acc : s.getAccesses() ) {
			if( acc.getType() == AccessType.READ ) {
				reads.add(acc);
			} else if( acc.getType() == AccessType.WRITE ) {
				writes.add(acc);
			} else {
				reads.clear();
				writes.clear();
			}
		}
	}

	/**
	 * Checks the accesses left unsynchronized at the end of a loop body
	 * against the body of the following iteration, and flags the first
	 * statement that conflicts.
	 */
	private void planLoopCarry(List<StatementEntry> seq, ForLoop loop,
			List<AccessEntry> reads, List<AccessEntry> writes) {
		for( StatementEntry s : seq ) {
			if( syncs.contains(s.getStatementId()) ) {
				break;
			}
			if( reads.isEmpty() && writes.isEmpty() ) {
				break;
			}
			boolean syncBeforeStmt = false;
			for( AccessEntry acc : s.getAccesses() ) {
				AccessEntry next = projectToNextIteration(acc, loop);
				if( next.getType() == AccessType.READ ) {
					if( detector.conflicts(writes, next, true) ) {
						syncBeforeStmt = true;
						break;
					}
				} else if( next.getType() == AccessType.WRITE ) {
					if( detector.conflicts(reads, next, true) ) {
						syncBeforeStmt = true;
						break;
					}
				} else {
					reads.clear();
					writes.clear();
				}
			}
			if( syncBeforeStmt ) {
				flagSync(s);
				break;
			}
		}
	}

	/**
	 * Returns the access as seen from the next iteration of the loop: for a
	 * serial loop the loop variable is replaced by itself plus one; other loop
	 * kinds keep the range as is.
	 */
	static AccessEntry projectToNextIteration(AccessEntry acc, ForLoop loop) {
		if( loop.getKind() != LoopKind.SERIAL || acc.getType() == AccessType.SYNC ) {
			return acc;
		}
		Variable v = loop.getLoopVariable();
		Expression next = new BinaryExpression(new Identifier(v),
				BinaryOperator.ADD, new IntegerLiteral(1));
		return acc.withTouched(acc.getTouched().substitute(v, next));
	}

	/**
	 * Replays the level and keeps the accesses before the first barrier, one
	 * barrier record standing for it, and the accesses after the last one.
	 */
	private List<AccessEntry> reduce(List<StatementEntry> seq) {
		int syncCount = 0;
		// head are before first sync, tail are after last sync
		List<AccessEntry> head = new ArrayList<AccessEntry>();
		List<AccessEntry> tail = new ArrayList<AccessEntry>();
		AccessEntry esync = AccessEntry.sync(getEnvThreads(), syncScope);
		for( StatementEntry s : seq ) {
			if( syncs.contains(s.getStatementId()) ) {
				if( syncCount != 0 ) {
					tail.clear();
				} else {
					head.add(esync);
				}
				++syncCount;
			}
			for( AccessEntry acc : s.getAccesses() ) {
				if( acc.getType() == AccessType.SYNC ) {
					if( syncCount != 0 ) {
						tail.clear();
					} else {
						head.add(esync);
					}
					++syncCount;
				} else if( syncCount != 0 ) {
					tail.add(acc);
				} else {
					head.add(acc);
				}
			}
		}
		head.addAll(tail);
		return head;
	}

	private void flagSync(StatementEntry s) {
		if( syncs.contains(s.getStatementId()) ) {
			return;
		}
		if( getConditionCounter() != 0 ) {
			throw new ThreadSyncException(ThreadSyncException.Kind.SYNC_INSIDE_CONDITION,
					"Cannot insert syncs inside condition: statement "
					+ s.getStatementId() + " needs a " + syncScope + " barrier");
		}
		syncs.add(s.getStatementId());
		PrintTools.println(pass_name + " barrier before statement "
				+ s.getStatementId() + " " + s.getAccesses(), 3);
	}
}
