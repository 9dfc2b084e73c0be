package gpusync.transforms;

import gpusync.analysis.BoundsProver;
import gpusync.analysis.RangeDomain;
import gpusync.analysis.SyncSet;
import gpusync.analysis.ThreadSyncPlanner;
import gpusync.hir.PrintTools;
import gpusync.hir.Program;
import gpusync.hir.StorageScope;

/**
 * Entry point of thread synchronization: plans the barriers one storage
 * scope needs and inserts them. Apply once per storage scope that requires
 * enforcement.
 */
public final class ThreadSync {
	private static final String pass_name = "[ThreadSync]";

	private ThreadSync() {
	}

	/**
	 * Inserts the barriers of the named storage scope into the program.
	 *
	 * @param program the program, rewritten in place.
	 * @param scope the storage scope name, such as {@code shared} or
	 *        {@code global}.
	 * @return the rewritten program.
	 * @throws IllegalArgumentException if the scope name is unknown.
	 * @throws gpusync.analysis.ThreadSyncException if the program needs a
	 *         barrier inside a conditional branch, or its global barriers sit
	 *         under different thread-scope nestings.
	 */
	public static Program apply(Program program, String scope) {
		return apply(program, StorageScope.parse(scope), new RangeDomain());
	}

	/** Same as {@link #apply(Program, String)} with an explicit prover. */
	public static Program apply(Program program, StorageScope scope,
			BoundsProver prover) {
		ThreadSyncPlanner planner = new ThreadSyncPlanner(scope, prover);
		SyncSet syncs = planner.plan(program);
		ThreadSyncInserter inserter = new ThreadSyncInserter(scope, syncs);
		int inserted = inserter.insert(program);
		// Inserted statements get fresh identities; existing ones keep theirs.
		program.number();
		PrintTools.printlnStatus(pass_name, inserted + " " + scope
				+ " barriers in " + program.getName(), 1);
		return program;
	}
}
