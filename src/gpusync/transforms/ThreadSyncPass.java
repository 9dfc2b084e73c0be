package gpusync.transforms;

import gpusync.hir.Program;
import gpusync.hir.StorageScope;

/**
 * Runs {@link ThreadSync} for one storage scope as a named transformation
 * pass.
 */
public class ThreadSyncPass extends TransformPass {
	private final StorageScope syncScope;

	public ThreadSyncPass(Program program, StorageScope syncScope) {
		super(program);
		this.syncScope = syncScope;
	}

	@Override
	public String getPassName() {
		return "[ThreadSync:" + syncScope + "]";
	}

	@Override
	public void start() {
		ThreadSync.apply(program, syncScope.toString());
	}
}
