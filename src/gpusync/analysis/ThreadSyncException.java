package gpusync.analysis;

/**
 * Thrown when a kernel violates a structural precondition of barrier
 * insertion. The pass is aborted rather than producing an unsound kernel.
 */
public class ThreadSyncException extends RuntimeException {
	private static final long serialVersionUID = 1L;

	/** The violated precondition. */
	public enum Kind {
		/** A barrier is needed where not every thread of the scope arrives. */
		SYNC_INSIDE_CONDITION,
		/** Global barriers of one launch see different thread nestings. */
		INCONSISTENT_THREAD_NESTING
	}

	private final Kind kind;

	public ThreadSyncException(Kind kind, String message) {
		super(message);
		this.kind = kind;
	}

	public Kind getKind() {
		return kind;
	}
}
