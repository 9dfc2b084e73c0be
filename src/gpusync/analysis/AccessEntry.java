package gpusync.analysis;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import gpusync.hir.Buffer;
import gpusync.hir.StorageScope;

/**
 * One access record of the access log: which buffer is read or written over
 * which range, under which environment threads. Records are immutable; the
 * {@code with*} methods return modified copies.
 */
public final class AccessEntry {
	private final Buffer buffer;
	private final AccessType type;
	private final AccessRange touched;
	private final StorageScope scope;
	private final List<ThreadBinding> threads;
	private final boolean doubleBufferWrite;
	private final String dtype;

	/**
	 * Creates a record.
	 *
	 * @param buffer the accessed buffer; null only for {@link AccessType#SYNC}.
	 * @param type the access kind.
	 * @param touched the touched range.
	 * @param scope the storage scope of the access.
	 * @param threads the environment threads active at the access.
	 * @param doubleBufferWrite whether this writes the next stage of a double
	 *        buffer.
	 * @param dtype the element type, may be null.
	 */
	public AccessEntry(Buffer buffer, AccessType type, AccessRange touched,
			StorageScope scope, List<ThreadBinding> threads,
			boolean doubleBufferWrite, String dtype) {
		if( type == null || touched == null || scope == null ) {
			throw new IllegalArgumentException("incomplete access record");
		}
		if( buffer == null && type != AccessType.SYNC ) {
			throw new IllegalArgumentException(type + " access without a buffer");
		}
		this.buffer = buffer;
		this.type = type;
		this.touched = touched;
		this.scope = scope;
		this.threads = Collections.unmodifiableList(
				new ArrayList<ThreadBinding>(threads));
		this.doubleBufferWrite = doubleBufferWrite;
		this.dtype = dtype;
	}

	/** Returns a read or write record of a buffer at its declared scope. */
	public static AccessEntry access(Buffer buffer, AccessType type,
			AccessRange touched, List<ThreadBinding> threads) {
		return new AccessEntry(buffer, type, touched, buffer.getScope(),
				threads, false, buffer.getDataType());
	}

	/** Returns a barrier record of the given scope. */
	public static AccessEntry sync(List<ThreadBinding> threads,
			StorageScope scope) {
		return new AccessEntry(null, AccessType.SYNC, AccessRange.everything(),
				scope, threads, false, null);
	}

	public Buffer getBuffer() {
		return buffer;
	}

	public AccessType getType() {
		return type;
	}

	public AccessRange getTouched() {
		return touched;
	}

	public StorageScope getScope() {
		return scope;
	}

	public List<ThreadBinding> getThreads() {
		return threads;
	}

	public boolean isDoubleBufferWrite() {
		return doubleBufferWrite;
	}

	public String getDataType() {
		return dtype;
	}

	/** Returns a copy touching the given range. */
	public AccessEntry withTouched(AccessRange range) {
		return new AccessEntry(buffer, type, range, scope, threads,
				doubleBufferWrite, dtype);
	}

	/** Returns a copy with the double-buffer flag set as given. */
	public AccessEntry withDoubleBufferWrite(boolean flag) {
		if( flag == doubleBufferWrite ) {
			return this;
		}
		return new AccessEntry(buffer, type, touched, scope, threads, flag,
				dtype);
	}

	@Override
	public String toString() {
		if( type == AccessType.SYNC ) {
			return "sync(" + scope + ")";
		}
		return (type == AccessType.READ ? "R " : "W ") + buffer + touched
			+ (doubleBufferWrite ? " (double buffer)" : "");
	}
}
