package gpusync.transforms;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import gpusync.hir.Buffer;

/**
 * Counts the reads and writes of each buffer seen by the rewriter, in the
 * order the buffers are first seen.
 */
public class ReadWriteStatistics {
	private static class Entry {
		int readCount = 0;
		int writeCount = 0;
	}

	private final Map<Buffer, Entry> stats;

	public ReadWriteStatistics() {
		stats = new LinkedHashMap<Buffer, Entry>();
	}

	private Entry getEntry(Buffer buffer) {
		Entry e = stats.get(buffer);
		if( e == null ) {
			e = new Entry();
			stats.put(buffer, e);
		}
		return e;
	}

	public void addRead(Buffer buffer) {
		getEntry(buffer).readCount++;
	}

	public void addWrite(Buffer buffer) {
		getEntry(buffer).writeCount++;
	}

	public int getWriteCount(Buffer buffer) {
		Entry e = stats.get(buffer);
		return (e == null) ? 0 : e.writeCount;
	}

	/** Returns the buffers that are both read and written. */
	public List<Buffer> getReadWriteBuffers() {
		List<Buffer> ret = new ArrayList<Buffer>();
		for( Map.Entry<Buffer, Entry> kv : stats.entrySet() ) {
			if( kv.getValue().readCount != 0 && kv.getValue().writeCount != 0 ) {
				ret.add(kv.getKey());
			}
		}
		return ret;
	}

	public boolean isEmpty() {
		return stats.isEmpty();
	}

	public void reset() {
		stats.clear();
	}
}
