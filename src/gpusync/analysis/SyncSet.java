package gpusync.analysis;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;

/**
 * The identities of the statements that need a barrier immediately before
 * them. The set only grows.
 */
public final class SyncSet {
	private final BitSet ids;

	public SyncSet() {
		ids = new BitSet();
	}

	/**
	 * Flags a statement.
	 *
	 * @return true if the statement was not flagged before.
	 */
	public boolean add(int stmtId) {
		if( stmtId < 0 ) {
			throw new IllegalArgumentException("statement " + stmtId + " was never numbered");
		}
		boolean fresh = !ids.get(stmtId);
		ids.set(stmtId);
		return fresh;
	}

	public boolean contains(int stmtId) {
		return stmtId >= 0 && ids.get(stmtId);
	}

	public boolean isEmpty() {
		return ids.isEmpty();
	}

	public int size() {
		return ids.cardinality();
	}

	/** Returns the flagged identities in increasing order. */
	public List<Integer> toList() {
		List<Integer> ret = new ArrayList<Integer>(ids.cardinality());
		for( int i = ids.nextSetBit(0); i >= 0; i = ids.nextSetBit(i + 1) ) {
			ret.add(i);
		}
		return ret;
	}

	@Override
	public String toString() {
		return toList().toString();
	}
}
