package gpusync.analysis;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The access records of one program point at one nesting level: a statement
 * identity paired with its accesses in program order. For a loop, a
 * conditional or a nested block the accesses are the reduced summary of its
 * body.
 */
public final class StatementEntry {
	private final int stmtId;
	private final List<AccessEntry> accesses;

	public StatementEntry(int stmtId, List<AccessEntry> accesses) {
		this.stmtId = stmtId;
		this.accesses = Collections.unmodifiableList(
				new ArrayList<AccessEntry>(accesses));
	}

	/** Returns the arena identity of the statement. */
	public int getStatementId() {
		return stmtId;
	}

	public List<AccessEntry> getAccesses() {
		return accesses;
	}

	@Override
	public String toString() {
		return "S" + stmtId + " " + accesses;
	}
}
