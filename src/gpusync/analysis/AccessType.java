package gpusync.analysis;

/**
 * Kind of an access record.
 */
public enum AccessType {
	/** The touched range is read. */
	READ,
	/** The touched range is written. */
	WRITE,
	/** A barrier of the analyzed storage scope; it touches nothing. */
	SYNC
}
