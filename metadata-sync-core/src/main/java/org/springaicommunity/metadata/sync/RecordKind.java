package org.springaicommunity.metadata.sync;

/**
 * What an archive entry holds, as decided by {@link RecordClassifier}.
 */
public enum RecordKind {

	/**
	 * Aggregate download counts per package identifier.
	 */
	STATISTICS,

	/**
	 * One package version's metadata.
	 */
	METADATA,

	/**
	 * Anything else; discarded.
	 */
	NOISE

}
