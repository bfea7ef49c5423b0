package org.springaicommunity.metadata.sync;

/**
 * Batch-level result of a repository sync.
 */
public enum SyncOutcome {

	/**
	 * New metadata was extracted and committed to the registry.
	 */
	UPDATED,

	/**
	 * Every repository was unchanged, or nothing was extracted; the registry was not
	 * touched.
	 */
	NO_CHANGES,

	/**
	 * A fatal error aborted the batch; the registry was not touched.
	 */
	FAILED

}
