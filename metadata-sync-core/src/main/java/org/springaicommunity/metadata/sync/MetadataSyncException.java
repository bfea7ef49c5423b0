package org.springaicommunity.metadata.sync;

/**
 * Base class of the fatal errors that abort a sync batch.
 *
 * <p>
 * {@link MetadataSynchronizer#syncAll()} catches these and reports a
 * {@link SyncOutcome#FAILED} outcome.
 */
public class MetadataSyncException extends RuntimeException {

	public MetadataSyncException(String message) {
		super(message);
	}

	public MetadataSyncException(String message, Throwable cause) {
		super(message, cause);
	}

}
