package org.springaicommunity.metadata.sync;

/**
 * Phases of one {@link MetadataSynchronizer#syncAll()} batch, in order.
 */
public enum SyncPhase {

	IDLE,

	CHECKING_FRESHNESS,

	FETCHING,

	EXTRACTING,

	COMMITTING,

	UPDATED,

	NO_CHANGES,

	FAILED;

	public boolean isTerminal() {
		return this == UPDATED || this == NO_CHANGES || this == FAILED;
	}

}
