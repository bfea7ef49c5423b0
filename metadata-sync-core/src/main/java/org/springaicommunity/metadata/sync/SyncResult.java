package org.springaicommunity.metadata.sync;

import org.jspecify.annotations.Nullable;

/**
 * Result of one {@link MetadataSynchronizer#syncAll()} call.
 *
 * @param outcome the batch-level outcome
 * @param repositoryCount number of distinct repositories taking part in the batch
 * @param descriptorCount number of descriptors committed (zero unless
 * {@link SyncOutcome#UPDATED})
 * @param failure the fatal error behind a {@link SyncOutcome#FAILED} outcome, otherwise
 * null
 */
public record SyncResult(SyncOutcome outcome, int repositoryCount, int descriptorCount,
		@Nullable Throwable failure) {

	public static SyncResult noChanges(int repositoryCount) {
		return new SyncResult(SyncOutcome.NO_CHANGES, repositoryCount, 0, null);
	}

	public static SyncResult updated(int repositoryCount, int descriptorCount) {
		return new SyncResult(SyncOutcome.UPDATED, repositoryCount, descriptorCount, null);
	}

	public static SyncResult failed(int repositoryCount, Throwable failure) {
		return new SyncResult(SyncOutcome.FAILED, repositoryCount, 0, failure);
	}

}
