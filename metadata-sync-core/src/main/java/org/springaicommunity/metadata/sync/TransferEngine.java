package org.springaicommunity.metadata.sync;

import java.net.URI;
import java.util.List;

/**
 * Downloads a batch of repository archives concurrently.
 */
public interface TransferEngine {

	/**
	 * Download every target and block until all of them completed.
	 *
	 * <p>
	 * The listener is called exactly once per target. Files reported to the listener
	 * belong to the caller, who must delete them.
	 * @param targets archive URIs to download
	 * @param listener per-target completion callback
	 * @throws DownloadException if any target could not be downloaded
	 */
	void fetchAll(List<URI> targets, DownloadListener listener);

}
