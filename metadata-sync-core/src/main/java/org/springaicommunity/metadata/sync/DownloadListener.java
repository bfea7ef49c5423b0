package org.springaicommunity.metadata.sync;

import org.jspecify.annotations.Nullable;

import java.net.URI;
import java.nio.file.Path;

/**
 * Completion callback of a {@link TransferEngine}, invoked once per target in any order
 * and from any thread.
 */
@FunctionalInterface
public interface DownloadListener {

	/**
	 * @param uri the target that completed
	 * @param path the downloaded file, or null if the download failed
	 * @param error the failure, or null on success
	 * @param etag the change-token reported by the server, if any
	 */
	void onComplete(URI uri, @Nullable Path path, @Nullable Throwable error, @Nullable String etag);

}
