package org.springaicommunity.metadata.sync;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ConcurrentMap;

/**
 * Thread-safe accumulator of download completions, keyed by repository URI.
 *
 * <p>
 * Completions arrive from the transfer engine's threads in any order; the synchronizer
 * reads a snapshot only after the whole batch returned.
 */
final class CompletionCollector implements DownloadListener {

	private static final Logger logger = LoggerFactory.getLogger(CompletionCollector.class);

	private final ConcurrentMap<URI, DownloadArtifact> artifacts = new ConcurrentHashMap<>();

	private final Queue<Path> files = new ConcurrentLinkedQueue<>();

	@Override
	public void onComplete(URI uri, @Nullable Path path, @Nullable Throwable error, @Nullable String etag) {
		if (path != null) {
			files.add(path);
		}
		if (error != null || path == null) {
			logger.debug("Download of {} did not complete: {}", uri, error != null ? error.getMessage() : "no file");
			return;
		}
		DownloadArtifact previous = artifacts.putIfAbsent(uri, new DownloadArtifact(uri, path, etag));
		if (previous != null) {
			logger.warn("Ignoring duplicate completion for {}", uri);
		}
	}

	Map<URI, DownloadArtifact> artifacts() {
		return Map.copyOf(artifacts);
	}

	List<Path> files() {
		return List.copyOf(files);
	}

}
