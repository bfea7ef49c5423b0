package org.springaicommunity.metadata.sync;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * {@link TransferEngine} downloading with {@link HttpClient#sendAsync} into temporary
 * files under a download directory.
 *
 * <p>
 * All targets are requested at once; completions are reported from the client's
 * executor. Temporary files of failed targets are deleted here.
 */
public class HttpTransferEngine implements TransferEngine {

	private static final Logger logger = LoggerFactory.getLogger(HttpTransferEngine.class);

	private final HttpClient httpClient;

	private final Path downloadDirectory;

	private final Duration requestTimeout;

	private final String userAgent;

	public HttpTransferEngine(HttpClient httpClient, Path downloadDirectory, Duration requestTimeout,
			String userAgent) {
		this.httpClient = httpClient;
		this.downloadDirectory = downloadDirectory;
		this.requestTimeout = requestTimeout;
		this.userAgent = userAgent;
	}

	@Override
	public void fetchAll(List<URI> targets, DownloadListener listener) {
		try {
			Files.createDirectories(downloadDirectory);
		}
		catch (IOException e) {
			throw new DownloadException("Cannot create download directory " + downloadDirectory, e);
		}

		List<Throwable> failures = Collections.synchronizedList(new ArrayList<>());
		List<CompletableFuture<Void>> downloads = new ArrayList<>();
		for (URI uri : targets) {
			downloads.add(download(uri, listener, failures));
		}
		CompletableFuture.allOf(downloads.toArray(new CompletableFuture[0])).join();

		if (!failures.isEmpty()) {
			DownloadException exception = new DownloadException(
					"Failed to download " + failures.size() + " of " + targets.size() + " repositories: "
							+ failures.get(0).getMessage(),
					failures.get(0));
			failures.stream().skip(1).forEach(exception::addSuppressed);
			throw exception;
		}
	}

	private CompletableFuture<Void> download(URI uri, DownloadListener listener, List<Throwable> failures) {
		HttpRequest request;
		Path target;
		try {
			request = HttpRequest.newBuilder()
				.uri(uri)
				.timeout(requestTimeout)
				.header("User-Agent", userAgent)
				.GET()
				.build();
			target = Files.createTempFile(downloadDirectory, "repo-", ".download");
		}
		catch (IllegalArgumentException | IOException e) {
			logger.error("Cannot download {}: {}", uri, e.getMessage());
			failures.add(e);
			listener.onComplete(uri, null, e, null);
			return CompletableFuture.completedFuture(null);
		}

		logger.debug("GET {}", uri);
		long start = System.currentTimeMillis();
		return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofFile(target)).handle((response, error) -> {
			Throwable failure = unwrap(error);
			if (failure == null && (response.statusCode() < 200 || response.statusCode() >= 300)) {
				failure = DownloadException.forStatus(uri, response.statusCode());
			}
			if (failure != null) {
				logger.error("Download of {} failed after {}ms: {}", uri, System.currentTimeMillis() - start,
						failure.getMessage());
				deleteTempFile(target);
				failures.add(failure);
				listener.onComplete(uri, null, failure, null);
				return null;
			}

			String etag = response.headers().firstValue("ETag").map(ChangeTokens::normalize).orElse(null);
			logger.debug("GET {} completed in {}ms (ETag {})", uri, System.currentTimeMillis() - start, etag);
			listener.onComplete(uri, response.body(), null, etag);
			return null;
		});
	}

	@Nullable
	private static Throwable unwrap(@Nullable Throwable error) {
		if (error instanceof CompletionException && error.getCause() != null) {
			return error.getCause();
		}
		return error;
	}

	private static void deleteTempFile(Path file) {
		try {
			Files.deleteIfExists(file);
		}
		catch (IOException e) {
			logger.warn("Failed to delete: {}", file);
		}
	}

}
