package org.springaicommunity.metadata.sync;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Optional;

/**
 * {@link ChangeTokenProbe} issuing an HTTP {@code HEAD} request and reading the
 * {@code ETag} response header.
 */
public class HttpChangeTokenProbe implements ChangeTokenProbe {

	private static final Logger logger = LoggerFactory.getLogger(HttpChangeTokenProbe.class);

	private final HttpClient httpClient;

	private final Duration requestTimeout;

	private final String userAgent;

	public HttpChangeTokenProbe(HttpClient httpClient, Duration requestTimeout, String userAgent) {
		this.httpClient = httpClient;
		this.requestTimeout = requestTimeout;
		this.userAgent = userAgent;
	}

	@Override
	public Optional<String> currentToken(URI uri) {
		try {
			HttpRequest request = HttpRequest.newBuilder()
				.uri(uri)
				.timeout(requestTimeout)
				.header("User-Agent", userAgent)
				.method("HEAD", HttpRequest.BodyPublishers.noBody())
				.build();
			HttpResponse<Void> response = httpClient.send(request, HttpResponse.BodyHandlers.discarding());
			int statusCode = response.statusCode();
			if (statusCode < 200 || statusCode >= 300) {
				throw new ChangeTokenProbeException("HEAD " + uri + " returned HTTP " + statusCode);
			}
			Optional<String> etag = response.headers()
				.firstValue("ETag")
				.map(ChangeTokens::normalize)
				.filter(value -> !value.isEmpty());
			logger.debug("HEAD {} -> ETag {}", uri, etag.orElse("(none)"));
			return etag;
		}
		catch (IllegalArgumentException | IOException e) {
			throw new ChangeTokenProbeException("HEAD " + uri + " failed: " + e.getMessage(), e);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new ChangeTokenProbeException("HEAD " + uri + " interrupted", e);
		}
	}

}
