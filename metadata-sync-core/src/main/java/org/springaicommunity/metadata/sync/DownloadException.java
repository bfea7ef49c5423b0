package org.springaicommunity.metadata.sync;

import java.net.URI;

/**
 * Thrown when a transfer batch cannot download every repository archive.
 */
public class DownloadException extends MetadataSyncException {

	public DownloadException(String message) {
		super(message);
	}

	public DownloadException(String message, Throwable cause) {
		super(message, cause);
	}

	public static DownloadException forStatus(URI uri, int statusCode) {
		return new DownloadException("HTTP " + statusCode + " while downloading " + uri);
	}

}
