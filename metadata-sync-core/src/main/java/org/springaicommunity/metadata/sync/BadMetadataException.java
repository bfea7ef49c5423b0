package org.springaicommunity.metadata.sync;

/**
 * Thrown for a metadata record that lacks required fields or carries malformed values.
 */
public class BadMetadataException extends RuntimeException {

	public BadMetadataException(String message) {
		super(message);
	}

	public BadMetadataException(String message, Throwable cause) {
		super(message, cause);
	}

}
