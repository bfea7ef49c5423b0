package org.springaicommunity.metadata.sync;

/**
 * Thrown for a metadata record written for a newer client, i.e. one declaring a spec
 * version this client does not support.
 */
public class UnsupportedMetadataException extends RuntimeException {

	public UnsupportedMetadataException(String message) {
		super(message);
	}

}
