package org.springaicommunity.metadata.sync;

/**
 * Thrown when the registry cannot be loaded or saved.
 */
public class RegistryException extends MetadataSyncException {

	public RegistryException(String message, Throwable cause) {
		super(message, cause);
	}

}
