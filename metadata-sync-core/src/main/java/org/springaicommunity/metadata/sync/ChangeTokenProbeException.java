package org.springaicommunity.metadata.sync;

/**
 * Thrown when a repository's current change-token cannot be probed. Never fatal: the
 * repository is then treated as changed.
 */
public class ChangeTokenProbeException extends MetadataSyncException {

	public ChangeTokenProbeException(String message) {
		super(message);
	}

	public ChangeTokenProbeException(String message, Throwable cause) {
		super(message, cause);
	}

}
