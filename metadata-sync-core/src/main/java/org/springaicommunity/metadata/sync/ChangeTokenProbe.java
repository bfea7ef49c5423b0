package org.springaicommunity.metadata.sync;

import java.net.URI;
import java.util.Optional;

/**
 * Looks up a repository's current change-token without transferring its archive.
 */
@FunctionalInterface
public interface ChangeTokenProbe {

	/**
	 * Probe the current change-token of a repository.
	 * @param uri the repository URI
	 * @return the current token, or empty if the server does not provide one
	 * @throws ChangeTokenProbeException if the probe fails
	 */
	Optional<String> currentToken(URI uri);

}
