package org.springaicommunity.metadata.sync;

import java.nio.file.Path;

/**
 * Thrown when a downloaded archive is neither a gzip-compressed tar nor a zip file.
 */
public class UnsupportedContainerException extends MetadataSyncException {

	public UnsupportedContainerException(Path path) {
		super("Not a .tar.gz or .zip, cannot process: " + path);
	}

}
