package org.springaicommunity.metadata.sync;

import java.nio.file.Path;

/**
 * Thrown when a downloaded archive is missing from the local file system.
 */
public class ArtifactNotFoundException extends MetadataSyncException {

	private final Path path;

	public ArtifactNotFoundException(Path path) {
		super("File not found: " + path);
		this.path = path;
	}

	public Path getPath() {
		return path;
	}

}
