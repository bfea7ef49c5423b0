package org.springaicommunity.metadata.sync;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * A named blob inside an archive, valid only while the reader that produced it is
 * positioned on it.
 */
public interface ContainerEntry {

	/**
	 * Path-like entry name as stored in the archive.
	 */
	String name();

	/**
	 * Size declared by the archive, or -1 if the archive does not declare one.
	 */
	long size();

	/**
	 * Read the entry's content.
	 * @return the raw bytes
	 * @throws IOException if the archive cannot be read
	 * @throws IllegalStateException if the reader has already moved past this entry
	 */
	byte[] content() throws IOException;

	default String contentAsString() throws IOException {
		return new String(content(), StandardCharsets.UTF_8);
	}

}
