package org.springaicommunity.metadata.sync;

import org.jspecify.annotations.Nullable;

import java.io.Closeable;
import java.io.IOException;

/**
 * Forward-only reader over the entries of one archive, in the archive's native order.
 *
 * <p>
 * Only file entries are returned. Each returned {@link ContainerEntry} stays readable
 * until the next call to {@link #nextEntry()}.
 */
public interface ArchiveEntryReader extends Closeable {

	/**
	 * Advance to the next entry.
	 * @return the next entry, or null when the archive is exhausted
	 * @throws IOException if the archive cannot be read
	 */
	@Nullable
	ContainerEntry nextEntry() throws IOException;

	/**
	 * How far traversal has progressed, as a percentage between 0 and 100.
	 * @return the percentage of the archive consumed so far
	 * @throws IOException if the position of the underlying file cannot be read
	 */
	int percentConsumed() throws IOException;

	/**
	 * The container format this reader handles.
	 */
	ContainerFormat format();

}
