package org.springaicommunity.metadata.sync;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Opens the {@link ArchiveEntryReader} matching an archive's detected format.
 */
public class ArchiveEntryReaderFactory {

	private final FormatDetector formatDetector;

	private final long maxEntrySize;

	public ArchiveEntryReaderFactory(FormatDetector formatDetector, long maxEntrySize) {
		this.formatDetector = formatDetector;
		this.maxEntrySize = maxEntrySize;
	}

	/**
	 * Open a reader for the given archive.
	 * @param path local archive file
	 * @return a reader positioned before the first entry
	 * @throws UnsupportedContainerException if the content matches no supported format
	 * @throws IOException if the file cannot be read
	 */
	public ArchiveEntryReader open(Path path) throws IOException {
		ContainerFormat format = formatDetector.identify(path);
		switch (format) {
			case TAR_GZ:
				return new TarGzEntryReader(path, maxEntrySize);
			case ZIP:
				return new ZipEntryReader(path, maxEntrySize);
			default:
				throw new UnsupportedContainerException(path);
		}
	}

}
