package org.springaicommunity.metadata.sync;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Enumeration;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;

/**
 * {@link ArchiveEntryReader} for zip archives.
 *
 * <p>
 * The central directory gives the entry count up front; progress is the share of entries
 * already handed out.
 */
public class ZipEntryReader implements ArchiveEntryReader {

	private static final Logger logger = LoggerFactory.getLogger(ZipEntryReader.class);

	private final ZipFile zipFile;

	private final Enumeration<? extends ZipEntry> entries;

	private final int totalEntries;

	private final long maxEntrySize;

	private int index = 0;

	@Nullable
	private ContainerEntry current;

	public ZipEntryReader(Path path, long maxEntrySize) throws IOException {
		this.maxEntrySize = maxEntrySize;
		this.zipFile = new ZipFile(path.toFile(), StandardCharsets.UTF_8);
		this.entries = zipFile.entries();
		this.totalEntries = zipFile.size();
		logger.debug("Starting registry update from zip file: \"{}\"", path);
	}

	@Override
	@Nullable
	public ContainerEntry nextEntry() {
		current = null;
		while (entries.hasMoreElements()) {
			ZipEntry entry = entries.nextElement();
			index++;
			if (entry.isDirectory()) {
				continue;
			}
			if (entry.getSize() > maxEntrySize) {
				logger.error("Error processing {}: Metadata size too large ({} bytes)", entry.getName(),
						entry.getSize());
				continue;
			}
			current = new ZipContainerEntry(entry);
			return current;
		}
		return null;
	}

	@Override
	public int percentConsumed() {
		if (totalEntries == 0) {
			return 0;
		}
		// Entries before the current one count as consumed
		return 100 * Math.max(index - 1, 0) / totalEntries;
	}

	@Override
	public ContainerFormat format() {
		return ContainerFormat.ZIP;
	}

	@Override
	public void close() throws IOException {
		zipFile.close();
	}

	private final class ZipContainerEntry implements ContainerEntry {

		private final ZipEntry entry;

		ZipContainerEntry(ZipEntry entry) {
			this.entry = entry;
		}

		@Override
		public String name() {
			return entry.getName();
		}

		@Override
		public long size() {
			return entry.getSize();
		}

		@Override
		public byte[] content() throws IOException {
			if (current != this) {
				throw new IllegalStateException("Archive has moved past entry " + entry.getName());
			}
			try (InputStream in = zipFile.getInputStream(entry)) {
				return in.readAllBytes();
			}
		}

	}

}
