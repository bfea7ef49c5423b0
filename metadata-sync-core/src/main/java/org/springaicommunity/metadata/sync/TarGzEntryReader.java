package org.springaicommunity.metadata.sync;

import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveInputStream;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.nio.channels.Channels;
import java.nio.channels.SeekableByteChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.zip.GZIPInputStream;

/**
 * {@link ArchiveEntryReader} for gzip-compressed tar archives.
 *
 * <p>
 * Progress is measured on the compressed file. Entries whose declared size exceeds the
 * configured maximum are skipped with an error log; traversal continues with the next
 * entry.
 */
public class TarGzEntryReader implements ArchiveEntryReader {

	private static final Logger logger = LoggerFactory.getLogger(TarGzEntryReader.class);

	private final SeekableByteChannel channel;

	private final long totalBytes;

	private final TarArchiveInputStream tar;

	private final long maxEntrySize;

	@Nullable
	private TarEntry current;

	public TarGzEntryReader(Path path, long maxEntrySize) throws IOException {
		this.maxEntrySize = maxEntrySize;
		this.channel = Files.newByteChannel(path);
		try {
			this.totalBytes = channel.size();
			this.tar = new TarArchiveInputStream(
					new GZIPInputStream(new BufferedInputStream(Channels.newInputStream(channel))),
					StandardCharsets.UTF_8.name());
		}
		catch (IOException e) {
			channel.close();
			throw e;
		}
		logger.debug("Starting registry update from tar.gz file: \"{}\"", path);
	}

	@Override
	@Nullable
	public ContainerEntry nextEntry() throws IOException {
		current = null;
		TarArchiveEntry entry;
		while ((entry = tar.getNextEntry()) != null) {
			if (!entry.isFile()) {
				logger.debug("Skipping non-file archive entry {}", entry.getName());
				continue;
			}
			if (entry.getSize() > maxEntrySize) {
				logger.error("Error processing {}: Metadata size too large ({} bytes)", entry.getName(),
						entry.getSize());
				continue;
			}
			current = new TarEntry(entry.getName(), entry.getSize());
			return current;
		}
		return null;
	}

	@Override
	public int percentConsumed() throws IOException {
		if (totalBytes <= 0) {
			return 0;
		}
		return (int) (100 * channel.position() / totalBytes);
	}

	@Override
	public ContainerFormat format() {
		return ContainerFormat.TAR_GZ;
	}

	@Override
	public void close() throws IOException {
		// Closes the whole stream chain down to the channel
		tar.close();
	}

	private final class TarEntry implements ContainerEntry {

		private final String name;

		private final long size;

		private byte @Nullable [] content;

		TarEntry(String name, long size) {
			this.name = name;
			this.size = size;
		}

		@Override
		public String name() {
			return name;
		}

		@Override
		public long size() {
			return size;
		}

		@Override
		public byte[] content() throws IOException {
			if (content == null) {
				if (current != this) {
					throw new IllegalStateException("Archive has moved past entry " + name);
				}
				content = tar.readNBytes((int) size);
			}
			return content;
		}

	}

}
