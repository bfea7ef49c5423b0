package org.springaicommunity.metadata.sync;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.zip.GZIPInputStream;
import java.util.zip.ZipException;

/**
 * Identifies an archive's container format from its content.
 *
 * <p>
 * File names are never consulted: repository servers may serve archives under any name.
 * A gzip stream is only accepted as {@link ContainerFormat#TAR_GZ} when its decompressed
 * header carries the POSIX {@code ustar} magic.
 */
public class FormatDetector {

	private static final Logger logger = LoggerFactory.getLogger(FormatDetector.class);

	private static final byte[] GZIP_MAGIC = new byte[] { 0x1f, (byte) 0x8b };

	private static final byte[] ZIP_MAGIC = new byte[] { 'P', 'K', 0x03, 0x04 };

	private static final byte[] EMPTY_ZIP_MAGIC = new byte[] { 'P', 'K', 0x05, 0x06 };

	private static final byte[] TAR_MAGIC = new byte[] { 'u', 's', 't', 'a', 'r' };

	// TAR magic is at offset 257 of the first header block
	private static final int TAR_MAGIC_OFFSET = 257;

	/**
	 * Identify the container format of a local file.
	 * @param path the file to inspect
	 * @return the detected format, {@link ContainerFormat#UNSUPPORTED} if no signature
	 * matches
	 * @throws IOException if the file cannot be read
	 */
	public ContainerFormat identify(Path path) throws IOException {
		byte[] header;
		try (InputStream in = Files.newInputStream(path)) {
			header = in.readNBytes(4);
		}

		if (startsWith(header, ZIP_MAGIC) || startsWith(header, EMPTY_ZIP_MAGIC)) {
			return ContainerFormat.ZIP;
		}
		if (startsWith(header, GZIP_MAGIC) && isCompressedTar(path)) {
			return ContainerFormat.TAR_GZ;
		}
		return ContainerFormat.UNSUPPORTED;
	}

	private boolean isCompressedTar(Path path) throws IOException {
		try (InputStream in = new GZIPInputStream(new BufferedInputStream(Files.newInputStream(path)))) {
			byte[] tarHeader = in.readNBytes(TAR_MAGIC_OFFSET + TAR_MAGIC.length);
			if (tarHeader.length < TAR_MAGIC_OFFSET + TAR_MAGIC.length) {
				return false;
			}
			for (int i = 0; i < TAR_MAGIC.length; i++) {
				if (tarHeader[TAR_MAGIC_OFFSET + i] != TAR_MAGIC[i]) {
					return false;
				}
			}
			return true;
		}
		catch (ZipException | EOFException e) {
			logger.debug("{} has a gzip signature but is not a readable gzip stream: {}", path, e.getMessage());
			return false;
		}
	}

	private static boolean startsWith(byte[] header, byte[] magic) {
		if (header.length < magic.length) {
			return false;
		}
		for (int i = 0; i < magic.length; i++) {
			if (header[i] != magic[i]) {
				return false;
			}
		}
		return true;
	}

}
