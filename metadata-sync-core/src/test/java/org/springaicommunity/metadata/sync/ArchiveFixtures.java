package org.springaicommunity.metadata.sync;

import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveOutputStream;
import org.apache.commons.compress.compressors.gzip.GzipCompressorOutputStream;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * Builds repository archives for tests. Entries are written in insertion order; a name
 * ending in {@code /} becomes a directory entry.
 */
final class ArchiveFixtures {

	private ArchiveFixtures() {
	}

	static Map<String, String> entries() {
		return new LinkedHashMap<>();
	}

	static String ckan(String identifier, String version) {
		return ckan("v1.4", identifier, version);
	}

	static String ckan(String specVersion, String identifier, String version) {
		return "{\"spec_version\":\"" + specVersion + "\",\"identifier\":\"" + identifier + "\",\"version\":\""
				+ version + "\",\"name\":\"" + identifier + " mod\",\"author\":\"someone\",\"license\":\"MIT\"}";
	}

	static Path tarGz(Path file, Map<String, String> entries) throws IOException {
		try (OutputStream out = Files.newOutputStream(file);
				GzipCompressorOutputStream gzip = new GzipCompressorOutputStream(out);
				TarArchiveOutputStream tar = new TarArchiveOutputStream(gzip)) {
			tar.setLongFileMode(TarArchiveOutputStream.LONGFILE_POSIX);
			for (Map.Entry<String, String> entry : entries.entrySet()) {
				TarArchiveEntry tarEntry = new TarArchiveEntry(entry.getKey());
				if (entry.getKey().endsWith("/")) {
					tar.putArchiveEntry(tarEntry);
				}
				else {
					byte[] content = entry.getValue().getBytes(StandardCharsets.UTF_8);
					tarEntry.setSize(content.length);
					tar.putArchiveEntry(tarEntry);
					tar.write(content);
				}
				tar.closeArchiveEntry();
			}
		}
		return file;
	}

	static Path zip(Path file, Map<String, String> entries) throws IOException {
		try (ZipOutputStream zip = new ZipOutputStream(Files.newOutputStream(file), StandardCharsets.UTF_8)) {
			for (Map.Entry<String, String> entry : entries.entrySet()) {
				zip.putNextEntry(new ZipEntry(entry.getKey()));
				if (!entry.getKey().endsWith("/")) {
					zip.write(entry.getValue().getBytes(StandardCharsets.UTF_8));
				}
				zip.closeEntry();
			}
		}
		return file;
	}

	static String repeat(char c, int count) {
		return String.valueOf(c).repeat(count);
	}

}
