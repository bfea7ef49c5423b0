package org.springaicommunity.metadata.sync;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.springaicommunity.metadata.sync.ArchiveFixtures.*;

/**
 * Unit tests for {@link TarGzEntryReader}.
 */
@DisplayName("TarGzEntryReader Tests")
class TarGzEntryReaderTest {

	@TempDir
	Path tempDir;

	@Nested
	@DisplayName("Traversal Tests")
	class TraversalTest {

		@Test
		@DisplayName("Should return file entries in archive order")
		void shouldReturnEntriesInOrder() throws Exception {
			Map<String, String> entries = entries();
			entries.put("CKAN-meta-master/", "");
			entries.put("CKAN-meta-master/A/A-1.0.ckan", ckan("A", "1.0"));
			entries.put("CKAN-meta-master/B/B-2.0.ckan", ckan("B", "2.0"));
			entries.put("CKAN-meta-master/download_counts.json", "{\"A\":5}");
			Path archive = tarGz(tempDir.resolve("repo.tar.gz"), entries);

			List<String> names = new ArrayList<>();
			try (TarGzEntryReader reader = new TarGzEntryReader(archive, Long.MAX_VALUE)) {
				ContainerEntry entry;
				while ((entry = reader.nextEntry()) != null) {
					names.add(entry.name());
				}
			}

			assertThat(names).containsExactly("CKAN-meta-master/A/A-1.0.ckan", "CKAN-meta-master/B/B-2.0.ckan",
					"CKAN-meta-master/download_counts.json");
		}

		@Test
		@DisplayName("Should expose entry content and size")
		void shouldExposeContent() throws Exception {
			Map<String, String> entries = entries();
			entries.put("A.ckan", ckan("A", "1.0"));
			Path archive = tarGz(tempDir.resolve("repo.tar.gz"), entries);

			try (TarGzEntryReader reader = new TarGzEntryReader(archive, Long.MAX_VALUE)) {
				ContainerEntry entry = reader.nextEntry();

				assertThat(entry).isNotNull();
				assertThat(entry.contentAsString()).isEqualTo(ckan("A", "1.0"));
				assertThat(entry.size()).isEqualTo(ckan("A", "1.0").length());
				assertThat(reader.format()).isEqualTo(ContainerFormat.TAR_GZ);
			}
		}

		@Test
		@DisplayName("Should allow reading content more than once")
		void shouldCacheContent() throws Exception {
			Map<String, String> entries = entries();
			entries.put("A.ckan", ckan("A", "1.0"));
			Path archive = tarGz(tempDir.resolve("repo.tar.gz"), entries);

			try (TarGzEntryReader reader = new TarGzEntryReader(archive, Long.MAX_VALUE)) {
				ContainerEntry entry = reader.nextEntry();

				assertThat(entry.content()).isEqualTo(entry.content());
			}
		}

		@Test
		@DisplayName("Should refuse content of an entry the reader has moved past")
		void shouldRefuseStaleEntry() throws Exception {
			Map<String, String> entries = entries();
			entries.put("A.ckan", ckan("A", "1.0"));
			entries.put("B.ckan", ckan("B", "1.0"));
			Path archive = tarGz(tempDir.resolve("repo.tar.gz"), entries);

			try (TarGzEntryReader reader = new TarGzEntryReader(archive, Long.MAX_VALUE)) {
				ContainerEntry first = reader.nextEntry();
				reader.nextEntry();

				assertThatThrownBy(first::content).isInstanceOf(IllegalStateException.class)
					.hasMessageContaining("A.ckan");
			}
		}

		@Test
		@DisplayName("Should return null for an empty archive")
		void shouldHandleEmptyArchive() throws Exception {
			Path archive = tarGz(tempDir.resolve("empty.tar.gz"), entries());

			try (TarGzEntryReader reader = new TarGzEntryReader(archive, Long.MAX_VALUE)) {
				assertThat(reader.nextEntry()).isNull();
			}
		}

	}

	@Nested
	@DisplayName("Oversized Entry Tests")
	class OversizedEntryTest {

		@Test
		@DisplayName("Should skip oversized entry and keep every following entry")
		void shouldSkipOversizedEntry() throws Exception {
			Map<String, String> entries = entries();
			entries.put("huge.ckan", repeat(' ', 4096));
			for (int i = 0; i < 5; i++) {
				entries.put("M" + i + ".ckan", ckan("M" + i, "1.0"));
			}
			Path archive = tarGz(tempDir.resolve("repo.tar.gz"), entries);

			List<String> names = new ArrayList<>();
			try (TarGzEntryReader reader = new TarGzEntryReader(archive, 1024)) {
				ContainerEntry entry;
				while ((entry = reader.nextEntry()) != null) {
					entry.content();
					names.add(entry.name());
				}
			}

			assertThat(names).hasSize(5).doesNotContain("huge.ckan").startsWith("M0.ckan");
		}

		@Test
		@DisplayName("Should accept entry exactly at the limit")
		void shouldAcceptEntryAtLimit() throws Exception {
			Map<String, String> entries = entries();
			entries.put("edge.ckan", repeat(' ', 1024));
			Path archive = tarGz(tempDir.resolve("repo.tar.gz"), entries);

			try (TarGzEntryReader reader = new TarGzEntryReader(archive, 1024)) {
				ContainerEntry entry = reader.nextEntry();

				assertThat(entry).isNotNull();
				assertThat(entry.content()).hasSize(1024);
			}
		}

	}

	@Nested
	@DisplayName("Progress Tests")
	class ProgressTest {

		@Test
		@DisplayName("Should report progress between 0 and 100 that never decreases")
		void shouldReportNonDecreasingProgress() throws Exception {
			Map<String, String> entries = entries();
			for (int i = 0; i < 200; i++) {
				entries.put("M" + i + ".ckan", ckan("M" + i, i + ".0") + repeat(' ', 200 + i * 13));
			}
			Path archive = tarGz(tempDir.resolve("repo.tar.gz"), entries);

			List<Integer> percents = new ArrayList<>();
			try (TarGzEntryReader reader = new TarGzEntryReader(archive, Long.MAX_VALUE)) {
				while (reader.nextEntry() != null) {
					percents.add(reader.percentConsumed());
				}
			}

			assertThat(percents).hasSize(200).allSatisfy(p -> assertThat(p).isBetween(0, 100)).isSorted();
		}

	}

}
