package org.springaicommunity.metadata.sync;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.UUID;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.*;
import static org.springaicommunity.metadata.sync.ArchiveFixtures.*;

/**
 * Tests for {@link MetadataSynchronizer} wired with real archives, a real registry file
 * and a stub transfer engine that copies prepared archives instead of downloading them.
 */
@DisplayName("MetadataSynchronizer Tests")
class MetadataSynchronizerTest {

	private static final URI FIRST = URI.create("https://example.org/first/master.tar.gz");

	private static final URI SECOND = URI.create("https://example.org/second/master.zip");

	private static final URI THIRD = URI.create("https://example.org/third/master.tar.gz");

	@TempDir
	Path tempDir;

	private Path registryFile;

	private Path downloadDir;

	private StubTransferEngine transferEngine;

	private final Map<URI, String> currentTokens = new HashMap<>();

	private RecordingReporter reporter;

	@BeforeEach
	void setUp() throws IOException {
		registryFile = tempDir.resolve("registry.json");
		downloadDir = Files.createDirectories(tempDir.resolve("downloads"));
		transferEngine = new StubTransferEngine();
		reporter = new RecordingReporter();
	}

	private FileSystemMetadataRegistry registry(RepositorySource... repositories) {
		FileSystemMetadataRegistry registry = FileSystemMetadataRegistry.load(registryFile,
				ObjectMapperFactory.create(), List.of(repositories));
		registry.save();
		return registry;
	}

	private MetadataSynchronizer synchronizer(MetadataRegistry registry) {
		return synchronizer(registry, new SyncProperties());
	}

	private MetadataSynchronizer synchronizer(MetadataRegistry registry, SyncProperties properties) {
		return MetadataSyncBuilder.create()
			.properties(properties)
			.registry(registry)
			.transferEngine(transferEngine)
			.changeTokenProbe(uri -> Optional.ofNullable(currentTokens.get(uri)))
			.userReporter(reporter)
			.build();
	}

	private Path tarGzFixture(String name, Map<String, String> entries) throws IOException {
		return tarGz(tempDir.resolve(name), entries);
	}

	private Path zipFixture(String name, Map<String, String> entries) throws IOException {
		return zip(tempDir.resolve(name), entries);
	}

	private static Map<String, String> modules(String prefix, String... identifiers) {
		Map<String, String> entries = entries();
		entries.put(prefix + "/", "");
		entries.put(prefix + "/README.md", "# metadata");
		for (String identifier : identifiers) {
			entries.put(prefix + "/" + identifier + "/" + identifier + "-1.0.ckan", ckan(identifier, "1.0"));
		}
		return entries;
	}

	private static List<String> identifiers(MetadataRegistry registry) {
		return registry.getAvailable().stream().map(PackageDescriptor::identifier).toList();
	}

	@Nested
	@DisplayName("Freshness Tests")
	class FreshnessTest {

		@Test
		@DisplayName("Should return no changes without downloading when every token matches")
		void shouldShortCircuitWhenUnchanged() throws Exception {
			FileSystemMetadataRegistry registry = registry(new RepositorySource("first", FIRST, "a1"),
					new RepositorySource("second", SECOND, "b1"));
			currentTokens.put(FIRST, "a1");
			currentTokens.put(SECOND, "b1");
			byte[] before = Files.readAllBytes(registryFile);

			MetadataSynchronizer synchronizer = synchronizer(registry);
			SyncResult result = synchronizer.syncAll();

			assertThat(result.outcome()).isEqualTo(SyncOutcome.NO_CHANGES);
			assertThat(transferEngine.calls).isEmpty();
			assertThat(Files.readAllBytes(registryFile)).isEqualTo(before);
			assertThat(reporter.messages).contains("No changes since last update");
			assertThat(synchronizer.getPhase()).isEqualTo(SyncPhase.NO_CHANGES);
		}

		@Test
		@DisplayName("Should run a full cycle when one token differs")
		void shouldSyncWhenOneTokenChanged() throws Exception {
			FileSystemMetadataRegistry registry = registry(new RepositorySource("first", FIRST, "a1"),
					new RepositorySource("second", SECOND, "b1"));
			currentTokens.put(FIRST, "a1");
			currentTokens.put(SECOND, "b2");
			transferEngine.serve(FIRST, tarGzFixture("first.tar.gz", modules("first", "A")), "a1");
			transferEngine.serve(SECOND, zipFixture("second.zip", modules("second", "B")), "b2");

			SyncResult result = synchronizer(registry).syncAll();

			assertThat(result.outcome()).isEqualTo(SyncOutcome.UPDATED);
			assertThat(transferEngine.calls).containsExactly(List.of(FIRST, SECOND));
			assertThat(identifiers(registry)).containsExactly("A", "B");
			assertThat(registry.getRepositories()).extracting(RepositorySource::lastServerEtag)
				.containsExactly("a1", "b2");
		}

		@Test
		@DisplayName("Should run a full cycle when a cached token is empty")
		void shouldSyncWhenCachedTokenEmpty() throws Exception {
			FileSystemMetadataRegistry registry = registry(new RepositorySource("first", FIRST, ""));
			currentTokens.put(FIRST, "");
			transferEngine.serve(FIRST, tarGzFixture("first.tar.gz", modules("first", "A")), null);

			SyncResult result = synchronizer(registry).syncAll();

			assertThat(result.outcome()).isEqualTo(SyncOutcome.UPDATED);
			assertThat(transferEngine.calls).hasSize(1);
		}

		@Test
		@DisplayName("Should fetch each repository URI once")
		void shouldDeduplicateRepositories() throws Exception {
			InMemoryRegistry registry = new InMemoryRegistry(List.of(new RepositorySource("first", FIRST, null),
					new RepositorySource("again", FIRST, null)));
			transferEngine.serve(FIRST, tarGzFixture("first.tar.gz", modules("first", "A")), "a1");

			SyncResult result = synchronizer(registry).syncAll();

			assertThat(result.repositoryCount()).isEqualTo(1);
			assertThat(transferEngine.calls).containsExactly(List.of(FIRST));
		}

	}

	@Nested
	@DisplayName("Extraction Tests")
	class ExtractionTest {

		@Test
		@DisplayName("Should yield identical descriptors from tar.gz and zip packaging")
		void shouldBeFormatTransparent() throws Exception {
			Map<String, String> entries = modules("CKAN-meta-master", "Astrogator", "KerbalEngineer", "MechJeb2");

			transferEngine.serve(FIRST, tarGzFixture("same.tar.gz", entries), null);
			FileSystemMetadataRegistry tarRegistry = registry(new RepositorySource("meta", FIRST, null));
			synchronizer(tarRegistry).syncAll();
			List<PackageDescriptor> fromTar = tarRegistry.getAvailable();

			Files.delete(registryFile);
			transferEngine.serve(FIRST, zipFixture("same.zip", entries), null);
			FileSystemMetadataRegistry zipRegistry = registry(new RepositorySource("meta", FIRST, null));
			synchronizer(zipRegistry).syncAll();
			List<PackageDescriptor> fromZip = zipRegistry.getAvailable();

			assertThat(fromTar).hasSize(3);
			assertThat(fromZip).containsExactlyInAnyOrderElementsOf(fromTar);
		}

		@Test
		@DisplayName("Should skip records for newer clients and still update")
		void shouldSkipBenignFailures() throws Exception {
			Map<String, String> entries = modules("meta", "A", "B");
			entries.put("meta/Future/Future-9.0.ckan", ckan("v1.99", "Future", "9.0"));
			entries.put("meta/Broken/Broken-1.0.ckan", "{\"spec_version\":\"v1.4\",\"version\":\"1.0\"}");
			transferEngine.serve(FIRST, tarGzFixture("first.tar.gz", entries), "a1");
			FileSystemMetadataRegistry registry = registry(new RepositorySource("first", FIRST, null));

			SyncResult result = synchronizer(registry).syncAll();

			assertThat(result.outcome()).isEqualTo(SyncOutcome.UPDATED);
			assertThat(result.failure()).isNull();
			assertThat(identifiers(registry)).containsExactly("A", "B");
		}

		@Test
		@DisplayName("Should skip oversized entry and keep the following ones")
		void shouldIsolateOversizedEntry() throws Exception {
			Map<String, String> entries = entries();
			entries.put("meta/Huge/Huge-1.0.ckan", ckan("Huge", "1.0") + repeat(' ', 8192));
			for (int i = 0; i < 4; i++) {
				entries.put("meta/M" + i + "/M" + i + "-1.0.ckan", ckan("M" + i, "1.0"));
			}
			transferEngine.serve(FIRST, tarGzFixture("first.tar.gz", entries), null);
			FileSystemMetadataRegistry registry = registry(new RepositorySource("first", FIRST, null));
			SyncProperties properties = new SyncProperties();
			properties.setMaxEntrySizeBytes(4096);

			SyncResult result = synchronizer(registry, properties).syncAll();

			assertThat(result.descriptorCount()).isEqualTo(4);
			assertThat(identifiers(registry)).containsExactly("M0", "M1", "M2", "M3");
		}

		@Test
		@DisplayName("Should concatenate descriptors in repository order including duplicates")
		void shouldConcatenateInRepositoryOrder() throws Exception {
			transferEngine.serve(FIRST, tarGzFixture("first.tar.gz", modules("first", "A", "Shared")), null);
			transferEngine.serve(SECOND, zipFixture("second.zip", modules("second", "Shared", "B")), null);
			FileSystemMetadataRegistry registry = registry(new RepositorySource("first", FIRST, null),
					new RepositorySource("second", SECOND, null));

			synchronizer(registry).syncAll();

			assertThat(identifiers(registry)).containsExactly("A", "Shared", "Shared", "B");
		}

		@Test
		@DisplayName("Should report progress that strictly increases within each archive")
		void shouldReportMonotonicProgress() throws Exception {
			Map<String, String> first = entries();
			Map<String, String> second = entries();
			for (int i = 0; i < 150; i++) {
				first.put("first/M" + i + ".ckan", ckan("M" + i, "1.0") + repeat(' ', 300 + i * 7));
				second.put("second/N" + i + ".ckan", ckan("N" + i, "1.0"));
			}
			transferEngine.serve(FIRST, tarGzFixture("first.tar.gz", first), null);
			transferEngine.serve(SECOND, zipFixture("second.zip", second), null);
			FileSystemMetadataRegistry registry = registry(new RepositorySource("first", FIRST, null),
					new RepositorySource("second", SECOND, null));

			synchronizer(registry).syncAll();

			for (String label : List.of("Loading modules from first repository",
					"Loading modules from second repository")) {
				List<Integer> values = reporter.progressFor(label);
				assertThat(values).isNotEmpty();
				for (int i = 1; i < values.size(); i++) {
					assertThat(values.get(i)).isGreaterThan(values.get(i - 1));
				}
			}
		}

		@Test
		@DisplayName("Should commit nothing when no descriptors were found")
		void shouldNotCommitEmptyResult() throws Exception {
			FileSystemMetadataRegistry registry = registry(new RepositorySource("first", FIRST, null));
			registry.setAvailable(List.of(new PackageDescriptor("v1.4", "Old", null, null, List.of(), "1.0",
					List.of(), List.of(), List.of())));
			registry.save();
			transferEngine.serve(FIRST, zipFixture("empty.zip", modules("first")), "a1");

			SyncResult result = synchronizer(registry).syncAll();

			assertThat(result.outcome()).isEqualTo(SyncOutcome.NO_CHANGES);
			assertThat(identifiers(registry)).containsExactly("Old");
			assertThat(registry.getRepositories().get(0).lastServerEtag()).isNull();
		}

	}

	@Nested
	@DisplayName("Download Count Tests")
	class DownloadCountTest {

		@Test
		@DisplayName("Should commit the last repository's table instead of a union")
		void shouldUseLastStatisticsTable() throws Exception {
			Map<String, String> first = modules("first", "A");
			first.put("first/download_counts.json", "{\"A\":100,\"OnlyFirst\":7}");
			Map<String, String> second = modules("second", "B");
			second.put("second/download_counts.json", "{\"A\":1,\"B\":2}");
			transferEngine.serve(FIRST, tarGzFixture("first.tar.gz", first), null);
			transferEngine.serve(SECOND, zipFixture("second.zip", second), null);
			FileSystemMetadataRegistry registry = registry(new RepositorySource("first", FIRST, null),
					new RepositorySource("second", SECOND, null));

			synchronizer(registry).syncAll();

			assertThat(registry.getDownloadCounts()).containsExactly(entry("A", 1), entry("B", 2));
		}

		@Test
		@DisplayName("Should keep an earlier table when later repositories carry none")
		void shouldKeepEarlierTable() throws Exception {
			Map<String, String> first = modules("first", "A");
			first.put("first/download_counts.json", "{\"A\":100}");
			transferEngine.serve(FIRST, tarGzFixture("first.tar.gz", first), null);
			transferEngine.serve(SECOND, zipFixture("second.zip", modules("second", "B")), null);
			FileSystemMetadataRegistry registry = registry(new RepositorySource("first", FIRST, null),
					new RepositorySource("second", SECOND, null));

			synchronizer(registry).syncAll();

			assertThat(registry.getDownloadCounts()).containsExactly(entry("A", 100));
			assertThat(reporter.messages).contains("Loaded download counts from first repository");
		}

		@Test
		@DisplayName("Should fail on unreadable statistics record")
		void shouldFailOnBadStatistics() throws Exception {
			Map<String, String> first = modules("first", "A");
			first.put("first/download_counts.json", "[not a table");
			transferEngine.serve(FIRST, tarGzFixture("first.tar.gz", first), null);
			FileSystemMetadataRegistry registry = registry(new RepositorySource("first", FIRST, null));

			SyncResult result = synchronizer(registry).syncAll();

			assertThat(result.outcome()).isEqualTo(SyncOutcome.FAILED);
			assertThat(result.failure()).isInstanceOf(MetadataParseException.class);
		}

	}

	@Nested
	@DisplayName("Failure Tests")
	class FailureTest {

		@Test
		@DisplayName("Should fail and keep the registry file unchanged on a fatal record")
		void shouldAbortOnFatalRecord() throws Exception {
			Map<String, String> entries = modules("meta", "A");
			entries.put("meta/Corrupt/Corrupt-1.0.ckan", "{ this is not json");
			transferEngine.serve(FIRST, tarGzFixture("first.tar.gz", entries), "a2");
			FileSystemMetadataRegistry registry = registry(new RepositorySource("first", FIRST, "a1"));
			byte[] before = Files.readAllBytes(registryFile);

			MetadataSynchronizer synchronizer = synchronizer(registry);
			SyncResult result = synchronizer.syncAll();

			assertThat(result.outcome()).isEqualTo(SyncOutcome.FAILED);
			assertThat(result.failure()).isInstanceOf(MetadataParseException.class)
				.hasMessageContaining("meta/Corrupt/Corrupt-1.0.ckan");
			assertThat(Files.readAllBytes(registryFile)).isEqualTo(before);
			assertThat(registry.getRepositories().get(0).lastServerEtag()).isEqualTo("a1");
			assertThat(synchronizer.getPhase()).isEqualTo(SyncPhase.FAILED);
			assertThat(reporter.messages).anyMatch(message -> message.startsWith("Repository update failed: "));
		}

		@Test
		@DisplayName("Should commit nothing from earlier repositories when a later one fails")
		void shouldNotPartiallyCommit() throws Exception {
			Map<String, String> broken = modules("second", "B");
			broken.put("second/Corrupt.ckan", "{\"spec_version\": [");
			transferEngine.serve(FIRST, tarGzFixture("first.tar.gz", modules("first", "A")), "a1");
			transferEngine.serve(SECOND, zipFixture("second.zip", broken), "b1");
			transferEngine.serve(THIRD, tarGzFixture("third.tar.gz", modules("third", "C")), "c1");
			FileSystemMetadataRegistry registry = registry(new RepositorySource("first", FIRST, null),
					new RepositorySource("second", SECOND, null), new RepositorySource("third", THIRD, null));

			SyncResult result = synchronizer(registry).syncAll();

			assertThat(result.outcome()).isEqualTo(SyncOutcome.FAILED);
			assertThat(registry.getAvailable()).isEmpty();
			assertThat(FileSystemMetadataRegistry.load(registryFile, ObjectMapperFactory.create(), List.of())
				.getAvailable()).isEmpty();
			assertThat(registry.getRepositories()).extracting(RepositorySource::lastServerEtag)
				.containsOnlyNulls();
		}

		@Test
		@DisplayName("Should fail on an archive that is neither tar.gz nor zip")
		void shouldFailOnUnsupportedContainer() throws Exception {
			Path html = Files.writeString(tempDir.resolve("error.html"), "<html>Rate limited</html>");
			transferEngine.serve(FIRST, html, null);
			FileSystemMetadataRegistry registry = registry(new RepositorySource("first", FIRST, null));

			SyncResult result = synchronizer(registry).syncAll();

			assertThat(result.outcome()).isEqualTo(SyncOutcome.FAILED);
			assertThat(result.failure()).isInstanceOf(UnsupportedContainerException.class);
		}

		@Test
		@DisplayName("Should fail naming the path when a reported download is missing on disk")
		void shouldFailOnMissingArtifact() throws Exception {
			Path gone = downloadDir.resolve("deleted-before-extraction.download");
			transferEngine.reportWithoutFile(FIRST, gone, "a2");
			FileSystemMetadataRegistry registry = registry(new RepositorySource("first", FIRST, "a1"));
			byte[] before = Files.readAllBytes(registryFile);

			SyncResult result = synchronizer(registry).syncAll();

			assertThat(result.outcome()).isEqualTo(SyncOutcome.FAILED);
			assertThat(result.failure()).isInstanceOf(ArtifactNotFoundException.class)
				.hasMessageContaining(gone.toString());
			assertThat(((ArtifactNotFoundException) result.failure()).getPath()).isEqualTo(gone);
			assertThat(Files.readAllBytes(registryFile)).isEqualTo(before);
			assertThat(registry.getRepositories().get(0).lastServerEtag()).isEqualTo("a1");
			assertThat(reporter.messages).contains("Repository update failed: File not found: " + gone);
		}

		@Test
		@DisplayName("Should fail when a download fails")
		void shouldFailOnDownloadError() {
			FileSystemMetadataRegistry registry = registry(new RepositorySource("first", FIRST, null));

			SyncResult result = synchronizer(registry).syncAll();

			assertThat(result.outcome()).isEqualTo(SyncOutcome.FAILED);
			assertThat(result.failure()).isInstanceOf(DownloadException.class);
		}

		@Test
		@DisplayName("Should fail when the registry cannot be saved and keep its previous state")
		void shouldFailOnSaveError() throws Exception {
			transferEngine.serve(FIRST, tarGzFixture("first.tar.gz", modules("first", "A")), "a1");
			InMemoryRegistry registry = new InMemoryRegistry(List.of(new RepositorySource("first", FIRST, null)));
			registry.failOnSave = true;

			SyncResult result = synchronizer(registry).syncAll();

			assertThat(result.outcome()).isEqualTo(SyncOutcome.FAILED);
			assertThat(result.failure()).isInstanceOf(RegistryException.class);
			assertThat(registry.rolledBack).isTrue();
			assertThat(registry.getAvailable()).isEmpty();
		}

	}

	@Nested
	@DisplayName("Cleanup and Reporting Tests")
	class CleanupTest {

		@Test
		@DisplayName("Should delete downloaded files after success")
		void shouldDeleteDownloadsAfterSuccess() throws Exception {
			transferEngine.serve(FIRST, tarGzFixture("first.tar.gz", modules("first", "A")), null);
			FileSystemMetadataRegistry registry = registry(new RepositorySource("first", FIRST, null));

			synchronizer(registry).syncAll();

			assertThat(transferEngine.written).isNotEmpty().allSatisfy(file -> assertThat(file).doesNotExist());
		}

		@Test
		@DisplayName("Should delete downloaded files after failure")
		void shouldDeleteDownloadsAfterFailure() throws Exception {
			Map<String, String> entries = modules("first", "A");
			entries.put("first/Corrupt.ckan", "{ nope");
			transferEngine.serve(FIRST, tarGzFixture("first.tar.gz", entries), null);
			FileSystemMetadataRegistry registry = registry(new RepositorySource("first", FIRST, null));

			synchronizer(registry).syncAll();

			try (Stream<Path> files = Files.list(downloadDir)) {
				assertThat(files).isEmpty();
			}
		}

		@Test
		@DisplayName("Should report dependency inconsistencies after commit")
		void shouldReportInconsistencies() throws Exception {
			Map<String, String> entries = entries();
			entries.put("meta/B.ckan",
					"{\"spec_version\":\"v1.4\",\"identifier\":\"B\",\"version\":\"1.0\",\"depends\":[{\"name\":\"Gone\"}]}");
			transferEngine.serve(FIRST, tarGzFixture("first.tar.gz", entries), null);
			FileSystemMetadataRegistry registry = registry(new RepositorySource("first", FIRST, null));

			synchronizer(registry).syncAll();

			assertThat(reporter.messages).anySatisfy(message -> assertThat(message)
				.startsWith(MetadataSynchronizer.INCONSISTENCIES_HEADER)
				.contains("- B 1.0 depends on Gone, which is not available"));
		}

	}

	/**
	 * Copies a prepared archive per URI into the download directory and reports it, the
	 * way a real engine reports a finished download. URIs without an archive fail.
	 */
	private class StubTransferEngine implements TransferEngine {

		final Map<URI, Path> archives = new HashMap<>();

		final Map<URI, String> etags = new HashMap<>();

		final List<List<URI>> calls = new ArrayList<>();

		final List<Path> written = new ArrayList<>();

		final Map<URI, Path> vanished = new HashMap<>();

		void serve(URI uri, Path archive, String etag) {
			archives.put(uri, archive);
			etags.put(uri, etag);
		}

		void reportWithoutFile(URI uri, Path reportedPath, String etag) {
			vanished.put(uri, reportedPath);
			etags.put(uri, etag);
		}

		@Override
		public void fetchAll(List<URI> targets, DownloadListener listener) {
			calls.add(List.copyOf(targets));
			List<URI> missing = new ArrayList<>();
			for (URI uri : targets) {
				if (vanished.containsKey(uri)) {
					listener.onComplete(uri, vanished.get(uri), null, etags.get(uri));
					continue;
				}
				Path archive = archives.get(uri);
				if (archive == null) {
					missing.add(uri);
					listener.onComplete(uri, null, new DownloadException("HTTP 404 while downloading " + uri), null);
					continue;
				}
				try {
					Path target = downloadDir.resolve(UUID.randomUUID() + ".download");
					Files.copy(archive, target, StandardCopyOption.REPLACE_EXISTING);
					written.add(target);
					listener.onComplete(uri, target, null, etags.get(uri));
				}
				catch (IOException e) {
					throw new DownloadException("Stub copy failed", e);
				}
			}
			if (!missing.isEmpty()) {
				throw new DownloadException("Failed to download " + missing.size() + " of " + targets.size()
						+ " repositories");
			}
		}

	}

	private static class RecordingReporter implements UserReporter {

		final List<String> messages = new ArrayList<>();

		final Map<String, List<Integer>> progress = new LinkedHashMap<>();

		@Override
		public void raiseProgress(String label, int percent) {
			progress.computeIfAbsent(label, key -> new ArrayList<>()).add(percent);
		}

		@Override
		public void raiseMessage(String message) {
			messages.add(message);
		}

		List<Integer> progressFor(String label) {
			return progress.getOrDefault(label, List.of());
		}

	}

	/**
	 * Registry that keeps state in memory and can be told to fail on save.
	 */
	private static class InMemoryRegistry implements MetadataRegistry {

		private final List<RepositorySource> repositories;

		private List<PackageDescriptor> available = List.of();

		private List<PackageDescriptor> stagedAvailable;

		boolean failOnSave = false;

		boolean rolledBack = false;

		InMemoryRegistry(List<RepositorySource> repositories) {
			this.repositories = new ArrayList<>(repositories);
		}

		@Override
		public List<RepositorySource> getRepositories() {
			return List.copyOf(repositories);
		}

		@Override
		public List<PackageDescriptor> getAvailable() {
			return available;
		}

		@Override
		public SortedMap<String, Integer> getDownloadCounts() {
			return new TreeMap<>();
		}

		@Override
		public void addRepository(RepositorySource repository) {
			repositories.add(repository);
		}

		@Override
		public void setAvailable(List<PackageDescriptor> descriptors) {
			stagedAvailable = descriptors;
		}

		@Override
		public void setDownloadCounts(SortedMap<String, Integer> downloadCounts) {
		}

		@Override
		public void setLastServerEtag(URI repositoryUri, String etag) {
		}

		@Override
		public void save() {
			if (failOnSave) {
				throw new RegistryException("Disk full", new IOException("No space left on device"));
			}
			available = stagedAvailable;
		}

		@Override
		public void rollback() {
			rolledBack = true;
			stagedAvailable = null;
		}

		@Override
		public List<String> getInconsistencies() {
			return List.of();
		}

	}

}
