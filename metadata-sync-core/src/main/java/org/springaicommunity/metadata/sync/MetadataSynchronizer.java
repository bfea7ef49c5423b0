package org.springaicommunity.metadata.sync;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Synchronizes every configured repository into the registry as one batch.
 *
 * <p>
 * A batch checks change-tokens, downloads all archives concurrently, extracts them one
 * after another in repository order and commits the result in one registry save. Any
 * fatal error aborts the batch before the commit, so the registry never holds data from
 * an incomplete extraction. Downloaded files are deleted whatever the outcome.
 *
 * <p>
 * Download counts follow a last-wins rule: the table of the last repository (in
 * repository order) whose archive carried a statistics record replaces all earlier ones.
 */
public class MetadataSynchronizer {

	private static final Logger logger = LoggerFactory.getLogger(MetadataSynchronizer.class);

	static final String INCONSISTENCIES_HEADER = "The following inconsistencies were found:";

	private final MetadataRegistry registry;

	private final FreshnessGate freshnessGate;

	private final TransferEngine transferEngine;

	private final RepositoryExtractor extractor;

	private final UserReporter reporter;

	private volatile SyncPhase phase = SyncPhase.IDLE;

	public MetadataSynchronizer(MetadataRegistry registry, FreshnessGate freshnessGate, TransferEngine transferEngine,
			RepositoryExtractor extractor, UserReporter reporter) {
		this.registry = registry;
		this.freshnessGate = freshnessGate;
		this.transferEngine = transferEngine;
		this.extractor = extractor;
		this.reporter = reporter;
	}

	/**
	 * The phase of the current or most recent batch.
	 */
	public SyncPhase getPhase() {
		return phase;
	}

	/**
	 * Run one sync batch across all configured repositories.
	 * @return {@link SyncOutcome#UPDATED} after a successful commit,
	 * {@link SyncOutcome#NO_CHANGES} if nothing changed or nothing was extracted,
	 * {@link SyncOutcome#FAILED} if a fatal error aborted the batch
	 */
	public synchronized SyncResult syncAll() {
		List<RepositorySource> repositories = distinctByUri(registry.getRepositories());

		transition(SyncPhase.CHECKING_FRESHNESS);
		reporter.raiseProgress("Checking for updates", 0);
		if (freshnessGate.allUnchanged(repositories)) {
			reporter.raiseProgress("Already up to date", 100);
			reporter.raiseMessage("No changes since last update");
			transition(SyncPhase.NO_CHANGES);
			return SyncResult.noChanges(repositories.size());
		}

		CompletionCollector completions = new CompletionCollector();
		try {
			transition(SyncPhase.FETCHING);
			List<URI> targets = repositories.stream().map(RepositorySource::uri).collect(Collectors.toList());
			transferEngine.fetchAll(targets, completions);
			Map<URI, DownloadArtifact> artifacts = completions.artifacts();

			transition(SyncPhase.EXTRACTING);
			List<RepositoryExtraction> extractions = new ArrayList<>();
			for (RepositorySource repository : repositories) {
				DownloadArtifact artifact = artifacts.get(repository.uri());
				if (artifact == null) {
					throw new DownloadException("No download completed for " + repository.uri());
				}
				extractions.add(extractor.extract(repository, artifact.path()));
			}

			List<PackageDescriptor> descriptors = concatDescriptors(extractions);
			if (descriptors.isEmpty()) {
				logger.warn("No modules found in {} repositories, registry left unchanged", repositories.size());
				transition(SyncPhase.NO_CHANGES);
				return SyncResult.noChanges(repositories.size());
			}

			transition(SyncPhase.COMMITTING);
			commit(descriptors, lastDownloadCounts(extractions), artifacts.values());
			showInconsistencies();

			transition(SyncPhase.UPDATED);
			return SyncResult.updated(repositories.size(), descriptors.size());
		}
		catch (MetadataSyncException | IOException e) {
			logger.error("Repository update failed in phase {}: {}", phase, e.getMessage(), e);
			reporter.raiseMessage("Repository update failed: " + e.getMessage());
			transition(SyncPhase.FAILED);
			return SyncResult.failed(repositories.size(), e);
		}
		finally {
			deleteDownloads(completions.files());
		}
	}

	private void commit(List<PackageDescriptor> descriptors, SortedMap<String, Integer> downloadCounts,
			Iterable<DownloadArtifact> artifacts) {
		try {
			registry.setAvailable(descriptors);
			registry.setDownloadCounts(downloadCounts);
			for (DownloadArtifact artifact : artifacts) {
				logger.debug("Setting etag for {}: {}", artifact.uri(), artifact.etag());
				registry.setLastServerEtag(artifact.uri(), artifact.etag());
			}
			registry.save();
		}
		catch (RuntimeException e) {
			registry.rollback();
			throw e;
		}
	}

	private void showInconsistencies() {
		List<String> inconsistencies = registry.getInconsistencies();
		if (inconsistencies.isEmpty()) {
			return;
		}
		StringBuilder message = new StringBuilder(INCONSISTENCIES_HEADER).append(System.lineSeparator());
		for (String inconsistency : inconsistencies) {
			message.append("- ").append(inconsistency).append(System.lineSeparator());
		}
		reporter.raiseMessage(message.toString());
	}

	static List<RepositorySource> distinctByUri(List<RepositorySource> repositories) {
		Map<URI, RepositorySource> byUri = new LinkedHashMap<>();
		for (RepositorySource repository : repositories) {
			byUri.putIfAbsent(repository.uri(), repository);
		}
		return List.copyOf(byUri.values());
	}

	static List<PackageDescriptor> concatDescriptors(List<RepositoryExtraction> extractions) {
		List<PackageDescriptor> descriptors = new ArrayList<>();
		for (RepositoryExtraction extraction : extractions) {
			descriptors.addAll(extraction.descriptors());
		}
		return descriptors;
	}

	/**
	 * Later tables replace earlier ones; they are never merged. With no statistics
	 * record at all the committed table is empty.
	 */
	static SortedMap<String, Integer> lastDownloadCounts(List<RepositoryExtraction> extractions) {
		SortedMap<String, Integer> downloadCounts = new TreeMap<>();
		for (RepositoryExtraction extraction : extractions) {
			if (extraction.downloadCounts() != null) {
				downloadCounts = extraction.downloadCounts();
			}
		}
		return downloadCounts;
	}

	private void transition(SyncPhase next) {
		logger.debug("Sync phase {} -> {}", phase, next);
		phase = next;
	}

	private static void deleteDownloads(List<Path> files) {
		for (Path file : files) {
			try {
				Files.deleteIfExists(file);
			}
			catch (IOException e) {
				logger.warn("Failed to delete: {}", file);
			}
		}
	}

}
