package org.springaicommunity.metadata.sync;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Extracts descriptors and download counts from one downloaded repository archive.
 *
 * <p>
 * The archive is traversed once, front to back. Should it contain several statistics
 * records, the last one read wins.
 */
public class RepositoryExtractor {

	private static final Logger logger = LoggerFactory.getLogger(RepositoryExtractor.class);

	private static final TypeReference<TreeMap<String, Integer>> DOWNLOAD_COUNTS_TYPE = new TypeReference<>() {
	};

	private final ArchiveEntryReaderFactory readerFactory;

	private final RecordClassifier classifier;

	private final MetadataRecordParser recordParser;

	private final ObjectMapper objectMapper;

	private final UserReporter reporter;

	public RepositoryExtractor(ArchiveEntryReaderFactory readerFactory, RecordClassifier classifier,
			MetadataRecordParser recordParser, ObjectMapper objectMapper, UserReporter reporter) {
		this.readerFactory = readerFactory;
		this.classifier = classifier;
		this.recordParser = recordParser;
		this.objectMapper = objectMapper;
		this.reporter = reporter;
	}

	/**
	 * Extract one repository's archive.
	 * @param repository the repository being loaded
	 * @param archive the downloaded archive
	 * @return the descriptors and optional statistics table found in the archive
	 * @throws ArtifactNotFoundException if the archive file does not exist
	 * @throws UnsupportedContainerException if the archive format is not supported
	 * @throws MetadataParseException if a metadata record fails fatally
	 * @throws IOException if the archive cannot be read
	 */
	public RepositoryExtraction extract(RepositorySource repository, Path archive) throws IOException {
		if (!Files.exists(archive)) {
			throw new ArtifactNotFoundException(archive);
		}

		List<PackageDescriptor> descriptors = new ArrayList<>();
		SortedMap<String, Integer> downloadCounts = null;
		String label = "Loading modules from " + repository.name() + " repository";

		try (ArchiveEntryReader reader = readerFactory.open(archive)) {
			reporter.raiseMessage(label + "...");
			ProgressThrottle progress = new ProgressThrottle(reporter, label);

			ContainerEntry entry;
			while ((entry = reader.nextEntry()) != null) {
				String entryName = entry.name();
				switch (classifier.classify(entryName)) {
					case STATISTICS:
						downloadCounts = readDownloadCounts(entry);
						reporter.raiseMessage("Loaded download counts from " + repository.name() + " repository");
						break;
					case METADATA:
						logger.debug("Reading CKAN data from {}", entryName);
						progress.update(reader.percentConsumed());
						Optional<PackageDescriptor> descriptor = recordParser.parse(entry.contentAsString(),
								entryName);
						descriptor.ifPresent(descriptors::add);
						break;
					default:
						logger.debug("Skipping archive entry {}", entryName);
						break;
				}
			}
		}

		logger.info("Loaded {} modules from {} repository{}", descriptors.size(), repository.name(),
				downloadCounts != null ? " with download counts" : "");
		return new RepositoryExtraction(repository, descriptors, downloadCounts);
	}

	@Nullable
	private SortedMap<String, Integer> readDownloadCounts(ContainerEntry entry) throws IOException {
		byte[] content = entry.content();
		try {
			return objectMapper.readValue(content, DOWNLOAD_COUNTS_TYPE);
		}
		catch (IOException e) {
			logger.error("Error processing {} : {}", entry.name(), e.getMessage());
			throw new MetadataParseException(entry.name(), e);
		}
	}

}
