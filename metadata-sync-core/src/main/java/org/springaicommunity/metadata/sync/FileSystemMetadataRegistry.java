package org.springaicommunity.metadata.sync;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * {@link MetadataRegistry} persisted as one JSON file.
 *
 * <p>
 * {@link #save()} writes the new state to a temporary file next to the registry and moves
 * it over the old file, so a crash mid-save leaves the previous registry intact.
 */
public class FileSystemMetadataRegistry implements MetadataRegistry {

	private static final Logger logger = LoggerFactory.getLogger(FileSystemMetadataRegistry.class);

	private final Path registryFile;

	private final ObjectMapper objectMapper;

	private RegistryDocument committed;

	private final List<RepositorySource> stagedRepositories = new ArrayList<>();

	@Nullable
	private List<PackageDescriptor> stagedAvailable;

	@Nullable
	private SortedMap<String, Integer> stagedDownloadCounts;

	private final Map<URI, @Nullable String> stagedEtags = new LinkedHashMap<>();

	FileSystemMetadataRegistry(Path registryFile, ObjectMapper objectMapper, RegistryDocument committed) {
		this.registryFile = registryFile;
		this.objectMapper = objectMapper;
		this.committed = committed;
	}

	/**
	 * Load a registry file, or start an empty registry if the file does not exist yet.
	 * @param registryFile the registry file
	 * @param objectMapper mapper used to read and write the file
	 * @param defaultRepositories repositories of a newly created registry
	 * @return the loaded registry
	 * @throws RegistryException if the file exists but cannot be read
	 */
	public static FileSystemMetadataRegistry load(Path registryFile, ObjectMapper objectMapper,
			List<RepositorySource> defaultRepositories) {
		if (!Files.exists(registryFile)) {
			logger.info("No registry at {}, starting with {} default repositories", registryFile,
					defaultRepositories.size());
			return new FileSystemMetadataRegistry(registryFile, objectMapper,
					RegistryDocument.empty(defaultRepositories));
		}
		try {
			RegistryDocument document = objectMapper.readValue(registryFile.toFile(), RegistryDocument.class);
			logger.info("Loaded registry {} ({} repositories, {} available modules)", registryFile,
					document.repositories().size(), document.availableModules().size());
			return new FileSystemMetadataRegistry(registryFile, objectMapper, document);
		}
		catch (IOException e) {
			throw new RegistryException("Failed to read registry " + registryFile, e);
		}
	}

	public Path getRegistryFile() {
		return registryFile;
	}

	@Override
	public synchronized List<RepositorySource> getRepositories() {
		return committed.repositories();
	}

	@Override
	public synchronized List<PackageDescriptor> getAvailable() {
		return committed.availableModules();
	}

	@Override
	public synchronized SortedMap<String, Integer> getDownloadCounts() {
		return Collections.unmodifiableSortedMap(committed.downloadCounts());
	}

	@Override
	public synchronized void addRepository(RepositorySource repository) {
		boolean known = committed.repositories().stream().anyMatch(r -> r.uri().equals(repository.uri()))
				|| stagedRepositories.stream().anyMatch(r -> r.uri().equals(repository.uri()));
		if (known) {
			logger.debug("Repository {} already configured", repository.uri());
			return;
		}
		stagedRepositories.add(repository);
	}

	@Override
	public synchronized void setAvailable(List<PackageDescriptor> descriptors) {
		this.stagedAvailable = List.copyOf(descriptors);
	}

	@Override
	public synchronized void setDownloadCounts(SortedMap<String, Integer> downloadCounts) {
		this.stagedDownloadCounts = new TreeMap<>(downloadCounts);
	}

	@Override
	public synchronized void setLastServerEtag(URI repositoryUri, @Nullable String etag) {
		stagedEtags.put(repositoryUri, etag);
	}

	@Override
	public synchronized void save() {
		RegistryDocument next = stagedDocument();
		Path directory = registryFile.toAbsolutePath().getParent();
		Path temp = null;
		try {
			Files.createDirectories(directory);
			temp = Files.createTempFile(directory, registryFile.getFileName().toString() + ".", ".tmp");
			objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), next);
			moveIntoPlace(temp);
		}
		catch (IOException e) {
			if (temp != null) {
				deleteTempFile(temp);
			}
			throw new RegistryException("Failed to save registry " + registryFile, e);
		}

		committed = next;
		clearStaged();
		logger.info("Saved registry {} ({} repositories, {} available modules)", registryFile,
				next.repositories().size(), next.availableModules().size());
	}

	@Override
	public synchronized void rollback() {
		clearStaged();
	}

	@Override
	public synchronized List<String> getInconsistencies() {
		Set<String> provided = committed.availableModules()
			.stream()
			.map(PackageDescriptor::identifier)
			.collect(Collectors.toSet());
		Set<String> problems = new LinkedHashSet<>();
		for (PackageDescriptor descriptor : committed.availableModules()) {
			for (Relationship dependency : descriptor.depends()) {
				String name = dependency.name();
				if (name != null && !provided.contains(name)) {
					problems.add(descriptor + " depends on " + name + ", which is not available");
				}
			}
		}
		return List.copyOf(problems);
	}

	private RegistryDocument stagedDocument() {
		List<RepositorySource> repositories = new ArrayList<>();
		for (RepositorySource repository : committed.repositories()) {
			repositories.add(stagedEtags.containsKey(repository.uri())
					? repository.withLastServerEtag(stagedEtags.get(repository.uri())) : repository);
		}
		repositories.addAll(stagedRepositories);
		return new RegistryDocument(repositories,
				stagedAvailable != null ? stagedAvailable : committed.availableModules(),
				stagedDownloadCounts != null ? stagedDownloadCounts : committed.downloadCounts());
	}

	private void moveIntoPlace(Path temp) throws IOException {
		try {
			Files.move(temp, registryFile, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
		}
		catch (AtomicMoveNotSupportedException e) {
			logger.debug("Atomic move not supported for {}, replacing instead", registryFile);
			Files.move(temp, registryFile, StandardCopyOption.REPLACE_EXISTING);
		}
	}

	private void clearStaged() {
		stagedRepositories.clear();
		stagedAvailable = null;
		stagedDownloadCounts = null;
		stagedEtags.clear();
	}

	private static void deleteTempFile(Path file) {
		try {
			Files.deleteIfExists(file);
		}
		catch (IOException e) {
			logger.warn("Failed to delete: {}", file);
		}
	}

}
