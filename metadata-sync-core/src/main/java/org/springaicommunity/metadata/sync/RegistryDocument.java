package org.springaicommunity.metadata.sync;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * On-disk layout of {@link FileSystemMetadataRegistry}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
record RegistryDocument(List<RepositorySource> repositories, List<PackageDescriptor> availableModules,
		SortedMap<String, Integer> downloadCounts) {

	RegistryDocument {
		repositories = repositories != null ? List.copyOf(repositories) : List.of();
		availableModules = availableModules != null ? List.copyOf(availableModules) : List.of();
		downloadCounts = downloadCounts != null ? new TreeMap<>(downloadCounts) : new TreeMap<>();
	}

	static RegistryDocument empty(List<RepositorySource> repositories) {
		return new RegistryDocument(repositories, List.of(), new TreeMap<>());
	}

}
