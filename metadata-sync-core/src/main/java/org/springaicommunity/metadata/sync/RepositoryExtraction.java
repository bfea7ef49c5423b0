package org.springaicommunity.metadata.sync;

import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.SortedMap;

/**
 * Everything extracted from one repository archive.
 *
 * @param repository the repository the archive belongs to
 * @param descriptors parsed descriptors in archive order
 * @param downloadCounts the statistics record's table, or null if the archive had none
 */
public record RepositoryExtraction(RepositorySource repository, List<PackageDescriptor> descriptors,
		@Nullable SortedMap<String, Integer> downloadCounts) {
}
