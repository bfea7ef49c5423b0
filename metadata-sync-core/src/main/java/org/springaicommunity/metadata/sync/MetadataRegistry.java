package org.springaicommunity.metadata.sync;

import org.jspecify.annotations.Nullable;

import java.net.URI;
import java.util.List;
import java.util.SortedMap;

/**
 * Local registry of repositories, available packages and download counts.
 *
 * <p>
 * Mutators only stage changes. {@link #save()} applies all staged changes at once;
 * readers never observe a partially applied batch. {@link #rollback()} discards staged
 * changes.
 */
public interface MetadataRegistry {

	/**
	 * Configured repositories with their last known change-tokens.
	 */
	List<RepositorySource> getRepositories();

	/**
	 * Descriptors currently available.
	 */
	List<PackageDescriptor> getAvailable();

	/**
	 * Download counts per package identifier.
	 */
	SortedMap<String, Integer> getDownloadCounts();

	/**
	 * Stage a new repository. Ignored if a repository with the same URI exists.
	 */
	void addRepository(RepositorySource repository);

	/**
	 * Stage the complete new set of available descriptors.
	 */
	void setAvailable(List<PackageDescriptor> descriptors);

	/**
	 * Stage a new download count table.
	 */
	void setDownloadCounts(SortedMap<String, Integer> downloadCounts);

	/**
	 * Stage a repository's newly observed change-token.
	 */
	void setLastServerEtag(URI repositoryUri, @Nullable String etag);

	/**
	 * Apply and persist every staged change.
	 * @throws RegistryException if the registry cannot be persisted; staged changes are
	 * kept and the committed state is unchanged
	 */
	void save();

	/**
	 * Discard every staged change.
	 */
	void rollback();

	/**
	 * Human-readable descriptions of consistency problems in the committed state.
	 */
	List<String> getInconsistencies();

}
