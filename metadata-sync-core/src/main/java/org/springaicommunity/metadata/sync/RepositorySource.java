package org.springaicommunity.metadata.sync;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.jspecify.annotations.Nullable;

import java.net.URI;

/**
 * A remote repository of package metadata, identified by the URI of its archive.
 *
 * @param name display name
 * @param uri canonical URI of the repository archive
 * @param lastServerEtag change-token observed at the last successful sync, or null if the
 * repository was never synced
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RepositorySource(String name, URI uri, @Nullable String lastServerEtag) {

	public RepositorySource withLastServerEtag(@Nullable String etag) {
		return new RepositorySource(name, uri, etag);
	}

}
