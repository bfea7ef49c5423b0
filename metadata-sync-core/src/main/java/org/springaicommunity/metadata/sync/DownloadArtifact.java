package org.springaicommunity.metadata.sync;

import org.jspecify.annotations.Nullable;

import java.net.URI;
import java.nio.file.Path;

/**
 * A repository archive downloaded to a local temporary file during one sync attempt.
 *
 * @param uri the repository URI the archive was fetched from
 * @param path the temporary file holding the archive
 * @param etag the change-token reported when the download completed, if any
 */
public record DownloadArtifact(URI uri, Path path, @Nullable String etag) {
}
