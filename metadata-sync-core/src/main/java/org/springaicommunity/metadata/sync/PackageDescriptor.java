package org.springaicommunity.metadata.sync;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Metadata of one installable package version, as read from a {@code .ckan} record.
 *
 * <p>
 * Unknown properties are ignored so that records written for newer clients still load.
 * Missing required properties raise {@link BadMetadataException}.
 *
 * @param specVersion metadata format version the record was written against
 * @param identifier unique package identifier
 * @param name human-readable name
 * @param summary one-line description ({@code abstract} in JSON)
 * @param author author names
 * @param version package version
 * @param license license identifiers
 * @param download download URLs
 * @param depends declared dependencies
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record PackageDescriptor(@JsonProperty("spec_version") String specVersion, String identifier,
		@Nullable String name, @JsonProperty("abstract") @Nullable String summary,
		@JsonFormat(with = JsonFormat.Feature.ACCEPT_SINGLE_VALUE_AS_ARRAY) List<String> author, String version,
		@JsonFormat(with = JsonFormat.Feature.ACCEPT_SINGLE_VALUE_AS_ARRAY) List<String> license,
		@JsonFormat(with = JsonFormat.Feature.ACCEPT_SINGLE_VALUE_AS_ARRAY) List<String> download,
		List<Relationship> depends) {

	public PackageDescriptor {
		if (specVersion == null || specVersion.isBlank()) {
			throw new BadMetadataException("Missing required property: spec_version");
		}
		if (identifier == null || identifier.isBlank()) {
			throw new BadMetadataException("Missing required property: identifier");
		}
		if (version == null || version.isBlank()) {
			throw new BadMetadataException("Missing required property: version in " + identifier);
		}
		author = author != null ? List.copyOf(author) : List.of();
		license = license != null ? List.copyOf(license) : List.of();
		download = download != null ? List.copyOf(download) : List.of();
		depends = depends != null ? List.copyOf(depends) : List.of();
	}

	@Override
	public String toString() {
		return identifier + " " + version;
	}

}
