package org.springaicommunity.metadata.sync;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jspecify.annotations.Nullable;

/**
 * A dependency declared by a package. Alternatives ({@code any_of}) have no name and are
 * not interpreted here.
 *
 * @param name identifier of the required package
 * @param minVersion lowest acceptable version
 * @param maxVersion highest acceptable version
 * @param version exact required version
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Relationship(@Nullable String name, @JsonProperty("min_version") @Nullable String minVersion,
		@JsonProperty("max_version") @Nullable String maxVersion, @Nullable String version) {

	public static Relationship on(String name) {
		return new Relationship(name, null, null, null);
	}

}
