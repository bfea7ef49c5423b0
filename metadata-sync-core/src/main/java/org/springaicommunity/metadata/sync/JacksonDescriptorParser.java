package org.springaicommunity.metadata.sync;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;

import java.io.IOException;

/**
 * {@link DescriptorParser} reading {@code .ckan} JSON with Jackson.
 *
 * <p>
 * The declared {@code spec_version} is checked before binding: records written against a
 * newer format than {@code supportedSpecVersion} raise
 * {@link UnsupportedMetadataException}.
 */
public class JacksonDescriptorParser implements DescriptorParser {

	private final ObjectMapper objectMapper;

	private final SpecVersion supportedSpecVersion;

	public JacksonDescriptorParser(ObjectMapper objectMapper, SpecVersion supportedSpecVersion) {
		this.objectMapper = objectMapper;
		this.supportedSpecVersion = supportedSpecVersion;
	}

	@Override
	@Nullable
	public PackageDescriptor parse(String json) throws IOException {
		if (json.isBlank()) {
			return null;
		}
		JsonNode tree = objectMapper.readTree(json);
		if (tree == null || tree.isMissingNode() || tree.isNull()) {
			return null;
		}
		if (!tree.isObject()) {
			throw new BadMetadataException("Metadata is not a JSON object");
		}

		JsonNode specNode = tree.get("spec_version");
		if (specNode == null || specNode.isNull()) {
			throw new BadMetadataException("Missing required property: spec_version");
		}
		SpecVersion declared = SpecVersion.parse(specNode.asText());
		if (declared.compareTo(supportedSpecVersion) > 0) {
			throw new UnsupportedMetadataException(
					"Requires spec version " + declared + ", this client supports up to " + supportedSpecVersion);
		}

		return objectMapper.treeToValue(tree, PackageDescriptor.class);
	}

}
