package org.springaicommunity.metadata.sync;

import org.jspecify.annotations.Nullable;

/**
 * Turns the raw text of a metadata record into a {@link PackageDescriptor}.
 *
 * <p>
 * Implementations may wrap the errors they raise arbitrarily deep;
 * {@link MetadataRecordParser} walks the whole cause chain.
 */
@FunctionalInterface
public interface DescriptorParser {

	/**
	 * Parse one record.
	 * @param json the record's text
	 * @return the descriptor, or null if the text holds no descriptor
	 * @throws Exception if the text cannot be parsed
	 */
	@Nullable
	PackageDescriptor parse(String json) throws Exception;

}
