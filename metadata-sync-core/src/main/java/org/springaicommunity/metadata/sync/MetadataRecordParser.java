package org.springaicommunity.metadata.sync;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.Set;

/**
 * Parses metadata records and triages their failures.
 *
 * <p>
 * Repositories carry records written by several client generations, and the underlying
 * parser tends to wrap errors rather than propagate them. A failure is benign, and the
 * record skipped, if any throwable in its cause chain is one of
 * {@link #BENIGN_FAILURES}. Every other failure is fatal to the batch.
 */
public class MetadataRecordParser {

	private static final Logger logger = LoggerFactory.getLogger(MetadataRecordParser.class);

	/**
	 * Failures that can be caused by data meant for newer clients.
	 */
	public static final Set<Class<? extends Throwable>> BENIGN_FAILURES = Set.of(UnsupportedMetadataException.class,
			BadMetadataException.class);

	private final DescriptorParser descriptorParser;

	public MetadataRecordParser(DescriptorParser descriptorParser) {
		this.descriptorParser = descriptorParser;
	}

	/**
	 * Parse one metadata record.
	 * @param rawText the record's text
	 * @param recordName the archive entry name, for logging
	 * @return the descriptor, or empty for blank records and benign failures
	 * @throws MetadataParseException if parsing fails for a reason that is not benign
	 */
	public Optional<PackageDescriptor> parse(String rawText, String recordName) {
		PackageDescriptor descriptor;
		try {
			descriptor = descriptorParser.parse(rawText);
		}
		catch (Exception e) {
			Optional<Throwable> benign = Exceptions.findCause(e, MetadataRecordParser::isBenign);
			if (benign.isPresent()) {
				logger.info("Skipping {} : {}", recordName, benign.get().getMessage());
				return Optional.empty();
			}
			logger.error("Error processing {} : {}", recordName, Exceptions.innermostMessage(e));
			throw new MetadataParseException(recordName, e);
		}

		if (descriptor == null) {
			return Optional.empty();
		}
		logger.debug("Module parsed: {}", descriptor);
		return Optional.of(descriptor);
	}

	static boolean isBenign(Throwable error) {
		return BENIGN_FAILURES.stream().anyMatch(type -> type.isInstance(error));
	}

}
