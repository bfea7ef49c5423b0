package org.springaicommunity.metadata.sync;

/**
 * Thrown when a metadata record fails to parse for a reason that is not attributable to a
 * newer metadata format.
 */
public class MetadataParseException extends MetadataSyncException {

	private final String recordName;

	public MetadataParseException(String recordName, Throwable cause) {
		super("Error processing " + recordName + ": " + Exceptions.innermostMessage(cause), cause);
		this.recordName = recordName;
	}

	public String getRecordName() {
		return recordName;
	}

}
