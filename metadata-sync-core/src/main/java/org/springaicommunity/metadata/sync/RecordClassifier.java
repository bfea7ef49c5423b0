package org.springaicommunity.metadata.sync;

/**
 * Classifies archive entries by name suffix.
 */
public class RecordClassifier {

	public static final String STATISTICS_SUFFIX = "download_counts.json";

	public static final String METADATA_SUFFIX = ".ckan";

	public RecordKind classify(String entryName) {
		if (entryName.endsWith(STATISTICS_SUFFIX)) {
			return RecordKind.STATISTICS;
		}
		if (entryName.endsWith(METADATA_SUFFIX)) {
			return RecordKind.METADATA;
		}
		return RecordKind.NOISE;
	}

}
