package org.springaicommunity.metadata.sync;

/**
 * Change-token (ETag) normalization shared by probes and downloads.
 */
final class ChangeTokens {

	private ChangeTokens() {
	}

	/**
	 * Strip the quotes servers put around ETag values, so HEAD and GET responses compare
	 * equal.
	 */
	static String normalize(String etag) {
		return etag.replace("\"", "").trim();
	}

}
