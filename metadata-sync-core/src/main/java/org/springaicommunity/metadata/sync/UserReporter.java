package org.springaicommunity.metadata.sync;

/**
 * Receives progress and messages meant for the user. Calls are fire-and-forget and may
 * arrive at high frequency during extraction.
 */
public interface UserReporter {

	/**
	 * Report progress of the current step.
	 * @param label what is in progress
	 * @param percent progress between 0 and 100
	 */
	void raiseProgress(String label, int percent);

	/**
	 * Report a message.
	 * @param message the text to show
	 */
	void raiseMessage(String message);

}
