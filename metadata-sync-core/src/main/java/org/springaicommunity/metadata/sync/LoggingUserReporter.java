package org.springaicommunity.metadata.sync;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link UserReporter} writing progress and messages to the log.
 */
public class LoggingUserReporter implements UserReporter {

	private static final Logger logger = LoggerFactory.getLogger(LoggingUserReporter.class);

	@Override
	public void raiseProgress(String label, int percent) {
		logger.info("{} ({}%)", label, percent);
	}

	@Override
	public void raiseMessage(String message) {
		logger.info(message);
	}

}
