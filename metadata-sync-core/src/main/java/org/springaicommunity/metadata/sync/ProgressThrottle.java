package org.springaicommunity.metadata.sync;

/**
 * Forwards a progress percentage to a {@link UserReporter} only when it strictly exceeds
 * the last forwarded value.
 *
 * <p>
 * One instance covers one archive traversal; archives contain thousands of entries and
 * most of them do not move the percentage.
 */
public class ProgressThrottle {

	private final UserReporter reporter;

	private final String label;

	private int lastPercent = 0;

	public ProgressThrottle(UserReporter reporter, String label) {
		this.reporter = reporter;
		this.label = label;
	}

	/**
	 * Report a new percentage.
	 * @param percent progress between 0 and 100
	 * @return true if the value was forwarded
	 */
	public boolean update(int percent) {
		if (percent <= lastPercent) {
			return false;
		}
		lastPercent = percent;
		reporter.raiseProgress(label, percent);
		return true;
	}

	public int lastPercent() {
		return lastPercent;
	}

}
