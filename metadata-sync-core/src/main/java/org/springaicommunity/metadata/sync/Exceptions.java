package org.springaicommunity.metadata.sync;

import org.jspecify.annotations.Nullable;

import java.util.Optional;
import java.util.function.Predicate;

/**
 * Helpers for walking exception cause chains.
 */
public final class Exceptions {

	private Exceptions() {
	}

	/**
	 * Find the first throwable in the cause chain of {@code error} (including
	 * {@code error} itself) matching the predicate.
	 * @param error the outermost throwable
	 * @param predicate the match condition
	 * @return the first match, outermost first
	 */
	public static Optional<Throwable> findCause(Throwable error, Predicate<Throwable> predicate) {
		Throwable current = error;
		while (current != null) {
			if (predicate.test(current)) {
				return Optional.of(current);
			}
			current = nextCause(current);
		}
		return Optional.empty();
	}

	/**
	 * Returns the message of the innermost throwable in the chain that has one.
	 * @param error the outermost throwable
	 * @return the deepest non-null message, or the innermost class name if no throwable
	 * in the chain has a message
	 */
	public static String innermostMessage(Throwable error) {
		String message = null;
		Throwable current = error;
		Throwable last = error;
		while (current != null) {
			if (current.getMessage() != null) {
				message = current.getMessage();
			}
			last = current;
			current = nextCause(current);
		}
		return message != null ? message : last.getClass().getName();
	}

	@Nullable
	private static Throwable nextCause(Throwable current) {
		Throwable cause = current.getCause();
		// Self-referencing causes would loop forever
		return cause == current ? null : cause;
	}

}
