package org.springaicommunity.github.inviter;

import java.time.Duration;

/**
 * Suspends the calling thread. Used for batch pacing and for waiting out rate limits so
 * tests can substitute a recording implementation.
 */
@FunctionalInterface
public interface Sleeper {

	/**
	 * Sleep for the given duration.
	 * @param duration how long to sleep
	 * @throws InterruptedException if the thread is interrupted while sleeping
	 */
	void sleep(Duration duration) throws InterruptedException;

	/**
	 * Returns a sleeper backed by {@link Thread#sleep(long)}.
	 * @return interruptible system sleeper
	 */
	static Sleeper system() {
		return duration -> Thread.sleep(duration.toMillis());
	}

}
