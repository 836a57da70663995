package org.springaicommunity.github.inviter;

import java.time.Instant;

/**
 * Rate limit snapshot taken from the headers of the most recent GitHub API response.
 *
 * <p>
 * Each {@link GitHubHttpClient} owns its own snapshot, so concurrent batches running on
 * separate clients never observe each other's quota.
 *
 * @param limit the maximum number of requests allowed per window, or -1 if unknown
 * @param remaining the number of requests remaining in the current window
 * @param reset the time when the rate limit resets (epoch seconds)
 * @param used the number of requests used in the current window, or -1 if unknown
 */
public record RateLimitInfo(int limit, int remaining, long reset, int used) {

	/**
	 * Remaining quota assumed when a response carries no rate limit headers.
	 */
	public static final int DEFAULT_REMAINING = 5000;

	/**
	 * Returns the snapshot used before any response has been seen.
	 * @return snapshot with {@link #DEFAULT_REMAINING} requests and no reset time
	 */
	public static RateLimitInfo initial() {
		return new RateLimitInfo(-1, DEFAULT_REMAINING, 0, -1);
	}

	/**
	 * Returns the reset time as an Instant.
	 * @return the reset time
	 */
	public Instant getResetTime() {
		return Instant.ofEpochSecond(reset);
	}

	/**
	 * Returns true if the rate limit has been exceeded.
	 * @return true if no requests remaining
	 */
	public boolean isExceeded() {
		return remaining <= 0;
	}

}
