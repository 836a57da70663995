package org.springaicommunity.github.inviter;

import java.time.Instant;

/**
 * Raised when the client gives up waiting for the GitHub rate limit to reset, either
 * because the retry budget is spent or because the reset lies too far in the future.
 */
public class RateLimitExceededException extends GitHubApiException {

	public RateLimitExceededException(String message, int statusCode, String responseBody, long resetEpochSeconds) {
		super(message, statusCode, responseBody, 0, resetEpochSeconds, ErrorReason.RATE_LIMITED);
	}

	public Instant getResetTime() {
		return Instant.ofEpochSecond(getResetEpochSeconds());
	}

}
