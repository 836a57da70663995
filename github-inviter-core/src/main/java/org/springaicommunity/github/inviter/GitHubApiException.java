package org.springaicommunity.github.inviter;

import org.jspecify.annotations.Nullable;

/**
 * Exception thrown when GitHub API calls fail.
 *
 * <p>
 * Carries the HTTP status (or -1 when no response was received), the raw response body,
 * the rate limit state observed on the failing response and a structured
 * {@link ErrorReason}.
 */
public class GitHubApiException extends RuntimeException {

	/**
	 * Status used when the request never produced an HTTP response.
	 */
	public static final int STATUS_UNSET = -1;

	private final int statusCode;

	private final @Nullable String responseBody;

	private final int rateLimitRemaining;

	private final long resetEpochSeconds;

	private final ErrorReason reason;

	public GitHubApiException(String message, int statusCode, @Nullable String responseBody) {
		this(message, statusCode, responseBody, -1, -1, ErrorReason.classify(statusCode, null, responseBody));
	}

	public GitHubApiException(String message, int statusCode, @Nullable String responseBody, int rateLimitRemaining,
			long resetEpochSeconds, ErrorReason reason) {
		super(message);
		this.statusCode = statusCode;
		this.responseBody = responseBody;
		this.rateLimitRemaining = rateLimitRemaining;
		this.resetEpochSeconds = resetEpochSeconds;
		this.reason = reason;
	}

	public GitHubApiException(String message, Throwable cause) {
		super(message, cause);
		this.statusCode = STATUS_UNSET;
		this.responseBody = null;
		this.rateLimitRemaining = -1;
		this.resetEpochSeconds = -1;
		this.reason = ErrorReason.TRANSPORT;
	}

	protected GitHubApiException(String message, Throwable cause, GitHubApiException origin) {
		super(message, cause);
		this.statusCode = origin.statusCode;
		this.responseBody = origin.responseBody;
		this.rateLimitRemaining = origin.rateLimitRemaining;
		this.resetEpochSeconds = origin.resetEpochSeconds;
		this.reason = origin.reason;
	}

	public int getStatusCode() {
		return statusCode;
	}

	public @Nullable String getResponseBody() {
		return responseBody;
	}

	public int getRateLimitRemaining() {
		return rateLimitRemaining;
	}

	public long getResetEpochSeconds() {
		return resetEpochSeconds;
	}

	public ErrorReason getReason() {
		return reason;
	}

	/**
	 * Returns true if no HTTP response was received (DNS, connect or timeout failure).
	 */
	public boolean isTransportFailure() {
		return statusCode == STATUS_UNSET;
	}

	/**
	 * Returns true if this exception represents a rate limit error (either 403 with
	 * remaining=0 or 429).
	 */
	public boolean isRateLimitError() {
		return (statusCode == 429) || (statusCode == 403 && rateLimitRemaining == 0);
	}

}
