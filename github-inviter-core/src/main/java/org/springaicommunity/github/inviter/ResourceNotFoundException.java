package org.springaicommunity.github.inviter;

/**
 * The referenced user, organization or repository does not exist on GitHub (HTTP 404).
 */
public class ResourceNotFoundException extends GitHubApiException {

	public ResourceNotFoundException(String message, String responseBody, int rateLimitRemaining,
			long resetEpochSeconds) {
		super(message, 404, responseBody, rateLimitRemaining, resetEpochSeconds, ErrorReason.NOT_FOUND);
	}

	/**
	 * Re-label a lookup failure with a more specific message, keeping the original status,
	 * body and rate limit details.
	 * @param message the new message
	 * @param cause the original not-found failure
	 */
	public ResourceNotFoundException(String message, ResourceNotFoundException cause) {
		super(message, cause, cause);
	}

}
