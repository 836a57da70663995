package org.springaicommunity.github.inviter;

/**
 * Maps failures to the HTTP status a hosting web layer should answer with.
 *
 * <p>
 * Batch responses are always 200 with per-user errors in the body; only failures raised
 * before or outside the per-user loop reach this mapper. Request-shape problems map to
 * 4xx and upstream communication problems to 5xx so callers can tell them apart.
 */
public final class ErrorStatusMapper {

	/**
	 * Non-standard status used when the client went away before the batch finished.
	 */
	public static final int CLIENT_CLOSED_REQUEST = 499;

	private ErrorStatusMapper() {
	}

	/**
	 * Returns the HTTP status for a failure.
	 * @param failure the failure
	 * @return HTTP status code
	 */
	public static int httpStatusFor(Throwable failure) {
		if (failure instanceof MissingCredentialException) {
			return 401;
		}
		if (failure instanceof IllegalArgumentException) {
			return 400;
		}
		if (failure instanceof BatchCancelledException) {
			return CLIENT_CLOSED_REQUEST;
		}
		if (failure instanceof ResourceNotFoundException) {
			return 404;
		}
		if (failure instanceof RateLimitExceededException) {
			return 429;
		}
		if (failure instanceof GitHubApiException apiException) {
			if (apiException.isRateLimitError()) {
				return 429;
			}
			return apiException.getReason() == ErrorReason.UNAUTHORIZED ? 401 : 502;
		}
		return 500;
	}

	/**
	 * Returns true if the failure is the caller's fault (4xx).
	 * @param failure the failure
	 * @return true for request-shape errors
	 */
	public static boolean isClientError(Throwable failure) {
		int status = httpStatusFor(failure);
		return status >= 400 && status < 500 && !(failure instanceof GitHubApiException)
				&& status != CLIENT_CLOSED_REQUEST;
	}

}
