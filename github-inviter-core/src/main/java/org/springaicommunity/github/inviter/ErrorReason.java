package org.springaicommunity.github.inviter;

import com.fasterxml.jackson.databind.JsonNode;
import org.jspecify.annotations.Nullable;

import java.util.Locale;

/**
 * Structured reason attached to a {@link GitHubApiException}.
 *
 * <p>
 * GitHub reports most failures as a JSON document with a top-level {@code message} and an
 * optional {@code errors} array. The reason is derived from that document first and only
 * falls back to matching the raw response text when the body is not JSON.
 */
public enum ErrorReason {

	/**
	 * The user already holds access to the repository.
	 */
	ALREADY_COLLABORATOR,

	/**
	 * The referenced user, organization or repository does not exist.
	 */
	NOT_FOUND,

	/**
	 * The request was throttled by a primary or secondary rate limit.
	 */
	RATE_LIMITED,

	/**
	 * The token is missing, invalid or expired.
	 */
	UNAUTHORIZED,

	/**
	 * GitHub rejected the request payload (HTTP 422).
	 */
	VALIDATION_FAILED,

	/**
	 * No HTTP response was received.
	 */
	TRANSPORT,

	/**
	 * Anything else.
	 */
	OTHER;

	static final String ALREADY_COLLABORATOR_TEXT = "already a collaborator";

	/**
	 * Classify an upstream failure.
	 * @param statusCode HTTP status, or -1 when no response was received
	 * @param document parsed error body, or null if the body was not JSON
	 * @param rawBody raw response body
	 * @return the reason
	 */
	public static ErrorReason classify(int statusCode, @Nullable JsonNode document, @Nullable String rawBody) {
		if (statusCode < 0) {
			return TRANSPORT;
		}
		if (document != null && mentionsAlreadyCollaborator(document)) {
			return ALREADY_COLLABORATOR;
		}
		if (document == null && containsIgnoreCase(rawBody, ALREADY_COLLABORATOR_TEXT)) {
			return ALREADY_COLLABORATOR;
		}
		return switch (statusCode) {
			case 401 -> UNAUTHORIZED;
			case 404 -> NOT_FOUND;
			case 422 -> VALIDATION_FAILED;
			case 429 -> RATE_LIMITED;
			default -> OTHER;
		};
	}

	private static boolean mentionsAlreadyCollaborator(JsonNode document) {
		if (containsIgnoreCase(document.path("message").asText(null), ALREADY_COLLABORATOR_TEXT)) {
			return true;
		}
		JsonNode errors = document.path("errors");
		if (errors.isArray()) {
			for (JsonNode error : errors) {
				if (containsIgnoreCase(error.path("message").asText(null), ALREADY_COLLABORATOR_TEXT)) {
					return true;
				}
			}
		}
		return false;
	}

	static boolean containsIgnoreCase(@Nullable String text, String fragment) {
		return text != null && text.toLowerCase(Locale.ROOT).contains(fragment);
	}

}
