package org.springaicommunity.github.inviter;

import com.fasterxml.jackson.databind.JsonNode;
import org.jspecify.annotations.Nullable;

import java.util.Map;

/**
 * Interface for authenticated GitHub REST API calls.
 *
 * <p>
 * Provides abstraction over the transport, enabling testability and decorator
 * implementations.
 */
public interface GitHubClient {

	/**
	 * Execute a request against the GitHub REST API.
	 * @param method HTTP method (GET, PUT, ...)
	 * @param path API path (e.g., "/users/octocat") or full URL
	 * @param body request body to serialize as JSON, or null
	 * @param query query parameters, or null
	 * @return parsed JSON response; an empty object when the response has no body
	 * @throws GitHubApiException if the request fails
	 */
	JsonNode request(String method, String path, @Nullable Object body, @Nullable Map<String, String> query);

	/**
	 * Execute a GET request.
	 * @param path API path
	 * @return parsed JSON response
	 * @throws GitHubApiException if the request fails
	 */
	default JsonNode get(String path) {
		return request("GET", path, null, null);
	}

	/**
	 * Execute a PUT request with a JSON body.
	 * @param path API path
	 * @param body request body
	 * @return parsed JSON response
	 * @throws GitHubApiException if the request fails
	 */
	default JsonNode put(String path, Object body) {
		return request("PUT", path, body, null);
	}

	/**
	 * Get the rate limit information from the most recent API response. Returns null if
	 * the implementation does not track rate limits.
	 * @return last observed RateLimitInfo, or null
	 */
	default @Nullable RateLimitInfo getLastRateLimitInfo() {
		return null;
	}

}
