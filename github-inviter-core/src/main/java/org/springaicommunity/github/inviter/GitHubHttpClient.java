package org.springaicommunity.github.inviter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * GitHub REST transport built on the Java 11+ HttpClient.
 *
 * <p>
 * Every request carries the bearer token, the pinned API version and a JSON accept
 * header. Rate limit headers are read from every response into a snapshot owned by this
 * instance (see {@link #getLastRateLimitInfo()}). A {@code 403} with no remaining quota
 * or a {@code 429} suspends the caller until the advertised reset and then replays the
 * request, up to {@link InviterProperties#getMaxRateLimitRetries()} times.
 *
 * <p>
 * Instances are meant to be used by one batch at a time; create one client per access
 * token.
 */
public class GitHubHttpClient implements GitHubClient {

	private static final Logger logger = LoggerFactory.getLogger(GitHubHttpClient.class);

	/**
	 * Back-off for a secondary rate limit that names neither a retry delay nor a reset.
	 */
	static final Duration SECONDARY_RATE_LIMIT_WAIT = Duration.ofSeconds(60);

	private final HttpClient httpClient;

	private final String token;

	private final InviterProperties properties;

	private final ObjectMapper objectMapper;

	private final Clock clock;

	private final Sleeper sleeper;

	private volatile RateLimitInfo lastRateLimitInfo = RateLimitInfo.initial();

	public GitHubHttpClient(String token) {
		this(token, new InviterProperties(), ObjectMapperFactory.create(), Clock.systemUTC(), Sleeper.system());
	}

	public GitHubHttpClient(String token, InviterProperties properties, ObjectMapper objectMapper, Clock clock,
			Sleeper sleeper) {
		this.token = token;
		this.properties = properties;
		this.objectMapper = objectMapper;
		this.clock = clock;
		this.sleeper = sleeper;
		this.httpClient = HttpClient.newBuilder()
			.connectTimeout(properties.getTimeout())
			.followRedirects(HttpClient.Redirect.NORMAL)
			.build();
	}

	@Override
	public RateLimitInfo getLastRateLimitInfo() {
		return lastRateLimitInfo;
	}

	@Override
	public JsonNode request(String method, String path, @Nullable Object body, @Nullable Map<String, String> query) {
		URI uri = buildUri(path, query);
		HttpRequest request = buildRequest(method, uri, body);

		int rateLimitRetries = 0;
		while (true) {
			logger.debug("{} {}", method, uri);
			long start = System.currentTimeMillis();
			HttpResponse<String> response = send(request);
			RateLimitInfo rateLimit = updateRateLimit(response);
			int statusCode = response.statusCode();
			String responseBody = response.body() != null ? response.body() : "";

			if (isThrottled(statusCode, rateLimit)) {
				Duration wait = computeWait(statusCode, response, rateLimit);
				if (rateLimitRetries >= properties.getMaxRateLimitRetries()) {
					logger.error("{} {} still rate limited after {} retries", method, uri, rateLimitRetries);
					throw new RateLimitExceededException("GitHub API rate limit exceeded. Reset at "
							+ rateLimit.getResetTime() + " (gave up after " + rateLimitRetries + " retries)",
							statusCode, responseBody, rateLimit.reset());
				}
				if (wait.compareTo(properties.getMaxRateLimitWait()) > 0) {
					logger.error("Rate limit reset is {} seconds away, longer than the {} second maximum",
							wait.toSeconds(), properties.getMaxRateLimitWait().toSeconds());
					throw new RateLimitExceededException(
							"GitHub API rate limit exceeded. Reset at " + rateLimit.getResetTime(), statusCode,
							responseBody, rateLimit.reset());
				}
				rateLimitRetries++;
				if (!wait.isNegative() && !wait.isZero()) {
					logger.warn("Rate limit exceeded. Waiting {} seconds before retrying {} {} (retry {}/{})",
							wait.toSeconds(), method, uri, rateLimitRetries, properties.getMaxRateLimitRetries());
					pause(wait);
				}
				continue;
			}

			logger.info("GitHub API Response: {} - {}", statusCode, responseBody);
			logger.debug("{} {} completed in {}ms", method, uri, System.currentTimeMillis() - start);
			return handleResponse(method, uri, statusCode, responseBody, rateLimit);
		}
	}

	private URI buildUri(String path, @Nullable Map<String, String> query) {
		String url = path.startsWith("http") ? path : properties.getApiBaseUrl() + path;
		if (query != null && !query.isEmpty()) {
			String queryString = query.entrySet()
				.stream()
				.map(entry -> encode(entry.getKey()) + "=" + encode(entry.getValue()))
				.collect(Collectors.joining("&"));
			url += (url.contains("?") ? "&" : "?") + queryString;
		}
		return URI.create(url);
	}

	private HttpRequest buildRequest(String method, URI uri, @Nullable Object body) {
		HttpRequest.Builder builder = HttpRequest.newBuilder()
			.uri(uri)
			.timeout(properties.getTimeout())
			.header("Authorization", "Bearer " + token)
			.header("Accept", "application/vnd.github+json")
			.header("X-GitHub-Api-Version", properties.getApiVersion())
			.header("User-Agent", properties.getUserAgent());

		if (body == null) {
			return builder.method(method, HttpRequest.BodyPublishers.noBody()).build();
		}
		try {
			String json = objectMapper.writeValueAsString(body);
			return builder.header("Content-Type", "application/json")
				.method(method, HttpRequest.BodyPublishers.ofString(json))
				.build();
		}
		catch (JsonProcessingException e) {
			throw new IllegalArgumentException("Request body cannot be serialized to JSON: " + e.getMessage(), e);
		}
	}

	private HttpResponse<String> send(HttpRequest request) {
		try {
			return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
		}
		catch (IOException e) {
			String errorMessage = "Request failed: " + describe(e);
			logger.error(errorMessage);
			throw new GitHubApiException(errorMessage, e);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new GitHubApiException("Request interrupted", e);
		}
	}

	private RateLimitInfo updateRateLimit(HttpResponse<?> response) {
		int remaining = parseIntHeader(response, "X-RateLimit-Remaining", RateLimitInfo.DEFAULT_REMAINING);
		long reset = parseLongHeader(response, "X-RateLimit-Reset", 0);
		int limit = parseIntHeader(response, "X-RateLimit-Limit", -1);
		int used = parseIntHeader(response, "X-RateLimit-Used", -1);

		RateLimitInfo info = new RateLimitInfo(limit, remaining, reset, used);
		this.lastRateLimitInfo = info;
		if (remaining < 100) {
			logger.info("Rate limit low: {}/{} remaining, resets at epoch {}", remaining, limit, reset);
		}
		else {
			logger.debug("Rate limit: {}/{} remaining, resets at epoch {}", remaining, limit, reset);
		}
		return info;
	}

	private static boolean isThrottled(int statusCode, RateLimitInfo rateLimit) {
		return (statusCode == 403 && rateLimit.isExceeded()) || statusCode == 429;
	}

	/**
	 * Time until the quota resets. {@code Retry-After} wins when GitHub sends it
	 * (secondary limits); otherwise the reset timestamp is compared with the clock. A 429
	 * carrying neither header waits {@link #SECONDARY_RATE_LIMIT_WAIT}.
	 */
	private Duration computeWait(int statusCode, HttpResponse<?> response, RateLimitInfo rateLimit) {
		long retryAfter = parseLongHeader(response, "Retry-After", -1);
		if (retryAfter >= 0) {
			return Duration.ofSeconds(retryAfter);
		}
		if (statusCode == 429 && response.headers().firstValue("X-RateLimit-Reset").isEmpty()) {
			return SECONDARY_RATE_LIMIT_WAIT;
		}
		return Duration.between(clock.instant(), Instant.ofEpochSecond(rateLimit.reset()));
	}

	private void pause(Duration wait) {
		try {
			sleeper.sleep(wait);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new GitHubApiException("Rate limit wait interrupted", e);
		}
	}

	private JsonNode handleResponse(String method, URI uri, int statusCode, String responseBody,
			RateLimitInfo rateLimit) {
		if (statusCode >= 200 && statusCode < 300) {
			if (responseBody.isBlank()) {
				return objectMapper.createObjectNode();
			}
			try {
				return objectMapper.readTree(responseBody);
			}
			catch (JsonProcessingException e) {
				throw new GitHubApiException("Invalid JSON in GitHub response: " + e.getOriginalMessage(), statusCode,
						responseBody);
			}
		}

		if (statusCode == 404 && responseBody.contains("Not Found")) {
			throw new ResourceNotFoundException("Not found: " + method + " " + uri.getPath(), responseBody,
					rateLimit.remaining(), rateLimit.reset());
		}

		String errorMessage = "GitHub API error: " + responseBody;
		logger.error(errorMessage);
		ErrorReason reason = ErrorReason.classify(statusCode, parseQuietly(responseBody), responseBody);
		throw new GitHubApiException(errorMessage, statusCode, responseBody, rateLimit.remaining(), rateLimit.reset(),
				reason);
	}

	private @Nullable JsonNode parseQuietly(String body) {
		if (body.isBlank()) {
			return null;
		}
		try {
			return objectMapper.readTree(body);
		}
		catch (JsonProcessingException e) {
			logger.debug("Error body is not JSON: {}", e.getOriginalMessage());
			return null;
		}
	}

	private static String describe(IOException e) {
		String message = e.getMessage();
		return message != null ? message : e.getClass().getSimpleName();
	}

	private static String encode(String value) {
		return URLEncoder.encode(value, StandardCharsets.UTF_8);
	}

	private static int parseIntHeader(HttpResponse<?> response, String headerName, int defaultValue) {
		return response.headers().firstValue(headerName).map(v -> {
			try {
				return Integer.parseInt(v.trim());
			}
			catch (NumberFormatException e) {
				return defaultValue;
			}
		}).orElse(defaultValue);
	}

	private static long parseLongHeader(HttpResponse<?> response, String headerName, long defaultValue) {
		return response.headers().firstValue(headerName).map(v -> {
			try {
				return Long.parseLong(v.trim());
			}
			catch (NumberFormatException e) {
				return defaultValue;
			}
		}).orElse(defaultValue);
	}

}
