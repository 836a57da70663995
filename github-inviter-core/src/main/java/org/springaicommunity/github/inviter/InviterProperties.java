package org.springaicommunity.github.inviter;

import org.jspecify.annotations.Nullable;

import java.time.Duration;
import java.util.function.Function;

/**
 * Configuration properties for the GitHub inviter.
 *
 * <p>
 * Properties can be set directly via setters, loaded from the environment with
 * {@link #fromEnvironment()}, or passed to {@link GitHubInviterBuilder}. Defaults are
 * suitable for github.com.
 */
public class InviterProperties {

	/**
	 * Base URL of the GitHub REST API.
	 */
	private String apiBaseUrl = "https://api.github.com";

	/**
	 * Value sent in the {@code X-GitHub-Api-Version} header.
	 */
	private String apiVersion = "2022-11-28";

	/**
	 * Value sent in the {@code User-Agent} header.
	 */
	private String userAgent = "github-inviter";

	/**
	 * Connect and request timeout for GitHub API calls.
	 */
	private Duration timeout = Duration.ofSeconds(30);

	/**
	 * Maximum number of times a single request is retried after waiting for a rate limit
	 * reset.
	 */
	private int maxRateLimitRetries = 3;

	/**
	 * Longest single wait for a rate limit reset. A reset further away fails fast.
	 */
	private Duration maxRateLimitWait = Duration.ofHours(1);

	/**
	 * Pause between two users of a batch.
	 */
	private Duration interRequestDelay = Duration.ofMillis(500);

	/**
	 * Repository permission used when none is given.
	 */
	private String defaultRepositoryPermission = "write";

	/**
	 * Organization role used when none is given.
	 */
	private String defaultOrganizationRole = "member";

	/**
	 * Create properties from defaults overlaid with {@code GITHUB_API_URL},
	 * {@code GITHUB_TIMEOUT} (seconds), {@code GITHUB_MAX_RETRIES} and
	 * {@code GITHUB_INVITE_DELAY_MS}, resolved through {@link EnvironmentSupport}.
	 * @return configured properties
	 */
	public static InviterProperties fromEnvironment() {
		return fromEnvironment(EnvironmentSupport::get);
	}

	/**
	 * Create properties from defaults overlaid with values from the given lookup.
	 * @param lookup variable lookup returning null for unset names
	 * @return configured properties
	 * @throws IllegalArgumentException if a numeric variable cannot be parsed
	 */
	public static InviterProperties fromEnvironment(Function<String, @Nullable String> lookup) {
		InviterProperties properties = new InviterProperties();
		String apiUrl = lookup.apply("GITHUB_API_URL");
		if (apiUrl != null && !apiUrl.isBlank()) {
			properties.setApiBaseUrl(apiUrl.trim());
		}
		Long timeout = parseLong(lookup, "GITHUB_TIMEOUT");
		if (timeout != null) {
			properties.setTimeout(Duration.ofSeconds(timeout));
		}
		Long retries = parseLong(lookup, "GITHUB_MAX_RETRIES");
		if (retries != null) {
			properties.setMaxRateLimitRetries(retries.intValue());
		}
		Long delay = parseLong(lookup, "GITHUB_INVITE_DELAY_MS");
		if (delay != null) {
			properties.setInterRequestDelay(Duration.ofMillis(delay));
		}
		return properties;
	}

	private static @Nullable Long parseLong(Function<String, @Nullable String> lookup, String name) {
		String value = lookup.apply(name);
		if (value == null || value.isBlank()) {
			return null;
		}
		try {
			long parsed = Long.parseLong(value.trim());
			if (parsed < 0) {
				throw new IllegalArgumentException(name + " must not be negative: " + parsed);
			}
			return parsed;
		}
		catch (NumberFormatException e) {
			throw new IllegalArgumentException("Invalid " + name + " '" + value + "': must be a whole number");
		}
	}

	public String getApiBaseUrl() {
		return apiBaseUrl;
	}

	public void setApiBaseUrl(String apiBaseUrl) {
		this.apiBaseUrl = apiBaseUrl.endsWith("/") ? apiBaseUrl.substring(0, apiBaseUrl.length() - 1) : apiBaseUrl;
	}

	public String getApiVersion() {
		return apiVersion;
	}

	public void setApiVersion(String apiVersion) {
		this.apiVersion = apiVersion;
	}

	public String getUserAgent() {
		return userAgent;
	}

	public void setUserAgent(String userAgent) {
		this.userAgent = userAgent;
	}

	public Duration getTimeout() {
		return timeout;
	}

	public void setTimeout(Duration timeout) {
		this.timeout = timeout;
	}

	public int getMaxRateLimitRetries() {
		return maxRateLimitRetries;
	}

	public void setMaxRateLimitRetries(int maxRateLimitRetries) {
		this.maxRateLimitRetries = maxRateLimitRetries;
	}

	public Duration getMaxRateLimitWait() {
		return maxRateLimitWait;
	}

	public void setMaxRateLimitWait(Duration maxRateLimitWait) {
		this.maxRateLimitWait = maxRateLimitWait;
	}

	public Duration getInterRequestDelay() {
		return interRequestDelay;
	}

	public void setInterRequestDelay(Duration interRequestDelay) {
		this.interRequestDelay = interRequestDelay;
	}

	public String getDefaultRepositoryPermission() {
		return defaultRepositoryPermission;
	}

	public void setDefaultRepositoryPermission(String defaultRepositoryPermission) {
		this.defaultRepositoryPermission = defaultRepositoryPermission;
	}

	public String getDefaultOrganizationRole() {
		return defaultOrganizationRole;
	}

	public void setDefaultOrganizationRole(String defaultOrganizationRole) {
		this.defaultOrganizationRole = defaultOrganizationRole;
	}

}
