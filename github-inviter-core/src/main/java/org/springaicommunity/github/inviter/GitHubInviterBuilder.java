package org.springaicommunity.github.inviter;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;

import java.time.Clock;

/**
 * Builder for creating GitHub inviter services without Spring dependencies.
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>
 * {@code
 * // Token from GITHUB_TOKEN (or .env)
 * BatchInvitationService inviter = GitHubInviterBuilder.create()
 *     .tokenFromEnv()
 *     .buildBatchInvitationService();
 *
 * BatchResult result = inviter.batchInvite(List.of("alice", "bob"), "acme/widgets", "write",
 *     InvitationMode.REPOSITORY);
 *
 * // For testing with mock HTTP client
 * GitHubClient mockClient = mock(GitHubClient.class);
 * BatchInvitationService testInviter = GitHubInviterBuilder.create()
 *     .httpClient(mockClient)
 *     .buildBatchInvitationService();
 * }
 * </pre>
 *
 * <p>
 * Every call to a {@code build*} method creates a fresh {@link GitHubHttpClient}, so
 * services built for different batches never share rate limit state.
 */
public class GitHubInviterBuilder {

	private @Nullable String token;

	private InviterProperties properties;

	private @Nullable ObjectMapper objectMapper;

	private @Nullable GitHubClient httpClient;

	private Clock clock = Clock.systemUTC();

	private Sleeper sleeper = Sleeper.system();

	private GitHubInviterBuilder() {
		this.properties = new InviterProperties();
	}

	/**
	 * Create a new builder instance.
	 * @return new GitHubInviterBuilder
	 */
	public static GitHubInviterBuilder create() {
		return new GitHubInviterBuilder();
	}

	/**
	 * Set the GitHub access token directly.
	 * @param token OAuth or personal access token
	 * @return this builder
	 */
	public GitHubInviterBuilder token(String token) {
		this.token = token;
		return this;
	}

	/**
	 * Read the GitHub token from {@code GITHUB_TOKEN} via {@link EnvironmentSupport}.
	 * @return this builder
	 * @throws MissingCredentialException if GITHUB_TOKEN is not set
	 */
	public GitHubInviterBuilder tokenFromEnv() {
		this.token = EnvironmentSupport.get("GITHUB_TOKEN");
		if (this.token == null) {
			throw new MissingCredentialException(
					"GITHUB_TOKEN environment variable is required. Please set your GitHub access token.");
		}
		return this;
	}

	/**
	 * Set inviter properties.
	 * @param properties configuration properties (null to use defaults)
	 * @return this builder
	 */
	public GitHubInviterBuilder properties(@Nullable InviterProperties properties) {
		if (properties != null) {
			this.properties = properties;
		}
		return this;
	}

	/**
	 * Set a custom ObjectMapper.
	 * @param objectMapper Jackson ObjectMapper (null to use default)
	 * @return this builder
	 */
	public GitHubInviterBuilder objectMapper(@Nullable ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
		return this;
	}

	/**
	 * Set a custom GitHubClient implementation. When a custom client is provided, the
	 * token is not required.
	 * @param httpClient custom GitHubClient implementation (null to use default)
	 * @return this builder
	 */
	public GitHubInviterBuilder httpClient(@Nullable GitHubClient httpClient) {
		this.httpClient = httpClient;
		return this;
	}

	/**
	 * Set the clock used to compute rate limit waits.
	 * @param clock clock to use
	 * @return this builder
	 */
	public GitHubInviterBuilder clock(Clock clock) {
		this.clock = clock;
		return this;
	}

	/**
	 * Set the sleeper used for pacing and rate limit waits.
	 * @param sleeper sleeper to use
	 * @return this builder
	 */
	public GitHubInviterBuilder sleeper(Sleeper sleeper) {
		this.sleeper = sleeper;
		return this;
	}

	/**
	 * Build the GitHub transport.
	 * @return the custom client if one was set, otherwise a new {@link GitHubHttpClient}
	 * @throws MissingCredentialException if no client and no token was provided
	 */
	public GitHubClient buildClient() {
		if (httpClient != null) {
			return httpClient;
		}
		if (token == null || token.isBlank()) {
			throw new MissingCredentialException(
					"A GitHub access token is required. Call token() or tokenFromEnv() first.");
		}
		return new GitHubHttpClient(token, properties, resolveObjectMapper(), clock, sleeper);
	}

	/**
	 * Build the resource client.
	 * @return configured InvitationService
	 */
	public InvitationService buildInvitationService() {
		return new GitHubInvitationService(buildClient(), resolveObjectMapper());
	}

	/**
	 * Build the batch orchestrator.
	 * @return configured BatchInvitationService
	 */
	public BatchInvitationService buildBatchInvitationService() {
		return new BatchInvitationService(buildInvitationService(), properties.getInterRequestDelay(), sleeper);
	}

	private ObjectMapper resolveObjectMapper() {
		if (objectMapper == null) {
			objectMapper = ObjectMapperFactory.create();
		}
		return objectMapper;
	}

}
