package org.springaicommunity.github.inviter;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.junit.jupiter.SpringJUnitConfig;

import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

/**
 * Spring context tests for GitHubInviterConfig.
 *
 * <p>
 * Uses a minimal context: beans are wired but no request reaches GitHub, since services
 * are only built from the factory and never invoked.
 */
@SpringJUnitConfig(GitHubInviterConfig.class)
@TestPropertySource(properties = { "GITHUB_API_URL=https://ghe.example.com/api/v3/", "GITHUB_TIMEOUT=12",
		"GITHUB_MAX_RETRIES=5", "GITHUB_INVITE_DELAY_MS=0" })
@DisplayName("GitHub Inviter - Spring Context Tests")
class SpringContextTest {

	@Autowired
	private InviterProperties properties;

	@Autowired
	private ObjectMapper objectMapper;

	@Autowired
	private BatchInvitationServiceFactory factory;

	@Test
	@DisplayName("Should bind properties from the environment")
	void shouldBindProperties() {
		assertThat(properties.getApiBaseUrl()).isEqualTo("https://ghe.example.com/api/v3");
		assertThat(properties.getTimeout()).isEqualTo(Duration.ofSeconds(12));
		assertThat(properties.getMaxRateLimitRetries()).isEqualTo(5);
		assertThat(properties.getInterRequestDelay()).isEqualTo(Duration.ZERO);
	}

	@Test
	@DisplayName("Should provide the shared ObjectMapper")
	void shouldProvideObjectMapper() {
		assertThat(objectMapper.getPropertyNamingStrategy()).isNotNull();
	}

	@Test
	@DisplayName("Should build a separate service per access token")
	void shouldBuildServicePerToken() {
		BatchInvitationService first = factory.forToken("token-a");
		BatchInvitationService second = factory.forToken("token-b");

		assertThat(first).isNotNull().isNotSameAs(second);
	}

	@Test
	@DisplayName("Should reject a blank access token")
	void shouldRejectBlankToken() {
		assertThatThrownBy(() -> factory.forToken("")).isInstanceOf(MissingCredentialException.class);
	}

}
