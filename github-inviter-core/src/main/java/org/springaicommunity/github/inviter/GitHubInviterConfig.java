package org.springaicommunity.github.inviter;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Spring configuration for applications that host the inviter, such as a web front end
 * that receives the access token per request.
 */
@Configuration
public class GitHubInviterConfig {

	@Bean
	public InviterProperties inviterProperties(@Value("${GITHUB_API_URL:https://api.github.com}") String apiBaseUrl,
			@Value("${GITHUB_TIMEOUT:30}") long timeoutSeconds, @Value("${GITHUB_MAX_RETRIES:3}") int maxRetries,
			@Value("${GITHUB_INVITE_DELAY_MS:500}") long inviteDelayMs) {
		InviterProperties properties = new InviterProperties();
		properties.setApiBaseUrl(apiBaseUrl);
		properties.setTimeout(Duration.ofSeconds(timeoutSeconds));
		properties.setMaxRateLimitRetries(maxRetries);
		properties.setInterRequestDelay(Duration.ofMillis(inviteDelayMs));
		return properties;
	}

	@Bean
	public ObjectMapper objectMapper() {
		return ObjectMapperFactory.create();
	}

	@Bean
	public BatchInvitationServiceFactory batchInvitationServiceFactory(InviterProperties properties,
			ObjectMapper objectMapper) {
		return accessToken -> GitHubInviterBuilder.create()
			.token(accessToken)
			.properties(properties)
			.objectMapper(objectMapper)
			.buildBatchInvitationService();
	}

}
