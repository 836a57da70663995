package org.springaicommunity.github.inviter;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Set;

/**
 * Service for the GitHub REST calls behind repository and organization invitations.
 */
public class GitHubInvitationService implements InvitationService {

	private static final Logger logger = LoggerFactory.getLogger(GitHubInvitationService.class);

	private static final Set<String> EXISTING_MEMBERSHIP_STATES = Set.of("active", "pending");

	private final GitHubClient httpClient;

	private final ObjectMapper objectMapper;

	public GitHubInvitationService(GitHubClient httpClient, ObjectMapper objectMapper) {
		this.httpClient = httpClient;
		this.objectMapper = objectMapper;
	}

	@Override
	public JsonNode getUserInfo(String username) {
		try {
			return httpClient.get("/users/" + encode(username));
		}
		catch (ResourceNotFoundException e) {
			throw new ResourceNotFoundException("User '" + username + "' not found or doesn't exist", e);
		}
	}

	@Override
	public JsonNode inviteToRepository(String owner, String repo, String username, RepositoryPermission permission) {
		getUserInfo(username);

		logger.debug("Inviting {} to {}/{} with {} permission", username, owner, repo, permission.value());
		String path = "/repos/" + encode(owner) + "/" + encode(repo) + "/collaborators/" + encode(username);
		return httpClient.put(path, Map.of("permission", permission.value()));
	}

	@Override
	public JsonNode inviteToOrganization(String org, String username, OrganizationRole role) {
		getUserInfo(username);

		String path = "/orgs/" + encode(org) + "/memberships/" + encode(username);
		try {
			JsonNode membership = httpClient.get(path);
			String state = membership.path("state").asText("");
			if (EXISTING_MEMBERSHIP_STATES.contains(state)) {
				logger.debug("{} is already {} in {}, skipping invitation", username, state, org);
				ObjectNode existing = objectMapper.createObjectNode();
				existing.put("state", state);
				existing.put("message", "User is already " + state + " in the organization");
				return existing;
			}
		}
		catch (ResourceNotFoundException e) {
			logger.debug("{} has no membership in {}, sending invitation", username, org);
		}

		logger.debug("Inviting {} to organization {} as {}", username, org, role.value());
		return httpClient.put(path, Map.of("role", role.value()));
	}

	private static String encode(String segment) {
		return URLEncoder.encode(segment, StandardCharsets.UTF_8).replace("+", "%20");
	}

}
