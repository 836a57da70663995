package org.springaicommunity.github.inviter;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Interface for the GitHub operations behind a single invitation.
 *
 * <p>
 * Both invitation operations verify that the user exists first, so an unknown user fails
 * with {@link ResourceNotFoundException} rather than a generic invitation failure.
 */
public interface InvitationService {

	/**
	 * Get information about a GitHub user.
	 * @param username GitHub username to look up
	 * @return user information from the GitHub API
	 * @throws ResourceNotFoundException if the user does not exist
	 * @throws GitHubApiException if the API call fails
	 */
	JsonNode getUserInfo(String username);

	/**
	 * Invite a user to a repository with the given permission.
	 *
	 * <p>
	 * A response whose {@code state} is {@code pending} means a new invitation was
	 * created; anything else means the user was added directly or already had access.
	 * @param owner repository owner
	 * @param repo repository name
	 * @param username user to invite
	 * @param permission permission level
	 * @return raw response from the GitHub API
	 * @throws ResourceNotFoundException if the user does not exist
	 * @throws GitHubApiException if the invitation fails
	 */
	JsonNode inviteToRepository(String owner, String repo, String username, RepositoryPermission permission);

	/**
	 * Invite a user to an organization with the given role. Existing active or pending
	 * memberships are returned as-is without issuing a write.
	 * @param org organization name
	 * @param username user to invite
	 * @param role organization role
	 * @return raw response from the GitHub API, or the existing membership state
	 * @throws ResourceNotFoundException if the user does not exist
	 * @throws GitHubApiException if the invitation fails
	 */
	JsonNode inviteToOrganization(String org, String username, OrganizationRole role);

}
