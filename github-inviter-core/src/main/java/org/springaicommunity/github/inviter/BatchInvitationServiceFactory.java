package org.springaicommunity.github.inviter;

/**
 * Creates a {@link BatchInvitationService} bound to one caller's access token. Each call
 * returns a service with its own client and rate limit state.
 */
@FunctionalInterface
public interface BatchInvitationServiceFactory {

	/**
	 * Create a batch service for the given token.
	 * @param accessToken the caller's GitHub access token
	 * @return a new service
	 * @throws MissingCredentialException if the token is blank
	 */
	BatchInvitationService forToken(String accessToken);

}
