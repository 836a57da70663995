package org.springaicommunity.github.inviter;

/**
 * Result of inviting one user.
 *
 * @param username the GitHub username that was invited
 * @param status classification of the attempt
 * @param message detailed message about the result
 */
public record InvitationOutcome(String username, InvitationStatus status, String message) {

	public static InvitationOutcome success(String username, String message) {
		return new InvitationOutcome(username, InvitationStatus.SUCCESS, message);
	}

	public static InvitationOutcome info(String username, String message) {
		return new InvitationOutcome(username, InvitationStatus.INFO, message);
	}

	public static InvitationOutcome error(String username, String message) {
		return new InvitationOutcome(username, InvitationStatus.ERROR, message);
	}

}
