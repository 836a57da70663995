package org.springaicommunity.github.inviter;

/**
 * What a batch invites users to.
 */
public enum InvitationMode {

	REPOSITORY,

	ORGANIZATION

}
