package org.springaicommunity.github.inviter;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Classification of a single invitation attempt. Both {@link #SUCCESS} and {@link #INFO}
 * count as successful in a {@link BatchResult}.
 */
public enum InvitationStatus {

	/**
	 * Invitation created, or the user was added or already held access.
	 */
	SUCCESS,

	/**
	 * Nothing to do, reported for information (e.g. already a collaborator).
	 */
	INFO,

	/**
	 * The attempt failed.
	 */
	ERROR;

	@JsonValue
	public String value() {
		return name().toLowerCase(Locale.ROOT);
	}

	public boolean isSuccessful() {
		return this != ERROR;
	}

}
