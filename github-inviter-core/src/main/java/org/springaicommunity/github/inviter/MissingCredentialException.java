package org.springaicommunity.github.inviter;

/**
 * No GitHub access token was supplied.
 */
public class MissingCredentialException extends IllegalStateException {

	public MissingCredentialException(String message) {
		super(message);
	}

}
