package org.springaicommunity.github.inviter;

/**
 * Malformed repository or organization identifier. Detected before any network call and
 * fatal to the whole batch.
 */
public class InvalidTargetException extends IllegalArgumentException {

	private final String target;

	public InvalidTargetException(String target, String message) {
		super(message);
		this.target = target;
	}

	public String getTarget() {
		return target;
	}

}
