package org.springaicommunity.github.inviter;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Permission granted to a repository collaborator.
 */
public enum RepositoryPermission {

	/**
	 * Read-only access.
	 */
	READ("read"),

	/**
	 * Read and write access.
	 */
	WRITE("write"),

	/**
	 * Full administrative access.
	 */
	ADMIN("admin");

	private final String value;

	RepositoryPermission(String value) {
		this.value = value;
	}

	@JsonValue
	public String value() {
		return value;
	}

	/**
	 * Parse a permission name, ignoring case.
	 * @param value permission name
	 * @return the permission
	 * @throws IllegalArgumentException if the name is not read, write or admin
	 */
	public static RepositoryPermission fromValue(String value) {
		String normalized = value.trim().toLowerCase(Locale.ROOT);
		for (RepositoryPermission permission : values()) {
			if (permission.value.equals(normalized)) {
				return permission;
			}
		}
		throw new IllegalArgumentException(
				"Invalid permission '" + value + "': must be 'read', 'write', or 'admin'");
	}

}
