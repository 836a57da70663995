package org.springaicommunity.github.inviter;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Role granted to an organization member. Independent from
 * {@link RepositoryPermission}: {@code write} is not accepted here.
 */
public enum OrganizationRole {

	MEMBER("member"),

	ADMIN("admin");

	private final String value;

	OrganizationRole(String value) {
		this.value = value;
	}

	@JsonValue
	public String value() {
		return value;
	}

	/**
	 * Parse a role name, ignoring case.
	 * @param value role name
	 * @return the role
	 * @throws IllegalArgumentException if the name is not member or admin
	 */
	public static OrganizationRole fromValue(String value) {
		String normalized = value.trim().toLowerCase(Locale.ROOT);
		for (OrganizationRole role : values()) {
			if (role.value.equals(normalized)) {
				return role;
			}
		}
		throw new IllegalArgumentException("Invalid role '" + value + "': must be 'member' or 'admin'");
	}

}
