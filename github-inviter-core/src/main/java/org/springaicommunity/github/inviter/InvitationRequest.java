package org.springaicommunity.github.inviter;

import java.util.ArrayList;
import java.util.List;

/**
 * Batch invitation request.
 *
 * @param usernames GitHub usernames to invite, in order; never empty
 * @param target repository ({@code owner/repo}) or organization name
 * @param permission repository permission (read, write, admin) or organization role
 * (member, admin)
 */
public record InvitationRequest(List<String> usernames, String target, String permission) {

	public InvitationRequest {
		if (usernames.isEmpty()) {
			throw new IllegalArgumentException("At least one username is required");
		}
		List<String> trimmed = new ArrayList<>(usernames.size());
		for (String username : usernames) {
			if (username == null || username.isBlank()) {
				throw new IllegalArgumentException("Usernames must not be blank");
			}
			trimmed.add(username.trim());
		}
		usernames = List.copyOf(trimmed);
		if (target.isBlank()) {
			throw new InvalidTargetException(target, "target_name must not be empty");
		}
		target = target.trim();
		permission = permission.trim();
	}

}
