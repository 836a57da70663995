package org.springaicommunity.github.inviter;

import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * Parsed configuration result from command-line arguments.
 */
public class ParsedConfiguration {

	/**
	 * Commands understood by the command-line tool.
	 */
	public enum Command {

		INVITE_REPO("invite-repo"), INVITE_ORG("invite-org"), CONFIG("config");

		private final String name;

		Command(String name) {
			this.name = name;
		}

		public String commandName() {
			return name;
		}

	}

	public @Nullable Command command;

	// Invitation target and users
	public @Nullable String target;

	public List<String> usernames = new ArrayList<>();

	// Repository permission or organization role
	public String permission;

	public String role;

	// Credentials (falls back to GITHUB_TOKEN)
	public @Nullable String token;

	// Pacing between users; null = use properties
	public @Nullable Long delayMs;

	public boolean showConfig = false;

	public boolean helpRequested = false;

	public ParsedConfiguration(InviterProperties defaultProperties) {
		this.permission = defaultProperties.getDefaultRepositoryPermission();
		this.role = defaultProperties.getDefaultOrganizationRole();
	}

	/**
	 * Returns the invitation mode for invite commands.
	 * @return mode matching the command
	 * @throws IllegalStateException if the command is not an invite command
	 */
	public InvitationMode mode() {
		if (command == Command.INVITE_REPO) {
			return InvitationMode.REPOSITORY;
		}
		if (command == Command.INVITE_ORG) {
			return InvitationMode.ORGANIZATION;
		}
		throw new IllegalStateException("Command " + command + " does not invite users");
	}

	/**
	 * Returns the permission or role that applies to the command.
	 * @return repository permission for invite-repo, organization role otherwise
	 */
	public String effectivePermission() {
		return command == Command.INVITE_REPO ? permission : role;
	}

	@Override
	public String toString() {
		return "ParsedConfiguration{" + "command=" + command + ", target='" + target + '\'' + ", usernames="
				+ usernames + ", permission='" + permission + '\'' + ", role='" + role + '\'' + ", token="
				+ (token != null ? "'********'" : "null") + ", delayMs=" + delayMs + ", showConfig=" + showConfig
				+ ", helpRequested=" + helpRequested + '}';
	}

}
