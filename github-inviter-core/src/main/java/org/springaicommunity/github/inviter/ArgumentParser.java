package org.springaicommunity.github.inviter;

import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Command-line argument parser for the GitHub inviter. Pure Java implementation with no
 * Spring dependencies for maximum testability.
 */
public class ArgumentParser {

	private final InviterProperties defaultProperties;

	public ArgumentParser(InviterProperties defaultProperties) {
		this.defaultProperties = defaultProperties;
	}

	/**
	 * Parse command-line arguments and return configuration.
	 * @param args Command-line arguments
	 * @return Parsed configuration object
	 * @throws IllegalArgumentException if arguments are invalid
	 */
	public ParsedConfiguration parseAndValidate(String[] args) {
		ParsedConfiguration config = new ParsedConfiguration(defaultProperties);
		List<String> positional = new ArrayList<>();

		for (int i = 0; i < args.length; i++) {
			String arg = args[i];

			switch (arg) {
				case "-p", "--permission":
					config.permission = getRequiredValue(args, i, "permission");
					RepositoryPermission.fromValue(config.permission);
					i++; // Skip next argument since we consumed it
					break;

				case "--role":
					config.role = getRequiredValue(args, i, "role");
					OrganizationRole.fromValue(config.role);
					i++;
					break;

				case "-t", "--token":
					config.token = getRequiredValue(args, i, "token");
					i++;
					break;

				case "--delay-ms":
					String delayStr = getRequiredValue(args, i, "delay-ms");
					try {
						config.delayMs = Long.parseLong(delayStr);
					}
					catch (NumberFormatException e) {
						throw new IllegalArgumentException(
								"Invalid delay '" + delayStr + "': must be a non-negative integer");
					}
					if (config.delayMs < 0) {
						throw new IllegalArgumentException("Delay must not be negative: " + config.delayMs);
					}
					i++;
					break;

				case "--show":
					config.showConfig = true;
					break;

				case "-h", "--help":
					config.helpRequested = true;
					break;

				default:
					if (arg.startsWith("-")) {
						throw new IllegalArgumentException("Unknown option: " + arg);
					}
					positional.add(arg);
					break;
			}
		}

		if (config.helpRequested) {
			return config;
		}

		applyPositionalArguments(config, positional);
		validateConfiguration(config);

		return config;
	}

	/**
	 * Check if help is requested without full parsing.
	 * @param args Command-line arguments
	 * @return true if help is requested
	 */
	public boolean isHelpRequested(String[] args) {
		if (args.length == 0) {
			return true;
		}
		for (String arg : args) {
			if ("-h".equals(arg) || "--help".equals(arg)) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Generate help text for command-line usage.
	 * @return Help text string
	 */
	public String generateHelpText() {
		StringBuilder help = new StringBuilder();
		help.append("Usage: github-inviter <command> [ARGS] [OPTIONS]\n");
		help.append("\n");
		help.append("Invite GitHub users to a repository or an organization in one batch.\n");
		help.append("\n");
		help.append("COMMANDS:\n");
		help.append("    invite-repo OWNER/REPO USER...   Invite users to a repository\n");
		help.append("    invite-org ORG USER...           Invite users to an organization\n");
		help.append("    config --show                    Show effective configuration (secrets masked)\n");
		help.append("\n");
		help.append("OPTIONS:\n");
		help.append("    -h, --help              Show this help message\n");
		help.append("    -p, --permission PERM   Repository permission: read, write, admin (default: ")
			.append(defaultProperties.getDefaultRepositoryPermission())
			.append(")\n");
		help.append("    --role ROLE             Organization role: member, admin (default: ")
			.append(defaultProperties.getDefaultOrganizationRole())
			.append(")\n");
		help.append("    -t, --token TOKEN       GitHub access token (default: GITHUB_TOKEN)\n");
		help.append("    --delay-ms MILLIS       Pause between users (default: ")
			.append(defaultProperties.getInterRequestDelay().toMillis())
			.append(")\n");
		help.append("\n");
		help.append("ENVIRONMENT VARIABLES (also read from .env):\n");
		help.append("    GITHUB_TOKEN           GitHub access token\n");
		help.append("    GITHUB_API_URL         API base URL (default: https://api.github.com)\n");
		help.append("    GITHUB_TIMEOUT         Request timeout in seconds (default: 30)\n");
		help.append("    GITHUB_MAX_RETRIES     Rate limit retries per request (default: 3)\n");
		help.append("    GITHUB_INVITE_DELAY_MS Pause between users in milliseconds (default: 500)\n");
		help.append("\n");
		help.append("EXAMPLES:\n");
		help.append("    github-inviter invite-repo owner/repo user1 user2 --permission write\n");
		help.append("    github-inviter invite-org my-org user1 user2 --role member\n");
		help.append("    github-inviter config --show\n");
		help.append("\n");
		help.append("EXIT CODES:\n");
		help.append("    0  every user was invited or already had access\n");
		help.append("    1  at least one invitation failed, or GitHub could not be reached\n");
		help.append("    2  invalid arguments, target or missing token\n");

		return help.toString();
	}

	/**
	 * Resolve the access token from the command line or the environment.
	 * @param config parsed configuration
	 * @param environment variable lookup
	 * @return the token
	 * @throws MissingCredentialException if no token is available
	 */
	public String resolveToken(ParsedConfiguration config, Function<String, @Nullable String> environment) {
		if (config.token != null && !config.token.isBlank()) {
			return config.token;
		}
		String githubToken = environment.apply("GITHUB_TOKEN");
		if (githubToken == null || githubToken.trim().isEmpty()) {
			throw new MissingCredentialException(
					"GITHUB_TOKEN environment variable is required. Pass --token or export GITHUB_TOKEN=your_token_here");
		}
		return githubToken;
	}

	private void applyPositionalArguments(ParsedConfiguration config, List<String> positional) {
		if (positional.isEmpty()) {
			throw new IllegalArgumentException("Missing command: expected invite-repo, invite-org or config");
		}
		String commandName = positional.get(0);
		for (ParsedConfiguration.Command command : ParsedConfiguration.Command.values()) {
			if (command.commandName().equals(commandName)) {
				config.command = command;
			}
		}
		if (config.command == null) {
			throw new IllegalArgumentException("Unknown command: " + commandName);
		}
		if (config.command == ParsedConfiguration.Command.CONFIG) {
			if (positional.size() > 1) {
				throw new IllegalArgumentException("config takes no arguments");
			}
			return;
		}
		if (positional.size() > 1) {
			config.target = positional.get(1);
		}
		config.usernames = new ArrayList<>(positional.subList(Math.min(2, positional.size()), positional.size()));
	}

	private String getRequiredValue(String[] args, int currentIndex, String optionName) {
		if (currentIndex + 1 >= args.length) {
			throw new IllegalArgumentException("Missing value for " + optionName + " option");
		}
		return args[currentIndex + 1];
	}

	private void validateConfiguration(ParsedConfiguration config) {
		List<String> errors = new ArrayList<>();

		if (config.command == ParsedConfiguration.Command.CONFIG) {
			if (!config.showConfig) {
				errors.add("config requires --show");
			}
		}
		else {
			if (config.target == null || config.target.isBlank()) {
				errors.add(config.command == ParsedConfiguration.Command.INVITE_REPO
						? "Repository is required in format 'owner/repo'" : "Organization is required");
			}
			else if (config.command == ParsedConfiguration.Command.INVITE_REPO) {
				try {
					RepositoryTarget.parse(config.target);
				}
				catch (InvalidTargetException e) {
					errors.add("Repository must be in format 'owner/repo': " + config.target);
				}
			}
			if (config.usernames.isEmpty()) {
				errors.add("At least one username is required");
			}
		}

		if (!errors.isEmpty()) {
			throw new IllegalArgumentException("Configuration errors: " + String.join(", ", errors));
		}
	}

}
