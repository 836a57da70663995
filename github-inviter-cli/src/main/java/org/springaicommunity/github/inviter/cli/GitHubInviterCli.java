package org.springaicommunity.github.inviter.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springaicommunity.github.inviter.*;

import java.io.PrintStream;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;

/**
 * GitHub Inviter CLI Application
 *
 * Plain Java command-line application that invites users to a repository or an
 * organization. No Spring dependencies - uses GitHubInviterBuilder for service wiring.
 *
 * Usage: java -jar github-inviter-cli.jar COMMAND [ARGS] [OPTIONS]
 *
 * Environment Variables: GITHUB_TOKEN - GitHub access token for authentication
 *
 * Examples: java -jar github-inviter-cli.jar invite-repo owner/repo user1 user2
 * --permission write java -jar github-inviter-cli.jar invite-org my-org user1 --role
 * member java -jar github-inviter-cli.jar config --show
 */
public class GitHubInviterCli {

	private static final Logger logger = LoggerFactory.getLogger(GitHubInviterCli.class);

	static final int EXIT_OK = 0;

	static final int EXIT_FAILURES = 1;

	static final int EXIT_USAGE = 2;

	private static final String MASK = "********";

	private static final List<String> SENSITIVE_KEYS = List.of("token", "secret", "key");

	private final InviterProperties properties;

	private final ArgumentParser argumentParser;

	private final Function<InviterProperties, BatchInvitationServiceFactory> factoryProvider;

	private final Function<String, @Nullable String> environment;

	private final ObjectMapper objectMapper;

	private final PrintStream out;

	private final PrintStream err;

	GitHubInviterCli(InviterProperties properties,
			Function<InviterProperties, BatchInvitationServiceFactory> factoryProvider,
			Function<String, @Nullable String> environment, PrintStream out, PrintStream err) {
		this.properties = properties;
		this.argumentParser = new ArgumentParser(properties);
		this.factoryProvider = factoryProvider;
		this.environment = environment;
		this.objectMapper = ObjectMapperFactory.create();
		this.out = out;
		this.err = err;
	}

	public static void main(String[] args) {
		int exitCode = run(args);
		if (exitCode != 0) {
			System.exit(exitCode);
		}
	}

	public static int run(String[] args) {
		InviterProperties properties;
		try {
			properties = InviterProperties.fromEnvironment();
		}
		catch (IllegalArgumentException e) {
			System.err.println("Error: " + e.getMessage());
			return EXIT_USAGE;
		}
		GitHubInviterCli cli = new GitHubInviterCli(properties, GitHubInviterCli::defaultFactory,
				EnvironmentSupport::get, System.out, System.err);
		return cli.execute(args);
	}

	private static BatchInvitationServiceFactory defaultFactory(InviterProperties properties) {
		return token -> GitHubInviterBuilder.create().token(token).properties(properties).buildBatchInvitationService();
	}

	int execute(String[] args) {
		if (argumentParser.isHelpRequested(args)) {
			out.println(argumentParser.generateHelpText());
			return EXIT_OK;
		}

		try {
			ParsedConfiguration config = argumentParser.parseAndValidate(args);
			logger.debug("Configuration: {}", config);

			if (config.command == ParsedConfiguration.Command.CONFIG) {
				return showConfig(config);
			}
			return invite(config);
		}
		catch (BatchCancelledException e) {
			err.println("Error: " + e.getMessage());
			return EXIT_FAILURES;
		}
		catch (JsonProcessingException e) {
			logger.error("Failed to render output: {}", e.getOriginalMessage());
			return EXIT_FAILURES;
		}
		catch (RuntimeException e) {
			err.println("Error: " + e.getMessage());
			if (ErrorStatusMapper.isClientError(e)) {
				err.println("Run with --help for usage.");
				return EXIT_USAGE;
			}
			logger.error("Invitation failed", e);
			return EXIT_FAILURES;
		}
	}

	private int invite(ParsedConfiguration config) throws JsonProcessingException {
		String token = argumentParser.resolveToken(config, environment);
		if (config.delayMs != null) {
			properties.setInterRequestDelay(Duration.ofMillis(config.delayMs));
		}

		InvitationMode mode = config.mode();
		String target = config.target != null ? config.target : "";
		String permission = config.effectivePermission();
		logger.info("Inviting {} users to {} {} ({})", config.usernames.size(),
				mode.name().toLowerCase(Locale.ROOT), target, permission);

		BatchInvitationService service = factoryProvider.apply(properties).forToken(token);
		BatchResult result = service.batchInvite(config.usernames, target, permission, mode);

		for (InvitationOutcome outcome : result.results()) {
			String line = symbolFor(outcome.status()) + " " + outcome.username() + ": " + outcome.message();
			if (outcome.status() == InvitationStatus.ERROR) {
				err.println(line);
			}
			else {
				out.println(line);
			}
		}
		out.println(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(result));
		out.println("Invited " + result.successful() + " of " + result.results().size() + " users to " + target
				+ " (" + result.failed() + " failed)");

		return result.failed() == 0 ? EXIT_OK : EXIT_FAILURES;
	}

	private int showConfig(ParsedConfiguration config) throws JsonProcessingException {
		ObjectNode view = objectMapper.valueToTree(properties);
		String token = config.token != null ? config.token : environment.apply("GITHUB_TOKEN");
		view.put("github_token", token);
		maskSensitiveValues(view);
		out.println(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(view));
		return EXIT_OK;
	}

	static void maskSensitiveValues(ObjectNode node) {
		List<String> sensitive = new ArrayList<>();
		Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
		while (fields.hasNext()) {
			Map.Entry<String, JsonNode> field = fields.next();
			String key = field.getKey().toLowerCase(Locale.ROOT);
			if (SENSITIVE_KEYS.stream().anyMatch(key::contains) && !field.getValue().isNull()) {
				sensitive.add(field.getKey());
			}
		}
		sensitive.forEach(key -> node.put(key, MASK));
	}

	private static String symbolFor(InvitationStatus status) {
		return switch (status) {
			case SUCCESS -> "✓";
			case INFO -> "ℹ";
			case ERROR -> "✗";
		};
	}

}
