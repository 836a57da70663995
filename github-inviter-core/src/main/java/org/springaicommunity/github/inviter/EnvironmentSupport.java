package org.springaicommunity.github.inviter;

import io.github.cdimascio.dotenv.Dotenv;
import io.github.cdimascio.dotenv.DotenvEntry;
import org.jspecify.annotations.Nullable;

import java.util.function.Function;

/**
 * Resolves configuration variables such as {@code GITHUB_TOKEN}. A {@code .env} file is
 * consulted before the process environment; both files are loaded once per process.
 *
 * <p>
 * Lookup order:
 * <ol>
 * <li>{@code .env} file in the current working directory (if present)</li>
 * <li>System environment variable ({@link System#getenv})</li>
 * <li>{@code .env} file in the user's home directory (if present)</li>
 * </ol>
 */
public final class EnvironmentSupport {

	private static final Dotenv CWD_DOTENV = Dotenv.configure().ignoreIfMissing().ignoreIfMalformed().load();

	private static final @Nullable Dotenv HOME_DOTENV = loadHomeDotenv();

	private static @Nullable Dotenv loadHomeDotenv() {
		String home = System.getProperty("user.home");
		if (home == null) {
			return null;
		}
		return Dotenv.configure().directory(home).ignoreIfMissing().ignoreIfMalformed().load();
	}

	private EnvironmentSupport() {
	}

	/**
	 * Get a variable value. Blank values count as unset.
	 * @param name the variable name
	 * @return the value, or {@code null} if not found
	 */
	public static @Nullable String get(String name) {
		return get(name, CWD_DOTENV, System::getenv, HOME_DOTENV);
	}

	static @Nullable String get(String name, @Nullable Dotenv cwd, Function<String, @Nullable String> environment,
			@Nullable Dotenv home) {
		String value = declaredIn(cwd, name);
		if (isBlank(value)) {
			value = environment.apply(name);
		}
		if (isBlank(value)) {
			value = declaredIn(home, name);
		}
		return isBlank(value) ? null : value;
	}

	/**
	 * {@link Dotenv#get(String)} also answers from the process environment, so only
	 * entries written in the file are read here.
	 */
	private static @Nullable String declaredIn(@Nullable Dotenv dotenv, String name) {
		if (dotenv == null) {
			return null;
		}
		for (DotenvEntry entry : dotenv.entries(Dotenv.Filter.DECLARED_IN_ENV_FILE)) {
			if (entry.getKey().equals(name)) {
				return entry.getValue();
			}
		}
		return null;
	}

	private static boolean isBlank(@Nullable String value) {
		return value == null || value.isBlank();
	}

}
