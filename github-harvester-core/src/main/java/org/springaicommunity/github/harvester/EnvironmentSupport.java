package org.springaicommunity.github.harvester;

import io.github.cdimascio.dotenv.Dotenv;
import org.jspecify.annotations.Nullable;

/**
 * Resolves configuration values such as {@code GITHUB_TOKEN} from {@code .env} files and
 * the process environment. The {@code .env} files are loaded once per process.
 *
 * <p>
 * Lookup order:
 * <ol>
 * <li>the process environment (dotenv-java checks {@code System.getenv} first)</li>
 * <li>{@code .env} file in the current working directory</li>
 * <li>{@code .env} file in the user's home directory</li>
 * </ol>
 */
public final class EnvironmentSupport {

	public static final String GITHUB_TOKEN = "GITHUB_TOKEN";

	private static final Dotenv CWD_DOTENV = Dotenv.configure().ignoreIfMissing().ignoreIfMalformed().load();

	private static final Dotenv HOME_DOTENV = loadHomeDotenv();

	private static Dotenv loadHomeDotenv() {
		String home = System.getProperty("user.home");
		if (home != null) {
			return Dotenv.configure().directory(home).ignoreIfMissing().ignoreIfMalformed().load();
		}
		return CWD_DOTENV;
	}

	private EnvironmentSupport() {
	}

	/**
	 * Get a value, treating blank values as absent.
	 * @param name the variable name
	 * @return the value, or {@code null} if not found
	 */
	@Nullable
	public static String get(String name) {
		String value = CWD_DOTENV.get(name);
		if (value == null || value.isBlank()) {
			value = HOME_DOTENV.get(name);
		}
		return value == null || value.isBlank() ? null : value.trim();
	}

	/**
	 * Get a value that must be present.
	 * @param name the variable name
	 * @return the non-blank value
	 * @throws IllegalStateException if the variable is missing or blank
	 */
	public static String require(String name) {
		String value = get(name);
		if (value == null) {
			throw new IllegalStateException(name + " environment variable is required. Set it in the environment "
					+ "or in a .env file: export " + name + "=your_value_here");
		}
		return value;
	}

}
