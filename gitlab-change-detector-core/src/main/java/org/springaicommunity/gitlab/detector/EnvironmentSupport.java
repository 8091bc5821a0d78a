package org.springaicommunity.gitlab.detector;

import io.github.cdimascio.dotenv.Dotenv;
import io.github.cdimascio.dotenv.DotenvBuilder;
import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Environment lookup for connection settings such as {@code GITLAB_HOST} and
 * {@code GITLAB_TOKEN}. Values come from the process environment or from {@code .env}
 * files, which are read once per process.
 *
 * <p>
 * Lookup order:
 * <ol>
 * <li>process environment ({@link System#getenv})</li>
 * <li>{@code .env} in the current working directory</li>
 * <li>{@code .env} in the user's home directory</li>
 * </ol>
 * Blank values count as absent.
 */
public final class EnvironmentSupport {

	private static final List<Dotenv> SOURCES = List.of(load(null), load(System.getProperty("user.home")));

	private EnvironmentSupport() {
	}

	/**
	 * Get an environment variable value.
	 * @param name the variable name
	 * @return the trimmed value, or {@code null} if not set or blank
	 */
	@Nullable
	public static String get(String name) {
		for (Dotenv source : SOURCES) {
			// Dotenv.get consults System.getenv before the file
			String value = source.get(name);
			if (value != null && !value.isBlank()) {
				return value.trim();
			}
		}
		return null;
	}

	private static Dotenv load(@Nullable String directory) {
		DotenvBuilder config = Dotenv.configure().ignoreIfMissing().ignoreIfMalformed();
		if (directory != null) {
			config.directory(directory);
		}
		return config.load();
	}

}
