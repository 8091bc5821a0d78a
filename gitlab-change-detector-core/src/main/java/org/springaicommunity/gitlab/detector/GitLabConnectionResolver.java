package org.springaicommunity.gitlab.detector;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Locale;
import java.util.function.Function;

/**
 * Resolves a named GitLab connection into a {@link GitLabConfig}.
 *
 * <p>
 * A connection id maps to a pair of environment variables: {@code gitlab_default} reads
 * {@code GITLAB_HOST} and {@code GITLAB_TOKEN}; any other id is upper-cased, so
 * {@code gitlab_conn_id} reads {@code GITLAB_CONN_ID_HOST} and
 * {@code GITLAB_CONN_ID_TOKEN}. Both values are required.
 */
public class GitLabConnectionResolver {

	private static final Logger logger = LoggerFactory.getLogger(GitLabConnectionResolver.class);

	public static final String DEFAULT_CONNECTION_ID = "gitlab_default";

	private static final String DEFAULT_PREFIX = "GITLAB";

	private final Function<String, @Nullable String> environment;

	private final Duration connectionTimeout;

	public GitLabConnectionResolver() {
		this(EnvironmentSupport::get, GitLabConfig.DEFAULT_CONNECTION_TIMEOUT);
	}

	/**
	 * @param environment variable lookup, {@link EnvironmentSupport#get(String)} outside
	 * of tests
	 * @param connectionTimeout timeout applied to resolved connections
	 */
	public GitLabConnectionResolver(Function<String, @Nullable String> environment, Duration connectionTimeout) {
		this.environment = environment;
		this.connectionTimeout = connectionTimeout;
	}

	/**
	 * Resolve a connection.
	 * @param connectionId connection id, e.g. {@value #DEFAULT_CONNECTION_ID}
	 * @return validated connection settings
	 * @throws GitLabConfigurationException if the token or host is missing or the host is
	 * not a valid URL
	 */
	public GitLabConfig resolve(String connectionId) {
		String prefix = prefixFor(connectionId);
		String token = lookup(prefix + "_TOKEN");
		String host = lookup(prefix + "_HOST");

		if (token == null) {
			throw new GitLabConfigurationException("An access token is required to authenticate to GitLab "
					+ "(connection '" + connectionId + "'). Set " + prefix + "_TOKEN.");
		}
		if (host == null) {
			throw new GitLabConfigurationException(
					"Host is required to connect to GitLab (connection '" + connectionId + "'). Set " + prefix
							+ "_HOST.");
		}

		try {
			GitLabConfig config = new GitLabConfig(host, token, connectionTimeout);
			logger.info("GitLab connection '{}' resolved for host {}", connectionId, host);
			return config;
		}
		catch (IllegalArgumentException e) {
			throw new GitLabConfigurationException(
					"Invalid GitLab host for connection '" + connectionId + "': " + e.getMessage(), e);
		}
	}

	static String prefixFor(String connectionId) {
		if (connectionId.isBlank()) {
			throw new GitLabConfigurationException("Connection id cannot be blank");
		}
		if (DEFAULT_CONNECTION_ID.equals(connectionId)) {
			return DEFAULT_PREFIX;
		}
		return connectionId.trim().toUpperCase(Locale.ROOT).replaceAll("[^A-Z0-9]", "_");
	}

	@Nullable
	private String lookup(String name) {
		String value = environment.apply(name);
		return value == null || value.isBlank() ? null : value.trim();
	}

}
