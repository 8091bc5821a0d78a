package org.springaicommunity.gitlab.detector;

import org.jspecify.annotations.Nullable;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;

/**
 * Connection settings for a GitLab server, passed by value into {@link GitLabHttpClient}.
 *
 * @param host base URL of the GitLab server, e.g. {@code https://gitlab.example.com}
 * @param token personal access token sent as {@code private_token}, or {@code null} for
 * anonymous access
 * @param connectionTimeout connect and per-request timeout
 */
public record GitLabConfig(String host, @Nullable String token, Duration connectionTimeout) {

	public static final Duration DEFAULT_CONNECTION_TIMEOUT = Duration.ofSeconds(10);

	static final String API_PATH = "/api/v4";

	public GitLabConfig {
		if (host == null || host.isBlank()) {
			throw new IllegalArgumentException("GitLab host cannot be blank");
		}
		host = host.trim();
		validateHost(host);
		if (connectionTimeout.isNegative() || connectionTimeout.isZero()) {
			throw new IllegalArgumentException("Connection timeout must be positive: " + connectionTimeout);
		}
	}

	public GitLabConfig(String host, @Nullable String token) {
		this(host, token, DEFAULT_CONNECTION_TIMEOUT);
	}

	/**
	 * Returns the API root without a trailing slash, e.g.
	 * {@code https://gitlab.example.com/api/v4}.
	 */
	public String apiBaseUrl() {
		String base = host;
		while (base.endsWith("/")) {
			base = base.substring(0, base.length() - 1);
		}
		return base + API_PATH;
	}

	public boolean hasToken() {
		return token != null && !token.isBlank();
	}

	@Override
	public String toString() {
		return "GitLabConfig{host='" + host + "', token=" + (hasToken() ? "****" : "(none)") + ", connectionTimeout="
				+ connectionTimeout + '}';
	}

	private static void validateHost(String host) {
		URI uri;
		try {
			uri = new URI(host);
		}
		catch (URISyntaxException e) {
			throw new IllegalArgumentException("Malformed GitLab host URL: " + host, e);
		}
		String scheme = uri.getScheme();
		if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))) {
			throw new IllegalArgumentException("GitLab host URL must use http or https: " + host);
		}
		if (uri.getHost() == null) {
			throw new IllegalArgumentException("GitLab host URL has no host name: " + host);
		}
		if (uri.getRawQuery() != null || uri.getRawFragment() != null) {
			throw new IllegalArgumentException("GitLab host URL cannot carry a query or fragment: " + host);
		}
	}

}
