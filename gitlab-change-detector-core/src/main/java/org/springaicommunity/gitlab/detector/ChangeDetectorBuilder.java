package org.springaicommunity.gitlab.detector;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;

import java.nio.file.Paths;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Builder for creating change detection components without Spring.
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>
 * {@code
 * // Connection from GITLAB_HOST / GITLAB_TOKEN
 * ChangeDetectionPoller poller = ChangeDetectorBuilder.create()
 *     .connectionFromEnv()
 *     .buildPoller();
 *
 * // Explicit connection and checkpoints on disk
 * ChangeDetectionPoller poller = ChangeDetectorBuilder.create()
 *     .host("https://gitlab.example.com")
 *     .token("glpat-xxxxx")
 *     .fileStateRepository()
 *     .buildPoller();
 *
 * // For testing with a mock client
 * GitLabClient mockClient = mock(GitLabClient.class);
 * ChangeDetectionPoller testPoller = ChangeDetectorBuilder.create()
 *     .httpClient(mockClient)
 *     .buildPoller();
 * }
 * </pre>
 */
public class ChangeDetectorBuilder {

	private String host;

	private String token;

	private GitLabConfig connection;

	private DetectorProperties properties;

	private ObjectMapper objectMapper;

	private GitLabClient httpClient;

	private PollSessionStateRepository stateRepository;

	private ScheduledExecutorService scheduler;

	private ChangeDetectorBuilder() {
		this.properties = new DetectorProperties();
	}

	/**
	 * Create a new builder instance.
	 * @return new ChangeDetectorBuilder
	 */
	public static ChangeDetectorBuilder create() {
		return new ChangeDetectorBuilder();
	}

	/**
	 * Set the GitLab base URL directly.
	 * @param host base URL, e.g. {@code https://gitlab.example.com}
	 * @return this builder
	 */
	public ChangeDetectorBuilder host(String host) {
		this.host = host;
		return this;
	}

	/**
	 * Set the GitLab access token directly.
	 * @param token personal access token
	 * @return this builder
	 */
	public ChangeDetectorBuilder token(String token) {
		this.token = token;
		return this;
	}

	/**
	 * Resolve host and token for the configured connection id (see
	 * {@link DetectorProperties#getConnectionId()}) from the environment.
	 * @return this builder
	 * @throws GitLabConfigurationException if the host or token is missing
	 */
	public ChangeDetectorBuilder connectionFromEnv() {
		return connectionFrom(new GitLabConnectionResolver(EnvironmentSupport::get, properties.getConnectionTimeout()));
	}

	/**
	 * Resolve host and token for the configured connection id with the given resolver.
	 * @param resolver connection resolver
	 * @return this builder
	 * @throws GitLabConfigurationException if the host or token is missing
	 */
	public ChangeDetectorBuilder connectionFrom(GitLabConnectionResolver resolver) {
		this.connection = resolver.resolve(properties.getConnectionId());
		return this;
	}

	/**
	 * Set detector properties.
	 * @param properties configuration properties (null to use defaults)
	 * @return this builder
	 */
	public ChangeDetectorBuilder properties(@Nullable DetectorProperties properties) {
		if (properties != null) {
			this.properties = properties;
		}
		return this;
	}

	/**
	 * Set a custom ObjectMapper.
	 * @param objectMapper Jackson ObjectMapper (null to use default)
	 * @return this builder
	 */
	public ChangeDetectorBuilder objectMapper(@Nullable ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
		return this;
	}

	/**
	 * Set a custom GitLabClient implementation. Useful for testing with mocks.
	 *
	 * <p>
	 * When a custom client is provided, host and token are not required.
	 * @param httpClient custom GitLabClient implementation (null to use default)
	 * @return this builder
	 */
	public ChangeDetectorBuilder httpClient(@Nullable GitLabClient httpClient) {
		this.httpClient = httpClient;
		return this;
	}

	/**
	 * Set a custom PollSessionStateRepository implementation.
	 * @param stateRepository checkpoint store (null to keep checkpoints in memory)
	 * @return this builder
	 */
	public ChangeDetectorBuilder stateRepository(@Nullable PollSessionStateRepository stateRepository) {
		this.stateRepository = stateRepository;
		return this;
	}

	/**
	 * Keep checkpoints on disk under {@link DetectorProperties#getStateDirectory()}.
	 * @return this builder
	 */
	public ChangeDetectorBuilder fileStateRepository() {
		this.stateRepository = new FileSystemPollSessionStateRepository(Paths.get(properties.getStateDirectory()),
				resolveObjectMapper());
		return this;
	}

	/**
	 * Set the scheduler that runs cycles and inter-cycle waits.
	 * @param scheduler host scheduler (null to create a single daemon thread)
	 * @return this builder
	 */
	public ChangeDetectorBuilder scheduler(@Nullable ScheduledExecutorService scheduler) {
		this.scheduler = scheduler;
		return this;
	}

	/**
	 * Build the GitLab client directly.
	 * @return configured GitLabClient
	 */
	public GitLabClient buildClient() {
		if (httpClient != null) {
			return httpClient;
		}
		return new GitLabHttpClient(resolveConnection(), resolveObjectMapper());
	}

	/**
	 * Build a ChangeDetectionPoller.
	 * @return configured ChangeDetectionPoller
	 */
	public ChangeDetectionPoller buildPoller() {
		GitLabClient client = buildClient();
		PollSessionStateRepository repository = this.stateRepository != null ? this.stateRepository
				: new InMemoryPollSessionStateRepository();
		ScheduledExecutorService executor = this.scheduler != null ? this.scheduler : createDefaultScheduler();
		return new ChangeDetectionPoller(client, executor, repository, properties.getQueryTimeout());
	}

	/**
	 * Build a ChangeDetectionSensor for single synchronous checks.
	 * @return configured ChangeDetectionSensor
	 */
	public ChangeDetectionSensor buildSensor() {
		return new ChangeDetectionSensor(buildClient());
	}

	private GitLabConfig resolveConnection() {
		if (connection != null) {
			return connection;
		}
		if (host == null || host.trim().isEmpty()) {
			throw new GitLabConfigurationException(
					"GitLab host is required. Call host() or connectionFromEnv() first.");
		}
		if (token == null || token.trim().isEmpty()) {
			throw new GitLabConfigurationException(
					"An access token is required to authenticate to GitLab. Call token() or connectionFromEnv() first.");
		}
		try {
			return new GitLabConfig(host, token, properties.getConnectionTimeout());
		}
		catch (IllegalArgumentException e) {
			throw new GitLabConfigurationException("Invalid GitLab host: " + e.getMessage(), e);
		}
	}

	private ObjectMapper resolveObjectMapper() {
		return this.objectMapper != null ? this.objectMapper : ObjectMapperFactory.create();
	}

	private static ScheduledExecutorService createDefaultScheduler() {
		return Executors.newSingleThreadScheduledExecutor(runnable -> {
			Thread thread = new Thread(runnable, "change-detector-scheduler");
			thread.setDaemon(true);
			return thread;
		});
	}

}
