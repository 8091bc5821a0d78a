package org.springaicommunity.gitlab.detector;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

import java.nio.file.Paths;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Spring configuration for the GitLab client, the poller and related beans.
 *
 * <p>
 * Connection settings are looked up in the Spring {@link Environment} first and fall back
 * to {@link EnvironmentSupport}, so {@code GITLAB_HOST} / {@code GITLAB_TOKEN} can come
 * from a property source, the process environment or a {@code .env} file.
 */
@Configuration
public class ChangeDetectorConfig {

	@Value("${gitlab.detector.connection-id:" + GitLabConnectionResolver.DEFAULT_CONNECTION_ID + "}")
	private String connectionId;

	@Value("${gitlab.detector.state-directory:.change-detector}")
	private String stateDirectory;

	@Bean
	public DetectorProperties detectorProperties() {
		DetectorProperties properties = new DetectorProperties();
		properties.setConnectionId(connectionId);
		properties.setStateDirectory(stateDirectory);
		return properties;
	}

	@Bean
	public ObjectMapper objectMapper() {
		return ObjectMapperFactory.create();
	}

	@Bean
	public GitLabConnectionResolver gitLabConnectionResolver(Environment environment,
			DetectorProperties detectorProperties) {
		return new GitLabConnectionResolver(name -> {
			String value = environment.getProperty(name);
			return value != null ? value : EnvironmentSupport.get(name);
		}, detectorProperties.getConnectionTimeout());
	}

	@Bean
	public GitLabConfig gitLabConfig(GitLabConnectionResolver resolver, DetectorProperties detectorProperties) {
		return resolver.resolve(detectorProperties.getConnectionId());
	}

	@Bean
	public GitLabClient gitLabClient(GitLabConfig gitLabConfig, ObjectMapper objectMapper) {
		return new GitLabHttpClient(gitLabConfig, objectMapper);
	}

	@Bean(destroyMethod = "shutdownNow")
	public ScheduledExecutorService changeDetectionScheduler() {
		return Executors.newSingleThreadScheduledExecutor(runnable -> {
			Thread thread = new Thread(runnable, "change-detector-scheduler");
			thread.setDaemon(true);
			return thread;
		});
	}

	@Bean
	public PollSessionStateRepository pollSessionStateRepository(DetectorProperties detectorProperties,
			ObjectMapper objectMapper) {
		return new FileSystemPollSessionStateRepository(Paths.get(detectorProperties.getStateDirectory()),
				objectMapper);
	}

	@Bean
	public ChangeDetectionPoller changeDetectionPoller(GitLabClient gitLabClient,
			ScheduledExecutorService changeDetectionScheduler, PollSessionStateRepository pollSessionStateRepository,
			DetectorProperties detectorProperties) {
		return new ChangeDetectionPoller(gitLabClient, changeDetectionScheduler, pollSessionStateRepository,
				detectorProperties.getQueryTimeout());
	}

	@Bean
	public ChangeDetectionSensor changeDetectionSensor(GitLabClient gitLabClient) {
		return new ChangeDetectionSensor(gitLabClient);
	}

}
