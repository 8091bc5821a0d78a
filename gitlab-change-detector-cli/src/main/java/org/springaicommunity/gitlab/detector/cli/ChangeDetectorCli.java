package org.springaicommunity.gitlab.detector.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springaicommunity.gitlab.detector.*;

import java.io.PrintStream;
import java.time.Duration;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.function.Function;

/**
 * GitLab Change Detector CLI Application
 *
 * Plain Java command-line application that polls GitLab branches for new commits and
 * prints one JSON line per changed project. No Spring dependencies - uses
 * ChangeDetectorBuilder for wiring.
 *
 * Usage: jbang detect.java [OPTIONS]
 *
 * Environment Variables: GITLAB_HOST, GITLAB_TOKEN (or {@code <CONNECTION>_HOST} and
 * {@code <CONNECTION>_TOKEN} for a named connection)
 *
 * Exit codes: 0 when the session finished, 1 on configuration or argument errors, 130
 * when the session was cancelled.
 */
public class ChangeDetectorCli {

	private static final Logger logger = LoggerFactory.getLogger(ChangeDetectorCli.class);

	static final int EXIT_CANCELLED = 130;

	public static void main(String[] args) {
		try {
			int exitCode = run(args);
			if (exitCode != 0) {
				System.exit(exitCode);
			}
		}
		catch (Exception e) {
			logger.error("Change detection failed: {}", e.getMessage());
			System.exit(1);
		}
	}

	public static int run(String[] args) throws Exception {
		return run(args, EnvironmentSupport::get, System.out);
	}

	static int run(String[] args, Function<String, @Nullable String> environment, PrintStream out) {
		DetectorProperties properties = new DetectorProperties();
		ArgumentParser argumentParser = new ArgumentParser(properties);

		if (argumentParser.isHelpRequested(args)) {
			out.println(argumentParser.generateHelpText());
			return 0;
		}

		ParsedConfiguration config;
		try {
			config = argumentParser.parseAndValidate(args);
		}
		catch (IllegalArgumentException e) {
			logger.error("{}", e.getMessage());
			logger.error("Run with --help for usage");
			return 1;
		}

		applyConfiguration(config, properties);
		logConfiguration(config);

		ObjectMapper objectMapper = ObjectMapperFactory.create();
		ChangeDetectorBuilder builder;
		try {
			builder = ChangeDetectorBuilder.create()
				.properties(properties)
				.objectMapper(objectMapper)
				.connectionFrom(new GitLabConnectionResolver(environment, properties.getConnectionTimeout()));
		}
		catch (GitLabConfigurationException e) {
			logger.error("{}", e.getMessage());
			return 1;
		}

		ChangeNotificationPublisher publisher = new PrintStreamChangeNotificationPublisher(out, objectMapper);

		if (config.once) {
			String checkId = config.sessionId != null ? config.sessionId : UUID.randomUUID().toString();
			List<String> changed = builder.buildSensor().poke(config.targets, config.since);
			ChangeDetectionEvent event = new ChangeDetectionEvent(checkId, changed, 1);
			logResults(event, config.verbose);
			publisher.publish(ChangeNotification.fromEvent(config.topic, event, objectMapper));
			return 0;
		}

		ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
			Thread thread = new Thread(runnable, "change-detector-scheduler");
			thread.setDaemon(true);
			return thread;
		});
		try {
			ChangeDetectionPoller poller = builder.scheduler(scheduler).fileStateRepository().buildPoller();
			PollSession session;
			if (config.resume) {
				try {
					session = poller.resume(config.sessionId);
				}
				catch (IllegalStateException e) {
					logger.error("{}", e.getMessage());
					return 1;
				}
			}
			else {
				session = poller.start(createInitialState(config));
			}
			return awaitAndPublish(session, config, publisher, objectMapper);
		}
		finally {
			scheduler.shutdownNow();
		}
	}

	private static int awaitAndPublish(PollSession session, ParsedConfiguration config,
			ChangeNotificationPublisher publisher, ObjectMapper objectMapper) {
		Thread shutdownHook = new Thread(() -> {
			if (session.cancel()) {
				logger.warn("Session {} interrupted; resume it with --resume --session-id {}", session.sessionId(),
						session.sessionId());
			}
		}, "change-detector-shutdown");
		Runtime.getRuntime().addShutdownHook(shutdownHook);

		ChangeDetectionEvent event;
		try {
			event = session.result().join();
		}
		catch (CancellationException e) {
			logger.warn("Session {} cancelled after {} of {} cycles", session.sessionId(),
					session.state().cyclesAttempted(), session.state().maxCycles());
			return EXIT_CANCELLED;
		}
		catch (CompletionException e) {
			Throwable cause = e.getCause() != null ? e.getCause() : e;
			throw cause instanceof RuntimeException ? (RuntimeException) cause
					: new IllegalStateException(cause.getMessage(), cause);
		}
		finally {
			removeShutdownHook(shutdownHook);
		}

		logResults(event, config.verbose);
		publisher.publish(ChangeNotification.fromEvent(config.topic, event, objectMapper));
		return 0;
	}

	private static void removeShutdownHook(Thread shutdownHook) {
		try {
			Runtime.getRuntime().removeShutdownHook(shutdownHook);
		}
		catch (IllegalStateException e) {
			// JVM already shutting down; the hook is running or has run
			logger.debug("Shutdown in progress, keeping hook: {}", e.getMessage());
		}
	}

	private static PollSessionState createInitialState(ParsedConfiguration config) {
		Duration interval = Duration.ofSeconds(config.checkIntervalSeconds);
		if (config.sessionId != null) {
			return PollSessionState.start(config.sessionId, config.targets, config.since, config.checkRuns, interval);
		}
		return PollSessionState.start(config.targets, config.since, config.checkRuns, interval);
	}

	private static void applyConfiguration(ParsedConfiguration config, DetectorProperties properties) {
		properties.setCheckRuns(config.checkRuns);
		properties.setCheckIntervalSeconds(config.checkIntervalSeconds);
		properties.setConnectionId(config.connectionId);
		properties.setStateDirectory(config.stateDirectory);
		properties.setNotificationTopic(config.topic);
		properties.setVerbose(config.verbose);
	}

	private static void logConfiguration(ParsedConfiguration config) {
		logger.info("Configuration:");
		logger.info("  Projects: {}", config.resume ? "(from checkpoint)" : config.targets);
		logger.info("  Since: {}", config.since != null ? config.since : "(full history)");
		logger.info("  Check runs: {}", config.checkRuns);
		logger.info("  Check interval: {}s", config.checkIntervalSeconds);
		logger.info("  Connection: {}", config.connectionId);
		logger.info("  Session id: {}", config.sessionId != null ? config.sessionId : "(generated)");
		logger.info("  State directory: {}", config.stateDirectory);
		logger.info("  Topic: {}", config.topic);
		logger.info("  Resume: {}", config.resume);
		logger.info("  Once: {}", config.once);
		logger.info("  Verbose: {}", config.verbose);
	}

	private static void logResults(ChangeDetectionEvent event, boolean verbose) {
		logger.info("Change detection completed!");
		logger.info("Session: {}", event.sessionId());
		logger.info("Cycles attempted: {}", event.cyclesAttempted());
		logger.info("Changed projects: {}", event.changedRepositories().size());

		if (verbose && event.changesDetected()) {
			logger.info("Changes:");
			for (String projectId : event.changedRepositories()) {
				logger.info("  - {}", projectId);
			}
		}
	}

}
