package org.springaicommunity.gitlab.detector;

import java.time.Duration;

/**
 * Configuration properties for change detection.
 *
 * <p>
 * Properties can be set directly via setters or passed to {@link ChangeDetectorBuilder}.
 * The defaults match a deployment that checks once a minute for ten minutes.
 */
public class DetectorProperties {

	/**
	 * Number of polling cycles before a session gives up.
	 */
	private int checkRuns = 10;

	/**
	 * Seconds to wait between polling cycles.
	 */
	private int checkIntervalSeconds = 60;

	/**
	 * Connect and request timeout for each GitLab call, in seconds.
	 */
	private int connectionTimeoutSeconds = 10;

	/**
	 * Upper bound on a single query inside a cycle, in seconds.
	 */
	private int queryTimeoutSeconds = 30;

	/**
	 * Connection id resolved by {@link GitLabConnectionResolver}.
	 */
	private String connectionId = GitLabConnectionResolver.DEFAULT_CONNECTION_ID;

	/**
	 * Directory holding session checkpoints.
	 */
	private String stateDirectory = ".change-detector";

	/**
	 * Topic that change notifications are addressed to.
	 */
	private String notificationTopic = "gitlab_repo_monitoring";

	/**
	 * Enable verbose logging output.
	 */
	private boolean verbose = false;

	public int getCheckRuns() {
		return checkRuns;
	}

	public void setCheckRuns(int checkRuns) {
		this.checkRuns = checkRuns;
	}

	public int getCheckIntervalSeconds() {
		return checkIntervalSeconds;
	}

	public void setCheckIntervalSeconds(int checkIntervalSeconds) {
		this.checkIntervalSeconds = checkIntervalSeconds;
	}

	public Duration getCheckInterval() {
		return Duration.ofSeconds(checkIntervalSeconds);
	}

	public int getConnectionTimeoutSeconds() {
		return connectionTimeoutSeconds;
	}

	public void setConnectionTimeoutSeconds(int connectionTimeoutSeconds) {
		this.connectionTimeoutSeconds = connectionTimeoutSeconds;
	}

	public Duration getConnectionTimeout() {
		return Duration.ofSeconds(connectionTimeoutSeconds);
	}

	public int getQueryTimeoutSeconds() {
		return queryTimeoutSeconds;
	}

	public void setQueryTimeoutSeconds(int queryTimeoutSeconds) {
		this.queryTimeoutSeconds = queryTimeoutSeconds;
	}

	public Duration getQueryTimeout() {
		return Duration.ofSeconds(queryTimeoutSeconds);
	}

	public String getConnectionId() {
		return connectionId;
	}

	public void setConnectionId(String connectionId) {
		this.connectionId = connectionId;
	}

	public String getStateDirectory() {
		return stateDirectory;
	}

	public void setStateDirectory(String stateDirectory) {
		this.stateDirectory = stateDirectory;
	}

	public String getNotificationTopic() {
		return notificationTopic;
	}

	public void setNotificationTopic(String notificationTopic) {
		this.notificationTopic = notificationTopic;
	}

	public boolean isVerbose() {
		return verbose;
	}

	public void setVerbose(boolean verbose) {
		this.verbose = verbose;
	}

}
