package org.springaicommunity.gitlab.detector;

import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * Parsed configuration result from command-line arguments.
 */
public class ParsedConfiguration {

	// Watched projects, in the order given
	public List<RepositoryTarget> targets = new ArrayList<>();

	public @Nullable String since;

	// Polling budget
	public int checkRuns;

	public int checkIntervalSeconds;

	// Connection and session
	public String connectionId;

	public @Nullable String sessionId;

	public String stateDirectory;

	public String topic;

	// Mode flags
	public boolean resume = false;

	public boolean once = false;

	public boolean verbose = false;

	public boolean helpRequested = false;

	public ParsedConfiguration(DetectorProperties defaultProperties) {
		this.checkRuns = defaultProperties.getCheckRuns();
		this.checkIntervalSeconds = defaultProperties.getCheckIntervalSeconds();
		this.connectionId = defaultProperties.getConnectionId();
		this.stateDirectory = defaultProperties.getStateDirectory();
		this.topic = defaultProperties.getNotificationTopic();
		this.verbose = defaultProperties.isVerbose();
	}

	@Override
	public String toString() {
		return "ParsedConfiguration{" + "targets=" + targets + ", since='" + since + '\'' + ", checkRuns=" + checkRuns
				+ ", checkIntervalSeconds=" + checkIntervalSeconds + ", connectionId='" + connectionId + '\''
				+ ", sessionId='" + sessionId + '\'' + ", stateDirectory='" + stateDirectory + '\'' + ", topic='"
				+ topic + '\'' + ", resume=" + resume + ", once=" + once + ", verbose=" + verbose
				+ ", helpRequested=" + helpRequested + '}';
	}

}
