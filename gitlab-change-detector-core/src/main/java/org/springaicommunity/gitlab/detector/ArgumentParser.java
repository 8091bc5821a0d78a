package org.springaicommunity.gitlab.detector;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Command-line argument parser for the change detector. Pure Java implementation with no
 * Spring dependencies.
 */
public class ArgumentParser {

	private final DetectorProperties defaultProperties;

	public ArgumentParser(DetectorProperties defaultProperties) {
		this.defaultProperties = defaultProperties;
	}

	/**
	 * Parse command-line arguments and return configuration.
	 * @param args Command-line arguments
	 * @return Parsed configuration object
	 * @throws IllegalArgumentException if arguments are invalid
	 */
	public ParsedConfiguration parseAndValidate(String[] args) {
		ParsedConfiguration config = new ParsedConfiguration(defaultProperties);

		for (int i = 0; i < args.length; i++) {
			String arg = args[i];

			switch (arg) {
				case "-p", "--project":
					config.targets.add(parseTarget(getRequiredValue(args, i, "project")));
					i++;
					break;

				case "-s", "--since":
					config.since = getRequiredValue(args, i, "since");
					i++;
					break;

				case "-n", "--check-runs":
					config.checkRuns = parseInt(getRequiredValue(args, i, "check-runs"), "check runs");
					i++;
					break;

				case "-i", "--check-interval":
					config.checkIntervalSeconds = parseInt(getRequiredValue(args, i, "check-interval"),
							"check interval");
					i++;
					break;

				case "-c", "--connection":
					config.connectionId = getRequiredValue(args, i, "connection");
					i++;
					break;

				case "--session-id":
					config.sessionId = getRequiredValue(args, i, "session-id");
					i++;
					break;

				case "--state-dir":
					config.stateDirectory = getRequiredValue(args, i, "state-dir");
					i++;
					break;

				case "-t", "--topic":
					config.topic = getRequiredValue(args, i, "topic");
					i++;
					break;

				case "--resume":
					config.resume = true;
					break;

				case "--once":
					config.once = true;
					break;

				case "-v", "--verbose":
					config.verbose = true;
					break;

				case "-h", "--help":
					config.helpRequested = true;
					break;

				default:
					throw new IllegalArgumentException(
							arg.startsWith("-") ? "Unknown option: " + arg : "Unexpected argument: " + arg);
			}
		}

		if (!config.helpRequested) {
			validateConfiguration(config);
		}

		return config;
	}

	/**
	 * Check if help is requested without full parsing.
	 * @param args Command-line arguments
	 * @return true if help is requested
	 */
	public boolean isHelpRequested(String[] args) {
		for (String arg : args) {
			if ("-h".equals(arg) || "--help".equals(arg)) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Generate help text for command-line usage.
	 * @return Help text string
	 */
	public String generateHelpText() {
		StringBuilder help = new StringBuilder();
		help.append("Usage: detect.java [OPTIONS]\n");
		help.append("\n");
		help.append("Watch GitLab branches for new commits and report the projects that changed.\n");
		help.append("\n");
		help.append("OPTIONS:\n");
		help.append("    -h, --help                 Show this help message\n");
		help.append("    -p, --project ID=BRANCH    Project id or path and the branch to watch (repeatable)\n");
		help.append("    -s, --since TIMESTAMP      Only count commits after this ISO-8601 timestamp\n");
		help.append("                               (default: none, the full history counts)\n");
		help.append("    -n, --check-runs COUNT     Cycles before giving up (default: ")
			.append(defaultProperties.getCheckRuns())
			.append(")\n");
		help.append("    -i, --check-interval SECS  Seconds between cycles (default: ")
			.append(defaultProperties.getCheckIntervalSeconds())
			.append(")\n");
		help.append("    -c, --connection ID        Connection id (default: ")
			.append(defaultProperties.getConnectionId())
			.append(")\n");
		help.append("    -t, --topic TOPIC          Topic of the change notifications (default: ")
			.append(defaultProperties.getNotificationTopic())
			.append(")\n");
		help.append("    --once                     Check every project once and exit\n");
		help.append("    -v, --verbose              Enable verbose logging\n");
		help.append("\n");
		help.append("SESSION OPTIONS:\n");
		help.append("    --session-id ID            Name the session so it can be resumed\n");
		help.append("    --resume                   Resume the session named by --session-id\n");
		help.append("    --state-dir DIR            Directory for session checkpoints (default: ")
			.append(defaultProperties.getStateDirectory())
			.append(")\n");
		help.append("\n");
		help.append("ENVIRONMENT VARIABLES:\n");
		help.append("    GITLAB_HOST                GitLab base URL for the default connection\n");
		help.append("    GITLAB_TOKEN               GitLab access token for the default connection\n");
		help.append("    <CONNECTION>_HOST/_TOKEN   Same for a named connection, e.g. MY_GITLAB_HOST\n");
		help.append("                               Values may also come from a .env file\n");
		help.append("\n");
		help.append("OUTPUT:\n");
		help.append("    One JSON line per changed project on stdout:\n");
		help.append("    {\"topic\":\"...\",\"key\":\"2949\",\"value\":\"{\\\"changed_repo_id\\\":2949}\"}\n");
		help.append("\n");
		help.append("EXAMPLES:\n");
		help.append("    # Poll two projects every minute, ten times\n");
		help.append("    ./detect.java --project 2949=master --project 2622=master --since 2024-01-01T00:00:00Z\n");
		help.append("\n");
		help.append("    # Single check of a project addressed by path\n");
		help.append("    ./detect.java --project group/project=main --since 2024-01-01T00:00:00Z --once\n");
		help.append("\n");
		help.append("    # Named session, resumed after a restart\n");
		help.append("    ./detect.java --project 2949=master --session-id nightly --check-runs 120\n");
		help.append("    ./detect.java --session-id nightly --resume\n");
		help.append("\n");

		return help.toString();
	}

	private String getRequiredValue(String[] args, int currentIndex, String optionName) {
		if (currentIndex + 1 >= args.length) {
			throw new IllegalArgumentException("Missing value for " + optionName + " option");
		}
		return args[currentIndex + 1];
	}

	private RepositoryTarget parseTarget(String value) {
		int separator = value.indexOf('=');
		if (separator <= 0 || separator == value.length() - 1) {
			throw new IllegalArgumentException("Invalid project '" + value + "': must be in format ID=BRANCH");
		}
		return new RepositoryTarget(value.substring(0, separator).trim(), value.substring(separator + 1).trim());
	}

	private int parseInt(String value, String name) {
		try {
			return Integer.parseInt(value.trim());
		}
		catch (NumberFormatException e) {
			throw new IllegalArgumentException("Invalid " + name + " '" + value + "': must be an integer", e);
		}
	}

	private void validateConfiguration(ParsedConfiguration config) {
		List<String> errors = new ArrayList<>();

		if (config.resume) {
			if (config.sessionId == null || config.sessionId.isBlank()) {
				errors.add("--resume requires --session-id");
			}
			if (!config.targets.isEmpty()) {
				errors.add("--project cannot be combined with --resume; the session's own projects are used");
			}
			if (config.once) {
				errors.add("--once cannot be combined with --resume");
			}
		}
		else if (config.targets.isEmpty()) {
			errors.add("At least one --project is required");
		}

		Set<String> seen = new HashSet<>();
		for (RepositoryTarget target : config.targets) {
			if (!seen.add(target.projectId())) {
				errors.add("Project " + target.projectId() + " is given more than once");
			}
		}

		if (config.checkRuns < 1) {
			errors.add("Check runs must be at least 1 (got: " + config.checkRuns + ")");
		}
		if (config.checkIntervalSeconds < 0) {
			errors.add("Check interval cannot be negative (got: " + config.checkIntervalSeconds + ")");
		}
		if (config.sessionId != null && !config.sessionId.matches("[A-Za-z0-9._-]+")) {
			errors.add("Session id may only contain letters, digits, '.', '_' and '-' (got: " + config.sessionId
					+ ")");
		}
		if (config.connectionId == null || config.connectionId.isBlank()) {
			errors.add("Connection id cannot be empty");
		}
		if (config.topic == null || config.topic.isBlank()) {
			errors.add("Topic cannot be empty");
		}

		if (!errors.isEmpty()) {
			StringBuilder errorMsg = new StringBuilder("Configuration validation failed:");
			for (String error : errors) {
				errorMsg.append("\n  - ").append(error);
			}
			throw new IllegalArgumentException(errorMsg.toString());
		}
	}

}
