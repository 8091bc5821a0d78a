package org.springaicommunity.gitlab.detector;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Single synchronous check of a set of targets using the blocking client. For callers
 * that run their own schedule and only need a yes/no per invocation.
 */
public class ChangeDetectionSensor {

	private static final Logger logger = LoggerFactory.getLogger(ChangeDetectionSensor.class);

	private final GitLabClient client;

	public ChangeDetectionSensor(GitLabClient client) {
		this.client = client;
	}

	/**
	 * Query every target once, one after another.
	 * @param targets projects and branches to check
	 * @param since ISO-8601 timestamp, or {@code null} for the full history
	 * @return ids of projects with new commits, in target order
	 */
	public List<String> poke(List<RepositoryTarget> targets, @Nullable String since) {
		logger.info("Checking for changes in {} since {}", targets, since);
		List<CommitResult> results = new ArrayList<>(targets.size());
		for (RepositoryTarget target : targets) {
			results.add(client.getCommits(target, since));
		}
		return ChangeDetectionPoller.detectChanges(targets, results);
	}

}
