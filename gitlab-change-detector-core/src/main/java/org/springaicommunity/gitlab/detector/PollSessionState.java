package org.springaicommunity.gitlab.detector;

import com.fasterxml.jackson.annotation.JsonIgnore;
import org.jspecify.annotations.Nullable;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Complete, serializable state of one polling session. A session can be stopped at any
 * point between cycles and resumed from this record alone.
 *
 * @param sessionId identifier used to checkpoint and resume the session
 * @param targets watched projects, in the order they are queried
 * @param since ISO-8601 timestamp passed through to the API, or {@code null} for the full
 * history
 * @param cyclesAttempted number of cycles already run
 * @param maxCycles cycle budget, at least 1
 * @param checkInterval wait between cycles
 * @param changedRepositories project ids with new commits, in detection order
 */
public record PollSessionState(String sessionId, List<RepositoryTarget> targets, @Nullable String since,
		int cyclesAttempted, int maxCycles, Duration checkInterval, List<String> changedRepositories) {

	public PollSessionState {
		if (sessionId == null || sessionId.isBlank()) {
			throw new IllegalArgumentException("Session id cannot be blank");
		}
		if (maxCycles < 1) {
			throw new IllegalArgumentException("Cycle budget must be at least 1 (got: " + maxCycles + ")");
		}
		if (cyclesAttempted < 0 || cyclesAttempted > maxCycles) {
			throw new IllegalArgumentException(
					"Cycles attempted must be between 0 and " + maxCycles + " (got: " + cyclesAttempted + ")");
		}
		if (checkInterval.isNegative()) {
			throw new IllegalArgumentException("Check interval cannot be negative: " + checkInterval);
		}
		targets = List.copyOf(targets);
		changedRepositories = List.copyOf(new LinkedHashSet<>(changedRepositories));
	}

	/**
	 * Create the state for a new session that has not run any cycle yet.
	 * @param sessionId session identifier
	 * @param targets watched projects
	 * @param since timestamp filter, or {@code null}
	 * @param maxCycles cycle budget, at least 1
	 * @param checkInterval wait between cycles
	 * @return the initial state
	 */
	public static PollSessionState start(String sessionId, List<RepositoryTarget> targets, @Nullable String since,
			int maxCycles, Duration checkInterval) {
		return new PollSessionState(sessionId, targets, since, 0, maxCycles, checkInterval, List.of());
	}

	/**
	 * Create the state for a new session with a random identifier.
	 */
	public static PollSessionState start(List<RepositoryTarget> targets, @Nullable String since, int maxCycles,
			Duration checkInterval) {
		return start(UUID.randomUUID().toString(), targets, since, maxCycles, checkInterval);
	}

	/**
	 * Convenience for the common {@code projectId -> branch} map form. Iteration order of
	 * the map is kept.
	 */
	public static PollSessionState start(String sessionId, Map<String, String> branchesByProject,
			@Nullable String since, int maxCycles, Duration checkInterval) {
		List<RepositoryTarget> targets = new ArrayList<>();
		branchesByProject.forEach((projectId, branch) -> targets.add(new RepositoryTarget(projectId, branch)));
		return start(sessionId, targets, since, maxCycles, checkInterval);
	}

	/**
	 * Returns the state after one more cycle that found the given projects changed.
	 * Projects already recorded keep their position; new ones are appended.
	 * @param detected project ids with commits in this cycle
	 * @return the next state
	 * @throws IllegalStateException if the session is already finished
	 */
	public PollSessionState afterCycle(List<String> detected) {
		if (isFinished()) {
			throw new IllegalStateException("Session " + sessionId + " is already finished");
		}
		Set<String> changed = new LinkedHashSet<>(changedRepositories);
		changed.addAll(detected);
		return new PollSessionState(sessionId, targets, since, cyclesAttempted + 1, maxCycles, checkInterval,
				new ArrayList<>(changed));
	}

	/**
	 * Returns true once a change was found or the cycle budget is spent.
	 */
	@JsonIgnore
	public boolean isFinished() {
		return !changedRepositories.isEmpty() || cyclesAttempted >= maxCycles;
	}

	@JsonIgnore
	public int remainingCycles() {
		return maxCycles - cyclesAttempted;
	}

}
