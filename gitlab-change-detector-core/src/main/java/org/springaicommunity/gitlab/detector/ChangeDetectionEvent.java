package org.springaicommunity.gitlab.detector;

import java.util.List;

/**
 * Terminal event of a polling session.
 *
 * @param sessionId session that produced the event
 * @param changedRepositories project ids with new commits, deduplicated, in detection
 * order; empty when the cycle budget ran out without a change
 * @param cyclesAttempted cycles run before the session ended
 */
public record ChangeDetectionEvent(String sessionId, List<String> changedRepositories, int cyclesAttempted) {

	public ChangeDetectionEvent {
		changedRepositories = List.copyOf(changedRepositories);
	}

	public static ChangeDetectionEvent from(PollSessionState state) {
		return new ChangeDetectionEvent(state.sessionId(), state.changedRepositories(), state.cyclesAttempted());
	}

	public boolean changesDetected() {
		return !changedRepositories.isEmpty();
	}

}
