package org.springaicommunity.gitlab.detector;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-process {@link PollSessionStateRepository}. Checkpoints survive a cancelled session
 * but not a restart of the JVM.
 */
public class InMemoryPollSessionStateRepository implements PollSessionStateRepository {

	private final ConcurrentMap<String, PollSessionState> states = new ConcurrentHashMap<>();

	@Override
	public void save(PollSessionState state) {
		states.put(state.sessionId(), state);
	}

	@Override
	public Optional<PollSessionState> load(String sessionId) {
		return Optional.ofNullable(states.get(sessionId));
	}

	@Override
	public void delete(String sessionId) {
		states.remove(sessionId);
	}

}
