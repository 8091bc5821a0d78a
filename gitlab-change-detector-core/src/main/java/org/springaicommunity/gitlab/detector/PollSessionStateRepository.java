package org.springaicommunity.gitlab.detector;

import java.util.Optional;

/**
 * Repository interface for polling session checkpoints.
 *
 * <p>
 * The poller saves the starting state and the state after every cycle that does not end
 * the session, and deletes it once the session terminates, so a stored entry always describes a session that can
 * still be resumed.
 */
public interface PollSessionStateRepository {

	/**
	 * Store (or replace) the checkpoint for a session.
	 * @param state the state to store, keyed by {@link PollSessionState#sessionId()}
	 */
	void save(PollSessionState state);

	/**
	 * Load the checkpoint for a session.
	 * @param sessionId session identifier
	 * @return the stored state, or empty if none exists
	 */
	Optional<PollSessionState> load(String sessionId);

	/**
	 * Remove the checkpoint for a session. Does nothing if none exists.
	 * @param sessionId session identifier
	 */
	void delete(String sessionId);

}
