package org.springaicommunity.gitlab.detector;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Future;

/**
 * Handle on a running polling session.
 *
 * <p>
 * {@link #result()} completes with the terminal {@link ChangeDetectionEvent}. Cancelling
 * the session (through {@link #cancel()} or by cancelling the result future) abandons any
 * in-flight queries and the pending wait; no event is emitted afterwards.
 */
public final class PollSession {

	private final String sessionId;

	private final CompletableFuture<ChangeDetectionEvent> result = new CompletableFuture<>();

	// guarded by this
	private final List<Future<?>> pending = new ArrayList<>();

	private volatile PollSessionState state;

	PollSession(PollSessionState initial) {
		this.sessionId = initial.sessionId();
		this.state = initial;
		this.result.whenComplete((event, error) -> {
			if (error instanceof CancellationException) {
				cancelPending();
			}
		});
	}

	public String sessionId() {
		return sessionId;
	}

	/**
	 * Returns the state as of the last completed cycle.
	 */
	public PollSessionState state() {
		return state;
	}

	/**
	 * Returns the future completing with the session's terminal event.
	 */
	public CompletableFuture<ChangeDetectionEvent> result() {
		return result;
	}

	public boolean cancel() {
		return result.cancel(true);
	}

	public boolean isCancelled() {
		return result.isCancelled();
	}

	public boolean isDone() {
		return result.isDone();
	}

	synchronized void track(Future<?> future) {
		if (result.isCancelled()) {
			future.cancel(true);
			return;
		}
		pending.removeIf(Future::isDone);
		pending.add(future);
	}

	void advance(PollSessionState next) {
		this.state = next;
	}

	/**
	 * Complete the session with its terminal state.
	 * @return false if the session was cancelled first; the state is left unchanged
	 */
	boolean finish(PollSessionState last) {
		if (result.isCancelled()) {
			return false;
		}
		PollSessionState previous = this.state;
		this.state = last;
		if (!result.complete(ChangeDetectionEvent.from(last))) {
			this.state = previous;
			return false;
		}
		return true;
	}

	void fail(Throwable error) {
		Throwable cause = error;
		while (cause instanceof CompletionException && cause.getCause() != null) {
			cause = cause.getCause();
		}
		result.completeExceptionally(cause);
	}

	private synchronized void cancelPending() {
		for (Future<?> future : pending) {
			future.cancel(true);
		}
		pending.clear();
	}

}
