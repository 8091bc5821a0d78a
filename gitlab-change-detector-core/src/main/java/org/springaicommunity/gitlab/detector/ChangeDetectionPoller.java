package org.springaicommunity.gitlab.detector;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;

/**
 * Bounded-retry poller that watches a set of GitLab branches for new commits.
 *
 * <p>
 * Every cycle queries all targets concurrently and waits for all of them (each bounded by
 * the query timeout). The results are folded into the session's change set in target
 * order. The session ends as soon as the change set is non-empty or the cycle budget is
 * spent; otherwise the next cycle is scheduled on the host's
 * {@link ScheduledExecutorService} after the check interval. No thread is held while a
 * session waits.
 *
 * <p>
 * Example usage:
 *
 * <pre>
 * {@code
 * PollSessionState initial = PollSessionState.start("nightly",
 *     List.of(RepositoryTarget.of(2949, "master"), RepositoryTarget.of(2622, "master")),
 *     "2024-01-01T00:00:00Z", 10, Duration.ofMinutes(1));
 *
 * PollSession session = poller.start(initial);
 * ChangeDetectionEvent event = session.result().join();
 * }
 * </pre>
 */
public class ChangeDetectionPoller {

	private static final Logger logger = LoggerFactory.getLogger(ChangeDetectionPoller.class);

	public static final Duration DEFAULT_QUERY_TIMEOUT = Duration.ofSeconds(30);

	private final GitLabClient client;

	private final ScheduledExecutorService scheduler;

	private final PollSessionStateRepository stateRepository;

	private final Duration queryTimeout;

	public ChangeDetectionPoller(GitLabClient client, ScheduledExecutorService scheduler,
			PollSessionStateRepository stateRepository, Duration queryTimeout) {
		if (queryTimeout.isNegative() || queryTimeout.isZero()) {
			throw new IllegalArgumentException("Query timeout must be positive: " + queryTimeout);
		}
		this.client = client;
		this.scheduler = scheduler;
		this.stateRepository = stateRepository;
		this.queryTimeout = queryTimeout;
	}

	public ChangeDetectionPoller(GitLabClient client, ScheduledExecutorService scheduler) {
		this(client, scheduler, new InMemoryPollSessionStateRepository(), DEFAULT_QUERY_TIMEOUT);
	}

	/**
	 * Start (or continue) a session from the given state. The first cycle runs on the
	 * scheduler right away; this method does not block.
	 * @param initial state to run from, usually fresh from
	 * {@link PollSessionState#start(String, List, String, int, Duration)}
	 * @return handle on the running session
	 */
	public PollSession start(PollSessionState initial) {
		PollSession session = new PollSession(initial);
		logger.info("Starting change detection session {} for {} (since {}, cycle {}/{} every {})",
				initial.sessionId(), initial.targets(), initial.since(), initial.cyclesAttempted(),
				initial.maxCycles(), initial.checkInterval());

		if (initial.isFinished()) {
			terminate(session, initial);
			return session;
		}
		try {
			// a session stopped during its first cycle must still be resumable
			stateRepository.save(initial);
		}
		catch (RuntimeException e) {
			logger.error("Session {} failed to save its initial checkpoint: {}", initial.sessionId(), e.getMessage());
			session.fail(e);
			return session;
		}
		schedule(session, Duration.ZERO);
		return session;
	}

	/**
	 * Resume a session from its last checkpoint.
	 * @param sessionId session identifier
	 * @return handle on the resumed session
	 * @throws IllegalStateException if no checkpoint exists for the session
	 */
	public PollSession resume(String sessionId) {
		PollSessionState state = stateRepository.load(sessionId)
			.orElseThrow(() -> new IllegalStateException("No checkpoint found for session " + sessionId));
		logger.info("Resuming session {} after {} of {} cycles", sessionId, state.cyclesAttempted(),
				state.maxCycles());
		return start(state);
	}

	/**
	 * Run a single cycle against the given state without scheduling anything. Useful for
	 * hosts that drive the loop themselves.
	 * @param state the state before the cycle
	 * @return future of the state after the cycle
	 */
	public CompletableFuture<PollSessionState> cycle(PollSessionState state) {
		return cycle(state, future -> {
		});
	}

	/**
	 * Fold one cycle's results into the list of changed project ids. A project counts as
	 * changed when its query succeeded with at least one commit. The result keeps the
	 * order of {@code targets} and contains no duplicates.
	 * @param targets targets queried this cycle
	 * @param results results, positionally matching {@code targets}
	 * @return project ids detected as changed
	 */
	static List<String> detectChanges(List<RepositoryTarget> targets, List<CommitResult> results) {
		if (targets.size() != results.size()) {
			throw new IllegalArgumentException(
					"Expected " + targets.size() + " results but got " + results.size());
		}
		Set<String> changed = new LinkedHashSet<>();
		for (int i = 0; i < targets.size(); i++) {
			RepositoryTarget target = targets.get(i);
			CommitResult result = results.get(i);
			if (result.hasCommits()) {
				logger.info("Changes detected for project {} ({} commits on {})", target.projectId(),
						result.commits().size(), target.branch());
				changed.add(target.projectId());
			}
			else if (!result.isSuccess()) {
				logger.warn("Check of project {} on {} failed: {} {} {}", target.projectId(), target.branch(),
						result.outcome(), result.status(), result.message());
			}
		}
		return new ArrayList<>(changed);
	}

	private CompletableFuture<PollSessionState> cycle(PollSessionState state, Consumer<Future<?>> tracker) {
		if (state.isFinished()) {
			throw new IllegalStateException("Session " + state.sessionId() + " is already finished");
		}
		int cycle = state.cyclesAttempted() + 1;
		logger.info("Trying gitlab check {} of {} for session {}", cycle, state.maxCycles(), state.sessionId());

		List<CompletableFuture<CommitResult>> queries = new ArrayList<>(state.targets().size());
		for (RepositoryTarget target : state.targets()) {
			logger.info("Checking branch {} of project {} for commits since {}", target.branch(), target.projectId(),
					state.since());
			queries.add(query(target, state.since(), tracker));
		}

		return CompletableFuture.allOf(queries.toArray(new CompletableFuture<?>[0])).thenApply(ignored -> {
			List<CommitResult> results = new ArrayList<>(queries.size());
			for (CompletableFuture<CommitResult> query : queries) {
				results.add(query.join());
			}
			PollSessionState next = state.afterCycle(detectChanges(state.targets(), results));
			logger.info("Changed repositories after cycle {}: {}", cycle, next.changedRepositories());
			return next;
		});
	}

	private CompletableFuture<CommitResult> query(RepositoryTarget target, @Nullable String since,
			Consumer<Future<?>> tracker) {
		CompletableFuture<CommitResult> exchange;
		try {
			exchange = client.getCommitsAsync(target, since);
		}
		catch (RuntimeException e) {
			logger.warn("Client rejected query for {}: {}", target, e.getMessage());
			return CompletableFuture.completedFuture(CommitResult.transportError(e));
		}

		CommitResult timedOut = CommitResult.transportError(
				new TimeoutException("Query for " + target + " timed out after " + queryTimeout.toMillis() + "ms"));
		CompletableFuture<CommitResult> guarded = exchange
			.exceptionally(error -> CommitResult.transportError(unwrap(error)))
			.completeOnTimeout(timedOut, queryTimeout.toMillis(), TimeUnit.MILLISECONDS);

		tracker.accept(guarded);
		tracker.accept(exchange);
		return guarded;
	}

	private void schedule(PollSession session, Duration delay) {
		try {
			Future<?> tick = scheduler.schedule(() -> runCycle(session), delay.toMillis(), TimeUnit.MILLISECONDS);
			session.track(tick);
		}
		catch (RejectedExecutionException e) {
			logger.error("Scheduler rejected next cycle of session {}: {}", session.sessionId(), e.getMessage());
			session.fail(e);
		}
	}

	private void runCycle(PollSession session) {
		if (session.isCancelled()) {
			return;
		}
		try {
			cycle(session.state(), session::track).thenAccept(next -> afterCycle(session, next))
				.exceptionally(error -> {
					if (!session.isCancelled()) {
						logger.error("Session {} failed: {}", session.sessionId(), error.getMessage());
					}
					session.fail(error);
					return null;
				});
		}
		catch (RuntimeException e) {
			logger.error("Session {} failed to start cycle: {}", session.sessionId(), e.getMessage());
			session.fail(e);
		}
	}

	private void afterCycle(PollSession session, PollSessionState next) {
		if (session.isCancelled()) {
			logger.info("Session {} cancelled, discarding results of cycle {}", session.sessionId(),
					next.cyclesAttempted());
			return;
		}
		if (next.isFinished()) {
			terminate(session, next);
			return;
		}
		stateRepository.save(next);
		session.advance(next);
		logger.info("No changes yet in session {}, next check in {}", session.sessionId(), next.checkInterval());
		schedule(session, next.checkInterval());
	}

	private void terminate(PollSession session, PollSessionState last) {
		stateRepository.delete(last.sessionId());
		if (!session.finish(last)) {
			// cancelled after the final cycle was folded; its results are discarded
			stateRepository.save(session.state());
			logger.info("Session {} cancelled while finishing, checkpoint kept at cycle {}", session.sessionId(),
					session.state().cyclesAttempted());
			return;
		}
		if (last.changedRepositories().isEmpty()) {
			logger.info("Session {} finished after {} cycles without changes", last.sessionId(),
					last.cyclesAttempted());
		}
		else {
			logger.info("Session {} finished after {} cycles, changed repositories: {}", last.sessionId(),
					last.cyclesAttempted(), last.changedRepositories());
		}
	}

	private static Throwable unwrap(Throwable error) {
		Throwable current = error;
		while (current instanceof CompletionException && current.getCause() != null) {
			current = current.getCause();
		}
		return current;
	}

}
