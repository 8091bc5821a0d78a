package org.springaicommunity.gitlab.detector;

import org.jspecify.annotations.Nullable;

import java.util.concurrent.CompletableFuture;

/**
 * Interface for the GitLab "list repository commits" query.
 *
 * <p>
 * Offered in a blocking and a non-blocking form with identical result semantics.
 * Implementations never throw or complete exceptionally for a failed or unreachable
 * remote call; the failure is reported through {@link CommitResult#outcome()}. No
 * retries happen at this level.
 */
public interface GitLabClient {

	/**
	 * List commits on the target's branch, blocking until the response arrives or the
	 * timeout elapses.
	 * @param target project and branch to query
	 * @param since ISO-8601 timestamp passed through as-is, or {@code null} for the full
	 * history
	 * @return normalised result
	 */
	CommitResult getCommits(RepositoryTarget target, @Nullable String since);

	/**
	 * List commits on the target's branch without blocking the caller. Cancelling the
	 * returned future abandons the request.
	 * @param target project and branch to query
	 * @param since ISO-8601 timestamp passed through as-is, or {@code null} for the full
	 * history
	 * @return future completing normally with the normalised result
	 */
	CompletableFuture<CommitResult> getCommitsAsync(RepositoryTarget target, @Nullable String since);

}
