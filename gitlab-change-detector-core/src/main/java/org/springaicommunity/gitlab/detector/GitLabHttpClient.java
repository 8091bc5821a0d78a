package org.springaicommunity.gitlab.detector;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * {@link GitLabClient} backed by the JDK {@link HttpClient}.
 *
 * <p>
 * Both calling modes funnel the response through the same normalisation step, so a given
 * HTTP exchange yields the same {@link CommitResult} whichever mode issued it.
 */
public class GitLabHttpClient implements GitLabClient {

	private static final Logger logger = LoggerFactory.getLogger(GitLabHttpClient.class);

	private final GitLabConfig config;

	private final HttpClient httpClient;

	private final ObjectMapper objectMapper;

	public GitLabHttpClient(GitLabConfig config) {
		this(config, ObjectMapperFactory.create());
	}

	public GitLabHttpClient(GitLabConfig config, ObjectMapper objectMapper) {
		this.config = config;
		this.objectMapper = objectMapper;
		this.httpClient = HttpClient.newBuilder()
			.connectTimeout(config.connectionTimeout())
			.followRedirects(HttpClient.Redirect.NORMAL)
			.build();
	}

	public GitLabConfig getConfig() {
		return config;
	}

	@Override
	public CommitResult getCommits(RepositoryTarget target, @Nullable String since) {
		HttpRequest request = newRequest(target, since);
		logger.debug("GET commits for {} since {}", target, since);
		long start = System.currentTimeMillis();

		try {
			HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
			logger.debug("GET commits for {} returned {} in {}ms", target, response.statusCode(),
					System.currentTimeMillis() - start);
			return processCommitResponse(response.statusCode(), response.body());
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			return transportFailure(target, start, e);
		}
		catch (IOException | RuntimeException e) {
			return transportFailure(target, start, e);
		}
	}

	@Override
	public CompletableFuture<CommitResult> getCommitsAsync(RepositoryTarget target, @Nullable String since) {
		HttpRequest request;
		try {
			request = newRequest(target, since);
		}
		catch (RuntimeException e) {
			return CompletableFuture.completedFuture(CommitResult.transportError(e));
		}
		logger.debug("GET (async) commits for {} since {}", target, since);
		long start = System.currentTimeMillis();

		CompletableFuture<HttpResponse<String>> exchange = httpClient.sendAsync(request,
				HttpResponse.BodyHandlers.ofString());
		CompletableFuture<CommitResult> result = exchange.handle((response, error) -> {
			if (error != null) {
				return transportFailure(target, start, unwrap(error));
			}
			logger.debug("GET (async) commits for {} returned {} in {}ms", target, response.statusCode(),
					System.currentTimeMillis() - start);
			return processCommitResponse(response.statusCode(), response.body());
		});
		result.whenComplete((ignored, error) -> {
			if (error instanceof CancellationException) {
				exchange.cancel(true);
			}
		});
		return result;
	}

	/**
	 * Build the commits URL for a target. Values are percent-encoded but otherwise passed
	 * through unchanged.
	 */
	URI commitsUri(RepositoryTarget target, @Nullable String since) {
		StringBuilder url = new StringBuilder(config.apiBaseUrl());
		url.append("/projects/").append(encode(target.projectId()));
		url.append("/repository/commits?ref_name=").append(encode(target.branch()));
		if (since != null && !since.isEmpty()) {
			url.append("&since=").append(encode(since));
		}
		if (config.hasToken()) {
			url.append("&private_token=").append(encode(config.token()));
		}
		return URI.create(url.toString());
	}

	CommitResult processCommitResponse(int status, String body) {
		if (status != CommitResult.STATUS_OK) {
			return CommitResult.notSucceeded();
		}

		JsonNode payload;
		try {
			payload = objectMapper.readTree(body);
		}
		catch (JsonProcessingException e) {
			return CommitResult.invalidPayload("result is not valid JSON: " + e.getOriginalMessage());
		}

		if (payload == null || !payload.isArray()) {
			return CommitResult.invalidPayload("result is not valid. result: " + body);
		}

		List<Commit> commits = new ArrayList<>(payload.size());
		payload.forEach(node -> commits.add(Commit.from(node)));
		return CommitResult.success(commits);
	}

	private HttpRequest newRequest(RepositoryTarget target, @Nullable String since) {
		return HttpRequest.newBuilder()
			.uri(commitsUri(target, since))
			.timeout(config.connectionTimeout())
			.header("Accept", "application/json")
			.header("User-Agent", "gitlab-change-detector")
			.GET()
			.build();
	}

	private CommitResult transportFailure(RepositoryTarget target, long start, Throwable error) {
		logger.debug("GET commits for {} failed after {}ms: {}", target, System.currentTimeMillis() - start,
				error.toString());
		return CommitResult.transportError(error);
	}

	private static Throwable unwrap(Throwable error) {
		Throwable current = error;
		while ((current instanceof CompletionException || current instanceof ExecutionException)
				&& current.getCause() != null) {
			current = current.getCause();
		}
		return current;
	}

	private static String encode(@Nullable String value) {
		return URLEncoder.encode(value == null ? "" : value, StandardCharsets.UTF_8).replace("+", "%20");
	}

}
