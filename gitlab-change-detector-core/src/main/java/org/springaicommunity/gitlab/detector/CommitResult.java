package org.springaicommunity.gitlab.detector;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Normalised outcome of one "list commits" query.
 *
 * <p>
 * {@link QueryOutcome#SUCCESS} holds exactly when the provider answered
 * {@value #STATUS_OK} with a JSON array. Every other outcome carries an empty commit
 * list. Failed exchanges report {@value #STATUS_ERROR} instead of the provider's status,
 * except for a 200 whose body was unusable, which keeps the 200.
 *
 * @param outcome classification of the exchange
 * @param status HTTP status, or {@value #STATUS_ERROR} for failures
 * @param message failure description, {@code null} on success
 * @param commits commits returned by the provider
 */
public record CommitResult(QueryOutcome outcome, int status, @Nullable String message, List<Commit> commits) {

	public static final int STATUS_OK = 200;

	public static final int STATUS_ERROR = 600;

	static final String NOT_SUCCEEDED_MESSAGE = "GitLab response is not succeed";

	private static final List<String> FIELDS = List.of("outcome", "status", "message", "commits");

	private static final ObjectMapper MAPPER = ObjectMapperFactory.create();

	public CommitResult {
		commits = List.copyOf(commits);
		if (outcome != QueryOutcome.SUCCESS && !commits.isEmpty()) {
			throw new IllegalArgumentException("A failed query cannot carry commits (outcome " + outcome + ")");
		}
		if (outcome == QueryOutcome.SUCCESS && status != STATUS_OK) {
			throw new IllegalArgumentException("A successful query must have status " + STATUS_OK + " (got " + status
					+ ")");
		}
	}

	public static CommitResult success(List<Commit> commits) {
		return new CommitResult(QueryOutcome.SUCCESS, STATUS_OK, null, commits);
	}

	/**
	 * The provider answered with something other than 200. The original status is
	 * replaced by {@value #STATUS_ERROR}.
	 */
	public static CommitResult notSucceeded() {
		return new CommitResult(QueryOutcome.API_ERROR, STATUS_ERROR, NOT_SUCCEEDED_MESSAGE, List.of());
	}

	/**
	 * The provider answered 200 but the body was not a commit list.
	 */
	public static CommitResult invalidPayload(String message) {
		return new CommitResult(QueryOutcome.API_ERROR, STATUS_OK, message, List.of());
	}

	public static CommitResult transportError(Throwable error) {
		String message = error.getMessage() != null ? error.getMessage() : error.getClass().getName();
		return new CommitResult(QueryOutcome.TRANSPORT_ERROR, STATUS_ERROR, message, List.of());
	}

	@JsonIgnore
	public boolean isSuccess() {
		return outcome == QueryOutcome.SUCCESS;
	}

	/**
	 * Returns true if the query succeeded and found at least one commit.
	 */
	public boolean hasCommits() {
		return isSuccess() && !commits.isEmpty();
	}

	/**
	 * Flatten this result into the field map accepted by {@link #fromFields(Map)}.
	 * @return ordered field map
	 */
	public Map<String, Object> toFields() {
		Map<String, Object> fields = new LinkedHashMap<>();
		fields.put("outcome", outcome.name());
		fields.put("status", status);
		fields.put("message", message);
		fields.put("commits", commits);
		return fields;
	}

	/**
	 * Rehydrate a result from a transport payload. All of {@code outcome},
	 * {@code status}, {@code message} and {@code commits} must be present;
	 * {@code message} may map to {@code null}.
	 * @param fields payload fields
	 * @return the rehydrated result
	 * @throws IllegalArgumentException if a field is missing or has the wrong type
	 */
	public static CommitResult fromFields(Map<String, ?> fields) {
		List<String> missing = new ArrayList<>();
		for (String field : FIELDS) {
			if (!fields.containsKey(field)) {
				missing.add(field);
			}
		}
		if (!missing.isEmpty()) {
			throw new IllegalArgumentException("Result payload is missing fields: " + missing);
		}

		Object outcome = fields.get("outcome");
		Object status = fields.get("status");
		Object message = fields.get("message");
		Object commits = fields.get("commits");

		if (!(status instanceof Number number)) {
			throw new IllegalArgumentException("Field 'status' must be a number, got: " + status);
		}
		if (message != null && !(message instanceof String)) {
			throw new IllegalArgumentException("Field 'message' must be a string, got: " + message);
		}
		if (!(commits instanceof Collection<?> items)) {
			throw new IllegalArgumentException("Field 'commits' must be a list, got: " + commits);
		}

		return new CommitResult(toOutcome(outcome), number.intValue(), (String) message, toCommits(items));
	}

	private static QueryOutcome toOutcome(@Nullable Object value) {
		if (value instanceof QueryOutcome outcome) {
			return outcome;
		}
		if (value instanceof String name) {
			try {
				return QueryOutcome.valueOf(name);
			}
			catch (IllegalArgumentException e) {
				throw new IllegalArgumentException("Unknown outcome: " + name, e);
			}
		}
		throw new IllegalArgumentException("Field 'outcome' must be a string, got: " + value);
	}

	private static List<Commit> toCommits(Collection<?> items) {
		List<Commit> commits = new ArrayList<>(items.size());
		for (Object item : items) {
			if (item == null) {
				throw new IllegalArgumentException("Field 'commits' cannot contain null entries");
			}
			if (item instanceof Commit commit) {
				commits.add(commit);
			}
			else if (item instanceof JsonNode node) {
				commits.add(Commit.from(node));
			}
			else {
				commits.add(Commit.from(MAPPER.valueToTree(item)));
			}
		}
		return commits;
	}

}
