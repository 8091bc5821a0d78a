package org.springaicommunity.gitlab.detector;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A commit entry from the GitLab "list repository commits" endpoint. Only a handful of
 * fields are kept; detection only cares whether any commits came back.
 */
public record Commit(String id, String shortId, String title, String authorName, String committedDate,
		String webUrl) {

	private static final JsonNodeUtils JSON = new JsonNodeUtils();

	/**
	 * Read a commit leniently from one element of the response array. Missing fields
	 * become empty strings.
	 * @param node array element
	 * @return the commit
	 */
	public static Commit from(JsonNode node) {
		return new Commit(JSON.getString(node, "id").orElse(""), JSON.getString(node, "short_id").orElse(""),
				JSON.getString(node, "title").orElse(""), JSON.getString(node, "author_name").orElse(""),
				JSON.getString(node, "committed_date").orElse(""), JSON.getString(node, "web_url").orElse(""));
	}

}
