package org.springaicommunity.gitlab.detector;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;

/**
 * Utility for JsonNode navigation.
 */
public class JsonNodeUtils {

	public Optional<String> getString(JsonNode node, String... path) {
		JsonNode target = navigate(node, path);
		return target.isMissingNode() || target.isNull() ? Optional.empty() : Optional.of(target.asText());
	}

	private JsonNode navigate(JsonNode node, String... path) {
		JsonNode target = node;
		for (String p : path) {
			target = target.path(p);
		}
		return target;
	}

}
