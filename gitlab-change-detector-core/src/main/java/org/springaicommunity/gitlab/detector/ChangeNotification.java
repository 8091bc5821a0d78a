package org.springaicommunity.gitlab.detector;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Message handed to the downstream publisher for one changed project.
 *
 * @param topic destination topic
 * @param key JSON-encoded project id, e.g. {@code 2949} or {@code "group/project"}
 * @param value JSON payload, {@code {"changed_repo_id": <id>}}
 */
public record ChangeNotification(String topic, String key, String value) {

	// no leading zeros, so the number reads back as the same id
	private static final Pattern CANONICAL_NUMBER = Pattern.compile("0|[1-9]\\d*");

	/**
	 * Build one notification per changed project, in detection order. Numeric project ids
	 * without leading zeros are encoded as JSON numbers, anything else (including
	 * {@code "007"}) as a JSON string.
	 * @param topic destination topic
	 * @param event terminal event of a session
	 * @param objectMapper mapper used for encoding
	 * @return notifications, empty if nothing changed
	 */
	public static List<ChangeNotification> fromEvent(String topic, ChangeDetectionEvent event,
			ObjectMapper objectMapper) {
		List<ChangeNotification> notifications = new ArrayList<>(event.changedRepositories().size());
		for (String projectId : event.changedRepositories()) {
			JsonNode id = CANONICAL_NUMBER.matcher(projectId).matches()
					? objectMapper.getNodeFactory().numberNode(new BigInteger(projectId))
					: objectMapper.getNodeFactory().textNode(projectId);
			ObjectNode payload = objectMapper.createObjectNode();
			payload.set("changed_repo_id", id);
			try {
				notifications.add(new ChangeNotification(topic, objectMapper.writeValueAsString(id),
						objectMapper.writeValueAsString(payload)));
			}
			catch (JsonProcessingException e) {
				throw new IllegalStateException("Failed to encode notification for project " + projectId, e);
			}
		}
		return notifications;
	}

}
