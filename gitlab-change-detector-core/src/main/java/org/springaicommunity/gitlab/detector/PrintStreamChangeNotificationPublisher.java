package org.springaicommunity.gitlab.detector;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.List;

/**
 * Writes each notification as one JSON line, for piping into another tool.
 */
public class PrintStreamChangeNotificationPublisher implements ChangeNotificationPublisher {

	private static final Logger logger = LoggerFactory.getLogger(PrintStreamChangeNotificationPublisher.class);

	private final PrintStream out;

	private final ObjectMapper objectMapper;

	public PrintStreamChangeNotificationPublisher(PrintStream out, ObjectMapper objectMapper) {
		this.out = out;
		this.objectMapper = objectMapper;
	}

	@Override
	public void publish(List<ChangeNotification> notifications) {
		for (ChangeNotification notification : notifications) {
			try {
				out.println(objectMapper.writeValueAsString(notification));
			}
			catch (JsonProcessingException e) {
				throw new IllegalStateException("Failed to write notification " + notification.key(), e);
			}
			logger.info("Published change of {} to {}", notification.key(), notification.topic());
		}
		out.flush();
	}

}
