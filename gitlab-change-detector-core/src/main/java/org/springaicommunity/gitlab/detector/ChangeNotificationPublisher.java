package org.springaicommunity.gitlab.detector;

import java.util.List;

/**
 * Downstream hand-off for the projects found changed by a session.
 */
public interface ChangeNotificationPublisher {

	/**
	 * Publish the given notifications, in order.
	 * @param notifications one message per changed project
	 */
	void publish(List<ChangeNotification> notifications);

}
