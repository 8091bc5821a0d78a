package org.springaicommunity.gitlab.detector;

/**
 * Thrown when a GitLab connection cannot be resolved into a usable host and token. Raised
 * before any request is sent and never retried.
 */
public class GitLabConfigurationException extends IllegalStateException {

	public GitLabConfigurationException(String message) {
		super(message);
	}

	public GitLabConfigurationException(String message, Throwable cause) {
		super(message, cause);
	}

}
