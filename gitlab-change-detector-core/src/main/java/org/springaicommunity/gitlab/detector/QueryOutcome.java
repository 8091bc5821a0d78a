package org.springaicommunity.gitlab.detector;

/**
 * Classification of a single commit query.
 */
public enum QueryOutcome {

	/** HTTP 200 with a JSON array body. */
	SUCCESS,

	/** The provider answered, but not with a usable commit list. */
	API_ERROR,

	/** The request never produced a response (timeout, refused connection, I/O). */
	TRANSPORT_ERROR

}
