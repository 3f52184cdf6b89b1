package org.javai.springai.safequery;

/**
 * Outcome of a single generation attempt.
 *
 * <p>Each attempt consumes one unit of the turn's shared retry budget.</p>
 */
public enum AttemptOutcome {
	/**
	 * The candidate passed the guard.
	 */
	ACCEPTED,

	/**
	 * The candidate was rejected by the guard.
	 */
	REJECTED,

	/**
	 * The generator declined the question as out of scope.
	 */
	DECLINED,

	/**
	 * The generator failed: transport error, timeout or malformed response.
	 */
	GENERATION_FAILED
}
