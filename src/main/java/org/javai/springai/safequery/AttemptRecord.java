package org.javai.springai.safequery;

/**
 * Record of a single generation attempt for the audit trail.
 *
 * @param attempt 1-based attempt number within the turn
 * @param outcome result of the attempt
 * @param durationMillis time spent generating and validating
 * @param sql the candidate text, or {@code null} when none was produced
 * @param detail violations, error text or scope reason; {@code null} when accepted
 */
public record AttemptRecord(
		int attempt,
		AttemptOutcome outcome,
		long durationMillis,
		String sql,
		String detail
) {
	public AttemptRecord {
		if (attempt < 1) {
			throw new IllegalArgumentException("attempt must be >= 1");
		}
		if (outcome == null) {
			throw new IllegalArgumentException("outcome must not be null");
		}
		if (durationMillis < 0) {
			throw new IllegalArgumentException("durationMillis must be >= 0");
		}
	}

	public boolean isAccepted() {
		return outcome == AttemptOutcome.ACCEPTED;
	}
}
