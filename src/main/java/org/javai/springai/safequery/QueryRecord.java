package org.javai.springai.safequery;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * The audit record of one user turn, handed to the audit sink exactly once.
 *
 * @param userId who asked
 * @param question the question, verbatim
 * @param finalSql the last candidate query, or {@code null} when none was produced
 * @param attemptCount generation attempts spent
 * @param outcome how the turn ended
 * @param answer the text shown to the user
 * @param rowCount rows returned by the executed query, or {@code null} when nothing ran
 * @param detail violations, error text or scope reason for audit; never shown to the user
 * @param attempts per-attempt trail
 * @param startedAt when the turn started
 * @param finishedAt when the turn ended
 */
public record QueryRecord(
		String userId,
		String question,
		String finalSql,
		int attemptCount,
		QueryOutcome outcome,
		String answer,
		Integer rowCount,
		String detail,
		List<AttemptRecord> attempts,
		Instant startedAt,
		Instant finishedAt
) {
	public QueryRecord {
		Objects.requireNonNull(userId, "userId must not be null");
		Objects.requireNonNull(question, "question must not be null");
		Objects.requireNonNull(outcome, "outcome must not be null");
		if (attemptCount < 0) {
			throw new IllegalArgumentException("attemptCount must be >= 0");
		}
		attempts = attempts != null ? List.copyOf(attempts) : List.of();
	}

	public boolean isAnswered() {
		return outcome == QueryOutcome.ANSWERED;
	}
}
