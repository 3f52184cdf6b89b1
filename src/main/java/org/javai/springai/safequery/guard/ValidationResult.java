package org.javai.springai.safequery.guard;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Verdict of the {@link QueryGuard}.
 *
 * @param violations ordered breaches; empty when the candidate is accepted
 */
public record ValidationResult(List<Violation> violations) {

	private static final ValidationResult ACCEPTED = new ValidationResult(List.of());

	public ValidationResult {
		violations = violations != null ? List.copyOf(violations) : List.of();
	}

	public static ValidationResult ok() {
		return ACCEPTED;
	}

	public static ValidationResult rejected(List<Violation> violations) {
		if (violations == null || violations.isEmpty()) {
			throw new IllegalArgumentException("a rejection needs at least one violation");
		}
		return new ValidationResult(violations);
	}

	public boolean accepted() {
		return violations.isEmpty();
	}

	public boolean hasViolation(ViolationKind kind) {
		return violations.stream().anyMatch(v -> v.kind() == kind);
	}

	/**
	 * Violations one per line, in detection order.
	 */
	public String describe() {
		return violations.stream()
				.map(Violation::toString)
				.collect(Collectors.joining("\n"));
	}
}
