package org.javai.springai.safequery.generation;

import java.util.List;
import java.util.Objects;
import org.javai.springai.safequery.guard.Violation;
import org.javai.springai.safequery.schema.SchemaSnapshot;

/**
 * Everything the generator gets for one attempt.
 *
 * @param question the user's question, verbatim
 * @param snapshot the policy-filtered schema
 * @param constraints policy rules to state in the prompt
 * @param priorViolations violations of the previous candidate, in detection order; empty on a first attempt
 * @param priorFailure description of the previous attempt's generator failure, or {@code null}
 */
public record GenerationRequest(
		String question,
		SchemaSnapshot snapshot,
		QueryConstraints constraints,
		List<Violation> priorViolations,
		String priorFailure
) {

	public GenerationRequest {
		Objects.requireNonNull(question, "question must not be null");
		Objects.requireNonNull(snapshot, "snapshot must not be null");
		Objects.requireNonNull(constraints, "constraints must not be null");
		priorViolations = priorViolations != null ? List.copyOf(priorViolations) : List.of();
	}

	public static GenerationRequest first(String question, SchemaSnapshot snapshot, QueryConstraints constraints) {
		return new GenerationRequest(question, snapshot, constraints, List.of(), null);
	}

	public GenerationRequest afterRejection(List<Violation> violations) {
		return new GenerationRequest(question, snapshot, constraints, violations, null);
	}

	public GenerationRequest afterFailure(String failure) {
		return new GenerationRequest(question, snapshot, constraints, List.of(), failure);
	}

	public boolean isRetry() {
		return !priorViolations.isEmpty() || priorFailure != null;
	}
}
