package org.javai.springai.safequery.generation;

import java.util.Optional;
import org.javai.springai.safequery.guard.Violation;

/**
 * Builds the prompt addendum for a retried generation attempt.
 */
public final class RetryPromptBuilder {

	private RetryPromptBuilder() {
	}

	/**
	 * Describes what went wrong with the previous attempt, or nothing on a first attempt.
	 * Violations are listed in the order the guard found them.
	 */
	public static Optional<String> buildRetryAddendum(GenerationRequest request) {
		if (request == null || !request.isRetry()) {
			return Optional.empty();
		}

		StringBuilder sb = new StringBuilder();
		if (!request.priorViolations().isEmpty()) {
			sb.append("Your previous query was rejected by the safety policy:\n");
			int i = 1;
			for (Violation violation : request.priorViolations()) {
				sb.append(i++).append(". ").append(violation).append("\n");
			}
			sb.append("Write a new query that fixes every item above. All prior rules still apply.\n");
		}
		if (request.priorFailure() != null && !request.priorFailure().isBlank()) {
			sb.append("Your previous response could not be used (").append(request.priorFailure()).append(").\n");
			sb.append("Respond with ONLY the JSON object described above.\n");
		}
		return Optional.of(sb.toString().trim());
	}
}
