package org.javai.springai.safequery;

import org.javai.springai.safequery.generation.CandidateQuery;
import org.javai.springai.safequery.generation.GenerationException;
import org.javai.springai.safequery.guard.ValidationResult;

/**
 * What one pass through generation and validation produced.
 */
sealed interface AttemptResult {

	record Accepted(CandidateQuery candidate) implements AttemptResult {
	}

	record Rejected(CandidateQuery candidate, ValidationResult validation) implements AttemptResult {
	}

	record Declined(CandidateQuery candidate) implements AttemptResult {
	}

	record Failed(GenerationException error) implements AttemptResult {
	}
}
