package org.javai.springai.safequery.generation;

/**
 * Text-generation backend: proposes queries and phrases answers.
 *
 * <p>Everything it returns is untrusted. Candidates go through the guard and answers are
 * length-constrained by the caller.</p>
 */
public interface QueryGenerator {

	/**
	 * Proposes a query for the question, or declines it as out of scope.
	 *
	 * @throws GenerationException on transport failure or a response that breaks the contract
	 */
	CandidateQuery generate(GenerationRequest request);

	/**
	 * Phrases a short natural-language answer from result rows.
	 *
	 * @throws GenerationException on transport failure
	 */
	String summarize(SummaryRequest request);

	/**
	 * A short friendly reply steering an off-topic question back to data questions.
	 *
	 * @throws GenerationException on transport failure
	 */
	String redirectOffTopic(String question);
}
