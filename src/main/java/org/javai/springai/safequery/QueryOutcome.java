package org.javai.springai.safequery;

/**
 * How a user turn ended.
 */
public enum QueryOutcome {

	/** Rows were fetched (possibly none) and an answer produced. */
	ANSWERED,

	/** The question cannot be served: off topic, unreachable database or no tables in scope. */
	OUT_OF_SCOPE,

	/** The request itself was refused, e.g. more items than the policy allows. */
	REJECTED,

	/** The database failed on an accepted query. */
	EXECUTION_FAILED,

	/** No acceptable query within the retry budget, or the answer could not be produced. */
	GENERATION_FAILED,

	/** The turn was interrupted before it finished. */
	CANCELLED
}
