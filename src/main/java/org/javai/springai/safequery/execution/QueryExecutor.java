package org.javai.springai.safequery.execution;

import java.time.Duration;

/**
 * Runs accepted queries against the database.
 */
public interface QueryExecutor {

	/**
	 * Runs the query read-only, reading at most {@code maxRows + 1} rows.
	 *
	 * @param sql an accepted query
	 * @param maxRows the policy's maximum row count
	 * @param timeout bound on the database call
	 * @return at most {@code maxRows} rows, flagged truncated when a probe row was seen
	 * @throws QueryExecutionException on any database error or timeout
	 */
	ExecutionResult execute(String sql, int maxRows, Duration timeout);
}
