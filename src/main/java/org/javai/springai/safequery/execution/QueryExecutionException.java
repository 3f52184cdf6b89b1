package org.javai.springai.safequery.execution;

/**
 * The database failed to run an accepted query.
 */
public class QueryExecutionException extends RuntimeException {

	public QueryExecutionException(String message) {
		super(message);
	}

	public QueryExecutionException(String message, Throwable cause) {
		super(message, cause);
	}
}
