package org.javai.springai.safequery.guard;

/**
 * Thrown when query text cannot be parsed into a statement.
 */
public class MalformedQueryException extends RuntimeException {

	public MalformedQueryException(String message) {
		super(message);
	}

	public MalformedQueryException(String message, Throwable cause) {
		super(message, cause);
	}
}
