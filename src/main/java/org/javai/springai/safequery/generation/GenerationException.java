package org.javai.springai.safequery.generation;

/**
 * The text-generation backend could not produce a usable result: transport error,
 * timeout, or a response that does not follow the expected contract.
 */
public class GenerationException extends RuntimeException {

	private final Kind kind;

	public enum Kind {
		TRANSPORT,
		TIMEOUT,
		MALFORMED_RESPONSE
	}

	public GenerationException(Kind kind, String message) {
		super(message);
		this.kind = kind;
	}

	public GenerationException(Kind kind, String message, Throwable cause) {
		super(message, cause);
		this.kind = kind;
	}

	public Kind kind() {
		return kind;
	}
}
