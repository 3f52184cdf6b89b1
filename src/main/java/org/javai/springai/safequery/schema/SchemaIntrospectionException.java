package org.javai.springai.safequery.schema;

/**
 * Thrown by a {@link SchemaIntrospector} when the database structure cannot be read.
 */
public class SchemaIntrospectionException extends RuntimeException {

	public SchemaIntrospectionException(String message) {
		super(message);
	}

	public SchemaIntrospectionException(String message, Throwable cause) {
		super(message, cause);
	}
}
