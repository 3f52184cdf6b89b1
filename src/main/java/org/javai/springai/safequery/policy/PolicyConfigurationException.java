package org.javai.springai.safequery.policy;

/**
 * Thrown when a policy or pipeline configuration cannot be read or is invalid.
 */
public class PolicyConfigurationException extends RuntimeException {

	public PolicyConfigurationException(String message) {
		super(message);
	}

	public PolicyConfigurationException(String message, Throwable cause) {
		super(message, cause);
	}
}
