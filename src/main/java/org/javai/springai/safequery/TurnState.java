package org.javai.springai.safequery;

/**
 * States of a single user turn.
 */
public enum TurnState {
	RECEIVED,
	GENERATING,
	VALIDATING,
	REJECTED,
	ACCEPTED,
	EXECUTING,
	EXEC_FAILED,
	REDACTING,
	ANSWERING,
	CONSTRAINING,
	DONE,
	OUT_OF_SCOPE,
	GENERATION_FAILED,
	CANCELLED;

	public boolean isTerminal() {
		return this == DONE || this == EXEC_FAILED || this == OUT_OF_SCOPE
				|| this == GENERATION_FAILED || this == CANCELLED;
	}
}
