package org.javai.springai.safequery.guard;

import java.util.Objects;

/**
 * One specific policy breach.
 *
 * @param kind the category of the breach
 * @param detail what exactly was wrong, phrased for the generator's next attempt
 */
public record Violation(ViolationKind kind, String detail) {

	public Violation {
		Objects.requireNonNull(kind, "kind must not be null");
		detail = detail != null ? detail : "";
	}

	@Override
	public String toString() {
		return detail.isBlank() ? kind.name() : kind.name() + ": " + detail;
	}
}
