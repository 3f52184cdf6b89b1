package org.javai.springai.safequery.guard;

/**
 * Category of a policy breach detected by the {@link QueryGuard}.
 */
public enum ViolationKind {

	/**
	 * Not a single read-only statement: mutation or DDL keyword, several statements,
	 * or a comment that could hide a second statement.
	 */
	NOT_READ_ONLY,

	/**
	 * References a table outside the allow scope (or unknown to the schema).
	 */
	TABLE_NOT_ALLOWED,

	/**
	 * References a table the policy explicitly restricts.
	 */
	TABLE_RESTRICTED,

	/**
	 * References a column the policy excludes.
	 */
	COLUMN_EXCLUDED,

	/**
	 * The outermost query has no numeric row-limiting clause.
	 */
	MISSING_LIMIT,

	/**
	 * The row-limiting clause exceeds the policy's maximum.
	 */
	LIMIT_TOO_LARGE,

	/**
	 * A soft-delete table is read without excluding deleted rows.
	 */
	MISSING_SOFT_DELETE_FILTER,

	/**
	 * The text could not be parsed into a recognisable query.
	 */
	MALFORMED
}
