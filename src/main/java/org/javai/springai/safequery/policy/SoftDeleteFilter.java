package org.javai.springai.safequery.policy;

/**
 * Predicate shapes that count as "excluding soft-deleted rows" on the configured
 * soft-delete column.
 *
 * <p>Which shapes are accepted is a policy decision: timestamp-style columns
 * ({@code deleted_at}) are normally filtered with {@link #IS_NULL}, flag-style columns
 * ({@code is_deleted}) with {@link #IS_FALSE} or {@link #EQUALS_FALSE}.</p>
 */
public enum SoftDeleteFilter {

	/** {@code deleted_at IS NULL} */
	IS_NULL,

	/** {@code is_deleted IS FALSE} or {@code is_deleted IS NOT TRUE} */
	IS_FALSE,

	/** {@code is_deleted = false}, {@code = 0}, {@code = 'f'}, {@code = 'n'} */
	EQUALS_FALSE;

	/**
	 * Renders this filter as a predicate on the given (possibly qualified) column.
	 */
	public String describe(String column) {
		return switch (this) {
			case IS_NULL -> column + " IS NULL";
			case IS_FALSE -> column + " IS FALSE";
			case EQUALS_FALSE -> column + " = FALSE";
		};
	}
}
