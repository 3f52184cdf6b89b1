package org.javai.springai.safequery.schema;

/**
 * A single column of a {@link TableInfo}.
 *
 * @param name column name as reported by the database
 * @param type database type name (e.g. "varchar", "integer")
 * @param nullable whether the column accepts nulls
 */
public record ColumnInfo(String name, String type, boolean nullable) {

	public ColumnInfo {
		if (name == null || name.isBlank()) {
			throw new IllegalArgumentException("column name must not be blank");
		}
	}

	/**
	 * Returns true if the given name refers to this column. Comparison is case-insensitive.
	 */
	public boolean matchesName(String candidate) {
		return candidate != null && name.equalsIgnoreCase(candidate);
	}
}
