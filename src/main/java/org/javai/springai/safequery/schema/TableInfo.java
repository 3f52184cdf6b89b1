package org.javai.springai.safequery.schema;

import java.util.List;
import java.util.Optional;

/**
 * A table (or view) exposed to the pipeline.
 *
 * @param name table name as reported by the database
 * @param columns columns in ordinal order
 * @param hasSoftDelete true if the table exposes the policy's soft-delete column
 */
public record TableInfo(String name, List<ColumnInfo> columns, boolean hasSoftDelete) {

	public TableInfo {
		if (name == null || name.isBlank()) {
			throw new IllegalArgumentException("table name must not be blank");
		}
		columns = columns != null ? List.copyOf(columns) : List.of();
	}

	/**
	 * Returns true if the given name refers to this table. Comparison is case-insensitive.
	 */
	public boolean matchesName(String candidate) {
		return candidate != null && name.equalsIgnoreCase(candidate);
	}

	public Optional<ColumnInfo> findColumn(String columnName) {
		if (columnName == null || columnName.isBlank()) {
			return Optional.empty();
		}
		return columns.stream()
				.filter(c -> c.matchesName(columnName))
				.findFirst();
	}

	public List<String> columnNames() {
		return columns.stream().map(ColumnInfo::name).toList();
	}
}
