package org.javai.springai.safequery.policy;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable access policy for generated queries.
 *
 * <p>All table and column names are normalised (trimmed, lower-cased) on construction,
 * so every lookup on this type is case-insensitive. Restriction always wins over
 * allow-listing: a table that is both allowed and restricted is restricted.</p>
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * Policy policy = Policy.builder()
 *         .allowAllTables()
 *         .restrictTables("admin_logs")
 *         .excludeColumns("password_hash")
 *         .maxRows(100)
 *         .build();
 * }</pre>
 *
 * @param allowAllTables true when every introspected table is in scope
 * @param allowedTables explicit allow-list; ignored when {@code allowAllTables} is set
 * @param restrictedTables tables that are never in scope
 * @param excludedColumns column names that must never leave the pipeline
 * @param maxRows upper bound for the row-limiting clause and for fetched rows
 * @param readOnly must be true; queries are only ever executed read-only
 * @param softDeleteColumn name of the column marking logically deleted rows
 * @param softDeleteFilters predicate shapes accepted as a soft-delete filter
 */
public record Policy(
		boolean allowAllTables,
		Set<String> allowedTables,
		Set<String> restrictedTables,
		Set<String> excludedColumns,
		int maxRows,
		boolean readOnly,
		String softDeleteColumn,
		Set<SoftDeleteFilter> softDeleteFilters
) {

	public static final int DEFAULT_MAX_ROWS = 100;
	public static final String DEFAULT_SOFT_DELETE_COLUMN = "deleted_at";

	public Policy {
		allowedTables = normalize(allowedTables);
		restrictedTables = normalize(restrictedTables);
		excludedColumns = normalize(excludedColumns);
		if (maxRows < 1) {
			throw new IllegalArgumentException("maxRows must be >= 1");
		}
		if (!readOnly) {
			throw new IllegalArgumentException("Only read-only policies are supported");
		}
		softDeleteColumn = softDeleteColumn != null && !softDeleteColumn.isBlank()
				? normalizeName(softDeleteColumn)
				: DEFAULT_SOFT_DELETE_COLUMN;
		softDeleteFilters = softDeleteFilters != null && !softDeleteFilters.isEmpty()
				? Collections.unmodifiableSet(EnumSet.copyOf(softDeleteFilters))
				: Collections.unmodifiableSet(EnumSet.of(SoftDeleteFilter.IS_NULL));
	}

	/**
	 * Policy allowing every table, restricting nothing, excluding no column.
	 */
	public static Policy defaults() {
		return builder().build();
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * True if the table is explicitly restricted.
	 */
	public boolean isRestricted(String tableName) {
		return tableName != null && restrictedTables.contains(normalizeName(tableName));
	}

	/**
	 * True if the table may be exposed: inside the allow scope and not restricted.
	 */
	public boolean isTableInScope(String tableName) {
		if (tableName == null || tableName.isBlank() || isRestricted(tableName)) {
			return false;
		}
		return allowAllTables || allowedTables.contains(normalizeName(tableName));
	}

	public boolean isExcludedColumn(String columnName) {
		return columnName != null && excludedColumns.contains(normalizeName(columnName));
	}

	public boolean isSoftDeleteColumn(String columnName) {
		return columnName != null && softDeleteColumn.equals(normalizeName(columnName));
	}

	/**
	 * Lower-cases and trims a table or column name.
	 */
	public static String normalizeName(String name) {
		return name.trim().toLowerCase(Locale.ROOT);
	}

	private static Set<String> normalize(Collection<String> names) {
		if (names == null || names.isEmpty()) {
			return Set.of();
		}
		Set<String> result = new LinkedHashSet<>();
		for (String name : names) {
			if (name != null && !name.isBlank()) {
				result.add(normalizeName(name));
			}
		}
		return Set.copyOf(result);
	}

	/**
	 * Builder for {@link Policy}.
	 */
	public static final class Builder {
		private boolean allowAllTables = true;
		private final List<String> allowedTables = new ArrayList<>();
		private final List<String> restrictedTables = new ArrayList<>();
		private final List<String> excludedColumns = new ArrayList<>();
		private int maxRows = DEFAULT_MAX_ROWS;
		private String softDeleteColumn = DEFAULT_SOFT_DELETE_COLUMN;
		private final Set<SoftDeleteFilter> softDeleteFilters = EnumSet.noneOf(SoftDeleteFilter.class);

		private Builder() {
		}

		public Builder allowAllTables() {
			this.allowAllTables = true;
			this.allowedTables.clear();
			return this;
		}

		/**
		 * Restricts the scope to the given tables. Calling this switches off
		 * {@link #allowAllTables()}.
		 */
		public Builder allowTables(String... tables) {
			return allowTables(tables != null ? Arrays.asList(tables) : List.of());
		}

		public Builder allowTables(Collection<String> tables) {
			this.allowAllTables = false;
			if (tables != null) {
				this.allowedTables.addAll(tables);
			}
			return this;
		}

		public Builder restrictTables(String... tables) {
			return restrictTables(tables != null ? Arrays.asList(tables) : List.of());
		}

		public Builder restrictTables(Collection<String> tables) {
			if (tables != null) {
				this.restrictedTables.addAll(tables);
			}
			return this;
		}

		public Builder excludeColumns(String... columns) {
			return excludeColumns(columns != null ? Arrays.asList(columns) : List.of());
		}

		public Builder excludeColumns(Collection<String> columns) {
			if (columns != null) {
				this.excludedColumns.addAll(columns);
			}
			return this;
		}

		public Builder maxRows(int maxRows) {
			this.maxRows = maxRows;
			return this;
		}

		public Builder softDeleteColumn(String column) {
			this.softDeleteColumn = column;
			return this;
		}

		public Builder softDeleteFilters(SoftDeleteFilter... filters) {
			return softDeleteFilters(filters != null ? Arrays.asList(filters) : List.of());
		}

		public Builder softDeleteFilters(Collection<SoftDeleteFilter> filters) {
			this.softDeleteFilters.clear();
			if (filters != null) {
				filters.stream().filter(Objects::nonNull).forEach(this.softDeleteFilters::add);
			}
			return this;
		}

		public Policy build() {
			return new Policy(allowAllTables, new LinkedHashSet<>(allowedTables), new LinkedHashSet<>(restrictedTables),
					new LinkedHashSet<>(excludedColumns), maxRows, true, softDeleteColumn, softDeleteFilters);
		}
	}
}
