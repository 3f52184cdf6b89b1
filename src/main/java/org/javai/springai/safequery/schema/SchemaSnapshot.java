package org.javai.springai.safequery.schema;

import java.util.List;
import java.util.Optional;

/**
 * Filtered, immutable view of the database structure.
 *
 * <p>Every table and column in a snapshot has already passed the policy's allow/deny
 * filtering. A snapshot flagged with {@code connectionError} carries no tables and
 * must be treated as "nothing in scope".</p>
 *
 * @param tables tables in introspection order
 * @param dialect database product name (e.g. "PostgreSQL"), empty if unknown
 * @param connectionError true if introspection failed
 */
public record SchemaSnapshot(List<TableInfo> tables, String dialect, boolean connectionError) {

	public SchemaSnapshot {
		tables = tables != null ? List.copyOf(tables) : List.of();
		dialect = dialect != null ? dialect : "";
		if (connectionError && !tables.isEmpty()) {
			throw new IllegalArgumentException("a connection-error snapshot cannot carry tables");
		}
	}

	public static SchemaSnapshot of(String dialect, List<TableInfo> tables) {
		return new SchemaSnapshot(tables, dialect, false);
	}

	public static SchemaSnapshot connectionFailure() {
		return new SchemaSnapshot(List.of(), "", true);
	}

	public Optional<TableInfo> findTable(String tableName) {
		if (tableName == null || tableName.isBlank()) {
			return Optional.empty();
		}
		return tables.stream()
				.filter(t -> t.matchesName(tableName))
				.findFirst();
	}

	public boolean containsTable(String tableName) {
		return findTable(tableName).isPresent();
	}

	public List<String> tableNames() {
		return tables.stream().map(TableInfo::name).toList();
	}

	public boolean isEmpty() {
		return tables.isEmpty();
	}
}
