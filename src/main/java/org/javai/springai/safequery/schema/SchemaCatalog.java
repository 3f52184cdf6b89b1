package org.javai.springai.safequery.schema;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.javai.springai.safequery.policy.Policy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the policy-filtered {@link SchemaSnapshot}.
 *
 * <p>The first call to {@link #snapshot()} introspects the database and filters the
 * result; later calls return the identical instance until {@link #invalidate()} is
 * called. Concurrent first callers wait for the single build instead of introspecting
 * again. A failed introspection yields a {@link SchemaSnapshot#connectionFailure()}
 * snapshot which is not cached, so the next call retries.</p>
 *
 * <p>Instances are meant to be shared by reference between orchestrator runs.</p>
 */
public class SchemaCatalog {

	private static final Logger logger = LoggerFactory.getLogger(SchemaCatalog.class);

	private final SchemaIntrospector introspector;
	private final Policy policy;
	private final Object buildLock = new Object();
	private volatile SchemaSnapshot cached;

	public SchemaCatalog(SchemaIntrospector introspector, Policy policy) {
		this.introspector = Objects.requireNonNull(introspector, "introspector must not be null");
		this.policy = Objects.requireNonNull(policy, "policy must not be null");
	}

	/**
	 * Returns the cached snapshot, building it on first access.
	 */
	public SchemaSnapshot snapshot() {
		SchemaSnapshot current = cached;
		if (current != null) {
			return current;
		}
		synchronized (buildLock) {
			if (cached != null) {
				return cached;
			}
			SchemaSnapshot built = build();
			if (!built.connectionError()) {
				cached = built;
			}
			return built;
		}
	}

	/**
	 * Drops the cached snapshot; the next {@link #snapshot()} introspects again.
	 */
	public void invalidate() {
		synchronized (buildLock) {
			cached = null;
		}
		logger.debug("Schema snapshot invalidated");
	}

	public Policy policy() {
		return policy;
	}

	private SchemaSnapshot build() {
		SchemaIntrospector.IntrospectedSchema raw;
		try {
			raw = introspector.introspect();
		} catch (SchemaIntrospectionException e) {
			logger.error("Schema introspection failed: {}", e.getMessage());
			return SchemaSnapshot.connectionFailure();
		}
		SchemaSnapshot snapshot = SchemaSnapshot.of(raw.dialect(), filter(raw.tables()));
		logger.info("Schema snapshot built: {} of {} tables in scope {}",
				snapshot.tables().size(), raw.tables().size(), snapshot.tableNames());
		return snapshot;
	}

	/**
	 * Applies the policy to raw tables: restricted and out-of-scope tables are dropped,
	 * excluded columns removed, soft-delete support detected.
	 */
	List<TableInfo> filter(List<TableInfo> rawTables) {
		List<TableInfo> filtered = new ArrayList<>();
		for (TableInfo table : rawTables) {
			if (policy.isRestricted(table.name())) {
				logger.debug("Filtering out table (restricted): {}", table.name());
				continue;
			}
			if (!policy.isTableInScope(table.name())) {
				logger.debug("Filtering out table (not in allowed): {}", table.name());
				continue;
			}
			List<ColumnInfo> columns = table.columns().stream()
					.filter(c -> !policy.isExcludedColumn(c.name()))
					.toList();
			boolean softDelete = columns.stream().anyMatch(c -> policy.isSoftDeleteColumn(c.name()));
			filtered.add(new TableInfo(table.name(), columns, softDelete));
		}
		return filtered;
	}
}
