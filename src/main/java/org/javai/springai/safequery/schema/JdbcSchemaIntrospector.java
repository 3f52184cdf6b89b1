package org.javai.springai.safequery.schema;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link SchemaIntrospector} backed by JDBC {@link DatabaseMetaData}.
 *
 * <p>Reads tables and views of the given catalog/schema (both optional) together with
 * their columns in ordinal order. The connection is opened read-only and closed before
 * returning.</p>
 */
public class JdbcSchemaIntrospector implements SchemaIntrospector {

	private static final Logger logger = LoggerFactory.getLogger(JdbcSchemaIntrospector.class);
	private static final String[] TABLE_TYPES = {"TABLE", "VIEW"};

	private final DataSource dataSource;
	private final String catalog;
	private final String schemaPattern;

	public JdbcSchemaIntrospector(DataSource dataSource) {
		this(dataSource, null, null);
	}

	/**
	 * @param dataSource source of connections to the target database
	 * @param catalog JDBC catalog name, or null for all
	 * @param schemaPattern JDBC schema pattern, or null for all
	 */
	public JdbcSchemaIntrospector(DataSource dataSource, String catalog, String schemaPattern) {
		this.dataSource = Objects.requireNonNull(dataSource, "dataSource must not be null");
		this.catalog = catalog;
		this.schemaPattern = schemaPattern;
	}

	@Override
	public IntrospectedSchema introspect() {
		try (Connection connection = dataSource.getConnection()) {
			connection.setReadOnly(true);
			DatabaseMetaData metaData = connection.getMetaData();
			String dialect = metaData.getDatabaseProductName();
			List<String> tableNames = readTableNames(metaData);
			logger.debug("Found tables: {}", tableNames);

			List<TableInfo> tables = new ArrayList<>();
			for (String tableName : tableNames) {
				tables.add(new TableInfo(tableName, readColumns(metaData, tableName), false));
			}
			return new IntrospectedSchema(dialect, tables);
		} catch (SQLException e) {
			throw new SchemaIntrospectionException("Schema introspection failed: " + e.getMessage(), e);
		}
	}

	private List<String> readTableNames(DatabaseMetaData metaData) throws SQLException {
		List<String> names = new ArrayList<>();
		try (ResultSet rs = metaData.getTables(catalog, schemaPattern, "%", TABLE_TYPES)) {
			while (rs.next()) {
				String name = rs.getString("TABLE_NAME");
				if (name != null && !name.isBlank() && !names.contains(name)) {
					names.add(name);
				}
			}
		}
		return names;
	}

	private List<ColumnInfo> readColumns(DatabaseMetaData metaData, String tableName) throws SQLException {
		List<OrderedColumn> columns = new ArrayList<>();
		String escaped = escapePattern(tableName, metaData.getSearchStringEscape());
		try (ResultSet rs = metaData.getColumns(catalog, schemaPattern, escaped, "%")) {
			while (rs.next()) {
				// The escaped pattern may still be matched loosely by some drivers
				if (!tableName.equals(rs.getString("TABLE_NAME"))) {
					continue;
				}
				String name = rs.getString("COLUMN_NAME");
				if (name == null || name.isBlank()) {
					continue;
				}
				boolean nullable = rs.getInt("NULLABLE") != DatabaseMetaData.columnNoNulls;
				ColumnInfo column = new ColumnInfo(name, rs.getString("TYPE_NAME"), nullable);
				columns.add(new OrderedColumn(rs.getInt("ORDINAL_POSITION"), column));
			}
		}
		return columns.stream()
				.sorted(Comparator.comparingInt(OrderedColumn::position))
				.map(OrderedColumn::column)
				.toList();
	}

	private static String escapePattern(String name, String escape) {
		if (escape == null || escape.isEmpty()) {
			return name;
		}
		return name.replace(escape, escape + escape)
				.replace("_", escape + "_")
				.replace("%", escape + "%");
	}

	private record OrderedColumn(int position, ColumnInfo column) {
	}
}
