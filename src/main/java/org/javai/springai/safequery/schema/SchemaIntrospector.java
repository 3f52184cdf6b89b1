package org.javai.springai.safequery.schema;

import java.util.List;

/**
 * Reads the raw, unfiltered structure of the target database.
 */
public interface SchemaIntrospector {

	/**
	 * @return every table and view with all of its columns
	 * @throws SchemaIntrospectionException if the database cannot be reached or read
	 */
	IntrospectedSchema introspect();

	/**
	 * Raw introspection result.
	 *
	 * @param dialect database product name
	 * @param tables tables and views with every column; {@code hasSoftDelete} is not yet set
	 */
	record IntrospectedSchema(String dialect, List<TableInfo> tables) {

		public IntrospectedSchema {
			dialect = dialect != null ? dialect : "";
			tables = tables != null ? List.copyOf(tables) : List.of();
		}
	}
}
