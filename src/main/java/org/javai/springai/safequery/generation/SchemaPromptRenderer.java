package org.javai.springai.safequery.generation;

import java.util.StringJoiner;
import org.javai.springai.safequery.schema.ColumnInfo;
import org.javai.springai.safequery.schema.SchemaSnapshot;
import org.javai.springai.safequery.schema.TableInfo;

/**
 * Renders a policy-filtered schema snapshot as prompt text.
 *
 * <p>Only what the snapshot holds is shown, so restricted tables and excluded columns
 * never reach the generator.</p>
 */
public final class SchemaPromptRenderer {

	private static final String SCHEMA_FOOTER = """

			CRITICAL: table and column names MUST be copied from this schema exactly as shown.
			- If a name doesn't appear in this schema, DON'T use it in SQL
			- Tables marked soft-delete must exclude deleted rows in every query that reads them
			""";

	private SchemaPromptRenderer() {
	}

	public static String render(SchemaSnapshot snapshot) {
		if (snapshot == null || snapshot.isEmpty()) {
			return "(No accessible tables)";
		}
		StringBuilder sb = new StringBuilder("AVAILABLE SCHEMA:\n");
		for (TableInfo table : snapshot.tables()) {
			sb.append("- ").append(table.name());
			if (table.hasSoftDelete()) {
				sb.append(" [soft-delete]");
			}
			sb.append("\n");
			for (ColumnInfo column : table.columns()) {
				sb.append("  • ").append(column.name());
				StringJoiner details = new StringJoiner("; ");
				if (column.type() != null && !column.type().isBlank()) {
					details.add("type=" + column.type());
				}
				details.add(column.nullable() ? "nullable" : "not null");
				sb.append(" (").append(details).append(")\n");
			}
		}
		sb.append(SCHEMA_FOOTER);
		return sb.toString().trim();
	}
}
