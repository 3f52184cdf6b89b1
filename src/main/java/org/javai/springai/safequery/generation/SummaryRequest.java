package org.javai.springai.safequery.generation;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Input for answer synthesis from already redacted rows.
 *
 * @param question the user's question
 * @param sql the accepted query that produced the rows
 * @param rows redacted rows, at most the configured summary row limit
 * @param totalRows number of rows returned by the query (after dropping the probe row)
 * @param truncated whether the database had more rows than the policy allows
 * @param constraints policy rules, for currency formatting and wording
 */
public record SummaryRequest(
		String question,
		String sql,
		List<Map<String, Object>> rows,
		int totalRows,
		boolean truncated,
		QueryConstraints constraints
) {

	public SummaryRequest {
		Objects.requireNonNull(question, "question must not be null");
		Objects.requireNonNull(sql, "sql must not be null");
		Objects.requireNonNull(constraints, "constraints must not be null");
		rows = rows != null ? List.copyOf(rows) : List.of();
		if (totalRows < 0) {
			throw new IllegalArgumentException("totalRows must be >= 0");
		}
	}
}
