package org.javai.springai.safequery.execution;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Rows returned by an accepted query.
 *
 * @param rows result rows, column label to value, in result order; never more than the policy's maximum
 * @param rowCount number of rows in {@code rows}
 * @param truncated whether the database had more rows than the maximum
 */
public record ExecutionResult(List<Map<String, Object>> rows, int rowCount, boolean truncated) {

	public ExecutionResult {
		rows = rows != null ? copyRows(rows) : List.of();
		if (rowCount != rows.size()) {
			throw new IllegalArgumentException("rowCount must equal the number of rows");
		}
	}

	/**
	 * Builds a result from rows fetched with one extra probe row: when more than
	 * {@code maxRows} rows came back the result is truncated and the probe row dropped.
	 */
	public static ExecutionResult fromProbe(List<Map<String, Object>> fetched, int maxRows) {
		if (maxRows < 1) {
			throw new IllegalArgumentException("maxRows must be >= 1");
		}
		List<Map<String, Object>> rows = fetched != null ? fetched : List.of();
		boolean truncated = rows.size() > maxRows;
		List<Map<String, Object>> kept = truncated ? rows.subList(0, maxRows) : rows;
		return new ExecutionResult(kept, kept.size(), truncated);
	}

	/**
	 * Caps the result at {@code maxRows}, dropping any rows beyond it. A result that was
	 * already truncated stays truncated.
	 */
	public ExecutionResult limitTo(int maxRows) {
		ExecutionResult capped = fromProbe(rows, maxRows);
		if (truncated && !capped.truncated()) {
			return new ExecutionResult(capped.rows(), capped.rowCount(), true);
		}
		return capped;
	}

	public static ExecutionResult empty() {
		return new ExecutionResult(List.of(), 0, false);
	}

	public boolean isEmpty() {
		return rows.isEmpty();
	}

	// values may be null, so no Map.copyOf
	private static List<Map<String, Object>> copyRows(List<Map<String, Object>> rows) {
		List<Map<String, Object>> copy = new ArrayList<>(rows.size());
		for (Map<String, Object> row : rows) {
			copy.add(Collections.unmodifiableMap(new LinkedHashMap<>(row)));
		}
		return Collections.unmodifiableList(copy);
	}
}
