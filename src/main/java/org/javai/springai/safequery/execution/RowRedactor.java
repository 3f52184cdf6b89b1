package org.javai.springai.safequery.execution;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.javai.springai.safequery.policy.Policy;

/**
 * Removes excluded columns from result rows.
 *
 * <p>Column labels are matched case-insensitively, so wildcards and aliases that keep an
 * excluded name are covered. Row count and truncation are preserved.</p>
 */
public class RowRedactor {

	private final Policy policy;

	public RowRedactor(Policy policy) {
		this.policy = Objects.requireNonNull(policy, "policy must not be null");
	}

	public ExecutionResult redact(ExecutionResult result) {
		if (policy.excludedColumns().isEmpty() || result.isEmpty()) {
			return result;
		}
		List<Map<String, Object>> redacted = new ArrayList<>(result.rowCount());
		for (Map<String, Object> row : result.rows()) {
			Map<String, Object> kept = new LinkedHashMap<>();
			row.forEach((column, value) -> {
				if (!policy.isExcludedColumn(column)) {
					kept.put(column, value);
				}
			});
			redacted.add(kept);
		}
		return new ExecutionResult(redacted, result.rowCount(), result.truncated());
	}
}
