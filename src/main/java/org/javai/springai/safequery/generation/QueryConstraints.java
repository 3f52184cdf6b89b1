package org.javai.springai.safequery.generation;

import java.util.List;
import java.util.stream.Collectors;
import org.javai.springai.safequery.policy.PipelineSettings;
import org.javai.springai.safequery.policy.Policy;
import org.javai.springai.safequery.policy.SoftDeleteFilter;

/**
 * The policy rules as the generator needs to hear them.
 *
 * @param allowedTables allow-listed tables, empty when every table is allowed
 * @param restrictedTables tables that must never be read
 * @param excludedColumns columns that must never be referenced
 * @param maxRows highest permitted LIMIT
 * @param softDeleteColumn column marking deleted rows
 * @param softDeleteFilters predicate shapes the guard accepts on that column, in preference order
 * @param currencySymbol symbol for monetary values in answers
 */
public record QueryConstraints(
		List<String> allowedTables,
		List<String> restrictedTables,
		List<String> excludedColumns,
		int maxRows,
		String softDeleteColumn,
		List<SoftDeleteFilter> softDeleteFilters,
		String currencySymbol
) {

	public QueryConstraints {
		allowedTables = allowedTables != null ? List.copyOf(allowedTables) : List.of();
		restrictedTables = restrictedTables != null ? List.copyOf(restrictedTables) : List.of();
		excludedColumns = excludedColumns != null ? List.copyOf(excludedColumns) : List.of();
		if (maxRows < 1) {
			throw new IllegalArgumentException("maxRows must be >= 1");
		}
		softDeleteFilters = softDeleteFilters != null && !softDeleteFilters.isEmpty()
				? List.copyOf(softDeleteFilters)
				: List.of(SoftDeleteFilter.IS_NULL);
		currencySymbol = currencySymbol != null ? currencySymbol : "$";
	}

	public static QueryConstraints from(Policy policy, PipelineSettings settings) {
		return new QueryConstraints(
				policy.allowAllTables() ? List.of() : policy.allowedTables().stream().sorted().toList(),
				policy.restrictedTables().stream().sorted().toList(),
				policy.excludedColumns().stream().sorted().toList(),
				policy.maxRows(),
				policy.softDeleteColumn(),
				List.copyOf(policy.softDeleteFilters()),
				settings.currencySymbol());
	}

	/**
	 * The predicates that exclude soft-deleted rows, e.g. {@code deleted_at IS NULL}.
	 */
	public String softDeletePredicate() {
		return softDeleteFilters.stream()
				.map(filter -> filter.describe(softDeleteColumn))
				.collect(Collectors.joining(" or "));
	}

	/**
	 * Renders the constraints as prompt lines.
	 */
	public String render() {
		return "Allowed tables: " + joinOr(allowedTables, "(any)")
				+ "\nRestricted tables: " + joinOr(restrictedTables, "(none)")
				+ "\nExcluded columns: " + joinOr(excludedColumns, "(none)")
				+ "\nMaximum rows (LIMIT): " + maxRows
				+ "\nSoft-delete column: " + softDeleteColumn + " (filter with " + softDeletePredicate() + ")"
				+ "\nCurrency symbol: " + currencySymbol
				+ " - use this symbol when formatting any monetary values (e.g., " + currencySymbol + "100.50)";
	}

	private static String joinOr(List<String> values, String fallback) {
		return values.isEmpty() ? fallback : String.join(", ", values);
	}
}
