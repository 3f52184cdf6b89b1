package org.javai.springai.safequery.guard;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import net.sf.jsqlparser.expression.Expression;
import net.sf.jsqlparser.expression.operators.relational.EqualsTo;
import net.sf.jsqlparser.expression.operators.relational.IsBooleanExpression;
import net.sf.jsqlparser.expression.operators.relational.IsNullExpression;
import net.sf.jsqlparser.schema.Column;
import org.javai.springai.safequery.generation.CandidateQuery;
import org.javai.springai.safequery.policy.Policy;
import org.javai.springai.safequery.policy.SoftDeleteFilter;
import org.javai.springai.safequery.schema.SchemaSnapshot;
import org.javai.springai.safequery.schema.TableInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides whether a candidate query may run.
 *
 * <p>Validation is pure: the same candidate, snapshot and policy always produce the same
 * verdict, and nothing is executed. Checks run in a fixed order and every breach found
 * is reported, so the generator can fix them all in one retry:</p>
 * <ol>
 *   <li>lexical read-only scan (keywords, several statements, comments)</li>
 *   <li>parse into a single SELECT</li>
 *   <li>table scope</li>
 *   <li>excluded columns</li>
 *   <li>outermost LIMIT</li>
 *   <li>soft-delete predicates per select block</li>
 * </ol>
 * <p>A statement that fails the read-only scan is never reported as merely malformed.</p>
 */
public class QueryGuard {

	private static final Logger logger = LoggerFactory.getLogger(QueryGuard.class);

	private static final Set<String> FALSE_LITERALS = Set.of("false", "0", "'f'", "'false'", "'n'", "'0'");

	public ValidationResult validate(CandidateQuery candidate, SchemaSnapshot snapshot, Policy policy) {
		Objects.requireNonNull(candidate, "candidate must not be null");
		Objects.requireNonNull(snapshot, "snapshot must not be null");
		Objects.requireNonNull(policy, "policy must not be null");

		if (candidate.isOutOfScope() || candidate.text().isBlank()) {
			return ValidationResult.rejected(List.of(new Violation(ViolationKind.MALFORMED, "no query text")));
		}

		List<Violation> violations = new ArrayList<>(ReadOnlyScanner.scan(candidate.text()));
		boolean lexicallyMutating = !violations.isEmpty();

		SqlShape shape;
		try {
			shape = SqlShape.parse(candidate.text());
		} catch (MalformedQueryException e) {
			if (!lexicallyMutating) {
				violations.add(new Violation(ViolationKind.MALFORMED, e.getMessage()));
			}
			return finish(candidate, violations);
		}

		if (!shape.isSelect()) {
			violations.add(new Violation(ViolationKind.NOT_READ_ONLY,
					"only SELECT statements are allowed, got " + shape.statementType()));
			return finish(candidate, violations);
		}
		if (lexicallyMutating) {
			return finish(candidate, violations);
		}

		if (!checkTables(shape, snapshot, policy, violations)) {
			return finish(candidate, violations);
		}
		checkColumns(shape, policy, violations);
		checkLimit(shape, policy, violations);
		checkSoftDelete(shape, snapshot, policy, violations);
		return finish(candidate, violations);
	}

	private ValidationResult finish(CandidateQuery candidate, List<Violation> violations) {
		if (violations.isEmpty()) {
			return ValidationResult.ok();
		}
		logger.debug("Rejected candidate query [{}]: {}", candidate.text(), violations);
		return ValidationResult.rejected(violations);
	}

	/**
	 * @return false when the statement reads no table at all, which ends validation
	 */
	private boolean checkTables(SqlShape shape, SchemaSnapshot snapshot, Policy policy, List<Violation> violations) {
		if (shape.tables().isEmpty()) {
			violations.add(new Violation(ViolationKind.MALFORMED, "the query reads no table"));
			return false;
		}
		// the snapshot only describes the introspected schema, under unqualified names
		for (String qualified : shape.qualifiedTables()) {
			violations.add(new Violation(ViolationKind.TABLE_NOT_ALLOWED,
					"table %s must be referenced without a schema prefix; use only %s"
							.formatted(qualified, snapshot.tableNames())));
		}
		for (String table : shape.tables()) {
			if (policy.isRestricted(table)) {
				violations.add(new Violation(ViolationKind.TABLE_RESTRICTED,
						"table %s is restricted".formatted(table)));
			} else if (!policy.isTableInScope(table) || !snapshot.containsTable(table)) {
				violations.add(new Violation(ViolationKind.TABLE_NOT_ALLOWED,
						"table %s is not available; use only %s".formatted(table, snapshot.tableNames())));
			}
		}
		return true;
	}

	private void checkColumns(SqlShape shape, Policy policy, List<Violation> violations) {
		Set<String> reported = new LinkedHashSet<>();
		for (SqlShape.ColumnReference column : shape.columns()) {
			if (!policy.isExcludedColumn(column.name())) {
				continue;
			}
			String table = shape.resolveQualifier(column.qualifier());
			String qualified = table != null ? table + "." + column.name() : column.name();
			if (reported.add(qualified.toLowerCase(Locale.ROOT))) {
				violations.add(new Violation(ViolationKind.COLUMN_EXCLUDED,
						"column %s is excluded and must not be referenced".formatted(qualified)));
			}
		}
	}

	private void checkLimit(SqlShape shape, Policy policy, List<Violation> violations) {
		if (!shape.hasLimit()) {
			violations.add(new Violation(ViolationKind.MISSING_LIMIT,
					"the outermost query must end with LIMIT n where n <= " + policy.maxRows()));
			return;
		}
		Long rowCount = shape.limitRowCount();
		if (rowCount == null) {
			violations.add(new Violation(ViolationKind.MISSING_LIMIT,
					"LIMIT must be a literal number <= " + policy.maxRows()));
		} else if (rowCount > policy.maxRows()) {
			violations.add(new Violation(ViolationKind.LIMIT_TOO_LARGE,
					"LIMIT %d exceeds the maximum of %d rows".formatted(rowCount, policy.maxRows())));
		}
	}

	private void checkSoftDelete(SqlShape shape, SchemaSnapshot snapshot, Policy policy, List<Violation> violations) {
		Set<String> reported = new LinkedHashSet<>();
		for (SqlShape.SelectBlock block : shape.blocks()) {
			List<SqlShape.TableReference> softTables = block.tables().stream()
					.filter(ref -> snapshot.findTable(ref.name()).map(TableInfo::hasSoftDelete).orElse(false))
					.toList();
			boolean unqualifiedOk = softTables.size() == 1;
			for (SqlShape.TableReference ref : softTables) {
				boolean filtered = block.whereConjuncts().stream()
						.anyMatch(c -> excludesDeleted(c, ref, unqualifiedOk, policy))
						|| ref.onConjuncts().stream()
						.anyMatch(c -> excludesDeleted(c, ref, unqualifiedOk, policy));
				String label = ref.alias() != null ? ref.name() + " " + ref.alias() : ref.name();
				if (!filtered && reported.add(label.toLowerCase(Locale.ROOT))) {
					String column = ref.alias() != null ? ref.alias() + "." + policy.softDeleteColumn()
							: policy.softDeleteColumn();
					violations.add(new Violation(ViolationKind.MISSING_SOFT_DELETE_FILTER,
							"table %s must be filtered with %s".formatted(ref.name(),
									policy.softDeleteFilters().iterator().next().describe(column))));
				}
			}
		}
	}

	private boolean excludesDeleted(Expression conjunct, SqlShape.TableReference ref, boolean unqualifiedOk,
			Policy policy) {
		for (SoftDeleteFilter filter : policy.softDeleteFilters()) {
			boolean matches = switch (filter) {
				case IS_NULL -> conjunct instanceof IsNullExpression isNull
						&& !isNull.isNot()
						&& targets(isNull.getLeftExpression(), ref, unqualifiedOk, policy);
				case IS_FALSE -> conjunct instanceof IsBooleanExpression isBoolean
						&& isBoolean.isTrue() == isBoolean.isNot()
						&& targets(isBoolean.getLeftExpression(), ref, unqualifiedOk, policy);
				case EQUALS_FALSE -> conjunct instanceof EqualsTo equals
						&& ((targets(equals.getLeftExpression(), ref, unqualifiedOk, policy)
								&& isFalseLiteral(equals.getRightExpression()))
						|| (targets(equals.getRightExpression(), ref, unqualifiedOk, policy)
								&& isFalseLiteral(equals.getLeftExpression())));
			};
			if (matches) {
				return true;
			}
		}
		return false;
	}

	private boolean targets(Expression expression, SqlShape.TableReference ref, boolean unqualifiedOk, Policy policy) {
		if (!(expression instanceof Column column)) {
			return false;
		}
		if (!policy.isSoftDeleteColumn(SqlShape.unquote(column.getColumnName()))) {
			return false;
		}
		String qualifier = column.getTable() != null && column.getTable().getName() != null
				? SqlShape.unquote(column.getTable().getName())
				: null;
		return qualifier == null ? unqualifiedOk : ref.answersTo(qualifier);
	}

	// FALSE may come back from the parser as a column named false, so compare text
	private static boolean isFalseLiteral(Expression expression) {
		return expression != null && FALSE_LITERALS.contains(expression.toString().trim().toLowerCase(Locale.ROOT));
	}
}
