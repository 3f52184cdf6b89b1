package org.javai.springai.safequery.guard;

import static org.assertj.core.api.Assertions.assertThat;
import java.util.List;
import org.javai.springai.safequery.generation.CandidateQuery;
import org.javai.springai.safequery.policy.Policy;
import org.javai.springai.safequery.policy.SoftDeleteFilter;
import org.javai.springai.safequery.schema.ColumnInfo;
import org.javai.springai.safequery.schema.SchemaSnapshot;
import org.javai.springai.safequery.schema.TableInfo;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class QueryGuardTest {

	private static final SchemaSnapshot SNAPSHOT = SchemaSnapshot.of("PostgreSQL", List.of(
			new TableInfo("products", List.of(
					new ColumnInfo("id", "integer", false),
					new ColumnInfo("name", "varchar", true),
					new ColumnInfo("price", "numeric", true),
					new ColumnInfo("deleted_at", "timestamp", true)), true),
			new TableInfo("orders", List.of(
					new ColumnInfo("id", "integer", false),
					new ColumnInfo("customer_id", "integer", false),
					new ColumnInfo("total", "numeric", true),
					new ColumnInfo("status", "varchar", true),
					new ColumnInfo("deleted_at", "timestamp", true)), true),
			new TableInfo("customers", List.of(
					new ColumnInfo("id", "integer", false),
					new ColumnInfo("name", "varchar", true),
					new ColumnInfo("updated_at", "timestamp", true)), false)));

	private static final Policy POLICY = Policy.builder()
			.restrictTables("admin_logs")
			.excludeColumns("password_hash")
			.maxRows(100)
			.build();

	private final QueryGuard guard = new QueryGuard();

	private ValidationResult validate(String sql) {
		return guard.validate(CandidateQuery.ok(sql), SNAPSHOT, POLICY);
	}

	private ValidationResult validate(String sql, Policy policy) {
		return guard.validate(CandidateQuery.ok(sql), SNAPSHOT, policy);
	}

	private static List<ViolationKind> kinds(ValidationResult result) {
		return result.violations().stream().map(Violation::kind).toList();
	}

	@Nested
	@DisplayName("Accepted queries")
	class Accepted {

		@Test
		@DisplayName("accepts a bounded, filtered SELECT")
		void acceptsSimpleSelect() {
			ValidationResult result = validate("SELECT id, name FROM products WHERE deleted_at IS NULL LIMIT 10");

			assertThat(result.accepted()).isTrue();
			assertThat(result.violations()).isEmpty();
		}

		@Test
		@DisplayName("accepts LIMIT equal to the maximum")
		void acceptsLimitAtMaximum() {
			assertThat(validate("SELECT id FROM customers LIMIT 100").accepted()).isTrue();
		}

		@Test
		@DisplayName("keywords inside string literals are ignored")
		void keywordInLiteral() {
			ValidationResult result = validate(
					"SELECT id FROM products WHERE name = 'please delete me; drop it' AND deleted_at IS NULL LIMIT 5");

			assertThat(result.accepted()).isTrue();
		}

		@Test
		@DisplayName("column names containing keywords are not mistaken for keywords")
		void keywordPrefixedColumn() {
			assertThat(validate("SELECT id, updated_at FROM customers ORDER BY updated_at DESC LIMIT 5").accepted())
					.isTrue();
		}

		@Test
		@DisplayName("a trailing semicolon is allowed")
		void trailingSemicolon() {
			assertThat(validate("SELECT id FROM customers LIMIT 5;").accepted()).isTrue();
		}

		@Test
		@DisplayName("quoted identifiers resolve to snapshot tables")
		void quotedNames() {
			assertThat(validate("SELECT \"name\" FROM \"products\" WHERE \"deleted_at\" IS NULL LIMIT 5").accepted())
					.isTrue();
		}

		@Test
		@DisplayName("joins pass when each soft-delete table is filtered")
		void filteredJoin() {
			ValidationResult result = validate("""
					SELECT o.id, c.name FROM orders o
					JOIN customers c ON o.customer_id = c.id
					WHERE o.deleted_at IS NULL AND o.status = 'open'
					LIMIT 10""");

			assertThat(result.accepted()).isTrue();
		}

		@Test
		@DisplayName("an unqualified filter counts when one soft-delete table is in the block")
		void unqualifiedFilterSingleSoftTable() {
			ValidationResult result = validate("""
					SELECT o.id FROM orders o JOIN customers c ON o.customer_id = c.id
					WHERE deleted_at IS NULL LIMIT 10""");

			assertThat(result.accepted()).isTrue();
		}

		@Test
		@DisplayName("a filter in the join condition counts for the joined table")
		void filterInJoinCondition() {
			ValidationResult result = validate("""
					SELECT c.name, o.total FROM customers c
					JOIN orders o ON o.customer_id = c.id AND o.deleted_at IS NULL
					LIMIT 10""");

			assertThat(result.accepted()).isTrue();
		}

		@Test
		@DisplayName("aggregates with a limit are accepted")
		void aggregate() {
			assertThat(validate("SELECT COUNT(*) FROM orders WHERE deleted_at IS NULL LIMIT 1").accepted()).isTrue();
		}
	}

	@Nested
	@DisplayName("Read-only enforcement")
	class ReadOnly {

		@Test
		@DisplayName("a DELETE is NOT_READ_ONLY and never merely MALFORMED")
		void delete() {
			ValidationResult result = validate("DELETE FROM orders");

			assertThat(result.accepted()).isFalse();
			assertThat(kinds(result)).isNotEmpty().containsOnly(ViolationKind.NOT_READ_ONLY);
		}

		@Test
		@DisplayName("mutation statements are rejected")
		void mutations() {
			for (String sql : List.of(
					"UPDATE orders SET status = 'x'",
					"INSERT INTO orders (id) VALUES (1)",
					"DROP TABLE orders",
					"TRUNCATE orders",
					"ALTER TABLE orders ADD COLUMN x int",
					"GRANT SELECT ON orders TO public")) {
				ValidationResult result = validate(sql);
				assertThat(kinds(result)).as(sql).isNotEmpty().containsOnly(ViolationKind.NOT_READ_ONLY);
			}
		}

		@Test
		@DisplayName("a second statement is rejected")
		void stackedStatements() {
			ValidationResult result = validate("SELECT id FROM customers LIMIT 5; DROP TABLE customers");

			assertThat(kinds(result)).isNotEmpty().containsOnly(ViolationKind.NOT_READ_ONLY);
		}

		@Test
		@DisplayName("SELECT INTO is rejected")
		void selectInto() {
			ValidationResult result = validate("SELECT * INTO backup FROM customers LIMIT 5");

			assertThat(kinds(result)).contains(ViolationKind.NOT_READ_ONLY);
		}

		@Test
		@DisplayName("comments are rejected")
		void comments() {
			assertThat(kinds(validate("SELECT id FROM customers LIMIT 5 -- trailing")))
					.containsOnly(ViolationKind.NOT_READ_ONLY);
			assertThat(kinds(validate("SELECT id /* hidden */ FROM customers LIMIT 5")))
					.containsOnly(ViolationKind.NOT_READ_ONLY);
		}
	}

	@Nested
	@DisplayName("Table scope")
	class TableScope {

		@Test
		@DisplayName("a restricted table is TABLE_RESTRICTED")
		void restrictedTable() {
			ValidationResult result = validate("SELECT * FROM admin_logs LIMIT 10");

			assertThat(kinds(result)).containsExactly(ViolationKind.TABLE_RESTRICTED);
			assertThat(result.violations().get(0).detail()).contains("admin_logs");
		}

		@Test
		@DisplayName("a table missing from the snapshot is TABLE_NOT_ALLOWED")
		void unknownTable() {
			ValidationResult result = validate("SELECT * FROM suppliers LIMIT 10");

			assertThat(kinds(result)).containsExactly(ViolationKind.TABLE_NOT_ALLOWED);
			assertThat(result.violations().get(0).detail()).contains("suppliers");
		}

		@Test
		@DisplayName("a schema prefix is TABLE_NOT_ALLOWED even when the bare name is in the snapshot")
		void schemaPrefix() {
			ValidationResult result = validate("SELECT id FROM secret_schema.customers LIMIT 10");

			assertThat(kinds(result)).containsExactly(ViolationKind.TABLE_NOT_ALLOWED);
			assertThat(result.violations().get(0).detail()).contains("secret_schema.customers");
			assertThat(kinds(validate("SELECT \"name\" FROM public.\"products\" WHERE \"deleted_at\" IS NULL LIMIT 5")))
					.containsExactly(ViolationKind.TABLE_NOT_ALLOWED);
		}

		@Test
		@DisplayName("tables in subqueries are checked")
		void tableInSubquery() {
			ValidationResult result = validate(
					"SELECT id FROM customers WHERE id IN (SELECT user_id FROM admin_logs) LIMIT 10");

			assertThat(kinds(result)).contains(ViolationKind.TABLE_RESTRICTED);
		}
	}

	@Nested
	@DisplayName("Excluded columns")
	class ExcludedColumns {

		@Test
		@DisplayName("an excluded column in the select list is rejected")
		void inSelectList() {
			ValidationResult result = validate("SELECT id, password_hash FROM customers LIMIT 5");

			assertThat(kinds(result)).containsExactly(ViolationKind.COLUMN_EXCLUDED);
		}

		@Test
		@DisplayName("the owning table is named when the qualifier resolves")
		void qualifiedColumn() {
			ValidationResult result = validate("SELECT c.password_hash FROM customers c LIMIT 5");

			assertThat(result.violations()).singleElement()
					.satisfies(v -> assertThat(v.detail()).contains("customers.password_hash"));
		}

		@Test
		@DisplayName("excluded columns in WHERE and ORDER BY are rejected")
		void inWhereAndOrderBy() {
			assertThat(kinds(validate("SELECT id FROM customers WHERE password_hash = 'x' LIMIT 5")))
					.containsExactly(ViolationKind.COLUMN_EXCLUDED);
			assertThat(kinds(validate("SELECT id FROM customers ORDER BY password_hash LIMIT 5")))
					.containsExactly(ViolationKind.COLUMN_EXCLUDED);
		}

		@Test
		@DisplayName("excluded columns in GROUP BY and HAVING are rejected")
		void inGroupByAndHaving() {
			assertThat(kinds(validate("SELECT COUNT(*) FROM customers GROUP BY password_hash LIMIT 5")))
					.containsExactly(ViolationKind.COLUMN_EXCLUDED);
			assertThat(kinds(validate(
					"SELECT name FROM customers GROUP BY name HAVING MAX(password_hash) > 'a' LIMIT 5")))
					.containsExactly(ViolationKind.COLUMN_EXCLUDED);
		}

		@Test
		@DisplayName("excluded columns in JOIN ... USING are rejected")
		void inJoinUsing() {
			ValidationResult result = validate("""
					SELECT c.id FROM customers c JOIN orders o USING (password_hash)
					WHERE o.deleted_at IS NULL LIMIT 5""");

			assertThat(kinds(result)).containsExactly(ViolationKind.COLUMN_EXCLUDED);
		}

		@Test
		@DisplayName("excluded columns in window ordering and partitioning are rejected")
		void inWindow() {
			assertThat(kinds(validate("SELECT id, row_number() OVER (ORDER BY password_hash) FROM customers LIMIT 5")))
					.containsExactly(ViolationKind.COLUMN_EXCLUDED);
			assertThat(kinds(validate(
					"SELECT id, rank() OVER (PARTITION BY password_hash ORDER BY id) FROM customers LIMIT 5")))
					.containsExactly(ViolationKind.COLUMN_EXCLUDED);
		}

		@Test
		@DisplayName("wildcards are allowed")
		void wildcard() {
			assertThat(validate("SELECT * FROM customers LIMIT 5").accepted()).isTrue();
		}
	}

	@Nested
	@DisplayName("Row limit")
	class RowLimit {

		@Test
		@DisplayName("a query without LIMIT is MISSING_LIMIT")
		void missing() {
			assertThat(kinds(validate("SELECT id FROM customers"))).containsExactly(ViolationKind.MISSING_LIMIT);
		}

		@Test
		@DisplayName("a LIMIT above the maximum is LIMIT_TOO_LARGE")
		void tooLarge() {
			ValidationResult result = validate("SELECT id FROM customers LIMIT 500");

			assertThat(kinds(result)).containsExactly(ViolationKind.LIMIT_TOO_LARGE);
			assertThat(result.violations().get(0).detail()).contains("500").contains("100");
		}

		@Test
		@DisplayName("only the outermost query's LIMIT counts")
		void innerLimitDoesNotCount() {
			ValidationResult result = validate(
					"SELECT id FROM customers WHERE id IN (SELECT customer_id FROM orders WHERE deleted_at IS NULL LIMIT 5)");

			assertThat(kinds(result)).containsExactly(ViolationKind.MISSING_LIMIT);
		}
	}

	@Nested
	@DisplayName("Soft delete")
	class SoftDelete {

		@Test
		@DisplayName("a soft-delete table without filter is rejected")
		void missingFilter() {
			ValidationResult result = validate("SELECT id FROM orders LIMIT 10");

			assertThat(kinds(result)).containsExactly(ViolationKind.MISSING_SOFT_DELETE_FILTER);
			assertThat(result.violations().get(0).detail()).contains("orders").contains("deleted_at IS NULL");
		}

		@Test
		@DisplayName("a filter under OR does not count")
		void filterUnderOr() {
			assertThat(kinds(validate("SELECT id FROM orders WHERE deleted_at IS NULL OR status = 'x' LIMIT 10")))
					.containsExactly(ViolationKind.MISSING_SOFT_DELETE_FILTER);
		}

		@Test
		@DisplayName("IS NOT NULL does not count")
		void isNotNull() {
			assertThat(kinds(validate("SELECT id FROM orders WHERE deleted_at IS NOT NULL LIMIT 10")))
					.containsExactly(ViolationKind.MISSING_SOFT_DELETE_FILTER);
		}

		@Test
		@DisplayName("each soft-delete table in a join needs its own filter")
		void joinNeedsFilterPerTable() {
			ValidationResult result = validate("""
					SELECT o.id, p.name FROM orders o JOIN products p ON p.id = o.id
					WHERE o.deleted_at IS NULL LIMIT 10""");

			assertThat(result.violations()).singleElement()
					.satisfies(v -> {
						assertThat(v.kind()).isEqualTo(ViolationKind.MISSING_SOFT_DELETE_FILTER);
						assertThat(v.detail()).contains("products");
					});
		}

		@Test
		@DisplayName("an unqualified filter is ambiguous with two soft-delete tables")
		void ambiguousUnqualifiedFilter() {
			ValidationResult result = validate("""
					SELECT o.id FROM orders o JOIN products p ON p.id = o.id
					WHERE deleted_at IS NULL LIMIT 10""");

			assertThat(kinds(result)).containsExactly(
					ViolationKind.MISSING_SOFT_DELETE_FILTER, ViolationKind.MISSING_SOFT_DELETE_FILTER);
		}

		@Test
		@DisplayName("subqueries are checked in their own block")
		void subqueryBlock() {
			ValidationResult result = validate(
					"SELECT name FROM customers WHERE id IN (SELECT customer_id FROM orders) LIMIT 10");

			assertThat(kinds(result)).containsExactly(ViolationKind.MISSING_SOFT_DELETE_FILTER);
		}

		@Test
		@DisplayName("boolean filters are accepted when the policy allows them")
		void booleanFilters() {
			Policy booleanPolicy = Policy.builder()
					.softDeleteFilters(SoftDeleteFilter.IS_FALSE, SoftDeleteFilter.EQUALS_FALSE)
					.build();

			assertThat(validate("SELECT id FROM orders WHERE deleted_at = 0 LIMIT 10", booleanPolicy).accepted())
					.isTrue();
			assertThat(validate("SELECT id FROM orders WHERE deleted_at IS FALSE LIMIT 10", booleanPolicy).accepted())
					.isTrue();
			assertThat(validate("SELECT id FROM orders WHERE deleted_at IS NULL LIMIT 10", booleanPolicy).accepted())
					.isFalse();
		}

		@Test
		@DisplayName("boolean filters do not satisfy the default policy")
		void booleanFilterWithDefaultPolicy() {
			assertThat(kinds(validate("SELECT id FROM orders WHERE deleted_at = 0 LIMIT 10")))
					.containsExactly(ViolationKind.MISSING_SOFT_DELETE_FILTER);
		}
	}

	@Nested
	@DisplayName("Malformed and combined")
	class MalformedAndCombined {

		@Test
		@DisplayName("unparseable text is MALFORMED only")
		void malformed() {
			ValidationResult result = validate("this is not sql at all");

			assertThat(kinds(result)).containsExactly(ViolationKind.MALFORMED);
		}

		@Test
		@DisplayName("a statement without a table is MALFORMED only")
		void noTable() {
			ValidationResult result = validate("SELECT password_hash");

			assertThat(kinds(result)).containsExactly(ViolationKind.MALFORMED);
		}

		@Test
		@DisplayName("an out-of-scope candidate has nothing to validate")
		void outOfScopeCandidate() {
			ValidationResult result = guard.validate(CandidateQuery.outOfScope("off_topic"), SNAPSHOT, POLICY);

			assertThat(kinds(result)).containsExactly(ViolationKind.MALFORMED);
		}

		@Test
		@DisplayName("all violations are reported in check order")
		void combined() {
			ValidationResult result = validate("SELECT o.id, c.password_hash FROM orders o JOIN customers c ON c.id = o.customer_id");

			assertThat(kinds(result)).containsExactly(
					ViolationKind.COLUMN_EXCLUDED,
					ViolationKind.MISSING_LIMIT,
					ViolationKind.MISSING_SOFT_DELETE_FILTER);
		}

		@Test
		@DisplayName("validation is deterministic")
		void deterministic() {
			String sql = "SELECT password_hash FROM admin_logs";

			assertThat(validate(sql)).isEqualTo(validate(sql));
		}
	}
}
