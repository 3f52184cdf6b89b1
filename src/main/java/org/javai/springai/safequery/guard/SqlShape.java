package org.javai.springai.safequery.guard;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.sf.jsqlparser.JSQLParserException;
import net.sf.jsqlparser.expression.AnalyticExpression;
import net.sf.jsqlparser.expression.Expression;
import net.sf.jsqlparser.expression.LongValue;
import net.sf.jsqlparser.expression.Parenthesis;
import net.sf.jsqlparser.expression.operators.conditional.AndExpression;
import net.sf.jsqlparser.parser.CCJSqlParserUtil;
import net.sf.jsqlparser.schema.Column;
import net.sf.jsqlparser.schema.Table;
import net.sf.jsqlparser.statement.Statement;
import net.sf.jsqlparser.statement.select.GroupByElement;
import net.sf.jsqlparser.statement.select.Join;
import net.sf.jsqlparser.statement.select.Limit;
import net.sf.jsqlparser.statement.select.OrderByElement;
import net.sf.jsqlparser.statement.select.ParenthesedSelect;
import net.sf.jsqlparser.statement.select.PlainSelect;
import net.sf.jsqlparser.statement.select.Select;
import net.sf.jsqlparser.statement.select.SetOperationList;
import net.sf.jsqlparser.util.TablesNamesFinder;

/**
 * Structural facts about one parsed SQL statement, as far as the guard needs them.
 *
 * <p>Table names are reported unquoted and without a schema prefix; names that were
 * written with a prefix are also listed as written. Column references keep their
 * qualifier (table name or alias) when one was written.</p>
 */
public final class SqlShape {

	private final Statement statement;
	private final Set<String> tables;
	private final Set<String> qualifiedTables;
	private final List<ColumnReference> columns;
	private final Map<String, String> aliases;
	private final List<SelectBlock> blocks;
	private final Limit limit;

	private SqlShape(Statement statement, Set<String> tables, Set<String> qualifiedTables,
			List<ColumnReference> columns, Map<String, String> aliases, List<SelectBlock> blocks, Limit limit) {
		this.statement = statement;
		this.tables = tables;
		this.qualifiedTables = qualifiedTables;
		this.columns = columns;
		this.aliases = aliases;
		this.blocks = blocks;
		this.limit = limit;
	}

	/**
	 * Parses one statement.
	 *
	 * @throws MalformedQueryException when the text is blank or does not parse
	 */
	public static SqlShape parse(String sql) {
		if (sql == null || sql.isBlank()) {
			throw new MalformedQueryException("SQL string cannot be null or blank");
		}
		Statement stmt;
		try {
			stmt = CCJSqlParserUtil.parse(sql);
		} catch (JSQLParserException e) {
			throw new MalformedQueryException("Invalid SQL syntax: " + firstLine(e.getMessage()), e);
		}
		if (!(stmt instanceof Select select)) {
			return new SqlShape(stmt, Set.of(), Set.of(), List.of(), Map.of(), List.of(), null);
		}

		ReferenceCollector collector = new ReferenceCollector();
		// Cast to Statement to resolve method ambiguity in JSqlParser
		Set<String> found = collector.getTables((Statement) select);
		// clauses the table finder skips; may reveal further subqueries, hence the index loop
		for (int i = 0; i < collector.plainSelects.size(); i++) {
			collector.visitSkippedClauses(collector.plainSelects.get(i));
		}

		Set<String> tables = new LinkedHashSet<>();
		for (String name : found) {
			tables.add(bareName(name));
		}
		List<SelectBlock> blocks = collector.plainSelects.stream()
				.map(SqlShape::toBlock)
				.toList();
		return new SqlShape(stmt, tables, Set.copyOf(collector.qualifiedTables), List.copyOf(collector.columns),
				Map.copyOf(collector.aliases), blocks, outerLimit(select));
	}

	public boolean isSelect() {
		return statement instanceof Select;
	}

	public String statementType() {
		return statement.getClass().getSimpleName();
	}

	/**
	 * Every table the statement reads, CTE names excluded.
	 */
	public Set<String> tables() {
		return tables;
	}

	/**
	 * Table names written with a schema or catalog prefix, as written.
	 */
	public Set<String> qualifiedTables() {
		return qualifiedTables;
	}

	public List<ColumnReference> columns() {
		return columns;
	}

	/**
	 * Resolves a column qualifier (alias or table name) to the table name it stands for.
	 *
	 * @return the table name, or {@code null} when the qualifier is unknown
	 */
	public String resolveQualifier(String qualifier) {
		if (qualifier == null) {
			return null;
		}
		return aliases.get(qualifier.toLowerCase());
	}

	public List<SelectBlock> blocks() {
		return blocks;
	}

	public boolean hasLimit() {
		return limit != null && !limit.isLimitAll() && limit.getRowCount() != null;
	}

	/**
	 * Numeric row count of the outermost LIMIT.
	 *
	 * @return the row count, or {@code null} when absent or not a literal number
	 */
	public Long limitRowCount() {
		if (!hasLimit()) {
			return null;
		}
		Expression rowCount = limit.getRowCount();
		if (rowCount instanceof LongValue value) {
			return value.getValue();
		}
		return null;
	}

	/**
	 * Splits an expression into its top-level AND conjuncts, unwrapping parentheses.
	 */
	static List<Expression> conjuncts(Expression expression) {
		List<Expression> out = new ArrayList<>();
		collectConjuncts(expression, out);
		return out;
	}

	private static void collectConjuncts(Expression expression, List<Expression> out) {
		if (expression == null) {
			return;
		}
		if (expression instanceof Parenthesis parenthesis) {
			collectConjuncts(parenthesis.getExpression(), out);
		} else if (expression instanceof AndExpression and) {
			collectConjuncts(and.getLeftExpression(), out);
			collectConjuncts(and.getRightExpression(), out);
		} else {
			out.add(expression);
		}
	}

	private static SelectBlock toBlock(PlainSelect plainSelect) {
		List<TableReference> refs = new ArrayList<>();
		if (plainSelect.getFromItem() instanceof Table fromTable) {
			refs.add(toReference(fromTable, List.of()));
		}
		if (plainSelect.getJoins() != null) {
			for (Join join : plainSelect.getJoins()) {
				if (join.getRightItem() instanceof Table joinTable) {
					refs.add(toReference(joinTable, onConjuncts(join.getOnExpressions())));
				}
			}
		}
		return new SelectBlock(List.copyOf(refs), conjuncts(plainSelect.getWhere()));
	}

	private static List<Expression> onConjuncts(Collection<Expression> onExpressions) {
		if (onExpressions == null) {
			return List.of();
		}
		List<Expression> out = new ArrayList<>();
		for (Expression expression : onExpressions) {
			collectConjuncts(expression, out);
		}
		return out;
	}

	private static TableReference toReference(Table table, List<Expression> onConjuncts) {
		String alias = table.getAlias() != null ? unquote(table.getAlias().getName()) : null;
		return new TableReference(bareName(table.getName()), alias, onConjuncts);
	}

	private static Limit outerLimit(Select select) {
		if (select instanceof PlainSelect plainSelect) {
			return plainSelect.getLimit();
		}
		if (select instanceof SetOperationList setOperations) {
			return setOperations.getLimit();
		}
		if (select instanceof ParenthesedSelect parenthesed && parenthesed.getSelect() != null) {
			return outerLimit(parenthesed.getSelect());
		}
		return null;
	}

	/**
	 * Strips quoting and any schema or catalog prefix from a table name.
	 */
	static String bareName(String name) {
		if (name == null) {
			return null;
		}
		String trimmed = name.trim();
		int dot = trimmed.lastIndexOf('.');
		if (dot >= 0 && dot < trimmed.length() - 1) {
			trimmed = trimmed.substring(dot + 1);
		}
		return unquote(trimmed);
	}

	static String unquote(String name) {
		if (name == null || name.length() < 2) {
			return name;
		}
		char first = name.charAt(0);
		char last = name.charAt(name.length() - 1);
		if ((first == '"' && last == '"') || (first == '`' && last == '`') || (first == '[' && last == ']')) {
			return name.substring(1, name.length() - 1);
		}
		return name;
	}

	private static String firstLine(String message) {
		if (message == null) {
			return "unparseable statement";
		}
		int newline = message.indexOf('\n');
		return newline > 0 ? message.substring(0, newline).trim() : message.trim();
	}

	/**
	 * A column as written in the query.
	 *
	 * @param qualifier table name or alias in front of the column, or {@code null}
	 * @param name unquoted column name
	 */
	public record ColumnReference(String qualifier, String name) {
	}

	/**
	 * A physical table read by a select block.
	 *
	 * @param name unquoted table name without schema
	 * @param alias alias, or {@code null}
	 * @param onConjuncts top-level AND conjuncts of the join condition, empty for the FROM table
	 */
	public record TableReference(String name, String alias, List<Expression> onConjuncts) {

		boolean answersTo(String qualifier) {
			return qualifier != null
					&& (qualifier.equalsIgnoreCase(name) || (alias != null && qualifier.equalsIgnoreCase(alias)));
		}
	}

	/**
	 * One SELECT ... FROM ... WHERE block: the outer query, a subquery, a CTE body or a
	 * branch of a set operation.
	 */
	public record SelectBlock(List<TableReference> tables, List<Expression> whereConjuncts) {
	}

	private static final class ReferenceCollector extends TablesNamesFinder {

		private final List<ColumnReference> columns = new ArrayList<>();
		private final List<PlainSelect> plainSelects = new ArrayList<>();
		private final Map<String, String> aliases = new HashMap<>();
		private final Set<String> qualifiedTables = new LinkedHashSet<>();

		void visitSkippedClauses(PlainSelect plainSelect) {
			GroupByElement groupBy = plainSelect.getGroupBy();
			if (groupBy != null && groupBy.getGroupByExpressionList() != null) {
				groupBy.getGroupByExpressionList().accept(this);
			}
			if (plainSelect.getHaving() != null) {
				plainSelect.getHaving().accept(this);
			}
			if (plainSelect.getJoins() != null) {
				for (Join join : plainSelect.getJoins()) {
					if (join.getUsingColumns() != null) {
						for (Column column : join.getUsingColumns()) {
							column.accept(this);
						}
					}
				}
			}
			visitOrderBy(plainSelect.getOrderByElements());
		}

		private void visitOrderBy(List<OrderByElement> elements) {
			if (elements == null) {
				return;
			}
			for (OrderByElement element : elements) {
				element.getExpression().accept(this);
			}
		}

		@Override
		public void visit(AnalyticExpression analytic) {
			super.visit(analytic);
			if (analytic.getPartitionExpressionList() != null) {
				analytic.getPartitionExpressionList().accept(this);
			}
			visitOrderBy(analytic.getOrderByElements());
		}

		@Override
		public void visit(PlainSelect plainSelect) {
			plainSelects.add(plainSelect);
			super.visit(plainSelect);
		}

		@Override
		public void visit(Table table) {
			String name = bareName(table.getName());
			String written = table.getFullyQualifiedName();
			if (name != null && written != null && !written.equals(table.getName())) {
				qualifiedTables.add(written);
			}
			if (name != null) {
				aliases.putIfAbsent(name.toLowerCase(), name);
				if (table.getAlias() != null && table.getAlias().getName() != null) {
					aliases.put(unquote(table.getAlias().getName()).toLowerCase(), name);
				}
			}
			super.visit(table);
		}

		@Override
		public void visit(Column column) {
			String qualifier = column.getTable() != null && column.getTable().getName() != null
					? unquote(column.getTable().getName())
					: null;
			columns.add(new ColumnReference(qualifier, unquote(column.getColumnName())));
			super.visit(column);
		}
	}
}
