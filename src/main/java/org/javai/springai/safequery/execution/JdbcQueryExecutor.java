package org.javai.springai.safequery.execution;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link QueryExecutor} over a caller-supplied {@link DataSource}.
 *
 * <p>Each call borrows a connection, marks it read-only, runs the query inside a
 * transaction that is always rolled back, and caps the rows at {@code maxRows + 1}
 * both on the statement and while reading.</p>
 */
public class JdbcQueryExecutor implements QueryExecutor {

	private static final Logger logger = LoggerFactory.getLogger(JdbcQueryExecutor.class);

	private static final int MAX_FETCH_SIZE = 100;

	private final DataSource dataSource;

	public JdbcQueryExecutor(DataSource dataSource) {
		this.dataSource = Objects.requireNonNull(dataSource, "dataSource must not be null");
	}

	@Override
	public ExecutionResult execute(String sql, int maxRows, Duration timeout) {
		Objects.requireNonNull(sql, "sql must not be null");
		if (maxRows < 1) {
			throw new IllegalArgumentException("maxRows must be >= 1");
		}
		int rowCap = maxRows + 1;
		long started = System.nanoTime();
		try (Connection conn = dataSource.getConnection()) {
			conn.setReadOnly(true);
			conn.setAutoCommit(false);
			try (Statement stmt = conn.createStatement()) {
				stmt.setMaxRows(rowCap);
				stmt.setFetchSize(Math.min(rowCap, MAX_FETCH_SIZE));
				if (timeout != null) {
					stmt.setQueryTimeout(toSeconds(timeout));
				}
				List<Map<String, Object>> rows;
				try (ResultSet rs = stmt.executeQuery(sql)) {
					rows = readRows(rs, rowCap);
				}
				ExecutionResult result = ExecutionResult.fromProbe(rows, maxRows);
				logger.info("Query returned {} rows (truncated={}) in {} ms",
						result.rowCount(), result.truncated(), (System.nanoTime() - started) / 1_000_000);
				return result;
			} finally {
				conn.rollback();
			}
		} catch (SQLException e) {
			throw new QueryExecutionException("Query execution failed: " + e.getMessage(), e);
		}
	}

	private static List<Map<String, Object>> readRows(ResultSet rs, int rowCap) throws SQLException {
		ResultSetMetaData meta = rs.getMetaData();
		int columnCount = meta.getColumnCount();
		List<String> labels = new ArrayList<>(columnCount);
		for (int i = 1; i <= columnCount; i++) {
			String label = meta.getColumnLabel(i);
			labels.add(label != null && !label.isBlank() ? label : meta.getColumnName(i));
		}
		List<Map<String, Object>> rows = new ArrayList<>();
		while (rows.size() < rowCap && rs.next()) {
			Map<String, Object> row = new LinkedHashMap<>();
			for (int i = 1; i <= columnCount; i++) {
				row.put(labels.get(i - 1), rs.getObject(i));
			}
			rows.add(row);
		}
		return rows;
	}

	private static int toSeconds(Duration timeout) {
		long seconds = (timeout.toMillis() + 999) / 1000;
		return (int) Math.max(1, Math.min(Integer.MAX_VALUE, seconds));
	}
}
