package org.javai.springai.safequery.generation;

import java.util.List;
import org.javai.springai.safequery.guard.MalformedQueryException;
import org.javai.springai.safequery.guard.SqlShape;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A query proposed by the generator. Untrusted until the guard accepts it.
 *
 * @param text the query text, empty when the generator declined
 * @param targetTables tables the query appears to read (best effort, informational)
 * @param limitRowCount row count of the outermost LIMIT, or {@code null} when absent or not a number
 * @param status whether the generator produced a query or declined
 * @param scopeReason why the generator declined, e.g. {@code off_topic}; {@code null} when OK
 */
public record CandidateQuery(String text, List<String> targetTables, Long limitRowCount,
		Status status, String scopeReason) {

	private static final Logger logger = LoggerFactory.getLogger(CandidateQuery.class);

	public static final String OFF_TOPIC = "off_topic";
	public static final String TOO_MANY_ITEMS = "too_many_items";

	public enum Status {
		OK,
		OUT_OF_SCOPE
	}

	public CandidateQuery {
		text = text != null ? text.strip() : "";
		targetTables = targetTables != null ? List.copyOf(targetTables) : List.of();
		if (status == null) {
			throw new IllegalArgumentException("status must not be null");
		}
		if (status == Status.OK && text.isEmpty()) {
			throw new IllegalArgumentException("an OK candidate needs query text");
		}
		if (status == Status.OUT_OF_SCOPE && (scopeReason == null || scopeReason.isBlank())) {
			scopeReason = OFF_TOPIC;
		}
	}

	/**
	 * Candidate with query text. Tables and limit are filled in when the text parses.
	 */
	public static CandidateQuery ok(String sql) {
		List<String> tables = List.of();
		Long limit = null;
		try {
			SqlShape shape = SqlShape.parse(sql);
			tables = List.copyOf(shape.tables());
			limit = shape.limitRowCount();
		} catch (MalformedQueryException e) {
			logger.debug("Candidate text does not parse, leaving metadata empty: {}", e.getMessage());
		}
		return new CandidateQuery(sql, tables, limit, Status.OK, null);
	}

	public static CandidateQuery outOfScope(String reason) {
		return new CandidateQuery("", List.of(), null, Status.OUT_OF_SCOPE, reason);
	}

	public boolean isOutOfScope() {
		return status == Status.OUT_OF_SCOPE;
	}
}
