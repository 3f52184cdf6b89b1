package org.javai.springai.safequery.audit;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import org.javai.springai.safequery.QueryRecord;

/**
 * Keeps records in memory, in arrival order.
 */
public class InMemoryAuditSink implements AuditSink {

	private final List<QueryRecord> records = new CopyOnWriteArrayList<>();

	@Override
	public void record(QueryRecord record) {
		records.add(record);
	}

	public List<QueryRecord> records() {
		return List.copyOf(records);
	}

	public int size() {
		return records.size();
	}

	public void clear() {
		records.clear();
	}
}
