package org.javai.springai.safequery.audit;

import org.javai.springai.safequery.QueryRecord;

/**
 * Receives the finished record of every user turn.
 *
 * <p>Implementations must be safe for concurrent use. A sink that throws does not
 * affect the user-visible answer; the orchestrator logs and carries on.</p>
 */
@FunctionalInterface
public interface AuditSink {

	void record(QueryRecord record);
}
