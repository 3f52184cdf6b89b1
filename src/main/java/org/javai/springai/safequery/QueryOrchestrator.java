package org.javai.springai.safequery;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import org.javai.springai.safequery.audit.AuditSink;
import org.javai.springai.safequery.audit.LoggingAuditSink;
import org.javai.springai.safequery.execution.QueryExecutor;
import org.javai.springai.safequery.execution.RowRedactor;
import org.javai.springai.safequery.generation.QueryGenerator;
import org.javai.springai.safequery.guard.QueryGuard;
import org.javai.springai.safequery.policy.PipelineSettings;
import org.javai.springai.safequery.schema.SampleQuestions;
import org.javai.springai.safequery.schema.SchemaCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the safe query pipeline.
 *
 * <p>Turns a user's question into an answer by running one {@link QueryTurn} per
 * question. Turns of the same user run one after another; turns of different users run
 * concurrently and share only the schema catalog and the audit sink. Every turn hands
 * exactly one {@link QueryRecord} to the audit sink, whatever its outcome.</p>
 *
 * <pre>{@code
 * QueryOrchestrator orchestrator = QueryOrchestrator.builder()
 *     .catalog(new SchemaCatalog(new JdbcSchemaIntrospector(dataSource), policy))
 *     .generator(new ChatClientQueryGenerator(chatClient))
 *     .executor(new JdbcQueryExecutor(dataSource))
 *     .build();
 * QueryRecord record = orchestrator.handleQuestion("alice", "How many orders shipped today?");
 * }</pre>
 */
public class QueryOrchestrator implements AutoCloseable {

	private static final Logger logger = LoggerFactory.getLogger(QueryOrchestrator.class);

	private final QueryTurn.Collaborators collaborators;
	private final AuditSink auditSink;
	private final TimeBoundedCall timeBoundedCall;
	private final ConcurrentMap<String, ReentrantLock> userLocks = new ConcurrentHashMap<>();

	private QueryOrchestrator(Builder builder) {
		this.timeBoundedCall = new TimeBoundedCall();
		this.auditSink = builder.auditSink;
		this.collaborators = new QueryTurn.Collaborators(
				builder.catalog,
				builder.generator,
				builder.guard,
				builder.executor,
				new RowRedactor(builder.catalog.policy()),
				builder.settings,
				timeBoundedCall);
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Answers one question for one user. Never throws for pipeline failures; the outcome
	 * is on the returned record, which has also been handed to the audit sink.
	 */
	public QueryRecord handleQuestion(String userId, String question) {
		Objects.requireNonNull(userId, "userId must not be null");
		Objects.requireNonNull(question, "question must not be null");

		ReentrantLock lock = userLocks.computeIfAbsent(userId, id -> new ReentrantLock());
		try {
			lock.lockInterruptibly();
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			QueryTurn turn = new QueryTurn(collaborators, userId, question);
			return publish(turn.run());
		}
		try {
			logger.info("Handling question for user {}", userId);
			QueryRecord record = new QueryTurn(collaborators, userId, question).run();
			logger.info("Turn for user {} finished: outcome={}, attempts={}, rows={}",
					userId, record.outcome(), record.attemptCount(), record.rowCount());
			return publish(record);
		} finally {
			lock.unlock();
		}
	}

	/**
	 * An example question about the tables in scope, or empty when nothing is in scope.
	 */
	public Optional<String> sampleQuestion() {
		return SampleQuestions.from(collaborators.catalog().snapshot());
	}

	private QueryRecord publish(QueryRecord record) {
		try {
			auditSink.record(record);
		} catch (RuntimeException e) {
			logger.warn("Audit sink failed for user {}: {}", record.userId(), e.getMessage(), e);
		}
		return record;
	}

	@Override
	public void close() {
		timeBoundedCall.close();
	}

	/**
	 * Builder for {@link QueryOrchestrator}.
	 */
	public static final class Builder {

		private SchemaCatalog catalog;
		private QueryGenerator generator;
		private QueryExecutor executor;
		private QueryGuard guard = new QueryGuard();
		private AuditSink auditSink = new LoggingAuditSink();
		private PipelineSettings settings = PipelineSettings.defaults();

		private Builder() {
		}

		public Builder catalog(SchemaCatalog catalog) {
			this.catalog = catalog;
			return this;
		}

		public Builder generator(QueryGenerator generator) {
			this.generator = generator;
			return this;
		}

		public Builder executor(QueryExecutor executor) {
			this.executor = executor;
			return this;
		}

		public Builder guard(QueryGuard guard) {
			this.guard = guard;
			return this;
		}

		public Builder auditSink(AuditSink auditSink) {
			this.auditSink = auditSink;
			return this;
		}

		public Builder settings(PipelineSettings settings) {
			this.settings = settings;
			return this;
		}

		public QueryOrchestrator build() {
			Objects.requireNonNull(catalog, "catalog must not be null");
			Objects.requireNonNull(generator, "generator must not be null");
			Objects.requireNonNull(executor, "executor must not be null");
			Objects.requireNonNull(guard, "guard must not be null");
			Objects.requireNonNull(auditSink, "auditSink must not be null");
			Objects.requireNonNull(settings, "settings must not be null");
			return new QueryOrchestrator(this);
		}
	}
}
