package org.javai.springai.safequery;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import org.javai.springai.safequery.answer.ListingRequestDetector;
import org.javai.springai.safequery.answer.UserMessages;
import org.javai.springai.safequery.answer.WordLimiter;
import org.javai.springai.safequery.execution.ExecutionResult;
import org.javai.springai.safequery.execution.QueryExecutor;
import org.javai.springai.safequery.execution.RowRedactor;
import org.javai.springai.safequery.generation.CandidateQuery;
import org.javai.springai.safequery.generation.GenerationException;
import org.javai.springai.safequery.generation.GenerationRequest;
import org.javai.springai.safequery.generation.QueryConstraints;
import org.javai.springai.safequery.generation.QueryGenerator;
import org.javai.springai.safequery.generation.SummaryRequest;
import org.javai.springai.safequery.guard.QueryGuard;
import org.javai.springai.safequery.guard.ValidationResult;
import org.javai.springai.safequery.policy.PipelineSettings;
import org.javai.springai.safequery.policy.Policy;
import org.javai.springai.safequery.schema.SchemaCatalog;
import org.javai.springai.safequery.schema.SchemaSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One user turn: generate, validate, execute, redact, answer, constrain.
 *
 * <p>A turn is single-use and confined to the thread that runs it. The retry budget is
 * shared by generator failures and guard rejections and is spent on every entry to
 * {@link TurnState#GENERATING}. Execution failures are never retried.</p>
 */
final class QueryTurn {

	private static final Logger logger = LoggerFactory.getLogger(QueryTurn.class);

	static final String DATABASE_UNREACHABLE = "database_unreachable";
	static final String NO_TABLES_IN_SCOPE = "no_tables_in_scope";
	static final String NO_RESULTS = "no_results";
	static final String EMPTY_QUESTION = "empty_question";

	private final Collaborators collaborators;
	private final String userId;
	private final String question;
	private final Instant startedAt;

	private final List<TurnState> states = new ArrayList<>();
	private final List<AttemptRecord> attempts = new ArrayList<>();
	private String finalSql;
	private Integer rowCount;
	private boolean used;

	/**
	 * Everything a turn needs, shared across turns.
	 */
	record Collaborators(
			SchemaCatalog catalog,
			QueryGenerator generator,
			QueryGuard guard,
			QueryExecutor executor,
			RowRedactor redactor,
			PipelineSettings settings,
			TimeBoundedCall timeBoundedCall
	) {
		Policy policy() {
			return catalog.policy();
		}
	}

	QueryTurn(Collaborators collaborators, String userId, String question) {
		this.collaborators = collaborators;
		this.userId = userId;
		this.question = question;
		this.startedAt = Instant.now();
	}

	List<TurnState> states() {
		return List.copyOf(states);
	}

	QueryRecord run() {
		if (used) {
			throw new IllegalStateException("a turn runs only once");
		}
		used = true;
		try {
			return process();
		} catch (TurnCancelledException e) {
			enter(TurnState.CANCELLED);
			logger.info("Turn for user {} cancelled", userId);
			return finish(QueryOutcome.CANCELLED, UserMessages.CANCELLED, e.getMessage());
		}
	}

	private QueryRecord process() {
		enter(TurnState.RECEIVED);
		if (question.isBlank()) {
			enter(TurnState.OUT_OF_SCOPE);
			return finish(QueryOutcome.OUT_OF_SCOPE, UserMessages.OUT_OF_SCOPE, EMPTY_QUESTION);
		}

		SchemaSnapshot snapshot = collaborators.catalog().snapshot();
		if (snapshot.connectionError()) {
			enter(TurnState.OUT_OF_SCOPE);
			return finish(QueryOutcome.OUT_OF_SCOPE, UserMessages.DATABASE_UNAVAILABLE, DATABASE_UNREACHABLE);
		}
		if (snapshot.isEmpty()) {
			logger.warn("No tables in scope for user {}", userId);
			enter(TurnState.OUT_OF_SCOPE);
			return finish(QueryOutcome.OUT_OF_SCOPE, UserMessages.OUT_OF_SCOPE, NO_TABLES_IN_SCOPE);
		}

		PipelineSettings settings = collaborators.settings();
		QueryConstraints constraints = QueryConstraints.from(collaborators.policy(), settings);
		GenerationRequest request = GenerationRequest.first(question, snapshot, constraints);
		String lastProblem = null;
		CandidateQuery accepted = null;

		while (accepted == null) {
			if (attempts.size() >= settings.maxRetries()) {
				enter(TurnState.GENERATION_FAILED);
				logger.warn("Retry budget of {} exhausted for user {}", settings.maxRetries(), userId);
				return finish(QueryOutcome.GENERATION_FAILED, UserMessages.ERROR, lastProblem);
			}
			AttemptResult result = attempt(request, snapshot);
			if (result instanceof AttemptResult.Accepted a) {
				accepted = a.candidate();
			} else if (result instanceof AttemptResult.Rejected r) {
				enter(TurnState.REJECTED);
				lastProblem = r.validation().describe();
				request = request.afterRejection(r.validation().violations());
			} else if (result instanceof AttemptResult.Failed f) {
				lastProblem = f.error().kind() + ": " + f.error().getMessage();
				request = request.afterFailure(f.error().kind().name().toLowerCase(Locale.ROOT));
			} else if (result instanceof AttemptResult.Declined d) {
				return declined(d.candidate());
			}
		}

		return executeAndAnswer(accepted);
	}

	private AttemptResult attempt(GenerationRequest request, SchemaSnapshot snapshot) {
		enter(TurnState.GENERATING);
		int number = attempts.size() + 1;
		long started = System.nanoTime();
		CandidateQuery candidate;
		try {
			candidate = collaborators.timeBoundedCall().call(
					() -> collaborators.generator().generate(request),
					collaborators.settings().generationTimeout());
		} catch (TimeoutException e) {
			GenerationException error = new GenerationException(GenerationException.Kind.TIMEOUT,
					"generation timed out after " + collaborators.settings().generationTimeout());
			return failed(number, started, error);
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new TurnCancelledException("interrupted while generating");
		} catch (GenerationException e) {
			return failed(number, started, e);
		} catch (RuntimeException e) {
			return failed(number, started, new GenerationException(GenerationException.Kind.TRANSPORT, e.getMessage(), e));
		}

		if (candidate == null) {
			return failed(number, started,
					new GenerationException(GenerationException.Kind.MALFORMED_RESPONSE, "generator returned no candidate"));
		}
		if (candidate.isOutOfScope()) {
			logAttempt(number, AttemptOutcome.DECLINED, started, null, candidate.scopeReason());
			return new AttemptResult.Declined(candidate);
		}

		enter(TurnState.VALIDATING);
		finalSql = candidate.text();
		ValidationResult validation = collaborators.guard().validate(candidate, snapshot, collaborators.policy());
		if (!validation.accepted()) {
			logger.warn("Attempt {} for user {} rejected: {}", number, userId, validation.violations());
			logAttempt(number, AttemptOutcome.REJECTED, started, candidate.text(), validation.describe());
			return new AttemptResult.Rejected(candidate, validation);
		}
		enter(TurnState.ACCEPTED);
		logger.info("Attempt {} for user {} accepted", number, userId);
		logAttempt(number, AttemptOutcome.ACCEPTED, started, candidate.text(), null);
		return new AttemptResult.Accepted(candidate);
	}

	private AttemptResult failed(int number, long started, GenerationException error) {
		logger.warn("Attempt {} for user {} failed ({}): {}", number, userId, error.kind(), error.getMessage());
		logAttempt(number, AttemptOutcome.GENERATION_FAILED, started, null, error.kind() + ": " + error.getMessage());
		return new AttemptResult.Failed(error);
	}

	private QueryRecord declined(CandidateQuery candidate) {
		String reason = candidate.scopeReason();
		enter(TurnState.OUT_OF_SCOPE);
		if (CandidateQuery.TOO_MANY_ITEMS.equals(reason)) {
			logger.info("User {} requested too many items", userId);
			return finish(QueryOutcome.REJECTED, UserMessages.tooManyItems(collaborators.policy().maxRows()), reason);
		}
		if (CandidateQuery.OFF_TOPIC.equals(reason)) {
			logger.info("Off-topic question from user {}", userId);
			return finish(QueryOutcome.OUT_OF_SCOPE, offTopicReply(), reason);
		}
		logger.info("Generator declined question from user {}: {}", userId, reason);
		return finish(QueryOutcome.OUT_OF_SCOPE, UserMessages.OUT_OF_SCOPE, reason);
	}

	private String offTopicReply() {
		try {
			String reply = collaborators.timeBoundedCall().call(
					() -> collaborators.generator().redirectOffTopic(question),
					collaborators.settings().generationTimeout());
			if (reply != null && !reply.isBlank()) {
				return reply.trim();
			}
			logger.warn("Off-topic reply was blank, using the canned message");
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new TurnCancelledException("interrupted while replying to an off-topic question");
		} catch (TimeoutException | RuntimeException e) {
			logger.warn("Off-topic reply failed, using the canned message: {}", e.toString());
		}
		return UserMessages.OUT_OF_SCOPE;
	}

	private QueryRecord executeAndAnswer(CandidateQuery accepted) {
		Policy policy = collaborators.policy();
		PipelineSettings settings = collaborators.settings();
		String sql = accepted.text();
		finalSql = sql;

		enter(TurnState.EXECUTING);
		ExecutionResult raw;
		try {
			raw = collaborators.timeBoundedCall().call(
					() -> collaborators.executor().execute(sql, policy.maxRows(), settings.executionTimeout()),
					settings.executionTimeout());
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new TurnCancelledException("interrupted while executing");
		} catch (TimeoutException e) {
			return executionFailed("execution timed out after " + settings.executionTimeout());
		} catch (RuntimeException e) {
			return executionFailed(e.getMessage());
		}

		enter(TurnState.REDACTING);
		// executors may hand back the probe row, or more
		ExecutionResult capped = raw != null ? raw.limitTo(policy.maxRows()) : ExecutionResult.empty();
		if (capped.truncated()) {
			logger.info("Result for user {} truncated to {} rows", userId, policy.maxRows());
		}
		ExecutionResult result = collaborators.redactor().redact(capped);
		rowCount = result.rowCount();
		if (result.isEmpty()) {
			enter(TurnState.DONE);
			return finish(QueryOutcome.ANSWERED, UserMessages.NO_RESULTS, NO_RESULTS);
		}

		enter(TurnState.ANSWERING);
		List<Map<String, Object>> preview = result.rows()
				.subList(0, Math.min(settings.summaryRowLimit(), result.rowCount()));
		SummaryRequest summaryRequest = new SummaryRequest(question, sql, preview, result.rowCount(),
				result.truncated(), QueryConstraints.from(policy, settings));
		String answer;
		try {
			answer = collaborators.timeBoundedCall().call(
					() -> collaborators.generator().summarize(summaryRequest),
					settings.generationTimeout());
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new TurnCancelledException("interrupted while answering");
		} catch (TimeoutException e) {
			return answerFailed("answer timed out after " + settings.generationTimeout());
		} catch (RuntimeException e) {
			return answerFailed(e.getMessage());
		}
		if (answer == null || answer.isBlank()) {
			return answerFailed("blank answer");
		}

		enter(TurnState.CONSTRAINING);
		String constrained = ListingRequestDetector.isListingRequest(question)
				? answer.trim()
				: WordLimiter.limit(answer.trim(), settings.responseWordLimit());

		enter(TurnState.DONE);
		return finish(QueryOutcome.ANSWERED, constrained, result.truncated() ? "truncated" : null);
	}

	private QueryRecord executionFailed(String error) {
		enter(TurnState.EXEC_FAILED);
		logger.error("Query execution failed for user {}: {}", userId, error);
		return finish(QueryOutcome.EXECUTION_FAILED, UserMessages.ERROR, error);
	}

	private QueryRecord answerFailed(String error) {
		enter(TurnState.GENERATION_FAILED);
		logger.error("Answer synthesis failed for user {}: {}", userId, error);
		return finish(QueryOutcome.GENERATION_FAILED, UserMessages.ERROR, error);
	}

	private void enter(TurnState state) {
		if (state != TurnState.CANCELLED && Thread.currentThread().isInterrupted()) {
			throw new TurnCancelledException("interrupted before " + state);
		}
		states.add(state);
		logger.debug("Turn for user {} -> {}", userId, state);
	}

	private void logAttempt(int number, AttemptOutcome outcome, long started, String sql, String detail) {
		long millis = (System.nanoTime() - started) / 1_000_000;
		attempts.add(new AttemptRecord(number, outcome, millis, sql, detail));
	}

	private QueryRecord finish(QueryOutcome outcome, String answer, String detail) {
		return new QueryRecord(userId, question, finalSql, attempts.size(), outcome, answer, rowCount,
				detail, attempts, startedAt, Instant.now());
	}

	private static final class TurnCancelledException extends RuntimeException {

		TurnCancelledException(String message) {
			super(message);
		}
	}
}
