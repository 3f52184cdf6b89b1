package org.javai.springai.safequery;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.javai.springai.safequery.execution.ExecutionResult;
import org.javai.springai.safequery.execution.QueryExecutionException;
import org.javai.springai.safequery.execution.QueryExecutor;
import org.javai.springai.safequery.execution.RowRedactor;
import org.javai.springai.safequery.generation.GenerationException;
import org.javai.springai.safequery.guard.QueryGuard;
import org.javai.springai.safequery.policy.PipelineSettings;
import org.javai.springai.safequery.policy.Policy;
import org.javai.springai.safequery.schema.ColumnInfo;
import org.javai.springai.safequery.schema.SchemaCatalog;
import org.javai.springai.safequery.schema.SchemaIntrospector;
import org.javai.springai.safequery.schema.TableInfo;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class QueryTurnTest {

	private static final String GOOD_SQL = "SELECT id FROM orders WHERE deleted_at IS NULL LIMIT 10";

	private static final Policy POLICY = Policy.builder().maxRows(10).build();

	private final ScriptedQueryGenerator generator = new ScriptedQueryGenerator();
	private final TimeBoundedCall timeBoundedCall = new TimeBoundedCall();

	@AfterEach
	void tearDown() {
		timeBoundedCall.close();
	}

	private QueryTurn turn(QueryExecutor executor, int maxRetries) {
		SchemaIntrospector introspector = () -> new SchemaIntrospector.IntrospectedSchema("H2", List.of(
				new TableInfo("orders", List.of(
						new ColumnInfo("id", "integer", false),
						new ColumnInfo("deleted_at", "timestamp", true)), false)));
		PipelineSettings settings = PipelineSettings.builder()
				.maxRetries(maxRetries)
				.generationTimeout(Duration.ofSeconds(5))
				.executionTimeout(Duration.ofSeconds(5))
				.build();
		QueryTurn.Collaborators collaborators = new QueryTurn.Collaborators(new SchemaCatalog(introspector, POLICY),
				generator, new QueryGuard(), executor, new RowRedactor(POLICY), settings, timeBoundedCall);
		return new QueryTurn(collaborators, "u1", "How many orders?");
	}

	private static QueryExecutor rows(int count) {
		return (sql, maxRows, timeout) -> {
			List<Map<String, Object>> rows = new ArrayList<>();
			for (int i = 0; i < count; i++) {
				rows.add(Map.of("id", i));
			}
			return ExecutionResult.fromProbe(rows, maxRows);
		};
	}

	@Test
	void happyPathVisitsEveryStage() {
		QueryTurn turn = turn(rows(2), 3);
		generator.thenSql(GOOD_SQL);

		QueryRecord record = turn.run();

		assertThat(record.outcome()).isEqualTo(QueryOutcome.ANSWERED);
		assertThat(turn.states()).containsExactly(
				TurnState.RECEIVED, TurnState.GENERATING, TurnState.VALIDATING, TurnState.ACCEPTED,
				TurnState.EXECUTING, TurnState.REDACTING, TurnState.ANSWERING, TurnState.CONSTRAINING,
				TurnState.DONE);
		assertThat(record.startedAt()).isBeforeOrEqualTo(record.finishedAt());
	}

	@Test
	void rejectionLoopsBackToGenerating() {
		QueryTurn turn = turn(rows(1), 3);
		generator.thenSql("SELECT id FROM orders LIMIT 10").thenSql(GOOD_SQL);

		turn.run();

		assertThat(turn.states()).startsWith(
				TurnState.RECEIVED, TurnState.GENERATING, TurnState.VALIDATING, TurnState.REJECTED,
				TurnState.GENERATING, TurnState.VALIDATING, TurnState.ACCEPTED);
	}

	@Test
	void generatorFailuresExhaustTheBudget() {
		QueryTurn turn = turn(rows(1), 2);
		generator.thenFail(new GenerationException(GenerationException.Kind.TRANSPORT, "down"));

		QueryRecord record = turn.run();

		assertThat(record.outcome()).isEqualTo(QueryOutcome.GENERATION_FAILED);
		assertThat(record.attemptCount()).isEqualTo(2);
		assertThat(turn.states()).containsExactly(
				TurnState.RECEIVED, TurnState.GENERATING, TurnState.GENERATING, TurnState.GENERATION_FAILED);
	}

	@Test
	void executionFailureIsTerminal() {
		QueryTurn turn = turn((sql, maxRows, timeout) -> {
			throw new QueryExecutionException("timeout");
		}, 3);
		generator.thenSql(GOOD_SQL);

		QueryRecord record = turn.run();

		assertThat(record.outcome()).isEqualTo(QueryOutcome.EXECUTION_FAILED);
		assertThat(turn.states()).endsWith(TurnState.EXECUTING, TurnState.EXEC_FAILED);
		assertThat(turn.states().get(turn.states().size() - 1).isTerminal()).isTrue();
	}

	@Test
	void noRowsSkipsAnswering() {
		QueryTurn turn = turn(rows(0), 3);
		generator.thenSql(GOOD_SQL);

		turn.run();

		assertThat(turn.states()).endsWith(TurnState.REDACTING, TurnState.DONE)
				.doesNotContain(TurnState.ANSWERING);
	}

	@Test
	void aTurnRunsOnce() {
		QueryTurn turn = turn(rows(1), 3);
		generator.thenSql(GOOD_SQL);
		turn.run();

		assertThatThrownBy(turn::run).isInstanceOf(IllegalStateException.class);
	}

	@Test
	void interruptionCancelsTheTurn() {
		QueryTurn turn = turn(rows(1), 3);
		generator.thenSql(GOOD_SQL);

		Thread.currentThread().interrupt();
		QueryRecord record;
		try {
			record = turn.run();
		} finally {
			Thread.interrupted();
		}

		assertThat(record.outcome()).isEqualTo(QueryOutcome.CANCELLED);
		assertThat(turn.states()).containsExactly(TurnState.CANCELLED);
	}
}
