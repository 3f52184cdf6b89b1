package org.javai.springai.safequery.generation;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.javai.springai.safequery.schema.SchemaSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;

/**
 * {@link QueryGenerator} backed by a Spring AI {@link ChatClient}.
 *
 * <p>Query generation asks the model for a single JSON object
 * {@code {"status": "ok"|"out_of_scope", "sql": ..., "notes": ...}}. Markdown code fences
 * around the object are tolerated; anything else that does not follow the contract is a
 * {@link GenerationException} of kind {@code MALFORMED_RESPONSE}.</p>
 */
public class ChatClientQueryGenerator implements QueryGenerator {

	private static final Logger logger = LoggerFactory.getLogger(ChatClientQueryGenerator.class);

	private static final Pattern JSON_BLOCK_PATTERN = Pattern.compile("```(?:json)?\\s*\\n?(\\{.*?\\})\\s*```", Pattern.DOTALL);

	private static final ObjectMapper JSON_MAPPER = new ObjectMapper()
			.registerModule(new JavaTimeModule())
			.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
			.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

	private static final String GENERATION_RULES = """
			# SQL Generation Task
			Generate one safe, read-only SQL SELECT query that answers the user's question.

			## Identifier quoting
			This database is %1$s. Copy table and column names EXACTLY as shown in the schema.
			If a name has ANY uppercase letters, wrap it in %2$s: %3$sEmployee_task%4$s.
			All-lowercase names need no quotes.

			## Output Format
			Respond with ONLY a JSON object (no markdown, no code fences) with keys: status, sql, notes
			Example: {"status": "ok", "sql": "SELECT ...", "notes": null}

			## Status Values
			- "ok": generated SQL for a database question
			- "out_of_scope": the question is not about the data, or cannot be answered with the schema.
			  Use notes "off_topic" when the question is not about data at all.

			## SQL Rules
			1. Read-only only: a single SELECT, no INSERT/UPDATE/DELETE/DDL, no comments, no semicolons
			2. Never reference excluded columns, not even in WHERE or ORDER BY
			3. Use only tables from the schema below
			4. ALWAYS end the outermost query with LIMIT n, n at most %5$d
			5. For "all records" or "list all" use LIMIT %5$d
			6. If the user gives a number, use it as LIMIT but never above %5$d
			7. If the user asks for more than %5$d items, return status "out_of_scope" with notes "too_many_items"
			8. For vague queries without a specific count, default to LIMIT %6$d
			9. Every table marked [soft-delete] must be filtered with %7$s in WHERE,
			   combined with AND (qualify it with the table alias when joining)

			## Constraints
			%8$s

			%9$s
			""";

	private static final String SUMMARY_RULES = """
			You write short, helpful answers based on SQL results.
			Reply in the same language as the user question.
			Use 1-3 sentences.
			Include numbers from the results.
			Do not expose sensitive columns, SQL or internal error details.
			Paraphrase table and column names into human-friendly wording.
			Format all monetary values with the currency symbol '%1$s' (e.g., %1$s1,234.56).
			""";

	private static final String OFF_TOPIC_RULES = """
			You are a helpful and friendly data bot.
			The user asked a question that's not related to data or databases.
			Reply with a SHORT (1-2 sentences), WITTY but RESPECTFUL response.
			Make it clear you're here for data questions, but keep it light and friendly.
			Max 15 words.
			""";

	private final ChatClient chatClient;

	public ChatClientQueryGenerator(ChatClient chatClient) {
		this.chatClient = Objects.requireNonNull(chatClient, "chatClient must not be null");
	}

	@Override
	public CandidateQuery generate(GenerationRequest request) {
		Objects.requireNonNull(request, "request must not be null");
		String system = buildGenerationPrompt(request);
		String response = invokeModel(system, "Question: " + request.question());
		CandidateQuery candidate = parseCandidate(response);
		logger.info("Generated candidate: status={}, tables={}, limit={}",
				candidate.status(), candidate.targetTables(), candidate.limitRowCount());
		return candidate;
	}

	@Override
	public String summarize(SummaryRequest request) {
		Objects.requireNonNull(request, "request must not be null");
		String system = SUMMARY_RULES.formatted(request.constraints().currencySymbol());
		String user = """
				Question:
				%s

				SQL:
				%s

				Results (%s):
				%s
				""".formatted(request.question(), request.sql(), describeRowCount(request), previewRows(request.rows()));
		return Optional.ofNullable(invokeModel(system, user)).map(String::trim).orElse("");
	}

	@Override
	public String redirectOffTopic(String question) {
		String response = invokeModel(OFF_TOPIC_RULES, "Off-topic question: " + question);
		return Optional.ofNullable(response).map(String::trim).orElse("");
	}

	String buildGenerationPrompt(GenerationRequest request) {
		SchemaSnapshot snapshot = request.snapshot();
		String dialect = snapshot.dialect() != null ? snapshot.dialect() : "unknown";
		boolean backticks = usesBackticks(dialect);
		QueryConstraints constraints = request.constraints();
		String prompt = GENERATION_RULES.formatted(
				dialect,
				backticks ? "backticks" : "double quotes",
				backticks ? "`" : "\"",
				backticks ? "`" : "\"",
				constraints.maxRows(),
				Math.min(50, constraints.maxRows()),
				constraints.softDeletePredicate(),
				constraints.render(),
				SchemaPromptRenderer.render(snapshot));
		return RetryPromptBuilder.buildRetryAddendum(request)
				.map(addendum -> prompt + "\n## Previous Attempt\n" + addendum)
				.orElse(prompt)
				.trim();
	}

	private String invokeModel(String system, String user) {
		logger.debug("System prompt:\n{}", system);
		logger.debug("User message:\n{}", user);
		String content;
		try {
			ChatClient.ChatClientRequestSpec request = chatClient.prompt();
			request.system(system);
			request.user(user);
			content = request.call().content();
		} catch (RuntimeException e) {
			throw new GenerationException(GenerationException.Kind.TRANSPORT,
					"Model call failed: " + e.getMessage(), e);
		}
		logger.debug("LLM response:\n{}", content);
		return content;
	}

	/**
	 * Parses the model's JSON reply into a candidate.
	 */
	CandidateQuery parseCandidate(String response) {
		if (response == null || response.isBlank()) {
			throw new GenerationException(GenerationException.Kind.MALFORMED_RESPONSE, "LLM returned an empty response");
		}
		String json = extractJsonContent(response)
				.orElseThrow(() -> new GenerationException(GenerationException.Kind.MALFORMED_RESPONSE,
						"LLM response does not contain a JSON object"));
		RawGeneration raw;
		try {
			raw = JSON_MAPPER.readValue(json, RawGeneration.class);
		} catch (JsonProcessingException e) {
			throw new GenerationException(GenerationException.Kind.MALFORMED_RESPONSE,
					"Failed to parse LLM JSON: " + e.getOriginalMessage(), e);
		}
		String status = raw.status() != null ? raw.status().trim().toLowerCase(Locale.ROOT) : "";
		switch (status) {
			case "ok" -> {
				if (raw.sql() == null || raw.sql().isBlank()) {
					throw new GenerationException(GenerationException.Kind.MALFORMED_RESPONSE,
							"LLM status ok but no SQL");
				}
				return CandidateQuery.ok(raw.sql());
			}
			case "out_of_scope" -> {
				return CandidateQuery.outOfScope(raw.notes() != null && !raw.notes().isBlank()
						? raw.notes().trim()
						: "out_of_scope");
			}
			default -> throw new GenerationException(GenerationException.Kind.MALFORMED_RESPONSE,
					"LLM returned unknown status: " + raw.status());
		}
	}

	private Optional<String> extractJsonContent(String response) {
		String trimmed = response.trim();
		Matcher matcher = JSON_BLOCK_PATTERN.matcher(trimmed);
		if (matcher.find()) {
			return Optional.of(matcher.group(1).trim());
		}
		if (trimmed.startsWith("{") && trimmed.endsWith("}")) {
			return Optional.of(trimmed);
		}
		return Optional.empty();
	}

	private static boolean usesBackticks(String dialect) {
		String lower = dialect.toLowerCase(Locale.ROOT);
		return lower.contains("mysql") || lower.contains("mariadb");
	}

	private static String describeRowCount(SummaryRequest request) {
		if (request.truncated()) {
			return "more than %d rows, showing %d".formatted(request.totalRows(), request.rows().size());
		}
		if (request.rows().size() < request.totalRows()) {
			return "%d rows, showing %d".formatted(request.totalRows(), request.rows().size());
		}
		return request.totalRows() + " rows";
	}

	private static String previewRows(List<Map<String, Object>> rows) {
		try {
			return JSON_MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(rows);
		} catch (JsonProcessingException e) {
			throw new GenerationException(GenerationException.Kind.MALFORMED_RESPONSE,
					"Result rows cannot be serialised: " + e.getOriginalMessage(), e);
		}
	}

	@JsonIgnoreProperties(ignoreUnknown = true)
	record RawGeneration(String status, String sql, String notes) {
	}
}
