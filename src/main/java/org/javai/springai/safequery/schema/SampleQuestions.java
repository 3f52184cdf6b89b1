package org.javai.springai.safequery.schema;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Suggests example questions a user could ask about the tables in scope.
 *
 * <p>Questions are filled from the filtered snapshot only, so they never mention a
 * restricted table or an excluded column.</p>
 */
public final class SampleQuestions {

	private static final List<String> TABLE_TEMPLATES = List.of(
			"How many %s are there?",
			"What's the total count of %s?",
			"Count all %s",
			"How many %s were created today?",
			"Most recent %s?",
			"How many %s from this month?");

	private static final List<String> COLUMN_TEMPLATES = List.of(
			"What %2$s values are in %1$s?",
			"Show me distinct %2$s values from %1$s",
			"Average %2$s in %1$s?",
			"Top %2$s values in %1$s?",
			"Compare %2$s across %1$s",
			"Summarize %1$s by %2$s",
			"Total of %2$s in %1$s?");

	private SampleQuestions() {
	}

	public static Optional<String> from(SchemaSnapshot snapshot) {
		return from(snapshot, ThreadLocalRandom.current());
	}

	/**
	 * @return a question, or empty when the snapshot is an error snapshot or has no tables
	 */
	public static Optional<String> from(SchemaSnapshot snapshot, Random random) {
		if (snapshot == null || snapshot.connectionError() || snapshot.isEmpty()) {
			return Optional.empty();
		}
		TableInfo table = snapshot.tables().get(random.nextInt(snapshot.tables().size()));
		int choice = random.nextInt(TABLE_TEMPLATES.size() + COLUMN_TEMPLATES.size());
		String question;
		if (choice < TABLE_TEMPLATES.size() || table.columns().isEmpty()) {
			String template = TABLE_TEMPLATES.get(choice % TABLE_TEMPLATES.size());
			question = template.formatted(pluralize(table.name()));
		} else {
			ColumnInfo column = table.columns().get(random.nextInt(table.columns().size()));
			question = COLUMN_TEMPLATES.get(choice - TABLE_TEMPLATES.size()).formatted(table.name(), column.name());
		}
		question = question.strip();
		return Optional.of(question.endsWith("?") ? question : question + "?");
	}

	static String pluralize(String word) {
		String lower = word.toLowerCase(Locale.ROOT);
		if (lower.endsWith("s") || lower.endsWith("x") || lower.endsWith("z")
				|| lower.endsWith("ch") || lower.endsWith("sh")) {
			return lower.endsWith("s") ? word : word + "es";
		}
		if (lower.length() > 1 && lower.endsWith("y") && "aeiou".indexOf(lower.charAt(lower.length() - 2)) < 0) {
			return word.substring(0, word.length() - 1) + "ies";
		}
		return word + "s";
	}
}
