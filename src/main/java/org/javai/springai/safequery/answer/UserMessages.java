package org.javai.springai.safequery.answer;

/**
 * Fixed user-facing replies for turns that end without a synthesized answer.
 *
 * <p>None of them mention SQL, tables, columns or error details.</p>
 */
public final class UserMessages {

	public static final String OUT_OF_SCOPE =
			"I can't help with that question. Either relevant information wasn't found or I'm not allowed to access it.";

	public static final String ERROR =
			"Sorry, I couldn't process that right now. Please try again.";

	public static final String DATABASE_UNAVAILABLE =
			"The database is unavailable right now. Please try again later.";

	public static final String NO_RESULTS =
			"I couldn't find any matching records.";

	public static final String CANCELLED =
			"The request was cancelled.";

	private UserMessages() {
	}

	public static String tooManyItems(int maxRows) {
		return "I can only list up to %d items at a time. Please be more precise with your query or ask for a smaller number of records."
				.formatted(maxRows);
	}
}
