package org.javai.springai.safequery.answer;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Caps an answer at a number of words.
 *
 * <p>A word is a run of Unicode letters, digits or underscores. Text over the limit is
 * cut right after the last permitted word and terminated with {@code ...}.</p>
 */
public final class WordLimiter {

	private static final Pattern WORD = Pattern.compile("\\w+", Pattern.UNICODE_CHARACTER_CLASS);

	public static final String ELLIPSIS = "...";

	private WordLimiter() {
	}

	public static int countWords(String text) {
		if (text == null) {
			return 0;
		}
		int count = 0;
		Matcher matcher = WORD.matcher(text);
		while (matcher.find()) {
			count++;
		}
		return count;
	}

	public static String limit(String text, int maxWords) {
		if (maxWords < 1) {
			throw new IllegalArgumentException("maxWords must be >= 1");
		}
		if (text == null) {
			return "";
		}
		Matcher matcher = WORD.matcher(text);
		int count = 0;
		while (matcher.find()) {
			count++;
			if (count == maxWords) {
				int end = matcher.end();
				if (!matcher.find()) {
					return text;
				}
				return text.substring(0, end).stripTrailing() + ELLIPSIS;
			}
		}
		return text;
	}
}
