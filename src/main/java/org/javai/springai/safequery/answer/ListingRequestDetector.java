package org.javai.springai.safequery.answer;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Tells whether a question asks for a list of records rather than an aggregate.
 *
 * <p>Listing answers are exempt from the word limit. "list all orders", "show 50 products"
 * and "all the customers" are listings; "how many orders", "total revenue" and
 * "average price" are not.</p>
 */
public final class ListingRequestDetector {

	private static final Pattern AGGREGATE = Pattern.compile(
			"\\b(how many|count|total|sum|average|avg|maximum|max|minimum|min|statistics|stats?)\\b");

	private static final List<Pattern> LISTING = List.of(
			Pattern.compile("\\b(list|show|display|get|fetch|give me|tell me)\\s+(all|the|me|every)\\b"),
			Pattern.compile("\\b(list|show|display)\\s+\\d+"),
			Pattern.compile("\\ball\\s+(the\\s+)?\\w+s?\\b"));

	private ListingRequestDetector() {
	}

	public static boolean isListingRequest(String question) {
		if (question == null || question.isBlank()) {
			return false;
		}
		String lower = question.toLowerCase(Locale.ROOT);
		if (AGGREGATE.matcher(lower).find()) {
			return false;
		}
		return LISTING.stream().anyMatch(p -> p.matcher(lower).find());
	}
}
