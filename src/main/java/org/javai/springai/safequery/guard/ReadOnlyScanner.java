package org.javai.springai.safequery.guard;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lexical check that query text cannot mutate anything, applied before parsing.
 *
 * <p>String literals and quoted identifiers are blanked first, so a keyword inside
 * {@code 'please delete me'} or a column named {@code "update"} is not reported.
 * Keywords are matched on word boundaries, so {@code updated_at} passes.</p>
 */
final class ReadOnlyScanner {

	private static final Pattern MUTATION_KEYWORD = Pattern.compile(
			"\\b(INSERT|UPDATE|DELETE|MERGE|UPSERT|DROP|CREATE|ALTER|TRUNCATE|RENAME|GRANT|REVOKE"
					+ "|EXEC|EXECUTE|CALL|INTO|ATTACH|DETACH|PRAGMA|VACUUM|LOCK|UNLOCK|COPY)\\b",
			Pattern.CASE_INSENSITIVE);

	private ReadOnlyScanner() {
	}

	/**
	 * Scans the text and returns one violation per distinct problem, in order of discovery.
	 */
	static List<Violation> scan(String sql) {
		List<Violation> violations = new ArrayList<>();
		if (sql == null || sql.isBlank()) {
			return violations;
		}
		String scrubbed = blankQuoted(sql);

		if (scrubbed.contains("--") || scrubbed.contains("/*")) {
			violations.add(new Violation(ViolationKind.NOT_READ_ONLY, "comments are not allowed in the query"));
		}

		if (hasSecondStatement(scrubbed)) {
			violations.add(new Violation(ViolationKind.NOT_READ_ONLY, "only a single statement is allowed"));
		}

		Set<String> keywords = new LinkedHashSet<>();
		Matcher matcher = MUTATION_KEYWORD.matcher(scrubbed);
		while (matcher.find()) {
			keywords.add(matcher.group(1).toUpperCase(Locale.ROOT));
		}
		for (String keyword : keywords) {
			violations.add(new Violation(ViolationKind.NOT_READ_ONLY,
					"keyword %s is not allowed in a read-only query".formatted(keyword)));
		}
		return violations;
	}

	private static boolean hasSecondStatement(String scrubbed) {
		String trimmed = scrubbed.strip();
		while (trimmed.endsWith(";")) {
			trimmed = trimmed.substring(0, trimmed.length() - 1).strip();
		}
		return trimmed.indexOf(';') >= 0;
	}

	/**
	 * Replaces the contents of string literals and quoted identifiers with spaces,
	 * keeping the delimiters. An unterminated quote blanks the rest of the text.
	 */
	static String blankQuoted(String sql) {
		StringBuilder out = new StringBuilder(sql.length());
		int i = 0;
		while (i < sql.length()) {
			char c = sql.charAt(i);
			char close = switch (c) {
				case '\'' -> '\'';
				case '"' -> '"';
				case '`' -> '`';
				default -> '\0';
			};
			if (close == '\0') {
				out.append(c);
				i++;
				continue;
			}
			out.append(c);
			i++;
			while (i < sql.length()) {
				char inner = sql.charAt(i);
				if (inner == close) {
					// doubled delimiter is an escaped quote
					if (i + 1 < sql.length() && sql.charAt(i + 1) == close) {
						out.append("  ");
						i += 2;
						continue;
					}
					break;
				}
				out.append(' ');
				i++;
			}
			if (i < sql.length()) {
				out.append(close);
				i++;
			}
		}
		return out.toString();
	}
}
