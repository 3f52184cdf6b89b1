package org.javai.springai.safequery.policy;

import java.io.InputStream;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.yaml.snakeyaml.Yaml;

/**
 * Reads a {@link SafeQueryConfiguration} from YAML.
 *
 * <p>Both sections are optional; missing keys fall back to the defaults of
 * {@link Policy} and {@link PipelineSettings}. Lists may be given as YAML sequences
 * or as comma-separated strings.</p>
 *
 * <pre>
 * policy:
 *   allowed_tables: all            # or a list of table names
 *   restricted_tables: [admin_logs]
 *   excluded_columns: password_hash, api_token
 *   max_rows: 100
 *   soft_delete_column: deleted_at
 *   soft_delete_filters: [IS_NULL]
 * pipeline:
 *   max_retries: 3
 *   response_word_limit: 30
 *   generation_timeout: 30s        # ms, s or m suffix; bare numbers are seconds
 *   execution_timeout: 15s
 *   summary_row_limit: 25
 *   currency_symbol: "$"
 * </pre>
 */
public class PolicyLoader {

	private static final Pattern DURATION_PATTERN = Pattern.compile("(\\d+)\\s*(ms|s|m)?");
	private static final String ALL_TABLES = "all";

	private final Yaml yaml = new Yaml();

	public SafeQueryConfiguration load(Path path) {
		try (var reader = Files.newBufferedReader(path)) {
			return load(reader);
		} catch (PolicyConfigurationException e) {
			throw e;
		} catch (Exception e) {
			throw new PolicyConfigurationException("Failed to read configuration from path: " + path, e);
		}
	}

	public SafeQueryConfiguration load(InputStream inputStream) {
		try {
			return build(yaml.load(inputStream));
		} catch (PolicyConfigurationException e) {
			throw e;
		} catch (Exception e) {
			throw new PolicyConfigurationException("Failed to read configuration from input stream", e);
		}
	}

	public SafeQueryConfiguration load(Reader reader) {
		try {
			return build(yaml.load(reader));
		} catch (PolicyConfigurationException e) {
			throw e;
		} catch (Exception e) {
			throw new PolicyConfigurationException("Failed to read configuration from reader", e);
		}
	}

	public SafeQueryConfiguration loadString(String yamlContent) {
		try {
			return build(yaml.load(yamlContent));
		} catch (PolicyConfigurationException e) {
			throw e;
		} catch (Exception e) {
			throw new PolicyConfigurationException("Failed to read configuration from string", e);
		}
	}

	/**
	 * Loads a configuration from a classpath resource.
	 */
	public SafeQueryConfiguration loadResource(String resourceName) {
		ClassLoader loader = Thread.currentThread().getContextClassLoader();
		if (loader == null) {
			loader = PolicyLoader.class.getClassLoader();
		}
		InputStream in = loader.getResourceAsStream(resourceName);
		if (in == null) {
			throw new PolicyConfigurationException("Configuration resource not found: " + resourceName);
		}
		try (in) {
			return load(in);
		} catch (PolicyConfigurationException e) {
			throw e;
		} catch (Exception e) {
			throw new PolicyConfigurationException("Failed to close configuration resource: " + resourceName, e);
		}
	}

	private SafeQueryConfiguration build(Object root) {
		if (root == null) {
			return SafeQueryConfiguration.defaults();
		}
		if (!(root instanceof Map<?, ?> data)) {
			throw new PolicyConfigurationException("Configuration root must be a mapping");
		}
		Policy policy = buildPolicy(section(data, "policy"));
		PipelineSettings settings = buildSettings(section(data, "pipeline"));
		return new SafeQueryConfiguration(policy, settings);
	}

	private Policy buildPolicy(Map<?, ?> section) {
		Policy.Builder builder = Policy.builder();
		Object allowed = section.get("allowed_tables");
		if (allowed != null && !isAllTables(allowed)) {
			builder.allowTables(stringList(allowed, "allowed_tables"));
		}
		builder.restrictTables(stringList(section.get("restricted_tables"), "restricted_tables"));
		builder.excludeColumns(stringList(section.get("excluded_columns"), "excluded_columns"));
		if (section.containsKey("max_rows")) {
			builder.maxRows(intValue(section.get("max_rows"), "max_rows"));
		}
		if (section.containsKey("soft_delete_column")) {
			builder.softDeleteColumn(String.valueOf(section.get("soft_delete_column")));
		}
		if (section.containsKey("soft_delete_filters")) {
			List<SoftDeleteFilter> filters = new ArrayList<>();
			for (String name : stringList(section.get("soft_delete_filters"), "soft_delete_filters")) {
				try {
					filters.add(SoftDeleteFilter.valueOf(name.trim().toUpperCase(Locale.ROOT)));
				} catch (IllegalArgumentException e) {
					throw new PolicyConfigurationException("Unknown soft_delete_filters entry: " + name, e);
				}
			}
			builder.softDeleteFilters(filters);
		}
		try {
			return builder.build();
		} catch (IllegalArgumentException e) {
			throw new PolicyConfigurationException("Invalid policy: " + e.getMessage(), e);
		}
	}

	private PipelineSettings buildSettings(Map<?, ?> section) {
		PipelineSettings.Builder builder = PipelineSettings.builder();
		if (section.containsKey("max_retries")) {
			builder.maxRetries(intValue(section.get("max_retries"), "max_retries"));
		}
		if (section.containsKey("response_word_limit")) {
			builder.responseWordLimit(intValue(section.get("response_word_limit"), "response_word_limit"));
		}
		if (section.containsKey("generation_timeout")) {
			builder.generationTimeout(durationValue(section.get("generation_timeout"), "generation_timeout"));
		}
		if (section.containsKey("execution_timeout")) {
			builder.executionTimeout(durationValue(section.get("execution_timeout"), "execution_timeout"));
		}
		if (section.containsKey("summary_row_limit")) {
			builder.summaryRowLimit(intValue(section.get("summary_row_limit"), "summary_row_limit"));
		}
		if (section.containsKey("currency_symbol")) {
			builder.currencySymbol(String.valueOf(section.get("currency_symbol")));
		}
		try {
			return builder.build();
		} catch (IllegalArgumentException e) {
			throw new PolicyConfigurationException("Invalid pipeline settings: " + e.getMessage(), e);
		}
	}

	private static Map<?, ?> section(Map<?, ?> data, String key) {
		Object value = data.get(key);
		if (value == null) {
			return Map.of();
		}
		if (value instanceof Map<?, ?> map) {
			return map;
		}
		throw new PolicyConfigurationException("Section '" + key + "' must be a mapping");
	}

	private static boolean isAllTables(Object value) {
		if (value instanceof String s) {
			return ALL_TABLES.equalsIgnoreCase(s.trim()) || s.trim().equals("*");
		}
		return false;
	}

	private static List<String> stringList(Object value, String key) {
		if (value == null) {
			return List.of();
		}
		List<String> result = new ArrayList<>();
		if (value instanceof String s) {
			for (String part : s.split(",")) {
				if (!part.isBlank()) {
					result.add(part.trim());
				}
			}
			return result;
		}
		if (value instanceof Collection<?> items) {
			for (Object item : items) {
				if (item != null && !String.valueOf(item).isBlank()) {
					result.add(String.valueOf(item).trim());
				}
			}
			return result;
		}
		throw new PolicyConfigurationException("'" + key + "' must be a list or a comma-separated string");
	}

	private static int intValue(Object value, String key) {
		if (value instanceof Number n) {
			return n.intValue();
		}
		try {
			return Integer.parseInt(String.valueOf(value).trim());
		} catch (NumberFormatException e) {
			throw new PolicyConfigurationException("'" + key + "' must be an integer, got: " + value, e);
		}
	}

	private static Duration durationValue(Object value, String key) {
		if (value instanceof Number n) {
			return Duration.ofSeconds(n.longValue());
		}
		Matcher matcher = DURATION_PATTERN.matcher(String.valueOf(value).trim().toLowerCase(Locale.ROOT));
		if (!matcher.matches()) {
			throw new PolicyConfigurationException("'" + key + "' must be a duration like 500ms, 30s or 2m, got: " + value);
		}
		long amount = Long.parseLong(matcher.group(1));
		String unit = matcher.group(2);
		if (unit == null || unit.equals("s")) {
			return Duration.ofSeconds(amount);
		}
		return unit.equals("ms") ? Duration.ofMillis(amount) : Duration.ofMinutes(amount);
	}
}
