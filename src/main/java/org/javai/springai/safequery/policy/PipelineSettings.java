package org.javai.springai.safequery.policy;

import java.time.Duration;

/**
 * Limits and defaults of the query pipeline that are not part of the access policy.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * // Use defaults
 * PipelineSettings settings = PipelineSettings.defaults();
 *
 * // Custom configuration
 * PipelineSettings settings = PipelineSettings.builder()
 *         .maxRetries(5)
 *         .responseWordLimit(50)
 *         .build();
 * }</pre>
 *
 * @param maxRetries attempts shared by generation failures and guard rejections
 * @param responseWordLimit word cap on answers that are not listing requests
 * @param generationTimeout bound on each call to the generator
 * @param executionTimeout bound on the database call
 * @param summaryRowLimit rows handed to the answer step
 * @param currencySymbol symbol the generator uses for monetary values
 */
public record PipelineSettings(
		int maxRetries,
		int responseWordLimit,
		Duration generationTimeout,
		Duration executionTimeout,
		int summaryRowLimit,
		String currencySymbol
) {

	public static final int DEFAULT_MAX_RETRIES = 3;
	public static final int DEFAULT_RESPONSE_WORD_LIMIT = 30;
	public static final Duration DEFAULT_GENERATION_TIMEOUT = Duration.ofSeconds(30);
	public static final Duration DEFAULT_EXECUTION_TIMEOUT = Duration.ofSeconds(15);
	public static final int DEFAULT_SUMMARY_ROW_LIMIT = 25;
	public static final String DEFAULT_CURRENCY_SYMBOL = "$";

	public PipelineSettings {
		if (maxRetries < 1) {
			throw new IllegalArgumentException("maxRetries must be >= 1");
		}
		if (responseWordLimit < 1) {
			throw new IllegalArgumentException("responseWordLimit must be >= 1");
		}
		if (generationTimeout == null || generationTimeout.isNegative() || generationTimeout.isZero()) {
			throw new IllegalArgumentException("generationTimeout must be positive");
		}
		if (executionTimeout == null || executionTimeout.isNegative() || executionTimeout.isZero()) {
			throw new IllegalArgumentException("executionTimeout must be positive");
		}
		if (summaryRowLimit < 1) {
			throw new IllegalArgumentException("summaryRowLimit must be >= 1");
		}
		currencySymbol = currencySymbol != null && !currencySymbol.isBlank()
				? currencySymbol.trim()
				: DEFAULT_CURRENCY_SYMBOL;
	}

	public static PipelineSettings defaults() {
		return builder().build();
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Builder for {@link PipelineSettings}.
	 */
	public static final class Builder {
		private int maxRetries = DEFAULT_MAX_RETRIES;
		private int responseWordLimit = DEFAULT_RESPONSE_WORD_LIMIT;
		private Duration generationTimeout = DEFAULT_GENERATION_TIMEOUT;
		private Duration executionTimeout = DEFAULT_EXECUTION_TIMEOUT;
		private int summaryRowLimit = DEFAULT_SUMMARY_ROW_LIMIT;
		private String currencySymbol = DEFAULT_CURRENCY_SYMBOL;

		private Builder() {
		}

		public Builder maxRetries(int maxRetries) {
			this.maxRetries = maxRetries;
			return this;
		}

		public Builder responseWordLimit(int responseWordLimit) {
			this.responseWordLimit = responseWordLimit;
			return this;
		}

		public Builder generationTimeout(Duration generationTimeout) {
			this.generationTimeout = generationTimeout;
			return this;
		}

		public Builder executionTimeout(Duration executionTimeout) {
			this.executionTimeout = executionTimeout;
			return this;
		}

		public Builder summaryRowLimit(int summaryRowLimit) {
			this.summaryRowLimit = summaryRowLimit;
			return this;
		}

		public Builder currencySymbol(String currencySymbol) {
			this.currencySymbol = currencySymbol;
			return this;
		}

		public PipelineSettings build() {
			return new PipelineSettings(maxRetries, responseWordLimit, generationTimeout, executionTimeout,
					summaryRowLimit, currencySymbol);
		}
	}
}
