package org.javai.springai.safequery.policy;

import java.util.Objects;

/**
 * Policy and pipeline settings read together from one configuration source.
 *
 * @param policy the access policy
 * @param settings the pipeline limits
 */
public record SafeQueryConfiguration(Policy policy, PipelineSettings settings) {

	public SafeQueryConfiguration {
		Objects.requireNonNull(policy, "policy must not be null");
		Objects.requireNonNull(settings, "settings must not be null");
	}

	public static SafeQueryConfiguration defaults() {
		return new SafeQueryConfiguration(Policy.defaults(), PipelineSettings.defaults());
	}
}
