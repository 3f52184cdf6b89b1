package org.javai.springai.safequery.generation;

import static org.assertj.core.api.Assertions.assertThat;
import java.util.List;
import org.javai.springai.safequery.guard.Violation;
import org.javai.springai.safequery.guard.ViolationKind;
import org.javai.springai.safequery.policy.PipelineSettings;
import org.javai.springai.safequery.policy.Policy;
import org.javai.springai.safequery.schema.SchemaSnapshot;
import org.junit.jupiter.api.Test;

class RetryPromptBuilderTest {

	private final GenerationRequest first = GenerationRequest.first("q", SchemaSnapshot.of("H2", List.of()),
			QueryConstraints.from(Policy.defaults(), PipelineSettings.defaults()));

	@Test
	void firstAttemptHasNoAddendum() {
		assertThat(first.isRetry()).isFalse();
		assertThat(RetryPromptBuilder.buildRetryAddendum(first)).isEmpty();
		assertThat(RetryPromptBuilder.buildRetryAddendum(null)).isEmpty();
	}

	@Test
	void rejectionListsViolations() {
		GenerationRequest retry = first.afterRejection(List.of(
				new Violation(ViolationKind.TABLE_RESTRICTED, "table admin_logs is restricted")));

		assertThat(RetryPromptBuilder.buildRetryAddendum(retry)).hasValueSatisfying(addendum -> assertThat(addendum)
				.startsWith("Your previous query was rejected by the safety policy:")
				.contains("1. TABLE_RESTRICTED: table admin_logs is restricted")
				.contains("fixes every item above"));
	}

	@Test
	void failureDescribesProblem() {
		GenerationRequest retry = first.afterFailure("malformed_response");

		assertThat(retry.isRetry()).isTrue();
		assertThat(RetryPromptBuilder.buildRetryAddendum(retry)).hasValueSatisfying(addendum -> assertThat(addendum)
				.contains("could not be used (malformed_response)")
				.doesNotContain("safety policy"));
	}

	@Test
	void laterRequestReplacesEarlierFeedback() {
		GenerationRequest retry = first
				.afterRejection(List.of(new Violation(ViolationKind.MISSING_LIMIT, "x")))
				.afterFailure("timeout");

		assertThat(retry.priorViolations()).isEmpty();
		assertThat(retry.priorFailure()).isEqualTo("timeout");
	}
}
