package org.javai.springai.safequery.policy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import java.time.Duration;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class PolicyTest {

	@Nested
	@DisplayName("Policy")
	class PolicyRules {

		@Test
		@DisplayName("defaults allow every table and cap rows at 100")
		void defaults() {
			Policy policy = Policy.defaults();

			assertThat(policy.allowAllTables()).isTrue();
			assertThat(policy.maxRows()).isEqualTo(100);
			assertThat(policy.readOnly()).isTrue();
			assertThat(policy.softDeleteColumn()).isEqualTo("deleted_at");
			assertThat(policy.softDeleteFilters()).containsExactly(SoftDeleteFilter.IS_NULL);
			assertThat(policy.isTableInScope("anything")).isTrue();
		}

		@Test
		@DisplayName("names are compared case-insensitively after trimming")
		void caseInsensitiveNames() {
			Policy policy = Policy.builder()
					.allowTables(" Orders ", "PRODUCTS")
					.excludeColumns("Password_Hash")
					.build();

			assertThat(policy.allowedTables()).containsExactlyInAnyOrder("orders", "products");
			assertThat(policy.isTableInScope("ORDERS")).isTrue();
			assertThat(policy.isTableInScope("customers")).isFalse();
			assertThat(policy.isExcludedColumn("PASSWORD_HASH")).isTrue();
		}

		@Test
		@DisplayName("restriction wins over allow-listing")
		void restrictionWins() {
			Policy policy = Policy.builder()
					.allowTables("orders", "admin_logs")
					.restrictTables("admin_logs")
					.build();

			assertThat(policy.isRestricted("Admin_Logs")).isTrue();
			assertThat(policy.isTableInScope("admin_logs")).isFalse();
			assertThat(policy.isTableInScope("orders")).isTrue();
		}

		@Test
		@DisplayName("blank and null entries are ignored")
		void blankEntriesIgnored() {
			Policy policy = Policy.builder()
					.excludeColumns("  ", null, "api_token")
					.build();

			assertThat(policy.excludedColumns()).containsExactly("api_token");
		}

		@Test
		@DisplayName("rejects a non-positive row cap")
		void rejectsZeroMaxRows() {
			assertThatThrownBy(() -> Policy.builder().maxRows(0).build())
					.isInstanceOf(IllegalArgumentException.class)
					.hasMessageContaining("maxRows");
		}

		@Test
		@DisplayName("rejects a policy that is not read-only")
		void rejectsWritablePolicy() {
			assertThatThrownBy(() -> new Policy(true, Set.of(), Set.of(), Set.of(), 10, false, null, null))
					.isInstanceOf(IllegalArgumentException.class)
					.hasMessageContaining("read-only");
		}

		@Test
		@DisplayName("soft-delete filters keep declaration order")
		void softDeleteFilterOrder() {
			Policy policy = Policy.builder()
					.softDeleteFilters(SoftDeleteFilter.EQUALS_FALSE, SoftDeleteFilter.IS_NULL)
					.build();

			assertThat(policy.softDeleteFilters())
					.containsExactly(SoftDeleteFilter.IS_NULL, SoftDeleteFilter.EQUALS_FALSE);
		}
	}

	@Nested
	@DisplayName("PipelineSettings")
	class Settings {

		@Test
		@DisplayName("defaults match the documented values")
		void defaults() {
			PipelineSettings settings = PipelineSettings.defaults();

			assertThat(settings.maxRetries()).isEqualTo(3);
			assertThat(settings.responseWordLimit()).isEqualTo(30);
			assertThat(settings.generationTimeout()).isEqualTo(Duration.ofSeconds(30));
			assertThat(settings.executionTimeout()).isEqualTo(Duration.ofSeconds(15));
			assertThat(settings.summaryRowLimit()).isEqualTo(25);
			assertThat(settings.currencySymbol()).isEqualTo("$");
		}

		@Test
		@DisplayName("rejects a zero retry budget")
		void rejectsZeroRetries() {
			assertThatThrownBy(() -> PipelineSettings.builder().maxRetries(0).build())
					.isInstanceOf(IllegalArgumentException.class);
		}

		@Test
		@DisplayName("rejects a non-positive timeout")
		void rejectsZeroTimeout() {
			assertThatThrownBy(() -> PipelineSettings.builder().executionTimeout(Duration.ZERO).build())
					.isInstanceOf(IllegalArgumentException.class);
		}
	}
}
