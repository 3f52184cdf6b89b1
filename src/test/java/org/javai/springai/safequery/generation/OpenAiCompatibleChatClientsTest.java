package org.javai.springai.safequery.generation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import org.junit.jupiter.api.Test;

class OpenAiCompatibleChatClientsTest {

	@Test
	void buildsAClientWithoutContactingTheEndpoint() {
		assertThat(OpenAiCompatibleChatClients.openRouter("sk-test", "openai/gpt-4o-mini")).isNotNull();
	}

	@Test
	void requiresKeyAndModel() {
		assertThatThrownBy(() -> OpenAiCompatibleChatClients.openRouter(" ", "openai/gpt-4o-mini"))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("apiKey");
		assertThatThrownBy(() -> OpenAiCompatibleChatClients.create("http://localhost:1234", "key", null))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("model");
	}
}
