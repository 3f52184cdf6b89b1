package org.javai.springai.safequery.generation;

import java.util.Objects;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.ai.openai.api.OpenAiApi;

/**
 * Builds {@link ChatClient}s for OpenAI-compatible endpoints such as OpenRouter.
 */
public final class OpenAiCompatibleChatClients {

	public static final String OPENROUTER_BASE_URL = "https://openrouter.ai/api";

	private static final double TEMPERATURE = 0.1;
	private static final int MAX_TOKENS = 800;

	private OpenAiCompatibleChatClients() {
	}

	public static ChatClient openRouter(String apiKey, String model) {
		return create(OPENROUTER_BASE_URL, apiKey, model);
	}

	public static ChatClient create(String baseUrl, String apiKey, String model) {
		if (apiKey == null || apiKey.isBlank()) {
			throw new IllegalArgumentException("apiKey is required");
		}
		if (model == null || model.isBlank()) {
			throw new IllegalArgumentException("model is required");
		}
		OpenAiApi openAiApi = OpenAiApi.builder()
				.baseUrl(Objects.requireNonNull(baseUrl, "baseUrl must not be null"))
				.apiKey(apiKey)
				.build();
		OpenAiChatModel chatModel = OpenAiChatModel.builder()
				.openAiApi(openAiApi)
				.build();
		OpenAiChatOptions options = OpenAiChatOptions.builder()
				.model(model)
				.temperature(TEMPERATURE)
				.maxTokens(MAX_TOKENS)
				.build();
		return ChatClient.builder(chatModel)
				.defaultOptions(options)
				.build();
	}
}
