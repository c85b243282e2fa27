package io.evitadb.scriptor.llm;

import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.Duration;
import java.util.Arrays;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Builds LangChain4j chat models for the supported providers.
 * OpenAI-compatible endpoints (OpenAI, Ollama, Groq, DeepSeek, ...) and Anthropic are supported.
 */
public final class ChatModelFactory {

	/**
	 * Timeout of a single model call. Generating a larger fragment of code may take minutes.
	 */
	public static final Duration DEFAULT_TIMEOUT = Duration.ofMinutes(5);
	/**
	 * Low temperature keeps generated code close to the pseudocode.
	 */
	public static final double DEFAULT_TEMPERATURE = 0.2;
	private static final int ANTHROPIC_MAX_TOKENS = 8192;

	/**
	 * Supported model providers.
	 */
	public enum Provider {
		OPENAI("gpt-4o-mini"),
		ANTHROPIC("claude-3-5-sonnet-latest");

		private final String defaultModel;

		Provider(@Nonnull String defaultModel) {
			this.defaultModel = defaultModel;
		}

		@Nonnull
		public String getDefaultModel() {
			return this.defaultModel;
		}

		/**
		 * Resolves a provider by its case-insensitive name.
		 *
		 * @param name provider name such as {@code openai}
		 * @return provider
		 * @throws IllegalArgumentException for unknown names
		 */
		@Nonnull
		public static Provider fromName(@Nonnull String name) {
			Objects.requireNonNull(name, "name must not be null");
			final String normalized = name.trim().toUpperCase(Locale.ROOT);
			for (Provider provider : values()) {
				if (provider.name().equals(normalized)) {
					return provider;
				}
			}
			throw new IllegalArgumentException(
				"Unknown LLM provider: " + name + ". Supported providers: " + Arrays.stream(values())
					.map(it -> it.name().toLowerCase(Locale.ROOT))
					.collect(Collectors.joining(", "))
			);
		}
	}

	private ChatModelFactory() {
		// Utility class - prevent instantiation
	}

	/**
	 * Creates a chat model.
	 *
	 * @param provider  provider name ({@code openai} or {@code anthropic})
	 * @param url       base URL of the endpoint
	 * @param token     API key, may be omitted for local endpoints
	 * @param modelName model name, the provider default is used when omitted
	 * @return chat model
	 * @throws IllegalArgumentException for an unknown provider or a blank URL
	 */
	@Nonnull
	public static ChatModel create(
		@Nonnull String provider,
		@Nonnull String url,
		@Nullable String token,
		@Nullable String modelName
	) {
		Objects.requireNonNull(url, "url must not be null");
		if (url.isBlank()) {
			throw new IllegalArgumentException("url must not be blank");
		}
		final Provider resolved = Provider.fromName(provider);
		final String baseUrl = stripTrailingSlashes(url.trim());
		final String model = isBlank(modelName) ? resolved.getDefaultModel() : modelName.trim();

		return switch (resolved) {
			case OPENAI -> OpenAiChatModel.builder()
				.baseUrl(baseUrl)
				// OpenAI-compatible local servers still expect some key
				.apiKey(isBlank(token) ? "none" : token)
				.modelName(model)
				.timeout(DEFAULT_TIMEOUT)
				.temperature(DEFAULT_TEMPERATURE)
				.build();
			case ANTHROPIC -> {
				final AnthropicChatModel.AnthropicChatModelBuilder builder = AnthropicChatModel.builder()
					.baseUrl(baseUrl)
					.modelName(model)
					.timeout(DEFAULT_TIMEOUT)
					.temperature(DEFAULT_TEMPERATURE)
					.maxTokens(ANTHROPIC_MAX_TOKENS);
				if (!isBlank(token)) {
					builder.apiKey(token);
				}
				yield builder.build();
			}
		};
	}

	@Nonnull
	static String stripTrailingSlashes(@Nonnull String url) {
		int end = url.length();
		while (end > 0 && url.charAt(end - 1) == '/') {
			end--;
		}
		return url.substring(0, end);
	}

	private static boolean isBlank(@Nullable String value) {
		return value == null || value.isBlank();
	}
}
