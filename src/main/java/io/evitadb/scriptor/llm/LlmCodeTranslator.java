package io.evitadb.scriptor.llm;

import dev.langchain4j.exception.NonRetriableException;
import dev.langchain4j.model.chat.ChatModel;
import io.evitadb.scriptor.model.TranslationContext;
import io.evitadb.scriptor.model.TranslationOutcome;
import org.apache.maven.plugin.logging.Log;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Translates natural-language blocks with a language model.
 *
 * The prompts are rendered from {@code translate-code-system.txt} and {@code translate-code-user.txt}.
 * The answer is cleaned by {@link GeneratedCodeCleaner}, whose validation warnings are attached to the
 * outcome. Every problem, including a permanent failure of the model, is reported as a failed outcome.
 */
public final class LlmCodeTranslator implements CodeTranslator {

	static final String SYSTEM_TEMPLATE = "translate-code-system.txt";
	static final String USER_TEMPLATE = "translate-code-user.txt";
	static final int MAX_INPUT_LENGTH = 50_000;

	private final LlmClient client;
	private final PromptLoader promptLoader;
	private final Log log;
	private final TranslationStatistics statistics = new TranslationStatistics();

	/**
	 * Creates a translator.
	 *
	 * @param client       LLM client
	 * @param promptLoader loader of the prompt templates
	 * @param log          Maven log for output
	 */
	public LlmCodeTranslator(@Nonnull LlmClient client, @Nonnull PromptLoader promptLoader, @Nonnull Log log) {
		this.client = Objects.requireNonNull(client, "client must not be null");
		this.promptLoader = Objects.requireNonNull(promptLoader, "promptLoader must not be null");
		this.log = Objects.requireNonNull(log, "log must not be null");
	}

	/**
	 * Creates a translator wrapping the chat model in a new {@link LlmClient}.
	 *
	 * @param model chat model
	 * @param log   Maven log for output
	 */
	public LlmCodeTranslator(@Nonnull ChatModel model, @Nonnull Log log) {
		this(new LlmClient(model), new PromptLoader(), log);
	}

	@Nonnull
	@Override
	public TranslationOutcome translate(
		@Nonnull String text,
		@Nonnull String targetLanguage,
		@Nonnull TranslationContext context
	) {
		Objects.requireNonNull(text, "text must not be null");
		Objects.requireNonNull(targetLanguage, "targetLanguage must not be null");
		Objects.requireNonNull(context, "context must not be null");

		final long start = System.currentTimeMillis();
		final String validationError = validateInput(text);
		if (validationError != null) {
			this.statistics.recordFailure();
			return TranslationOutcome.failure("Input validation failed: " + validationError);
		}

		final Map<String, String> values = Map.of(
			"language", displayName(targetLanguage),
			"text", text.strip(),
			"before", context.before()
		);
		try {
			final String answer = this.client.chat(
				this.promptLoader.render(SYSTEM_TEMPLATE, values),
				this.promptLoader.render(USER_TEMPLATE, values)
			);
			final String code = GeneratedCodeCleaner.clean(answer, targetLanguage);
			if (code.isBlank()) {
				this.statistics.recordFailure();
				return TranslationOutcome.failure("Model returned empty or invalid result");
			}

			final List<String> warnings = GeneratedCodeCleaner.validate(code, targetLanguage);
			final long duration = System.currentTimeMillis() - start;
			this.statistics.recordSuccess(duration);
			this.log.debug("[TRANSLATE] Chunk " + context.chunkIndex() + ": block translated in " + duration + " ms"
				+ (warnings.isEmpty() ? "" : " with warnings " + warnings));
			return TranslationOutcome.success(code, warnings);
		} catch (NonRetriableException e) {
			this.statistics.recordFailure();
			this.log.error("[TRANSLATE] Permanent LLM failure: " + e.getMessage());
			return TranslationOutcome.failure("Permanent LLM failure: " + e.getMessage());
		} catch (RuntimeException e) {
			this.statistics.recordFailure();
			this.log.warn("[TRANSLATE] Chunk " + context.chunkIndex() + ": " + e.getMessage());
			return TranslationOutcome.failure("LLM translation failed: " + e.getMessage());
		}
	}

	@Nonnull
	public TranslationStatistics getStatistics() {
		return this.statistics;
	}

	public void resetStatistics() {
		this.statistics.reset();
		this.log.debug("[TRANSLATE] Statistics reset");
	}

	@Override
	public void shutdown() {
		this.client.shutdown();
		this.log.info("[TRANSLATE] " + this.statistics + ", tokens in/out: "
			+ this.client.getInputTokens() + "/" + this.client.getOutputTokens());
	}

	@Nullable
	private static String validateInput(@Nonnull String text) {
		if (text.isBlank()) {
			return "text is empty";
		}
		if (text.length() > MAX_INPUT_LENGTH) {
			return "text is longer than " + MAX_INPUT_LENGTH + " characters";
		}
		return null;
	}

	@Nonnull
	static String displayName(@Nonnull String targetLanguage) {
		final String trimmed = targetLanguage.trim();
		if (trimmed.isEmpty()) {
			return trimmed;
		}
		return trimmed.substring(0, 1).toUpperCase(Locale.ROOT) + trimmed.substring(1).toLowerCase(Locale.ROOT);
	}
}
