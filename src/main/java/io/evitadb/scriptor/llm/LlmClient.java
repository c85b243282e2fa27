package io.evitadb.scriptor.llm;

import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.exception.LangChain4jException;
import dev.langchain4j.exception.NonRetriableException;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.output.TokenUsage;
import io.evitadb.scriptor.Shutdownable;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Thread-safe gateway to a LangChain4j {@link ChatModel}.
 *
 * Retries of transient errors are left to LangChain4j. A {@link NonRetriableException} (bad credentials,
 * unknown model, exhausted quota) is remembered and every later call fails immediately, so the workers
 * of a streaming run stop hammering an endpoint that cannot answer. The same happens after
 * {@link #shutdown()}.
 */
public final class LlmClient implements Shutdownable {

	private final ChatModel model;
	private final AtomicBoolean closed = new AtomicBoolean();
	private final AtomicReference<NonRetriableException> permanentFailure = new AtomicReference<>();
	private final AtomicLong inputTokens = new AtomicLong();
	private final AtomicLong outputTokens = new AtomicLong();

	public LlmClient(@Nonnull ChatModel model) {
		this.model = Objects.requireNonNull(model, "model must not be null");
	}

	/**
	 * Sends a system and a user prompt and returns the text of the answer.
	 *
	 * @param systemPrompt system instructions
	 * @param userPrompt   user request
	 * @return answer text, empty if the model answered without text
	 * @throws NonRetriableException if the model reports a permanent failure
	 * @throws LangChain4jException  if the client is shut down, failed permanently before or the call fails
	 */
	@Nonnull
	public String chat(@Nonnull String systemPrompt, @Nonnull String userPrompt) {
		Objects.requireNonNull(systemPrompt, "systemPrompt must not be null");
		Objects.requireNonNull(userPrompt, "userPrompt must not be null");

		final NonRetriableException previous = this.permanentFailure.get();
		if (previous != null) {
			throw new LangChain4jException("LLM unavailable after permanent failure: " + previous.getMessage(), previous);
		}
		if (this.closed.get()) {
			throw new LangChain4jException("LLM client has been shut down");
		}

		final ChatResponse response;
		try {
			response = this.model.chat(List.of(SystemMessage.from(systemPrompt), UserMessage.from(userPrompt)));
		} catch (NonRetriableException e) {
			this.permanentFailure.compareAndSet(null, e);
			throw e;
		}

		final TokenUsage tokenUsage = response.tokenUsage();
		if (tokenUsage != null) {
			this.inputTokens.addAndGet(tokenUsage.inputTokenCount() == null ? 0 : tokenUsage.inputTokenCount());
			this.outputTokens.addAndGet(tokenUsage.outputTokenCount() == null ? 0 : tokenUsage.outputTokenCount());
		}
		final String text = response.aiMessage() == null ? null : response.aiMessage().text();
		return text == null ? "" : text;
	}

	/**
	 * Returns true if the client has not failed permanently and was not shut down.
	 *
	 * @return true when calls may be attempted
	 */
	public boolean isAvailable() {
		return this.permanentFailure.get() == null && !this.closed.get();
	}

	@Nullable
	public NonRetriableException getPermanentFailure() {
		return this.permanentFailure.get();
	}

	public long getInputTokens() {
		return this.inputTokens.get();
	}

	public long getOutputTokens() {
		return this.outputTokens.get();
	}

	/**
	 * Makes every later call fail fast. Calls in progress are not affected.
	 */
	@Override
	public void shutdown() {
		this.closed.set(true);
	}
}
