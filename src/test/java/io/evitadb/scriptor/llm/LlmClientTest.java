package io.evitadb.scriptor.llm;

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.exception.AuthenticationException;
import dev.langchain4j.exception.LangChain4jException;
import dev.langchain4j.exception.NonRetriableException;
import dev.langchain4j.exception.RateLimitException;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.output.TokenUsage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

@DisplayName("LlmClient permanent failure handling")
class LlmClientTest {

	private ChatModel mockModel;

	@BeforeEach
	void setUp() {
		mockModel = mock(ChatModel.class);
	}

	@Test
	@DisplayName("shouldSendSystemAndUserPrompt")
	@SuppressWarnings("unchecked")
	void shouldSendSystemAndUserPrompt() {
		when(mockModel.chat(anyList())).thenReturn(response("x = 1", 10, 3));

		final LlmClient client = new LlmClient(mockModel);
		final String answer = client.chat("system", "user");

		assertEquals("x = 1", answer);
		final ArgumentCaptor<List<ChatMessage>> captor = ArgumentCaptor.forClass(List.class);
		verify(mockModel).chat(captor.capture());
		assertEquals(2, captor.getValue().size());
		assertEquals("system", ((SystemMessage) captor.getValue().get(0)).text());
		assertEquals("user", ((UserMessage) captor.getValue().get(1)).singleText());
	}

	@Test
	@DisplayName("shouldAccumulateTokenUsage")
	void shouldAccumulateTokenUsage() {
		when(mockModel.chat(anyList())).thenReturn(response("a", 10, 3), response("b", 5, 2));

		final LlmClient client = new LlmClient(mockModel);
		client.chat("s", "u");
		client.chat("s", "u");

		assertEquals(15, client.getInputTokens());
		assertEquals(5, client.getOutputTokens());
	}

	@Test
	@DisplayName("shouldReturnEmptyTextWhenModelAnswersNothing")
	void shouldReturnEmptyTextWhenModelAnswersNothing() {
		when(mockModel.chat(anyList())).thenReturn(ChatResponse.builder().aiMessage(AiMessage.from("")).build());

		assertEquals("", new LlmClient(mockModel).chat("s", "u"));
	}

	@Test
	@DisplayName("shouldRememberPermanentFailure")
	void shouldRememberPermanentFailure() {
		when(mockModel.chat(anyList())).thenThrow(new AuthenticationException("Invalid API key"));

		final LlmClient client = new LlmClient(mockModel);

		assertTrue(client.isAvailable());
		assertThrows(NonRetriableException.class, () -> client.chat("s", "u"));
		assertFalse(client.isAvailable());
		assertNotNull(client.getPermanentFailure());
	}

	@Test
	@DisplayName("shouldFastFailAfterPermanentFailure")
	void shouldFastFailAfterPermanentFailure() {
		when(mockModel.chat(anyList())).thenThrow(new AuthenticationException("Invalid API key"));

		final LlmClient client = new LlmClient(mockModel);
		assertThrows(NonRetriableException.class, () -> client.chat("s", "u"));

		final LangChain4jException exception = assertThrows(LangChain4jException.class, () -> client.chat("s", "u"));
		assertTrue(exception.getMessage().contains("permanent failure"));
		assertTrue(exception.getMessage().contains("Invalid API key"));
		verify(mockModel, times(1)).chat(anyList());
	}

	@Test
	@DisplayName("shouldNotRememberTransientFailure")
	void shouldNotRememberTransientFailure() {
		when(mockModel.chat(anyList()))
			.thenThrow(new RateLimitException("Too many requests"))
			.thenReturn(response("ok", 1, 1));

		final LlmClient client = new LlmClient(mockModel);

		assertThrows(RateLimitException.class, () -> client.chat("s", "u"));
		assertTrue(client.isAvailable());
		assertEquals("ok", client.chat("s", "u"));
	}

	@Test
	@DisplayName("shouldRejectCallsAfterShutdown")
	void shouldRejectCallsAfterShutdown() {
		final LlmClient client = new LlmClient(mockModel);
		client.shutdown();

		final LangChain4jException exception = assertThrows(LangChain4jException.class, () -> client.chat("s", "u"));
		assertTrue(exception.getMessage().contains("shut down"));
		assertFalse(client.isAvailable());
		verifyNoInteractions(mockModel);
	}

	private static ChatResponse response(String text, int inputTokens, int outputTokens) {
		return ChatResponse.builder()
			.aiMessage(AiMessage.from(text))
			.tokenUsage(new TokenUsage(inputTokens, outputTokens))
			.build();
	}
}
