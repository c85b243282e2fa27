package io.evitadb.scriptor.stream;

import io.evitadb.scriptor.model.BlockType;
import io.evitadb.scriptor.model.ChunkResult;
import io.evitadb.scriptor.model.CodeBlock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ChunkBuffer and ContextWindow bookkeeping")
class ChunkBufferTest {

	@Test
	@DisplayName("keeps the first result registered by a worker")
	void shouldKeepFirstResult() {
		final ChunkBuffer buffer = new ChunkBuffer();
		final ChunkResult first = success(0, "x = 1");

		assertTrue(buffer.putIfAbsent(first));
		assertFalse(buffer.putIfAbsent(success(0, "x = 2")));
		assertSame(first, buffer.get(0));
	}

	@Test
	@DisplayName("timeout replaces a late worker result")
	void shouldReplaceWithTimeout() {
		final ChunkBuffer buffer = new ChunkBuffer();
		buffer.putIfAbsent(success(2, "x = 1"));

		buffer.put(ChunkResult.timeout(2, Duration.ofSeconds(1)));

		assertTrue(buffer.get(2).isTimeout());
	}

	@Test
	@DisplayName("returns translated blocks of successful chunks in index order")
	void shouldReturnTranslatedBlocksInOrder() {
		final ChunkBuffer buffer = new ChunkBuffer();
		buffer.putIfAbsent(success(2, "c = 3"));
		buffer.putIfAbsent(ChunkResult.failure(1, "boom", List.of(), 5));
		buffer.putIfAbsent(success(0, "a = 1"));

		assertEquals(
			List.of("a = 1", "c = 3"),
			buffer.translatedBlocksInOrder().stream().map(CodeBlock::content).toList()
		);
		assertEquals(List.of(0, 1, 2), buffer.inOrder().stream().map(ChunkResult::index).toList());
		assertEquals(3, buffer.size());
		assertEquals(10, buffer.sizeInBytes());

		buffer.clear();
		assertEquals(0, buffer.size());
	}

	@Test
	@DisplayName("context window retains only the most recent code blocks")
	void shouldBoundContextWindow() {
		final ContextWindow window = new ContextWindow();

		IntStream.range(0, 12).forEach(i -> window.update(i, List.of(
			CodeBlock.code("v" + i + " = " + i),
			CodeBlock.naturalLanguage("untranslated " + i)
		)));

		final List<ContextWindow.Entry> entries = window.entries();
		assertEquals(ContextWindow.MAX_ENTRIES, entries.size());
		assertEquals(2, entries.get(0).chunkIndex());
		assertEquals("v11 = 11", entries.get(entries.size() - 1).content());
	}

	@Test
	@DisplayName("context window returns trailing code of preceding chunks only")
	void shouldReturnPrecedingCode() {
		final ContextWindow window = new ContextWindow();
		window.update(1, List.of(CodeBlock.code("b = 2")));
		window.update(0, List.of(CodeBlock.code("a = 1")));
		window.update(3, List.of(CodeBlock.code("d = 4")));

		assertEquals("a = 1\nb = 2", window.codeBefore(2, 100));
		assertEquals("b = 2", window.codeBefore(2, 5));
		assertEquals("", window.codeBefore(0, 100));
		assertEquals(15, window.sizeInBytes());

		window.clear();
		assertTrue(window.entries().isEmpty());
	}

	private static ChunkResult success(int index, String code) {
		final CodeBlock block = CodeBlock.of(BlockType.TARGET_CODE, code, 1, 1);
		return ChunkResult.success(index, List.of(block), List.of(block), List.of(), 1);
	}
}
