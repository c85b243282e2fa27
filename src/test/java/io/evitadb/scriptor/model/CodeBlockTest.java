package io.evitadb.scriptor.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Pipeline value types")
class CodeBlockTest {

	@Test
	@DisplayName("translation produces a new TARGET_CODE block with same lines")
	void shouldProduceTranslatedCopy() {
		final CodeBlock original = new CodeBlock(
			BlockType.NATURAL_LANGUAGE, "sum the list", 4, 4, Map.of("source", "heuristic"), "hint"
		);

		final CodeBlock translated = original.withTranslatedCode("total = sum(items)");

		assertEquals(BlockType.NATURAL_LANGUAGE, original.type());
		assertFalse(original.isTranslated());
		assertEquals(BlockType.TARGET_CODE, translated.type());
		assertEquals("total = sum(items)", translated.content());
		assertEquals(4, translated.firstLine());
		assertEquals(4, translated.lastLine());
		assertEquals("heuristic", translated.metadata().get("source"));
		assertEquals("hint", translated.context());
		assertTrue(translated.isTranslated());
	}

	@Test
	@DisplayName("keeps its own copy of metadata")
	void shouldCopyMetadata() {
		final Map<String, String> metadata = new HashMap<>();
		metadata.put("source", "fence");
		final CodeBlock block = new CodeBlock(BlockType.TARGET_CODE, "x = 1", 1, 1, metadata, null);

		metadata.put("source", "changed");

		assertEquals("fence", block.metadata().get("source"));
		assertThrows(UnsupportedOperationException.class, () -> block.metadata().put("k", "v"));
	}

	@Test
	@DisplayName("rejects inverted line span")
	void shouldRejectInvertedLines() {
		assertThrows(IllegalArgumentException.class, () -> CodeBlock.of(BlockType.TARGET_CODE, "x", 5, 4));
	}

	@Test
	@DisplayName("shifts and trims line spans")
	void shouldShiftAndTrim() {
		final CodeBlock block = CodeBlock.of(BlockType.TARGET_CODE, "a = 1\nb = 2\nc = 3", 1, 3);

		final CodeBlock shifted = block.shiftLines(10);
		assertEquals(11, shifted.firstLine());
		assertEquals(13, shifted.lastLine());
		assertSame(block, block.shiftLines(0));

		final CodeBlock trimmed = block.keepFromLine(3);
		assertEquals("c = 3", trimmed.content());
		assertEquals(3, trimmed.firstLine());
		assertEquals(3, trimmed.lastLine());
		assertSame(block, block.keepFromLine(1));
	}

	@Test
	@DisplayName("describes block by type and span")
	void shouldDescribeBlock() {
		assertEquals("TARGET_CODE[3-7]", CodeBlock.of(BlockType.TARGET_CODE, "x", 3, 7).describe());
		assertEquals("NATURAL_LANGUAGE[1-2]", CodeBlock.naturalLanguage("a\nb").describe());
	}

	@Test
	@DisplayName("marks timed out chunk results")
	void shouldCreateTimeoutResult() {
		final ChunkResult result = ChunkResult.timeout(3, Duration.ofMillis(250));

		assertFalse(result.success());
		assertTrue(result.isTimeout());
		assertEquals("Chunk 3 timed out after 250 ms", result.error());
		assertEquals(250, result.processingTimeMillis());
		assertTrue(result.translatedBlocks().isEmpty());
	}

	@Test
	@DisplayName("chunk covers the content it was cut from")
	void shouldValidateChunkOffsets() {
		final CodeChunk chunk = CodeChunk.whole("čaj = 1");

		assertEquals(7, chunk.length());
		assertEquals(8, chunk.size());
		assertThrows(IllegalArgumentException.class, () -> new CodeChunk(0, 0, 3, 1, "ab"));
		assertThrows(IllegalArgumentException.class, () -> new CodeChunk(0, 0, 2, 0, "ab"));
	}

	@Test
	@DisplayName("computes progress percentage and completion")
	void shouldComputeProgress() {
		final StreamingProgress progress = new StreamingProgress(4, 1, 2, 10, 40, List.of("e"), List.of(), true);

		assertEquals(25.0, progress.progressPercentage(), 0.0001);
		assertFalse(progress.isComplete());
		assertEquals("StreamingProgress[chunks=1/4, bytes=10/40, errors=1, warnings=0]", progress.toString());
		assertEquals(0.0, StreamingProgress.empty().progressPercentage(), 0.0001);
		assertFalse(StreamingProgress.empty().isComplete());
	}

	@Test
	@DisplayName("is not complete while more chunks may still be cut")
	void shouldNotCompleteBeforeSourceIsExhausted() {
		final StreamingProgress allCutCollected = new StreamingProgress(2, 2, 1, 25, 100, List.of(), List.of(), false);
		final StreamingProgress finished = new StreamingProgress(4, 4, 3, 100, 100, List.of(), List.of(), true);
		final StreamingProgress emptyInput = new StreamingProgress(0, 0, null, 0, 0, List.of(), List.of(), true);

		assertFalse(allCutCollected.isComplete());
		assertEquals(25.0, allCutCollected.progressPercentage(), 0.0001);
		assertTrue(finished.isComplete());
		assertEquals(100.0, finished.progressPercentage(), 0.0001);
		assertTrue(emptyInput.isComplete());
		assertEquals(100.0, emptyInput.progressPercentage(), 0.0001);
	}

	@Test
	@DisplayName("exposes translation context as placeholder map")
	void shouldExposeContextMap() {
		final Map<String, String> map = new TranslationContext("run-1", 2, "x = 1").asMap();

		assertEquals("run-1", map.get(TranslationContext.TRANSLATION_ID));
		assertEquals("2", map.get(TranslationContext.CHUNK_INDEX));
		assertEquals("x = 1", map.get(TranslationContext.BEFORE));
		assertEquals("x = 1", map.get(TranslationContext.CODE));
	}

	@Test
	@DisplayName("treats blank translated code as no code")
	void shouldTreatBlankOutcomeAsNoCode() {
		assertTrue(TranslationOutcome.success("x = 1", List.of()).hasCode());
		assertFalse(TranslationOutcome.success("  ", List.of()).hasCode());
		assertFalse(TranslationOutcome.failure("boom").hasCode());
	}
}
