package io.evitadb.scriptor.stream;

import io.evitadb.scriptor.llm.CodeTranslator;
import io.evitadb.scriptor.model.BlockType;
import io.evitadb.scriptor.model.ChunkResult;
import io.evitadb.scriptor.model.CodeBlock;
import io.evitadb.scriptor.model.CodeChunk;
import io.evitadb.scriptor.model.ParseResult;
import io.evitadb.scriptor.model.StreamConfig;
import io.evitadb.scriptor.model.TranslationContext;
import io.evitadb.scriptor.model.TranslationOutcome;
import io.evitadb.scriptor.parser.BlockParser;
import org.apache.maven.plugin.logging.Log;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Processes a single chunk: injects context, parses, translates natural-language blocks,
 * buffers the result and updates the context window.
 *
 * Instances are shared by all workers of one streaming run. Any exception raised while processing
 * is turned into a failed {@link ChunkResult}, so a chunk never aborts the stream.
 */
final class ChunkProcessor {

	/**
	 * Number of trailing lines of the previous chunk injected as context.
	 */
	static final int CONTEXT_LINES = 10;

	private final StreamConfig config;
	private final BlockParser parser;
	private final CodeTranslator translator;
	private final ChunkBuffer buffer;
	private final ContextWindow contextWindow;
	private final String translationId;
	private final Log log;

	ChunkProcessor(
		@Nonnull StreamConfig config,
		@Nonnull BlockParser parser,
		@Nonnull CodeTranslator translator,
		@Nonnull ChunkBuffer buffer,
		@Nonnull ContextWindow contextWindow,
		@Nonnull String translationId,
		@Nonnull Log log
	) {
		this.config = Objects.requireNonNull(config, "config must not be null");
		this.parser = Objects.requireNonNull(parser, "parser must not be null");
		this.translator = Objects.requireNonNull(translator, "translator must not be null");
		this.buffer = Objects.requireNonNull(buffer, "buffer must not be null");
		this.contextWindow = Objects.requireNonNull(contextWindow, "contextWindow must not be null");
		this.translationId = Objects.requireNonNull(translationId, "translationId must not be null");
		this.log = Objects.requireNonNull(log, "log must not be null");
	}

	/**
	 * Processes the chunk. Never throws for processing problems.
	 *
	 * @param chunk chunk to process
	 * @return result of the chunk
	 */
	@Nonnull
	ChunkResult process(@Nonnull CodeChunk chunk) {
		final long start = System.currentTimeMillis();
		try {
			final ChunkResult result = doProcess(chunk, start);
			if (Thread.currentThread().isInterrupted()) {
				// the chunk was abandoned (timeout or cancellation), its output must not leak into later chunks
				return ChunkResult.failure(chunk.index(), "Chunk " + chunk.index() + " was interrupted",
					result.warnings(), elapsedSince(start));
			}
			this.buffer.putIfAbsent(result);
			if (result.success()) {
				this.contextWindow.update(chunk.index(), result.translatedBlocks());
			}
			return result;
		} catch (RuntimeException e) {
			final String message = messageOf(e);
			this.log.error("[CHUNK " + chunk.index() + "] Processing failed: " + message);
			final ChunkResult failure = ChunkResult.failure(chunk.index(), message, List.of(), elapsedSince(start));
			this.buffer.putIfAbsent(failure);
			return failure;
		}
	}

	@Nonnull
	private ChunkResult doProcess(@Nonnull CodeChunk chunk, long start) {
		final String prefix = contextPrefix(chunk);
		final int prefixLines = prefix.isEmpty() ? 0 : (int) prefix.chars().filter(c -> c == '\n').count();

		final ParseResult parsed = this.parser.parse(prefix + chunk.content());
		if (!parsed.success()) {
			return ChunkResult.failure(
				chunk.index(), "Parse error: " + parsed.errors(), parsed.warnings(), elapsedSince(start)
			);
		}

		final List<CodeBlock> blocks = relocate(parsed.blocks(), prefixLines, chunk.startLine());
		final List<String> warnings = new ArrayList<>(parsed.warnings());
		final List<CodeBlock> translated = new ArrayList<>(blocks.size());
		for (CodeBlock block : blocks) {
			if (block.type() == BlockType.NATURAL_LANGUAGE) {
				translated.add(translate(block, chunk.index(), warnings));
			} else {
				translated.add(block);
			}
		}
		return ChunkResult.success(chunk.index(), blocks, translated, warnings, elapsedSince(start));
	}

	/**
	 * Builds the context prefix from the tail of the previous chunk's last translated block.
	 * Empty when context is disabled or the previous chunk has no buffered output yet.
	 */
	@Nonnull
	private String contextPrefix(@Nonnull CodeChunk chunk) {
		if (!this.config.maintainContextWindow() || chunk.index() == 0) {
			return "";
		}
		final ChunkResult previous = this.buffer.get(chunk.index() - 1);
		if (previous == null || !previous.success() || previous.translatedBlocks().isEmpty()) {
			return "";
		}
		final List<CodeBlock> previousBlocks = previous.translatedBlocks();
		final String[] lines = previousBlocks.get(previousBlocks.size() - 1).content().split("\n", -1);
		final String tail = String.join("\n", Arrays.copyOfRange(lines, Math.max(0, lines.length - CONTEXT_LINES), lines.length));
		return tail + "\n\n# --- Chunk " + chunk.index() + " ---\n\n";
	}

	/**
	 * Drops blocks that lie entirely in the injected prefix, trims blocks straddling it and shifts
	 * the rest to line numbers of the original input.
	 */
	@Nonnull
	private static List<CodeBlock> relocate(@Nonnull List<CodeBlock> blocks, int prefixLines, int chunkStartLine) {
		final int firstChunkLine = prefixLines + 1;
		final int offset = chunkStartLine - 1 - prefixLines;
		final List<CodeBlock> result = new ArrayList<>(blocks.size());
		for (CodeBlock block : blocks) {
			if (block.lastLine() < firstChunkLine) {
				continue;
			}
			final CodeBlock trimmed = block.keepFromLine(firstChunkLine);
			if (trimmed.content().isBlank()) {
				continue;
			}
			result.add(trimmed.shiftLines(offset));
		}
		return result;
	}

	@Nonnull
	private CodeBlock translate(@Nonnull CodeBlock block, int chunkIndex, @Nonnull List<String> warnings) {
		final TranslationContext context = new TranslationContext(
			this.translationId,
			chunkIndex,
			this.contextWindow.codeBefore(chunkIndex, this.config.contextWindowSize())
		);
		try {
			final TranslationOutcome outcome = this.translator.translate(
				block.content(), this.config.targetLanguage(), context
			);
			if (!outcome.hasCode()) {
				final String reason = outcome.errors().isEmpty() ? "No code returned" : String.join("; ", outcome.errors());
				this.log.warn("[CHUNK " + chunkIndex + "] Translation of " + block.describe() + " failed: " + reason);
				warnings.add("Translation error: " + reason);
				return block;
			}
			warnings.addAll(outcome.warnings());
			return block.withTranslatedCode(outcome.code());
		} catch (RuntimeException e) {
			final String reason = messageOf(e);
			this.log.error("[CHUNK " + chunkIndex + "] Translation of " + block.describe() + " failed: " + reason);
			warnings.add("Translation error: " + reason);
			return block;
		}
	}

	private static long elapsedSince(long start) {
		return System.currentTimeMillis() - start;
	}

	@Nonnull
	static String messageOf(@Nonnull Throwable e) {
		return e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
	}
}
