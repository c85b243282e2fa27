package io.evitadb.scriptor.stream;

import io.evitadb.scriptor.model.CodeChunk;
import io.evitadb.scriptor.model.StreamConfig;

import javax.annotation.Nonnull;
import java.nio.charset.StandardCharsets;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Lazy producer of chunks over an input text.
 *
 * Chunks are cut only when requested, so the size of each chunk can follow the feedback the sizer
 * received for chunks processed so far. When streaming is disabled or the input is smaller than the
 * streaming threshold, the whole input is produced as a single chunk.
 */
public final class ChunkSource implements Iterator<CodeChunk> {

	private final String input;
	private final StreamConfig config;
	private final ChunkSizer sizer;
	private final Consumer<ChunkSizeDecision> decisions;
	private final boolean singleChunk;
	private int position;
	private int index;
	private int line = 1;
	private int previousSize = -1;

	/**
	 * Creates a chunk source over the given input.
	 *
	 * @param input     the complete input text
	 * @param config    streaming configuration
	 * @param sizer     strategy proposing chunk lengths
	 * @param decisions receives a decision whenever the chunk length changes
	 */
	public ChunkSource(
		@Nonnull String input,
		@Nonnull StreamConfig config,
		@Nonnull ChunkSizer sizer,
		@Nonnull Consumer<ChunkSizeDecision> decisions
	) {
		this.input = Objects.requireNonNull(input, "input must not be null");
		this.config = Objects.requireNonNull(config, "config must not be null");
		this.sizer = Objects.requireNonNull(sizer, "sizer must not be null");
		this.decisions = Objects.requireNonNull(decisions, "decisions must not be null");
		this.singleChunk = !config.enableStreaming()
			|| input.getBytes(StandardCharsets.UTF_8).length < config.minFileSizeForStreaming();
	}

	/**
	 * Returns true if the whole input is produced as one chunk.
	 *
	 * @return true when streaming does not apply to this input
	 */
	public boolean isSingleChunk() {
		return this.singleChunk;
	}

	@Override
	public boolean hasNext() {
		return this.position < this.input.length();
	}

	@Nonnull
	@Override
	public CodeChunk next() {
		if (!hasNext()) {
			throw new NoSuchElementException("No more chunks");
		}

		final int end;
		if (this.singleChunk) {
			end = this.input.length();
		} else {
			final int desired = Math.max(1, Math.min(this.config.hardChunkCap(), this.sizer.nextChunkSize(this.config.chunkSize())));
			if (this.previousSize > 0 && desired != this.previousSize) {
				this.decisions.accept(ChunkSizeDecision.of(this.previousSize, desired));
			}
			this.previousSize = desired;
			end = CodeChunker.findBoundary(this.input, this.position, desired);
		}

		final String content = this.input.substring(this.position, end);
		final CodeChunk chunk = new CodeChunk(this.index, this.position, end, this.line, content);
		this.index++;
		this.position = end;
		this.line += countLineBreaks(content);
		return chunk;
	}

	private static int countLineBreaks(@Nonnull String content) {
		int count = 0;
		for (int i = 0; i < content.length(); i++) {
			if (content.charAt(i) == '\n') {
				count++;
			}
		}
		return count;
	}
}
