package io.evitadb.scriptor.model;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Immutable outcome of processing a single chunk.
 * Created once per chunk and never mutated after it is placed in the chunk buffer.
 *
 * @param index                the chunk index
 * @param success              whether the chunk was parsed and processed
 * @param parsedBlocks         blocks returned by the parser (empty on failure)
 * @param translatedBlocks     blocks after translation (empty on failure)
 * @param error                error message if the chunk failed
 * @param warnings             non-fatal problems collected while processing
 * @param processingTimeMillis wall-clock time spent on the chunk
 */
public record ChunkResult(
	int index,
	boolean success,
	@Nonnull List<CodeBlock> parsedBlocks,
	@Nonnull List<CodeBlock> translatedBlocks,
	@Nullable String error,
	@Nonnull List<String> warnings,
	long processingTimeMillis
) {

	public ChunkResult {
		if (index < 0) {
			throw new IllegalArgumentException("index must be non-negative");
		}
		parsedBlocks = List.copyOf(Objects.requireNonNull(parsedBlocks, "parsedBlocks must not be null"));
		translatedBlocks = List.copyOf(Objects.requireNonNull(translatedBlocks, "translatedBlocks must not be null"));
		warnings = List.copyOf(Objects.requireNonNull(warnings, "warnings must not be null"));
	}

	/**
	 * Creates a successful chunk result.
	 *
	 * @param index                the chunk index
	 * @param parsedBlocks         blocks produced by the parser
	 * @param translatedBlocks     blocks after translation
	 * @param warnings             warnings collected along the way
	 * @param processingTimeMillis time spent processing
	 * @return a successful ChunkResult
	 */
	@Nonnull
	public static ChunkResult success(
		int index,
		@Nonnull List<CodeBlock> parsedBlocks,
		@Nonnull List<CodeBlock> translatedBlocks,
		@Nonnull List<String> warnings,
		long processingTimeMillis
	) {
		return new ChunkResult(index, true, parsedBlocks, translatedBlocks, null, warnings, processingTimeMillis);
	}

	/**
	 * Creates a failed chunk result.
	 *
	 * @param index                the chunk index
	 * @param errorMessage         the error message describing the failure
	 * @param warnings             warnings collected before the failure
	 * @param processingTimeMillis time spent before the failure
	 * @return a failed ChunkResult
	 */
	@Nonnull
	public static ChunkResult failure(
		int index,
		@Nonnull String errorMessage,
		@Nonnull List<String> warnings,
		long processingTimeMillis
	) {
		return new ChunkResult(index, false, List.of(), List.of(), errorMessage, warnings, processingTimeMillis);
	}

	/**
	 * Creates a failed chunk result for a chunk that exceeded its time budget.
	 *
	 * @param index   the chunk index
	 * @param timeout the configured chunk timeout
	 * @return a failed ChunkResult with a timeout error message
	 */
	@Nonnull
	public static ChunkResult timeout(int index, @Nonnull Duration timeout) {
		return failure(
			index,
			"Chunk " + index + " timed out after " + timeout.toMillis() + " ms",
			List.of(),
			timeout.toMillis()
		);
	}

	/**
	 * Returns true if the error message marks a timeout.
	 *
	 * @return true for timed out chunks
	 */
	public boolean isTimeout() {
		return this.error != null && this.error.contains("timed out");
	}
}
