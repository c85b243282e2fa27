package io.evitadb.scriptor.model;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;

/**
 * Immutable snapshot of streaming progress handed to progress callbacks.
 *
 * Chunks are cut lazily, so {@code totalChunks} grows while the run proceeds. Completion and percentage
 * are therefore derived from the input size and from whether the last chunk has already been cut.
 *
 * @param totalChunks     number of chunks cut so far
 * @param processedChunks number of chunks collected
 * @param currentChunk    index of the chunk most recently started, null before the first one
 * @param bytesProcessed  UTF-8 bytes of collected chunks
 * @param totalBytes      UTF-8 bytes of the whole input
 * @param errors          error messages of failed chunks
 * @param warnings        warnings of all collected chunks
 * @param sourceExhausted true once the last chunk of the input has been cut
 */
public record StreamingProgress(
	int totalChunks,
	int processedChunks,
	@Nullable Integer currentChunk,
	long bytesProcessed,
	long totalBytes,
	@Nonnull List<String> errors,
	@Nonnull List<String> warnings,
	boolean sourceExhausted
) {

	public StreamingProgress {
		errors = List.copyOf(errors);
		warnings = List.copyOf(warnings);
	}

	/**
	 * Creates a snapshot with all counters at zero.
	 *
	 * @return empty progress
	 */
	@Nonnull
	public static StreamingProgress empty() {
		return new StreamingProgress(0, 0, null, 0, 0, List.of(), List.of(), false);
	}

	/**
	 * Returns progress as percentage of input bytes covered by collected chunks.
	 * An empty input counts as fully processed once the source is exhausted.
	 *
	 * @return value between 0 and 100
	 */
	public double progressPercentage() {
		if (this.totalBytes <= 0) {
			return this.sourceExhausted ? 100.0 : 0.0;
		}
		return Math.min(100.0, (this.bytesProcessed * 100.0) / this.totalBytes);
	}

	/**
	 * Returns true once the last chunk was cut and every chunk was collected.
	 *
	 * @return true when complete
	 */
	public boolean isComplete() {
		return this.sourceExhausted && this.processedChunks >= this.totalChunks;
	}

	@Override
	public String toString() {
		return String.format(
			"StreamingProgress[chunks=%d/%d, bytes=%d/%d, errors=%d, warnings=%d]",
			this.processedChunks, this.totalChunks, this.bytesProcessed, this.totalBytes,
			this.errors.size(), this.warnings.size()
		);
	}
}
