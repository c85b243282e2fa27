package io.evitadb.scriptor.stream;

import javax.annotation.Nonnull;

/**
 * Receives notifications about a streaming run. All methods default to doing nothing.
 * Exceptions thrown by a listener are logged by the pipeline and otherwise ignored.
 */
public interface StreamEventListener {

	/**
	 * Called before a chunk is cut with a length different from the previous chunk.
	 *
	 * @param decision the resize
	 */
	default void onChunkSizeDecision(@Nonnull ChunkSizeDecision decision) {
	}

	/**
	 * Called when the result of a chunk is collected.
	 *
	 * @param chunkIndex     chunk index
	 * @param success        whether the chunk succeeded
	 * @param durationMillis processing time
	 */
	default void onChunkProcessed(int chunkIndex, boolean success, long durationMillis) {
	}

	/**
	 * Called once at the end of every run, including failed and cancelled ones.
	 *
	 * @param processedChunks number of collected chunks
	 */
	default void onStreamCompleted(int processedChunks) {
	}

	/**
	 * Returns a listener ignoring all events.
	 *
	 * @return no-op listener
	 */
	@Nonnull
	static StreamEventListener noop() {
		return new StreamEventListener() {
		};
	}
}
