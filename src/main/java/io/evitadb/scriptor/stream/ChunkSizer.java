package io.evitadb.scriptor.stream;

/**
 * Strategy proposing the length of the next chunk.
 */
public interface ChunkSizer {

	/**
	 * Proposes the length of the next chunk. The caller clamps the proposal to the allowed range.
	 *
	 * @param defaultSize configured default chunk length
	 * @return proposed chunk length in chars
	 */
	int nextChunkSize(int defaultSize);

	/**
	 * Receives the outcome of a processed chunk.
	 *
	 * @param chunkLength    length of the chunk in chars
	 * @param durationMillis processing time of the chunk
	 * @param success        whether the chunk was processed successfully
	 */
	default void recordFeedback(int chunkLength, long durationMillis, boolean success) {
		// fixed strategies ignore feedback
	}
}
