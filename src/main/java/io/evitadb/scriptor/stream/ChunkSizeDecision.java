package io.evitadb.scriptor.stream;

import javax.annotation.Nonnull;

/**
 * Change of the chunk size between two consecutive chunks.
 *
 * @param previousSize size used for the previous chunk
 * @param nextSize     size used for the next chunk
 * @param direction    whether the size grows or shrinks
 */
public record ChunkSizeDecision(
	int previousSize,
	int nextSize,
	@Nonnull Direction direction
) {

	/**
	 * Direction of a resize.
	 */
	public enum Direction {
		INCREASE,
		DECREASE
	}

	public ChunkSizeDecision {
		if (previousSize == nextSize) {
			throw new IllegalArgumentException("previousSize and nextSize must differ");
		}
	}

	/**
	 * Creates a decision with the direction derived from the sizes.
	 *
	 * @param previousSize size of the previous chunk
	 * @param nextSize     size of the next chunk
	 * @return resize decision
	 */
	@Nonnull
	public static ChunkSizeDecision of(int previousSize, int nextSize) {
		return new ChunkSizeDecision(
			previousSize, nextSize, nextSize > previousSize ? Direction.INCREASE : Direction.DECREASE
		);
	}
}
