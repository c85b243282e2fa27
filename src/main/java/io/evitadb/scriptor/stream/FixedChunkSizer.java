package io.evitadb.scriptor.stream;

/**
 * Sizer that always proposes the configured default length.
 */
public final class FixedChunkSizer implements ChunkSizer {

	@Override
	public int nextChunkSize(int defaultSize) {
		return defaultSize;
	}
}
