package io.evitadb.scriptor.stream;

import org.apache.maven.plugin.logging.Log;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Writes stream events to the Maven log.
 */
public final class LoggingStreamEventListener implements StreamEventListener {

	private final Log log;

	public LoggingStreamEventListener(@Nonnull Log log) {
		this.log = Objects.requireNonNull(log, "log must not be null");
	}

	@Override
	public void onChunkSizeDecision(@Nonnull ChunkSizeDecision decision) {
		this.log.debug("[STREAM] Chunk size " + decision.direction().name().toLowerCase()
			+ ": " + decision.previousSize() + " -> " + decision.nextSize());
	}

	@Override
	public void onChunkProcessed(int chunkIndex, boolean success, long durationMillis) {
		this.log.debug("[STREAM] Chunk " + chunkIndex + (success ? " processed in " : " failed after ")
			+ durationMillis + " ms");
	}

	@Override
	public void onStreamCompleted(int processedChunks) {
		this.log.info("[STREAM] Completed, " + processedChunks + " chunk(s) processed");
	}
}
