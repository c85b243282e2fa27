package io.evitadb.scriptor.stream;

import io.evitadb.scriptor.model.ChunkResult;
import io.evitadb.scriptor.model.CodeChunk;
import io.evitadb.scriptor.model.StreamingProgress;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Thread-safe counters of a streaming run, readable at any time as a {@link StreamingProgress} snapshot.
 */
public final class ProgressTracker {

	private final AtomicInteger totalChunks = new AtomicInteger();
	private final AtomicInteger processedChunks = new AtomicInteger();
	private final AtomicInteger currentChunk = new AtomicInteger(-1);
	private final AtomicLong bytesProcessed = new AtomicLong();
	private final AtomicLong totalBytes = new AtomicLong();
	private final AtomicBoolean sourceExhausted = new AtomicBoolean();
	private final List<String> errors = Collections.synchronizedList(new ArrayList<>());
	private final List<String> warnings = Collections.synchronizedList(new ArrayList<>());

	/**
	 * Resets all counters for a new run.
	 *
	 * @param inputBytes UTF-8 size of the new input
	 */
	public void reset(long inputBytes) {
		this.totalChunks.set(0);
		this.processedChunks.set(0);
		this.currentChunk.set(-1);
		this.bytesProcessed.set(0);
		this.totalBytes.set(inputBytes);
		this.sourceExhausted.set(false);
		this.errors.clear();
		this.warnings.clear();
	}

	public void chunkSubmitted() {
		this.totalChunks.incrementAndGet();
	}

	public void chunkStarted(int index) {
		this.currentChunk.set(index);
	}

	/**
	 * Marks that no further chunk will be cut, so {@code totalChunks} is final.
	 */
	public void sourceExhausted() {
		this.sourceExhausted.set(true);
	}

	/**
	 * Records a collected chunk result.
	 *
	 * @param chunk  the processed chunk
	 * @param result its result
	 */
	public void chunkCompleted(@Nonnull CodeChunk chunk, @Nonnull ChunkResult result) {
		this.processedChunks.incrementAndGet();
		this.bytesProcessed.addAndGet(chunk.size());
		if (!result.success() && result.error() != null) {
			this.errors.add(result.error());
		}
		this.warnings.addAll(result.warnings());
	}

	/**
	 * Returns an immutable snapshot of the counters.
	 *
	 * @return progress snapshot
	 */
	@Nonnull
	public StreamingProgress snapshot() {
		final List<String> errorsCopy;
		synchronized (this.errors) {
			errorsCopy = new ArrayList<>(this.errors);
		}
		final List<String> warningsCopy;
		synchronized (this.warnings) {
			warningsCopy = new ArrayList<>(this.warnings);
		}
		final int current = this.currentChunk.get();
		return new StreamingProgress(
			this.totalChunks.get(),
			this.processedChunks.get(),
			current < 0 ? null : current,
			this.bytesProcessed.get(),
			this.totalBytes.get(),
			errorsCopy,
			warningsCopy,
			this.sourceExhausted.get()
		);
	}
}
