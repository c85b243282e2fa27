package io.evitadb.scriptor.stream;

import javax.annotation.Nonnull;
import java.time.Duration;
import java.util.Objects;

/**
 * Sizer that grows the chunk length while chunks finish quickly and shrinks it after slow or failed ones.
 *
 * The first proposal is the configured default. After a successful chunk processed within the target
 * latency the next proposal grows by a quarter, after a failure or a chunk slower than the target it is
 * halved. Proposals always stay within {@code [minSize, maxSize]}.
 */
public final class AdaptiveChunkSizer implements ChunkSizer {

	private static final double GROWTH_FACTOR = 1.25;
	private static final double SHRINK_FACTOR = 0.5;

	private final int minSize;
	private final int maxSize;
	private final long targetLatencyMillis;
	private int currentSize = -1;

	/**
	 * Creates a new adaptive sizer.
	 *
	 * @param minSize       smallest proposed length, at least 1
	 * @param maxSize       largest proposed length
	 * @param targetLatency chunks finishing within this time are considered fast
	 */
	public AdaptiveChunkSizer(int minSize, int maxSize, @Nonnull Duration targetLatency) {
		Objects.requireNonNull(targetLatency, "targetLatency must not be null");
		if (minSize < 1) {
			throw new IllegalArgumentException("minSize must be positive");
		}
		if (maxSize < minSize) {
			throw new IllegalArgumentException("maxSize must be >= minSize");
		}
		this.minSize = minSize;
		this.maxSize = maxSize;
		this.targetLatencyMillis = targetLatency.toMillis();
	}

	@Override
	public synchronized int nextChunkSize(int defaultSize) {
		if (this.currentSize < 0) {
			this.currentSize = clamp(defaultSize);
		}
		return this.currentSize;
	}

	@Override
	public synchronized void recordFeedback(int chunkLength, long durationMillis, boolean success) {
		final int base = this.currentSize < 0 ? clamp(chunkLength) : this.currentSize;
		if (success && durationMillis <= this.targetLatencyMillis) {
			this.currentSize = clamp((int) Math.ceil(base * GROWTH_FACTOR));
		} else {
			this.currentSize = clamp((int) Math.floor(base * SHRINK_FACTOR));
		}
	}

	private int clamp(int size) {
		return Math.max(this.minSize, Math.min(this.maxSize, size));
	}
}
