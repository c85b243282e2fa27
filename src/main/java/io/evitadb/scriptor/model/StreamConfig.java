package io.evitadb.scriptor.model;

import javax.annotation.Nonnull;
import java.time.Duration;
import java.util.Objects;

/**
 * Immutable configuration snapshot of the streaming pipeline.
 * Created once at pipeline construction and never changed during a run.
 *
 * @param enableStreaming          when false the whole input is processed as one chunk
 * @param minFileSizeForStreaming  inputs smaller than this (UTF-8 bytes) are processed as one chunk
 * @param maxConcurrentChunks      chunks processed at the same time; 1 selects sequential mode
 * @param chunkTimeout             time budget of a single chunk, counted from the moment a worker starts it
 * @param progressCallbackInterval interval between two progress callback ticks
 * @param maintainContextWindow    whether the tail of the previous chunk is prepended to the next one
 * @param contextWindowSize        characters of previously translated code passed to the translator
 * @param enableBackpressure       whether up to {@code maxQueueSize} extra chunks may wait for a worker
 * @param maxQueueSize             chunks allowed to wait for a worker on top of the running ones
 * @param threadPoolSize           number of worker threads
 * @param chunkSize                default chunk length in chars
 * @param maxContextLength         translator context length; chunks never exceed twice this value
 * @param adaptiveChunking         whether chunk sizes adapt to observed throughput
 * @param targetLanguage           language the translator produces
 */
public record StreamConfig(
	boolean enableStreaming,
	int minFileSizeForStreaming,
	int maxConcurrentChunks,
	@Nonnull Duration chunkTimeout,
	@Nonnull Duration progressCallbackInterval,
	boolean maintainContextWindow,
	int contextWindowSize,
	boolean enableBackpressure,
	int maxQueueSize,
	int threadPoolSize,
	int chunkSize,
	int maxContextLength,
	boolean adaptiveChunking,
	@Nonnull String targetLanguage
) {

	public static final int DEFAULT_MIN_FILE_SIZE_FOR_STREAMING = 100 * 1024;
	public static final int DEFAULT_MAX_CONCURRENT_CHUNKS = 3;
	public static final Duration DEFAULT_CHUNK_TIMEOUT = Duration.ofSeconds(30);
	public static final Duration DEFAULT_PROGRESS_CALLBACK_INTERVAL = Duration.ofMillis(500);
	public static final int DEFAULT_CONTEXT_WINDOW_SIZE = 1024;
	public static final int DEFAULT_MAX_QUEUE_SIZE = 10;
	public static final int DEFAULT_THREAD_POOL_SIZE = 4;
	public static final int DEFAULT_CHUNK_SIZE = 4096;
	public static final int DEFAULT_MAX_CONTEXT_LENGTH = 4096;
	public static final String DEFAULT_TARGET_LANGUAGE = "python";

	public StreamConfig {
		if (minFileSizeForStreaming < 0) {
			throw new IllegalArgumentException("minFileSizeForStreaming must be non-negative");
		}
		if (maxConcurrentChunks < 1) {
			throw new IllegalArgumentException("maxConcurrentChunks must be at least 1");
		}
		Objects.requireNonNull(chunkTimeout, "chunkTimeout must not be null");
		if (chunkTimeout.isNegative() || chunkTimeout.isZero()) {
			throw new IllegalArgumentException("chunkTimeout must be positive");
		}
		Objects.requireNonNull(progressCallbackInterval, "progressCallbackInterval must not be null");
		if (progressCallbackInterval.isNegative() || progressCallbackInterval.isZero()) {
			throw new IllegalArgumentException("progressCallbackInterval must be positive");
		}
		if (contextWindowSize < 0) {
			throw new IllegalArgumentException("contextWindowSize must be non-negative");
		}
		if (maxQueueSize < 0) {
			throw new IllegalArgumentException("maxQueueSize must be non-negative");
		}
		if (threadPoolSize < 1) {
			throw new IllegalArgumentException("threadPoolSize must be at least 1");
		}
		if (chunkSize < 1) {
			throw new IllegalArgumentException("chunkSize must be positive");
		}
		if (maxContextLength < 1) {
			throw new IllegalArgumentException("maxContextLength must be positive");
		}
		Objects.requireNonNull(targetLanguage, "targetLanguage must not be null");
	}

	/**
	 * Returns the configuration with all defaults.
	 *
	 * @return default configuration
	 */
	@Nonnull
	public static StreamConfig defaults() {
		return builder().build();
	}

	/**
	 * Creates a builder initialized with the defaults.
	 *
	 * @return new builder
	 */
	@Nonnull
	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Returns true if chunks are processed by more than one worker at a time.
	 *
	 * @return true for bounded-parallel mode
	 */
	public boolean isParallel() {
		return this.maxConcurrentChunks > 1;
	}

	/**
	 * Returns the maximum number of submitted but not yet collected chunks.
	 * With backpressure disabled the bound collapses to the concurrency limit.
	 *
	 * @return outstanding work limit
	 */
	public int outstandingLimit() {
		return this.enableBackpressure
			? this.maxConcurrentChunks + this.maxQueueSize
			: this.maxConcurrentChunks;
	}

	/**
	 * Returns the hard cap for a single chunk length.
	 *
	 * @return twice the translator context length
	 */
	public int hardChunkCap() {
		return this.maxContextLength * 2;
	}

	/**
	 * Returns a builder initialized with the values of this configuration.
	 *
	 * @return builder copy
	 */
	@Nonnull
	public Builder toBuilder() {
		return new Builder()
			.enableStreaming(this.enableStreaming)
			.minFileSizeForStreaming(this.minFileSizeForStreaming)
			.maxConcurrentChunks(this.maxConcurrentChunks)
			.chunkTimeout(this.chunkTimeout)
			.progressCallbackInterval(this.progressCallbackInterval)
			.maintainContextWindow(this.maintainContextWindow)
			.contextWindowSize(this.contextWindowSize)
			.enableBackpressure(this.enableBackpressure)
			.maxQueueSize(this.maxQueueSize)
			.threadPoolSize(this.threadPoolSize)
			.chunkSize(this.chunkSize)
			.maxContextLength(this.maxContextLength)
			.adaptiveChunking(this.adaptiveChunking)
			.targetLanguage(this.targetLanguage);
	}

	/**
	 * Builder for {@link StreamConfig}.
	 */
	public static final class Builder {
		private boolean enableStreaming = true;
		private int minFileSizeForStreaming = DEFAULT_MIN_FILE_SIZE_FOR_STREAMING;
		private int maxConcurrentChunks = DEFAULT_MAX_CONCURRENT_CHUNKS;
		private Duration chunkTimeout = DEFAULT_CHUNK_TIMEOUT;
		private Duration progressCallbackInterval = DEFAULT_PROGRESS_CALLBACK_INTERVAL;
		private boolean maintainContextWindow = true;
		private int contextWindowSize = DEFAULT_CONTEXT_WINDOW_SIZE;
		private boolean enableBackpressure = true;
		private int maxQueueSize = DEFAULT_MAX_QUEUE_SIZE;
		private int threadPoolSize = DEFAULT_THREAD_POOL_SIZE;
		private int chunkSize = DEFAULT_CHUNK_SIZE;
		private int maxContextLength = DEFAULT_MAX_CONTEXT_LENGTH;
		private boolean adaptiveChunking = false;
		private String targetLanguage = DEFAULT_TARGET_LANGUAGE;

		private Builder() {}

		@Nonnull
		public Builder enableStreaming(boolean enableStreaming) {
			this.enableStreaming = enableStreaming;
			return this;
		}

		@Nonnull
		public Builder minFileSizeForStreaming(int minFileSizeForStreaming) {
			this.minFileSizeForStreaming = minFileSizeForStreaming;
			return this;
		}

		@Nonnull
		public Builder maxConcurrentChunks(int maxConcurrentChunks) {
			this.maxConcurrentChunks = maxConcurrentChunks;
			return this;
		}

		@Nonnull
		public Builder chunkTimeout(@Nonnull Duration chunkTimeout) {
			this.chunkTimeout = chunkTimeout;
			return this;
		}

		@Nonnull
		public Builder progressCallbackInterval(@Nonnull Duration progressCallbackInterval) {
			this.progressCallbackInterval = progressCallbackInterval;
			return this;
		}

		@Nonnull
		public Builder maintainContextWindow(boolean maintainContextWindow) {
			this.maintainContextWindow = maintainContextWindow;
			return this;
		}

		@Nonnull
		public Builder contextWindowSize(int contextWindowSize) {
			this.contextWindowSize = contextWindowSize;
			return this;
		}

		@Nonnull
		public Builder enableBackpressure(boolean enableBackpressure) {
			this.enableBackpressure = enableBackpressure;
			return this;
		}

		@Nonnull
		public Builder maxQueueSize(int maxQueueSize) {
			this.maxQueueSize = maxQueueSize;
			return this;
		}

		@Nonnull
		public Builder threadPoolSize(int threadPoolSize) {
			this.threadPoolSize = threadPoolSize;
			return this;
		}

		@Nonnull
		public Builder chunkSize(int chunkSize) {
			this.chunkSize = chunkSize;
			return this;
		}

		@Nonnull
		public Builder maxContextLength(int maxContextLength) {
			this.maxContextLength = maxContextLength;
			return this;
		}

		@Nonnull
		public Builder adaptiveChunking(boolean adaptiveChunking) {
			this.adaptiveChunking = adaptiveChunking;
			return this;
		}

		@Nonnull
		public Builder targetLanguage(@Nonnull String targetLanguage) {
			this.targetLanguage = targetLanguage;
			return this;
		}

		@Nonnull
		public StreamConfig build() {
			return new StreamConfig(
				this.enableStreaming,
				this.minFileSizeForStreaming,
				this.maxConcurrentChunks,
				this.chunkTimeout,
				this.progressCallbackInterval,
				this.maintainContextWindow,
				this.contextWindowSize,
				this.enableBackpressure,
				this.maxQueueSize,
				this.threadPoolSize,
				this.chunkSize,
				this.maxContextLength,
				this.adaptiveChunking,
				this.targetLanguage
			);
		}
	}
}
