package io.evitadb.scriptor.stream;

import io.evitadb.scriptor.Shutdownable;
import io.evitadb.scriptor.assembler.AssemblyException;
import io.evitadb.scriptor.assembler.CodeAssembler;
import io.evitadb.scriptor.llm.CodeTranslator;
import io.evitadb.scriptor.model.ChunkResult;
import io.evitadb.scriptor.model.CodeChunk;
import io.evitadb.scriptor.model.StreamConfig;
import io.evitadb.scriptor.model.StreamingProgress;
import io.evitadb.scriptor.parser.BlockParser;
import org.apache.maven.plugin.logging.Log;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Splits a large input into chunks, processes them on a worker pool and delivers a result per chunk.
 *
 * In sequential mode ({@code maxConcurrentChunks <= 1}) chunks are processed strictly one at a time in
 * index order. In bounded-parallel mode up to {@link StreamConfig#outstandingLimit()} chunks are submitted
 * and not yet collected at any moment, and results are delivered in completion order. Every chunk is
 * bounded by {@link StreamConfig#chunkTimeout()}, measured from the moment a worker picks it up; a chunk
 * over budget is interrupted and reported as a failed result while the stream continues.
 *
 * Each run uses a fresh worker pool and fresh run state, so workers abandoned by a cancelled or timed out
 * run never write into a later run. {@link #close()} releases the progress reporter, the last worker pool
 * and the translator, in this order, exactly once.
 */
public final class StreamingPipeline implements Shutdownable, AutoCloseable {

	static final long POLL_INTERVAL_MILLIS = 50;
	private static final long SHUTDOWN_TIMEOUT_SECONDS = 60;

	private final StreamConfig config;
	private final BlockParser parser;
	private final CodeTranslator translator;
	private final CodeAssembler assembler;
	private final StreamEventListener listener;
	private final ChunkSizer sizer;
	private final Log log;
	private final List<Consumer<StreamingProgress>> progressCallbacks = new CopyOnWriteArrayList<>();
	private final AtomicBoolean stopRequested = new AtomicBoolean();
	private final AtomicBoolean running = new AtomicBoolean();
	private final AtomicBoolean closed = new AtomicBoolean();

	@Nullable private volatile Run currentRun;
	@Nullable private volatile ExecutorService workers;
	@Nullable private volatile ProgressReporter reporter;

	/**
	 * Creates a pipeline with the chunk sizer derived from the configuration.
	 *
	 * @param config     streaming configuration
	 * @param parser     parser splitting chunks into blocks
	 * @param translator translator of natural-language blocks
	 * @param assembler  assembler of the final program
	 * @param listener   receiver of stream events
	 * @param log        Maven log for output
	 */
	public StreamingPipeline(
		@Nonnull StreamConfig config,
		@Nonnull BlockParser parser,
		@Nonnull CodeTranslator translator,
		@Nonnull CodeAssembler assembler,
		@Nonnull StreamEventListener listener,
		@Nonnull Log log
	) {
		this(config, parser, translator, assembler, listener, defaultSizer(config), log);
	}

	/**
	 * Creates a pipeline with an explicit chunk sizer.
	 *
	 * @param config     streaming configuration
	 * @param parser     parser splitting chunks into blocks
	 * @param translator translator of natural-language blocks
	 * @param assembler  assembler of the final program
	 * @param listener   receiver of stream events
	 * @param sizer      strategy proposing chunk lengths
	 * @param log        Maven log for output
	 */
	public StreamingPipeline(
		@Nonnull StreamConfig config,
		@Nonnull BlockParser parser,
		@Nonnull CodeTranslator translator,
		@Nonnull CodeAssembler assembler,
		@Nonnull StreamEventListener listener,
		@Nonnull ChunkSizer sizer,
		@Nonnull Log log
	) {
		this.config = Objects.requireNonNull(config, "config must not be null");
		this.parser = Objects.requireNonNull(parser, "parser must not be null");
		this.translator = Objects.requireNonNull(translator, "translator must not be null");
		this.assembler = Objects.requireNonNull(assembler, "assembler must not be null");
		this.listener = Objects.requireNonNull(listener, "listener must not be null");
		this.sizer = Objects.requireNonNull(sizer, "sizer must not be null");
		this.log = Objects.requireNonNull(log, "log must not be null");
	}

	/**
	 * Returns the sizer matching the configuration: adaptive between an eighth of the default chunk size
	 * and the hard cap, targeting a quarter of the chunk timeout, or fixed.
	 */
	@Nonnull
	static ChunkSizer defaultSizer(@Nonnull StreamConfig config) {
		if (!config.adaptiveChunking()) {
			return new FixedChunkSizer();
		}
		final int cap = config.hardChunkCap();
		final int min = Math.max(1, Math.min(config.chunkSize(), cap) / 8);
		return new AdaptiveChunkSizer(min, cap, config.chunkTimeout().dividedBy(4));
	}

	/**
	 * Registers a callback invoked periodically with a progress snapshot and once more when a run ends.
	 *
	 * @param callback progress callback
	 */
	public void addProgressCallback(@Nonnull Consumer<StreamingProgress> callback) {
		this.progressCallbacks.add(Objects.requireNonNull(callback, "callback must not be null"));
	}

	/**
	 * Streams the input and delivers each chunk result to the consumer as soon as it is collected.
	 * Only one run may be active at a time.
	 *
	 * @param input    the complete input
	 * @param consumer receiver of chunk results, called on the calling thread
	 * @return summary of the run
	 */
	@Nonnull
	public StreamSummary stream(@Nonnull String input, @Nonnull Consumer<ChunkResult> consumer) {
		Objects.requireNonNull(input, "input must not be null");
		Objects.requireNonNull(consumer, "consumer must not be null");
		if (this.closed.get()) {
			throw new IllegalStateException("Pipeline has been shut down");
		}
		if (!this.running.compareAndSet(false, true)) {
			throw new IllegalStateException("Another stream is already running on this pipeline");
		}

		final long start = System.currentTimeMillis();
		final long inputBytes = input.getBytes(StandardCharsets.UTF_8).length;
		final Run run = new Run(UUID.randomUUID().toString(), inputBytes);
		this.currentRun = run;
		this.stopRequested.set(false);

		final ChunkSource source = new ChunkSource(
			input, this.config, this.sizer, decision -> dispatch(l -> l.onChunkSizeDecision(decision))
		);
		final ChunkProcessor processor = new ChunkProcessor(
			this.config, this.parser, this.translator, run.buffer, run.contextWindow, run.translationId, this.log
		);
		this.log.info("[STREAM] Processing " + inputBytes + " bytes"
			+ (source.isSingleChunk() ? " as a single chunk" : this.config.isParallel() ? " in parallel" : " sequentially"));

		final ExecutorService pool = Executors.newFixedThreadPool(this.config.threadPoolSize());
		this.workers = pool;
		final ProgressReporter progressReporter = new ProgressReporter(
			this.config.progressCallbackInterval(), run.tracker::snapshot, this.progressCallbacks, this.log
		);
		this.reporter = progressReporter;
		progressReporter.start();
		try {
			collect(run, source, processor, pool, consumer);
		} finally {
			progressReporter.stop();
			pool.shutdown();
			dispatch(l -> l.onStreamCompleted(run.processed));
			this.running.set(false);
		}

		final StreamingProgress progress = run.tracker.snapshot();
		final StreamSummary summary = new StreamSummary(
			run.translationId,
			progress.totalChunks(),
			run.successful,
			run.failed,
			run.timedOut,
			run.maxOutstanding,
			this.stopRequested.get(),
			System.currentTimeMillis() - start,
			progress.errors(),
			progress.warnings()
		);
		this.log.info(String.format(
			"[STREAM] Finished %d chunk(s): %d succeeded, %d failed (%d timed out)%s",
			summary.totalChunks(), summary.successfulChunks(), summary.failedChunks(), summary.timedOutChunks(),
			summary.cancelled() ? ", cancelled" : ""
		));
		return summary;
	}

	/**
	 * Streams the input and returns all chunk results in delivery order.
	 *
	 * @param input the complete input
	 * @return collected results
	 */
	@Nonnull
	public List<ChunkResult> streamAll(@Nonnull String input) {
		final List<ChunkResult> results = new ArrayList<>();
		stream(input, results::add);
		return results;
	}

	/**
	 * Streams the input and assembles the translated program.
	 *
	 * @param input the complete input
	 * @return assembled program text
	 * @throws AssemblyException if assembly fails
	 */
	@Nonnull
	public String translate(@Nonnull String input) throws AssemblyException {
		stream(input, result -> {
		});
		return assembleStreamedCode();
	}

	/**
	 * Assembles the translated blocks of the last run, read from the chunk buffer in chunk index order.
	 *
	 * @return assembled program text, empty when nothing was streamed
	 * @throws AssemblyException if assembly fails
	 */
	@Nonnull
	public String assembleStreamedCode() throws AssemblyException {
		final Run run = this.currentRun;
		if (run == null) {
			return this.assembler.assemble(List.of());
		}
		return this.assembler.assemble(run.buffer.translatedBlocksInOrder());
	}

	/**
	 * Requests cancellation of the active run. Returns immediately: no new chunks are submitted, chunks not
	 * yet picked up by a worker are cancelled and chunks in flight are abandoned.
	 */
	public void cancel() {
		if (this.stopRequested.compareAndSet(false, true)) {
			this.log.info("[STREAM] Cancellation requested");
		}
		final Run run = this.currentRun;
		if (run != null) {
			run.inFlight.forEach((future, task) -> {
				if (!task.isStarted()) {
					future.cancel(false);
				}
			});
		}
		final ExecutorService pool = this.workers;
		if (pool != null) {
			pool.shutdown();
		}
	}

	public boolean isCancelled() {
		return this.stopRequested.get();
	}

	/**
	 * Returns the progress of the active or last run.
	 *
	 * @return progress snapshot
	 */
	@Nonnull
	public StreamingProgress getProgress() {
		final Run run = this.currentRun;
		return run == null ? StreamingProgress.empty() : run.tracker.snapshot();
	}

	/**
	 * Returns approximate memory held by the buffered results and the context window of the last run.
	 *
	 * @return map with {@code buffered_chunks}, {@code buffer_bytes} and {@code context_window_bytes}
	 */
	@Nonnull
	public Map<String, Long> getMemoryUsage() {
		final Map<String, Long> usage = new LinkedHashMap<>();
		final Run run = this.currentRun;
		usage.put("buffered_chunks", run == null ? 0L : run.buffer.size());
		usage.put("buffer_bytes", run == null ? 0L : run.buffer.sizeInBytes());
		usage.put("context_window_bytes", run == null ? 0L : run.contextWindow.sizeInBytes());
		return usage;
	}

	/**
	 * Stops the progress reporter, shuts the worker pool down and shuts the translator down.
	 * Subsequent calls do nothing.
	 */
	@Override
	public void shutdown() {
		if (!this.closed.compareAndSet(false, true)) {
			return;
		}
		this.stopRequested.set(true);

		final ProgressReporter progressReporter = this.reporter;
		if (progressReporter != null) {
			progressReporter.stop();
		}

		final ExecutorService pool = this.workers;
		if (pool != null) {
			pool.shutdown();
			try {
				if (!pool.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
					this.log.warn("[STREAM] Worker pool did not terminate in time, forcing shutdown");
					pool.shutdownNow();
				}
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				pool.shutdownNow();
			}
		}

		this.translator.shutdown();
	}

	@Override
	public void close() {
		shutdown();
	}

	/**
	 * Submits chunks while below the outstanding limit and collects results until the source is drained
	 * or cancellation is requested.
	 */
	private void collect(
		@Nonnull Run run,
		@Nonnull ChunkSource source,
		@Nonnull ChunkProcessor processor,
		@Nonnull ExecutorService pool,
		@Nonnull Consumer<ChunkResult> consumer
	) {
		final int limit = this.config.isParallel() ? this.config.outstandingLimit() : 1;
		final CompletionService<ChunkResult> completion = new ExecutorCompletionService<>(pool);
		try {
			while (!this.stopRequested.get()) {
				while (run.inFlight.size() < limit && source.hasNext() && !this.stopRequested.get()) {
					if (!submit(run, source.next(), processor, completion)) {
						break;
					}
				}
				if (!source.hasNext()) {
					run.tracker.sourceExhausted();
				}
				if (run.inFlight.isEmpty()) {
					break;
				}

				final Future<ChunkResult> done = completion.poll(POLL_INTERVAL_MILLIS, TimeUnit.MILLISECONDS);
				if (done != null) {
					final InFlight task = run.inFlight.remove(done);
					if (task != null && !done.isCancelled()) {
						deliver(run, task.chunk, resultOf(run, done, task.chunk), consumer);
					}
				}
				expireTimedOut(run, consumer);
			}
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			this.stopRequested.set(true);
			this.log.warn("[STREAM] Interrupted, abandoning " + run.inFlight.size() + " chunk(s) in flight");
		}
	}

	private boolean submit(
		@Nonnull Run run,
		@Nonnull CodeChunk chunk,
		@Nonnull ChunkProcessor processor,
		@Nonnull CompletionService<ChunkResult> completion
	) {
		final InFlight task = new InFlight(chunk);
		final Future<ChunkResult> future;
		try {
			future = completion.submit(() -> {
				task.markStarted();
				run.tracker.chunkStarted(chunk.index());
				return processor.process(chunk);
			});
		} catch (RejectedExecutionException e) {
			if (this.stopRequested.get()) {
				return false;
			}
			throw e;
		}
		run.inFlight.put(future, task);
		run.tracker.chunkSubmitted();
		run.maxOutstanding = Math.max(run.maxOutstanding, run.inFlight.size());
		return true;
	}

	@Nonnull
	private ChunkResult resultOf(@Nonnull Run run, @Nonnull Future<ChunkResult> done, @Nonnull CodeChunk chunk) {
		try {
			return done.get();
		} catch (ExecutionException e) {
			final Throwable cause = e.getCause() == null ? e : e.getCause();
			this.log.error("[STREAM] Chunk " + chunk.index() + " crashed: " + ChunkProcessor.messageOf(cause));
			final ChunkResult failure = ChunkResult.failure(chunk.index(), ChunkProcessor.messageOf(cause), List.of(), 0);
			run.buffer.putIfAbsent(failure);
			return failure;
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			this.stopRequested.set(true);
			return ChunkResult.failure(chunk.index(), "Chunk " + chunk.index() + " was interrupted", List.of(), 0);
		}
	}

	/**
	 * Cancels started chunks running longer than the chunk timeout and reports them as failed.
	 */
	private void expireTimedOut(@Nonnull Run run, @Nonnull Consumer<ChunkResult> consumer) {
		final Duration timeout = this.config.chunkTimeout();
		final long now = System.currentTimeMillis();
		final Iterator<Map.Entry<Future<ChunkResult>, InFlight>> it = run.inFlight.entrySet().iterator();
		while (it.hasNext()) {
			final Map.Entry<Future<ChunkResult>, InFlight> entry = it.next();
			final InFlight task = entry.getValue();
			// a chunk that completes before the cancel keeps its result, the next poll collects it
			if (task.isStarted() && now - task.startedAt > timeout.toMillis() && cancelExpired(entry.getKey())) {
				it.remove();
				final ChunkResult result = ChunkResult.timeout(task.chunk.index(), timeout);
				run.buffer.put(result);
				run.timedOut++;
				deliver(run, task.chunk, result, consumer);
			}
		}
	}

	/**
	 * Interrupts a chunk over its time budget.
	 *
	 * @param future the chunk task
	 * @return false if the task completed before it could be cancelled
	 */
	static boolean cancelExpired(@Nonnull Future<?> future) {
		return !future.isDone() && future.cancel(true);
	}

	private void deliver(
		@Nonnull Run run,
		@Nonnull CodeChunk chunk,
		@Nonnull ChunkResult result,
		@Nonnull Consumer<ChunkResult> consumer
	) {
		run.processed++;
		if (result.success()) {
			run.successful++;
		} else {
			run.failed++;
			this.log.warn("[STREAM] Chunk " + result.index() + " failed: " + result.error());
		}
		run.tracker.chunkCompleted(chunk, result);
		this.sizer.recordFeedback(chunk.length(), result.processingTimeMillis(), result.success());
		dispatch(l -> l.onChunkProcessed(result.index(), result.success(), result.processingTimeMillis()));
		consumer.accept(result);
	}

	/**
	 * Delivers an event to the listener. Listener failures are logged and ignored.
	 */
	private void dispatch(@Nonnull Consumer<StreamEventListener> event) {
		try {
			event.accept(this.listener);
		} catch (RuntimeException e) {
			this.log.warn("[STREAM] Event listener failed: " + ChunkProcessor.messageOf(e));
		}
	}

	/**
	 * State of a single run. Counters are updated only by the thread that called {@link #stream}.
	 */
	private static final class Run {
		private final String translationId;
		private final ChunkBuffer buffer = new ChunkBuffer();
		private final ContextWindow contextWindow = new ContextWindow();
		private final ProgressTracker tracker = new ProgressTracker();
		private final Map<Future<ChunkResult>, InFlight> inFlight = new ConcurrentHashMap<>();
		private int processed;
		private int successful;
		private int failed;
		private int timedOut;
		private int maxOutstanding;

		private Run(@Nonnull String translationId, long inputBytes) {
			this.translationId = translationId;
			this.tracker.reset(inputBytes);
		}
	}

	/**
	 * Chunk submitted to the pool together with the moment a worker picked it up.
	 */
	private static final class InFlight {
		private final CodeChunk chunk;
		private volatile long startedAt = -1;

		private InFlight(@Nonnull CodeChunk chunk) {
			this.chunk = chunk;
		}

		private void markStarted() {
			this.startedAt = System.currentTimeMillis();
		}

		private boolean isStarted() {
			return this.startedAt >= 0;
		}
	}
}
