package io.evitadb.scriptor.stream;

import io.evitadb.scriptor.model.StreamingProgress;
import org.apache.maven.plugin.logging.Log;

import javax.annotation.Nonnull;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Periodically hands progress snapshots to registered callbacks on a dedicated thread.
 * A failing callback is logged and does not affect other callbacks or later ticks.
 */
final class ProgressReporter {

	private static final long STOP_TIMEOUT_SECONDS = 5;

	private final Duration interval;
	private final Supplier<StreamingProgress> progress;
	private final List<Consumer<StreamingProgress>> callbacks;
	private final Log log;
	private ScheduledExecutorService scheduler;

	ProgressReporter(
		@Nonnull Duration interval,
		@Nonnull Supplier<StreamingProgress> progress,
		@Nonnull List<Consumer<StreamingProgress>> callbacks,
		@Nonnull Log log
	) {
		this.interval = Objects.requireNonNull(interval, "interval must not be null");
		this.progress = Objects.requireNonNull(progress, "progress must not be null");
		this.callbacks = Objects.requireNonNull(callbacks, "callbacks must not be null");
		this.log = Objects.requireNonNull(log, "log must not be null");
	}

	/**
	 * Starts the periodic reporting.
	 */
	synchronized void start() {
		if (this.scheduler != null) {
			throw new IllegalStateException("Progress reporter already started");
		}
		this.scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
			final Thread thread = new Thread(runnable, "scriptor-progress");
			thread.setDaemon(true);
			return thread;
		});
		final long millis = Math.max(1, this.interval.toMillis());
		this.scheduler.scheduleAtFixedRate(this::report, millis, millis, TimeUnit.MILLISECONDS);
	}

	/**
	 * Stops the periodic reporting, waits for a running tick and reports the final state once.
	 */
	synchronized void stop() {
		if (this.scheduler == null) {
			return;
		}
		this.scheduler.shutdownNow();
		try {
			if (!this.scheduler.awaitTermination(STOP_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
				this.log.warn("[PROGRESS] Progress reporter did not stop within " + STOP_TIMEOUT_SECONDS + " seconds");
			}
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
		}
		this.scheduler = null;
		report();
	}

	/**
	 * Invokes every callback with a fresh snapshot.
	 */
	void report() {
		final StreamingProgress snapshot = this.progress.get();
		for (Consumer<StreamingProgress> callback : this.callbacks) {
			try {
				callback.accept(snapshot);
			} catch (RuntimeException e) {
				this.log.error("[PROGRESS] Progress callback failed: " + ChunkProcessor.messageOf(e));
			}
		}
	}
}
