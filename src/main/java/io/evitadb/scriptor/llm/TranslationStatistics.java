package io.evitadb.scriptor.llm;

/**
 * Thread-safe counters of translations performed by one translator instance.
 */
public final class TranslationStatistics {

	private long successful;
	private long failed;
	private long totalTimeMillis;

	/**
	 * Records a successful translation.
	 *
	 * @param durationMillis time the translation took
	 */
	public synchronized void recordSuccess(long durationMillis) {
		this.successful++;
		this.totalTimeMillis += durationMillis;
	}

	public synchronized void recordFailure() {
		this.failed++;
	}

	public synchronized long getSuccessful() {
		return this.successful;
	}

	public synchronized long getFailed() {
		return this.failed;
	}

	public synchronized long getTotal() {
		return this.successful + this.failed;
	}

	public synchronized long getTotalTimeMillis() {
		return this.totalTimeMillis;
	}

	/**
	 * Returns the share of successful translations.
	 *
	 * @return percentage between 0 and 100, 0 when nothing was translated
	 */
	public synchronized double getSuccessRate() {
		final long total = this.successful + this.failed;
		return total == 0 ? 0.0 : this.successful * 100.0 / total;
	}

	/**
	 * Returns the average duration of a successful translation.
	 *
	 * @return average in milliseconds, 0 when nothing succeeded
	 */
	public synchronized double getAverageTimeMillis() {
		return this.successful == 0 ? 0.0 : (double) this.totalTimeMillis / this.successful;
	}

	public synchronized void reset() {
		this.successful = 0;
		this.failed = 0;
		this.totalTimeMillis = 0;
	}

	@Override
	public synchronized String toString() {
		return String.format(
			"%d translated, %d failed (%.1f%% success, avg %.0f ms)",
			this.successful, this.failed, getSuccessRate(), getAverageTimeMillis()
		);
	}
}
