package io.evitadb.scriptor.stream;

import javax.annotation.Nonnull;
import java.util.List;

/**
 * Outcome of a single streaming run.
 *
 * @param translationId    identifier of the run, passed to the translator
 * @param totalChunks      number of chunks submitted
 * @param successfulChunks number of chunks that succeeded
 * @param failedChunks     number of chunks that failed, timeouts included
 * @param timedOutChunks   number of chunks that exceeded the chunk timeout
 * @param maxOutstanding   highest number of submitted but not yet collected chunks
 * @param cancelled        whether the run was cancelled
 * @param elapsedMillis    wall-clock duration of the run
 * @param errors           error messages of failed chunks
 * @param warnings         warnings of all chunks
 */
public record StreamSummary(
	@Nonnull String translationId,
	int totalChunks,
	int successfulChunks,
	int failedChunks,
	int timedOutChunks,
	int maxOutstanding,
	boolean cancelled,
	long elapsedMillis,
	@Nonnull List<String> errors,
	@Nonnull List<String> warnings
) {

	public StreamSummary {
		errors = List.copyOf(errors);
		warnings = List.copyOf(warnings);
	}

	/**
	 * Returns true if at least one chunk failed.
	 *
	 * @return true when some chunk failed
	 */
	public boolean hasFailures() {
		return this.failedChunks > 0;
	}
}
