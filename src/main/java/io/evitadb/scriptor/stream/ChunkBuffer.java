package io.evitadb.scriptor.stream;

import io.evitadb.scriptor.model.ChunkResult;
import io.evitadb.scriptor.model.CodeBlock;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Thread-safe store of chunk results keyed by chunk index.
 *
 * Workers register results with {@link #putIfAbsent(ChunkResult)}, the collector records timeouts with
 * {@link #put(ChunkResult)}, so a worker finishing after its chunk timed out never replaces the timeout.
 */
public final class ChunkBuffer {

	private final ConcurrentMap<Integer, ChunkResult> results = new ConcurrentHashMap<>();

	/**
	 * Stores the result unless a result for the same chunk is already present.
	 *
	 * @param result chunk result
	 * @return true if the result was stored
	 */
	public boolean putIfAbsent(@Nonnull ChunkResult result) {
		Objects.requireNonNull(result, "result must not be null");
		return this.results.putIfAbsent(result.index(), result) == null;
	}

	/**
	 * Stores the result, replacing any previous result for the same chunk.
	 *
	 * @param result chunk result
	 */
	public void put(@Nonnull ChunkResult result) {
		Objects.requireNonNull(result, "result must not be null");
		this.results.put(result.index(), result);
	}

	@Nullable
	public ChunkResult get(int index) {
		return this.results.get(index);
	}

	/**
	 * Returns all stored results ordered by chunk index.
	 *
	 * @return results in index order
	 */
	@Nonnull
	public List<ChunkResult> inOrder() {
		final List<ChunkResult> ordered = new ArrayList<>(this.results.values());
		ordered.sort((a, b) -> Integer.compare(a.index(), b.index()));
		return ordered;
	}

	/**
	 * Returns the translated blocks of successful chunks concatenated in chunk index order.
	 *
	 * @return translated blocks
	 */
	@Nonnull
	public List<CodeBlock> translatedBlocksInOrder() {
		final List<CodeBlock> blocks = new ArrayList<>();
		for (ChunkResult result : inOrder()) {
			if (result.success()) {
				blocks.addAll(result.translatedBlocks());
			}
		}
		return blocks;
	}

	public int size() {
		return this.results.size();
	}

	/**
	 * Returns the approximate UTF-8 size of all buffered translated content.
	 *
	 * @return size in bytes
	 */
	public long sizeInBytes() {
		long size = 0;
		for (ChunkResult result : this.results.values()) {
			for (CodeBlock block : result.translatedBlocks()) {
				size += block.content().getBytes(StandardCharsets.UTF_8).length;
			}
		}
		return size;
	}

	public void clear() {
		this.results.clear();
	}
}
