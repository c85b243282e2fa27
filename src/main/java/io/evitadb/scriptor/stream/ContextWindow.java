package io.evitadb.scriptor.stream;

import io.evitadb.scriptor.model.BlockType;
import io.evitadb.scriptor.model.CodeBlock;

import javax.annotation.Nonnull;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Bounded, thread-safe record of the most recently translated code.
 *
 * Only the last {@link #MAX_ENTRIES} target-code blocks are kept. The window is the source of the
 * preceding code handed to the translator.
 */
public final class ContextWindow {

	/**
	 * Maximum number of retained entries.
	 */
	public static final int MAX_ENTRIES = 10;

	private final Deque<Entry> entries = new ArrayDeque<>();

	/**
	 * Single retained code block.
	 *
	 * @param chunkIndex index of the chunk the code came from
	 * @param content    the code
	 * @param metadata   metadata of the originating block
	 */
	public record Entry(int chunkIndex, @Nonnull String content, @Nonnull Map<String, String> metadata) {
	}

	/**
	 * Appends the target-code blocks of a processed chunk, evicting the oldest entries above the bound.
	 *
	 * @param chunkIndex index of the processed chunk
	 * @param blocks     translated blocks of that chunk
	 */
	public synchronized void update(int chunkIndex, @Nonnull List<CodeBlock> blocks) {
		for (CodeBlock block : blocks) {
			if (block.type() == BlockType.TARGET_CODE) {
				this.entries.addLast(new Entry(chunkIndex, block.content(), block.metadata()));
				while (this.entries.size() > MAX_ENTRIES) {
					this.entries.removeFirst();
				}
			}
		}
	}

	/**
	 * Returns the retained code of chunks preceding the given one, trimmed to its last {@code maxChars} chars.
	 *
	 * @param chunkIndex index of the chunk being translated
	 * @param maxChars   maximum length of the returned text
	 * @return preceding code, possibly empty
	 */
	@Nonnull
	public synchronized String codeBefore(int chunkIndex, int maxChars) {
		final String code = this.entries.stream()
			.filter(entry -> entry.chunkIndex() < chunkIndex)
			.sorted(Comparator.comparingInt(Entry::chunkIndex))
			.map(Entry::content)
			.collect(Collectors.joining("\n"));
		return code.length() > maxChars ? code.substring(code.length() - maxChars) : code;
	}

	/**
	 * Returns a copy of the retained entries, oldest first.
	 *
	 * @return entries
	 */
	@Nonnull
	public synchronized List<Entry> entries() {
		return new ArrayList<>(this.entries);
	}

	/**
	 * Returns the approximate UTF-8 size of the retained code.
	 *
	 * @return size in bytes
	 */
	public synchronized long sizeInBytes() {
		long size = 0;
		for (Entry entry : this.entries) {
			size += entry.content().getBytes(StandardCharsets.UTF_8).length;
		}
		return size;
	}

	/**
	 * Removes all entries.
	 */
	public synchronized void clear() {
		this.entries.clear();
	}
}
