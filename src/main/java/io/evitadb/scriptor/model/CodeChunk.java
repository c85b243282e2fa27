package io.evitadb.scriptor.model;

import javax.annotation.Nonnull;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Contiguous slice of the original input assigned a sequential index.
 * Concatenating the content of all chunks in index order reconstructs the input.
 *
 * @param index       zero-based index of this chunk in the input
 * @param startOffset char offset where this chunk starts in the original input
 * @param endOffset   char offset where this chunk ends in the original input (exclusive)
 * @param startLine   1-based line number of the first character of this chunk
 * @param content     the chunk text
 */
public record CodeChunk(
	int index,
	int startOffset,
	int endOffset,
	int startLine,
	@Nonnull String content
) {

	public CodeChunk {
		if (index < 0) {
			throw new IllegalArgumentException("index must be non-negative");
		}
		if (startOffset < 0) {
			throw new IllegalArgumentException("startOffset must be non-negative");
		}
		if (endOffset < startOffset) {
			throw new IllegalArgumentException("endOffset must be >= startOffset");
		}
		if (startLine < 1) {
			throw new IllegalArgumentException("startLine must be positive");
		}
		Objects.requireNonNull(content, "content must not be null");
		if (content.length() != endOffset - startOffset) {
			throw new IllegalArgumentException("content length must match the offset range");
		}
	}

	/**
	 * Creates a chunk that covers the complete input.
	 *
	 * @param content the whole input
	 * @return single chunk with index zero
	 */
	@Nonnull
	public static CodeChunk whole(@Nonnull String content) {
		return new CodeChunk(0, 0, content.length(), 1, content);
	}

	/**
	 * Returns the size of this chunk in bytes using UTF-8 encoding.
	 *
	 * @return the byte size of the content
	 */
	public int size() {
		return this.content.getBytes(StandardCharsets.UTF_8).length;
	}

	/**
	 * Returns the length of this chunk in chars.
	 *
	 * @return char length
	 */
	public int length() {
		return this.content.length();
	}
}
