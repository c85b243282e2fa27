package io.evitadb.scriptor.stream;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Chooses chunk boundaries in the input text.
 *
 * Within the back half of the allowed window the chunker prefers to cut right after a line break
 * that is followed by an unindented line, since such a line usually starts a new top-level statement
 * or paragraph. Failing that it cuts after any line break, and as a last resort it performs a hard
 * cut at the window end. A hard cut never separates the two halves of a surrogate pair.
 */
public final class CodeChunker {

	private CodeChunker() {
		// Utility class - prevent instantiation
	}

	/**
	 * Finds the end of the chunk starting at {@code start} that should not exceed {@code desired} chars.
	 *
	 * @param text    the complete input
	 * @param start   offset where the chunk starts, lower than the text length
	 * @param desired desired chunk length, at least 1
	 * @return exclusive end offset, always greater than {@code start}
	 */
	public static int findBoundary(@Nonnull String text, int start, int desired) {
		Objects.requireNonNull(text, "text must not be null");
		if (start < 0 || start >= text.length()) {
			throw new IllegalArgumentException("start must be within the text");
		}
		if (desired < 1) {
			throw new IllegalArgumentException("desired must be positive");
		}

		final int limit = (int) Math.min(text.length(), (long) start + desired);
		if (limit >= text.length()) {
			return text.length();
		}

		final int windowStart = start + Math.max(1, desired / 2);
		for (int i = limit - 1; i >= windowStart; i--) {
			if (text.charAt(i) == '\n' && startsUnindentedLine(text, i + 1)) {
				return i + 1;
			}
		}
		for (int i = limit - 1; i >= windowStart; i--) {
			if (text.charAt(i) == '\n') {
				return i + 1;
			}
		}

		int cut = limit;
		if (Character.isHighSurrogate(text.charAt(cut - 1)) && Character.isLowSurrogate(text.charAt(cut))) {
			cut = cut - 1 > start ? cut - 1 : cut + 1;
		}
		return cut;
	}

	private static boolean startsUnindentedLine(@Nonnull String text, int position) {
		if (position >= text.length()) {
			return false;
		}
		final char c = text.charAt(position);
		return !Character.isWhitespace(c);
	}
}
