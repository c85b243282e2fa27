package io.evitadb.scriptor.python;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One logical line of Python source: a statement line together with all physical lines joined to it
 * by open brackets, open triple-quoted strings or backslash continuations. Blank and comment-only
 * physical lines are represented as single-line logical lines of their own kind.
 *
 * The skeleton is the code with comments removed, continuation line breaks replaced by spaces and
 * every string literal collapsed into an empty literal ({@code ""}) while keeping its prefix letters.
 * Structural questions are answered on the skeleton so that string content never misleads them.
 *
 * @param firstLine               0-based index of the first physical line
 * @param lastLine                0-based index of the last physical line (inclusive)
 * @param indent                  indentation width of the first physical line, tabs expanded to multiples of 8
 * @param kind                    the line kind
 * @param text                    the original physical lines joined with {@code \n}
 * @param skeleton                code skeleton used for structural analysis
 * @param stringContinuationLines 0-based indexes of physical lines that start inside a string literal
 */
public record LogicalLine(
	int firstLine,
	int lastLine,
	int indent,
	@Nonnull Kind kind,
	@Nonnull String text,
	@Nonnull String skeleton,
	@Nonnull Set<Integer> stringContinuationLines
) {

	private static final Pattern WORD = Pattern.compile("^([A-Za-z_][A-Za-z0-9_]*)");
	private static final Pattern SECOND_WORD = Pattern.compile("^async\\s+([A-Za-z_][A-Za-z0-9_]*)");
	private static final Pattern DEFINITION_NAME = Pattern.compile("^(?:async\\s+)?(?:def|class)\\s+([A-Za-z_][A-Za-z0-9_]*)");
	private static final Pattern STRING_ONLY = Pattern.compile("^[rRbBuUfF]{0,2}\"\"$");

	/**
	 * Kind of a logical line.
	 */
	public enum Kind {
		CODE,
		COMMENT,
		BLANK
	}

	public LogicalLine {
		Objects.requireNonNull(kind, "kind must not be null");
		Objects.requireNonNull(text, "text must not be null");
		Objects.requireNonNull(skeleton, "skeleton must not be null");
		stringContinuationLines = Set.copyOf(stringContinuationLines);
		if (lastLine < firstLine) {
			throw new IllegalArgumentException("lastLine must be >= firstLine");
		}
	}

	/**
	 * Returns true for code lines.
	 *
	 * @return true if this line holds a statement
	 */
	public boolean isCode() {
		return this.kind == Kind.CODE;
	}

	/**
	 * Returns true if the physical line at the given index is part of this logical line but not its first line.
	 *
	 * @param physicalLine 0-based physical line index
	 * @return true for continuation lines
	 */
	public boolean isContinuation(int physicalLine) {
		return physicalLine > this.firstLine && physicalLine <= this.lastLine;
	}

	/**
	 * Returns the leading keyword or identifier of the statement. For {@code async def/for/with}
	 * the word after {@code async} is returned, decorators yield {@code @}.
	 *
	 * @return keyword or empty string if the statement does not start with a word
	 */
	@Nonnull
	public String keyword() {
		final String code = this.skeleton.strip();
		if (code.startsWith("@")) {
			return "@";
		}
		final Matcher asyncMatcher = SECOND_WORD.matcher(code);
		if (asyncMatcher.find()) {
			return asyncMatcher.group(1);
		}
		final Matcher matcher = WORD.matcher(code);
		return matcher.find() ? matcher.group(1) : "";
	}

	/**
	 * Returns the name declared by a {@code def} or {@code class} header.
	 *
	 * @return the declared name or null for other statements
	 */
	@Nullable
	public String definitionName() {
		final Matcher matcher = DEFINITION_NAME.matcher(this.skeleton.strip());
		return matcher.find() ? matcher.group(1) : null;
	}

	/**
	 * Returns true if the statement opens an indented block, i.e. its last significant character is a colon.
	 *
	 * @return true for block headers
	 */
	public boolean isBlockHeader() {
		return isCode() && this.skeleton.stripTrailing().endsWith(":");
	}

	/**
	 * Returns true if the statement contains a colon outside any bracket.
	 *
	 * @return true if a top-level colon is present
	 */
	public boolean hasTopLevelColon() {
		int depth = 0;
		for (int i = 0; i < this.skeleton.length(); i++) {
			final char c = this.skeleton.charAt(i);
			if (c == '(' || c == '[' || c == '{') {
				depth++;
			} else if (c == ')' || c == ']' || c == '}') {
				depth = Math.max(0, depth - 1);
			} else if (c == ':' && depth == 0) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Returns the position of the assignment operator outside any bracket, or -1 if the statement
	 * is not an assignment. Comparison operators and the walrus operator are not assignments.
	 *
	 * @return index into the skeleton or -1
	 */
	public int assignmentIndex() {
		int depth = 0;
		for (int i = 0; i < this.skeleton.length(); i++) {
			final char c = this.skeleton.charAt(i);
			if (c == '(' || c == '[' || c == '{') {
				depth++;
			} else if (c == ')' || c == ']' || c == '}') {
				depth = Math.max(0, depth - 1);
			} else if (c == '=' && depth == 0) {
				final char next = i + 1 < this.skeleton.length() ? this.skeleton.charAt(i + 1) : ' ';
				final char prev = i > 0 ? this.skeleton.charAt(i - 1) : ' ';
				final char prevPrev = i > 1 ? this.skeleton.charAt(i - 2) : ' ';
				if (next == '=') {
					// ==
					i++;
					continue;
				}
				if (prev == '=' || prev == '!' || prev == ':') {
					continue;
				}
				if ((prev == '<' || prev == '>') && prevPrev != prev) {
					continue;
				}
				return i;
			}
		}
		return -1;
	}

	/**
	 * Returns true if the statement consists of a single string literal only.
	 *
	 * @return true for docstring-like statements
	 */
	public boolean isStringOnly() {
		return isCode() && STRING_ONLY.matcher(this.skeleton.strip()).matches();
	}

	/**
	 * Returns the number of physical lines of this logical line.
	 *
	 * @return physical line count
	 */
	public int physicalLineCount() {
		return this.lastLine - this.firstLine + 1;
	}
}
