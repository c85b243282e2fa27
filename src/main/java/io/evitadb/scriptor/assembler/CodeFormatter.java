package io.evitadb.scriptor.assembler;

import io.evitadb.scriptor.python.LogicalLine;
import io.evitadb.scriptor.python.PythonSourceScanner;
import org.apache.maven.plugin.logging.Log;

import javax.annotation.Nonnull;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Final formatting pass of the assembler. Normalizes line endings, re-derives indentation with an
 * indent stack, collapses long runs of blank lines, strips trailing whitespace, separates consecutive
 * top-level definitions by a blank line and terminates the output with exactly one newline.
 */
final class CodeFormatter {

	/**
	 * Clause keywords that close the body they follow.
	 */
	static final Set<String> DEDENT_KEYWORDS = Set.of("else", "elif", "except", "finally", "case");

	private static final Pattern EXCESS_BLANK_LINES = Pattern.compile("\n{4,}");
	private static final Pattern DEFINITION_START = Pattern.compile("^(async\\s+def|def|class)\\b");

	private final int indentSize;
	private final int maxLineLength;
	private final Log log;

	CodeFormatter(int indentSize, int maxLineLength, @Nonnull Log log) {
		this.indentSize = indentSize;
		this.maxLineLength = maxLineLength;
		this.log = Objects.requireNonNull(log, "log must not be null");
	}

	/**
	 * Removes comment-only lines. Comments after code on the same line are kept.
	 *
	 * @param code Python source
	 * @return source without full-line comments
	 */
	@Nonnull
	static String stripFullLineComments(@Nonnull String code) {
		final String[] physical = PythonSourceScanner.splitLines(code);
		final List<String> kept = new ArrayList<>(physical.length);
		for (final LogicalLine line : PythonSourceScanner.scan(code)) {
			if (line.kind() == LogicalLine.Kind.COMMENT) {
				continue;
			}
			for (int p = line.firstLine(); p <= line.lastLine(); p++) {
				kept.add(physical[p]);
			}
		}
		return String.join("\n", kept);
	}

	/**
	 * Formats the assembled program.
	 *
	 * @param code stitched program text
	 * @return formatted program ending with a single newline, or an empty string for blank input
	 */
	@Nonnull
	String format(@Nonnull String code) {
		if (code.isBlank()) {
			return "";
		}
		final String normalized = code.replace("\r\n", "\n").replace('\r', '\n');
		final String reindented = reindent(normalized);
		final String collapsed = EXCESS_BLANK_LINES.matcher(reindented).replaceAll("\n\n\n");

		final List<String> lines = new ArrayList<>();
		for (final String line : PythonSourceScanner.splitLines(collapsed)) {
			lines.add(line.stripTrailing());
		}
		final List<String> spaced = ensureSpacingAroundDefinitions(lines, topLevelStatementStarts(collapsed));

		int start = 0;
		int end = spaced.size();
		while (start < end && spaced.get(start).isEmpty()) {
			start++;
		}
		while (end > start && spaced.get(end - 1).isEmpty()) {
			end--;
		}
		final List<String> trimmed = spaced.subList(start, end);
		reportLongLines(trimmed);
		return trimmed.isEmpty() ? "" : String.join("\n", trimmed) + "\n";
	}

	/**
	 * Rebuilds indentation level by level. Each block body gets the parent indentation plus
	 * {@code indentSize}; continuation lines keep their offset relative to the statement start and
	 * lines inside multi-line strings are left untouched. A clause keyword stranded at body level
	 * without a sibling statement it could belong to is moved out to the level of the block opener.
	 */
	@Nonnull
	private String reindent(@Nonnull String code) {
		final String[] physical = PythonSourceScanner.splitLines(code);
		final String[] out = new String[physical.length];
		final Deque<Frame> frames = new ArrayDeque<>();
		frames.push(new Frame(0, 0, ""));
		boolean openPending = false;
		String openKeyword = "";

		for (final LogicalLine line : PythonSourceScanner.scan(code)) {
			switch (line.kind()) {
				case BLANK -> out[line.firstLine()] = "";
				case COMMENT -> out[line.firstLine()] = " ".repeat(commentIndent(frames, line.indent(), openPending))
					+ physical[line.firstLine()].strip();
				case CODE -> {
					final int source = line.indent();
					final String keyword = line.keyword();
					if (openPending && source > frames.peek().source) {
						frames.push(new Frame(source, frames.peek().emitted + this.indentSize, openKeyword));
					} else {
						while (frames.size() > 1 && source < frames.peek().source) {
							frames.pop();
						}
					}
					openPending = false;
					if (frames.size() > 1 && line.isBlockHeader() && isStrandedClause(keyword, frames.peek())) {
						frames.pop();
					}

					final Frame frame = frames.peek();
					final int delta = frame.emitted - source;
					for (int p = line.firstLine(); p <= line.lastLine(); p++) {
						final String text = physical[p];
						if (p == line.firstLine()) {
							out[p] = " ".repeat(frame.emitted) + text.stripLeading();
						} else if (line.stringContinuationLines().contains(p)) {
							out[p] = text;
						} else if (text.isBlank()) {
							out[p] = "";
						} else {
							final int shifted = Math.max(0, PythonSourceScanner.indentOf(text) + delta);
							out[p] = " ".repeat(shifted) + text.stripLeading();
						}
					}
					frame.lastKeyword = keyword;
					if (line.isBlockHeader()) {
						openPending = true;
						openKeyword = keyword;
					}
				}
			}
		}
		return String.join("\n", out);
	}

	private boolean isStrandedClause(@Nonnull String keyword, @Nonnull Frame frame) {
		if (!DEDENT_KEYWORDS.contains(keyword)) {
			return false;
		}
		if ("case".equals(keyword)) {
			return !"match".equals(frame.opener);
		}
		return !PythonSourceScanner.isClauseOf(keyword, frame.lastKeyword)
			&& PythonSourceScanner.isClauseOf(keyword, frame.opener);
	}

	private int commentIndent(@Nonnull Deque<Frame> frames, int source, boolean openPending) {
		final Frame top = frames.peek();
		if (openPending && source > top.source) {
			return top.emitted + this.indentSize;
		}
		for (final Frame frame : frames) {
			if (frame.source <= source) {
				return frame.emitted + (source - frame.source);
			}
		}
		return 0;
	}

	@Nonnull
	private static Set<Integer> topLevelStatementStarts(@Nonnull String code) {
		final Set<Integer> starts = new HashSet<>();
		for (final LogicalLine line : PythonSourceScanner.scan(code)) {
			if (line.isCode() && line.indent() == 0) {
				starts.add(line.firstLine());
			}
		}
		return starts;
	}

	/**
	 * Inserts a blank line in front of a top-level definition (or its decorators and leading comments)
	 * that directly follows the previous definition. Existing blank lines are left as they are.
	 */
	@Nonnull
	private static List<String> ensureSpacingAroundDefinitions(@Nonnull List<String> lines, @Nonnull Set<Integer> statementStarts) {
		final List<String> result = new ArrayList<>(lines.size() + 8);
		boolean inDefinition = false;
		boolean previousWasDecorator = false;
		for (int i = 0; i < lines.size(); i++) {
			final String line = lines.get(i);
			if (statementStarts.contains(i)) {
				final boolean decorator = line.startsWith("@");
				final boolean definition = decorator || DEFINITION_START.matcher(line).find();
				if (definition) {
					if (inDefinition && !previousWasDecorator) {
						insertBlankBeforeLeadingComments(result);
					}
					inDefinition = true;
					previousWasDecorator = decorator;
				} else {
					inDefinition = false;
					previousWasDecorator = false;
				}
			}
			result.add(line);
		}
		return result;
	}

	private static void insertBlankBeforeLeadingComments(@Nonnull List<String> result) {
		int position = result.size();
		while (position > 0 && result.get(position - 1).startsWith("#")) {
			position--;
		}
		if (position > 0 && !result.get(position - 1).isEmpty()) {
			result.add(position, "");
		}
	}

	private void reportLongLines(@Nonnull List<String> lines) {
		if (!this.log.isDebugEnabled()) {
			return;
		}
		for (int i = 0; i < lines.size(); i++) {
			final int length = lines.get(i).length();
			if (length > this.maxLineLength) {
				this.log.debug("[ASSEMBLE] Line " + (i + 1) + " has " + length + " characters (limit " + this.maxLineLength + ")");
			}
		}
	}

	/**
	 * One level of the indent stack: source indentation, emitted indentation, the header keyword
	 * that opened the level and the keyword of the last statement seen on it.
	 */
	private static final class Frame {
		private final int source;
		private final int emitted;
		private final String opener;
		private String lastKeyword;

		private Frame(int source, int emitted, @Nonnull String opener) {
			this.source = source;
			this.emitted = emitted;
			this.opener = opener;
		}
	}
}
