package io.evitadb.scriptor.python;

import io.evitadb.scriptor.python.LogicalLine.Kind;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Lightweight structural scanner of Python source. It understands string literals (prefixed and
 * triple-quoted ones included), comments, brackets and line continuations, which is enough to split
 * a fragment into logical lines and module-level statements and to detect the syntax errors that
 * matter when fragments are merged: broken literals and brackets, inconsistent indentation, block
 * headers without a body or a colon, and clauses without their opening statement.
 *
 * It is not a Python parser; expressions are never validated.
 */
public final class PythonSourceScanner {

	private static final Set<String> COLON_KEYWORDS = Set.of(
		"if", "elif", "else", "for", "while", "try", "except", "finally", "with", "def", "class"
	);
	private static final Map<String, Set<String>> CLAUSE_PREDECESSORS = Map.of(
		"elif", Set.of("if", "elif"),
		"else", Set.of("if", "elif", "for", "while", "try", "except"),
		"except", Set.of("try", "except"),
		"finally", Set.of("try", "except", "else")
	);
	private static final Set<String> SIMPLE_KEYWORDS = Set.of(
		"pass", "return", "del", "assert", "raise", "global", "nonlocal", "break", "continue"
	);
	private static final Pattern TRAILING_OPERATOR = Pattern.compile("[+\\-*/%&|^@<>]+$");

	private PythonSourceScanner() {
		// Utility class - prevent instantiation
	}

	/**
	 * Splits the source into logical lines. Never fails: broken literals are closed at the end of
	 * their line (or of the input) and unmatched brackets are ignored.
	 *
	 * @param source Python source
	 * @return logical lines covering every physical line in order
	 */
	@Nonnull
	public static List<LogicalLine> scan(@Nonnull String source) {
		Objects.requireNonNull(source, "source must not be null");
		return new Tokenizer(splitLines(source)).run();
	}

	/**
	 * Splits the source into logical lines and fails on the first lexical problem.
	 *
	 * @param source Python source
	 * @return logical lines covering every physical line in order
	 * @throws PythonSyntaxException on unterminated literals, unbalanced brackets or stray continuations
	 */
	@Nonnull
	public static List<LogicalLine> scanStrict(@Nonnull String source) throws PythonSyntaxException {
		Objects.requireNonNull(source, "source must not be null");
		final Tokenizer tokenizer = new Tokenizer(splitLines(source));
		final List<LogicalLine> lines = tokenizer.run();
		if (tokenizer.errorMessage != null) {
			throw new PythonSyntaxException(tokenizer.errorMessage, tokenizer.errorLine + 1);
		}
		return lines;
	}

	/**
	 * Splits the source into module-level statements after checking its structure.
	 *
	 * @param source Python source
	 * @return statements in source order
	 * @throws PythonSyntaxException if the source is not structurally valid
	 */
	@Nonnull
	public static List<TopLevelStatement> parseModule(@Nonnull String source) throws PythonSyntaxException {
		final List<LogicalLine> lines = scanStrict(source);
		validateStructure(lines);
		return groupStatements(lines);
	}

	/**
	 * Checks that the source is structurally valid Python.
	 *
	 * @param source Python source
	 * @throws PythonSyntaxException describing the first problem found
	 */
	public static void validate(@Nonnull String source) throws PythonSyntaxException {
		parseModule(source);
	}

	/**
	 * Returns the 0-based indexes of physical lines that start inside a string literal.
	 * Such lines must never be re-indented.
	 *
	 * @param source Python source
	 * @return set of physical line indexes
	 */
	@Nonnull
	public static Set<Integer> stringContinuationLines(@Nonnull String source) {
		final Set<Integer> result = new HashSet<>();
		for (final LogicalLine line : scan(source)) {
			result.addAll(line.stringContinuationLines());
		}
		return result;
	}

	/**
	 * Returns true if the clause keyword ({@code elif}, {@code else}, {@code except}, {@code finally})
	 * may follow a statement starting with the given keyword at the same indentation.
	 *
	 * @param clause          the clause keyword
	 * @param previousKeyword keyword of the preceding statement at the same level, may be null
	 * @return true if the clause continues the preceding statement
	 */
	public static boolean isClauseOf(@Nonnull String clause, @Nullable String previousKeyword) {
		final Set<String> predecessors = CLAUSE_PREDECESSORS.get(clause);
		return predecessors != null && previousKeyword != null && predecessors.contains(previousKeyword);
	}

	/**
	 * Normalizes line endings and splits the source into physical lines.
	 *
	 * @param source Python source
	 * @return physical lines, a trailing newline yields a trailing empty line
	 */
	@Nonnull
	public static String[] splitLines(@Nonnull String source) {
		return source.replace("\r\n", "\n").replace('\r', '\n').split("\n", -1);
	}

	/**
	 * Computes the indentation width of a physical line; tabs advance to the next multiple of 8.
	 *
	 * @param line physical line
	 * @return indentation width
	 */
	public static int indentOf(@Nonnull String line) {
		int width = 0;
		for (int i = 0; i < line.length(); i++) {
			final char c = line.charAt(i);
			if (c == ' ') {
				width++;
			} else if (c == '\t') {
				width = (width / 8 + 1) * 8;
			} else if (c == '\f') {
				width = 0;
			} else {
				break;
			}
		}
		return width;
	}

	private static void validateStructure(@Nonnull List<LogicalLine> lines) throws PythonSyntaxException {
		final Deque<Integer> indents = new ArrayDeque<>();
		indents.push(0);
		final Map<Integer, String> lastKeywordAt = new HashMap<>();
		LogicalLine pendingHeader = null;

		for (final LogicalLine line : lines) {
			if (!line.isCode()) {
				continue;
			}
			final int lineNumber = line.firstLine() + 1;
			final int indent = line.indent();
			if (pendingHeader != null) {
				if (indent <= indents.peek()) {
					throw new PythonSyntaxException(
						"expected an indented block after '" + pendingHeader.keyword() +
							"' statement on line " + (pendingHeader.firstLine() + 1),
						lineNumber
					);
				}
				indents.push(indent);
				pendingHeader = null;
			} else if (indent > indents.peek()) {
				throw new PythonSyntaxException("unexpected indent", lineNumber);
			} else if (indent < indents.peek()) {
				while (indent < indents.peek()) {
					final int removed = indents.pop();
					lastKeywordAt.keySet().removeIf(level -> level >= removed);
				}
				if (indent != indents.peek()) {
					throw new PythonSyntaxException("unindent does not match any outer indentation level", lineNumber);
				}
			}

			final String keyword = line.keyword();
			if (CLAUSE_PREDECESSORS.containsKey(keyword) && !isClauseOf(keyword, lastKeywordAt.get(indent))) {
				throw new PythonSyntaxException("'" + keyword + "' without a matching statement", lineNumber);
			}
			if (COLON_KEYWORDS.contains(keyword) && !line.hasTopLevelColon()) {
				throw new PythonSyntaxException("expected ':' after '" + keyword + "'", lineNumber);
			}
			if (line.isBlockHeader()) {
				pendingHeader = line;
			}
			lastKeywordAt.put(indent, keyword);
		}

		if (pendingHeader != null) {
			throw new PythonSyntaxException(
				"expected an indented block after '" + pendingHeader.keyword() + "' statement",
				pendingHeader.firstLine() + 1
			);
		}
	}

	@Nonnull
	private static List<TopLevelStatement> groupStatements(@Nonnull List<LogicalLine> lines) throws PythonSyntaxException {
		final List<TopLevelStatement> statements = new ArrayList<>();
		final List<LogicalLine> pending = new ArrayList<>();
		List<LogicalLine> current = null;
		LogicalLine header = null;

		for (final LogicalLine line : lines) {
			if (line.isCode() && line.indent() == 0) {
				final String keyword = line.keyword();
				if (current != null && CLAUSE_PREDECESSORS.containsKey(keyword)) {
					// else / elif / except / finally continue the open compound statement
					current.addAll(pending);
					pending.clear();
					current.add(line);
					continue;
				}
				if (current != null) {
					statements.add(buildStatement(header, current));
					current = null;
					header = null;
				}
				if ("@".equals(keyword)) {
					pending.add(line);
					continue;
				}
				if (hasDecorator(pending) && !"def".equals(keyword) && !"class".equals(keyword)) {
					throw new PythonSyntaxException("decorator must precede a function or class", line.firstLine() + 1);
				}
				current = new ArrayList<>(dropLeadingBlanks(pending));
				pending.clear();
				current.add(line);
				header = line;
			} else if (line.isCode()) {
				if (current == null) {
					throw new PythonSyntaxException("unexpected indent", line.firstLine() + 1);
				}
				current.addAll(pending);
				pending.clear();
				current.add(line);
			} else {
				pending.add(line);
			}
		}

		if (hasDecorator(pending)) {
			throw new PythonSyntaxException("decorator without a function or class", pending.get(pending.size() - 1).firstLine() + 1);
		}
		if (current != null) {
			for (final LogicalLine line : pending) {
				if (line.kind() == Kind.COMMENT) {
					current.add(line);
				}
			}
			statements.add(buildStatement(header, current));
		}
		return statements;
	}

	private static boolean hasDecorator(@Nonnull List<LogicalLine> lines) {
		return lines.stream().anyMatch(line -> line.isCode() && "@".equals(line.keyword()));
	}

	@Nonnull
	private static List<LogicalLine> dropLeadingBlanks(@Nonnull List<LogicalLine> lines) {
		int start = 0;
		while (start < lines.size() && lines.get(start).kind() == Kind.BLANK) {
			start++;
		}
		return lines.subList(start, lines.size());
	}

	@Nonnull
	private static TopLevelStatement buildStatement(@Nonnull LogicalLine header, @Nonnull List<LogicalLine> lines) {
		int end = lines.size();
		while (end > 0 && lines.get(end - 1).kind() == Kind.BLANK) {
			end--;
		}
		final List<LogicalLine> kept = lines.subList(0, end);
		final StringBuilder text = new StringBuilder();
		for (final LogicalLine line : kept) {
			if (text.length() > 0) {
				text.append('\n');
			}
			text.append(line.text());
		}
		final StatementKind kind = classify(header);
		return new TopLevelStatement(
			kind,
			nameOf(kind, header),
			text.toString(),
			kept.get(0).firstLine(),
			kept.get(kept.size() - 1).lastLine()
		);
	}

	@Nonnull
	private static StatementKind classify(@Nonnull LogicalLine header) {
		final String keyword = header.keyword();
		switch (keyword) {
			case "def":
				return StatementKind.FUNCTION;
			case "class":
				return StatementKind.CLASS;
			case "import":
				return StatementKind.IMPORT;
			case "from":
				return StatementKind.FROM_IMPORT;
			case "if", "for", "while", "try", "with":
				return StatementKind.COMPOUND;
			default:
				break;
		}
		if ("match".equals(keyword) && header.isBlockHeader()) {
			return StatementKind.COMPOUND;
		}
		if (SIMPLE_KEYWORDS.contains(keyword)) {
			return StatementKind.OTHER;
		}
		if (header.isStringOnly()) {
			return StatementKind.DOCSTRING;
		}
		if (header.assignmentIndex() >= 0) {
			return StatementKind.ASSIGNMENT;
		}
		return StatementKind.EXPRESSION;
	}

	@Nullable
	private static String nameOf(@Nonnull StatementKind kind, @Nonnull LogicalLine header) {
		return switch (kind) {
			case FUNCTION, CLASS -> header.definitionName();
			case ASSIGNMENT -> {
				String target = header.skeleton().substring(0, header.assignmentIndex()).strip();
				target = TRAILING_OPERATOR.matcher(target).replaceAll("").strip();
				final int annotation = target.indexOf(':');
				yield annotation >= 0 ? target.substring(0, annotation).strip() : target;
			}
			default -> null;
		};
	}

	/**
	 * Single pass over the physical lines that tracks literals, brackets and continuations.
	 * The first lexical problem is remembered; scanning always completes.
	 */
	private static final class Tokenizer {
		private final String[] lines;
		private final List<LogicalLine> result = new ArrayList<>();
		private final Deque<Character> brackets = new ArrayDeque<>();

		private String errorMessage;
		private int errorLine;

		private int logicalStart = -1;
		private int logicalIndent;
		private StringBuilder skeleton;
		private Set<Integer> stringLines;
		private char quote;
		private boolean triple;
		private boolean escapedNewline;
		private boolean backslash;

		Tokenizer(@Nonnull String[] lines) {
			this.lines = lines;
		}

		@Nonnull
		List<LogicalLine> run() {
			for (int p = 0; p < this.lines.length; p++) {
				final String line = this.lines[p];
				if (this.logicalStart < 0) {
					final String stripped = line.strip();
					if (stripped.isEmpty()) {
						this.result.add(single(p, Kind.BLANK));
						continue;
					}
					if (stripped.startsWith("#")) {
						this.result.add(single(p, Kind.COMMENT));
						continue;
					}
					this.logicalStart = p;
					this.logicalIndent = indentOf(line);
					this.skeleton = new StringBuilder();
					this.stringLines = new HashSet<>();
				} else if (this.quote != 0) {
					this.stringLines.add(p);
				} else {
					this.skeleton.append(' ');
				}

				this.backslash = false;
				this.escapedNewline = false;
				scanLine(line, p);

				if (this.quote != 0 && !this.triple && !this.escapedNewline) {
					error("unterminated string literal", p);
					closeString();
				}
				if (this.quote == 0 && this.brackets.isEmpty() && !this.backslash) {
					emit(p);
				}
			}

			if (this.logicalStart >= 0) {
				if (this.quote != 0) {
					error("unterminated triple-quoted string literal", this.logicalStart);
					closeString();
				} else if (!this.brackets.isEmpty()) {
					error("'" + this.brackets.peek() + "' was never closed", this.logicalStart);
				} else if (this.backslash) {
					error("unexpected end of input after line continuation", this.lines.length - 1);
				}
				emit(this.lines.length - 1);
			}
			return this.result;
		}

		private void scanLine(@Nonnull String line, int p) {
			int i = 0;
			while (i < line.length()) {
				final char c = line.charAt(i);
				if (this.quote != 0) {
					if (c == '\\') {
						if (i + 1 >= line.length()) {
							this.escapedNewline = true;
						}
						i += 2;
						continue;
					}
					if (c == this.quote) {
						if (!this.triple) {
							closeString();
							i++;
							continue;
						}
						if (line.startsWith(tripleOf(c), i)) {
							closeString();
							i += 3;
							continue;
						}
					}
					i++;
					continue;
				}

				switch (c) {
					case '#':
						return;
					case '\'', '"':
						this.quote = c;
						this.triple = line.startsWith(tripleOf(c), i);
						this.skeleton.append('"');
						i += this.triple ? 3 : 1;
						continue;
					case '(', '[', '{':
						this.brackets.push(c);
						break;
					case ')', ']', '}':
						if (this.brackets.isEmpty()) {
							error("unmatched '" + c + "'", p);
						} else {
							final char open = this.brackets.pop();
							if (!matches(open, c)) {
								error("closing parenthesis '" + c + "' does not match opening parenthesis '" + open + "'", p);
							}
						}
						break;
					case '\\':
						if (line.substring(i + 1).isBlank()) {
							this.backslash = true;
							return;
						}
						error("unexpected character after line continuation character", p);
						break;
					default:
						break;
				}
				this.skeleton.append(c);
				i++;
			}
		}

		private void closeString() {
			this.quote = 0;
			this.triple = false;
			this.skeleton.append('"');
		}

		private void emit(int lastLine) {
			final StringBuilder text = new StringBuilder();
			for (int p = this.logicalStart; p <= lastLine; p++) {
				if (p > this.logicalStart) {
					text.append('\n');
				}
				text.append(this.lines[p]);
			}
			this.result.add(new LogicalLine(
				this.logicalStart, lastLine, this.logicalIndent, Kind.CODE,
				text.toString(), this.skeleton.toString().strip(), this.stringLines
			));
			this.logicalStart = -1;
			this.brackets.clear();
			this.backslash = false;
		}

		@Nonnull
		private LogicalLine single(int p, @Nonnull Kind kind) {
			return new LogicalLine(p, p, indentOf(this.lines[p]), kind, this.lines[p], "", Set.of());
		}

		private void error(@Nonnull String message, int line) {
			if (this.errorMessage == null) {
				this.errorMessage = message;
				this.errorLine = line;
			}
		}

		@Nonnull
		private static String tripleOf(char quote) {
			return String.valueOf(quote).repeat(3);
		}

		private static boolean matches(char open, char close) {
			return (open == '(' && close == ')') || (open == '[' && close == ']') || (open == '{' && close == '}');
		}
	}
}
