package io.evitadb.scriptor.parser;

import io.evitadb.scriptor.model.BlockType;
import io.evitadb.scriptor.model.CodeBlock;
import io.evitadb.scriptor.model.ParseResult;
import org.apache.maven.plugin.logging.Log;
import org.apache.maven.plugin.logging.SystemStreamLog;
import org.commonmark.node.AbstractVisitor;
import org.commonmark.node.FencedCodeBlock;
import org.commonmark.node.Node;
import org.commonmark.node.SourceSpan;
import org.commonmark.parser.IncludeSourceSpans;
import org.commonmark.parser.Parser;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits Markdown-flavoured pseudocode into natural-language and code blocks.
 *
 * Fenced code blocks are located with CommonMark. Fences tagged {@code python}, {@code py} or not tagged
 * at all become TARGET_CODE blocks, fences in other languages are treated as pseudocode. Lines outside
 * fences are classified one by one by line heuristics and consecutive lines of the same kind form a block.
 * Comment lines, closing brackets and indented lines follow the kind of the preceding line. The
 * heuristics are best-effort; a sentence that looks like Python is taken for code and vice versa.
 */
public final class PseudocodeParser implements BlockParser {

	public static final String SOURCE_KEY = "source";
	public static final String LANGUAGE_KEY = "language";

	private static final Set<String> CODE_FENCE_LANGUAGES = Set.of("", "python", "py", "python3");
	private static final Pattern CLOSING_FENCE = Pattern.compile("^\\s*(`{3,}|~{3,})\\s*$");

	private static final Pattern DEFINITION = Pattern.compile("^(async\\s+def|def|class)\\s+[A-Za-z_]\\w*.*:\\s*(#.*)?$");
	private static final Pattern IMPORT = Pattern.compile(
		"^(import\\s+[\\w.]+(\\s+as\\s+\\w+)?(\\s*,\\s*[\\w.]+(\\s+as\\s+\\w+)?)*|from\\s+\\.*[\\w.]*\\s+import\\s+.+)\\s*$"
	);
	private static final Pattern CONDITIONAL_HEADER = Pattern.compile("^(if|elif|while)\\s+(.+):\\s*(#.*)?$");
	private static final Pattern FOR_HEADER = Pattern.compile("^(async\\s+)?for\\s+\\w+(\\s*,\\s*\\w+)*\\s+in\\s+\\S.*:\\s*(#.*)?$");
	private static final Pattern OTHER_HEADER = Pattern.compile(
		"^((else|try|finally)\\s*:|(except|case)\\b[^:]*:|with\\s+[^:]*(\\(|\\sas\\s)[^:]*:|match\\s+[\\w.()\\[\\]]+\\s*:)\\s*(#.*)?$"
	);
	private static final Pattern DECORATOR = Pattern.compile("^@[A-Za-z_][\\w.]*(\\(.*\\))?\\s*$");
	private static final Pattern ASSIGNMENT = Pattern.compile(
		"^[A-Za-z_][\\w.]*(\\[[^\\]]*\\])?(\\s*,\\s*[A-Za-z_][\\w.]*)*\\s*(:\\s*[\\w\\[\\], .|]+)?\\s*(\\*\\*|//|>>|<<|[-+*/%&|^@])?=(?!=).*$"
	);
	private static final Pattern CALL = Pattern.compile("^(await\\s+)?[A-Za-z_][\\w.]*\\(.*\\)\\s*(#.*)?$");
	private static final Pattern FLOW = Pattern.compile("^(return|raise|yield|assert|del|global|nonlocal)(\\s+(.*))?$");
	private static final Pattern BARE_STATEMENT = Pattern.compile("^(pass|break|continue|return)\\s*(#.*)?$");
	private static final Pattern CLOSING_BRACKETS = Pattern.compile("^[)\\]}]+[,;]?\\s*$");
	private static final Pattern CODE_SYMBOLS = Pattern.compile("[()\\[\\]=<>!.+\\-*/%\"']");
	private static final Set<String> LITERALS = Set.of("None", "True", "False");

	private final Parser markdownParser = Parser.builder()
		.includeSourceSpans(IncludeSourceSpans.BLOCKS)
		.build();
	private final Log log;

	public PseudocodeParser() {
		this(new SystemStreamLog());
	}

	public PseudocodeParser(@Nonnull Log log) {
		this.log = Objects.requireNonNull(log, "log must not be null");
	}

	@Nonnull
	@Override
	public ParseResult parse(@Nonnull String text) {
		Objects.requireNonNull(text, "text must not be null");
		if (text.indexOf('\0') >= 0) {
			return ParseResult.failure(List.of("Input contains NUL characters"));
		}

		final String normalized = text.replace("\r\n", "\n").replace('\r', '\n');
		final String[] lines = normalized.split("\n", -1);
		final List<Fence> fences;
		try {
			fences = findFences(normalized, lines);
		} catch (RuntimeException e) {
			return ParseResult.failure(List.of("Markdown parsing failed: " + e.getMessage()));
		}

		final List<CodeBlock> blocks = new ArrayList<>();
		final List<String> warnings = new ArrayList<>();
		int position = 0;
		for (Fence fence : fences) {
			classifySegment(lines, position, fence.firstLine(), blocks);
			addFence(fence, lines, blocks, warnings);
			position = fence.lastLine() + 1;
		}
		classifySegment(lines, position, lines.length, blocks);

		this.log.debug("[PARSE] " + blocks.size() + " block(s) in " + lines.length + " line(s)");
		return ParseResult.success(blocks, warnings);
	}

	/**
	 * Classifies a single line outside fences. Comment lines, closing brackets, indented lines and blank
	 * lines are reported as {@link LineKind#FOLLOW} or {@link LineKind#BLANK}.
	 *
	 * @param line raw line
	 * @return line kind
	 */
	@Nonnull
	static LineKind classify(@Nonnull String line) {
		if (line.isBlank()) {
			return LineKind.BLANK;
		}
		if (Character.isWhitespace(line.charAt(0))) {
			return LineKind.FOLLOW;
		}
		final String stripped = line.strip();
		if (stripped.startsWith("#") && !stripped.startsWith("#!") || CLOSING_BRACKETS.matcher(stripped).matches()) {
			return LineKind.FOLLOW;
		}
		if (stripped.startsWith("#!")) {
			return LineKind.CODE;
		}
		if (DEFINITION.matcher(stripped).matches()
			|| IMPORT.matcher(stripped).matches()
			|| FOR_HEADER.matcher(stripped).matches()
			|| OTHER_HEADER.matcher(stripped).matches()
			|| DECORATOR.matcher(stripped).matches()
			|| BARE_STATEMENT.matcher(stripped).matches()
			|| ASSIGNMENT.matcher(stripped).matches()
			|| CALL.matcher(stripped).matches()) {
			return LineKind.CODE;
		}
		final Matcher conditional = CONDITIONAL_HEADER.matcher(stripped);
		if (conditional.matches()) {
			return looksLikeExpression(conditional.group(2)) ? LineKind.CODE : LineKind.TEXT;
		}
		final Matcher flow = FLOW.matcher(stripped);
		if (flow.matches()) {
			final String rest = flow.group(3);
			return rest == null || rest.isBlank() || looksLikeExpression(rest) ? LineKind.CODE : LineKind.TEXT;
		}
		return LineKind.TEXT;
	}

	/**
	 * Returns true for an expression that contains operators, is a single word, a negated word or
	 * mentions a Python literal.
	 */
	private static boolean looksLikeExpression(@Nonnull String expression) {
		final String trimmed = expression.strip();
		if (CODE_SYMBOLS.matcher(trimmed).find()) {
			return true;
		}
		final String[] words = trimmed.split("\\s+");
		if (words.length == 1 || (words.length == 2 && words[0].equals("not"))) {
			return true;
		}
		return Arrays.stream(words).anyMatch(LITERALS::contains);
	}

	private void classifySegment(@Nonnull String[] lines, int from, int to, @Nonnull List<CodeBlock> blocks) {
		LineKind current = null;
		int runStart = -1;
		int runEnd = -1;
		for (int i = from; i < to; i++) {
			LineKind kind = classify(lines[i]);
			if (kind == LineKind.BLANK) {
				continue;
			}
			if (kind == LineKind.FOLLOW) {
				kind = current == null ? LineKind.TEXT : current;
			}
			if (kind != current) {
				if (current != null) {
					blocks.add(runBlock(current, lines, runStart, runEnd));
				}
				current = kind;
				runStart = i;
			}
			runEnd = i;
		}
		if (current != null) {
			blocks.add(runBlock(current, lines, runStart, runEnd));
		}
	}

	@Nonnull
	private static CodeBlock runBlock(@Nonnull LineKind kind, @Nonnull String[] lines, int start, int end) {
		final String content = String.join("\n", Arrays.copyOfRange(lines, start, end + 1));
		return new CodeBlock(
			kind == LineKind.CODE ? BlockType.TARGET_CODE : BlockType.NATURAL_LANGUAGE,
			content,
			start + 1,
			end + 1,
			Map.of(SOURCE_KEY, "heuristic"),
			null
		);
	}

	private void addFence(
		@Nonnull Fence fence,
		@Nonnull String[] lines,
		@Nonnull List<CodeBlock> blocks,
		@Nonnull List<String> warnings
	) {
		final int openingLine = fence.firstLine() + 1;
		if (!fence.closed()) {
			warnings.add("Unterminated code fence starting at line " + openingLine);
		}
		final int contentFrom = fence.firstLine() + 1;
		final int contentTo = fence.closed() ? fence.lastLine() : fence.lastLine() + 1;
		if (contentFrom >= contentTo) {
			return;
		}
		final String content = String.join("\n", Arrays.copyOfRange(lines, contentFrom, contentTo)).stripTrailing();
		if (content.isBlank()) {
			return;
		}

		final String language = fence.language();
		final boolean code = CODE_FENCE_LANGUAGES.contains(language);
		if (!code) {
			warnings.add("Code fence in '" + language + "' at line " + openingLine + " treated as pseudocode");
		}
		final int contentLines = content.split("\n", -1).length;
		blocks.add(new CodeBlock(
			code ? BlockType.TARGET_CODE : BlockType.NATURAL_LANGUAGE,
			content,
			contentFrom + 1,
			contentFrom + contentLines,
			Map.of(SOURCE_KEY, "fence", LANGUAGE_KEY, language),
			null
		));
	}

	@Nonnull
	private List<Fence> findFences(@Nonnull String text, @Nonnull String[] lines) {
		final Node document = this.markdownParser.parse(text);
		final List<Fence> fences = new ArrayList<>();
		document.accept(new AbstractVisitor() {
			@Override
			public void visit(FencedCodeBlock fencedCodeBlock) {
				final List<SourceSpan> spans = fencedCodeBlock.getSourceSpans();
				if (spans.isEmpty()) {
					return;
				}
				final int first = spans.get(0).getLineIndex();
				final int last = spans.get(spans.size() - 1).getLineIndex();
				final boolean closed = last > first && last < lines.length && CLOSING_FENCE.matcher(lines[last]).matches();
				final String info = fencedCodeBlock.getInfo() == null ? "" : fencedCodeBlock.getInfo().strip();
				final String language = info.isEmpty() ? "" : info.split("\\s+")[0].toLowerCase(Locale.ROOT);
				fences.add(new Fence(first, last, language, closed));
			}
		});
		fences.sort((a, b) -> Integer.compare(a.firstLine(), b.firstLine()));
		return fences;
	}

	/**
	 * Kind of a line outside code fences.
	 */
	enum LineKind {
		CODE,
		TEXT,
		/**
		 * Takes the kind of the preceding non-blank line.
		 */
		FOLLOW,
		BLANK
	}

	/**
	 * Fenced block located by CommonMark; line indexes are 0-based and include the fence lines.
	 */
	private record Fence(int firstLine, int lastLine, @Nonnull String language, boolean closed) {
	}
}
