package io.evitadb.scriptor.assembler;

import io.evitadb.scriptor.assembler.AssemblyException.Stage;
import io.evitadb.scriptor.model.AssemblerConfig;
import io.evitadb.scriptor.model.CodeBlock;
import io.evitadb.scriptor.python.PythonSourceScanner;
import io.evitadb.scriptor.python.PythonSyntaxException;
import io.evitadb.scriptor.python.TopLevelStatement;
import org.apache.maven.plugin.logging.Log;
import org.apache.maven.plugin.logging.SystemStreamLog;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Merges translated code blocks of all chunks into one Python program.
 *
 * The blocks are filtered to code, split into module-level statements and sorted into sections:
 * module docstring, imports, globals, functions, classes and main code. Imports are grouped and
 * deduplicated, functions and classes of the same name are merged (the last body wins at the
 * position of the first occurrence), globals are split into constants and variables and the main
 * code is wrapped in a main guard when it performs top-level calls. The stitched program is
 * re-formatted as a whole.
 *
 * A block that cannot be split into statements is kept verbatim in the main section.
 */
public final class CodeAssembler {

	static final String SECTION_JOIN = "\n\n\n";
	static final String CONSTANTS_HEADER = "# Constants";
	static final String VARIABLES_HEADER = "# Global variables";

	private static final Pattern CONSTANT_ASSIGNMENT = Pattern.compile("^[A-Z_][A-Z0-9_]*\\s*(:[^=]*)?=");

	private final AssemblerConfig config;
	private final Log log;
	private final MainGuardWrapper mainGuardWrapper;
	private final CodeFormatter formatter;

	/**
	 * Creates an assembler logging to the standard output.
	 *
	 * @param config formatting preferences
	 */
	public CodeAssembler(@Nonnull AssemblerConfig config) {
		this(config, new SystemStreamLog());
	}

	/**
	 * Creates an assembler.
	 *
	 * @param config formatting preferences
	 * @param log    Maven log for output
	 */
	public CodeAssembler(@Nonnull AssemblerConfig config, @Nonnull Log log) {
		this.config = Objects.requireNonNull(config, "config must not be null");
		this.log = Objects.requireNonNull(log, "log must not be null");
		this.mainGuardWrapper = new MainGuardWrapper(config.indentSize());
		this.formatter = new CodeFormatter(config.indentSize(), config.maxLineLength(), log);
	}

	/**
	 * Assembles the blocks into a complete program.
	 *
	 * @param blocks translated blocks in original input order
	 * @return the program ending with a single newline, or an empty string if there is no code
	 * @throws AssemblyException if any assembly stage fails; no partial output is produced
	 */
	@Nonnull
	public String assemble(@Nonnull List<CodeBlock> blocks) throws AssemblyException {
		Objects.requireNonNull(blocks, "blocks must not be null");
		if (blocks.isEmpty()) {
			return "";
		}
		this.log.info("[ASSEMBLE] Assembling " + blocks.size() + " code blocks");

		final List<CodeBlock> codeBlocks = runStage(Stage.FILTER, blocks, () -> filterCode(blocks));
		if (codeBlocks.isEmpty()) {
			this.log.warn("[ASSEMBLE] No code blocks found in input");
			return "";
		}
		final String combinedCode = codeBlocks.stream().map(CodeBlock::content).collect(Collectors.joining("\n"));

		final ProgramSections sections = runStage(Stage.SECTIONS, codeBlocks, () -> organizeSections(codeBlocks));
		final String imports = runStage(Stage.IMPORTS, codeBlocks, () -> {
			if (this.config.autoImportCommon()) {
				sections.imports.addCommonImports(combinedCode);
			}
			return sections.imports.render();
		});
		final String functions = runStage(Stage.MERGE, codeBlocks, () -> mergeDefinitions(sections.functions, "function"));
		final String classes = runStage(Stage.MERGE, codeBlocks, () -> mergeDefinitions(sections.classes, "class"));
		final String globals = runStage(Stage.GLOBALS, codeBlocks, () -> organizeGlobals(sections.globals));
		final String main = runStage(
			Stage.MAIN, codeBlocks,
			() -> this.mainGuardWrapper.wrap(String.join("\n\n", sections.main), combinedCode)
		);

		final String stitched = runStage(Stage.STITCHING, codeBlocks, () -> {
			final List<String> parts = new ArrayList<>(6);
			if (sections.moduleDocstring != null && this.config.preserveDocstrings()) {
				parts.add(sections.moduleDocstring);
			}
			for (final String part : List.of(imports, globals, functions, classes, main)) {
				if (!part.isBlank()) {
					parts.add(part);
				}
			}
			return String.join(SECTION_JOIN, parts);
		});
		final String result = runStage(Stage.POSTPROCESS, codeBlocks, () -> this.formatter.format(stitched));

		if (sections.unparsed.isEmpty()) {
			try {
				PythonSourceScanner.validate(result);
			} catch (PythonSyntaxException e) {
				throw new AssemblyException(
					"Assembled program is not valid Python", Stage.VALIDATION, codeBlocks, suggestionsFor(Stage.VALIDATION), e
				);
			}
		} else {
			this.log.warn(
				"[ASSEMBLE] " + sections.unparsed.size() + " block(s) were kept verbatim, the program may not be valid: " +
					sections.unparsed.stream().map(CodeBlock::describe).collect(Collectors.joining(", "))
			);
		}

		this.log.info("[ASSEMBLE] Code assembly complete");
		return result;
	}

	/**
	 * Collects all blocks from the iterator and assembles them.
	 *
	 * @param blocks iterator over translated blocks in original input order
	 * @return the assembled program
	 * @throws AssemblyException if assembly fails
	 */
	@Nonnull
	public String assembleStreaming(@Nonnull Iterator<CodeBlock> blocks) throws AssemblyException {
		Objects.requireNonNull(blocks, "blocks must not be null");
		final List<CodeBlock> collected = new ArrayList<>();
		blocks.forEachRemaining(collected::add);
		return assemble(collected);
	}

	@Nonnull
	private List<CodeBlock> filterCode(@Nonnull List<CodeBlock> blocks) {
		final List<CodeBlock> codeBlocks = blocks.stream()
			.filter(block -> block.type().isCode())
			.toList();
		this.log.debug("[ASSEMBLE] Found " + codeBlocks.size() + " code blocks out of " + blocks.size());
		return codeBlocks;
	}

	@Nonnull
	private ProgramSections organizeSections(@Nonnull List<CodeBlock> blocks) {
		final ProgramSections sections = new ProgramSections(new ImportOrganizer(this.log));
		for (final CodeBlock block : blocks) {
			final String content = this.config.preserveComments()
				? block.content()
				: CodeFormatter.stripFullLineComments(block.content());
			final List<TopLevelStatement> statements;
			try {
				statements = PythonSourceScanner.parseModule(content);
			} catch (PythonSyntaxException e) {
				this.log.warn("[ASSEMBLE] Could not parse block " + block.describe() + ", keeping it verbatim: " + e.getMessage());
				if (!content.isBlank()) {
					sections.main.add(content.strip());
				}
				sections.unparsed.add(block);
				continue;
			}

			final List<String> blockMain = new ArrayList<>();
			for (int i = 0; i < statements.size(); i++) {
				final TopLevelStatement statement = statements.get(i);
				switch (statement.kind()) {
					case IMPORT -> sections.imports.addImport(statement.text());
					case FROM_IMPORT -> sections.imports.addFromImport(statement.text());
					case FUNCTION -> sections.functions.add(statement);
					case CLASS -> sections.classes.add(statement);
					case ASSIGNMENT -> sections.globals.add(statement.text().strip());
					case DOCSTRING -> {
						if (i == 0 && sections.moduleDocstring == null) {
							sections.moduleDocstring = statement.text().strip();
						} else {
							blockMain.add(statement.text().stripTrailing());
						}
					}
					default -> blockMain.add(statement.text().stripTrailing());
				}
			}
			if (!blockMain.isEmpty()) {
				sections.main.add(String.join("\n", blockMain));
			}
		}
		return sections;
	}

	/**
	 * Merges definitions by name: a later definition replaces the body of an earlier one while the
	 * earlier position is kept. Nameless fragments get a synthetic positional key.
	 */
	@Nonnull
	private String mergeDefinitions(@Nonnull List<TopLevelStatement> definitions, @Nonnull String kind) {
		final Map<String, String> unique = new LinkedHashMap<>();
		for (final TopLevelStatement definition : definitions) {
			final String key = definition.name() != null ? definition.name() : kind + "#" + unique.size();
			if (unique.containsKey(key)) {
				this.log.debug("[ASSEMBLE] Replacing duplicate " + kind + ": " + key);
			}
			unique.put(key, definition.text().stripTrailing());
		}
		return String.join("\n\n", unique.values());
	}

	@Nonnull
	private static String organizeGlobals(@Nonnull List<String> globals) {
		final Set<String> constants = new LinkedHashSet<>();
		final Set<String> variables = new LinkedHashSet<>();
		for (final String global : globals) {
			if (CONSTANT_ASSIGNMENT.matcher(global).find()) {
				constants.add(global);
			} else {
				variables.add(global);
			}
		}
		final List<String> lines = new ArrayList<>();
		if (!constants.isEmpty()) {
			lines.add(CONSTANTS_HEADER);
			lines.addAll(constants);
		}
		if (!variables.isEmpty()) {
			if (!constants.isEmpty()) {
				lines.add("");
			}
			lines.add(VARIABLES_HEADER);
			lines.addAll(variables);
		}
		return String.join("\n", lines);
	}

	@Nonnull
	private <T> T runStage(@Nonnull Stage stage, @Nonnull List<CodeBlock> blocks, @Nonnull Supplier<T> action) throws AssemblyException {
		try {
			return action.get();
		} catch (RuntimeException e) {
			this.log.error("[ASSEMBLE] Stage " + stage.getLabel() + " failed: " + e.getMessage());
			throw new AssemblyException("Failed to assemble code blocks", stage, blocks, suggestionsFor(stage), e);
		}
	}

	@Nonnull
	private static List<String> suggestionsFor(@Nonnull Stage stage) {
		return switch (stage) {
			case SECTIONS -> List.of("Check code block structure", "Ensure valid Python syntax in all blocks");
			case MERGE, STITCHING -> List.of("Check for naming conflicts", "Ensure function/class definitions are valid");
			case POSTPROCESS -> List.of("Check for severe indentation errors", "Ensure consistent use of spaces or tabs");
			case VALIDATION -> List.of(
				"Verify all blocks contain valid Python syntax",
				"Check that clauses such as else, except and finally follow their opening statement"
			);
			default -> List.of("Check block compatibility", "Verify all blocks contain valid Python syntax");
		};
	}

	/**
	 * Sections of the program collected during one assembly.
	 */
	private static final class ProgramSections {
		private final ImportOrganizer imports;
		private final List<TopLevelStatement> functions = new ArrayList<>();
		private final List<TopLevelStatement> classes = new ArrayList<>();
		private final List<String> globals = new ArrayList<>();
		private final List<String> main = new ArrayList<>();
		private final List<CodeBlock> unparsed = new ArrayList<>();
		@Nullable
		private String moduleDocstring;

		private ProgramSections(@Nonnull ImportOrganizer imports) {
			this.imports = imports;
		}
	}
}
