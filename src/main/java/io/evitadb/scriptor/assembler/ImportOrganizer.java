package io.evitadb.scriptor.assembler;

import org.apache.maven.plugin.logging.Log;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Collects import statements of all assembled fragments and renders them as one import section.
 * Modules are grouped into standard library, third party and local imports; plain imports are
 * deduplicated and sorted, {@code from} imports are merged per module. One instance serves a single
 * assembly.
 */
final class ImportOrganizer {

	/**
	 * Import groups in the order they are rendered.
	 */
	enum ImportGroup {
		STANDARD,
		THIRD_PARTY,
		LOCAL
	}

	static final String FUTURE_MODULE = "__future__";

	/**
	 * Top-level modules treated as the standard library.
	 */
	static final Set<String> STANDARD_MODULES = Set.of(
		FUTURE_MODULE, "abc", "argparse", "array", "ast", "asyncio", "base64", "bisect", "builtins", "calendar",
		"collections", "configparser", "contextlib", "copy", "csv", "dataclasses", "datetime", "decimal",
		"difflib", "enum", "functools", "glob", "gzip", "hashlib", "heapq", "html", "http", "io", "itertools",
		"json", "logging", "math", "multiprocessing", "operator", "os", "pathlib", "pickle", "platform",
		"random", "re", "shutil", "socket", "sqlite3", "statistics", "string", "subprocess", "sys",
		"tempfile", "threading", "time", "typing", "urllib", "uuid", "warnings", "weakref", "xml", "zipfile"
	);

	/**
	 * Well-known standard library names that are imported automatically when called but not imported.
	 */
	static final Map<String, List<String>> COMMON_IMPORTS = createCommonImports();

	private static final Pattern IMPORT_STATEMENT = Pattern.compile("^import\\s+(.+)$");
	private static final Pattern FROM_IMPORT_STATEMENT = Pattern.compile("^from\\s+(\\S+)\\s+import\\s+(.+)$");
	private static final Pattern ALIAS = Pattern.compile("^([\\w.]+)(?:\\s+as\\s+(\\w+))?$");

	private final Log log;
	private final Map<ImportGroup, Set<String>> plainImports = new EnumMap<>(ImportGroup.class);
	private final Map<ImportGroup, Map<String, Set<String>>> fromImports = new EnumMap<>(ImportGroup.class);
	private final Set<String> boundNames = new TreeSet<>();

	ImportOrganizer(@Nonnull Log log) {
		this.log = Objects.requireNonNull(log, "log must not be null");
		for (final ImportGroup group : ImportGroup.values()) {
			this.plainImports.put(group, new TreeSet<>());
			this.fromImports.put(group, new TreeMap<>());
		}
	}

	/**
	 * Classifies a module name into its import group. Relative modules and the empty module are local,
	 * modules whose top-level package is in {@link #STANDARD_MODULES} are standard, all others third party.
	 *
	 * @param module dotted module name as written in the import
	 * @return the import group
	 */
	@Nonnull
	static ImportGroup categorize(@Nonnull String module) {
		if (module.isEmpty() || module.startsWith(".")) {
			return ImportGroup.LOCAL;
		}
		final int dot = module.indexOf('.');
		final String topLevel = dot < 0 ? module : module.substring(0, dot);
		return STANDARD_MODULES.contains(topLevel) ? ImportGroup.STANDARD : ImportGroup.THIRD_PARTY;
	}

	/**
	 * Registers a plain {@code import} statement; every listed module becomes its own import line.
	 *
	 * @param statement statement source
	 */
	void addImport(@Nonnull String statement) {
		final Matcher matcher = IMPORT_STATEMENT.matcher(normalize(statement));
		if (!matcher.matches()) {
			this.log.warn("[ASSEMBLE] Ignoring malformed import: " + statement);
			return;
		}
		for (final String part : matcher.group(1).split(",")) {
			final Matcher alias = ALIAS.matcher(part.strip());
			if (!alias.matches()) {
				this.log.warn("[ASSEMBLE] Ignoring malformed import target: " + part.strip());
				continue;
			}
			final String module = alias.group(1);
			final String asName = alias.group(2);
			final String line = asName == null ? "import " + module : "import " + module + " as " + asName;
			this.plainImports.get(categorize(module)).add(line);
			this.boundNames.add(asName == null ? module.split("\\.")[0] : asName);
		}
	}

	/**
	 * Registers a {@code from ... import ...} statement, merging its names with earlier ones of the same module.
	 *
	 * @param statement statement source
	 */
	void addFromImport(@Nonnull String statement) {
		final Matcher matcher = FROM_IMPORT_STATEMENT.matcher(normalize(statement));
		if (!matcher.matches()) {
			this.log.warn("[ASSEMBLE] Ignoring malformed import: " + statement);
			return;
		}
		final String module = matcher.group(1);
		final Set<String> names = this.fromImports.get(categorize(module))
			.computeIfAbsent(module, key -> new TreeSet<>());
		for (final String part : matcher.group(2).split(",")) {
			final String name = part.strip();
			if (name.isEmpty()) {
				continue;
			}
			names.add(name);
			final Matcher alias = ALIAS.matcher(name);
			if (alias.matches()) {
				this.boundNames.add(alias.group(2) == null ? alias.group(1) : alias.group(2));
			}
		}
	}

	/**
	 * Scans the combined code for calls of well-known standard library names and imports the ones
	 * that are neither imported from their module nor bound by another import. This is a textual
	 * heuristic: calls inside strings or comments count, attribute calls such as {@code obj.search(...)}
	 * count as well.
	 *
	 * @param combinedCode source of all assembled fragments
	 */
	void addCommonImports(@Nonnull String combinedCode) {
		for (final Map.Entry<String, List<String>> entry : COMMON_IMPORTS.entrySet()) {
			final String module = entry.getKey();
			for (final String name : entry.getValue()) {
				final Pattern usage = Pattern.compile("\\b" + name + "\\s*\\(");
				if (usage.matcher(combinedCode).find() && !isImported(module, name)) {
					this.fromImports.get(ImportGroup.STANDARD)
						.computeIfAbsent(module, key -> new TreeSet<>())
						.add(name);
					this.boundNames.add(name);
					this.log.debug("[ASSEMBLE] Auto-adding import: from " + module + " import " + name);
				}
			}
		}
	}

	/**
	 * Renders the import section: groups in standard, third party, local order separated by one
	 * blank line, plain imports before {@code from} imports inside a group and {@code __future__}
	 * imports first of all.
	 *
	 * @return the import section or an empty string when nothing was imported
	 */
	@Nonnull
	String render() {
		final List<String> lines = new ArrayList<>();
		for (final ImportGroup group : ImportGroup.values()) {
			final List<String> groupLines = new ArrayList<>();
			final Map<String, Set<String>> modules = this.fromImports.get(group);
			if (group == ImportGroup.STANDARD && modules.containsKey(FUTURE_MODULE)) {
				groupLines.add(renderFrom(FUTURE_MODULE, modules.get(FUTURE_MODULE)));
			}
			groupLines.addAll(this.plainImports.get(group));
			for (final Map.Entry<String, Set<String>> entry : modules.entrySet()) {
				if (!FUTURE_MODULE.equals(entry.getKey())) {
					groupLines.add(renderFrom(entry.getKey(), entry.getValue()));
				}
			}
			if (!groupLines.isEmpty()) {
				if (!lines.isEmpty()) {
					lines.add("");
				}
				lines.addAll(groupLines);
			}
		}
		return String.join("\n", lines);
	}

	/**
	 * Returns true if nothing was imported.
	 *
	 * @return true for an empty import section
	 */
	boolean isEmpty() {
		return this.plainImports.values().stream().allMatch(Set::isEmpty)
			&& this.fromImports.values().stream().allMatch(Map::isEmpty);
	}

	private boolean isImported(@Nonnull String module, @Nonnull String name) {
		for (final Set<String> lines : this.plainImports.values()) {
			if (lines.contains("import " + module)) {
				return true;
			}
		}
		for (final Map<String, Set<String>> modules : this.fromImports.values()) {
			final Set<String> names = modules.get(module);
			if (names != null && names.contains(name)) {
				return true;
			}
		}
		return this.boundNames.contains(name);
	}

	@Nonnull
	private static String renderFrom(@Nonnull String module, @Nonnull Set<String> names) {
		return "from " + module + " import " + String.join(", ", names);
	}

	/**
	 * Drops comments, line continuations and parentheses so the statement fits on one line.
	 */
	@Nonnull
	private static String normalize(@Nonnull String statement) {
		final StringBuilder result = new StringBuilder();
		for (final String line : statement.split("\n")) {
			final int comment = line.indexOf('#');
			String code = comment >= 0 ? line.substring(0, comment) : line;
			code = code.strip();
			if (code.endsWith("\\")) {
				code = code.substring(0, code.length() - 1);
			}
			result.append(code).append(' ');
		}
		return result.toString()
			.replace("(", " ")
			.replace(")", " ")
			.replaceAll("\\s+", " ")
			.strip()
			.replaceAll("\\s*,\\s*$", "");
	}

	@Nonnull
	private static Map<String, List<String>> createCommonImports() {
		final Map<String, List<String>> imports = new LinkedHashMap<>();
		imports.put("math", List.of("sin", "cos", "sqrt", "pi", "tan", "log", "exp"));
		imports.put("os", List.of("path", "getcwd", "listdir", "mkdir", "remove"));
		imports.put("sys", List.of("argv", "exit", "path", "platform"));
		imports.put("datetime", List.of("datetime", "date", "time", "timedelta"));
		imports.put("json", List.of("dumps", "loads", "dump", "load"));
		imports.put("re", List.of("match", "search", "findall", "sub", "compile"));
		imports.put("typing", List.of("List", "Dict", "Tuple", "Optional", "Union", "Any"));
		return Collections.unmodifiableMap(imports);
	}
}
