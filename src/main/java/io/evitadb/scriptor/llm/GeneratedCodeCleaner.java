package io.evitadb.scriptor.llm;

import io.evitadb.scriptor.python.PythonSourceScanner;
import io.evitadb.scriptor.python.PythonSyntaxException;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Cleans code returned by a language model and reports suspicious results.
 */
public final class GeneratedCodeCleaner {

	static final int TAB_SIZE = 4;

	private GeneratedCodeCleaner() {
		// Utility class - prevent instantiation
	}

	/**
	 * Removes a surrounding Markdown fence and outer blank space. Python code also gets its tabs expanded.
	 *
	 * @param rawCode        answer of the model
	 * @param targetLanguage target language name
	 * @return cleaned code
	 */
	@Nonnull
	public static String clean(@Nonnull String rawCode, @Nonnull String targetLanguage) {
		Objects.requireNonNull(rawCode, "rawCode must not be null");
		Objects.requireNonNull(targetLanguage, "targetLanguage must not be null");

		String code = rawCode.replace("\r\n", "\n").strip();
		if (code.startsWith("```")) {
			final List<String> lines = new ArrayList<>(List.of(code.split("\n", -1)));
			lines.remove(0);
			if (!lines.isEmpty() && lines.get(lines.size() - 1).strip().equals("```")) {
				lines.remove(lines.size() - 1);
			}
			code = String.join("\n", lines).strip();
		}
		if (isPython(targetLanguage)) {
			code = expandTabs(code);
		}
		return code;
	}

	/**
	 * Returns warnings about the generated code. Empty code yields a single warning.
	 *
	 * @param code           cleaned code
	 * @param targetLanguage target language name
	 * @return warnings, possibly empty
	 */
	@Nonnull
	public static List<String> validate(@Nonnull String code, @Nonnull String targetLanguage) {
		final List<String> warnings = new ArrayList<>();
		if (code.isBlank()) {
			warnings.add("Generated code is empty");
			return warnings;
		}
		if (isPython(targetLanguage)) {
			try {
				PythonSourceScanner.validate(code);
			} catch (PythonSyntaxException e) {
				warnings.add("Python syntax error: " + e.getMessage());
			}
		}
		if (code.lines().count() < 2) {
			warnings.add("Generated code seems too short");
		}
		if (code.contains("TODO") || code.contains("FIXME")) {
			warnings.add("Generated code contains TODO/FIXME comments");
		}
		return warnings;
	}

	/**
	 * Expands tabs to the next multiple of {@value #TAB_SIZE} columns on every line.
	 */
	@Nonnull
	static String expandTabs(@Nonnull String code) {
		if (code.indexOf('\t') < 0) {
			return code;
		}
		final StringBuilder result = new StringBuilder(code.length() + 16);
		int column = 0;
		for (int i = 0; i < code.length(); i++) {
			final char c = code.charAt(i);
			if (c == '\t') {
				final int spaces = TAB_SIZE - column % TAB_SIZE;
				result.append(" ".repeat(spaces));
				column += spaces;
			} else {
				result.append(c);
				column = c == '\n' ? 0 : column + 1;
			}
		}
		return result.toString();
	}

	private static boolean isPython(@Nonnull String targetLanguage) {
		final String normalized = targetLanguage.trim().toLowerCase(Locale.ROOT);
		return normalized.equals("python") || normalized.equals("py");
	}
}
