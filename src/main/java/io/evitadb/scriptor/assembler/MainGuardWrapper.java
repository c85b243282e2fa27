package io.evitadb.scriptor.assembler;

import io.evitadb.scriptor.python.PythonSourceScanner;

import javax.annotation.Nonnull;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Decides whether the main section of an assembled program is wrapped in an
 * {@code if __name__ == "__main__":} guard and performs the wrapping.
 *
 * Detection is textual. A call-like fragment inside a string or a comment also triggers wrapping,
 * and a guard mentioned in a comment suppresses it.
 */
final class MainGuardWrapper {

	static final String GUARD_HEADER = "if __name__ == \"__main__\":";

	private static final String DOUBLE_QUOTED_GUARD = "if __name__ == \"__main__\"";
	private static final String SINGLE_QUOTED_GUARD = "if __name__ == '__main__'";
	private static final Pattern ENTRYPOINT_CALL = Pattern.compile("\\b(main|run|execute|start)\\s*\\(");
	private static final Pattern EXIT_CALL = Pattern.compile("\\b(sys\\.exit|quit|exit)\\s*\\(");
	private static final Pattern BARE_CALL = Pattern.compile("^\\s*[a-zA-Z_][a-zA-Z0-9_]*\\s*\\(", Pattern.MULTILINE);

	private final int indentSize;

	MainGuardWrapper(int indentSize) {
		this.indentSize = indentSize;
	}

	/**
	 * Returns true if the code already contains a main guard in either quoting style.
	 *
	 * @param code source to inspect
	 * @return true if a guard is present
	 */
	static boolean hasMainGuard(@Nonnull String code) {
		return code.contains(DOUBLE_QUOTED_GUARD) || code.contains(SINGLE_QUOTED_GUARD);
	}

	/**
	 * Returns true if the main section performs calls that should only run on direct invocation:
	 * {@code print}/{@code input}, common entry point names, exit calls or any bare call at line start.
	 *
	 * @param mainCode the main section
	 * @return true if wrapping is needed
	 */
	static boolean needsMainGuard(@Nonnull String mainCode) {
		return mainCode.contains("print(")
			|| mainCode.contains("input(")
			|| ENTRYPOINT_CALL.matcher(mainCode).find()
			|| EXIT_CALL.matcher(mainCode).find()
			|| BARE_CALL.matcher(mainCode).find();
	}

	/**
	 * Wraps the main section when needed.
	 *
	 * @param mainCode     the main section
	 * @param combinedCode source of all assembled fragments, searched for an existing guard
	 * @return the main section, wrapped or unchanged
	 */
	@Nonnull
	String wrap(@Nonnull String mainCode, @Nonnull String combinedCode) {
		if (mainCode.isEmpty() || hasMainGuard(combinedCode) || !needsMainGuard(mainCode)) {
			return mainCode;
		}
		return GUARD_HEADER + "\n" + indent(mainCode);
	}

	/**
	 * Indents every non-blank line by one level, leaving lines that continue a string literal untouched.
	 */
	@Nonnull
	private String indent(@Nonnull String code) {
		final String padding = " ".repeat(this.indentSize);
		final String[] lines = PythonSourceScanner.splitLines(code);
		final Set<Integer> insideStrings = PythonSourceScanner.stringContinuationLines(code);
		final StringBuilder result = new StringBuilder();
		for (int i = 0; i < lines.length; i++) {
			if (i > 0) {
				result.append('\n');
			}
			final String line = lines[i];
			if (line.isBlank() || insideStrings.contains(i)) {
				result.append(line);
			} else {
				result.append(padding).append(line);
			}
		}
		return result.toString();
	}
}
