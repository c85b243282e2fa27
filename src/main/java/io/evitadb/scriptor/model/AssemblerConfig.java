package io.evitadb.scriptor.model;

/**
 * Formatting preferences of the code assembler.
 *
 * @param indentSize         number of spaces per indentation level
 * @param maxLineLength      line length above which a diagnostic is logged
 * @param preserveComments   whether full-line comments are kept
 * @param preserveDocstrings whether the module docstring is kept
 * @param autoImportCommon   whether well-known standard library names are imported automatically
 */
public record AssemblerConfig(
	int indentSize,
	int maxLineLength,
	boolean preserveComments,
	boolean preserveDocstrings,
	boolean autoImportCommon
) {

	public static final int DEFAULT_INDENT_SIZE = 4;
	public static final int DEFAULT_MAX_LINE_LENGTH = 88;

	public AssemblerConfig {
		if (indentSize < 1 || indentSize > 8) {
			throw new IllegalArgumentException("indentSize must be between 1 and 8");
		}
		if (maxLineLength < 1) {
			throw new IllegalArgumentException("maxLineLength must be positive");
		}
	}

	/**
	 * Returns the configuration with all defaults.
	 *
	 * @return default assembler configuration
	 */
	public static AssemblerConfig defaults() {
		return new AssemblerConfig(DEFAULT_INDENT_SIZE, DEFAULT_MAX_LINE_LENGTH, true, true, true);
	}

	/**
	 * Returns a copy with a different indentation width.
	 *
	 * @param indentSize the new indentation width
	 * @return modified configuration
	 */
	public AssemblerConfig withIndentSize(int indentSize) {
		return new AssemblerConfig(indentSize, this.maxLineLength, this.preserveComments, this.preserveDocstrings, this.autoImportCommon);
	}

	/**
	 * Returns a copy with common import injection switched on or off.
	 *
	 * @param autoImportCommon the new flag value
	 * @return modified configuration
	 */
	public AssemblerConfig withAutoImportCommon(boolean autoImportCommon) {
		return new AssemblerConfig(this.indentSize, this.maxLineLength, this.preserveComments, this.preserveDocstrings, autoImportCommon);
	}
}
