package io.evitadb.scriptor.python;

import javax.annotation.Nonnull;

/**
 * Raised by {@link PythonSourceScanner} when a source fragment cannot be split into well-formed
 * statements. The exception never leaves the components that use the scanner; callers convert it
 * into a warning or a verbatim fallback.
 */
public class PythonSyntaxException extends Exception {

	private static final long serialVersionUID = 3012482093318729641L;

	private final int lineNumber;

	/**
	 * Creates a new exception.
	 *
	 * @param message    description of the problem
	 * @param lineNumber 1-based line where the problem was detected
	 */
	public PythonSyntaxException(@Nonnull String message, int lineNumber) {
		super(message + " (line " + lineNumber + ")");
		this.lineNumber = lineNumber;
	}

	/**
	 * Returns the 1-based line where the problem was detected.
	 *
	 * @return line number
	 */
	public int getLineNumber() {
		return this.lineNumber;
	}
}
