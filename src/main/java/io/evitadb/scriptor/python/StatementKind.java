package io.evitadb.scriptor.python;

/**
 * Classification of a top-level Python statement.
 */
public enum StatementKind {

	/**
	 * {@code def} or {@code async def}, including its decorators.
	 */
	FUNCTION,

	/**
	 * {@code class}, including its decorators.
	 */
	CLASS,

	/**
	 * Plain or annotated assignment, augmented assignment included.
	 */
	ASSIGNMENT,

	/**
	 * {@code import a, b as c}.
	 */
	IMPORT,

	/**
	 * {@code from module import names}.
	 */
	FROM_IMPORT,

	/**
	 * A statement consisting of a single string literal.
	 */
	DOCSTRING,

	/**
	 * Any other expression statement, typically a call.
	 */
	EXPRESSION,

	/**
	 * {@code if}, {@code for}, {@code while}, {@code try}, {@code with} or {@code match} with their clauses.
	 */
	COMPOUND,

	/**
	 * Simple statements such as {@code pass}, {@code assert} or {@code raise}.
	 */
	OTHER;

	/**
	 * Returns true for both import forms.
	 *
	 * @return true for IMPORT and FROM_IMPORT
	 */
	public boolean isImport() {
		return this == IMPORT || this == FROM_IMPORT;
	}
}
