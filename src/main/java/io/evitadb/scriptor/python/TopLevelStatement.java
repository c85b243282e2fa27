package io.evitadb.scriptor.python;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * A module-level statement with its whole source, i.e. the header line, the indented body,
 * the decorators and the comments directly preceding it.
 *
 * @param kind      statement classification
 * @param name      declared name for functions and classes, assignment target for assignments, null otherwise
 * @param text      the statement source, without trailing blank lines
 * @param firstLine 0-based index of the first physical line (decorators and leading comments included)
 * @param lastLine  0-based index of the last physical line (inclusive)
 */
public record TopLevelStatement(
	@Nonnull StatementKind kind,
	@Nullable String name,
	@Nonnull String text,
	int firstLine,
	int lastLine
) {

	public TopLevelStatement {
		Objects.requireNonNull(kind, "kind must not be null");
		Objects.requireNonNull(text, "text must not be null");
	}

	/**
	 * Returns true if the statement declares a named function or class.
	 *
	 * @return true for named definitions
	 */
	public boolean isNamedDefinition() {
		return (this.kind == StatementKind.FUNCTION || this.kind == StatementKind.CLASS) && this.name != null;
	}
}
