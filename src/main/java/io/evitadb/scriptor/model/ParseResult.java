package io.evitadb.scriptor.model;

import javax.annotation.Nonnull;
import java.util.List;

/**
 * Outcome of parsing one chunk into blocks.
 *
 * @param blocks   the parsed blocks in source order
 * @param warnings non-fatal parser remarks
 * @param errors   fatal parser problems; a non-empty list means the parse failed
 */
public record ParseResult(
	@Nonnull List<CodeBlock> blocks,
	@Nonnull List<String> warnings,
	@Nonnull List<String> errors
) {

	public ParseResult {
		blocks = List.copyOf(blocks);
		warnings = List.copyOf(warnings);
		errors = List.copyOf(errors);
	}

	/**
	 * Creates a successful parse result.
	 *
	 * @param blocks   the parsed blocks
	 * @param warnings parser warnings
	 * @return successful result
	 */
	@Nonnull
	public static ParseResult success(@Nonnull List<CodeBlock> blocks, @Nonnull List<String> warnings) {
		return new ParseResult(blocks, warnings, List.of());
	}

	/**
	 * Creates a failed parse result.
	 *
	 * @param errors the parse errors
	 * @return failed result
	 */
	@Nonnull
	public static ParseResult failure(@Nonnull List<String> errors) {
		return new ParseResult(List.of(), List.of(), errors);
	}

	/**
	 * Returns true if the parse produced no errors.
	 *
	 * @return true on success
	 */
	public boolean success() {
		return this.errors.isEmpty();
	}
}
