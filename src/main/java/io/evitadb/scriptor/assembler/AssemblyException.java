package io.evitadb.scriptor.assembler;

import io.evitadb.scriptor.model.CodeBlock;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;
import java.util.Objects;

/**
 * Exception thrown when code blocks cannot be assembled into a program.
 * Carries the failing stage, the blocks involved and hints on how to fix the input.
 * Assembly is all-or-nothing; no partial output accompanies this exception.
 */
public final class AssemblyException extends Exception {

	private static final long serialVersionUID = -2465117019930417153L;

	/**
	 * Assembly stages in execution order.
	 */
	public enum Stage {
		FILTER("filter"),
		SECTIONS("sections"),
		IMPORTS("imports"),
		MERGE("merge"),
		GLOBALS("globals"),
		MAIN("main"),
		STITCHING("stitching"),
		POSTPROCESS("postprocess"),
		VALIDATION("validation");

		private final String label;

		Stage(@Nonnull String label) {
			this.label = label;
		}

		@Nonnull
		public String getLabel() {
			return this.label;
		}
	}

	@Nonnull
	private final Stage stage;
	@Nonnull
	private final List<String> blocks;
	@Nonnull
	private final List<String> suggestions;

	/**
	 * Creates a new AssemblyException.
	 *
	 * @param message     the error message describing the failure
	 * @param stage       the stage that failed
	 * @param blocks      the blocks implicated in the failure
	 * @param suggestions remediation hints
	 * @param cause       the underlying failure, may be null
	 */
	public AssemblyException(
		@Nonnull String message,
		@Nonnull Stage stage,
		@Nonnull List<CodeBlock> blocks,
		@Nonnull List<String> suggestions,
		@Nullable Throwable cause
	) {
		super(formatMessage(message, stage, cause), cause);
		this.stage = Objects.requireNonNull(stage, "stage must not be null");
		this.blocks = blocks.stream().map(CodeBlock::describe).toList();
		this.suggestions = List.copyOf(suggestions);
	}

	@Nonnull
	private static String formatMessage(@Nonnull String message, @Nonnull Stage stage, @Nullable Throwable cause) {
		final StringBuilder sb = new StringBuilder(message);
		sb.append(" (stage: ").append(stage.getLabel()).append(")");
		if (cause != null && cause.getMessage() != null) {
			sb.append(": ").append(cause.getMessage());
		}
		return sb.toString();
	}

	/**
	 * Returns the stage that failed.
	 *
	 * @return the failed stage
	 */
	@Nonnull
	public Stage getStage() {
		return this.stage;
	}

	/**
	 * Returns the implicated blocks as type and original line span, e.g. {@code TARGET_CODE[3-7]}.
	 *
	 * @return block descriptions
	 */
	@Nonnull
	public List<String> getBlocks() {
		return this.blocks;
	}

	/**
	 * Returns remediation hints.
	 *
	 * @return suggestions
	 */
	@Nonnull
	public List<String> getSuggestions() {
		return this.suggestions;
	}

	/**
	 * Returns the message followed by the implicated blocks and the suggestions, one per line.
	 *
	 * @return multi-line report
	 */
	@Nonnull
	public String toReport() {
		final StringBuilder sb = new StringBuilder(getMessage());
		if (!this.blocks.isEmpty()) {
			sb.append("\nBlocks: ").append(String.join(", ", this.blocks));
		}
		for (final String suggestion : this.suggestions) {
			sb.append("\n - ").append(suggestion);
		}
		return sb.toString();
	}
}
