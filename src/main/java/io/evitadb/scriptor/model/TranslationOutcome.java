package io.evitadb.scriptor.model;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;

/**
 * Result returned by a {@link io.evitadb.scriptor.llm.CodeTranslator}.
 * Translation failures are reported through this record rather than thrown.
 *
 * @param success  whether code was produced
 * @param code     the generated code (null if failed)
 * @param errors   error messages of a failed translation
 * @param warnings remarks about the generated code
 */
public record TranslationOutcome(
	boolean success,
	@Nullable String code,
	@Nonnull List<String> errors,
	@Nonnull List<String> warnings
) {

	public TranslationOutcome {
		errors = List.copyOf(errors);
		warnings = List.copyOf(warnings);
	}

	/**
	 * Creates a successful outcome.
	 *
	 * @param code     the generated code
	 * @param warnings remarks about the code
	 * @return successful outcome
	 */
	@Nonnull
	public static TranslationOutcome success(@Nonnull String code, @Nonnull List<String> warnings) {
		return new TranslationOutcome(true, code, List.of(), warnings);
	}

	/**
	 * Creates a failed outcome.
	 *
	 * @param errorMessage the reason of the failure
	 * @return failed outcome
	 */
	@Nonnull
	public static TranslationOutcome failure(@Nonnull String errorMessage) {
		return new TranslationOutcome(false, null, List.of(errorMessage), List.of());
	}

	/**
	 * Returns true if the outcome carries usable code.
	 *
	 * @return true if successful and the code is not blank
	 */
	public boolean hasCode() {
		return this.success && this.code != null && !this.code.isBlank();
	}
}
