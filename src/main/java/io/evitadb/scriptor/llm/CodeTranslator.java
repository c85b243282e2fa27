package io.evitadb.scriptor.llm;

import io.evitadb.scriptor.Shutdownable;
import io.evitadb.scriptor.model.TranslationContext;
import io.evitadb.scriptor.model.TranslationOutcome;

import javax.annotation.Nonnull;

/**
 * Translates a natural-language block into code of the target language.
 * Implementations report translation failures in the outcome and do not throw for them.
 */
public interface CodeTranslator extends Shutdownable {

	/**
	 * Translates the text.
	 *
	 * @param text           natural-language text of one block
	 * @param targetLanguage name of the target language
	 * @param context        translation id, chunk index and preceding code
	 * @return translation outcome
	 */
	@Nonnull
	TranslationOutcome translate(@Nonnull String text, @Nonnull String targetLanguage, @Nonnull TranslationContext context);

	@Override
	default void shutdown() {
		// nothing to release by default
	}
}
