package io.evitadb.scriptor.model;

import javax.annotation.Nonnull;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Context handed to the translator together with one natural-language block.
 *
 * @param translationId identifier of the whole streaming run
 * @param chunkIndex    index of the chunk the block belongs to
 * @param before        trailing window of previously translated code, bounded by the context window size
 */
public record TranslationContext(
	@Nonnull String translationId,
	int chunkIndex,
	@Nonnull String before
) {

	public static final String TRANSLATION_ID = "translation_id";
	public static final String CHUNK_INDEX = "chunk_index";
	public static final String BEFORE = "before";
	public static final String CODE = "code";

	public TranslationContext {
		Objects.requireNonNull(translationId, "translationId must not be null");
		Objects.requireNonNull(before, "before must not be null");
	}

	/**
	 * Returns the context as a string map; {@code code} mirrors {@code before}.
	 *
	 * @return ordered key/value view used for prompt placeholders
	 */
	@Nonnull
	public Map<String, String> asMap() {
		final Map<String, String> map = new LinkedHashMap<>();
		map.put(TRANSLATION_ID, this.translationId);
		map.put(CHUNK_INDEX, String.valueOf(this.chunkIndex));
		map.put(BEFORE, this.before);
		map.put(CODE, this.before);
		return map;
	}
}
