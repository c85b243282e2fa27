package io.evitadb.scriptor.model;

/**
 * Classification of a parsed block of source content.
 */
public enum BlockType {

	/**
	 * Natural-language pseudocode that still needs translation.
	 */
	NATURAL_LANGUAGE,

	/**
	 * Code already written in the target language.
	 */
	TARGET_CODE,

	/**
	 * Code interleaved with natural-language fragments.
	 */
	MIXED;

	/**
	 * Returns true if blocks of this type carry target-language code the assembler can merge.
	 *
	 * @return true for TARGET_CODE and MIXED
	 */
	public boolean isCode() {
		return this == TARGET_CODE || this == MIXED;
	}
}
