package io.evitadb.scriptor.model;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable typed unit of source content produced by a {@link io.evitadb.scriptor.parser.BlockParser}.
 * Translation never mutates a block; it produces a new one via {@link #withTranslatedCode(String)}.
 *
 * @param type      the block classification
 * @param content   the block text
 * @param firstLine 1-based line of the first block line in the original input
 * @param lastLine  1-based line of the last block line in the original input (inclusive)
 * @param metadata  opaque key/value pairs attached by the parser or the pipeline
 * @param context   optional hint carried forward to the translator
 */
public record CodeBlock(
	@Nonnull BlockType type,
	@Nonnull String content,
	int firstLine,
	int lastLine,
	@Nonnull Map<String, String> metadata,
	@Nullable String context
) {

	/**
	 * Metadata key marking blocks that were produced by the translator.
	 */
	public static final String TRANSLATED_KEY = "translated";

	public CodeBlock {
		Objects.requireNonNull(type, "type must not be null");
		Objects.requireNonNull(content, "content must not be null");
		Objects.requireNonNull(metadata, "metadata must not be null");
		if (firstLine < 0) {
			throw new IllegalArgumentException("firstLine must be non-negative");
		}
		if (lastLine < firstLine) {
			throw new IllegalArgumentException("lastLine must be >= firstLine");
		}
		metadata = Map.copyOf(metadata);
	}

	/**
	 * Creates a block without metadata or context.
	 *
	 * @param type      the block classification
	 * @param content   the block text
	 * @param firstLine first original line (1-based)
	 * @param lastLine  last original line (1-based, inclusive)
	 * @return new block
	 */
	@Nonnull
	public static CodeBlock of(@Nonnull BlockType type, @Nonnull String content, int firstLine, int lastLine) {
		return new CodeBlock(type, content, firstLine, lastLine, Map.of(), null);
	}

	/**
	 * Creates a target-code block spanning as many lines as the content has, starting at line 1.
	 *
	 * @param content the code text
	 * @return new TARGET_CODE block
	 */
	@Nonnull
	public static CodeBlock code(@Nonnull String content) {
		return of(BlockType.TARGET_CODE, content, 1, Math.max(1, content.split("\n", -1).length));
	}

	/**
	 * Creates a natural-language block spanning as many lines as the content has, starting at line 1.
	 *
	 * @param content the pseudocode text
	 * @return new NATURAL_LANGUAGE block
	 */
	@Nonnull
	public static CodeBlock naturalLanguage(@Nonnull String content) {
		return of(BlockType.NATURAL_LANGUAGE, content, 1, Math.max(1, content.split("\n", -1).length));
	}

	/**
	 * Returns a TARGET_CODE copy of this block holding the translated code.
	 * Line numbers and context are preserved, metadata gains the translated flag.
	 *
	 * @param code the translated code
	 * @return new block
	 */
	@Nonnull
	public CodeBlock withTranslatedCode(@Nonnull String code) {
		Objects.requireNonNull(code, "code must not be null");
		final Map<String, String> newMetadata = new LinkedHashMap<>(this.metadata);
		newMetadata.put(TRANSLATED_KEY, "true");
		return new CodeBlock(BlockType.TARGET_CODE, code, this.firstLine, this.lastLine, newMetadata, this.context);
	}

	/**
	 * Returns a copy of this block with line numbers shifted by the given offset.
	 *
	 * @param offset number of lines to add
	 * @return shifted block
	 */
	@Nonnull
	public CodeBlock shiftLines(int offset) {
		if (offset == 0) {
			return this;
		}
		return new CodeBlock(
			this.type, this.content, this.firstLine + offset, this.lastLine + offset, this.metadata, this.context
		);
	}

	/**
	 * Returns a copy of this block keeping only the content lines from the given original line onwards.
	 * Used to drop lines that belong to injected context.
	 *
	 * @param fromLine first original line (1-based) to keep
	 * @return trimmed block
	 */
	@Nonnull
	public CodeBlock keepFromLine(int fromLine) {
		if (fromLine <= this.firstLine) {
			return this;
		}
		final String[] lines = this.content.split("\n", -1);
		final int skip = Math.min(fromLine - this.firstLine, lines.length);
		final String trimmed = String.join("\n", Arrays.copyOfRange(lines, skip, lines.length));
		return new CodeBlock(this.type, trimmed, fromLine, Math.max(fromLine, this.lastLine), this.metadata, this.context);
	}

	/**
	 * Returns true if this block was produced by the translator.
	 *
	 * @return true for translated blocks
	 */
	public boolean isTranslated() {
		return "true".equals(this.metadata.get(TRANSLATED_KEY));
	}

	/**
	 * Short description used in diagnostics: type and original line span.
	 *
	 * @return description such as {@code TARGET_CODE[3-7]}
	 */
	@Nonnull
	public String describe() {
		return this.type + "[" + this.firstLine + "-" + this.lastLine + "]";
	}
}
