package io.evitadb.scriptor.parser;

import io.evitadb.scriptor.model.ParseResult;

import javax.annotation.Nonnull;

/**
 * Splits mixed pseudocode and code text into typed blocks.
 * Line numbers of the returned blocks are 1-based and relative to the parsed text.
 */
public interface BlockParser {

	/**
	 * Parses the text into blocks. Problems are reported in the result, never thrown.
	 *
	 * @param text text to parse
	 * @return parse result
	 */
	@Nonnull
	ParseResult parse(@Nonnull String text);
}
